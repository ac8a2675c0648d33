package logsim.frontend;

/**
 * Codes of all definition file errors. Messages are format strings over the diagnostic arguments.
 */
public enum DiagnosticCode {
  INVALID_CHARACTER(Category.LEXICAL, "invalid character '%s'"),
  UNTERMINATED_COMMENT(Category.LEXICAL, "block comment is never closed"),
  NUMBER_TOO_LARGE(Category.LEXICAL, "number %s is too large"),

  EXPECTED_BLOCK(Category.SYNTACTIC, "expected block header %s"),
  BLOCK_OUT_OF_ORDER(Category.SYNTACTIC, "block %s is repeated or out of order"),
  EXPECTED_COLON(Category.SYNTACTIC, "expected ':' after %s"),
  EXPECTED_NAME(Category.SYNTACTIC, "expected a device name, found %s"),
  KEYWORD_AS_NAME(Category.SYNTACTIC, "keyword '%s' cannot be used as a name"),
  EXPECTED_EQUALS(Category.SYNTACTIC, "expected '=' or ',', found %s"),
  EXPECTED_DEVICE_KIND(Category.SYNTACTIC, "expected a device kind, found %s"),
  EXPECTED_NUMBER(Category.SYNTACTIC, "expected a number after %s, found %s"),
  EXPECTED_ARROW(Category.SYNTACTIC, "expected '->', found %s"),
  EXPECTED_DOT(Category.SYNTACTIC, "expected '.' and an input pin, found %s"),
  EXPECTED_PIN(Category.SYNTACTIC, "expected a pin name, found %s"),
  EXPECTED_SEMICOLON(Category.SYNTACTIC, "expected ';', found %s"),
  UNEXPECTED_TOKEN(Category.SYNTACTIC, "unexpected '%s' after the end of the definition"),

  DUPLICATE_DEVICE(Category.SEMANTIC, "device %s is already defined"),
  UNDEFINED_DEVICE(Category.SEMANTIC, "device %s is not defined"),
  INVALID_PARAMETER(Category.SEMANTIC, "invalid parameter %s for %s"),
  UNKNOWN_PIN(Category.SEMANTIC, "%s has no %s pin %s"),
  PIN_OUT_OF_RANGE(Category.SEMANTIC, "pin %s is out of range, %s has %s inputs"),
  OUTPUT_PIN_REQUIRED(Category.SEMANTIC, "%s is a %s and needs an output pin"),
  MULTIPLE_DRIVERS(Category.SEMANTIC, "input %s is already driven by %s"),
  UNCONNECTED_INPUT(Category.SEMANTIC, "input %s is not connected"),
  DUPLICATE_MONITOR(Category.SEMANTIC, "signal %s is already monitored");

  public enum Category {
    LEXICAL,
    SYNTACTIC,
    SEMANTIC
  }

  public final Category category;
  public final String messageFormat;

  DiagnosticCode(Category category, String messageFormat) {
    this.category = category;
    this.messageFormat = messageFormat;
  }
}
