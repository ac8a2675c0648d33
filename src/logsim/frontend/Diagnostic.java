package logsim.frontend;

import java.util.List;

/**
 * An error found while loading a definition file. Immutable.
 */
public class Diagnostic {
  /** Definition errors are never downgraded; there are no warnings. */
  public enum Severity {
    ERROR
  }

  private final Severity severity = Severity.ERROR;
  private final int line;
  private final int column;
  private final DiagnosticCode code;
  private final List<String> arguments;

  public Diagnostic(DiagnosticCode code, int line, int column, String... arguments) {
    this.code = code;
    this.line = line;
    this.column = column;
    this.arguments = List.of(arguments);
  }

  /** Creates a diagnostic located at a token. */
  public static Diagnostic at(Token token, DiagnosticCode code, String... arguments) {
    return new Diagnostic(code, token.line(), token.column(), arguments);
  }

  public Severity getSeverity() { return severity; }
  public int getLine() { return line; }
  public int getColumn() { return column; }
  public DiagnosticCode getCode() { return code; }
  public List<String> getArguments() { return arguments; }

  public String getMessage() { return String.format(code.messageFormat, arguments.toArray()); }

  /**
   * Formats the diagnostic with the offending source line and a caret under the column.
   * @param sourceLines the definition file split into lines
   */
  public String render(List<String> sourceLines) {
    StringBuilder out = new StringBuilder(toString());
    if (line >= 1 && line <= sourceLines.size()) {
      String text = sourceLines.get(line - 1);
      out.append('\n').append(text).append('\n');
      // Keep tabs so the caret lines up with the source as printed.
      for (int i = 0; i < column - 1 && i < text.length(); i++)
        out.append(text.charAt(i) == '\t' ? '\t' : ' ');
      out.append('^');
    }
    return out.toString();
  }

  @Override
  public String toString() {
    return severity + " " + code + " on line " + line + ", column " + column + ": " + getMessage();
  }
}
