package logsim.frontend;

public enum TokenKind {
  KEYWORD,
  NAME,
  NUMBER,
  PUNCT,
  EOF,
  /** A character sequence that is not part of the language. Turned into a diagnostic by the parser. */
  ERROR
}
