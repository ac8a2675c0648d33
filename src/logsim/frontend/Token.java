package logsim.frontend;

/**
 * A token with the 1-based position of its first character.
 * <p>
 * For {@link TokenKind#KEYWORD} tokens the lexeme is the canonical keyword, even if the source used a configured alias.
 */
public record Token(TokenKind kind, String lexeme, int line, int column) {

  public boolean is(TokenKind kind, String lexeme) { return this.kind == kind && this.lexeme.equals(lexeme); }

  public boolean isPunct(String punct) { return is(TokenKind.PUNCT, punct); }

  public boolean isKeyword(String keyword) { return is(TokenKind.KEYWORD, keyword); }

  @Override
  public String toString() {
    return kind + "('" + lexeme + "')@" + line + ":" + column;
  }
}
