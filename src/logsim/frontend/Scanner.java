package logsim.frontend;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits definition file text into tokens on demand.
 * <p>
 * Whitespace, {@code # ...} line comments and {@code /* ... *}{@code /} block comments are skipped. Line and column
 * counters advance on every character, including those inside comments. The scanner never throws: characters outside
 * the language come back as {@link TokenKind#ERROR} tokens. Once the end of input is reached, every further call returns
 * an EOF token.
 */
public class Scanner {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final String source;
  private final LoadContext context;

  private int pos = 0;
  private int line = 1;
  private int column = 1;

  private Token pushedBack = null;

  public Scanner(String source, LoadContext context) {
    this.source = source;
    this.context = context;
  }

  /**
   * Returns a token to the scanner; the next {@link #nextToken()} call returns it again.
   * @throws IllegalStateException if a token is already pushed back
   */
  public void pushBack(Token token) {
    if (pushedBack != null)
      throw new IllegalStateException("Only one token of pushback is supported");
    pushedBack = token;
  }

  public Token nextToken() {
    if (pushedBack != null) {
      Token token = pushedBack;
      pushedBack = null;
      return token;
    }
    Token token = scan();
    logger.trace("Scanner. {}", token);
    return token;
  }

  private boolean atEnd() { return pos >= source.length(); }

  private char peek() { return source.charAt(pos); }

  private boolean peekIs(int offset, char c) { return pos + offset < source.length() && source.charAt(pos + offset) == c; }

  private void advance() {
    if (source.charAt(pos) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    pos++;
  }

  private Token scan() {
    while (true) {
      while (!atEnd() && isWhitespace(peek()))
        advance();
      if (atEnd())
        return new Token(TokenKind.EOF, "", line, column);

      int startLine = line;
      int startColumn = column;
      char c = peek();

      if (c == '#') {
        while (!atEnd() && peek() != '\n')
          advance();
        continue;
      }
      if (c == '/' && peekIs(1, '*')) {
        advance();
        advance();
        boolean closed = false;
        while (!atEnd()) {
          if (peek() == '*' && peekIs(1, '/')) {
            advance();
            advance();
            closed = true;
            break;
          }
          advance();
        }
        if (!closed)
          return new Token(TokenKind.ERROR, "/*", startLine, startColumn);
        continue;
      }

      if (isLetter(c)) {
        int start = pos;
        while (!atEnd() && (isLetter(peek()) || isDigit(peek()) || peek() == '_'))
          advance();
        String word = source.substring(start, pos);
        return context.resolveKeyword(word)
            .map(keyword -> new Token(TokenKind.KEYWORD, keyword, startLine, startColumn))
            .orElseGet(() -> new Token(TokenKind.NAME, word, startLine, startColumn));
      }
      if (isDigit(c)) {
        int start = pos;
        while (!atEnd() && isDigit(peek()))
          advance();
        return new Token(TokenKind.NUMBER, source.substring(start, pos), startLine, startColumn);
      }
      if (c == '-' && peekIs(1, '>')) {
        advance();
        advance();
        return new Token(TokenKind.PUNCT, "->", startLine, startColumn);
      }
      if ("=;:.,".indexOf(c) >= 0) {
        advance();
        return new Token(TokenKind.PUNCT, String.valueOf(c), startLine, startColumn);
      }

      // Keep surrogate pairs together so the diagnostic shows the whole character.
      int codePoint = source.codePointAt(pos);
      int length = Character.charCount(codePoint);
      for (int i = 0; i < length; i++)
        advance();
      return new Token(TokenKind.ERROR, new String(Character.toChars(codePoint)), startLine, startColumn);
    }
  }

  static boolean isWhitespace(char c) { return c == ' ' || c == '\t' || c == '\r' || c == '\n'; }

  static boolean isLetter(char c) { return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z'); }

  static boolean isDigit(char c) { return c >= '0' && c <= '9'; }
}
