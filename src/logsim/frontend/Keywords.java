package logsim.frontend;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import logsim.devices.DeviceKind;

/** Canonical keyword spellings of the definition language. */
public final class Keywords {
  public static final String DEVICES = "DEVICES";
  public static final String CONNECTIONS = "CONNECTIONS";
  public static final String MONITORS = "MONITORS";
  public static final String END = "END";

  /** Block headers in the order they must appear. */
  public static final List<String> BLOCKS = List.of(DEVICES, CONNECTIONS, MONITORS);

  public static final Set<String> ALL =
      Stream.concat(Stream.of(DEVICES, CONNECTIONS, MONITORS, END), Stream.of(DeviceKind.values()).map(kind -> kind.keyword))
          .collect(Collectors.toUnmodifiableSet());

  private Keywords() {}

  /**
   * Checks a configured alternative spelling.
   * @throws IllegalArgumentException if keyword is not a keyword or alias is not a valid name
   */
  public static void checkAlias(String alias, String keyword) {
    if (keyword == null || !ALL.contains(keyword))
      throw new IllegalArgumentException("Keyword alias '" + alias + "' targets unknown keyword '" + keyword + "'");
    if (alias == null || !alias.matches("[A-Za-z][A-Za-z0-9_]*"))
      throw new IllegalArgumentException("Keyword alias '" + alias + "' is not a valid name");
  }

  public static boolean isBlockHeader(Token token) { return token.kind() == TokenKind.KEYWORD && BLOCKS.contains(token.lexeme()); }
}
