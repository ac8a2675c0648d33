package logsim.frontend;

import java.util.HashMap;
import java.util.Optional;
import logsim.names.SymbolTable;
import logsim.ui.LogSimConfig;

/**
 * State shared by the scanner, parser and registry during one load. A new context is created per load, so names from
 * an earlier load never leak into a later one.
 */
public class LoadContext {
  private final SymbolTable names = new SymbolTable();
  private final HashMap<String, String> keywordSpellings = new HashMap<>();

  public LoadContext() { this(new LogSimConfig()); }

  /**
   * @throws IllegalArgumentException if a configured keyword alias targets an unknown keyword or is not a valid name
   */
  public LoadContext(LogSimConfig cfg) {
    for (String keyword : Keywords.ALL)
      keywordSpellings.put(keyword, keyword);
    if (cfg.keyword_aliases != null) {
      cfg.keyword_aliases.forEach((alias, keyword) -> {
        Keywords.checkAlias(alias, keyword);
        keywordSpellings.put(alias, keyword);
      });
    }
  }

  public SymbolTable getNames() { return names; }

  /** Returns the canonical keyword a word spells, if it is a keyword or alias. */
  public Optional<String> resolveKeyword(String word) { return Optional.ofNullable(keywordSpellings.get(word)); }
}
