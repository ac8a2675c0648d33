package logsim.names;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps identifier strings to unique integer ids and back.
 * <p>
 * One table belongs to one load session (see {@link logsim.frontend.LoadContext}); ids are handed out in order of first
 * lookup, starting at 0. Device ids in the registry are the ids of the device names in this table.
 */
public class SymbolTable {
  private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

  private final ArrayList<Symbol> symbols = new ArrayList<>();
  private final HashMap<String, Symbol> byName = new HashMap<>();

  /**
   * Returns the id of name, adding it to the table if it is new.
   * @param name a syntactically valid identifier
   * @throws IllegalArgumentException if name is not a valid identifier
   */
  public int lookup(String name) {
    Symbol existing = byName.get(name);
    if (existing != null)
      return existing.getId();
    if (name == null || !VALID_NAME.matcher(name).matches())
      throw new IllegalArgumentException("Not a valid name: '" + name + "'");
    Symbol symbol = new Symbol(name, symbols.size());
    symbols.add(symbol);
    byName.put(name, symbol);
    return symbol.getId();
  }

  /** Looks up a list of names in order, adding the new ones. */
  public List<Integer> lookup(List<String> names) {
    List<Integer> ids = new ArrayList<>(names.size());
    for (String name : names)
      ids.add(lookup(name));
    return ids;
  }

  /** Returns the id of name without adding it. */
  public Optional<Integer> query(String name) { return Optional.ofNullable(byName.get(name)).map(Symbol::getId); }

  /**
   * Returns the string for an id.
   * @throws IllegalArgumentException if id is negative
   */
  public Optional<String> getName(int id) {
    if (id < 0)
      throw new IllegalArgumentException("Negative symbol id " + id);
    if (id >= symbols.size())
      return Optional.empty();
    return Optional.of(symbols.get(id).getName());
  }

  /** Like {@link #getName(int)}, for ids known to be present. */
  public String nameOf(int id) {
    return getName(id).orElseThrow(() -> new IllegalArgumentException("Unknown symbol id " + id));
  }

  public Symbol getSymbol(int id) { return symbols.get(id); }

  public void setKind(int id, SymbolKind kind) { symbols.get(id).kind = kind; }

  public int size() { return symbols.size(); }
}
