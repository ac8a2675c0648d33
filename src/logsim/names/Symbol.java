package logsim.names;

/**
 * An interned name. Ids are dense and unique within one {@link SymbolTable}.
 */
public class Symbol {
  private final String name;
  private final int id;
  SymbolKind kind = SymbolKind.UNKNOWN;

  Symbol(String name, int id) {
    this.name = name;
    this.id = id;
  }

  public String getName() { return name; }
  public int getId() { return id; }
  public SymbolKind getKind() { return kind; }

  @Override
  public String toString() {
    return name + "#" + id + "(" + kind + ")";
  }
}
