package logsim.names;

/** What a name in the definition file turned out to denote. */
public enum SymbolKind {
  DEVICE,
  INPUT_PIN,
  OUTPUT_PIN,
  UNKNOWN
}
