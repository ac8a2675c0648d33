package logsim.ui;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import logsim.frontend.Keywords;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options. Field names are the keys of the YAML config file.
 */
public class LogSimConfig {

  /** Settling iterations allowed per tick before the network counts as oscillating. */
  public int settle_iteration_limit = 100;
  /** Largest input count accepted for AND, OR, NAND and NOR. */
  public int max_gate_inputs = 16;
  /** Ticks run by the command line tool when no count is given. */
  public int default_cycles = 10;
  /** Alternative keyword spellings, alias to canonical keyword. */
  public Map<String, String> keyword_aliases = new LinkedHashMap<>();

  /**
   * Reads a config file. Keys that are absent keep their defaults.
   * @throws IOException if the file cannot be read
   */
  public static LogSimConfig load(Path path) throws IOException {
    try (InputStream in = new FileInputStream(path.toFile())) {
      return load(in);
    }
  }

  /**
   * Reads a config document.
   * @throws IllegalArgumentException if a keyword alias targets an unknown keyword or is not a valid name
   */
  public static LogSimConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(LogSimConfig.class, new LoaderOptions()));
    LogSimConfig cfg = yaml.load(in);
    // An empty document yields null.
    if (cfg == null)
      return new LogSimConfig();
    if (cfg.keyword_aliases != null)
      cfg.keyword_aliases.forEach(Keywords::checkAlias);
    return cfg;
  }
}
