package logsim.ui;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import logsim.LogSim;
import logsim.devices.Signal;
import logsim.sim.OscillationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Line-oriented command shell over a loaded {@link LogSim}.
 *
 * <pre>
 * r N         reset, then run N ticks
 * c N         continue for N more ticks
 * s NAME 0|1  set a switch
 * m SIGNAL    monitor a signal
 * z SIGNAL    stop monitoring ("zap") a signal
 * l           list monitored and unmonitored signals
 * h           help
 * q           quit
 * </pre>
 */
public class UserInterface {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  static final String HELP = "User commands:\n"
                             + "r N       - run the simulation for N cycles\n"
                             + "c N       - continue the simulation for N cycles\n"
                             + "s X N     - set switch X to N (0 or 1)\n"
                             + "m X       - set a monitor on signal X\n"
                             + "z X       - zap the monitor on signal X\n"
                             + "l         - list signals\n"
                             + "h         - help (this command)\n"
                             + "q         - quit the program";

  private final LogSim sim;
  private final PrintStream out;

  public UserInterface(LogSim sim, PrintStream out) {
    this.sim = sim;
    this.out = out;
  }

  /** Reads and executes commands until 'q' or end of input. */
  public void commandLoop(Reader input) throws IOException {
    BufferedReader lines = new BufferedReader(input);
    out.println("Logic Simulator: interactive command line user interface.\nEnter 'h' for help.");
    String line;
    while (true) {
      out.print("#: ");
      out.flush();
      line = lines.readLine();
      if (line == null || !execute(line))
        break;
    }
  }

  /**
   * Executes one command line.
   * @return false if the command was 'q'
   */
  public boolean execute(String line) {
    String[] words = line.trim().split("\\s+");
    if (words.length == 0 || words[0].isEmpty())
      return true;
    logger.debug("UI. Command '{}'", line.trim());
    try {
      switch (words[0]) {
      case "h":
        out.println(HELP);
        break;
      case "q":
        return false;
      case "r":
        int cycles = cycles(words);
        sim.reset();
        runCycles(cycles, "Running");
        break;
      case "c":
        if (sim.getTick() == 0)
          out.println("Error! Nothing to continue. Run first.");
        else
          runCycles(cycles(words), "Continuing");
        break;
      case "s":
        requireArgs(words, 3);
        sim.setSwitch(words[1], Signal.fromBit(parseNumber(words[2])));
        out.println("Successfully set switch " + words[1] + ".");
        break;
      case "m":
        requireArgs(words, 2);
        out.println(sim.addMonitor(words[1]) ? "Successfully made monitor." : "Error! Monitor is already present.");
        break;
      case "z":
        requireArgs(words, 2);
        out.println(sim.removeMonitor(words[1]) ? "Successfully zapped monitor." : "Error! Could not zap monitor.");
        break;
      case "l":
        var names = sim.getMonitors().getSignalNames();
        out.println("Monitored: " + String.join(" ", names.monitored()));
        out.println("Not monitored: " + String.join(" ", names.unmonitored()));
        break;
      default:
        out.println("Invalid command. Enter 'h' for help.");
      }
    } catch (IllegalArgumentException | IllegalStateException e) {
      out.println("Error! " + e.getMessage());
    }
    return true;
  }

  private void runCycles(int cycles, String verb) {
    out.println(verb + " for " + cycles + " cycles");
    try {
      sim.step(cycles);
    } catch (OscillationException e) {
      out.println("Error! " + e.getMessage());
      out.println("Reset with 'r' after changing the circuit inputs.");
    }
    TraceFormatter.formatAll(sim.getMonitors()).forEach(out::println);
  }

  private static int cycles(String[] words) {
    requireArgs(words, 2);
    int cycles = parseNumber(words[1]);
    if (cycles <= 0)
      throw new IllegalArgumentException("Number of cycles must be positive.");
    return cycles;
  }

  private static void requireArgs(String[] words, int count) {
    if (words.length < count)
      throw new IllegalArgumentException("Missing argument. Enter 'h' for help.");
  }

  private static int parseNumber(String word) {
    try {
      return Integer.parseInt(word);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Expected a number, got '" + word + "'.");
    }
  }
}
