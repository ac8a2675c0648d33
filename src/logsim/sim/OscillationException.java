package logsim.sim;

import java.util.List;

/**
 * A tick did not settle within the iteration limit: the network contains an unstable feedback loop.
 */
public class OscillationException extends SimulationException {
  private static final long serialVersionUID = 1L;

  private final int tick;
  private final List<Integer> suspects;
  private final List<String> suspectNames;

  /**
   * @param tick the tick that failed to settle (1-based)
   * @param ticksCompleted ticks completed by the step call before the failing one
   * @param suspects ids of the devices whose output still changed in the last settling iteration
   * @param suspectNames their names, in the same order
   */
  public OscillationException(int tick, int ticksCompleted, List<Integer> suspects, List<String> suspectNames) {
    super("Network oscillates at tick " + tick + "; unstable devices: " + String.join(", ", suspectNames), ticksCompleted);
    this.tick = tick;
    this.suspects = List.copyOf(suspects);
    this.suspectNames = List.copyOf(suspectNames);
  }

  public int getTick() { return tick; }

  public List<Integer> getSuspects() { return suspects; }

  public List<String> getSuspectNames() { return suspectNames; }
}
