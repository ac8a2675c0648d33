package logsim.sim;

/**
 * Raised when a simulation run cannot continue. Ticks completed before the failure stay valid.
 */
public class SimulationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int ticksCompleted;

  public SimulationException(String message, int ticksCompleted) {
    super(message);
    this.ticksCompleted = ticksCompleted;
  }

  /** Ticks completed by the failing {@code step} call before it stopped. */
  public int getTicksCompleted() { return ticksCompleted; }
}
