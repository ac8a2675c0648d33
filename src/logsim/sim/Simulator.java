package logsim.sim;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import logsim.devices.Device;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceRegistry;
import logsim.devices.Signal;
import logsim.network.Network;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Executes a network tick by tick.
 * <p>
 * One tick:
 * <ol>
 * <li>every DTYPE samples its DATA input as committed by the previous tick,</li>
 * <li>switches take their set level and clocks advance,</li>
 * <li>all devices are re-evaluated until no output changes. Each iteration evaluates every device from the outputs of
 * the previous iteration and only then swaps in the new values, so the order in which devices are visited does not
 * matter. If that does not settle, the tick restarts from the same outputs and updates devices one at a time in
 * ascending id order, which resolves bistable loops such as a latch in its hold state,</li>
 * <li>DTYPE memories are committed and the monitors sample their pins.</li>
 * </ol>
 * A tick that settles in neither way within the iteration limit raises an {@link OscillationException}; nothing of
 * that tick is committed or recorded and the simulator stays in {@link State#OSCILLATING} until {@link #reset()}.
 * <p>
 * Single-threaded: callers drive it with blocking {@link #step(int)} calls from one thread.
 */
public class Simulator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_SETTLE_ITERATION_LIMIT = 100;

  public enum State {
    IDLE,
    STEPPING,
    STABLE,
    OSCILLATING
  }

  private final DeviceRegistry devices;
  private final Network network;
  private final Monitors monitors;
  private final int settleIterationLimit;
  private final IntFunction<String> deviceNames;

  private State state = State.IDLE;
  private int tick = 0;
  // Devices whose output changed in the last settling iteration.
  private List<Integer> lastChanged = List.of();

  public Simulator(Network network, Monitors monitors) {
    this(network, monitors, DEFAULT_SETTLE_ITERATION_LIMIT, id -> "#" + id);
  }

  /**
   * @param settleIterationLimit iterations allowed per tick; raised to the device count + 1 if lower, so that any
   *     network without feedback settles
   * @param deviceNames names devices in oscillation reports
   */
  public Simulator(Network network, Monitors monitors, int settleIterationLimit, IntFunction<String> deviceNames) {
    this.devices = network.getDevices();
    this.network = network;
    this.monitors = monitors;
    this.settleIterationLimit = settleIterationLimit;
    this.deviceNames = deviceNames;
  }

  public State getState() { return state; }

  /** Number of ticks completed since the last reset. */
  public int getTick() { return tick; }

  /** The iteration limit actually applied to each tick. */
  public int getEffectiveSettleLimit() { return Math.max(settleIterationLimit, devices.size() + 1); }

  /**
   * Runs n ticks.
   * @return the number of ticks completed, which is n
   * @throws OscillationException if a tick does not settle; earlier ticks remain recorded
   */
  public int step(int n) throws OscillationException { return step(n, () -> false); }

  /**
   * Runs up to n ticks, checking cancelled before each one.
   * @return the number of ticks completed
   * @throws OscillationException if a tick does not settle; earlier ticks remain recorded
   * @throws IllegalStateException if the simulator is oscillating and has not been reset
   */
  public int step(int n, BooleanSupplier cancelled) throws OscillationException {
    if (n < 0)
      throw new IllegalArgumentException("Cannot step a negative number of ticks: " + n);
    if (state == State.OSCILLATING)
      throw new IllegalStateException("Simulator is oscillating at tick " + (tick + 1) + "; reset before stepping again");
    int completed = 0;
    while (completed < n) {
      if (cancelled.getAsBoolean()) {
        logger.debug("Simulator. Cancelled after {} of {} ticks", completed, n);
        break;
      }
      executeTick(completed);
      completed++;
    }
    return completed;
  }

  private void executeTick(int completedInStep) throws OscillationException {
    state = State.STEPPING;
    devices.sampleFlipFlops(id -> network.getInputSignal(device(id), DeviceKind.DTYPE_DATA));
    devices.updateSources();

    int limit = getEffectiveSettleLimit();
    List<Signal[]> start = snapshot();
    Optional<Integer> iterations = settleSimultaneous(limit);
    if (iterations.isEmpty()) {
      // A bistable loop can alternate when all devices switch together.
      // Retry from the same start, one device at a time.
      logger.debug("Simulator. Tick {} did not settle with simultaneous updates, retrying in id order", tick + 1);
      restore(start);
      iterations = settleInPlace(limit);
    }
    if (iterations.isEmpty()) {
      state = State.OSCILLATING;
      List<String> names = lastChanged.stream().map(deviceNames::apply).collect(Collectors.toList());
      logger.warn("Simulator. Tick {} did not settle within {} iterations; unstable: {}", tick + 1, limit, names);
      throw new OscillationException(tick + 1, completedInStep, lastChanged, names);
    }

    devices.commitFlipFlops(id -> network.getInputSignal(device(id), DeviceKind.DTYPE_CLK));
    tick++;
    monitors.sampleAll(tick);
    state = State.STABLE;
    logger.trace("Simulator. Tick {} settled after {} iterations", tick, iterations.get());
  }

  /**
   * Evaluates every device from the previous iteration's outputs, then commits all of them.
   * @return the iteration count, or empty if the limit was reached
   */
  private Optional<Integer> settleSimultaneous(int limit) {
    for (int iteration = 1; iteration <= limit; iteration++) {
      for (Device device : devices.getDevices())
        device.setPending(devices.evaluate(device, network.getInputSignals(device)));
      lastChanged = new ArrayList<>();
      for (Device device : devices.getDevices())
        if (device.commitPending())
          lastChanged.add(device.getId());
      if (lastChanged.isEmpty())
        return Optional.of(iteration);
    }
    return Optional.empty();
  }

  /**
   * Evaluates and commits each device in ascending id order, so later devices see the new outputs of earlier ones.
   * @return the iteration count, or empty if the limit was reached
   */
  private Optional<Integer> settleInPlace(int limit) {
    for (int iteration = 1; iteration <= limit; iteration++) {
      lastChanged = new ArrayList<>();
      for (Device device : devices.getDevices()) {
        device.setPending(devices.evaluate(device, network.getInputSignals(device)));
        if (device.commitPending())
          lastChanged.add(device.getId());
      }
      if (lastChanged.isEmpty())
        return Optional.of(iteration);
    }
    return Optional.empty();
  }

  private List<Signal[]> snapshot() {
    List<Signal[]> outputs = new ArrayList<>(devices.size());
    for (Device device : devices.getDevices())
      outputs.add(device.getOutputs());
    return outputs;
  }

  private void restore(List<Signal[]> outputs) {
    int index = 0;
    for (Device device : devices.getDevices()) {
      device.setPending(outputs.get(index++));
      device.commitPending();
    }
  }

  private Device device(int id) { return devices.getDevice(id).orElseThrow(); }

  /** Returns all devices to their power-up state, clears the traces and sets the tick counter to zero. */
  public void reset() {
    devices.powerUp();
    monitors.resetTraces();
    tick = 0;
    state = State.IDLE;
    logger.debug("Simulator. Reset");
  }
}
