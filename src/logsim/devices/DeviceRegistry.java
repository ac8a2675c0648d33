package logsim.devices;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.IntFunction;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns all devices of one session, indexed by their stable id (the id of the device name in the symbol table), and
 * holds the evaluation logic of every device kind.
 */
public class DeviceRegistry {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_MAX_GATE_INPUTS = 16;

  // Ordered by id so that iteration order, and with it logging and suspect lists, is reproducible.
  private final TreeMap<Integer, Device> devices = new TreeMap<>();
  private final int maxGateInputs;

  public DeviceRegistry() { this(DEFAULT_MAX_GATE_INPUTS); }
  public DeviceRegistry(int maxGateInputs) { this.maxGateInputs = maxGateInputs; }

  /**
   * Checks whether parameter is acceptable for the kind. Kinds that take no parameter accept only 0.
   */
  public boolean isValidParameter(DeviceKind kind, int parameter) {
    switch (kind.parameterUse) {
    case INPUT_COUNT:
      return parameter >= 1 && parameter <= maxGateInputs;
    case INITIAL_LEVEL:
      return parameter == 0 || parameter == 1;
    case HALF_PERIOD:
      return parameter >= 1;
    default:
      return parameter == 0;
    }
  }

  /**
   * Creates a device.
   * @throws IllegalArgumentException if the id is taken or the parameter is not valid for the kind
   */
  public Device makeDevice(int id, DeviceKind kind, int parameter) {
    if (devices.containsKey(id))
      throw new IllegalArgumentException("Device id " + id + " already present");
    if (!isValidParameter(kind, parameter))
      throw new IllegalArgumentException("Invalid parameter " + parameter + " for " + kind);
    Device device = new Device(id, kind, parameter);
    devices.put(id, device);
    logger.trace("Registry. Made device {}", device);
    return device;
  }

  public Optional<Device> getDevice(int id) { return Optional.ofNullable(devices.get(id)); }

  public boolean contains(int id) { return devices.containsKey(id); }

  public Collection<Device> getDevices() { return Collections.unmodifiableCollection(devices.values()); }

  public int size() { return devices.size(); }

  /** Returns the ids of all devices of a kind, in id order. */
  public List<Integer> findDevices(DeviceKind kind) {
    return devices.values().stream().filter(device -> device.getKind() == kind).map(Device::getId).collect(Collectors.toList());
  }

  private Device require(int id) {
    Device device = devices.get(id);
    if (device == null)
      throw new IllegalArgumentException("No device with id " + id);
    return device;
  }

  public Signal getOutput(int id, int pin) { return require(id).outputs[pin]; }

  public void setOutput(int id, int pin, Signal value) { require(id).outputs[pin] = value; }

  /**
   * Sets the level a switch drives. The new level reaches the network at the next tick.
   * @throws IllegalArgumentException if id is not a switch
   */
  public void setSwitch(int id, Signal level) {
    Device device = require(id);
    if (device.getKind() != DeviceKind.SWITCH)
      throw new IllegalArgumentException("Device " + id + " is not a switch");
    if (!level.isDefined())
      throw new IllegalArgumentException("A switch cannot be set to " + level);
    device.switchLevel = level;
  }

  /** Returns every device to its power-up state. Switch levels set by the caller are kept. */
  public void powerUp() { devices.values().forEach(Device::powerUp); }

  /**
   * Start of a tick, before any source changes: each DTYPE samples its data input from the committed values.
   * @param dataInputs the current DATA level per DTYPE id
   */
  public void sampleFlipFlops(IntFunction<Signal> dataInputs) {
    for (Device device : devices.values())
      if (device.getKind() == DeviceKind.DTYPE)
        device.sampledData = dataInputs.apply(device.getId());
  }

  /** Applies pending switch levels and advances every clock by one tick. */
  public void updateSources() {
    for (Device device : devices.values()) {
      if (device.getKind() == DeviceKind.SWITCH) {
        device.outputs[0] = device.switchLevel;
      } else if (device.getKind() == DeviceKind.CLOCK) {
        device.clockCounter++;
        if (device.clockCounter >= device.getParameter()) {
          device.clockCounter = 0;
          device.outputs[0] = device.outputs[0].invert();
        }
      }
    }
  }

  /**
   * Computes the new outputs of a device from its input levels and, for a DTYPE, its latched state. Does not modify the
   * device.
   * @param inputs one level per input pin, UNDEFINED for an unconnected required input
   */
  public Signal[] evaluate(Device device, Signal[] inputs) {
    // No default branch: a new kind must be handled here before this compiles.
    return switch (device.getKind()) {
      case AND -> single(gate(inputs, true, false));
      case OR -> single(gate(inputs, false, false));
      case NAND -> single(gate(inputs, true, true));
      case NOR -> single(gate(inputs, false, true));
      case XOR -> single(xor(inputs));
      case NOT -> single(inputs[0].invert());
      case LED -> single(inputs[0]);
      case DTYPE -> {
        Signal q = flipFlop(device, inputs);
        yield new Signal[] {q, q.invert()};
      }
      // Sources were updated at the start of the tick.
      case SWITCH, CLOCK -> single(device.outputs[0]);
    };
  }

  private static Signal[] single(Signal value) { return new Signal[] {value}; }

  /**
   * AND (isAnd) or OR over all inputs, optionally inverted. Any UNDEFINED input makes the result UNDEFINED.
   */
  private static Signal gate(Signal[] inputs, boolean isAnd, boolean inverted) {
    boolean result = isAnd;
    for (Signal input : inputs) {
      if (!input.isDefined())
        return Signal.UNDEFINED;
      if (isAnd)
        result &= input == Signal.HIGH;
      else
        result |= input == Signal.HIGH;
    }
    return Signal.of(result != inverted);
  }

  private static Signal xor(Signal[] inputs) {
    boolean result = false;
    for (Signal input : inputs) {
      if (!input.isDefined())
        return Signal.UNDEFINED;
      result ^= input == Signal.HIGH;
    }
    return Signal.of(result);
  }

  private static Signal flipFlop(Device device, Signal[] inputs) {
    Signal set = inputs[DeviceKind.DTYPE_SET];
    Signal clear = inputs[DeviceKind.DTYPE_CLEAR];
    Signal clock = inputs[DeviceKind.DTYPE_CLK];
    if (set == Signal.HIGH)
      return Signal.HIGH;
    if (clear == Signal.HIGH)
      return Signal.LOW;
    if (!set.isDefined() || !clear.isDefined())
      return Signal.UNDEFINED;
    if (clock == Signal.HIGH && device.lastClock != Signal.HIGH)
      return device.sampledData;
    return device.memory;
  }

  /**
   * End of a settled tick: copies each DTYPE's settled Q into its memory and remembers the clock level it saw.
   * @param clockInputs the settled CLK level per DTYPE id
   */
  public void commitFlipFlops(IntFunction<Signal> clockInputs) {
    for (Device device : devices.values()) {
      if (device.getKind() == DeviceKind.DTYPE) {
        device.memory = device.outputs[DeviceKind.DTYPE_Q];
        device.lastClock = clockInputs.apply(device.getId());
      }
    }
  }
}
