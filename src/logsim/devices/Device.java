package logsim.devices;

import java.util.Arrays;

/**
 * A device instance in the registry.
 * <p>
 * Outputs are double-buffered: the simulator evaluates into {@link #pending} from the values in {@link #outputs} and
 * swaps afterwards, so no device reads a value written in the same settling iteration. DTYPE memory is only committed
 * once a tick has settled.
 */
public class Device {
  private final int id;
  private final DeviceKind kind;
  private final int parameter;
  private final int inputCount;

  final Signal[] outputs;
  final Signal[] pending;

  // SWITCH: level applied at the next tick
  Signal switchLevel;
  // CLOCK: ticks since the last toggle
  int clockCounter;
  // DTYPE state
  Signal memory;
  Signal lastClock;
  Signal sampledData;

  Device(int id, DeviceKind kind, int parameter) {
    this.id = id;
    this.kind = kind;
    this.parameter = parameter;
    this.inputCount = kind.inputCount(parameter);
    this.outputs = new Signal[kind.outputCount()];
    this.pending = new Signal[kind.outputCount()];
    if (kind == DeviceKind.SWITCH)
      switchLevel = Signal.fromBit(parameter);
    powerUp();
  }

  /** Puts the device into its power-up state. A switch keeps its current level. */
  void powerUp() {
    switch (kind) {
    case SWITCH:
      outputs[0] = switchLevel;
      break;
    case CLOCK:
      clockCounter = 0;
      outputs[0] = Signal.LOW;
      break;
    case DTYPE:
      memory = Signal.LOW;
      lastClock = Signal.LOW;
      sampledData = Signal.LOW;
      outputs[DeviceKind.DTYPE_Q] = Signal.LOW;
      outputs[DeviceKind.DTYPE_QBAR] = Signal.HIGH;
      break;
    default:
      Arrays.fill(outputs, Signal.LOW);
    }
    System.arraycopy(outputs, 0, pending, 0, outputs.length);
  }

  public int getId() { return id; }
  public DeviceKind getKind() { return kind; }

  /** Gate input count, switch initial level or clock half-period, depending on the kind; 0 if unused. */
  public int getParameter() { return parameter; }

  public int getInputCount() { return inputCount; }
  public int getOutputCount() { return outputs.length; }

  public Signal getOutput(int pin) { return outputs[pin]; }

  /** A copy of all output levels. */
  public Signal[] getOutputs() { return outputs.clone(); }

  /** Writes the next output values into the pending buffer; outputs are unchanged until {@link #commitPending()}. */
  public void setPending(Signal[] values) {
    if (values.length != pending.length)
      throw new IllegalArgumentException("Expected " + pending.length + " output values, got " + values.length);
    System.arraycopy(values, 0, pending, 0, values.length);
  }

  /**
   * Makes the pending values current.
   * @return true if any output changed
   */
  public boolean commitPending() {
    boolean changed = !Arrays.equals(outputs, pending);
    System.arraycopy(pending, 0, outputs, 0, outputs.length);
    return changed;
  }

  /** Level a switch will drive from the next tick on. */
  public Signal getSwitchLevel() { return switchLevel; }

  /** The value latched by a DTYPE at the end of the last settled tick. */
  public Signal getMemory() { return memory; }

  @Override
  public String toString() {
    return kind + "#" + id + Arrays.toString(outputs);
  }
}
