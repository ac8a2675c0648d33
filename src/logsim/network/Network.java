package logsim.network;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import logsim.devices.Device;
import logsim.devices.DeviceRegistry;
import logsim.devices.Signal;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Connectivity between devices: maps each driven input pin to the output pin driving it.
 * <p>
 * Every input has at most one driver. Cycles are allowed; the simulator resolves them by iteration.
 */
public class Network {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final DeviceRegistry devices;
  // input -> output, in order of connection
  private final LinkedHashMap<PinRef, PinRef> drivers = new LinkedHashMap<>();

  public Network(DeviceRegistry devices) { this.devices = devices; }

  public DeviceRegistry getDevices() { return devices; }

  /** Returns the output pin driving an input pin, if any. */
  public Optional<PinRef> getDriver(int deviceId, int inputPin) { return Optional.ofNullable(drivers.get(new PinRef(deviceId, inputPin))); }

  /**
   * Connects an output pin to an input pin.
   * @throws IllegalArgumentException if a device does not exist or a pin index is out of range
   * @throws IllegalStateException if the input already has a driver
   */
  public void makeConnection(PinRef output, PinRef input) {
    Device source = devices.getDevice(output.deviceId())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown source device " + output.deviceId()));
    Device target = devices.getDevice(input.deviceId())
                        .orElseThrow(() -> new IllegalArgumentException("Unknown target device " + input.deviceId()));
    if (output.pin() < 0 || output.pin() >= source.getOutputCount())
      throw new IllegalArgumentException("Output pin " + output.pin() + " out of range for " + source);
    if (input.pin() < 0 || input.pin() >= target.getInputCount())
      throw new IllegalArgumentException("Input pin " + input.pin() + " out of range for " + target);
    PinRef existing = drivers.putIfAbsent(input, output);
    if (existing != null)
      throw new IllegalStateException("Input " + input + " is already driven by " + existing);
    logger.trace("Network. Connected {} -> {}", output, input);
  }

  /** All connections, input pin to driving output pin, in the order they were made. */
  public Map<PinRef, PinRef> getConnections() { return Collections.unmodifiableMap(drivers); }

  /** Required inputs without a driver, in device id then pin order. */
  public List<PinRef> getUnconnectedInputs() {
    List<PinRef> unconnected = new ArrayList<>();
    for (Device device : devices.getDevices()) {
      for (int pin = 0; pin < device.getInputCount(); pin++) {
        PinRef input = new PinRef(device.getId(), pin);
        if (!drivers.containsKey(input) && !device.getKind().isOptionalInput(pin))
          unconnected.add(input);
      }
    }
    return unconnected;
  }

  /** True if every required input is driven. */
  public boolean checkNetwork() { return getUnconnectedInputs().isEmpty(); }

  /**
   * Current level at an input pin: the driver's output, LOW for an unconnected optional input, UNDEFINED otherwise.
   */
  public Signal getInputSignal(Device device, int inputPin) {
    PinRef driver = drivers.get(new PinRef(device.getId(), inputPin));
    if (driver == null)
      return device.getKind().isOptionalInput(inputPin) ? Signal.LOW : Signal.UNDEFINED;
    return devices.getOutput(driver.deviceId(), driver.pin());
  }

  /** Levels at all inputs of a device. */
  public Signal[] getInputSignals(Device device) {
    Signal[] inputs = new Signal[device.getInputCount()];
    for (int pin = 0; pin < inputs.length; pin++)
      inputs[pin] = getInputSignal(device, pin);
    return inputs;
  }
}
