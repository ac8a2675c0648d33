package logsim.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import logsim.devices.Device;
import logsim.devices.DeviceRegistry;
import logsim.devices.Signal;
import logsim.frontend.SignalNames;
import logsim.names.SymbolTable;
import logsim.network.PinRef;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The output pins whose levels are recorded, with one trace entry per completed tick since the monitor was made.
 */
public class Monitors {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Monitored and unmonitored signal names, as listed to the user. */
  public record SignalNameLists(List<String> monitored, List<String> unmonitored) {}

  private final SymbolTable names;
  private final DeviceRegistry devices;
  // Insertion order is display order.
  private final LinkedHashMap<PinRef, ArrayList<Signal>> traces = new LinkedHashMap<>();

  public Monitors(SymbolTable names, DeviceRegistry devices) {
    this.names = names;
    this.devices = devices;
  }

  /**
   * Starts monitoring an output pin with an empty trace.
   * @return false if the pin is already monitored
   * @throws IllegalArgumentException if the device or output does not exist
   */
  public boolean makeMonitor(int deviceId, int outputPin) {
    Device device = devices.getDevice(deviceId).orElseThrow(() -> new IllegalArgumentException("No device with id " + deviceId));
    if (outputPin < 0 || outputPin >= device.getOutputCount())
      throw new IllegalArgumentException("Output pin " + outputPin + " out of range for " + device);
    PinRef pin = new PinRef(deviceId, outputPin);
    if (traces.containsKey(pin))
      return false;
    traces.put(pin, new ArrayList<>());
    logger.debug("Monitors. Monitoring {}", getSignalName(pin));
    return true;
  }

  /**
   * Stops monitoring an output pin and drops its trace.
   * @return false if the pin was not monitored
   */
  public boolean removeMonitor(int deviceId, int outputPin) { return traces.remove(new PinRef(deviceId, outputPin)) != null; }

  public boolean isMonitored(int deviceId, int outputPin) { return traces.containsKey(new PinRef(deviceId, outputPin)); }

  /** Monitored pins in the order they were added. */
  public Set<PinRef> getMonitoredPins() { return Collections.unmodifiableSet(traces.keySet()); }

  /** Appends the current level of every monitored pin to its trace. */
  public void sampleAll(int tick) {
    traces.forEach((pin, trace) -> trace.add(devices.getOutput(pin.deviceId(), pin.pin())));
    logger.trace("Monitors. Sampled {} signals at tick {}", traces.size(), tick);
  }

  /** The recorded levels of a pin, oldest first, or empty if the pin is not monitored. */
  public Optional<List<Signal>> getTrace(int deviceId, int outputPin) {
    return Optional.ofNullable(traces.get(new PinRef(deviceId, outputPin))).map(Collections::unmodifiableList);
  }

  /** Empties all traces; the set of monitored pins is kept. */
  public void resetTraces() { traces.values().forEach(ArrayList::clear); }

  public String getSignalName(PinRef output) { return SignalNames.outputName(names, devices, output); }

  /** Lists all output signals, split into monitored and unmonitored ones. */
  public SignalNameLists getSignalNames() {
    List<String> monitored = new ArrayList<>();
    List<String> unmonitored = new ArrayList<>();
    for (PinRef pin : traces.keySet())
      monitored.add(getSignalName(pin));
    for (Device device : devices.getDevices()) {
      for (int pin = 0; pin < device.getOutputCount(); pin++) {
        PinRef output = new PinRef(device.getId(), pin);
        if (!traces.containsKey(output))
          unmonitored.add(getSignalName(output));
      }
    }
    return new SignalNameLists(monitored, unmonitored);
  }

  /** Length of the longest monitored signal name, for aligning printed traces. 0 if nothing is monitored. */
  public int getMargin() { return traces.keySet().stream().mapToInt(pin -> getSignalName(pin).length()).max().orElse(0); }
}
