package logsim.frontend;

import java.util.Optional;
import logsim.devices.Device;
import logsim.devices.DeviceRegistry;
import logsim.names.SymbolTable;
import logsim.network.PinRef;

/**
 * Converts between pins and the {@code DEVICE} / {@code DEVICE.PIN} notation of the definition language.
 */
public final class SignalNames {
  private SignalNames() {}

  /** Name of an output pin, e.g. {@code G1} or {@code FF1.QBAR}. */
  public static String outputName(SymbolTable names, DeviceRegistry devices, PinRef output) {
    String deviceName = names.nameOf(output.deviceId());
    return devices.getDevice(output.deviceId())
        .flatMap(device -> device.getKind().outputPinName(output.pin()))
        .map(pin -> deviceName + "." + pin)
        .orElse(deviceName);
  }

  /** Name of an input pin, e.g. {@code G1.I2} or {@code FF1.CLK}. */
  public static String inputName(SymbolTable names, DeviceRegistry devices, PinRef input) {
    Device device = devices.getDevice(input.deviceId()).orElseThrow();
    return names.nameOf(input.deviceId()) + "." + device.getKind().inputPinName(input.pin());
  }

  /**
   * Resolves an output signal name as typed by a user.
   * @return the output pin, or empty if the device does not exist or has no such output
   */
  public static Optional<PinRef> parseOutput(String signal, SymbolTable names, DeviceRegistry devices) {
    String[] parts = signal.trim().split("\\.", -1);
    if (parts.length > 2)
      return Optional.empty();
    Optional<Device> device = names.query(parts[0]).flatMap(devices::getDevice);
    if (device.isEmpty())
      return Optional.empty();
    if (parts.length == 1)
      return device.get().getOutputCount() == 1 ? Optional.of(new PinRef(device.get().getId(), 0)) : Optional.empty();
    return device.get().getKind().outputIndex(parts[1]).map(pin -> new PinRef(device.get().getId(), pin));
  }
}
