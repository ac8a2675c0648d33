package logsim.ui;

import java.util.ArrayList;
import java.util.List;
import logsim.devices.Signal;
import logsim.network.PinRef;
import logsim.sim.Monitors;

/**
 * Prints monitor traces as text, one line per signal: {@code _} low, {@code -} high, {@code X} undefined.
 */
public class TraceFormatter {
  private TraceFormatter() {}

  public static String format(List<Signal> trace) {
    StringBuilder out = new StringBuilder(trace.size());
    for (Signal level : trace)
      out.append(level.traceChar);
    return out.toString();
  }

  /** One line per monitored signal, names padded to the monitors' margin. */
  public static List<String> formatAll(Monitors monitors) {
    int margin = monitors.getMargin();
    List<String> lines = new ArrayList<>();
    for (PinRef pin : monitors.getMonitoredPins()) {
      String name = monitors.getSignalName(pin);
      List<Signal> trace = monitors.getTrace(pin.deviceId(), pin.pin()).orElseThrow();
      lines.add(name + " ".repeat(margin - name.length()) + " : " + format(trace));
    }
    return lines;
  }
}
