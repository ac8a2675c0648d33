package logsim;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceRegistry;
import logsim.devices.Signal;
import logsim.frontend.Diagnostic;
import logsim.frontend.LoadContext;
import logsim.frontend.Parser;
import logsim.frontend.Scanner;
import logsim.frontend.SignalNames;
import logsim.names.SymbolTable;
import logsim.network.Network;
import logsim.network.PinRef;
import logsim.sim.Monitors;
import logsim.sim.OscillationException;
import logsim.sim.Simulator;
import logsim.ui.LogSimConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point to the simulator core: loads a definition file and runs it.
 * <p>
 * Each load starts a fresh session with its own symbol table, registry, network and monitors. If a load reports
 * diagnostics, the session is not ready and every simulation call throws {@link IllegalStateException}.
 */
public class LogSim {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LogSimConfig cfg;

  private LoadContext context = null;
  private DeviceRegistry devices = null;
  private Network network = null;
  private Monitors monitors = null;
  private Simulator simulator = null;
  private List<Diagnostic> diagnostics = List.of();
  private List<String> sourceLines = List.of();

  public LogSim() { this(new LogSimConfig()); }
  public LogSim(LogSimConfig cfg) { this.cfg = cfg; }

  /**
   * Loads a definition file, replacing any previous session.
   * @return the diagnostics; empty if the circuit is ready to simulate
   * @throws IOException if the file cannot be read
   */
  public List<Diagnostic> load(Path path) throws IOException {
    // Malformed bytes become U+FFFD, which the scanner reports with its position.
    String source = StandardCharsets.UTF_8.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPLACE)
                        .onUnmappableCharacter(CodingErrorAction.REPLACE)
                        .decode(ByteBuffer.wrap(Files.readAllBytes(path)))
                        .toString();
    logger.info("Loading {}", path);
    return loadSource(source);
  }

  /** Loads definition text, replacing any previous session. */
  public List<Diagnostic> loadSource(String source) {
    context = new LoadContext(cfg);
    devices = new DeviceRegistry(cfg.max_gate_inputs);
    network = new Network(devices);
    monitors = new Monitors(context.getNames(), devices);
    sourceLines = source.lines().toList();

    Parser parser = new Parser(new Scanner(source, context), context, devices, network, monitors);
    boolean ok = parser.parseNetwork();
    diagnostics = parser.getDiagnostics();
    SymbolTable names = context.getNames();
    simulator = ok ? new Simulator(network, monitors, cfg.settle_iteration_limit, names::nameOf) : null;
    if (ok)
      logger.info("Loaded {} devices, {} connections, {} monitors", devices.size(), network.getConnections().size(),
                  monitors.getMonitoredPins().size());
    else
      logger.info("Definition has {} errors", diagnostics.size());
    return diagnostics;
  }

  /** True once a definition has been loaded without errors. */
  public boolean isReady() { return simulator != null; }

  public List<Diagnostic> getDiagnostics() { return diagnostics; }

  /** Diagnostics formatted with the offending source line and a caret, one block per diagnostic. */
  public List<String> renderDiagnostics() { return diagnostics.stream().map(d -> d.render(sourceLines)).toList(); }

  private Simulator requireReady() {
    if (simulator == null)
      throw new IllegalStateException(context == null ? "No definition loaded" : "Definition has errors and cannot be simulated");
    return simulator;
  }

  public SymbolTable getNames() {
    requireReady();
    return context.getNames();
  }

  public DeviceRegistry getDevices() {
    requireReady();
    return devices;
  }

  public Network getNetwork() {
    requireReady();
    return network;
  }

  public Monitors getMonitors() {
    requireReady();
    return monitors;
  }

  public Simulator.State getState() { return requireReady().getState(); }

  public int getTick() { return requireReady().getTick(); }

  /**
   * Resolves a device name.
   * @throws IllegalArgumentException if there is no such device
   */
  public int getDeviceId(String name) {
    requireReady();
    return context.getNames().query(name).filter(devices::contains).orElseThrow(
        () -> new IllegalArgumentException("No device named " + name));
  }

  /**
   * Resolves an output signal name such as {@code G1} or {@code FF1.Q}.
   * @throws IllegalArgumentException if there is no such output
   */
  public PinRef getOutput(String signal) {
    requireReady();
    return SignalNames.parseOutput(signal, context.getNames(), devices)
        .orElseThrow(() -> new IllegalArgumentException("No output signal named " + signal));
  }

  public String getSignalName(PinRef output) {
    requireReady();
    return monitors.getSignalName(output);
  }

  /** Names of all switches, in declaration order of their ids. */
  public List<String> getSwitchNames() {
    requireReady();
    return devices.findDevices(DeviceKind.SWITCH).stream().map(context.getNames()::nameOf).toList();
  }

  /**
   * Sets a switch; the level takes effect at the next tick.
   * @throws IllegalArgumentException if the device is not a switch
   */
  public void setSwitch(int deviceId, Signal level) {
    requireReady();
    devices.setSwitch(deviceId, level);
  }

  public void setSwitch(String name, Signal level) { setSwitch(getDeviceId(name), level); }

  /**
   * Runs n ticks.
   * @return ticks completed
   * @throws OscillationException if a tick does not settle
   */
  public int step(int n) throws OscillationException { return requireReady().step(n); }

  /**
   * Runs up to n ticks, stopping early when cancelled returns true.
   * @return ticks completed
   * @throws OscillationException if a tick does not settle
   */
  public int step(int n, BooleanSupplier cancelled) throws OscillationException { return requireReady().step(n, cancelled); }

  /** Returns all devices to their initial state, clears traces and the tick counter. Switch settings are kept. */
  public void reset() { requireReady().reset(); }

  /**
   * The recorded trace of a monitored output.
   * @throws IllegalArgumentException if the output is not monitored
   */
  public List<Signal> getTrace(int deviceId, int outputPin) {
    requireReady();
    return monitors.getTrace(deviceId, outputPin)
        .orElseThrow(() -> new IllegalArgumentException("Signal " + getSignalName(new PinRef(deviceId, outputPin)) + " is not monitored"));
  }

  public List<Signal> getTrace(String signal) {
    PinRef output = getOutput(signal);
    return getTrace(output.deviceId(), output.pin());
  }

  /**
   * Starts monitoring a signal. Its trace begins with the next completed tick.
   * @return false if it was already monitored
   */
  public boolean addMonitor(String signal) {
    PinRef output = getOutput(signal);
    return monitors.makeMonitor(output.deviceId(), output.pin());
  }

  /**
   * Stops monitoring a signal.
   * @return false if it was not monitored
   */
  public boolean removeMonitor(String signal) {
    PinRef output = getOutput(signal);
    return monitors.removeMonitor(output.deviceId(), output.pin());
  }

  /** Monitored signal names in display order. */
  public List<String> getMonitoredSignals() {
    requireReady();
    return Collections.unmodifiableList(monitors.getSignalNames().monitored());
  }
}
