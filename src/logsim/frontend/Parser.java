package logsim.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import logsim.devices.Device;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceRegistry;
import logsim.names.SymbolKind;
import logsim.names.SymbolTable;
import logsim.network.Network;
import logsim.network.PinRef;
import logsim.sim.Monitors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Recursive-descent parser for definition files. Builds devices, connections and monitors while it checks the file.
 *
 * <pre>
 * circuit     = devices, connections, [ monitors ], [ "END" ], EOF ;
 * devices     = "DEVICES", ":", { device } ;
 * device      = name, { ",", name }, "=", kind, [ number ], ";" ;
 * connections = "CONNECTIONS", ":", { connection } ;
 * connection  = signal, "->", name, ".", pin, ";" ;
 * monitors    = "MONITORS", ":", { signal, { ",", signal }, ";" } ;
 * signal      = name, [ ".", pin ] ;
 * </pre>
 *
 * A syntax error is recorded and switches the parser to {@link ParserState#RECOVERING}, in which tokens are skipped up
 * to the next ';' or block header, so later statements are still checked. Semantic errors are reported on complete
 * statements and need no recovery. The registry, network and monitors are filled as statements succeed; if
 * {@link #getDiagnostics()} is not empty afterwards they are incomplete and must not be simulated.
 */
public class Parser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum ParserState {
    NORMAL,
    /** Skipping to the next statement boundary after a syntax error. */
    RECOVERING
  }

  /** A signal reference as written: device name and optional pin name. */
  private record SignalRef(Token device, Token pin) {}

  @FunctionalInterface
  private interface StatementParser {
    void parse();
  }

  private final Scanner scanner;
  private final SymbolTable names;
  private final DeviceRegistry devices;
  private final Network network;
  private final Monitors monitors;

  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private ParserState state = ParserState.NORMAL;
  private Token current;

  // Name token of each successfully declared device, for positioning end-of-parse diagnostics.
  private final HashMap<Integer, Token> declarations = new HashMap<>();
  // Names whose declaration failed; references to them are not reported again as undefined.
  private final HashSet<String> failedDeclarations = new HashSet<>();

  public Parser(Scanner scanner, LoadContext context, DeviceRegistry devices, Network network, Monitors monitors) {
    this.scanner = scanner;
    this.names = context.getNames();
    this.devices = devices;
    this.network = network;
    this.monitors = monitors;
  }

  public List<Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }

  public ParserState getState() { return state; }

  /**
   * Parses the whole definition.
   * @return true if the file is free of errors and the network is ready for simulation
   */
  public boolean parseNetwork() {
    advance();
    int nextBlock = 0;
    boolean reportedMissingHeader = false;
    StatementParser statements = this::parseDevice;

    while (current.kind() != TokenKind.EOF) {
      if (current.isKeyword(Keywords.END)) {
        advance();
        if (current.kind() != TokenKind.EOF) {
          report(Diagnostic.at(current, DiagnosticCode.UNEXPECTED_TOKEN, describe(current)));
          while (current.kind() != TokenKind.EOF)
            advance();
        }
        break;
      }
      if (Keywords.isBlockHeader(current)) {
        int block = Keywords.BLOCKS.indexOf(current.lexeme());
        if (block < nextBlock) {
          report(Diagnostic.at(current, DiagnosticCode.BLOCK_OUT_OF_ORDER, current.lexeme()));
        } else {
          for (int skipped = nextBlock; skipped < block; skipped++)
            if (skipped < 2) // MONITORS is optional
              report(Diagnostic.at(current, DiagnosticCode.EXPECTED_BLOCK, Keywords.BLOCKS.get(skipped)));
          nextBlock = block + 1;
        }
        statements = statementParserFor(block);
        parseBlockHeader();
        continue;
      }
      if (nextBlock == 0 && !reportedMissingHeader) {
        // Statements before any header are read as device declarations.
        report(Diagnostic.at(current, DiagnosticCode.EXPECTED_BLOCK, Keywords.DEVICES));
        reportedMissingHeader = true;
        nextBlock = 1;
      }
      state = ParserState.NORMAL;
      statements.parse();
      if (state == ParserState.RECOVERING)
        synchronize();
    }

    for (int missing = nextBlock; missing < 2; missing++)
      report(Diagnostic.at(current, DiagnosticCode.EXPECTED_BLOCK, Keywords.BLOCKS.get(missing)));

    checkUnconnectedInputs();
    logger.debug("Parser. Finished with {} devices, {} connections, {} monitors and {} errors", devices.size(),
                 network.getConnections().size(), monitors.getMonitoredPins().size(), diagnostics.size());
    return diagnostics.isEmpty();
  }

  private StatementParser statementParserFor(int block) {
    switch (block) {
    case 0:
      return this::parseDevice;
    case 1:
      return this::parseConnection;
    default:
      return this::parseMonitor;
    }
  }

  private void parseBlockHeader() {
    Token header = current;
    advance();
    if (current.isPunct(":"))
      advance();
    else
      report(Diagnostic.at(current, DiagnosticCode.EXPECTED_COLON, header.lexeme()));
  }

  //////////   statements   //////////

  private void parseDevice() {
    List<Token> nameTokens = new ArrayList<>();
    do {
      if (!nameTokens.isEmpty())
        advance(); // ','
      Optional<Token> name = expectName();
      if (name.isEmpty()) {
        markFailed(nameTokens);
        return;
      }
      nameTokens.add(name.get());
    } while (current.isPunct(","));

    if (!expectPunct("=", DiagnosticCode.EXPECTED_EQUALS)) {
      markFailed(nameTokens);
      return;
    }

    Optional<DeviceKind> kind = current.kind() == TokenKind.KEYWORD ? DeviceKind.fromKeyword(current.lexeme()) : Optional.empty();
    if (kind.isEmpty()) {
      error(current, DiagnosticCode.EXPECTED_DEVICE_KIND, describe(current));
      markFailed(nameTokens);
      return;
    }
    Token kindToken = current;
    advance();

    Token parameterToken = null;
    if (current.kind() == TokenKind.NUMBER) {
      parameterToken = current;
      advance();
    } else if (kind.get().parameterUse != DeviceKind.ParameterUse.NONE) {
      error(current, DiagnosticCode.EXPECTED_NUMBER, kindToken.lexeme(), describe(current));
      markFailed(nameTokens);
      return;
    }

    if (!expectPunct(";", DiagnosticCode.EXPECTED_SEMICOLON)) {
      markFailed(nameTokens);
      return;
    }

    // Statement is syntactically complete.
    int parameter = 0;
    if (parameterToken != null) {
      Optional<Integer> value = parseNumber(parameterToken);
      if (value.isEmpty()) {
        markFailed(nameTokens);
        return;
      }
      parameter = value.get();
      if (kind.get().parameterUse == DeviceKind.ParameterUse.NONE || !devices.isValidParameter(kind.get(), parameter)) {
        report(Diagnostic.at(parameterToken, DiagnosticCode.INVALID_PARAMETER, parameterToken.lexeme(), kindToken.lexeme()));
        markFailed(nameTokens);
        return;
      }
    }

    for (Token nameToken : nameTokens) {
      int id = names.lookup(nameToken.lexeme());
      if (devices.contains(id)) {
        report(Diagnostic.at(nameToken, DiagnosticCode.DUPLICATE_DEVICE, nameToken.lexeme()));
        continue;
      }
      devices.makeDevice(id, kind.get(), parameter);
      names.setKind(id, SymbolKind.DEVICE);
      declarations.put(id, nameToken);
      logger.debug("Parser. Declared {} as {} {}", nameToken.lexeme(), kind.get(), parameter);
    }
  }

  private void parseConnection() {
    Optional<SignalRef> source = parseSignal();
    if (source.isEmpty())
      return;
    if (!expectPunct("->", DiagnosticCode.EXPECTED_ARROW))
      return;
    Optional<Token> targetName = expectName();
    if (targetName.isEmpty())
      return;
    if (!expectPunct(".", DiagnosticCode.EXPECTED_DOT))
      return;
    Optional<Token> targetPin = expectPin();
    if (targetPin.isEmpty())
      return;
    if (!expectPunct(";", DiagnosticCode.EXPECTED_SEMICOLON))
      return;

    Optional<PinRef> output = resolveOutput(source.get());
    Optional<PinRef> input = resolveInput(targetName.get(), targetPin.get());
    if (output.isEmpty() || input.isEmpty())
      return;

    Optional<PinRef> existing = network.getDriver(input.get().deviceId(), input.get().pin());
    if (existing.isPresent()) {
      report(Diagnostic.at(targetName.get(), DiagnosticCode.MULTIPLE_DRIVERS, SignalNames.inputName(names, devices, input.get()),
                           SignalNames.outputName(names, devices, existing.get())));
      return;
    }
    network.makeConnection(output.get(), input.get());
    markPin(targetPin.get(), SymbolKind.INPUT_PIN);
  }

  private void parseMonitor() {
    List<SignalRef> signals = new ArrayList<>();
    do {
      if (!signals.isEmpty())
        advance(); // ','
      Optional<SignalRef> signal = parseSignal();
      if (signal.isEmpty())
        return;
      signals.add(signal.get());
    } while (current.isPunct(","));
    if (!expectPunct(";", DiagnosticCode.EXPECTED_SEMICOLON))
      return;

    for (SignalRef signal : signals) {
      Optional<PinRef> output = resolveOutput(signal);
      if (output.isPresent() && !monitors.makeMonitor(output.get().deviceId(), output.get().pin()))
        report(Diagnostic.at(signal.device(), DiagnosticCode.DUPLICATE_MONITOR, SignalNames.outputName(names, devices, output.get())));
    }
  }

  private Optional<SignalRef> parseSignal() {
    Optional<Token> device = expectName();
    if (device.isEmpty())
      return Optional.empty();
    Token pin = null;
    if (current.isPunct(".")) {
      advance();
      Optional<Token> pinToken = expectPin();
      if (pinToken.isEmpty())
        return Optional.empty();
      pin = pinToken.get();
    }
    return Optional.of(new SignalRef(device.get(), pin));
  }

  //////////   semantic checks   //////////

  private Optional<Device> resolveDevice(Token name) {
    Optional<Device> device = names.query(name.lexeme()).flatMap(devices::getDevice);
    if (device.isEmpty() && !failedDeclarations.contains(name.lexeme()))
      report(Diagnostic.at(name, DiagnosticCode.UNDEFINED_DEVICE, name.lexeme()));
    return device;
  }

  private Optional<PinRef> resolveOutput(SignalRef signal) {
    Optional<Device> device = resolveDevice(signal.device());
    if (device.isEmpty())
      return Optional.empty();
    DeviceKind kind = device.get().getKind();
    if (signal.pin() == null) {
      if (device.get().getOutputCount() > 1) {
        report(Diagnostic.at(signal.device(), DiagnosticCode.OUTPUT_PIN_REQUIRED, signal.device().lexeme(), kind.keyword));
        return Optional.empty();
      }
      return Optional.of(new PinRef(device.get().getId(), 0));
    }
    Optional<Integer> pin = kind.outputIndex(signal.pin().lexeme());
    if (pin.isEmpty()) {
      report(Diagnostic.at(signal.pin(), DiagnosticCode.UNKNOWN_PIN, signal.device().lexeme(), "output", signal.pin().lexeme()));
      return Optional.empty();
    }
    markPin(signal.pin(), SymbolKind.OUTPUT_PIN);
    return Optional.of(new PinRef(device.get().getId(), pin.get()));
  }

  private Optional<PinRef> resolveInput(Token name, Token pinName) {
    Optional<Device> device = resolveDevice(name);
    if (device.isEmpty())
      return Optional.empty();
    DeviceKind kind = device.get().getKind();
    Optional<Integer> pin = kind.inputIndex(pinName.lexeme(), device.get().getInputCount());
    if (pin.isPresent())
      return Optional.of(new PinRef(device.get().getId(), pin.get()));
    if (kind.hasNumberedInputs() && DeviceKind.numberedInput(pinName.lexeme()).isPresent())
      report(Diagnostic.at(pinName, DiagnosticCode.PIN_OUT_OF_RANGE, pinName.lexeme(), name.lexeme(),
                           String.valueOf(device.get().getInputCount())));
    else
      report(Diagnostic.at(pinName, DiagnosticCode.UNKNOWN_PIN, name.lexeme(), "input", pinName.lexeme()));
    return Optional.empty();
  }

  private void checkUnconnectedInputs() {
    for (PinRef input : network.getUnconnectedInputs()) {
      Token declaration = declarations.get(input.deviceId());
      report(Diagnostic.at(declaration, DiagnosticCode.UNCONNECTED_INPUT, SignalNames.inputName(names, devices, input)));
    }
  }

  private Optional<Integer> parseNumber(Token token) {
    try {
      return Optional.of(Integer.parseInt(token.lexeme()));
    } catch (NumberFormatException e) {
      report(Diagnostic.at(token, DiagnosticCode.NUMBER_TOO_LARGE, token.lexeme()));
      return Optional.empty();
    }
  }

  /** Records what a name is used for, unless it already has a kind (a device may share a pin's name). */
  private void markPin(Token pin, SymbolKind kind) {
    int id = names.lookup(pin.lexeme());
    if (names.getSymbol(id).getKind() == SymbolKind.UNKNOWN)
      names.setKind(id, kind);
  }

  private void markFailed(List<Token> nameTokens) { nameTokens.forEach(token -> failedDeclarations.add(token.lexeme())); }

  //////////   token handling and recovery   //////////

  /** Moves to the next token. Lexical errors are reported here and never reach the grammar. */
  private void advance() {
    current = scanner.nextToken();
    while (current.kind() == TokenKind.ERROR) {
      if (current.lexeme().equals("/*"))
        report(Diagnostic.at(current, DiagnosticCode.UNTERMINATED_COMMENT));
      else
        report(Diagnostic.at(current, DiagnosticCode.INVALID_CHARACTER, current.lexeme()));
      current = scanner.nextToken();
    }
  }

  private Optional<Token> expectName() {
    Token token = current;
    if (token.kind() == TokenKind.NAME) {
      advance();
      return Optional.of(token);
    }
    if (token.kind() == TokenKind.KEYWORD)
      error(token, DiagnosticCode.KEYWORD_AS_NAME, token.lexeme());
    else
      error(token, DiagnosticCode.EXPECTED_NAME, describe(token));
    return Optional.empty();
  }

  private Optional<Token> expectPin() {
    Token token = current;
    if (token.kind() == TokenKind.NAME) {
      advance();
      return Optional.of(token);
    }
    error(token, DiagnosticCode.EXPECTED_PIN, describe(token));
    return Optional.empty();
  }

  private boolean expectPunct(String punct, DiagnosticCode code) {
    if (current.isPunct(punct)) {
      advance();
      return true;
    }
    error(current, code, describe(current));
    return false;
  }

  private static String describe(Token token) { return token.kind() == TokenKind.EOF ? "end of file" : token.lexeme(); }

  /** Records a syntax error and starts recovery. */
  private void error(Token token, DiagnosticCode code, String... arguments) {
    report(Diagnostic.at(token, code, arguments));
    state = ParserState.RECOVERING;
  }

  private void report(Diagnostic diagnostic) {
    logger.debug("Parser. {}", diagnostic);
    diagnostics.add(diagnostic);
  }

  /**
   * Skips tokens up to and including the next ';', or up to the next block header or end marker, then returns to
   * {@link ParserState#NORMAL}.
   */
  private void synchronize() {
    while (current.kind() != TokenKind.EOF && !Keywords.isBlockHeader(current) && !current.isKeyword(Keywords.END)) {
      if (current.isPunct(";")) {
        advance();
        break;
      }
      advance();
    }
    logger.trace("Parser. Resynchronized at {}", current);
    state = ParserState.NORMAL;
  }
}
