package logsim.frontend;

import java.util.List;
import java.util.Map;
import logsim.devices.Device;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceRegistry;
import logsim.names.SymbolKind;
import logsim.network.Network;
import logsim.network.PinRef;
import logsim.sim.Monitors;
import logsim.ui.LogSimConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ParserTest {
  LoadContext context;
  DeviceRegistry devices;
  Network network;
  Monitors monitors;
  Parser parser;

  boolean parse(String source) { return parse(source, new LogSimConfig()); }

  boolean parse(String source, LogSimConfig cfg) {
    context = new LoadContext(cfg);
    devices = new DeviceRegistry(cfg.max_gate_inputs);
    network = new Network(devices);
    monitors = new Monitors(context.getNames(), devices);
    parser = new Parser(new Scanner(source, context), context, devices, network, monitors);
    return parser.parseNetwork();
  }

  List<DiagnosticCode> codes() { return parser.getDiagnostics().stream().map(Diagnostic::getCode).toList(); }

  Device device(String name) { return devices.getDevice(context.getNames().query(name).orElseThrow()).orElseThrow(); }

  void assertDiagnostic(int index, DiagnosticCode code, int line, int column) {
    Diagnostic diagnostic = parser.getDiagnostics().get(index);
    Assertions.assertEquals(code, diagnostic.getCode(), diagnostic.toString());
    Assertions.assertEquals(line, diagnostic.getLine(), diagnostic.toString());
    Assertions.assertEquals(column, diagnostic.getColumn(), diagnostic.toString());
  }

  static final String HALF_ADDER = "DEVICES:\n"
                                   + "  A, B = SWITCH 0;\n"
                                   + "  S = XOR;\n"
                                   + "  C = AND 2;\n"
                                   + "CONNECTIONS:\n"
                                   + "  A -> S.I1; B -> S.I2;\n"
                                   + "  A -> C.I1; B -> C.I2;\n"
                                   + "MONITORS:\n"
                                   + "  S, C;\n"
                                   + "END\n";

  @Test
  void testValidCircuit() {
    Assertions.assertTrue(parse(HALF_ADDER), parser.getDiagnostics().toString());
    Assertions.assertEquals(4, devices.size());
    Assertions.assertEquals(DeviceKind.SWITCH, device("A").getKind());
    Assertions.assertEquals(DeviceKind.SWITCH, device("B").getKind());
    Assertions.assertEquals(2, device("C").getInputCount());
    Assertions.assertEquals(4, network.getConnections().size());
    Assertions.assertEquals(2, monitors.getMonitoredPins().size());
    Assertions.assertEquals(SymbolKind.DEVICE, context.getNames().getSymbol(device("S").getId()).getKind());
    Assertions.assertEquals(Parser.ParserState.NORMAL, parser.getState());
  }

  @Test
  void testMonitorsAndEndAreOptional() {
    Assertions.assertTrue(parse("DEVICES: N = NOT; S = SWITCH 1; CONNECTIONS: S -> N.I1;"), parser.getDiagnostics().toString());
  }

  @Test
  void testDtypePins() {
    String source = "DEVICES: FF = DTYPE; D, K = SWITCH 0; L = LED;\n"
                    + "CONNECTIONS: D -> FF.DATA; K -> FF.CLK; FF.QBAR -> L.I1;\n"
                    + "MONITORS: FF.Q, FF.QBAR, L;";
    Assertions.assertTrue(parse(source), parser.getDiagnostics().toString());
    int ff = device("FF").getId();
    Assertions.assertEquals(new PinRef(ff, DeviceKind.DTYPE_QBAR), network.getDriver(device("L").getId(), 0).orElseThrow());
    Assertions.assertTrue(monitors.isMonitored(ff, DeviceKind.DTYPE_Q));
  }

  @Test
  void testDeviceNamedLikeAPin() {
    String source = "DEVICES: FF = DTYPE; DATA, CLK = SWITCH 0;\n"
                    + "CONNECTIONS: DATA -> FF.DATA; CLK -> FF.CLK;\n"
                    + "MONITORS: FF.Q;";
    Assertions.assertTrue(parse(source), parser.getDiagnostics().toString());
    Assertions.assertEquals(SymbolKind.DEVICE, context.getNames().getSymbol(device("DATA").getId()).getKind());
    Assertions.assertEquals(SymbolKind.DEVICE, context.getNames().getSymbol(device("CLK").getId()).getKind());
    int q = context.getNames().query("Q").orElseThrow();
    Assertions.assertEquals(SymbolKind.OUTPUT_PIN, context.getNames().getSymbol(q).getKind());
  }

  @Test
  void testPinNamesGetPinKind() {
    Assertions.assertTrue(parse(HALF_ADDER), parser.getDiagnostics().toString());
    int i1 = context.getNames().query("I1").orElseThrow();
    Assertions.assertEquals(SymbolKind.INPUT_PIN, context.getNames().getSymbol(i1).getKind());
  }

  @Test
  void testMissingSemicolon_reportedAtNextToken() {
    Assertions.assertFalse(parse("DEVICES:\n  G1 = AND 2\n  G2 = OR 2;\nCONNECTIONS:\n"));
    assertDiagnostic(0, DiagnosticCode.EXPECTED_SEMICOLON, 3, 3);
    Assertions.assertEquals("expected ';', found G2", parser.getDiagnostics().get(0).getMessage());
  }

  @Test
  void testRecovery_laterErrorsStillFound() {
    String source = "DEVICES:\n"
                    + "  G1 = FOO 2;\n"     // not a kind
                    + "  SW = SWITCH 3;\n"  // bad level
                    + "  G2 = NOT;\n"
                    + "CONNECTIONS:\n"
                    + "  SW -> G2.I1;\n"
                    + "  X -> G2.I1;\n";
    Assertions.assertFalse(parse(source));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_DEVICE_KIND, DiagnosticCode.INVALID_PARAMETER, DiagnosticCode.UNDEFINED_DEVICE,
                                    DiagnosticCode.UNCONNECTED_INPUT),
                            codes());
    assertDiagnostic(0, DiagnosticCode.EXPECTED_DEVICE_KIND, 2, 8);
    assertDiagnostic(1, DiagnosticCode.INVALID_PARAMETER, 3, 15);
    assertDiagnostic(2, DiagnosticCode.UNDEFINED_DEVICE, 7, 3);
    assertDiagnostic(3, DiagnosticCode.UNCONNECTED_INPUT, 4, 3);
    Assertions.assertEquals("input G2.I1 is not connected", parser.getDiagnostics().get(3).getMessage());
  }

  @Test
  void testFailedDeclarationIsNotReportedAgainWhenUsed() {
    Assertions.assertFalse(parse("DEVICES: G1 = AND 99; S = SWITCH 0; CONNECTIONS: S -> G1.I1;"));
    Assertions.assertEquals(List.of(DiagnosticCode.INVALID_PARAMETER), codes());
  }

  @Test
  void testLexicalErrorsDoNotStopParsing() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0 $;\nN = NOT; CONNECTIONS: S -> N.I1; /* open"));
    Assertions.assertEquals(List.of(DiagnosticCode.INVALID_CHARACTER, DiagnosticCode.UNTERMINATED_COMMENT), codes());
    assertDiagnostic(0, DiagnosticCode.INVALID_CHARACTER, 1, 23);
    Assertions.assertEquals(2, devices.size());
  }

  @Test
  void testNumberTooLarge() {
    Assertions.assertFalse(parse("DEVICES: C = CLOCK 99999999999; CONNECTIONS:"));
    Assertions.assertEquals(List.of(DiagnosticCode.NUMBER_TOO_LARGE), codes());
  }

  @Test
  void testKeywordAsName() {
    Assertions.assertFalse(parse("DEVICES: AND = AND 2; CONNECTIONS:"));
    Assertions.assertEquals(DiagnosticCode.KEYWORD_AS_NAME, codes().get(0));
    assertDiagnostic(0, DiagnosticCode.KEYWORD_AS_NAME, 1, 10);
  }

  @Test
  void testMissingParameter() {
    Assertions.assertFalse(parse("DEVICES: G = NAND; CONNECTIONS:"));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_NUMBER), codes());
    Assertions.assertEquals("expected a number after NAND, found ;", parser.getDiagnostics().get(0).getMessage());
  }

  @ParameterizedTest
  @ValueSource(strings = {"NOT 1", "XOR 2", "DTYPE 0", "LED 3"})
  void testParameterOnFixedKind(String declaration) {
    Assertions.assertFalse(parse("DEVICES: D = " + declaration + "; CONNECTIONS:"));
    Assertions.assertEquals(DiagnosticCode.INVALID_PARAMETER, codes().get(0));
  }

  @ParameterizedTest
  @ValueSource(strings = {"AND 0", "OR 17", "SWITCH 2", "CLOCK 0"})
  void testParameterOutOfRange(String declaration) {
    Assertions.assertFalse(parse("DEVICES: D = " + declaration + "; CONNECTIONS:"));
    Assertions.assertEquals(List.of(DiagnosticCode.INVALID_PARAMETER), codes());
  }

  @Test
  void testMaxGateInputsFromConfig() {
    LogSimConfig cfg = new LogSimConfig();
    cfg.max_gate_inputs = 2;
    Assertions.assertFalse(parse("DEVICES: G = AND 3; CONNECTIONS:", cfg));
    Assertions.assertEquals(List.of(DiagnosticCode.INVALID_PARAMETER), codes());
  }

  @Test
  void testDuplicateDevice() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0;\nS, T = SWITCH 1; CONNECTIONS:"));
    Assertions.assertEquals(List.of(DiagnosticCode.DUPLICATE_DEVICE), codes());
    assertDiagnostic(0, DiagnosticCode.DUPLICATE_DEVICE, 2, 1);
    // The other name of the statement is still declared.
    Assertions.assertEquals(DeviceKind.SWITCH, device("T").getKind());
  }

  @Test
  void testPinErrors() {
    String source = "DEVICES: S = SWITCH 0; G = AND 2; FF = DTYPE;\n"
                    + "CONNECTIONS:\n"
                    + "S -> G.I3;\n"
                    + "S -> G.X;\n"
                    + "FF -> G.I1;\n"
                    + "FF.Z -> G.I2;\n"
                    + "S -> FF.Q;\n";
    Assertions.assertFalse(parse(source));
    Assertions.assertEquals(DiagnosticCode.PIN_OUT_OF_RANGE, codes().get(0));
    assertDiagnostic(0, DiagnosticCode.PIN_OUT_OF_RANGE, 3, 8);
    Assertions.assertEquals("pin I3 is out of range, G has 2 inputs", parser.getDiagnostics().get(0).getMessage());
    assertDiagnostic(1, DiagnosticCode.UNKNOWN_PIN, 4, 8);
    assertDiagnostic(2, DiagnosticCode.OUTPUT_PIN_REQUIRED, 5, 1);
    assertDiagnostic(3, DiagnosticCode.UNKNOWN_PIN, 6, 4);
    assertDiagnostic(4, DiagnosticCode.UNKNOWN_PIN, 7, 9);
  }

  @Test
  void testMultipleDrivers() {
    Assertions.assertFalse(parse("DEVICES: A, B = SWITCH 0; N = NOT;\nCONNECTIONS: A -> N.I1;\nB -> N.I1;"));
    Assertions.assertEquals(List.of(DiagnosticCode.MULTIPLE_DRIVERS), codes());
    assertDiagnostic(0, DiagnosticCode.MULTIPLE_DRIVERS, 3, 6);
    Assertions.assertEquals("input N.I1 is already driven by A", parser.getDiagnostics().get(0).getMessage());
  }

  @Test
  void testDuplicateMonitor() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0; CONNECTIONS: MONITORS: S; S;"));
    Assertions.assertEquals(List.of(DiagnosticCode.DUPLICATE_MONITOR), codes());
    assertDiagnostic(0, DiagnosticCode.DUPLICATE_MONITOR, 1, 50);
  }

  @Test
  void testMissingBlocks() {
    Assertions.assertFalse(parse("S = SWITCH 0;"));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_BLOCK, DiagnosticCode.EXPECTED_BLOCK), codes());
    assertDiagnostic(0, DiagnosticCode.EXPECTED_BLOCK, 1, 1);
    Assertions.assertEquals(List.of("DEVICES"), parser.getDiagnostics().get(0).getArguments());
    Assertions.assertEquals(List.of("CONNECTIONS"), parser.getDiagnostics().get(1).getArguments());
    // Statements without a header are still read as declarations.
    Assertions.assertEquals(1, devices.size());
  }

  @Test
  void testSkippedConnectionsBlock() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0; MONITORS: S;"));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_BLOCK), codes());
    Assertions.assertEquals(List.of("CONNECTIONS"), parser.getDiagnostics().get(0).getArguments());
  }

  @Test
  void testRepeatedBlock() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0; CONNECTIONS: DEVICES: T = SWITCH 1;"));
    Assertions.assertEquals(List.of(DiagnosticCode.BLOCK_OUT_OF_ORDER), codes());
    Assertions.assertEquals(2, devices.size());
  }

  @Test
  void testMissingColon() {
    Assertions.assertFalse(parse("DEVICES S = SWITCH 0; CONNECTIONS:"));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_COLON), codes());
    Assertions.assertEquals(1, devices.size());
  }

  @Test
  void testTokensAfterEnd() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0; CONNECTIONS: END S"));
    Assertions.assertEquals(List.of(DiagnosticCode.UNEXPECTED_TOKEN), codes());
    Assertions.assertEquals(Parser.ParserState.NORMAL, parser.getState());
  }

  @Test
  void testErrorAtEndOfFile() {
    Assertions.assertFalse(parse("DEVICES: S = SWITCH 0; CONNECTIONS: S ->"));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_NAME), codes());
    Assertions.assertEquals("expected a device name, found end of file", parser.getDiagnostics().get(0).getMessage());
  }

  @Test
  void testConnectionSyntaxErrors() {
    String source = "DEVICES: S = SWITCH 0; N = NOT;\n"
                    + "CONNECTIONS:\n"
                    + "S N.I1;\n"
                    + "S -> N I1;\n"
                    + "S -> N.;\n"
                    + "S -> N.I1;\n";
    Assertions.assertFalse(parse(source));
    Assertions.assertEquals(List.of(DiagnosticCode.EXPECTED_ARROW, DiagnosticCode.EXPECTED_DOT, DiagnosticCode.EXPECTED_PIN), codes());
    assertDiagnostic(0, DiagnosticCode.EXPECTED_ARROW, 3, 3);
    assertDiagnostic(1, DiagnosticCode.EXPECTED_DOT, 4, 8);
    assertDiagnostic(2, DiagnosticCode.EXPECTED_PIN, 5, 8);
    Assertions.assertEquals(1, network.getConnections().size());
  }

  @Test
  void testKeywordAliases() {
    LogSimConfig cfg = new LogSimConfig();
    cfg.keyword_aliases = Map.of("GERAETE", "DEVICES", "VERBINDUNGEN", "CONNECTIONS", "SCHALTER", "SWITCH");
    Assertions.assertTrue(parse("GERAETE: S = SCHALTER 1; L = LED; VERBINDUNGEN: S -> L.I1;", cfg),
                          parser.getDiagnostics().toString());
    Assertions.assertEquals(DeviceKind.SWITCH, device("S").getKind());
  }

  @Test
  void testRender() {
    String source = "DEVICES:\n  G = AND 2\nCONNECTIONS:";
    Assertions.assertFalse(parse(source));
    String rendered = parser.getDiagnostics().get(0).render(source.lines().toList());
    Assertions.assertEquals("ERROR EXPECTED_SEMICOLON on line 3, column 1: expected ';', found CONNECTIONS\n"
                                + "CONNECTIONS:\n"
                                + "^",
                            rendered);
  }
}
