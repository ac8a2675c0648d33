package logsim.network;

import java.util.List;
import logsim.devices.DeviceKind;
import logsim.devices.DeviceRegistry;
import logsim.devices.Signal;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NetworkTest {
  DeviceRegistry devices;
  Network network;

  static final int SW = 0, GATE = 1, FF = 2;

  @BeforeEach
  void setUp() {
    devices = new DeviceRegistry();
    network = new Network(devices);
    devices.makeDevice(SW, DeviceKind.SWITCH, 1);
    devices.makeDevice(GATE, DeviceKind.OR, 2);
    devices.makeDevice(FF, DeviceKind.DTYPE, 0);
  }

  @Test
  void testConnect() {
    network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 0));
    Assertions.assertEquals(new PinRef(SW, 0), network.getDriver(GATE, 0).orElseThrow());
    Assertions.assertTrue(network.getDriver(GATE, 1).isEmpty());
    Assertions.assertEquals(Signal.HIGH, network.getInputSignal(devices.getDevice(GATE).orElseThrow(), 0));
  }

  @Test
  void testSingleDriverPerInput() {
    network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 0));
    Assertions.assertThrows(IllegalStateException.class, () -> network.makeConnection(new PinRef(FF, 0), new PinRef(GATE, 0)));
    Assertions.assertEquals(new PinRef(SW, 0), network.getDriver(GATE, 0).orElseThrow());
    // One output may drive many inputs.
    network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 1));
    Assertions.assertEquals(2, network.getConnections().size());
  }

  @Test
  void testInvalidPins() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.makeConnection(new PinRef(SW, 1), new PinRef(GATE, 0)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 2)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.makeConnection(new PinRef(9, 0), new PinRef(GATE, 0)));
    Assertions.assertThrows(IllegalArgumentException.class, () -> network.makeConnection(new PinRef(SW, 0), new PinRef(9, 0)));
    Assertions.assertTrue(network.getConnections().isEmpty());
  }

  @Test
  void testUnconnectedInputs() {
    Assertions.assertEquals(List.of(new PinRef(GATE, 0), new PinRef(GATE, 1), new PinRef(FF, DeviceKind.DTYPE_DATA),
                                    new PinRef(FF, DeviceKind.DTYPE_CLK)),
                            network.getUnconnectedInputs());
    Assertions.assertFalse(network.checkNetwork());
    network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 0));
    network.makeConnection(new PinRef(SW, 0), new PinRef(GATE, 1));
    network.makeConnection(new PinRef(GATE, 0), new PinRef(FF, DeviceKind.DTYPE_DATA));
    network.makeConnection(new PinRef(FF, DeviceKind.DTYPE_QBAR), new PinRef(FF, DeviceKind.DTYPE_CLK));
    Assertions.assertTrue(network.checkNetwork());
  }

  @Test
  void testUnconnectedInputLevels() {
    var ff = devices.getDevice(FF).orElseThrow();
    Assertions.assertEquals(Signal.UNDEFINED, network.getInputSignal(ff, DeviceKind.DTYPE_DATA));
    Assertions.assertEquals(Signal.LOW, network.getInputSignal(ff, DeviceKind.DTYPE_SET));
    Assertions.assertEquals(Signal.LOW, network.getInputSignal(ff, DeviceKind.DTYPE_CLEAR));
  }
}
