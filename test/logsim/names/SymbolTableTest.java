package logsim.names;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SymbolTableTest {
  SymbolTable names;

  @BeforeEach
  void setUp() {
    names = new SymbolTable();
  }

  @Test
  void testLookup_idsInOrderOfFirstUse() {
    Assertions.assertEquals(0, names.lookup("G1"));
    Assertions.assertEquals(1, names.lookup("SW1"));
    Assertions.assertEquals(0, names.lookup("G1"));
    Assertions.assertEquals(2, names.size());
  }

  @Test
  void testLookup_list() {
    Assertions.assertEquals(List.of(0, 1, 0, 2), names.lookup(List.of("A", "B", "A", "C")));
  }

  @Test
  void testQuery_doesNotAdd() {
    Assertions.assertEquals(Optional.empty(), names.query("nope"));
    Assertions.assertEquals(0, names.size());
    int id = names.lookup("nope");
    Assertions.assertEquals(Optional.of(id), names.query("nope"));
  }

  @Test
  void testGetName() {
    int id = names.lookup("clk_1");
    Assertions.assertEquals(Optional.of("clk_1"), names.getName(id));
    Assertions.assertEquals(Optional.empty(), names.getName(id + 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> names.getName(-1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> names.nameOf(5));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "1abc", "_x", "a-b", "a.b", "a b"})
  void testLookup_rejectsInvalidNames(String name) {
    Assertions.assertThrows(IllegalArgumentException.class, () -> names.lookup(name));
    Assertions.assertEquals(0, names.size());
  }

  @Test
  void testKind() {
    int id = names.lookup("G1");
    Assertions.assertEquals(SymbolKind.UNKNOWN, names.getSymbol(id).getKind());
    names.setKind(id, SymbolKind.DEVICE);
    Assertions.assertEquals(SymbolKind.DEVICE, names.getSymbol(id).getKind());
  }
}
