package ipxgen;

import java.math.BigInteger;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class StandardTest {

  @ParameterizedTest
  @CsvSource({"2009, IEEE_1685_2009", "1685-2009, IEEE_1685_2009", "IEEE_1685_2009, IEEE_1685_2009", "2014, IEEE_1685_2014",
              "' 1685-2014 ', IEEE_1685_2014"})
  void testFromSerialName(String serialName, Standard expected) {
    Assertions.assertEquals(Optional.of(expected), Standard.fromSerialName(serialName));
  }

  @ParameterizedTest
  @ValueSource(strings = {"2022", "1685-2022", "ieee_1685_2014", ""})
  void testFromSerialNameUnknown(String serialName) {
    Assertions.assertTrue(Standard.fromSerialName(serialName).isEmpty());
  }

  @Test
  void testHexStr() {
    Assertions.assertEquals("0x0", Standard.IEEE_1685_2009.hexStr(0));
    Assertions.assertEquals("0xdeadbeef", Standard.IEEE_1685_2009.hexStr(0xDEADBEEFL));
    Assertions.assertEquals("'h1000", Standard.IEEE_1685_2014.hexStr(0x1000));
    Assertions.assertEquals("'hffffffffffffffff", Standard.IEEE_1685_2014.hexStr(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE)));
  }

  @Test
  void testHexStrRejectsNegative() {
    for (Standard standard : Standard.values()) {
      Assertions.assertThrows(IllegalArgumentException.class, () -> standard.hexStr(-1));
      Assertions.assertThrows(IllegalArgumentException.class, () -> standard.hexStr(BigInteger.valueOf(Long.MIN_VALUE)));
    }
  }

  @Test
  void testDialectTable() {
    Assertions.assertEquals("spirit:register", Standard.IEEE_1685_2009.tag("register"));
    Assertions.assertEquals("ipxact:register", Standard.IEEE_1685_2014.tag("register"));

    Assertions.assertFalse(Standard.IEEE_1685_2009.supportsIsPresent());
    Assertions.assertTrue(Standard.IEEE_1685_2014.supportsIsPresent());
    Assertions.assertFalse(Standard.IEEE_1685_2009.hasFieldResets());
    Assertions.assertTrue(Standard.IEEE_1685_2014.hasFieldResets());
    Assertions.assertEquals(Standard.RegisterOrder.REGISTERS_FIRST, Standard.IEEE_1685_2009.getRegisterOrder());
    Assertions.assertEquals(Standard.RegisterOrder.INTERLEAVED, Standard.IEEE_1685_2014.getRegisterOrder());

    Assertions.assertEquals("http://www.spiritconsortium.org/XMLSchema/SPIRIT/1685-2009 "
                                + "http://www.spiritconsortium.org/XMLSchema/SPIRIT/1685-2009/index.xsd",
                            Standard.IEEE_1685_2009.schemaLocation());
    Assertions.assertEquals(Standard.IEEE_1685_2014, Standard.DEFAULT);
  }
}
