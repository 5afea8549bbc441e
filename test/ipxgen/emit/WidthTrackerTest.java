package ipxgen.emit;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class WidthTrackerTest {

  @Test
  void testKeepsMaximum() {
    WidthTracker width = new WidthTracker();
    Assertions.assertTrue(width.get().isEmpty());
    width.observe(16);
    width.observe(64);
    width.observe(32);
    Assertions.assertEquals(64, width.get().getAsInt());
  }
}
