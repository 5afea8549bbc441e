package ipxgen.emit;

import java.util.OptionalInt;

/**
 * Widest register seen below one addressBlock. A fresh tracker is created for every addressBlock.
 */
public class WidthTracker {
  private OptionalInt maxWidth = OptionalInt.empty();

  public void observe(int regwidth) {
    if (maxWidth.isEmpty() || regwidth > maxWidth.getAsInt())
      maxWidth = OptionalInt.of(regwidth);
  }

  /** Widest register width, empty if no register was observed. */
  public OptionalInt get() { return maxWidth; }
}
