package ipxgen.rdl;

import java.math.BigInteger;

/**
 * One member of a field encoding ('encode' property).
 * @param name member identifier
 * @param displayName human-readable name, may be null
 * @param description description text, may be null
 * @param value encoded value, not negative
 */
public record EnumEntry(String name, String displayName, String description, BigInteger value) {
  public EnumEntry {
    if (value == null || value.signum() < 0)
      throw new IllegalArgumentException("Value of encoding '" + name + "' must not be negative, got " + value);
  }

  public EnumEntry(String name, String displayName, String description, long value) {
    this(name, displayName, description, BigInteger.valueOf(value));
  }
}
