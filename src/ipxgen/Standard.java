package ipxgen;

import java.math.BigInteger;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Supported IP-XACT standards. Every dialect-dependent decision of the exporter is a lookup on this enum.
 */
public enum Standard {
  /** SPIRIT IP-XACT, IEEE Std. 1685-2009 */
  IEEE_1685_2009(2009, "spirit", "http://www.spiritconsortium.org/XMLSchema/SPIRIT/1685-2009", "0x", false, false,
                 RegisterOrder.REGISTERS_FIRST),
  /** IP-XACT, IEEE Std. 1685-2014 */
  IEEE_1685_2014(2014, "ipxact", "http://www.accellera.org/XMLSchema/IPXACT/1685-2014", "'h", true, true, RegisterOrder.INTERLEAVED);

  /** How registers and register files may be ordered within one container. */
  public enum RegisterOrder {
    /** Source order, registers and register files mixed. */
    INTERLEAVED,
    /** All registers first, then all register files, each in source order. */
    REGISTERS_FIRST
  }

  public static final Standard DEFAULT = IEEE_1685_2014;
  public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

  public final int year;
  public final String prefix;
  public final String namespace;
  private final String hexPrefix;
  private final boolean supportsIsPresent;
  private final boolean hasFieldResets;
  private final RegisterOrder registerOrder;

  private Standard(int year, String prefix, String namespace, String hexPrefix, boolean supportsIsPresent, boolean hasFieldResets,
                   RegisterOrder registerOrder) {
    this.year = year;
    this.prefix = prefix;
    this.namespace = namespace;
    this.hexPrefix = hexPrefix;
    this.supportsIsPresent = supportsIsPresent;
    this.hasFieldResets = hasFieldResets;
    this.registerOrder = registerOrder;
  }

  /**
   * Looks up a standard by year ("2014"), IEEE number ("1685-2014") or constant name ("IEEE_1685_2014").
   */
  public static Optional<Standard> fromSerialName(String serialName) {
    String trimmed = serialName.trim();
    return Stream.of(Standard.values())
        .filter(standardVal
                -> standardVal.name().equals(trimmed) || Integer.toString(standardVal.year).equals(trimmed) ||
                       ("1685-" + standardVal.year).equals(trimmed))
        .findAny();
  }

  /** Qualified element name, e.g. "ipxact:register". */
  public String tag(String localName) { return prefix + ":" + localName; }

  public String schemaLocation() { return namespace + " " + namespace + "/index.xsd"; }

  public String hexStr(long value) { return hexStr(BigInteger.valueOf(value)); }

  /**
   * Formats a value as a hex literal of this standard.
   * @throws IllegalArgumentException for negative values
   */
  public String hexStr(BigInteger value) {
    if (value.signum() < 0)
      throw new IllegalArgumentException("Cannot write negative value " + value + " as an IP-XACT hex literal");
    return hexPrefix + value.toString(16);
  }

  /** Whether isPresent can mark absent elements. */
  public boolean supportsIsPresent() { return supportsIsPresent; }

  /** Whether resets are declared per field (else: one value/mask pair per register). */
  public boolean hasFieldResets() { return hasFieldResets; }

  public RegisterOrder getRegisterOrder() { return registerOrder; }
}
