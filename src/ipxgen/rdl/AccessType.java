package ipxgen.rdl;

import java.util.Optional;
import java.util.stream.Stream;

/** Software access modes ('sw' property). */
public enum AccessType {
  rw("rw"),
  r("r"),
  w("w"),
  rw1("rw1"),
  w1("w1"),
  na("na");

  public final String serialName;

  private AccessType(String serialName) { this.serialName = serialName; }
  public static Optional<AccessType> fromSerialName(String serialName) {
    return Stream.of(AccessType.values()).filter(accessVal -> accessVal.serialName.equals(serialName)).findAny();
  }
}
