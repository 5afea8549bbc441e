package ipxgen.rdl;

import java.util.Optional;
import java.util.stream.Stream;

/** Read side-effects of a field ('onread' property). */
public enum OnReadType {
  /** Clear on read */
  rclr("rclr"),
  /** Set on read */
  rset("rset"),
  /** User-defined read behavior */
  ruser("ruser");

  public final String serialName;

  private OnReadType(String serialName) { this.serialName = serialName; }
  public static Optional<OnReadType> fromSerialName(String serialName) {
    return Stream.of(OnReadType.values()).filter(typeVal -> typeVal.serialName.equals(serialName)).findAny();
  }
}
