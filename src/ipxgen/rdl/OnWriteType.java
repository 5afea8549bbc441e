package ipxgen.rdl;

import java.util.Optional;
import java.util.stream.Stream;

/** Write side-effects of a field ('onwrite' property). */
public enum OnWriteType {
  /** Write one to set */
  woset("woset"),
  /** Write one to clear */
  woclr("woclr"),
  /** Write one to toggle */
  wot("wot"),
  /** Write zero to set */
  wzs("wzs"),
  /** Write zero to clear */
  wzc("wzc"),
  /** Write zero to toggle */
  wzt("wzt"),
  /** Any write clears */
  wclr("wclr"),
  /** Any write sets */
  wset("wset"),
  /** User-defined write behavior */
  wuser("wuser");

  public final String serialName;

  private OnWriteType(String serialName) { this.serialName = serialName; }
  public static Optional<OnWriteType> fromSerialName(String serialName) {
    return Stream.of(OnWriteType.values()).filter(typeVal -> typeVal.serialName.equals(serialName)).findAny();
  }
}
