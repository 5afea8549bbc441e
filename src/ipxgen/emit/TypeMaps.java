package ipxgen.emit;

import ipxgen.rdl.AccessType;
import ipxgen.rdl.OnReadType;
import ipxgen.rdl.OnWriteType;

/**
 * Translation of register model property values into the IP-XACT vocabulary.
 */
public class TypeMaps {
  private TypeMaps() {}

  /** Value of the 'access' element for a software access mode. */
  public static String accessFromSw(AccessType sw) {
    switch (sw) {
    case r:
      return "read-only";
    case w:
      return "write-only";
    case rw1:
      return "read-writeOnce";
    case w1:
      return "writeOnce";
    case rw:
    default:
      return "read-write";
    }
  }

  /** Value of the 'modifiedWriteValue' element for a write side-effect. */
  public static String mwvFromOnWrite(OnWriteType onwrite) {
    switch (onwrite) {
    case woset:
      return "oneToSet";
    case woclr:
      return "oneToClear";
    case wot:
      return "oneToToggle";
    case wzs:
      return "zeroToSet";
    case wzc:
      return "zeroToClear";
    case wzt:
      return "zeroToToggle";
    case wclr:
      return "clear";
    case wset:
      return "set";
    case wuser:
    default:
      return "modify";
    }
  }

  /** Value of the 'readAction' element for a read side-effect. */
  public static String readActionFromOnRead(OnReadType onread) {
    switch (onread) {
    case rclr:
      return "clear";
    case rset:
      return "set";
    case ruser:
    default:
      return "modify";
    }
  }
}
