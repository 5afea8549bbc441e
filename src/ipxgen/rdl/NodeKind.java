package ipxgen.rdl;

import java.util.Optional;
import java.util.stream.Stream;

/**
 * The closed set of node kinds in a register model.
 */
public enum NodeKind {
  /** Conceptual root of an elaborated model; holds the top-level node. */
  ROOT("root"),
  /** Address map, a named address space that may contain any addressable node. */
  ADDRMAP("addrmap"),
  /** Register file, a group of registers and nested register files. */
  REGFILE("regfile"),
  /** Raw memory region. */
  MEM("mem"),
  /** Register. */
  REG("reg"),
  /** Bit-field of a register. */
  FIELD("field");

  public final String serialName;

  private NodeKind(String serialName) { this.serialName = serialName; }
  public static Optional<NodeKind> fromSerialName(String serialName) {
    return Stream.of(NodeKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }

  /** True for the kinds that occupy an address range. */
  public boolean isAddressable() { return this == ADDRMAP || this == REGFILE || this == MEM || this == REG; }
}
