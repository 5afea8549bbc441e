package ipxgen.emit;

import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.NodeKind;
import ipxgen.rdl.RdlNode;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decides how the top-level node is folded into addressBlocks.
 *
 * An addrmap whose addressable children are all non-array addrmaps or mems is exploded: every child becomes its own addressBlock.
 * Anything else is wrapped: the top-level node is exported as a single addressBlock.
 */
public class HierarchyFlattener {
  private HierarchyFlattener() {}

  public enum Strategy {
    /** Each child of the top-level node becomes an addressBlock. */
    EXPLODE,
    /** The top-level node becomes the only addressBlock. */
    WRAP
  }

  public static Strategy choose(AddressableNode top) {
    if (top.getKind() != NodeKind.ADDRMAP)
      return Strategy.WRAP;

    int addrblockableChildren = 0;
    int nonAddrblockableChildren = 0;
    for (AddressableNode child : addressableChildren(top)) {
      if ((child.getKind() == NodeKind.ADDRMAP || child.getKind() == NodeKind.MEM) && !child.isArray())
        addrblockableChildren++;
      else
        nonAddrblockableChildren++;
    }
    return (nonAddrblockableChildren == 0 && addrblockableChildren >= 1) ? Strategy.EXPLODE : Strategy.WRAP;
  }

  /** The nodes to export as addressBlocks, in order. */
  public static List<AddressableNode> addressBlockNodes(AddressableNode top, Strategy strategy) {
    switch (strategy) {
    case EXPLODE:
      return addressableChildren(top);
    case WRAP:
      return List.of(top);
    default:
      throw new IllegalStateException("Unhandled strategy " + strategy);
    }
  }

  /** Addressable children including absent ones, in source order. */
  static List<AddressableNode> addressableChildren(RdlNode node) {
    return node.children(false)
        .stream()
        .filter(child -> child.getKind().isAddressable())
        .map(child -> (AddressableNode)child)
        .collect(Collectors.toList());
  }
}
