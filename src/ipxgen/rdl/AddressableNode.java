package ipxgen.rdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node that occupies an address range. Array nodes stand for all of their elements; address and size refer to the first element.
 */
public abstract class AddressableNode extends RdlNode {
  private final long addressOffset;
  private List<Integer> arrayDimensions = Collections.emptyList();
  private long arrayStride = -1;

  protected AddressableNode(String instName, long addressOffset) {
    super(instName);
    if (addressOffset < 0)
      throw new IllegalArgumentException("addressOffset must not be negative");
    this.addressOffset = addressOffset;
  }

  /** Byte size of one element. */
  public abstract long getSize();

  /**
   * Turns this node into an array.
   * @param stride byte distance between consecutive elements
   * @param dimensions one entry per array dimension, outermost first
   */
  public AddressableNode setArray(long stride, int... dimensions) {
    if (dimensions.length == 0)
      throw new IllegalArgumentException("An array needs at least one dimension");
    List<Integer> dims = new ArrayList<>(dimensions.length);
    for (int dim : dimensions) {
      if (dim <= 0)
        throw new IllegalArgumentException("Array dimensions must be positive");
      dims.add(dim);
    }
    this.arrayDimensions = Collections.unmodifiableList(dims);
    this.arrayStride = stride;
    return this;
  }

  public boolean isArray() { return !arrayDimensions.isEmpty(); }

  @Override
  protected boolean isArrayNode() {
    return isArray();
  }

  public List<Integer> getArrayDimensions() { return arrayDimensions; }

  /** Byte distance between array elements; the element size for arrays declared without an explicit stride. */
  public long getArrayStride() { return (arrayStride < 0) ? getSize() : arrayStride; }

  /** Number of elements, 1 for non-arrays. */
  public long getElementCount() {
    long count = 1;
    for (int dim : arrayDimensions)
      count *= dim;
    return count;
  }

  /** Bytes covered by all array elements. */
  public long getTotalSize() {
    if (!isArray())
      return getSize();
    return getArrayStride() * (getElementCount() - 1) + getSize();
  }

  /** Offset relative to the parent node. */
  public long getRawAddressOffset() { return addressOffset; }

  public long getAbsoluteAddress() {
    RdlNode parent = getParent();
    if (parent != null && parent.getKind().isAddressable())
      return ((AddressableNode)parent).getAbsoluteAddress() + addressOffset;
    return addressOffset;
  }

  /** End of the furthest addressable child, relative to this node. */
  protected long getChildrenExtent() {
    long extent = 0;
    for (RdlNode child : children(false)) {
      if (!child.getKind().isAddressable())
        continue;
      AddressableNode addrChild = (AddressableNode)child;
      extent = Math.max(extent, addrChild.getRawAddressOffset() + addrChild.getTotalSize());
    }
    return extent;
  }
}
