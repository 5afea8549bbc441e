package ipxgen.rdl;

/**
 * Address map. Properties: "bridge" (Boolean).
 */
public class AddrmapNode extends AddressableNode {
  private long explicitSize = -1;

  public AddrmapNode(String instName) { this(instName, 0); }

  public AddrmapNode(String instName, long addressOffset) { super(instName, addressOffset); }

  @Override
  public NodeKind getKind() {
    return NodeKind.ADDRMAP;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return kind == NodeKind.ADDRMAP || kind == NodeKind.REGFILE || kind == NodeKind.MEM || kind == NodeKind.REG;
  }

  /** Fixes the size instead of deriving it from the children. */
  public AddrmapNode setSize(long size) {
    this.explicitSize = size;
    return this;
  }

  @Override
  public long getSize() {
    return (explicitSize >= 0) ? explicitSize : getChildrenExtent();
  }

  public boolean isBridge() { return getProperty("bridge", Boolean.FALSE); }
}
