package ipxgen.rdl;

public class RegfileNode extends AddressableNode {
  private long explicitSize = -1;

  public RegfileNode(String instName) { this(instName, 0); }

  public RegfileNode(String instName, long addressOffset) { super(instName, addressOffset); }

  @Override
  public NodeKind getKind() {
    return NodeKind.REGFILE;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return kind == NodeKind.REGFILE || kind == NodeKind.REG;
  }

  public RegfileNode setSize(long size) {
    this.explicitSize = size;
    return this;
  }

  @Override
  public long getSize() {
    return (explicitSize >= 0) ? explicitSize : getChildrenExtent();
  }
}
