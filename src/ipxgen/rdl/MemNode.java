package ipxgen.rdl;

/**
 * Raw memory region of mementries words, memwidth bits each. Properties: "sw" ({@link AccessType}, default rw), "memwidth",
 * "mementries".
 */
public class MemNode extends AddressableNode {

  public MemNode(String instName, long addressOffset, long mementries, int memwidth) {
    super(instName, addressOffset);
    if (mementries <= 0 || memwidth <= 0 || memwidth % 8 != 0)
      throw new IllegalArgumentException("mem '" + instName + "' needs positive mementries and a byte-multiple memwidth");
    setProperty("mementries", mementries);
    setProperty("memwidth", memwidth);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.MEM;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return kind == NodeKind.REG;
  }

  public int getMemWidth() { return getProperty("memwidth", 32); }

  public long getMemEntries() { return getProperty("mementries", 1L); }

  public AccessType getSw() { return getProperty("sw", AccessType.rw); }

  @Override
  public long getSize() {
    return getMemEntries() * (getMemWidth() / 8);
  }
}
