package ipxgen.rdl;

/**
 * Conceptual root of a register model. Owns the message handler and exactly one top-level node.
 */
public class RootNode extends RdlNode {
  private final MessageHandler msg;

  public RootNode() { this(new MessageHandler()); }

  public RootNode(MessageHandler msg) {
    super("$root");
    this.msg = msg;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ROOT;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return (kind == NodeKind.ADDRMAP || kind == NodeKind.MEM) && children(false).isEmpty();
  }

  /** Installs the top-level node. */
  public <T extends AddressableNode> T setTop(T top) { return addChild(top); }

  /** The top-level node, or null if none was set. */
  public AddressableNode getTop() {
    var children = children(false);
    return children.isEmpty() ? null : (AddressableNode)children.get(0);
  }

  @Override
  public MessageHandler getMessageHandler() {
    return msg;
  }

  @Override
  public RootNode getRoot() {
    return this;
  }

  @Override
  public String getPath() {
    return "";
  }
}
