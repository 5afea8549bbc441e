package ipxgen.rdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class of all register model nodes. Nodes form a tree with a {@link RootNode} on top; each node carries a set of named properties.
 *
 * Properties used by the exporter:
 * <ul>
 * <li>"name" (String): display name</li>
 * <li>"desc" (String): description</li>
 * <li>"ispresent" (Boolean): false if the node is declared but not implemented</li>
 * </ul>
 * Kind-specific properties are listed on the subclasses.
 */
public abstract class RdlNode {
  private final String instName;
  private RdlNode parent = null;
  private final List<RdlNode> children = new ArrayList<>();
  private final HashMap<String, Object> properties = new HashMap<>();
  private final HashMap<String, SourceRef> propertySrcRefs = new HashMap<>();
  private SourceRef instSrcRef = SourceRef.UNKNOWN;

  protected RdlNode(String instName) {
    if (instName == null || instName.isEmpty())
      throw new IllegalArgumentException("instName must not be empty");
    this.instName = instName;
  }

  public abstract NodeKind getKind();

  /** Whether a node of the given kind may be added as a child of this node. */
  protected abstract boolean canContain(NodeKind kind);

  public String getInstName() { return instName; }

  public RdlNode getParent() { return parent; }

  /**
   * Appends a child node.
   * @return the child, for chaining
   */
  public <T extends RdlNode> T addChild(T child) {
    if (!canContain(child.getKind()))
      throw new IllegalArgumentException(getKind().serialName + " '" + instName + "' cannot contain a " + child.getKind().serialName);
    RdlNode node = child;
    if (node.parent != null)
      throw new IllegalArgumentException("'" + node.instName + "' already has a parent");
    node.parent = this;
    children.add(node);
    return child;
  }

  /**
   * Returns the direct children in declaration order.
   * @param skipNotPresent if set, children with ispresent=false are left out
   */
  public List<RdlNode> children(boolean skipNotPresent) {
    if (!skipNotPresent)
      return Collections.unmodifiableList(children);
    return children.stream().filter(child -> child.isPresent()).collect(Collectors.toList());
  }

  public RdlNode setProperty(String name, Object value) {
    properties.put(name, value);
    return this;
  }

  public RdlNode setProperty(String name, Object value, SourceRef srcRef) {
    propertySrcRefs.put(name, srcRef);
    return setProperty(name, value);
  }

  /** Returns the property value, or null if it was never assigned. */
  public Object getProperty(String name) { return properties.get(name); }

  /**
   * Returns the property value, or defaultValue if the property was never assigned.
   * @throws ClassCastException if the assigned value does not have the type of defaultValue
   */
  @SuppressWarnings("unchecked")
  public <T> T getProperty(String name, T defaultValue) {
    Object value = properties.get(name);
    if (value == null)
      return defaultValue;
    return (T)value;
  }

  public boolean isPresent() { return getProperty("ispresent", Boolean.TRUE); }

  /** Hierarchical path, e.g. "top.block.CTRL[]". */
  public String getPath() {
    String ownName = instName + (isArrayNode() ? "[]" : "");
    if (parent == null || parent.getKind() == NodeKind.ROOT)
      return ownName;
    return parent.getPath() + "." + ownName;
  }

  protected boolean isArrayNode() { return false; }

  public RootNode getRoot() {
    RdlNode node = this;
    while (node.parent != null)
      node = node.parent;
    if (node.getKind() != NodeKind.ROOT)
      throw new IllegalStateException("'" + instName + "' is not attached to a RootNode");
    return (RootNode)node;
  }

  public MessageHandler getMessageHandler() { return getRoot().getMessageHandler(); }

  public SourceRef getSourceRef() { return instSrcRef; }

  public void setSourceRef(SourceRef instSrcRef) { this.instSrcRef = instSrcRef; }

  /** Location of the property assignment, falling back to the location of the node itself. */
  public SourceRef getPropertySourceRef(String name) { return propertySrcRefs.getOrDefault(name, instSrcRef); }

  @Override
  public String toString() {
    return getKind().serialName + " " + getPath();
  }
}
