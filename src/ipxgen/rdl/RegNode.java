package ipxgen.rdl;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Register. Properties: "regwidth" (Integer, bits).
 */
public class RegNode extends AddressableNode {

  public RegNode(String instName, long addressOffset, int regwidth) {
    super(instName, addressOffset);
    if (regwidth < 8 || Integer.bitCount(regwidth) != 1)
      throw new IllegalArgumentException("regwidth of '" + instName + "' must be a power of two and at least 8, got " + regwidth);
    setProperty("regwidth", regwidth);
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.REG;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return kind == NodeKind.FIELD;
  }

  public int getRegWidth() { return getProperty("regwidth", 32); }

  @Override
  public long getSize() {
    return getRegWidth() / 8;
  }

  public FieldNode addField(FieldNode field) {
    if (field.getHigh() >= getRegWidth())
      throw new IllegalArgumentException("Field '" + field.getInstName() + "' does not fit into the " + getRegWidth() + "-bit register '" +
                                         getInstName() + "'");
    return addChild(field);
  }

  /** Fields in declaration order. */
  public List<FieldNode> fields(boolean skipNotPresent) {
    return children(skipNotPresent).stream().map(child -> (FieldNode)child).collect(Collectors.toList());
  }
}
