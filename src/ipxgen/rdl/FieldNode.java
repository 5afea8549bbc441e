package ipxgen.rdl;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

/**
 * Bit-field of a register.
 *
 * Properties: "sw" ({@link AccessType}, default rw), "reset" (BigInteger or any integral Number), "encode" (List of {@link EnumEntry}), "onwrite"
 * ({@link OnWriteType}), "onread" ({@link OnReadType}), "volatile" (Boolean), "donttest" (Boolean).
 */
public class FieldNode extends RdlNode {
  private final int lsb;
  private final int msb;

  /** Bit positions may be given in either order; msb &lt; lsb declares a field with reversed bit ordering. */
  public FieldNode(String instName, int lsb, int msb) {
    super(instName);
    if (lsb < 0 || msb < 0)
      throw new IllegalArgumentException("Bit positions of field '" + instName + "' must not be negative");
    this.lsb = lsb;
    this.msb = msb;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.FIELD;
  }

  @Override
  protected boolean canContain(NodeKind kind) {
    return false;
  }

  public int getLsb() { return lsb; }

  public int getLow() { return Math.min(lsb, msb); }

  public int getHigh() { return Math.max(lsb, msb); }

  public int getWidth() { return getHigh() - getLow() + 1; }

  public boolean isVolatile() { return getProperty("volatile", Boolean.FALSE); }

  public AccessType getSw() { return getProperty("sw", AccessType.rw); }

  /**
   * @throws IllegalArgumentException if the assigned reset is negative
   */
  public Optional<BigInteger> getReset() {
    Object reset = getProperty("reset");
    if (reset == null)
      return Optional.empty();
    BigInteger value = (reset instanceof BigInteger) ? (BigInteger)reset : BigInteger.valueOf(((Number)reset).longValue());
    if (value.signum() < 0)
      throw new IllegalArgumentException("Reset of field '" + getPath() + "' must not be negative, got " + value);
    return Optional.of(value);
  }

  @SuppressWarnings("unchecked")
  public Optional<List<EnumEntry>> getEncode() { return Optional.ofNullable((List<EnumEntry>)getProperty("encode")); }

  public Optional<OnWriteType> getOnWrite() { return Optional.ofNullable(getProperty("onwrite", (OnWriteType)null)); }

  public Optional<OnReadType> getOnRead() { return Optional.ofNullable(getProperty("onread", (OnReadType)null)); }

  public boolean isDontTest() { return getProperty("donttest", Boolean.FALSE); }
}
