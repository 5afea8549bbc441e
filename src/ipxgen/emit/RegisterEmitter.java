package ipxgen.emit;

import ipxgen.rdl.FieldNode;
import ipxgen.rdl.RegNode;
import java.math.BigInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Renders a register as a 'register' element and delegates its fields to the {@link FieldEmitter}.
 */
public class RegisterEmitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final EmitContext ctx;
  private final FieldEmitter fieldEmitter;

  public RegisterEmitter(EmitContext ctx, FieldEmitter fieldEmitter) {
    this.ctx = ctx;
    this.fieldEmitter = fieldEmitter;
  }

  public Element emit(Element parent, RegNode node, WidthTracker width) {
    logger.trace("Emitting register {}", node.getPath());
    Element register = ctx.addElement(parent, "register");

    ctx.addNameGroup(register, node);
    ctx.addIsPresent(register, node);

    if (node.isArray()) {
      // dim + size cannot express a gap between elements
      if (node.getArrayStride() != node.getRegWidth() / 8) {
        node.getMessageHandler().fatal("IP-XACT does not support register arrays whose stride is larger then the register's size",
                                       node.getSourceRef());
      }
      for (int dim : node.getArrayDimensions())
        ctx.addValue(register, "dim", Integer.toString(dim));
    }

    ctx.addValue(register, "addressOffset", ctx.standard.hexStr(ctx.hooks.getRegAddrOffset(node)));
    ctx.addValue(register, "size", Integer.toString(node.getRegWidth()));
    width.observe(node.getRegWidth());

    if (!ctx.standard.hasFieldResets())
      addAggregateReset(register, node);

    for (FieldNode field : node.fields(false))
      fieldEmitter.emit(register, field);

    ctx.addVendorExtensions(register, vendorExtensions -> ctx.hooks.registerVendorExtensions(vendorExtensions, node));
    return register;
  }

  /**
   * Folds the field resets into one register-wide value/mask pair. Fields without a reset leave their bits out of the mask.
   */
  private void addAggregateReset(Element register, RegNode node) {
    BigInteger reset = BigInteger.ZERO;
    BigInteger mask = BigInteger.ZERO;
    for (FieldNode field : node.fields(false)) {
      if (field.getReset().isEmpty())
        continue;
      BigInteger fieldMask = BigInteger.ONE.shiftLeft(field.getWidth()).subtract(BigInteger.ONE).shiftLeft(field.getLow());
      BigInteger fieldReset = field.getReset().get().shiftLeft(field.getLow()).and(fieldMask);
      reset = reset.or(fieldReset);
      mask = mask.or(fieldMask);
    }

    if (mask.signum() != 0) {
      Element resetEl = ctx.addElement(register, "reset");
      ctx.addValue(resetEl, "value", ctx.standard.hexStr(reset));
      ctx.addValue(resetEl, "mask", ctx.standard.hexStr(mask));
    }
  }
}
