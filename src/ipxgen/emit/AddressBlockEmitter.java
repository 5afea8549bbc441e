package ipxgen.emit;

import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.MemNode;
import ipxgen.rdl.NodeKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Element;

/**
 * Renders an addrmap or mem as an 'addressBlock' element.
 *
 * IP-XACT only declares a bus width per addressBlock while the register model declares it per register. The width element is reserved
 * up front and filled once the subtree is done: the widest register, else the mem word width, else 32.
 */
public class AddressBlockEmitter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_WIDTH = 32;

  private final EmitContext ctx;
  private final RegisterDataEmitter registerDataEmitter;

  public AddressBlockEmitter(EmitContext ctx, RegisterDataEmitter registerDataEmitter) {
    this.ctx = ctx;
    this.registerDataEmitter = registerDataEmitter;
  }

  public Element emit(Element parent, AddressableNode node) {
    WidthTracker width = new WidthTracker();

    Element addressBlock = ctx.addElement(parent, "addressBlock");

    ctx.addNameGroup(addressBlock, node);
    ctx.addIsPresent(addressBlock, node);
    ctx.addValue(addressBlock, "baseAddress", ctx.standard.hexStr(node.getAbsoluteAddress()));
    ctx.addValue(addressBlock, "range", ctx.standard.hexStr(node.getSize()));

    Element widthEl = ctx.addElement(addressBlock, "width");

    boolean isMem = node.getKind() == NodeKind.MEM;
    if (isMem) {
      ctx.addValue(addressBlock, "usage", "memory");
      ctx.addValue(addressBlock, "access", TypeMaps.accessFromSw(((MemNode)node).getSw()));
    }

    registerDataEmitter.emit(addressBlock, node, width);

    int resolvedWidth = width.get().orElse(isMem ? ((MemNode)node).getMemWidth() : DEFAULT_WIDTH);
    widthEl.appendChild(ctx.doc.createTextNode(Integer.toString(resolvedWidth)));
    logger.debug("addressBlock {}: width {}", node.getPath(), resolvedWidth);

    ctx.addVendorExtensions(addressBlock, vendorExtensions -> ctx.hooks.addressBlockVendorExtensions(vendorExtensions, node));
    return addressBlock;
  }
}
