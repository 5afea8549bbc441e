package ipxgen.emit;

import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.NodeKind;
import ipxgen.rdl.RdlNode;
import ipxgen.rdl.RegNode;
import org.w3c.dom.Element;

/**
 * Renders the register content of an addressBlock or registerFile: registers, nested register files and (dropped) nested memories.
 */
public class RegisterDataEmitter {
  private final EmitContext ctx;
  private final RegisterEmitter registerEmitter;

  public RegisterDataEmitter(EmitContext ctx, RegisterEmitter registerEmitter) {
    this.ctx = ctx;
    this.registerEmitter = registerEmitter;
  }

  /**
   * Emits the children of node into parent, in the order the standard allows.
   */
  public void emit(Element parent, RdlNode node, WidthTracker width) {
    switch (ctx.standard.getRegisterOrder()) {
    case INTERLEAVED:
      for (RdlNode child : node.children(false)) {
        switch (child.getKind()) {
        case REG:
          registerEmitter.emit(parent, (RegNode)child, width);
          break;
        case ADDRMAP:
        case REGFILE:
          emitRegisterFile(parent, (AddressableNode)child, width);
          break;
        case MEM:
          discardNestedMem(child);
          break;
        default:
          break;
        }
      }
      break;
    case REGISTERS_FIRST:
      for (RdlNode child : node.children(false)) {
        if (child.getKind() == NodeKind.REG)
          registerEmitter.emit(parent, (RegNode)child, width);
      }
      for (RdlNode child : node.children(false)) {
        switch (child.getKind()) {
        case ADDRMAP:
        case REGFILE:
          emitRegisterFile(parent, (AddressableNode)child, width);
          break;
        case MEM:
          discardNestedMem(child);
          break;
        default:
          break;
        }
      }
      break;
    default:
      node.getMessageHandler().fatal("Unsupported register ordering " + ctx.standard.getRegisterOrder(), node.getSourceRef());
    }
  }

  /** Renders a nested addrmap or regfile as a 'registerFile' element. */
  Element emitRegisterFile(Element parent, AddressableNode node, WidthTracker width) {
    Element registerFile = ctx.addElement(parent, "registerFile");

    ctx.addNameGroup(registerFile, node);
    ctx.addIsPresent(registerFile, node);

    if (node.isArray()) {
      for (int dim : node.getArrayDimensions())
        ctx.addValue(registerFile, "dim", Integer.toString(dim));
    }

    ctx.addValue(registerFile, "addressOffset", ctx.standard.hexStr(ctx.hooks.getRegfileAddrOffset(node)));

    // For arrays, range also defines the increment between elements
    long range = node.isArray() ? node.getArrayStride() : node.getSize();
    ctx.addValue(registerFile, "range", ctx.standard.hexStr(range));

    emit(registerFile, node, width);

    ctx.addVendorExtensions(registerFile, vendorExtensions -> ctx.hooks.registerFileVendorExtensions(vendorExtensions, node));
    return registerFile;
  }

  private void discardNestedMem(RdlNode child) {
    child.getMessageHandler().warning("IP-XACT does not support 'mem' nodes that are nested in hierarchy. Discarding '" +
                                          child.getPath() + "'",
                                      child.getSourceRef());
  }
}
