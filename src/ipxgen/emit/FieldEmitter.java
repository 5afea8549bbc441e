package ipxgen.emit;

import ipxgen.rdl.EnumEntry;
import ipxgen.rdl.FieldNode;
import org.w3c.dom.Element;

/**
 * Renders a bit-field as a 'field' element.
 */
public class FieldEmitter {
  private final EmitContext ctx;

  public FieldEmitter(EmitContext ctx) { this.ctx = ctx; }

  public Element emit(Element parent, FieldNode node) {
    Element field = ctx.addElement(parent, "field");

    ctx.addNameGroup(field, node);
    ctx.addIsPresent(field, node);
    ctx.addValue(field, "bitOffset", Integer.toString(node.getLow()));

    if (ctx.standard.hasFieldResets()) {
      node.getReset().ifPresent(reset -> {
        Element resets = ctx.addElement(field, "resets");
        Element resetEl = ctx.addElement(resets, "reset");
        ctx.addValue(resetEl, "value", ctx.standard.hexStr(reset));
      });
    }

    ctx.addValue(field, "bitWidth", Integer.toString(node.getWidth()));

    if (node.isVolatile())
      ctx.addValue(field, "volatile", "true");

    ctx.addValue(field, "access", TypeMaps.accessFromSw(node.getSw()));

    node.getEncode().ifPresent(encode -> {
      Element enumValues = ctx.addElement(field, "enumeratedValues");
      for (EnumEntry entry : encode) {
        Element enumValue = ctx.addElement(enumValues, "enumeratedValue");
        ctx.addNameGroup(enumValue, entry.name(), entry.displayName(), entry.description());
        ctx.addValue(enumValue, "value", ctx.standard.hexStr(entry.value()));
      }
    });

    node.getOnWrite().ifPresent(onwrite -> ctx.addValue(field, "modifiedWriteValue", TypeMaps.mwvFromOnWrite(onwrite)));
    node.getOnRead().ifPresent(onread -> ctx.addValue(field, "readAction", TypeMaps.readActionFromOnRead(onread)));

    if (node.isDontTest())
      ctx.addValue(field, "testable", "false");

    ctx.addVendorExtensions(field, vendorExtensions -> ctx.hooks.fieldVendorExtensions(vendorExtensions, node));
    return field;
  }
}
