package ipxgen;

import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.FieldNode;
import ipxgen.rdl.RdlNode;
import ipxgen.rdl.RegNode;
import org.w3c.dom.Element;

/**
 * Customization points of the exporter. Override in a subclass of {@link IpxactExporter}.
 *
 * The vendorExtensions hooks receive an empty vendorExtensions element; it is only added to the document if the hook appended
 * something to it.
 */
public interface ExportHooks {
  /** Name written to the 'name' element of the node. */
  default String getName(RdlNode node) { return node.getInstName(); }

  /** Value of the register's addressOffset element. */
  default long getRegAddrOffset(AddressableNode node) { return node.getRawAddressOffset(); }

  /** Value of the register file's addressOffset element. */
  default long getRegfileAddrOffset(AddressableNode node) { return node.getRawAddressOffset(); }

  default void addressBlockVendorExtensions(Element parent, AddressableNode node) {}

  default void registerFileVendorExtensions(Element parent, AddressableNode node) {}

  default void registerVendorExtensions(Element parent, RegNode node) {}

  default void fieldVendorExtensions(Element parent, FieldNode node) {}
}
