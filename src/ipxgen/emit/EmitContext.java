package ipxgen.emit;

import ipxgen.ExportHooks;
import ipxgen.Standard;
import ipxgen.rdl.RdlNode;
import java.util.function.Consumer;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * State shared by the emitters of one export: the output document, the selected standard and the customization hooks.
 */
public class EmitContext {
  public final Document doc;
  public final Standard standard;
  public final ExportHooks hooks;

  public EmitContext(Document doc, Standard standard, ExportHooks hooks) {
    this.doc = doc;
    this.standard = standard;
    this.hooks = hooks;
  }

  /** Creates an element in the standard's namespace prefix. */
  public Element createElement(String localName) { return doc.createElement(standard.tag(localName)); }

  /** Creates and appends an element. */
  public Element addElement(Element parent, String localName) {
    Element el = createElement(localName);
    parent.appendChild(el);
    return el;
  }

  /** Appends an element holding only text. */
  public Element addValue(Element parent, String localName, String value) {
    Element el = addElement(parent, localName);
    el.appendChild(doc.createTextNode(value));
    return el;
  }

  /** Appends name, and displayName/description where not null. */
  public void addNameGroup(Element parent, String name, String displayName, String description) {
    addValue(parent, "name", name);
    if (displayName != null)
      addValue(parent, "displayName", displayName);
    if (description != null)
      addValue(parent, "description", description);
  }

  /** Name group of a node: hook-provided name, 'name' and 'desc' properties. */
  public void addNameGroup(Element parent, RdlNode node) {
    addNameGroup(parent, hooks.getName(node), node.getProperty("name", (String)null), node.getProperty("desc", (String)null));
  }

  /** Marks the element as not present, if the node is absent and the standard can express it. */
  public void addIsPresent(Element parent, RdlNode node) {
    if (standard.supportsIsPresent() && !node.isPresent())
      addValue(parent, "isPresent", "0");
  }

  /** Lets a hook fill a vendorExtensions element, which is appended only if the hook added content. */
  public void addVendorExtensions(Element parent, Consumer<Element> hook) {
    Element vendorExtensions = createElement("vendorExtensions");
    hook.accept(vendorExtensions);
    if (vendorExtensions.hasChildNodes())
      parent.appendChild(vendorExtensions);
  }
}
