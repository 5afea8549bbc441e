package ipxgen;

import ipxgen.emit.AddressBlockEmitter;
import ipxgen.emit.EmitContext;
import ipxgen.emit.FieldEmitter;
import ipxgen.emit.HierarchyFlattener;
import ipxgen.emit.HierarchyFlattener.Strategy;
import ipxgen.emit.RegisterDataEmitter;
import ipxgen.emit.RegisterEmitter;
import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.AddrmapNode;
import ipxgen.rdl.NodeKind;
import ipxgen.rdl.RdlNode;
import ipxgen.rdl.RootNode;
import ipxgen.ui.IpxactConfig;
import ipxgen.util.XmlFileWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Exports a register model as an IP-XACT component description.
 *
 * Subclasses may override the {@link ExportHooks} methods to rename elements, move offsets or add vendor extensions.
 */
public class IpxactExporter implements ExportHooks {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String GENERATOR_COMMENT = "Generated by ipxgen IP-XACT exporter";

  /** Per-export option: IP-XACT component name, defaults to the top-level node name. */
  public static final String OPT_COMPONENT_NAME = "component_name";

  private final IpxactConfig cfg;

  public IpxactExporter() { this(new IpxactConfig()); }

  /**
   * @param options configuration keys as accepted by {@link IpxactConfig#fromMap(Map)}
   * @throws IllegalArgumentException on unknown keys
   */
  public IpxactExporter(Map<String, ?> options) { this(IpxactConfig.fromMap(options)); }

  public IpxactExporter(IpxactConfig cfg) {
    cfg.validate();
    this.cfg = cfg;
  }

  public void export(RdlNode node, Path path) throws IOException { export(node, path, Map.of()); }

  /**
   * Exports node and writes the document to path. Nothing is written if the export fails.
   *
   * @param node a {@link RootNode} (its top-level node is exported), an addrmap or a mem
   * @param options per-export options; only {@link #OPT_COMPONENT_NAME} is known
   * @throws IllegalArgumentException for a node of the wrong kind, a node outside a {@link RootNode} or unknown options
   * @throws ipxgen.rdl.RdlFatalException if the model cannot be represented in IP-XACT
   */
  public void export(RdlNode node, Path path, Map<String, ?> options) throws IOException {
    Document doc = buildDocument(node, options);
    new XmlFileWriter(cfg.xml_indent, cfg.xml_newline).WriteFile(doc, path);
  }

  /** Like {@link #export(RdlNode, Path, Map)}, but returns the document text instead of writing a file. */
  public String exportToString(RdlNode node, Map<String, ?> options) {
    Document doc = buildDocument(node, options);
    return new XmlFileWriter(cfg.xml_indent, cfg.xml_newline).toXml(doc);
  }

  /**
   * Builds the IP-XACT document for node without serializing it.
   * @see #export(RdlNode, Path, Map)
   */
  public Document buildDocument(RdlNode node, Map<String, ?> options) {
    Optional<String> componentName = Optional.empty();
    for (var entry : options.entrySet()) {
      if (!entry.getKey().equals(OPT_COMPONENT_NAME))
        throw new IllegalArgumentException("got an unexpected keyword argument '" + entry.getKey() + "'");
      componentName = Optional.ofNullable(entry.getValue()).map(Object::toString).filter(name -> !name.isBlank());
    }

    AddressableNode top = resolveTop(node);
    Standard standard = cfg.standard;
    logger.debug("Exporting {} as IP-XACT {}", top.getPath(), standard.year);

    if (top.getKind() == NodeKind.ADDRMAP && ((AddrmapNode)top).isBridge()) {
      top.getMessageHandler().warning(
          "IP-XACT generator does not have proper support for bridge addmaps yet. The 'bridge' property will be ignored.",
          top.getPropertySourceRef("bridge"));
    }

    Document doc = newDocument();
    doc.appendChild(doc.createComment(GENERATOR_COMMENT));

    Element comp = doc.createElement(standard.tag("component"));
    comp.setAttribute("xmlns:" + standard.prefix, standard.namespace);
    comp.setAttribute("xmlns:xsi", Standard.XSI_NAMESPACE);
    comp.setAttribute("xsi:schemaLocation", standard.schemaLocation());
    doc.appendChild(comp);

    EmitContext ctx = new EmitContext(doc, standard, this);
    AddressBlockEmitter addressBlockEmitter =
        new AddressBlockEmitter(ctx, new RegisterDataEmitter(ctx, new RegisterEmitter(ctx, new FieldEmitter(ctx))));

    // versionedIdentifier
    ctx.addValue(comp, "vendor", cfg.vendor);
    ctx.addValue(comp, "library", cfg.library);
    ctx.addValue(comp, "name", componentName.orElse(top.getInstName()));
    ctx.addValue(comp, "version", cfg.version);

    Element mmaps = ctx.addElement(comp, "memoryMaps");
    Element mmap = ctx.addElement(mmaps, "memoryMap");

    Strategy strategy = HierarchyFlattener.choose(top);
    logger.debug("Top-level node {}: {}", top.getInstName(), strategy);
    switch (strategy) {
    case EXPLODE:
      // top-level node becomes the memoryMap
      ctx.addNameGroup(mmap, top.getInstName(), top.getProperty("name", (String)null), top.getProperty("desc", (String)null));
      break;
    case WRAP:
      // dummy memoryMap bearing the top-level node's name
      ctx.addNameGroup(mmap, top.getInstName(), null, null);
      break;
    default:
      throw new IllegalStateException("Unhandled strategy " + strategy);
    }

    for (AddressableNode blockNode : HierarchyFlattener.addressBlockNodes(top, strategy))
      addressBlockEmitter.emit(mmap, blockNode);

    return doc;
  }

  private static AddressableNode resolveTop(RdlNode node) {
    RdlNode top = node;
    if (node.getKind() == NodeKind.ROOT) {
      top = ((RootNode)node).getTop();
      if (top == null)
        throw new IllegalArgumentException("RootNode has no top-level node");
    }
    if (top.getKind() != NodeKind.ADDRMAP && top.getKind() != NodeKind.MEM)
      throw new IllegalArgumentException("'node' argument expects an addrmap or mem node. Got " + top.getKind().serialName);
    // warnings and fatal errors are reported through the root's message handler
    try {
      top.getRoot();
    } catch (IllegalStateException e) {
      throw new IllegalArgumentException("'" + top.getInstName() + "' must belong to a RootNode to be exported", e);
    }
    return (AddressableNode)top;
  }

  private static Document newDocument() {
    try {
      return DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("No XML DOM implementation available", e);
    }
  }
}
