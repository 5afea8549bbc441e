package ipxgen.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/*
 * Class for writing XML documents.
 */
public class XmlFileWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public String tab = "  ";
  public String newline = "\n";

  public XmlFileWriter() {}

  public XmlFileWriter(String tab, String newline) {
    this.tab = tab;
    this.newline = newline;
  }

  /**
   * Serializes the document. Elements that only hold text are written on one line, elements without content as empty-element tags,
   * and every other node starts a new line indented by one tab per nesting level.
   */
  public String toXml(Document doc) {
    StringBuilder out = new StringBuilder();
    out.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>").append(newline);
    NodeList children = doc.getChildNodes();
    for (int i = 0; i < children.getLength(); i++)
      WriteNode(out, children.item(i), "");
    return out.toString();
  }

  /**
   * Writes the document to a file in one go, UTF-8 encoded. Missing parent directories are created.
   */
  public void WriteFile(Document doc, Path path) throws IOException {
    String content = toXml(doc);
    Path parentDir = path.toAbsolutePath().getParent();
    if (parentDir != null)
      Files.createDirectories(parentDir);
    logger.info("Writing " + path);
    Files.writeString(path, content, StandardCharsets.UTF_8);
  }

  private void WriteNode(StringBuilder out, Node node, String indent) {
    switch (node.getNodeType()) {
    case Node.COMMENT_NODE:
      out.append(indent).append("<!--").append(node.getNodeValue()).append("-->").append(newline);
      break;
    case Node.TEXT_NODE:
      out.append(indent).append(Escape(node.getNodeValue())).append(newline);
      break;
    case Node.ELEMENT_NODE:
      WriteElement(out, (Element)node, indent);
      break;
    default:
      logger.warn("Skipping unsupported XML node type {}", node.getNodeType());
    }
  }

  private void WriteElement(StringBuilder out, Element element, String indent) {
    out.append(indent).append('<').append(element.getTagName());
    NamedNodeMap attributes = element.getAttributes();
    for (int i = 0; i < attributes.getLength(); i++) {
      Node attr = attributes.item(i);
      out.append(' ').append(attr.getNodeName()).append("=\"").append(Escape(attr.getNodeValue())).append('"');
    }

    NodeList children = element.getChildNodes();
    if (children.getLength() == 0) {
      out.append("/>").append(newline);
      return;
    }
    out.append('>');
    if (children.getLength() == 1 && children.item(0).getNodeType() == Node.TEXT_NODE) {
      out.append(Escape(children.item(0).getNodeValue()));
    } else {
      out.append(newline);
      for (int i = 0; i < children.getLength(); i++)
        WriteNode(out, children.item(i), indent + tab);
      out.append(indent);
    }
    out.append("</").append(element.getTagName()).append('>').append(newline);
  }

  static String Escape(String text) {
    return text.replace("&", "&amp;").replace("<", "&lt;").replace("\"", "&quot;").replace(">", "&gt;");
  }
}
