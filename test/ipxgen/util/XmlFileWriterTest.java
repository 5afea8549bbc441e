package ipxgen.util;

import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.parsers.DocumentBuilderFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

class XmlFileWriterTest {

  @TempDir Path tempDir;

  Document doc;

  @BeforeEach
  void setUp() throws Exception {
    doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
    doc.appendChild(doc.createComment("header"));
    Element root = doc.createElement("a:root");
    root.setAttribute("xmlns:a", "urn:a");
    doc.appendChild(root);
    Element leaf = doc.createElement("a:leaf");
    leaf.appendChild(doc.createTextNode("x < y & \"z\""));
    root.appendChild(leaf);
    Element group = doc.createElement("a:group");
    group.appendChild(doc.createElement("a:empty"));
    root.appendChild(group);
  }

  @Test
  void testLayout() {
    String expected = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                      + "<!--header-->\n"
                      + "<a:root xmlns:a=\"urn:a\">\n"
                      + "  <a:leaf>x &lt; y &amp; &quot;z&quot;</a:leaf>\n"
                      + "  <a:group>\n"
                      + "    <a:empty/>\n"
                      + "  </a:group>\n"
                      + "</a:root>\n";
    Assertions.assertEquals(expected, new XmlFileWriter().toXml(doc));
  }

  @Test
  void testCustomWhitespace() {
    String xml = new XmlFileWriter("\t", "\r\n").toXml(doc);
    Assertions.assertTrue(xml.contains("\r\n\t<a:group>\r\n\t\t<a:empty/>\r\n"), xml);
  }

  @Test
  void testWriteFileCreatesDirectories() throws Exception {
    Path path = tempDir.resolve("sub").resolve("doc.xml");
    XmlFileWriter writer = new XmlFileWriter();
    writer.WriteFile(doc, path);
    Assertions.assertEquals(writer.toXml(doc), Files.readString(path));
  }

  @Test
  void testEscape() {
    Assertions.assertEquals("a&amp;&amp;b &gt; c", XmlFileWriter.Escape("a&&b > c"));
  }
}
