package ipxgen.rdl;

import java.io.File;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RdlYamlReaderTest {

  static final String SOC_YAML = """
      top:
        type: addrmap
        name: soc
        desc: Example SoC
        children:
          - type: reg
            name: CTRL
            fields:
              - {name: EN, sw: rw, reset: 1}
              - name: MODE
                width: 2
                sw: r
                onread: rclr
                encode:
                  - {name: SLOW, value: 0}
                  - {name: FAST, name_display: Fast mode, value: 0x2}
              - {name: IRQ, lsb: 8, onwrite: woclr, volatile: true}
          - type: reg
            name: STATUS
            regwidth: 16
            ispresent: false
          - type: regfile
            name: chan
            offset: 0x10
            dims: [4]
            stride: 0x10
            children:
              - {type: reg, name: CFG}
              - {type: reg, name: DATA}
          - {type: reg, name: TAIL}
          - type: mem
            name: ram
            offset: 0x1000
            mementries: 256
            sw: r
      """;

  @TempDir Path tempDir;

  private static RootNode read(String yaml) throws RdlFormatException { return new RdlYamlReader().read(yaml, "model.yaml"); }

  private static List<String> childNames(RdlNode node) {
    return node.children(false).stream().map(RdlNode::getInstName).collect(Collectors.toList());
  }

  @Test
  void testReadHierarchy() throws RdlFormatException {
    RootNode root = read(SOC_YAML);
    AddressableNode top = root.getTop();
    Assertions.assertEquals(NodeKind.ADDRMAP, top.getKind());
    Assertions.assertEquals("soc", top.getInstName());
    Assertions.assertEquals("Example SoC", top.getProperty("desc"));
    Assertions.assertEquals(List.of("CTRL", "STATUS", "chan", "TAIL", "ram"), childNames(top));

    var children = top.children(false);
    RegNode ctrl = (RegNode)children.get(0);
    RegNode status = (RegNode)children.get(1);
    RegfileNode chan = (RegfileNode)children.get(2);
    RegNode tail = (RegNode)children.get(3);
    MemNode ram = (MemNode)children.get(4);

    // offsets are packed after the previous sibling unless given
    Assertions.assertEquals(0x0, ctrl.getRawAddressOffset());
    Assertions.assertEquals(0x4, status.getRawAddressOffset());
    Assertions.assertEquals(0x10, chan.getRawAddressOffset());
    Assertions.assertEquals(0x48, tail.getRawAddressOffset());
    Assertions.assertEquals(0x1000, ram.getRawAddressOffset());

    Assertions.assertEquals(16, status.getRegWidth());
    Assertions.assertFalse(status.isPresent());

    Assertions.assertEquals(List.of(4), chan.getArrayDimensions());
    Assertions.assertEquals(0x10, chan.getArrayStride());
    Assertions.assertEquals(8, chan.getSize());
    Assertions.assertEquals(0x14, ((RegNode)chan.children(false).get(1)).getAbsoluteAddress());

    Assertions.assertEquals(32, ram.getMemWidth());
    Assertions.assertEquals(1024, ram.getSize());
    Assertions.assertEquals(AccessType.r, ram.getSw());
  }

  @Test
  void testReadFields() throws RdlFormatException {
    RegNode ctrl = (RegNode)read(SOC_YAML).getTop().children(false).get(0);
    List<FieldNode> fields = ctrl.fields(false);
    Assertions.assertEquals(3, fields.size());

    FieldNode en = fields.get(0);
    Assertions.assertEquals(0, en.getLow());
    Assertions.assertEquals(1, en.getWidth());
    Assertions.assertEquals(BigInteger.ONE, en.getReset().get());
    Assertions.assertEquals(AccessType.rw, en.getSw());

    FieldNode mode = fields.get(1);
    Assertions.assertEquals(1, mode.getLow());
    Assertions.assertEquals(2, mode.getHigh());
    Assertions.assertEquals(AccessType.r, mode.getSw());
    Assertions.assertEquals(OnReadType.rclr, mode.getOnRead().get());
    Assertions.assertTrue(mode.getReset().isEmpty());
    Assertions.assertEquals(List.of(new EnumEntry("SLOW", null, null, 0), new EnumEntry("FAST", "Fast mode", null, 2)),
                            mode.getEncode().get());

    FieldNode irq = fields.get(2);
    Assertions.assertEquals(8, irq.getLow());
    Assertions.assertEquals(8, irq.getHigh());
    Assertions.assertEquals(OnWriteType.woclr, irq.getOnWrite().get());
    Assertions.assertTrue(irq.isVolatile());
  }

  @Test
  void testSourceRefs() throws RdlFormatException {
    RootNode root = read(SOC_YAML);
    RdlNode chan = root.getTop().children(false).get(2);
    Assertions.assertEquals(new SourceRef("model.yaml", "top.children[2]"), chan.getSourceRef());
    FieldNode mode = ((RegNode)root.getTop().children(false).get(0)).fields(false).get(1);
    Assertions.assertEquals("model.yaml (top.children[0].fields[1].sw)", mode.getPropertySourceRef("sw").toString());
    // falls back to the declaration
    Assertions.assertEquals("model.yaml (top.children[0].fields[1])", mode.getPropertySourceRef("reset").toString());
  }

  @Test
  void testDisplayName() throws RdlFormatException {
    RootNode root = read("""
        top:
          type: addrmap
          name: top
          name_display: Top Level
          children:
            - {type: reg, name: R, fields: [{name: F, width: 4, name_display: Flag nibble}]}
        """);
    Assertions.assertEquals("Top Level", root.getTop().getProperty("name"));
    RegNode reg = (RegNode)root.getTop().children(false).get(0);
    Assertions.assertEquals("Flag nibble", reg.fields(false).get(0).getProperty("name"));
  }

  @Test
  void testTopLevelMem() throws RdlFormatException {
    RootNode root = read("top: {type: mem, name: rom, mementries: 1024, memwidth: 16}");
    MemNode rom = (MemNode)root.getTop();
    Assertions.assertEquals(16, rom.getMemWidth());
    Assertions.assertEquals(1024, rom.getMemEntries());
  }

  @Test
  void testBridgeProperty() throws RdlFormatException {
    RootNode root = read("""
        top:
          type: addrmap
          name: top
          bridge: true
          children: [{type: addrmap, name: a}, {type: addrmap, name: b, offset: 0x1000}]
        """);
    AddrmapNode top = (AddrmapNode)root.getTop();
    Assertions.assertTrue(top.isBridge());
    Assertions.assertEquals(new SourceRef("model.yaml", "top.bridge"), top.getPropertySourceRef("bridge"));
  }

  @ParameterizedTest
  @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
      "foo: 1|model.yaml: missing 'top' node",
      "top: {type: addrmap, name: t}\\nextra: 1|model.yaml: unknown key 'extra'",
      "top: {type: reg, name: R}|model.yaml (top): top-level node must be an addrmap or mem, got 'reg'",
      "top: {type: addrmap, name: t, children: [{type: block, name: x}]}|model.yaml (top.children[0]): unknown node type 'block'",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, size: 4}]}|model.yaml (top.children[0]): unknown key 'size' for reg",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, stride: 4}]}|model.yaml (top.children[0]): 'stride' requires 'dims'",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, offset: abc}]}|model.yaml (top.children[0].offset): expected an integer, got 'abc'",
      "top: {type: addrmap, name: t, children: [{type: reg, regwidth: 8, name: R, fields: [{name: F, lsb: 4, width: 8}]}]}|" +
          "model.yaml (top.children[0].fields[0]): Field 'F' does not fit into the 8-bit register 'R'",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, fields: [{name: F, onwrite: wtoggle}]}]}|" +
          "model.yaml (top.children[0].fields[0]): unknown onwrite 'wtoggle'",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, fields: [{name: F, sw: rwx}]}]}|" +
          "model.yaml (top.children[0].fields[0].sw): unknown access mode 'rwx'",
      "top: {type: mem, name: m}|model.yaml (top): missing 'mementries'",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, fields: [{name: F, reset: -1}]}]}|" +
          "model.yaml (top.children[0].fields[0].reset): value must not be negative, got -1",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, fields: [{name: F, encode: [{name: N, value: -2}]}]}]}|" +
          "model.yaml (top.children[0].fields[0].encode[0].value): value must not be negative, got -2",
      "top: {type: addrmap, name: t, children: [{type: reg, name: R, offset: 0x10000000000000000}]}|" +
          "model.yaml (top.children[0].offset): integer 18446744073709551616 is out of range",
      "top: {type: addrmap, name: t, children: [{type: regfile, name: rf, children: [{type: mem, name: m, mementries: 4}]}]}|" +
          "model.yaml (top.children[0].children[0]): regfile 'rf' cannot contain a mem",
  })
  void testMalformed(String yaml, String expectedMessage) {
    RdlFormatException e = Assertions.assertThrows(RdlFormatException.class, () -> read(yaml.replace("\\n", "\n")));
    Assertions.assertEquals(expectedMessage, e.getMessage());
  }

  @Test
  void testWideValues() throws RdlFormatException {
    RootNode root = read("""
        top:
          type: addrmap
          name: t
          children:
            - type: reg
              name: R
              regwidth: 128
              fields:
                - {name: lo, width: 64, reset: 0xFFFFFFFFFFFFFFFF}
                - {name: hi, width: 64, reset: "0x1_0000_0000", encode: [{name: TOP, value: 0x8000000000000000}]}
        """);
    List<FieldNode> fields = ((RegNode)root.getTop().children(false).get(0)).fields(false);
    Assertions.assertEquals(BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE), fields.get(0).getReset().get());
    Assertions.assertEquals(BigInteger.ONE.shiftLeft(32), fields.get(1).getReset().get());
    Assertions.assertEquals(BigInteger.ONE.shiftLeft(63), fields.get(1).getEncode().get().get(0).value());
  }

  @Test
  void testInvalidYaml() {
    RdlFormatException e = Assertions.assertThrows(RdlFormatException.class, () -> read("top: [unclosed"));
    Assertions.assertTrue(e.getMessage().startsWith("model.yaml: invalid YAML"), e.getMessage());
  }

  @Test
  void testReadFile() throws Exception {
    File file = tempDir.resolve("soc.yaml").toFile();
    Files.writeString(file.toPath(), SOC_YAML);
    MessageHandler msg = new MessageHandler();
    RootNode root = new RdlYamlReader().read(file, msg);
    Assertions.assertSame(msg, root.getMessageHandler());
    Assertions.assertEquals("soc.yaml", root.getTop().getSourceRef().fileName());
  }
}
