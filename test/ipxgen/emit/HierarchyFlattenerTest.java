package ipxgen.emit;

import ipxgen.ModelFixtures;
import ipxgen.emit.HierarchyFlattener.Strategy;
import ipxgen.rdl.AddressableNode;
import ipxgen.rdl.AddrmapNode;
import ipxgen.rdl.MemNode;
import ipxgen.rdl.RegfileNode;
import ipxgen.rdl.RootNode;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HierarchyFlattenerTest {

  private static List<String> blockNames(AddressableNode top) {
    return HierarchyFlattener.addressBlockNodes(top, HierarchyFlattener.choose(top))
        .stream()
        .map(AddressableNode::getInstName)
        .collect(Collectors.toList());
  }

  @Test
  void testExplodeBlocksAndMems() {
    AddressableNode top = ModelFixtures.mapAndMem().getTop();
    Assertions.assertEquals(Strategy.EXPLODE, HierarchyFlattener.choose(top));
    Assertions.assertEquals(List.of("blk", "ram"), blockNames(top));
  }

  @Test
  void testWrapWhenRegisterAtTop() {
    AddressableNode top = ModelFixtures.interleaved().getTop();
    Assertions.assertEquals(Strategy.WRAP, HierarchyFlattener.choose(top));
    Assertions.assertEquals(List.of("top"), blockNames(top));
  }

  @Test
  void testWrapWhenChildIsArray() {
    Assertions.assertEquals(Strategy.WRAP, HierarchyFlattener.choose(ModelFixtures.arrayedChild().getTop()));
  }

  @Test
  void testWrapWhenChildIsRegfile() {
    RootNode root = new RootNode();
    AddrmapNode top = root.setTop(new AddrmapNode("top"));
    top.addChild(new AddrmapNode("a", 0x0));
    top.addChild(new RegfileNode("rf", 0x100));
    Assertions.assertEquals(Strategy.WRAP, HierarchyFlattener.choose(top));
  }

  @Test
  void testWrapEmptyAddrmap() {
    RootNode root = new RootNode();
    AddrmapNode top = root.setTop(new AddrmapNode("top"));
    Assertions.assertEquals(Strategy.WRAP, HierarchyFlattener.choose(top));
    Assertions.assertEquals(List.of("top"), blockNames(top));
  }

  @Test
  void testWrapTopLevelMem() {
    RootNode root = new RootNode();
    MemNode mem = root.setTop(new MemNode("ram", 0x0, 64, 32));
    Assertions.assertEquals(Strategy.WRAP, HierarchyFlattener.choose(mem));
  }

  @Test
  void testAbsentChildrenStillBecomeBlocks() {
    RootNode root = ModelFixtures.mapAndMem();
    root.getTop().children(false).get(1).setProperty("ispresent", false);
    Assertions.assertEquals(List.of("blk", "ram"), blockNames(root.getTop()));
  }
}
