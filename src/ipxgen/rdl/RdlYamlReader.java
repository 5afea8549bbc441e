package ipxgen.rdl;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a register model from a YAML description.
 *
 * <pre>
 * top:
 *   type: addrmap
 *   name: my_block
 *   children:
 *     - type: reg
 *       name: CTRL
 *       offset: 0x0
 *       fields:
 *         - {name: EN, lsb: 0, msb: 0, sw: rw, reset: 0}
 * </pre>
 *
 * Nodes without an explicit offset are placed right after their previous sibling, fields without lsb right above the previous field.
 */
public class RdlYamlReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final Set<String> COMMON_KEYS = Set.of("type", "name", "name_display", "desc", "ispresent");
  private static final Set<String> ADDRESSABLE_KEYS = Set.of("offset", "dims", "stride");
  private static final Set<String> ADDRMAP_KEYS = Set.of("size", "bridge", "children");
  private static final Set<String> REGFILE_KEYS = Set.of("size", "children");
  private static final Set<String> MEM_KEYS = Set.of("mementries", "memwidth", "sw", "children");
  private static final Set<String> REG_KEYS = Set.of("regwidth", "fields");
  private static final Set<String> FIELD_KEYS =
      Set.of("name", "name_display", "desc", "ispresent", "lsb", "msb", "width", "sw", "reset", "onwrite", "onread", "volatile",
             "donttest", "encode");
  private static final Set<String> ENCODE_KEYS = Set.of("name", "name_display", "desc", "value");

  private String sourceName = "<yaml>";

  public RootNode read(File file) throws IOException, RdlFormatException { return read(file, new MessageHandler()); }

  public RootNode read(File file, MessageHandler msg) throws IOException, RdlFormatException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in, file.getName(), msg);
    }
  }

  /**
   * Reads a description from a stream.
   * @param sourceName name used in source references
   */
  public RootNode read(InputStream in, String sourceName, MessageHandler msg) throws RdlFormatException {
    Object data;
    try {
      data = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new RdlFormatException(sourceName + ": invalid YAML: " + e.getMessage(), e);
    }
    return read(data, sourceName, msg);
  }

  public RootNode read(String yamlText, String sourceName) throws RdlFormatException {
    Object data;
    try {
      data = new Yaml().load(yamlText);
    } catch (YAMLException e) {
      throw new RdlFormatException(sourceName + ": invalid YAML: " + e.getMessage(), e);
    }
    return read(data, sourceName, new MessageHandler());
  }

  private RootNode read(Object data, String sourceName, MessageHandler msg) throws RdlFormatException {
    this.sourceName = sourceName;
    Map<?, ?> doc = asMap(data, "");
    if (!doc.containsKey("top"))
      throw error("", "missing 'top' node");
    for (Object key : doc.keySet()) {
      if (!"top".equals(key))
        throw error("", "unknown key '" + key + "'");
    }

    RootNode root = new RootNode(msg);
    Map<?, ?> topDesc = asMap(doc.get("top"), "top");
    String type = asString(topDesc.get("type"), "top.type");
    if (!type.equals(NodeKind.ADDRMAP.serialName) && !type.equals(NodeKind.MEM.serialName))
      throw error("top", "top-level node must be an addrmap or mem, got '" + type + "'");
    AddressableNode top = createNode(topDesc, "top", 0);
    root.setTop(top);
    readChildren(top, topDesc, "top");
    logger.debug("Read register model '{}' from {}", top.getInstName(), sourceName);
    return root;
  }

  private void readChildren(AddressableNode parent, Map<?, ?> desc, String path) throws RdlFormatException {
    if (parent.getKind() == NodeKind.REG) {
      readFields((RegNode)parent, desc, path);
      return;
    }
    Object childrenDesc = desc.get("children");
    if (childrenDesc == null)
      return;
    List<?> children = asList(childrenDesc, path + ".children");
    long nextOffset = 0;
    for (int i = 0; i < children.size(); i++) {
      String childPath = path + ".children[" + i + "]";
      Map<?, ?> childDesc = asMap(children.get(i), childPath);
      AddressableNode child = createNode(childDesc, childPath, nextOffset);
      try {
        parent.addChild(child);
      } catch (IllegalArgumentException e) {
        throw error(childPath, e.getMessage());
      }
      readChildren(child, childDesc, childPath);
      nextOffset = child.getRawAddressOffset() + child.getTotalSize();
    }
  }

  private AddressableNode createNode(Map<?, ?> desc, String path, long defaultOffset) throws RdlFormatException {
    String type = asString(desc.get("type"), path + ".type");
    NodeKind kind =
        NodeKind.fromSerialName(type).filter(kindVal -> kindVal.isAddressable()).orElseThrow(() -> error(path, "unknown node type '" + type + "'"));
    String name = asString(desc.get("name"), path + ".name");
    long offset = desc.containsKey("offset") ? asLong(desc.get("offset"), path + ".offset") : defaultOffset;

    AddressableNode node;
    try {
      switch (kind) {
      case ADDRMAP: {
        checkKeys(desc, path, ADDRMAP_KEYS);
        AddrmapNode addrmap = new AddrmapNode(name, offset);
        if (desc.containsKey("size"))
          addrmap.setSize(asLong(desc.get("size"), path + ".size"));
        if (desc.containsKey("bridge"))
          addrmap.setProperty("bridge", asBoolean(desc.get("bridge"), path + ".bridge"), ref(path + ".bridge"));
        node = addrmap;
        break;
      }
      case REGFILE: {
        checkKeys(desc, path, REGFILE_KEYS);
        RegfileNode regfile = new RegfileNode(name, offset);
        if (desc.containsKey("size"))
          regfile.setSize(asLong(desc.get("size"), path + ".size"));
        node = regfile;
        break;
      }
      case MEM: {
        checkKeys(desc, path, MEM_KEYS);
        long mementries = asLong(required(desc, "mementries", path), path + ".mementries");
        int memwidth = desc.containsKey("memwidth") ? (int)asLong(desc.get("memwidth"), path + ".memwidth") : 32;
        MemNode mem = new MemNode(name, offset, mementries, memwidth);
        if (desc.containsKey("sw"))
          mem.setProperty("sw", asAccess(desc.get("sw"), path + ".sw"), ref(path + ".sw"));
        node = mem;
        break;
      }
      case REG: {
        checkKeys(desc, path, REG_KEYS);
        int regwidth = desc.containsKey("regwidth") ? (int)asLong(desc.get("regwidth"), path + ".regwidth") : 32;
        node = new RegNode(name, offset, regwidth);
        break;
      }
      default:
        throw error(path, "unsupported node type '" + type + "'");
      }

      if (desc.containsKey("dims")) {
        List<?> dimsDesc = asList(desc.get("dims"), path + ".dims");
        int[] dims = new int[dimsDesc.size()];
        for (int i = 0; i < dims.length; i++)
          dims[i] = (int)asLong(dimsDesc.get(i), path + ".dims[" + i + "]");
        long stride = desc.containsKey("stride") ? asLong(desc.get("stride"), path + ".stride") : -1;
        node.setArray(stride, dims);
      } else if (desc.containsKey("stride")) {
        throw error(path, "'stride' requires 'dims'");
      }
    } catch (IllegalArgumentException e) {
      throw error(path, e.getMessage());
    }

    node.setSourceRef(ref(path));
    readCommonProperties(node, desc, path);
    return node;
  }

  private void readFields(RegNode reg, Map<?, ?> desc, String path) throws RdlFormatException {
    Object fieldsDesc = desc.get("fields");
    if (fieldsDesc == null)
      return;
    List<?> fields = asList(fieldsDesc, path + ".fields");
    int nextLsb = 0;
    for (int i = 0; i < fields.size(); i++) {
      String fieldPath = path + ".fields[" + i + "]";
      Map<?, ?> fieldDesc = asMap(fields.get(i), fieldPath);
      checkFieldKeys(fieldDesc, fieldPath);
      String name = asString(fieldDesc.get("name"), fieldPath + ".name");
      int lsb = fieldDesc.containsKey("lsb") ? (int)asLong(fieldDesc.get("lsb"), fieldPath + ".lsb") : nextLsb;
      int msb;
      if (fieldDesc.containsKey("msb"))
        msb = (int)asLong(fieldDesc.get("msb"), fieldPath + ".msb");
      else if (fieldDesc.containsKey("width"))
        msb = lsb + (int)asLong(fieldDesc.get("width"), fieldPath + ".width") - 1;
      else
        msb = lsb;

      FieldNode field;
      try {
        field = reg.addField(new FieldNode(name, lsb, msb));
      } catch (IllegalArgumentException e) {
        throw error(fieldPath, e.getMessage());
      }
      field.setSourceRef(ref(fieldPath));
      readCommonProperties(field, fieldDesc, fieldPath);

      if (fieldDesc.containsKey("sw"))
        field.setProperty("sw", asAccess(fieldDesc.get("sw"), fieldPath + ".sw"), ref(fieldPath + ".sw"));
      if (fieldDesc.containsKey("reset"))
        field.setProperty("reset", asUnsigned(fieldDesc.get("reset"), fieldPath + ".reset"), ref(fieldPath + ".reset"));
      if (fieldDesc.containsKey("onwrite")) {
        String onwrite = asString(fieldDesc.get("onwrite"), fieldPath + ".onwrite");
        field.setProperty("onwrite",
                          OnWriteType.fromSerialName(onwrite).orElseThrow(() -> error(fieldPath, "unknown onwrite '" + onwrite + "'")),
                          ref(fieldPath + ".onwrite"));
      }
      if (fieldDesc.containsKey("onread")) {
        String onread = asString(fieldDesc.get("onread"), fieldPath + ".onread");
        field.setProperty("onread",
                          OnReadType.fromSerialName(onread).orElseThrow(() -> error(fieldPath, "unknown onread '" + onread + "'")),
                          ref(fieldPath + ".onread"));
      }
      if (fieldDesc.containsKey("volatile"))
        field.setProperty("volatile", asBoolean(fieldDesc.get("volatile"), fieldPath + ".volatile"));
      if (fieldDesc.containsKey("donttest"))
        field.setProperty("donttest", asBoolean(fieldDesc.get("donttest"), fieldPath + ".donttest"));
      if (fieldDesc.containsKey("encode"))
        field.setProperty("encode", readEncode(fieldDesc.get("encode"), fieldPath + ".encode"), ref(fieldPath + ".encode"));

      nextLsb = field.getHigh() + 1;
    }
  }

  private List<EnumEntry> readEncode(Object encodeDesc, String path) throws RdlFormatException {
    List<?> entries = asList(encodeDesc, path);
    List<EnumEntry> encode = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      String entryPath = path + "[" + i + "]";
      Map<?, ?> entryDesc = asMap(entries.get(i), entryPath);
      for (Object key : entryDesc.keySet()) {
        if (!ENCODE_KEYS.contains(key))
          throw error(entryPath, "unknown key '" + key + "'");
      }
      encode.add(new EnumEntry(asString(entryDesc.get("name"), entryPath + ".name"),
                               optString(entryDesc.get("name_display"), entryPath + ".name_display"),
                               optString(entryDesc.get("desc"), entryPath + ".desc"),
                               asUnsigned(required(entryDesc, "value", entryPath), entryPath + ".value")));
    }
    return encode;
  }

  private void readCommonProperties(RdlNode node, Map<?, ?> desc, String path) throws RdlFormatException {
    if (desc.containsKey("name_display"))
      node.setProperty("name", asString(desc.get("name_display"), path + ".name_display"), ref(path + ".name_display"));
    if (desc.containsKey("desc"))
      node.setProperty("desc", asString(desc.get("desc"), path + ".desc"), ref(path + ".desc"));
    if (desc.containsKey("ispresent"))
      node.setProperty("ispresent", asBoolean(desc.get("ispresent"), path + ".ispresent"), ref(path + ".ispresent"));
  }

  private void checkKeys(Map<?, ?> desc, String path, Set<String> kindKeys) throws RdlFormatException {
    for (Object key : desc.keySet()) {
      if (!COMMON_KEYS.contains(key) && !ADDRESSABLE_KEYS.contains(key) && !kindKeys.contains(key))
        throw error(path, "unknown key '" + key + "' for " + desc.get("type"));
    }
  }

  private void checkFieldKeys(Map<?, ?> desc, String path) throws RdlFormatException {
    for (Object key : desc.keySet()) {
      if (!FIELD_KEYS.contains(key))
        throw error(path, "unknown key '" + key + "' for field");
    }
  }

  private SourceRef ref(String path) { return new SourceRef(sourceName, path); }

  private RdlFormatException error(String path, String message) {
    return new RdlFormatException(ref(path) + ": " + message);
  }

  private Object required(Map<?, ?> desc, String key, String path) throws RdlFormatException {
    if (!desc.containsKey(key))
      throw error(path, "missing '" + key + "'");
    return desc.get(key);
  }

  private Map<?, ?> asMap(Object value, String path) throws RdlFormatException {
    if (value instanceof Map)
      return (Map<?, ?>)value;
    throw error(path, "expected a mapping");
  }

  private List<?> asList(Object value, String path) throws RdlFormatException {
    if (value instanceof List)
      return (List<?>)value;
    throw error(path, "expected a list");
  }

  private String asString(Object value, String path) throws RdlFormatException {
    if (value == null)
      throw error(path, "missing value");
    if (value instanceof Map || value instanceof List)
      throw error(path, "expected a string");
    return value.toString();
  }

  private String optString(Object value, String path) throws RdlFormatException {
    return (value == null) ? null : asString(value, path);
  }

  private long asLong(Object value, String path) throws RdlFormatException {
    if (value instanceof BigInteger) {
      if (((BigInteger)value).bitLength() > 63)
        throw error(path, "integer " + value + " is out of range");
      return ((BigInteger)value).longValue();
    }
    if (value instanceof Number)
      return ((Number)value).longValue();
    if (value instanceof String) {
      try {
        return Long.decode(((String)value).trim());
      } catch (NumberFormatException e) {
        throw error(path, "expected an integer, got '" + value + "'");
      }
    }
    throw error(path, "expected an integer");
  }

  /** Arbitrary-width integer as used for reset and encoding values, rejecting negative numbers. */
  private BigInteger asUnsigned(Object value, String path) throws RdlFormatException {
    BigInteger result;
    if (value instanceof BigInteger) {
      result = (BigInteger)value;
    } else if (value instanceof Integer || value instanceof Long) {
      result = BigInteger.valueOf(((Number)value).longValue());
    } else if (value instanceof String) {
      String text = ((String)value).trim().replace("_", "");
      try {
        if (text.startsWith("0x") || text.startsWith("0X"))
          result = new BigInteger(text.substring(2), 16);
        else
          result = new BigInteger(text);
      } catch (NumberFormatException e) {
        throw error(path, "expected an integer, got '" + value + "'");
      }
    } else {
      throw error(path, "expected an integer");
    }
    if (result.signum() < 0)
      throw error(path, "value must not be negative, got " + result);
    return result;
  }

  private boolean asBoolean(Object value, String path) throws RdlFormatException {
    if (value instanceof Boolean)
      return (Boolean)value;
    throw error(path, "expected true or false");
  }

  private AccessType asAccess(Object value, String path) throws RdlFormatException {
    String sw = asString(value, path);
    return AccessType.fromSerialName(sw).orElseThrow(() -> error(path, "unknown access mode '" + sw + "'"));
  }
}
