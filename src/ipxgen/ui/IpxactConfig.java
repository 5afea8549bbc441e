package ipxgen.ui;

import ipxgen.Standard;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Data-Class to hold exporter options.
 */
public class IpxactConfig {

  public String vendor = "example.org";
  public String library = "mylibrary";
  public String version = "1.0";
  public Standard standard = Standard.DEFAULT;

  public String xml_indent = "  ";
  public String xml_newline = "\n";

  /**
   * Builds a configuration from key/value pairs, e.g. a parsed YAML file. Keys not listed are left at their defaults.
   * @throws IllegalArgumentException on unknown keys or values of the wrong type
   */
  public static IpxactConfig fromMap(Map<String, ?> values) {
    IpxactConfig cfg = new IpxactConfig();
    for (var entry : values.entrySet()) {
      Object value = entry.getValue();
      switch (entry.getKey()) {
      case "vendor":
        cfg.vendor = asString(entry.getKey(), value);
        break;
      case "library":
        cfg.library = asString(entry.getKey(), value);
        break;
      case "version":
        cfg.version = asString(entry.getKey(), value);
        break;
      case "standard":
        cfg.standard = asStandard(value);
        break;
      case "xml_indent":
        cfg.xml_indent = asString(entry.getKey(), value);
        break;
      case "xml_newline":
        cfg.xml_newline = asString(entry.getKey(), value);
        break;
      default:
        throw new IllegalArgumentException("got an unexpected configuration key '" + entry.getKey() + "'");
      }
    }
    return cfg;
  }

  /**
   * Reads a configuration from a YAML mapping.
   * @throws IllegalArgumentException if the file is not a valid configuration
   */
  public static IpxactConfig fromYaml(File configFile) throws IOException {
    Yaml yaml = new Yaml();
    Object data;
    try (InputStream in = new FileInputStream(configFile)) {
      data = yaml.load(in);
    } catch (YAMLException e) {
      throw new IllegalArgumentException("Configuration file " + configFile + " is not valid YAML: " + e.getMessage(), e);
    }
    if (data == null)
      return new IpxactConfig();
    if (!(data instanceof Map))
      throw new IllegalArgumentException("Configuration file " + configFile + " must contain a mapping");
    @SuppressWarnings("unchecked")
    Map<String, ?> values = (Map<String, ?>)data;
    return fromMap(values);
  }

  /**
   * Checks that no option is missing.
   * @throws IllegalArgumentException naming the first missing option
   */
  public void validate() {
    if (vendor == null)
      throw new IllegalArgumentException("vendor must be set");
    if (library == null)
      throw new IllegalArgumentException("library must be set");
    if (version == null)
      throw new IllegalArgumentException("version must be set");
    if (standard == null)
      throw new IllegalArgumentException("standard must be set");
    if (xml_indent == null || xml_newline == null)
      throw new IllegalArgumentException("xml_indent and xml_newline must be set");
  }

  private static String asString(String key, Object value) {
    if (value instanceof String || value instanceof Number)
      return value.toString();
    throw new IllegalArgumentException("Configuration key '" + key + "' expects a string, got " + value);
  }

  private static Standard asStandard(Object value) {
    if (value instanceof Standard)
      return (Standard)value;
    if (value == null)
      throw new IllegalArgumentException("Configuration key 'standard' must not be empty");
    return Standard.fromSerialName(value.toString())
        .orElseThrow(() -> new IllegalArgumentException("Unknown IP-XACT standard '" + value + "', supported: 2009, 2014"));
  }
}
