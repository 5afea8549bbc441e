package ipxgen.rdl;

/**
 * Location of a declaration in the register description it was read from.
 * @param fileName name of the description file, or a placeholder for models built in code
 * @param location position inside the file (for YAML input, the key path of the declaration)
 */
public record SourceRef(String fileName, String location) {
  public static final SourceRef UNKNOWN = new SourceRef("<unknown>", "");

  @Override
  public String toString() {
    return location.isEmpty() ? fileName : fileName + " (" + location + ")";
  }
}
