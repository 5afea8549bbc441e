package ipxgen.rdl;

/**
 * Signals a malformed register description.
 */
public class RdlFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  public RdlFormatException(String message) { super(message); }

  public RdlFormatException(String message, Throwable cause) { super(message, cause); }
}
