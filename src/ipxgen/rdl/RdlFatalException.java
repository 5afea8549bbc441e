package ipxgen.rdl;

/**
 * Thrown by {@link MessageHandler#fatal(String, SourceRef)} to abort the current operation.
 */
public class RdlFatalException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final SourceRef sourceRef;

  public RdlFatalException(String message, SourceRef sourceRef) {
    super(message);
    this.sourceRef = sourceRef;
  }

  public SourceRef getSourceRef() { return sourceRef; }
}
