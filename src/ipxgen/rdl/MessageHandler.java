package ipxgen.rdl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Message sink shared by all nodes of one model. Warnings are logged and recorded, fatal errors are logged and abort the caller.
 */
public class MessageHandler {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final List<String> warnings = new ArrayList<>();

  public void warning(String message, SourceRef sourceRef) {
    logger.warn("{}: {}", sourceRef, message);
    warnings.add(message);
  }

  /**
   * Reports an unrecoverable error.
   * @throws RdlFatalException always
   */
  public void fatal(String message, SourceRef sourceRef) {
    logger.fatal("{}: {}", sourceRef, message);
    throw new RdlFatalException(message, sourceRef);
  }

  /** Messages of all warnings reported so far, in order. */
  public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
}
