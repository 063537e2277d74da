package hdlelab.elab;

import hdlelab.util.ExprPrinter;
import hdlelab.value.Value;
import java.util.Optional;

/**
 * Fatal diagnostic raised during elaboration. Identifies the offending node or statement.
 */
public class ElaborationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorKind kind;
  private final transient Object culprit;

  /**
   * @param kind the error category
   * @param message a human-readable description
   * @param culprit the Value, Statement, Signal or enum class that caused the error, or null
   */
  public ElaborationException(ErrorKind kind, String message, Object culprit) {
    super(format(kind, message, culprit));
    this.kind = kind;
    this.culprit = culprit;
  }

  public ElaborationException(ErrorKind kind, String message) { this(kind, message, null); }

  public ErrorKind getKind() { return kind; }

  /** The offending node or statement, if one was recorded. */
  public Optional<Object> getCulprit() { return Optional.ofNullable(culprit); }

  private static String format(ErrorKind kind, String message, Object culprit) {
    if (culprit == null)
      return String.format("%s: %s", kind, message);
    String where = (culprit instanceof Value) ? ExprPrinter.render((Value)culprit) : String.valueOf(culprit);
    return String.format("%s: %s (at %s)", kind, message, where);
  }
}
