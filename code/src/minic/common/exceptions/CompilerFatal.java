package minic.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class CompilerFatal extends RuntimeException {
  public final int exitCode;

  public CompilerFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
