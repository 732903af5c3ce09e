package minic.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug, or a grammar that has drifted
 * out of sync with the code that consumes its trees.
 * */
public class CompilerRuntimeError extends RuntimeException
{
  public CompilerRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
