
package exm.lowc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug or a malformed input tree
 * built by a caller.
 * */
public class LowcRuntimeError extends RuntimeException
{
  public LowcRuntimeError(String msg)
  {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
