package exm.lowc.common.exceptions;

public class UndefinedFunctionException
extends UserException
{
  private final String function;

  public UndefinedFunctionException(String function, String msg)
  {
    super(msg);
    this.function = function;
  }

  public static UndefinedFunctionException unknownFunction(String fnname) {
    return new UndefinedFunctionException(fnname,
                                   "undefined function: " + fnname);
  }

  public String getFunction() {
    return function;
  }

  private static final long serialVersionUID = 1L;
}
