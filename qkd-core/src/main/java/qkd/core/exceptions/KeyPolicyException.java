package qkd.core.exceptions;

public class KeyPolicyException extends QkdException
{
  private static final long serialVersionUID = 2204857162315508891L;

  public KeyPolicyException( String msg )
  {
    super( msg );
  }
}
