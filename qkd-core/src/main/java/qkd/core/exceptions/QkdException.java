package qkd.core.exceptions;

/**
 * Root of the checked failures raised by the QKD core. Each subclass is one
 * failure category so callers can tell a transport outage from a policy
 * rejection or an integrity failure.
 */
public abstract class QkdException extends Exception
{
  private static final long serialVersionUID = 3108827361950412270L;

  protected QkdException( String msg )
  {
    super( msg );
  }

  protected QkdException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
