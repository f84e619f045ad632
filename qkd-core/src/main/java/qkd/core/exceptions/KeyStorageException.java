package qkd.core.exceptions;

/**
 * The key repository could not be read or written.
 */
public class KeyStorageException extends QkdException
{
  private static final long serialVersionUID = 6251009836624758210L;

  public KeyStorageException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
