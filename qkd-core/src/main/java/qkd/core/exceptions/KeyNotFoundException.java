package qkd.core.exceptions;

/**
 * Thrown when a key identifier is not known to a local key channel.
 */
public class KeyNotFoundException extends QkdException
{
  private static final long serialVersionUID = 4757120132833816243L;

  private final String keyId;

  public KeyNotFoundException( String keyId, String msg )
  {
    super( msg );
    this.keyId = keyId;
  }

  public String getKeyId()
  {
    return keyId;
  }
}
