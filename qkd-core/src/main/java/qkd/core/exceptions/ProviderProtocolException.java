package qkd.core.exceptions;

/**
 * The KME answered, but the answer is an API-level error or cannot be used:
 * an error payload, an empty key list, malformed JSON or undecodable key material.
 */
public class ProviderProtocolException extends QkdException
{
  private static final long serialVersionUID = 7712066309928145104L;

  public ProviderProtocolException( String msg )
  {
    super( msg );
  }

  public ProviderProtocolException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
