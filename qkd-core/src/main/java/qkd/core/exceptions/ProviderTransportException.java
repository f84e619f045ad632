package qkd.core.exceptions;

/**
 * The KME could not be reached or answered with a failing HTTP status and no
 * API error payload: connection refused, TLS handshake failure, timeout.
 */
public class ProviderTransportException extends QkdException
{
  private static final long serialVersionUID = 5521897407316425830L;

  private final int statusCode;

  public ProviderTransportException( String msg, Throwable cause )
  {
    super( msg, cause );
    this.statusCode = -1;
  }

  public ProviderTransportException( String msg, int statusCode )
  {
    super( msg );
    this.statusCode = statusCode;
  }

  /**
   * @return the HTTP status that caused the failure, or -1 if no response was received
   */
  public int getStatusCode()
  {
    return statusCode;
  }
}
