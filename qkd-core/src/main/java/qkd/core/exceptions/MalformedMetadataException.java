package qkd.core.exceptions;

public class MalformedMetadataException extends QkdException
{
  private static final long serialVersionUID = 1597730226914581126L;

  public MalformedMetadataException( String msg )
  {
    super( msg );
  }

  public MalformedMetadataException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
