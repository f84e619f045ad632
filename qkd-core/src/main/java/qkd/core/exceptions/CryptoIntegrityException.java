package qkd.core.exceptions;

/**
 * Authentication of a ciphertext (or of a wrapped key) failed. The data was
 * tampered with or the wrong key was used; no plaintext is released.
 */
public class CryptoIntegrityException extends QkdException
{
  private static final long serialVersionUID = 8846153007212974455L;

  public CryptoIntegrityException( String msg )
  {
    super( msg );
  }

  public CryptoIntegrityException( String msg, Throwable cause )
  {
    super( msg, cause );
  }
}
