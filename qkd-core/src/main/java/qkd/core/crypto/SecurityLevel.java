package qkd.core.crypto;

/**
 * Protection tiers selectable per message. Each tier binds one cipher
 * construction and one key-derivation rule.
 */
public enum SecurityLevel
{
  BASIC(    1 ),  // one-time pad
  STANDARD( 2 ),  // AES-256-GCM
  HIGH(     3 ),  // ChaCha20-Poly1305 over a mixed key
  MAXIMUM(  4 );  // ephemeral key mixed with the quantum key, AES-256-GCM

  private final int code;

  SecurityLevel( int code )
  {
    this.code = code;
  }

  public int getCode()
  {
    return code;
  }

  public static SecurityLevel fromCode( int code )
  {
    for( SecurityLevel level : values() )
    {
      if( level.code == code )
        return level;
    }

    throw new IllegalArgumentException( "Unknown security level: " + code );
  }
}
