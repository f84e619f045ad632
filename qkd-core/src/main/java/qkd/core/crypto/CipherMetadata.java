package qkd.core.crypto;

import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import io.vertx.core.json.JsonObject;

import qkd.core.exceptions.MalformedMetadataException;

/**
 * Everything a receiver needs, besides the key, to reverse one encryption.
 * There is exactly one variant per {@link SecurityLevel}, each carrying only
 * the fields its construction uses. The JSON form travels with the
 * ciphertext and decides how it is decrypted.
 */
public sealed interface CipherMetadata
  permits CipherMetadata.Basic, CipherMetadata.Standard, CipherMetadata.High, CipherMetadata.Maximum
{
  public static final String SECURITY_LEVEL   = "security_level";
  public static final String ALGORITHM        = "algorithm";
  public static final String KEY_LENGTH       = "key_length";
  public static final String NONCE            = "nonce";
  public static final String KEY_MIXING       = "key_mixing";
  public static final String ENCRYPTED_KEY    = "encrypted_key";
  public static final String KEY_WRAPPING     = "key_wrapping";
  public static final String QUANTUM_ENHANCED = "quantum_enhanced";

  public static final String ALG_OTP    = "XOR_OTP";
  public static final String ALG_HYBRID = "Hybrid-RSA-AES-256-GCM-Quantum";

  public SecurityLevel getSecurityLevel();

  public String getAlgorithm();

  public JsonObject toJson();

  /**
   * How the level 4 ephemeral key reaches the receiver.
   */
  public enum KeyWrapping
  {
    RSA_OAEP_SHA256( "rsa-oaep-sha256" ),
    DERIVED(         "derived-from-quantum-key" );

    private final String label;

    KeyWrapping( String label )
    {
      this.label = label;
    }

    public String getLabel()
    {
      return label;
    }

    public static KeyWrapping fromLabel( String label ) throws MalformedMetadataException
    {
      for( KeyWrapping wrapping : values() )
      {
        if( wrapping.label.equals( label ) )
          return wrapping;
      }

      throw new MalformedMetadataException( "Unknown key_wrapping: " + label );
    }
  }

  public record Basic( int keyLength ) implements CipherMetadata
  {
    @Override public SecurityLevel getSecurityLevel() { return SecurityLevel.BASIC; }
    @Override public String        getAlgorithm()     { return ALG_OTP;             }

    @Override
    public JsonObject toJson()
    {
      return header( this ).put( KEY_LENGTH, keyLength );
    }
  }

  public record Standard( byte[] nonce ) implements CipherMetadata
  {
    @Override public SecurityLevel getSecurityLevel() { return SecurityLevel.STANDARD;   }
    @Override public String        getAlgorithm()     { return AesGcmCipher.ALGORITHM;   }

    @Override
    public JsonObject toJson()
    {
      return header( this ).put( NONCE, Hex.toHexString( nonce ) );
    }
  }

  public record High( byte[] nonce ) implements CipherMetadata
  {
    @Override public SecurityLevel getSecurityLevel() { return SecurityLevel.HIGH;               }
    @Override public String        getAlgorithm()     { return ChaCha20Poly1305Cipher.ALGORITHM; }

    @Override
    public JsonObject toJson()
    {
      return header( this ).put( NONCE,      Hex.toHexString( nonce ) )
                           .put( KEY_MIXING, true );
    }
  }

  /**
   * @param encryptedKey the RSA wrapped ephemeral key, null when the key is derived
   */
  public record Maximum( byte[] nonce, KeyWrapping keyWrapping, byte[] encryptedKey ) implements CipherMetadata
  {
    @Override public SecurityLevel getSecurityLevel() { return SecurityLevel.MAXIMUM; }
    @Override public String        getAlgorithm()     { return ALG_HYBRID;            }

    @Override
    public JsonObject toJson()
    {
      return header( this ).put( NONCE,            Hex.toHexString( nonce ) )
                           .put( ENCRYPTED_KEY,    encryptedKey != null ? Hex.toHexString( encryptedKey ) : null )
                           .put( KEY_WRAPPING,     keyWrapping.getLabel() )
                           .put( QUANTUM_ENHANCED, true );
    }
  }

  /**
   * Parses and validates metadata. Every field the level needs must be
   * present and well formed.
   */
  public static CipherMetadata fromJson( JsonObject json ) throws MalformedMetadataException
  {
    if( json == null )
      throw new MalformedMetadataException( "Metadata is missing" );

    SecurityLevel level;
    try
    {
      Integer code = json.getInteger( SECURITY_LEVEL );
      if( code == null )
        throw new MalformedMetadataException( "Metadata has no " + SECURITY_LEVEL );

      level = SecurityLevel.fromCode( code );
    }
    catch( ClassCastException | IllegalArgumentException e )
    {
      throw new MalformedMetadataException( "Invalid " + SECURITY_LEVEL + ": " + json.getValue( SECURITY_LEVEL ), e );
    }

    CipherMetadata metadata = switch( level )
    {
      case BASIC    -> new Basic( requireInt( json, KEY_LENGTH ) );
      case STANDARD -> new Standard( requireNonce( json ) );
      case HIGH     -> parseHigh( json );
      case MAXIMUM  -> parseMaximum( json );
    };

    String algorithm = json.getValue( ALGORITHM ) instanceof String alg ? alg : null;
    if( !metadata.getAlgorithm().equals( algorithm ) )
      throw new MalformedMetadataException( "Algorithm " + algorithm + " does not match security level " + level.getCode() );

    return metadata;
  }

  private static JsonObject header( CipherMetadata metadata )
  {
    return new JsonObject().put( SECURITY_LEVEL, metadata.getSecurityLevel().getCode() )
                           .put( ALGORITHM,      metadata.getAlgorithm() );
  }

  private static High parseHigh( JsonObject json ) throws MalformedMetadataException
  {
    if( !Boolean.TRUE.equals( json.getValue( KEY_MIXING ) ) )
      throw new MalformedMetadataException( "Level 3 metadata must set " + KEY_MIXING );

    return new High( requireNonce( json ) );
  }

  private static Maximum parseMaximum( JsonObject json ) throws MalformedMetadataException
  {
    byte[] nonce = requireNonce( json );

    Object wrapped = json.getValue( ENCRYPTED_KEY );
    if( wrapped != null && !( wrapped instanceof String ) )
      throw new MalformedMetadataException( "Invalid " + ENCRYPTED_KEY );

    byte[] encryptedKey = wrapped != null ? decodeHex( ENCRYPTED_KEY, (String)wrapped ) : null;

    // Packages without key_wrapping predate the label; infer it from the wrapped key.
    KeyWrapping wrapping;
    Object      label = json.getValue( KEY_WRAPPING );
    if( label == null )
      wrapping = encryptedKey != null ? KeyWrapping.RSA_OAEP_SHA256 : KeyWrapping.DERIVED;
    else if( label instanceof String str )
      wrapping = KeyWrapping.fromLabel( str );
    else
      throw new MalformedMetadataException( "Invalid " + KEY_WRAPPING );

    if( wrapping == KeyWrapping.RSA_OAEP_SHA256 && ( encryptedKey == null || encryptedKey.length == 0 ) )
      throw new MalformedMetadataException( "RSA wrapped metadata has no " + ENCRYPTED_KEY );
    if( wrapping == KeyWrapping.DERIVED && encryptedKey != null )
      throw new MalformedMetadataException( "Derived key metadata must not carry " + ENCRYPTED_KEY );

    return new Maximum( nonce, wrapping, encryptedKey );
  }

  private static int requireInt( JsonObject json, String field ) throws MalformedMetadataException
  {
    if( json.getValue( field ) instanceof Number num )
      return num.intValue();

    throw new MalformedMetadataException( "Metadata field " + field + " is missing or not a number" );
  }

  private static byte[] requireNonce( JsonObject json ) throws MalformedMetadataException
  {
    if( !( json.getValue( NONCE ) instanceof String hex ) )
      throw new MalformedMetadataException( "Metadata field " + NONCE + " is missing" );

    byte[] nonce = decodeHex( NONCE, hex );
    if( nonce.length != AeadCipherIF.NONCE_LENGTH )
      throw new MalformedMetadataException( "Nonce must be " + AeadCipherIF.NONCE_LENGTH + " bytes, got " + nonce.length );

    return nonce;
  }

  private static byte[] decodeHex( String field, String hex ) throws MalformedMetadataException
  {
    if( hex.length() % 2 != 0 )
      throw new MalformedMetadataException( "Metadata field " + field + " has odd hex length" );

    try
    {
      return Hex.decode( hex );
    }
    catch( DecoderException e )
    {
      throw new MalformedMetadataException( "Metadata field " + field + " is not valid hex", e );
    }
  }
}
