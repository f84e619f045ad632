package qkd.core.crypto;

import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.json.JsonObject;

import qkd.core.exceptions.KeyPolicyException;
import qkd.core.exceptions.QkdException;

/**
 * Encrypts with the construction bound to a {@link SecurityLevel} and
 * decrypts according to the level recorded in the metadata.
 *
 * <ul>
 *   <li>BASIC: one-time pad, the key must be at least as long as the data.</li>
 *   <li>STANDARD: AES-256-GCM under a key derived from the quantum key.</li>
 *   <li>HIGH: ChaCha20-Poly1305 under a key derived from SHA-256 of the quantum key.</li>
 *   <li>MAXIMUM: AES-256-GCM under SHA-256( ephemeral XOR quantum key ). The
 *       ephemeral key is either random and RSA-OAEP wrapped for the recipient,
 *       or (only when enabled) derived from the quantum key.</li>
 * </ul>
 *
 * Instances hold no per-message state and may be shared between threads.
 */
public class EncryptionEngine
{
  private static final Logger LOGGER = LoggerFactory.getLogger( EncryptionEngine.class );

  private final boolean      allowDerivedEphemeralKey;
  private final AeadCipherIF aesGcm   = new AesGcmCipher();
  private final AeadCipherIF chacha   = new ChaCha20Poly1305Cipher();
  private final SecureRandom random   = new SecureRandom();

  public EncryptionEngine()
  {
    this( false );
  }

  /**
   * @param allowDerivedEphemeralKey accept level 4 without a recipient public
   *        key. The ephemeral key is then recoverable from the quantum key
   *        alone, which gives no protection beyond level 2.
   */
  public EncryptionEngine( boolean allowDerivedEphemeralKey )
  {
    this.allowDerivedEphemeralKey = allowDerivedEphemeralKey;
  }

  public boolean isDerivedEphemeralKeyAllowed()
  {
    return allowDerivedEphemeralKey;
  }

  public EncryptionResult encrypt( byte[] plaintext, byte[] key, SecurityLevel level ) throws QkdException
  {
    return encrypt( plaintext, key, level, null );
  }

  public EncryptionResult encrypt( byte[] plaintext, byte[] key, SecurityLevel level, PublicKey recipientPublicKey ) throws QkdException
  {
    if( plaintext == null )
      throw new IllegalArgumentException( "plaintext cannot be null" );
    if( key == null || key.length == 0 )
      throw new IllegalArgumentException( "key cannot be null/empty" );
    if( level == null )
      throw new IllegalArgumentException( "level cannot be null" );

    EncryptionResult result = switch( level )
    {
      case BASIC    -> encryptBasic( plaintext, key );
      case STANDARD -> encryptStandard( plaintext, key );
      case HIGH     -> encryptHigh( plaintext, key );
      case MAXIMUM  -> encryptMaximum( plaintext, key, recipientPublicKey );
    };

    LOGGER.debug( "Encrypted {} bytes at level {} ({})", plaintext.length, level.getCode(), result.getMetadata().getAlgorithm() );
    return result;
  }

  public byte[] decrypt( byte[] ciphertext, byte[] key, JsonObject metadata ) throws QkdException
  {
    return decrypt( ciphertext, key, CipherMetadata.fromJson( metadata ), null );
  }

  public byte[] decrypt( byte[] ciphertext, byte[] key, JsonObject metadata, PrivateKey privateKey ) throws QkdException
  {
    return decrypt( ciphertext, key, CipherMetadata.fromJson( metadata ), privateKey );
  }

  public byte[] decrypt( byte[] ciphertext, byte[] key, CipherMetadata metadata ) throws QkdException
  {
    return decrypt( ciphertext, key, metadata, null );
  }

  public byte[] decrypt( byte[] ciphertext, byte[] key, CipherMetadata metadata, PrivateKey privateKey ) throws QkdException
  {
    if( ciphertext == null )
      throw new IllegalArgumentException( "ciphertext cannot be null" );
    if( key == null || key.length == 0 )
      throw new IllegalArgumentException( "key cannot be null/empty" );
    if( metadata == null )
      throw new IllegalArgumentException( "metadata cannot be null" );

    return switch( metadata.getSecurityLevel() )
    {
      case BASIC    -> OneTimePad.apply( ciphertext, key );
      case STANDARD -> aesGcm.decrypt( standardKey( key ), ( (CipherMetadata.Standard)metadata ).nonce(), ciphertext );
      case HIGH     -> chacha.decrypt( highKey( key ), ( (CipherMetadata.High)metadata ).nonce(), ciphertext );
      case MAXIMUM  -> decryptMaximum( ciphertext, key, (CipherMetadata.Maximum)metadata, privateKey );
    };
  }

  private EncryptionResult encryptBasic( byte[] plaintext, byte[] key ) throws KeyPolicyException
  {
    return new EncryptionResult( OneTimePad.apply( plaintext, key ), new CipherMetadata.Basic( key.length ) );
  }

  private EncryptionResult encryptStandard( byte[] plaintext, byte[] key )
  {
    byte[] nonce = newNonce();
    return new EncryptionResult( aesGcm.encrypt( standardKey( key ), nonce, plaintext ), new CipherMetadata.Standard( nonce ) );
  }

  private EncryptionResult encryptHigh( byte[] plaintext, byte[] key )
  {
    byte[] nonce = newNonce();
    return new EncryptionResult( chacha.encrypt( highKey( key ), nonce, plaintext ), new CipherMetadata.High( nonce ) );
  }

  private EncryptionResult encryptMaximum( byte[] plaintext, byte[] key, PublicKey recipientPublicKey ) throws KeyPolicyException
  {
    byte[]                     ephemeral;
    byte[]                     wrapped;
    CipherMetadata.KeyWrapping wrapping;

    if( recipientPublicKey != null )
    {
      ephemeral = new byte[KeyDerivation.DERIVED_KEY_LENGTH];
      random.nextBytes( ephemeral );
      wrapped   = RsaKeyWrap.wrap( recipientPublicKey, ephemeral );
      wrapping  = CipherMetadata.KeyWrapping.RSA_OAEP_SHA256;
    }
    else
    {
      requireDerivedAllowed();
      LOGGER.warn( "Level 4 encryption without a recipient public key; ephemeral key derived from the quantum key" );

      ephemeral = KeyDerivation.derive( key, KeyDerivation.DERIVED_KEY_LENGTH );
      wrapped   = null;
      wrapping  = CipherMetadata.KeyWrapping.DERIVED;
    }

    byte[] finalKey = KeyDerivation.mix( ephemeral, key );
    byte[] nonce    = newNonce();
    try
    {
      byte[] ciphertext = aesGcm.encrypt( finalKey, nonce, plaintext );
      return new EncryptionResult( ciphertext, new CipherMetadata.Maximum( nonce, wrapping, wrapped ) );
    }
    finally
    {
      Arrays.fill( ephemeral, (byte)0 );
      Arrays.fill( finalKey,  (byte)0 );
    }
  }

  private byte[] decryptMaximum( byte[] ciphertext, byte[] key, CipherMetadata.Maximum metadata, PrivateKey privateKey ) throws QkdException
  {
    byte[] ephemeral = switch( metadata.keyWrapping() )
    {
      case RSA_OAEP_SHA256 -> unwrapEphemeral( metadata, privateKey );
      case DERIVED         -> deriveEphemeral( key );
    };

    byte[] finalKey = KeyDerivation.mix( ephemeral, key );
    try
    {
      return aesGcm.decrypt( finalKey, metadata.nonce(), ciphertext );
    }
    finally
    {
      Arrays.fill( ephemeral, (byte)0 );
      Arrays.fill( finalKey,  (byte)0 );
    }
  }

  private byte[] unwrapEphemeral( CipherMetadata.Maximum metadata, PrivateKey privateKey ) throws QkdException
  {
    if( privateKey == null )
      throw new KeyPolicyException( "Level 4 package carries an RSA wrapped key but no private key was supplied" );

    return RsaKeyWrap.unwrap( privateKey, metadata.encryptedKey() );
  }

  private byte[] deriveEphemeral( byte[] key ) throws KeyPolicyException
  {
    requireDerivedAllowed();
    return KeyDerivation.derive( key, KeyDerivation.DERIVED_KEY_LENGTH );
  }

  private void requireDerivedAllowed() throws KeyPolicyException
  {
    if( !allowDerivedEphemeralKey )
      throw new KeyPolicyException( "Level 4 requires a recipient public key; derived ephemeral keys are disabled" );
  }

  private static byte[] standardKey( byte[] key )
  {
    return KeyDerivation.derive( key, AeadCipherIF.KEY_LENGTH );
  }

  private static byte[] highKey( byte[] key )
  {
    return KeyDerivation.derive( KeyDerivation.sha256( key ), AeadCipherIF.KEY_LENGTH );
  }

  private byte[] newNonce()
  {
    byte[] nonce = new byte[AeadCipherIF.NONCE_LENGTH];
    random.nextBytes( nonce );
    return nonce;
  }
}
