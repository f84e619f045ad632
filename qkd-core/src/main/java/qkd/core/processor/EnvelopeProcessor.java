package qkd.core.processor;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.crypto.CipherMetadata;
import qkd.core.crypto.EncryptionEngine;
import qkd.core.crypto.EncryptionResult;
import qkd.core.crypto.SecurityLevel;
import qkd.core.exceptions.KeyNotFoundException;
import qkd.core.exceptions.QkdException;
import qkd.core.handler.KeyManager;
import qkd.core.model.EncryptedPackage;
import qkd.core.model.QuantumKey;

/**
 * Send and receive side of one party: obtains a fresh quantum key for every
 * outgoing message and recovers the peer's key from the package's key id
 * and sender id on the way in.
 */
public class EnvelopeProcessor
{
  private static final Logger LOGGER = LoggerFactory.getLogger( EnvelopeProcessor.class );

  private final String           partyId;
  private final KeyManager       keyManager;
  private final EncryptionEngine engine;
  private final String           protocol;
  private final int              keyLengthBits;

  public EnvelopeProcessor( String partyId, KeyManager keyManager, EncryptionEngine engine, String protocol, int keyLengthBits )
  {
    if( partyId == null || keyManager == null || engine == null )
      throw new IllegalArgumentException( "partyId, keyManager and engine are required" );
    if( keyLengthBits <= 0 || keyLengthBits % 8 != 0 )
      throw new IllegalArgumentException( "keyLengthBits must be a positive multiple of 8" );

    this.partyId       = partyId;
    this.keyManager    = keyManager;
    this.engine        = engine;
    this.protocol      = protocol != null ? protocol : EncryptedPackage.PROTOCOL_LOCAL;
    this.keyLengthBits = keyLengthBits;
  }

  public EncryptedPackage seal( String recipientId, String plaintext, SecurityLevel level, PublicKey recipientPublicKey ) throws QkdException
  {
    return seal( recipientId, plaintext.getBytes( StandardCharsets.UTF_8 ), level, recipientPublicKey );
  }

  public EncryptedPackage seal( String recipientId, byte[] plaintext, SecurityLevel level, PublicKey recipientPublicKey ) throws QkdException
  {
    // The pad must cover the whole message
    int bits = level == SecurityLevel.BASIC ? Math.max( keyLengthBits, plaintext.length * 8 ) : keyLengthBits;

    QuantumKey key      = keyManager.requestQuantumKey( recipientId, bits );
    byte[]     keyBytes = key.getKeyBytes();
    try
    {
      EncryptionResult result = engine.encrypt( plaintext, keyBytes, level, recipientPublicKey );
      LOGGER.info( "{} sealed {} bytes for {} with key {} at level {}", partyId, plaintext.length, recipientId, key.getKeyId(), level );

      return EncryptedPackage.of( result, key.getKeyId(), partyId, protocol );
    }
    finally
    {
      Arrays.fill( keyBytes, (byte)0 );
      key.clearKeyBytes();
    }
  }

  public byte[] open( EncryptedPackage pkg, PrivateKey privateKey ) throws QkdException
  {
    // Validate the metadata before consuming a key use
    CipherMetadata metadata = CipherMetadata.fromJson( pkg.getMetadata() );

    byte[] keyBytes = keyManager.retrieveQuantumKey( pkg.getSenderId(), pkg.getKeyId() );
    if( keyBytes == null )
      throw new KeyNotFoundException( pkg.getKeyId(), "Key " + pkg.getKeyId() + " from " + pkg.getSenderId() + " is no longer available" );

    try
    {
      byte[] plaintext = engine.decrypt( pkg.getCiphertext(), keyBytes, metadata, privateKey );
      LOGGER.info( "{} opened package from {} with key {}", partyId, pkg.getSenderId(), pkg.getKeyId() );
      return plaintext;
    }
    finally
    {
      Arrays.fill( keyBytes, (byte)0 );
    }
  }

  public String openText( EncryptedPackage pkg, PrivateKey privateKey ) throws QkdException
  {
    return new String( open( pkg, privateKey ), StandardCharsets.UTF_8 );
  }
}
