package qkd.core.crypto;

import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.RSAKeyGenParameterSpec;

import org.bouncycastle.crypto.AsymmetricBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.encodings.OAEPEncoding;
import org.bouncycastle.crypto.engines.RSAEngine;
import org.bouncycastle.crypto.params.AsymmetricKeyParameter;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.crypto.util.PrivateKeyFactory;
import org.bouncycastle.crypto.util.PublicKeyFactory;

import qkd.core.exceptions.CryptoIntegrityException;

/**
 * RSA-OAEP (SHA-256, MGF1 with SHA-256) wrapping of short symmetric keys.
 */
public final class RsaKeyWrap
{
  public static final int DEFAULT_KEY_SIZE = 2048;

  private static final SecureRandom RANDOM = new SecureRandom();

  private RsaKeyWrap()
  {
  }

  public static KeyPair generateKeyPair()
  {
    return generateKeyPair( DEFAULT_KEY_SIZE );
  }

  public static KeyPair generateKeyPair( int keySizeBits )
  {
    try
    {
      KeyPairGenerator generator = KeyPairGenerator.getInstance( "RSA" );
      generator.initialize( new RSAKeyGenParameterSpec( keySizeBits, RSAKeyGenParameterSpec.F4 ), RANDOM );
      return generator.generateKeyPair();
    }
    catch( GeneralSecurityException e )
    {
      throw new IllegalStateException( "RSA key pair generation failed for " + keySizeBits + " bits", e );
    }
  }

  public static byte[] wrap( PublicKey publicKey, byte[] keyMaterial )
  {
    if( publicKey == null )
      throw new IllegalArgumentException( "publicKey cannot be null" );

    try
    {
      AsymmetricKeyParameter param  = PublicKeyFactory.createKey( publicKey.getEncoded() );
      AsymmetricBlockCipher  cipher = oaep();
      cipher.init( true, new ParametersWithRandom( param, RANDOM ) );

      return cipher.processBlock( keyMaterial, 0, keyMaterial.length );
    }
    catch( IOException | InvalidCipherTextException e )
    {
      throw new IllegalArgumentException( "Unable to wrap key with the supplied RSA public key", e );
    }
  }

  public static byte[] unwrap( PrivateKey privateKey, byte[] wrapped ) throws CryptoIntegrityException
  {
    if( privateKey == null )
      throw new IllegalArgumentException( "privateKey cannot be null" );

    AsymmetricKeyParameter param;
    try
    {
      param = PrivateKeyFactory.createKey( privateKey.getEncoded() );
    }
    catch( IOException e )
    {
      throw new IllegalArgumentException( "Unsupported RSA private key encoding", e );
    }

    try
    {
      AsymmetricBlockCipher cipher = oaep();
      cipher.init( false, param );

      return cipher.processBlock( wrapped, 0, wrapped.length );
    }
    catch( InvalidCipherTextException | DataLengthException e )
    {
      throw new CryptoIntegrityException( "RSA-OAEP unwrap of the ephemeral key failed", e );
    }
  }

  private static AsymmetricBlockCipher oaep()
  {
    return new OAEPEncoding( new RSAEngine(), new SHA256Digest(), new SHA256Digest(), null );
  }
}
