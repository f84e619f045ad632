package qkd.core.crypto;

import java.util.Arrays;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESLightEngine;
import org.bouncycastle.crypto.modes.GCMBlockCipher;
import org.bouncycastle.crypto.modes.GCMModeCipher;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import qkd.core.exceptions.CryptoIntegrityException;

public class AesGcmCipher implements AeadCipherIF
{
  public static final String ALGORITHM = "AES-256-GCM";

  @Override
  public String getAlgorithm()
  {
    return ALGORITHM;
  }

  @Override
  public byte[] encrypt( byte[] key, byte[] nonce, byte[] plaintext )
  {
    try
    {
      return process( true, key, nonce, plaintext );
    }
    catch( InvalidCipherTextException e )
    {
      // GCM only reports this while decrypting
      throw new IllegalStateException( "AES-GCM encryption failed", e );
    }
  }

  @Override
  public byte[] decrypt( byte[] key, byte[] nonce, byte[] ciphertext ) throws CryptoIntegrityException
  {
    if( ciphertext.length < TAG_LENGTH )
      throw new CryptoIntegrityException( "AES-GCM ciphertext shorter than its tag" );

    try
    {
      return process( false, key, nonce, ciphertext );
    }
    catch( InvalidCipherTextException e )
    {
      throw new CryptoIntegrityException( "AES-GCM authentication failed", e );
    }
  }

  private byte[] process( boolean forEncryption, byte[] key, byte[] nonce, byte[] input ) throws InvalidCipherTextException
  {
    // Fresh cipher per call, instances are not shareable between threads
    GCMModeCipher  gcm    = GCMBlockCipher.newInstance( new AESLightEngine() );
    AEADParameters params = new AEADParameters( new KeyParameter( key ), TAG_LENGTH * 8, nonce );
    gcm.init( forEncryption, params );

    byte[] output = new byte[gcm.getOutputSize( input.length )];
    int len = gcm.processBytes( input, 0, input.length, output, 0 );
    len += gcm.doFinal( output, len );

    return len == output.length ? output : Arrays.copyOf( output, len );
  }
}
