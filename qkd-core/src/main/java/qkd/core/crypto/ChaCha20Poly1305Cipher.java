package qkd.core.crypto;

import java.util.Arrays;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import qkd.core.exceptions.CryptoIntegrityException;

public class ChaCha20Poly1305Cipher implements AeadCipherIF
{
  public static final String ALGORITHM = "ChaCha20-Poly1305";

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
      throw new IllegalStateException( "ChaCha20-Poly1305 encryption failed", e );
    }
  }

  @Override
  public byte[] decrypt( byte[] key, byte[] nonce, byte[] ciphertext ) throws CryptoIntegrityException
  {
    if( ciphertext.length < TAG_LENGTH )
      throw new CryptoIntegrityException( "ChaCha20-Poly1305 ciphertext shorter than its tag" );

    try
    {
      return process( false, key, nonce, ciphertext );
    }
    catch( InvalidCipherTextException e )
    {
      throw new CryptoIntegrityException( "ChaCha20-Poly1305 authentication failed", e );
    }
  }

  private byte[] process( boolean forEncryption, byte[] key, byte[] nonce, byte[] input ) throws InvalidCipherTextException
  {
    ChaCha20Poly1305 aead = new ChaCha20Poly1305();
    aead.init( forEncryption, new AEADParameters( new KeyParameter( key ), TAG_LENGTH * 8, nonce ) );

    byte[] output = new byte[aead.getOutputSize( input.length )];
    int len = aead.processBytes( input, 0, input.length, output, 0 );
    len += aead.doFinal( output, len );

    return len == output.length ? output : Arrays.copyOf( output, len );
  }
}
