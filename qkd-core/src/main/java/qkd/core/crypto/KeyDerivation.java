package qkd.core.crypto;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * Hash based key stretching and mixing used to turn raw quantum key
 * material into cipher keys.
 */
public final class KeyDerivation
{
  public static final int    DERIVED_KEY_LENGTH = 32;
  public static final int    MAX_DERIVED_LENGTH = 255 * 32;
  public static final String HKDF_INFO          = "QKD-KEY-DERIVATION";

  private KeyDerivation()
  {
  }

  public static byte[] sha256( byte[] input )
  {
    SHA256Digest digest = new SHA256Digest();
    byte[]       out    = new byte[digest.getDigestSize()];

    digest.update( input, 0, input.length );
    digest.doFinal( out, 0 );
    return out;
  }

  /**
   * HKDF-SHA256 expand step with the secret used directly as the
   * pseudo-random key. Output of a shorter length is a prefix of a longer one.
   */
  public static byte[] derive( byte[] secret, int length )
  {
    if( secret == null || secret.length == 0 )
      throw new IllegalArgumentException( "secret cannot be null/empty" );
    if( length <= 0 || length > MAX_DERIVED_LENGTH )
      throw new IllegalArgumentException( "length must be within 1.." + MAX_DERIVED_LENGTH );

    HKDFBytesGenerator hkdf = new HKDFBytesGenerator( new SHA256Digest() );
    hkdf.init( HKDFParameters.skipExtractParameters( secret, HKDF_INFO.getBytes( StandardCharsets.US_ASCII ) ) );

    byte[] out = new byte[length];
    hkdf.generateBytes( out, 0, length );
    return out;
  }

  /**
   * XOR of the two keys over their common length, hashed with SHA-256.
   */
  public static byte[] mix( byte[] first, byte[] second )
  {
    int    len   = Math.min( first.length, second.length );
    byte[] mixed = new byte[len];

    for( int i = 0; i < len; i++ )
    {
      mixed[i] = (byte)( first[i] ^ second[i] );
    }

    return sha256( mixed );
  }
}
