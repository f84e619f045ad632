package qkd.core.crypto;

import qkd.core.exceptions.KeyPolicyException;

public final class OneTimePad
{
  private OneTimePad()
  {
  }

  /**
   * XORs {@code data} with the leading bytes of {@code key}. The operation is
   * its own inverse. Keys shorter than the data are rejected, never stretched.
   */
  public static byte[] apply( byte[] data, byte[] key ) throws KeyPolicyException
  {
    if( data == null || key == null )
      throw new IllegalArgumentException( "data and key are required" );
    if( key.length < data.length )
      throw new KeyPolicyException( "One-time pad needs " + data.length + " key bytes but only " + key.length + " are available" );

    byte[] out = new byte[data.length];
    for( int i = 0; i < data.length; i++ )
    {
      out[i] = (byte)( data[i] ^ key[i] );
    }

    return out;
  }
}
