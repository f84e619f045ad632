package qkd.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Key material produced by a QKD exchange together with its identifier.
 */
public final class QuantumKey
{
  private final String keyId;
  private final byte[] keyBytes;

  public QuantumKey( String keyId, byte[] keyBytes )
  {
    this.keyId    = Objects.requireNonNull( keyId,    "Key ID cannot be null" );
    this.keyBytes = Objects.requireNonNull( keyBytes, "Key bytes cannot be null" ).clone();
  }

  public String getKeyId()    { return keyId;            }
  public byte[] getKeyBytes() { return keyBytes.clone(); }
  public int    getLength()   { return keyBytes.length;  }

  public void clearKeyBytes()
  {
    Arrays.fill( keyBytes, (byte)0 );
  }

  @Override
  public String toString()
  {
    return String.format( "QuantumKey{keyId='%s', bytes=%d}", keyId, keyBytes.length );
  }
}
