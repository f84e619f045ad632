package qkd.core.model;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Key handed back by a QKD provider, with the provider's description of where it came from.
 */
public final class ProvidedKey
{
  private final String              keyId;
  private final byte[]              keyBytes;
  private final Map<String, String> metadata;
  private final Duration            expiresIn; // null when the provider does not say

  public ProvidedKey( String keyId, byte[] keyBytes, Map<String, String> metadata, Duration expiresIn )
  {
    this.keyId     = Objects.requireNonNull( keyId,    "Key ID cannot be null" );
    this.keyBytes  = Objects.requireNonNull( keyBytes, "Key bytes cannot be null" ).clone();
    this.metadata  = metadata != null ? new HashMap<>( metadata ) : new HashMap<>();
    this.expiresIn = expiresIn;
  }

  public String              getKeyId()     { return keyId;                                  }
  public byte[]              getKeyBytes()  { return keyBytes.clone();                       }
  public Map<String, String> getMetadata()  { return Collections.unmodifiableMap( metadata ); }
  public Duration            getExpiresIn() { return expiresIn;                              }

  @Override
  public String toString()
  {
    return String.format( "ProvidedKey{keyId='%s', bytes=%d, metadata=%s}", keyId, keyBytes.length, metadata );
  }
}
