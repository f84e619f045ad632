package qkd.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Freshness window and usage limit applied to keys when they are stored.
 * A {@code maxUsage} of 0 means the number of uses is not limited.
 */
public final class KeyPolicy
{
  public static final int UNLIMITED = 0;

  private final Duration ttl;
  private final int      maxUsage;

  public KeyPolicy( Duration ttl, int maxUsage )
  {
    this.ttl      = Objects.requireNonNull( ttl, "TTL cannot be null" );
    this.maxUsage = maxUsage;

    if( ttl.isNegative() || ttl.isZero() )
      throw new IllegalArgumentException( "TTL must be positive" );
    if( maxUsage < 0 )
      throw new IllegalArgumentException( "maxUsage cannot be negative" );
  }

  /** Short-lived single-use keys for interactive messages. */
  public static KeyPolicy interactive()
  {
    return new KeyPolicy( Duration.ofMinutes( 10 ), 1 );
  }

  /** Day-long keys that may be read back once after the first use. */
  public static KeyPolicy storage()
  {
    return new KeyPolicy( Duration.ofHours( 24 ), 2 );
  }

  public Duration getTtl()      { return ttl;      }
  public int      getMaxUsage() { return maxUsage; }

  public boolean isUnlimited()
  {
    return maxUsage == UNLIMITED;
  }

  @Override
  public String toString()
  {
    return String.format( "KeyPolicy{ttl=%s, maxUsage=%s}", ttl, isUnlimited() ? "unlimited" : String.valueOf( maxUsage ) );
  }
}
