package qkd.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.Test;

class KeyEntryTest
{
  private static final Instant CREATED = Instant.parse( "2026-03-01T10:00:00Z" );
  private static final Instant EXPIRES = Instant.parse( "2026-03-01T10:10:00Z" );

  private static KeyEntry entry( int maxUsage )
  {
    return new KeyEntry( "a1b2c3d4e5f60718", new byte[] { 9, 8, 7, 6 }, CREATED, EXPIRES, maxUsage,
                         Map.of( KeyEntry.META_PEER, "bob", KeyEntry.META_ROLE, "master", KeyEntry.META_PROVENANCE, KeyEntry.PROVENANCE_LOCAL ) );
  }

  @Test
  void singleUseKeyIsConsumedAfterOneUse()
  {
    KeyEntry key = entry( 1 );

    key.recordUse();

    assertThat( key.getState() ).isEqualTo( KeyState.CONSUMED );
    assertThat( key.isActive() ).isFalse();
    assertThatThrownBy( key::recordUse ).isInstanceOf( IllegalStateException.class );
  }

  @Test
  void unlimitedKeyStaysActive()
  {
    KeyEntry key = entry( KeyPolicy.UNLIMITED );

    for( int i = 0; i < 50; i++ )
      key.recordUse();

    assertThat( key.getUsageCount() ).isEqualTo( 50 );
    assertThat( key.isActive() ).isTrue();
  }

  @Test
  void expiryIsStrictlyAfterDeadline()
  {
    KeyEntry key = entry( 1 );

    assertThat( key.isExpired( EXPIRES ) ).isFalse();
    assertThat( key.isExpired( EXPIRES.plusMillis( 1 ) ) ).isTrue();
  }

  @Test
  void markExpiredOnlyAffectsActiveKeys()
  {
    KeyEntry consumed = entry( 1 );
    consumed.recordUse();
    consumed.markExpired();

    assertThat( consumed.getState() ).isEqualTo( KeyState.CONSUMED );
  }

  @Test
  void avroRecordPreservesEverything() throws Exception
  {
    KeyEntry key = entry( 3 );
    key.recordUse();

    KeyEntry restored = KeyEntry.deSerialize( KeyEntry.serialize( key ) );

    assertThat( restored.getKeyId() ).isEqualTo( key.getKeyId() );
    assertThat( restored.getKeyData() ).isEqualTo( key.getKeyData() );
    assertThat( restored.getCreatedAt() ).isEqualTo( CREATED );
    assertThat( restored.getExpiresAt() ).isEqualTo( EXPIRES );
    assertThat( restored.getUsageCount() ).isEqualTo( 1 );
    assertThat( restored.getMaxUsage() ).isEqualTo( 3 );
    assertThat( restored.getState() ).isEqualTo( KeyState.ACTIVE );
    assertThat( restored.getPeer() ).isEqualTo( "bob" );
    assertThat( restored.getProvenance() ).isEqualTo( KeyEntry.PROVENANCE_LOCAL );
  }

  @Test
  void accessorsReturnCopies()
  {
    KeyEntry key = entry( 1 );

    key.getKeyData()[ 0 ] = 0;
    KeyEntry copy = key.copy();
    key.clearKeyData();

    assertThat( copy.getKeyData() ).containsExactly( 9, 8, 7, 6 );
    assertThat( key.getKeyData() ).containsOnly( 0 );
  }

  @Test
  void summaryOmitsKeyMaterial()
  {
    KeySummary summary = entry( 1 ).toSummary();

    assertThat( summary.keyId() ).isEqualTo( "a1b2c3d4e5f60718" );
    assertThat( summary.state() ).isEqualTo( KeyState.ACTIVE );
    assertThat( summary.metadata() ).containsEntry( KeyEntry.META_ROLE, "master" );
  }

  @Test
  void expiryBeforeCreationIsRejected()
  {
    assertThatThrownBy( () -> new KeyEntry( "id", new byte[ 1 ], EXPIRES, CREATED, 1, null ) ).isInstanceOf( IllegalArgumentException.class );
  }
}
