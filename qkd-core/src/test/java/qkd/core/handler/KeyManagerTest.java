package qkd.core.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import qkd.core.exceptions.KeyPolicyException;
import qkd.core.model.KeyEntry;
import qkd.core.model.KeyPolicy;
import qkd.core.model.KeyState;
import qkd.core.model.KeySummary;
import qkd.core.model.QuantumKey;

class KeyManagerTest
{
  private static final Instant START = Instant.parse( "2026-03-01T12:00:00Z" );

  private MutableClock          clock;
  private StubProvider          provider;
  private InMemoryKeyRepository repository;

  @BeforeEach
  void setUp()
  {
    clock      = new MutableClock( START );
    provider   = new StubProvider();
    repository = new InMemoryKeyRepository();
  }

  private KeyManager manager( KeyPolicy policy )
  {
    return new KeyManager( "alice", repository, provider, policy, clock );
  }

  @Test
  void requestedKeyIsStoredAsMasterWithoutCountingAUse() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );

    QuantumKey key = manager.requestQuantumKey( "bob", 256 );

    assertThat( key.getLength() ).isEqualTo( 32 );

    KeySummary summary = manager.listKeys().get( 0 );
    assertThat( summary.keyId() ).isEqualTo( key.getKeyId() );
    assertThat( summary.usageCount() ).isZero();
    assertThat( summary.state() ).isEqualTo( KeyState.ACTIVE );
    assertThat( summary.expiresAt() ).isEqualTo( START.plus( Duration.ofMinutes( 10 ) ) );
    assertThat( summary.metadata() ).containsEntry( KeyEntry.META_PEER, "bob" )
                                    .containsEntry( KeyEntry.META_ROLE, "master" )
                                    .containsEntry( KeyEntry.META_PROVENANCE, "stub" )
                                    .containsEntry( KeyEntry.META_KEY_LENGTH, "256" )
                                    .containsEntry( "source", "stub" );
  }

  @Test
  void singleUseKeyIsReleasedExactlyOnce() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );
    QuantumKey key     = manager.requestQuantumKey( "bob", 128 );

    KeyEntry first = manager.getKey( key.getKeyId() );
    assertThat( first ).isNotNull();
    assertThat( first.getKeyData() ).isEqualTo( key.getKeyBytes() );
    assertThat( first.getUsageCount() ).isEqualTo( 1 );
    assertThat( first.getState() ).isEqualTo( KeyState.CONSUMED );

    assertThat( manager.getKey( key.getKeyId() ) ).isNull();
    // still on record until the next cleanup
    assertThat( manager.listKeys() ).extracting( KeySummary::state ).containsExactly( KeyState.CONSUMED );
  }

  @Test
  void usageLimitAllowsFurtherUsesUpToTheMaximum() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.storage() );
    String     keyId   = manager.requestQuantumKey( "bob", 128 ).getKeyId();

    assertThat( manager.getKey( keyId ).getState() ).isEqualTo( KeyState.ACTIVE );
    assertThat( manager.getKey( keyId ).getState() ).isEqualTo( KeyState.CONSUMED );
    assertThat( manager.getKey( keyId ) ).isNull();
  }

  @Test
  void unlimitedPolicyNeverConsumes() throws Exception
  {
    KeyManager manager = manager( new KeyPolicy( Duration.ofMinutes( 5 ), KeyPolicy.UNLIMITED ) );
    String     keyId   = manager.requestQuantumKey( "bob", 128 ).getKeyId();

    for( int i = 0; i < 25; i++ )
    {
      assertThat( manager.getKey( keyId ) ).isNotNull();
    }
    assertThat( manager.listKeys().get( 0 ).usageCount() ).isEqualTo( 25 );
  }

  @Test
  void expiredKeyIsUnavailableAndMarkedExpired() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );
    String     keyId   = manager.requestQuantumKey( "bob", 128 ).getKeyId();

    clock.advance( Duration.ofMinutes( 10 ).plusSeconds( 1 ) );

    assertThat( manager.getKey( keyId ) ).isNull();
    assertThat( manager.listKeys().get( 0 ).state() ).isEqualTo( KeyState.EXPIRED );
  }

  @Test
  void providerExpiryShortensTheFreshnessWindow() throws Exception
  {
    provider.expiresIn = Duration.ofSeconds( 30 );
    KeyManager manager = manager( KeyPolicy.interactive() );

    String keyId = manager.requestQuantumKey( "bob", 128 ).getKeyId();

    assertThat( manager.listKeys().get( 0 ).expiresAt() ).isEqualTo( START.plusSeconds( 30 ) );
    clock.advance( Duration.ofSeconds( 31 ) );
    assertThat( manager.getKey( keyId ) ).isNull();
  }

  @Test
  void cleanupRemovesEveryInactiveEntryAndLeavesTheRestUntouched() throws Exception
  {
    KeyManager manager = manager( new KeyPolicy( Duration.ofMinutes( 10 ), 1 ) );

    String consumed = manager.requestQuantumKey( "bob", 128 ).getKeyId();
    manager.getKey( consumed );

    String timedOut = manager.requestQuantumKey( "bob", 128 ).getKeyId();
    clock.advance( Duration.ofMinutes( 6 ) );
    String fresh = manager.requestQuantumKey( "bob", 128 ).getKeyId();
    clock.advance( Duration.ofMinutes( 5 ) );

    int removed = manager.cleanupExpiredKeys();

    assertThat( removed ).isEqualTo( 2 );
    assertThat( repository.contains( consumed ) ).isFalse();
    assertThat( repository.contains( timedOut ) ).isFalse();

    List<KeySummary> left = manager.listKeys();
    assertThat( left ).extracting( KeySummary::keyId ).containsExactly( fresh );
    assertThat( left.get( 0 ).usageCount() ).isZero();
    assertThat( left.get( 0 ).state() ).isEqualTo( KeyState.ACTIVE );

    assertThat( manager.cleanupExpiredKeys() ).isZero();
  }

  @Test
  void storeKeyRefusesDuplicates() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );

    assertThat( manager.storeKey( new byte[] { 1, 2, 3 }, "k1", Map.of( "peer", "bob" ) ) ).isTrue();
    assertThat( manager.storeKey( new byte[] { 9, 9, 9 }, "k1", Map.of() ) ).isFalse();

    assertThat( manager.getKey( "k1" ).getKeyData() ).containsExactly( 1, 2, 3 );
  }

  @Test
  void deletedKeyIdIsRetiredForGood() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );
    manager.storeKey( new byte[] { 1, 2, 3 }, "k1", Map.of() );

    assertThat( manager.deleteKey( "k1" ) ).isTrue();
    assertThat( manager.deleteKey( "k1" ) ).isFalse();
    assertThat( manager.getKey( "k1" ) ).isNull();
    assertThat( manager.storeKey( new byte[] { 4, 5, 6 }, "k1", Map.of() ) ).isFalse();
    assertThat( repository.isRetired( "k1" ) ).isTrue();
  }

  @Test
  void retiredKeyIdIsNotFetchedAgain() throws Exception
  {
    provider.requestKey( "bob", "alice", 128 );

    KeyManager manager = manager( KeyPolicy.interactive() );
    assertThat( manager.retrieveQuantumKey( "bob", "key-1" ) ).hasSize( 16 );
    assertThat( manager.cleanupExpiredKeys() ).isEqualTo( 1 );

    KeyManager restarted = manager( KeyPolicy.interactive() );
    assertThat( restarted.retrieveQuantumKey( "bob", "key-1" ) ).isNull();
    assertThat( provider.fetches.get() ).isEqualTo( 1 );
  }

  @Test
  void reissuedKeyIdFromTheProviderIsRejected() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );
    provider.fixedKeyId = "same-id";

    manager.requestQuantumKey( "bob", 128 );

    assertThatThrownBy( () -> manager.requestQuantumKey( "bob", 128 ) ).isInstanceOf( KeyPolicyException.class );
  }

  @Test
  void requestedKeyIdsNeverRepeat() throws Exception
  {
    KeyManager  manager = manager( KeyPolicy.interactive() );
    Set<String> seen    = new HashSet<>();

    for( int i = 0; i < 50; i++ )
    {
      assertThat( seen.add( manager.requestQuantumKey( "bob", 64 ).getKeyId() ) ).isTrue();
    }
  }

  @Test
  void retrievedKeyIsFetchedOnceStoredAsSlaveAndCounted() throws Exception
  {
    StubProvider shared = provider;
    shared.requestKey( "bob", "alice", 256 );

    KeyManager manager = manager( KeyPolicy.interactive() );

    byte[] key = manager.retrieveQuantumKey( "bob", "key-1" );

    assertThat( key ).hasSize( 32 );
    assertThat( shared.fetches.get() ).isEqualTo( 1 );

    KeySummary summary = manager.listKeys().get( 0 );
    assertThat( summary.metadata() ).containsEntry( KeyEntry.META_ROLE, "slave" )
                                    .containsEntry( KeyEntry.META_PEER, "bob" );
    assertThat( summary.usageCount() ).isEqualTo( 1 );
    assertThat( summary.state() ).isEqualTo( KeyState.CONSUMED );

    // the local copy is used up; the provider is not asked again
    assertThat( manager.retrieveQuantumKey( "bob", "key-1" ) ).isNull();
    assertThat( shared.fetches.get() ).isEqualTo( 1 );
  }

  @Test
  void retrievingALocallyHeldKeyCountsAUse() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.storage() );
    QuantumKey key     = manager.requestQuantumKey( "bob", 128 );

    assertThat( manager.retrieveQuantumKey( "alice", key.getKeyId() ) ).isEqualTo( key.getKeyBytes() );
    assertThat( manager.listKeys().get( 0 ).usageCount() ).isEqualTo( 1 );
    assertThat( provider.fetches.get() ).isZero();
  }

  @Test
  void concurrentReadersShareASingleUse() throws Exception
  {
    KeyManager manager = manager( KeyPolicy.interactive() );
    String     keyId   = manager.requestQuantumKey( "bob", 128 ).getKeyId();

    ExecutorService pool = Executors.newFixedThreadPool( 8 );
    try
    {
      List<Callable<KeyEntry>> readers = new ArrayList<>();
      for( int i = 0; i < 32; i++ )
      {
        readers.add( () -> manager.getKey( keyId ) );
      }

      int released = 0;
      for( Future<KeyEntry> result : pool.invokeAll( readers ) )
      {
        if( result.get() != null )
          released++;
      }

      assertThat( released ).isEqualTo( 1 );
    }
    finally
    {
      pool.shutdownNow();
    }
  }

  @Test
  void concurrentRetrievalsOfANewKeyShareOneFetch() throws Exception
  {
    provider.requestKey( "bob", "alice", 128 );
    provider.fetchStarted = new CountDownLatch( 1 );
    provider.fetchGate    = new CountDownLatch( 1 );

    KeyManager manager = manager( KeyPolicy.storage() );

    ExecutorService pool = Executors.newFixedThreadPool( 2 );
    try
    {
      Future<byte[]> first = pool.submit( () -> manager.retrieveQuantumKey( "bob", "key-1" ) );
      assertThat( provider.fetchStarted.await( 5, TimeUnit.SECONDS ) ).isTrue();

      Future<byte[]> second = pool.submit( () -> manager.retrieveQuantumKey( "bob", "key-1" ) );
      Thread.sleep( 100 );
      provider.fetchGate.countDown();

      assertThat( first.get( 5, TimeUnit.SECONDS ) ).isEqualTo( provider.issued.get( "key-1" ) );
      assertThat( second.get( 5, TimeUnit.SECONDS ) ).isEqualTo( provider.issued.get( "key-1" ) );
    }
    finally
    {
      pool.shutdownNow();
    }

    assertThat( provider.fetches.get() ).isEqualTo( 1 );

    KeySummary summary = manager.listKeys().get( 0 );
    assertThat( summary.usageCount() ).isEqualTo( 2 );
    assertThat( summary.state() ).isEqualTo( KeyState.CONSUMED );
  }

  @Test
  void managerWithoutProviderCanStillStoreKeys() throws Exception
  {
    KeyManager manager = new KeyManager( "alice", repository, null, KeyPolicy.interactive(), clock );

    assertThat( manager.storeKey( new byte[] { 7 }, "manual", Map.of() ) ).isTrue();
    assertThatThrownBy( () -> manager.requestQuantumKey( "bob", 128 ) ).isInstanceOf( IllegalStateException.class );
  }
}
