package qkd.core.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import qkd.core.model.KeyEntry;
import qkd.core.model.KeyPolicy;
import qkd.core.model.KeyState;
import qkd.core.model.KeySummary;

class FileKeyRepositoryTest
{
  private static final Instant CREATED = Instant.parse( "2026-03-01T12:00:00.123456Z" );

  @TempDir
  Path storage;

  @Test
  void entriesRoundTripThroughTheirFiles() throws Exception
  {
    FileKeyRepository repository = new FileKeyRepository( storage );
    KeyEntry          entry      = new KeyEntry( "a1b2c3", new byte[] { 5, 6, 7 }, CREATED, CREATED.plusSeconds( 600 ), 2,
                                                 Map.of( KeyEntry.META_PEER, "bob", KeyEntry.META_ROLE, "master" ) );
    entry.recordUse();

    repository.save( entry );

    assertThat( storage.resolve( "a1b2c3.key" ) ).exists();

    KeyEntry loaded = repository.find( "a1b2c3" );
    assertThat( loaded.getKeyData() ).containsExactly( 5, 6, 7 );
    assertThat( loaded.getCreatedAt() ).isEqualTo( CREATED );
    assertThat( loaded.getExpiresAt() ).isEqualTo( CREATED.plusSeconds( 600 ) );
    assertThat( loaded.getUsageCount() ).isEqualTo( 1 );
    assertThat( loaded.getMaxUsage() ).isEqualTo( 2 );
    assertThat( loaded.getState() ).isEqualTo( KeyState.ACTIVE );
    assertThat( loaded.getPeer() ).isEqualTo( "bob" );
    assertThat( loaded.getRole() ).isEqualTo( "master" );

    assertThat( repository.find( "missing" ) ).isNull();
  }

  @Test
  void usageAndStateSurviveARestart() throws Exception
  {
    MutableClock clock = new MutableClock( CREATED );

    KeyManager before = new KeyManager( "alice", new FileKeyRepository( storage ), null, KeyPolicy.storage(), clock );
    before.storeKey( new byte[] { 1, 2, 3, 4 }, "durable", Map.of() );
    before.getKey( "durable" );

    KeyManager after = new KeyManager( "alice", new FileKeyRepository( storage ), null, KeyPolicy.storage(), clock );

    KeyEntry second = after.getKey( "durable" );
    assertThat( second.getUsageCount() ).isEqualTo( 2 );
    assertThat( second.getState() ).isEqualTo( KeyState.CONSUMED );
    assertThat( after.getKey( "durable" ) ).isNull();
  }

  @Test
  void deleteOverwritesBeforeRemoving() throws Exception
  {
    RecordingRepository repository = new RecordingRepository( storage );
    repository.save( new KeyEntry( "wipe-me", new byte[] { 42, 42, 42, 42 }, CREATED, CREATED.plus( Duration.ofMinutes( 1 ) ), 1, Map.of() ) );

    byte[] original = Files.readAllBytes( storage.resolve( "wipe-me.key" ) );

    assertThat( repository.delete( "wipe-me" ) ).isTrue();
    assertThat( storage.resolve( "wipe-me.key" ) ).doesNotExist();

    assertThat( repository.wiped ).hasSizeGreaterThanOrEqualTo( Math.max( original.length, 1024 ) );
    assertThat( repository.wiped ).isNotEqualTo( original );
    assertThat( repository.delete( "wipe-me" ) ).isFalse();
  }

  @Test
  void findAllListsOnlyKeyFiles() throws Exception
  {
    FileKeyRepository repository = new FileKeyRepository( storage );
    repository.save( new KeyEntry( "one", new byte[] { 1 }, CREATED, CREATED.plusSeconds( 60 ), 1, Map.of() ) );
    repository.save( new KeyEntry( "two", new byte[] { 2 }, CREATED, CREATED.plusSeconds( 60 ), 1, Map.of() ) );
    Files.writeString( storage.resolve( "notes.txt" ), "not a key" );

    assertThat( repository.findAll() ).extracting( KeyEntry::getKeyId ).containsExactlyInAnyOrder( "one", "two" );
  }

  @Test
  void keyIdsMustBeSafeFileNames() throws Exception
  {
    FileKeyRepository repository = new FileKeyRepository( storage );

    assertThatThrownBy( () -> repository.find( "../escape" ) ).isInstanceOf( IllegalArgumentException.class );
    assertThatThrownBy( () -> repository.contains( "a/b" ) ).isInstanceOf( IllegalArgumentException.class );
  }

  @Test
  void corruptFileIsReportedAsIoFailure() throws Exception
  {
    FileKeyRepository repository = new FileKeyRepository( storage );
    Files.write( storage.resolve( "broken.key" ), new byte[] { (byte)0xff, (byte)0xff, (byte)0xff } );

    assertThatThrownBy( () -> repository.find( "broken" ) ).isInstanceOf( IOException.class );
  }

  @Test
  void retiredIdsStayRetiredAfterARestart() throws Exception
  {
    MutableClock clock = new MutableClock( CREATED );

    KeyManager before = new KeyManager( "alice", new FileKeyRepository( storage ), null, KeyPolicy.interactive(), clock );
    before.storeKey( new byte[] { 1, 2, 3 }, "k1", Map.of() );
    before.storeKey( new byte[] { 4, 5, 6 }, "k2", Map.of() );
    before.getKey( "k2" );

    assertThat( before.deleteKey( "k1" ) ).isTrue();
    assertThat( before.cleanupExpiredKeys() ).isEqualTo( 1 );
    assertThat( before.storeKey( new byte[] { 9 }, "k1", Map.of() ) ).isFalse();

    FileKeyRepository reopened = new FileKeyRepository( storage );
    KeyManager        after    = new KeyManager( "alice", reopened, null, KeyPolicy.interactive(), clock );

    assertThat( reopened.isRetired( "k1" ) ).isTrue();
    assertThat( reopened.isRetired( "k2" ) ).isTrue();
    assertThat( after.storeKey( new byte[] { 9 }, "k1", Map.of() ) ).isFalse();
    assertThat( after.storeKey( new byte[] { 9 }, "k2", Map.of() ) ).isFalse();
    assertThat( after.listKeys() ).isEmpty();
  }

  @Test
  void sweepProceedsPastACorruptFile() throws Exception
  {
    MutableClock clock   = new MutableClock( CREATED );
    KeyManager   manager = new KeyManager( "alice", new FileKeyRepository( storage ), null, KeyPolicy.interactive(), clock );

    manager.storeKey( new byte[] { 1, 2, 3 }, "k1", Map.of() );
    Files.write( storage.resolve( "broken.key" ), new byte[] { (byte)0xff, (byte)0xff } );
    clock.advance( Duration.ofHours( 1 ) );

    assertThat( manager.listKeys() ).extracting( KeySummary::keyId ).containsExactly( "k1" );
    assertThat( manager.cleanupExpiredKeys() ).isEqualTo( 1 );
    assertThat( storage.resolve( "k1.key" ) ).doesNotExist();
    assertThat( storage.resolve( "broken.key" ) ).exists();
  }

  @Test
  void saveReplacesTheEntryWithoutLeavingTemporaryFiles() throws Exception
  {
    FileKeyRepository repository = new FileKeyRepository( storage );
    KeyEntry          entry      = new KeyEntry( "k3", new byte[] { 3 }, CREATED, CREATED.plusSeconds( 60 ), 3, Map.of() );

    repository.save( entry );
    entry.recordUse();
    repository.save( entry );

    assertThat( repository.find( "k3" ).getUsageCount() ).isEqualTo( 1 );
    try( Stream<Path> files = Files.list( storage ) )
    {
      assertThat( files ).extracting( p -> p.getFileName().toString() ).containsExactly( "k3.key" );
    }
  }

  /**
   * Captures what the wipe wrote just before the file is unlinked.
   */
  private static final class RecordingRepository extends FileKeyRepository
  {
    byte[] wiped;

    RecordingRepository( Path storagePath ) throws IOException
    {
      super( storagePath );
    }

    @Override
    protected void wipe( Path file ) throws IOException
    {
      super.wipe( file );
      wiped = Files.readAllBytes( file );
    }
  }
}
