package qkd.core.handler;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.model.KeyEntry;

/**
 * Disk-backed repository: one Avro-encoded {@code <keyId>.key} file per entry
 * inside a directory private to one party. Updates are written to a temporary
 * file and renamed over the entry. Deletion leaves an empty
 * {@code <keyId>.retired} marker, then overwrites the entry with random bytes
 * before unlinking it.
 */
public class FileKeyRepository implements KeyRepositoryIF
{
  private static final Logger LOGGER         = LoggerFactory.getLogger( FileKeyRepository.class );
  private static final String FILE_SUFFIX    = ".key";
  private static final String TEMP_SUFFIX    = ".key.tmp";
  private static final String RETIRED_SUFFIX = ".retired";
  private static final int    MIN_WIPE_BYTES = 1024;

  private final Path         storagePath;
  private final SecureRandom secureRandom = new SecureRandom();

  public FileKeyRepository( Path storagePath ) throws IOException
  {
    if( storagePath == null )
      throw new IllegalArgumentException( "storagePath cannot be null" );

    this.storagePath = storagePath;
    Files.createDirectories( storagePath );

    LOGGER.info( "File key repository at {}", storagePath.toAbsolutePath() );
  }

  public Path getStoragePath()
  {
    return storagePath;
  }

  @Override
  public KeyEntry find( String keyId ) throws IOException
  {
    Path file = fileFor( keyId );
    if( !Files.exists( file ) )
      return null;

    return KeyEntry.deSerialize( Files.readAllBytes( file ) );
  }

  @Override
  public boolean contains( String keyId )
  {
    return Files.exists( fileFor( keyId ) );
  }

  @Override
  public void save( KeyEntry entry ) throws IOException
  {
    Path file = fileFor( entry.getKeyId() );
    Path temp = file.resolveSibling( entry.getKeyId() + TEMP_SUFFIX );

    Files.write( temp, KeyEntry.serialize( entry ), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE, StandardOpenOption.DSYNC );
    Files.move( temp, file, StandardCopyOption.ATOMIC_MOVE );
  }

  @Override
  public boolean delete( String keyId ) throws IOException
  {
    Path file = fileFor( keyId );
    if( !Files.exists( file ) )
      return false;

    // retire first; a crash before the wipe must not free the id
    Path marker = markerFor( keyId );
    if( !Files.exists( marker ) )
      Files.createFile( marker );

    wipe( file );
    Files.delete( file );

    LOGGER.debug( "Securely deleted key file for {}", keyId );
    return true;
  }

  @Override
  public boolean isRetired( String keyId )
  {
    return Files.exists( markerFor( keyId ) );
  }

  /**
   * Lists every readable entry. Files that cannot be decoded are logged and
   * left in place; {@link #find(String)} still reports them as failures.
   */
  @Override
  public List<KeyEntry> findAll() throws IOException
  {
    List<KeyEntry> result = new ArrayList<>();

    try( DirectoryStream<Path> stream = Files.newDirectoryStream( storagePath, "*" + FILE_SUFFIX ) )
    {
      for( Path file : stream )
      {
        try
        {
          result.add( KeyEntry.deSerialize( Files.readAllBytes( file ) ) );
        }
        catch( IOException e )
        {
          LOGGER.warn( "Skipping unreadable key file {}: {}", file.getFileName(), e.getMessage() );
        }
      }
    }

    return result;
  }

  /**
   * Overwrites the whole file, and at least {@value #MIN_WIPE_BYTES} bytes, with random data and forces it to disk.
   */
  protected void wipe( Path file ) throws IOException
  {
    long   length = Math.max( Files.size( file ), MIN_WIPE_BYTES );
    byte[] noise  = new byte[(int)Math.min( length, Integer.MAX_VALUE )];
    secureRandom.nextBytes( noise );

    try( FileChannel channel = FileChannel.open( file, StandardOpenOption.WRITE ) )
    {
      ByteBuffer buffer = ByteBuffer.wrap( noise );
      while( buffer.hasRemaining() )
      {
        channel.write( buffer, buffer.position() );
      }
      channel.force( true );
    }
  }

  private Path fileFor( String keyId )
  {
    if( !KeyEntry.isPortableKeyId( keyId ) )
      throw new IllegalArgumentException( "Key ID is not usable as a file name: " + keyId );

    return storagePath.resolve( keyId + FILE_SUFFIX );
  }

  private Path markerFor( String keyId )
  {
    return fileFor( keyId ).resolveSibling( keyId + RETIRED_SUFFIX );
  }
}
