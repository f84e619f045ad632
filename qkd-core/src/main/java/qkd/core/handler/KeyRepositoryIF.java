package qkd.core.handler;

import java.io.IOException;
import java.util.List;

import qkd.core.model.KeyEntry;

/**
 * Storage of key entries for one party, addressed by key id. Implementations
 * hand out copies; callers persist changes through {@link #save(KeyEntry)}.
 */
public interface KeyRepositoryIF
{
  /**
   * @return a copy of the entry, or null if none is stored under {@code keyId}
   */
  KeyEntry find( String keyId ) throws IOException;

  boolean contains( String keyId ) throws IOException;

  /**
   * Inserts or replaces the entry with the same key id.
   */
  void save( KeyEntry entry ) throws IOException;

  /**
   * Destroys the stored representation of an entry and retires its id, so
   * {@link #isRetired(String)} answers true for it from then on, restarts included.
   *
   * @return true if an entry was removed
   */
  boolean delete( String keyId ) throws IOException;

  boolean isRetired( String keyId ) throws IOException;

  List<KeyEntry> findAll() throws IOException;
}
