package qkd.core.handler;


import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.exceptions.KeyPolicyException;
import qkd.core.exceptions.KeyStorageException;
import qkd.core.exceptions.ProviderTransportException;
import qkd.core.exceptions.QkdException;
import qkd.core.model.KeyEntry;
import qkd.core.model.KeyPolicy;
import qkd.core.model.KeyRole;
import qkd.core.model.KeySummary;
import qkd.core.model.ProvidedKey;
import qkd.core.model.QuantumKey;
import qkd.core.provider.QkdProviderIF;

/**
 * Authoritative key store of one party. Keys enter either from the
 * configured provider (master or slave role) or through {@link #storeKey},
 * and leave through use, expiry or secure deletion.
 *
 * Lifecycle: ACTIVE until the usage limit is reached (CONSUMED) or the
 * freshness window passes (EXPIRED). Only ACTIVE, unexpired entries release
 * key material; everything else stays on record until the next
 * {@link #cleanupExpiredKeys()} sweep.
 *
 * All mutations of the key table run under this instance's monitor. Provider
 * calls happen outside it.
 */
public class KeyManager
{
  private static final Logger LOGGER = LoggerFactory.getLogger( KeyManager.class );

  private final String          managerId;
  private final KeyRepositoryIF repository;
  private final QkdProviderIF   provider;
  private final KeyPolicy       policy;
  private final Clock           clock;

  // Ids whose provider fetch is in progress; guarded by this
  private final Set<String> fetching = new HashSet<>();

  public KeyManager( String managerId, KeyRepositoryIF repository, QkdProviderIF provider, KeyPolicy policy, Clock clock )
  {
    if( managerId == null || managerId.isBlank() )
      throw new IllegalArgumentException( "managerId cannot be null or blank" );
    if( repository == null )
      throw new IllegalArgumentException( "repository cannot be null" );

    this.managerId  = managerId;
    this.repository = repository;
    this.provider   = provider;
    this.policy     = policy != null ? policy : KeyPolicy.interactive();
    this.clock      = clock  != null ? clock  : Clock.systemUTC();

    LOGGER.info( "KeyManager {} initialized with policy {}", managerId, this.policy );
  }

  public KeyManager( String managerId, KeyRepositoryIF repository, QkdProviderIF provider, KeyPolicy policy )
  {
    this( managerId, repository, provider, policy, Clock.systemUTC() );
  }

  public String    getManagerId() { return managerId; }
  public KeyPolicy getPolicy()    { return policy;    }

  /**
   * Originates a key shared with {@code peerId} through the provider's master
   * flow and stores it with role master. Handing the key to its originator
   * does not count as a use.
   */
  public QuantumKey requestQuantumKey( String peerId, int keyLengthBits ) throws QkdException
  {
    if( peerId == null || peerId.isBlank() )
      throw new IllegalArgumentException( "peerId cannot be null or blank" );

    ProvidedKey provided = requireProvider().requestKey( managerId, peerId, keyLengthBits );
    byte[]      keyBytes = provided.getKeyBytes();

    Map<String, String> metadata = buildMetadata( provided, peerId, KeyRole.MASTER );
    metadata.put( KeyEntry.META_KEY_LENGTH, String.valueOf( keyLengthBits ) );

    if( !storeKey( keyBytes, provided.getKeyId(), metadata, effectiveTtl( provided ) ) )
      throw new KeyPolicyException( "Provider returned key id " + provided.getKeyId() + " which is already known to " + managerId );

    LOGGER.info( "KeyManager {} obtained key {} for peer {} ({} bits)", managerId, provided.getKeyId(), peerId, keyLengthBits );
    return new QuantumKey( provided.getKeyId(), keyBytes );
  }

  /**
   * Returns the key {@code keyId} originated by {@code originatorId}. A locally
   * held copy is used when present; otherwise the key is fetched through the
   * provider's slave flow and stored with role slave. Either way one use is counted.
   *
   * @return the key material, or null if the locally held entry is no longer usable
   */
  public byte[] retrieveQuantumKey( String originatorId, String keyId ) throws QkdException
  {
    if( keyId == null || keyId.isBlank() )
      throw new IllegalArgumentException( "keyId cannot be null or blank" );

    synchronized( this )
    {
      awaitFetch( keyId );

      if( isKnown( keyId ) )
      {
        KeyEntry local = getKey( keyId );
        return local != null ? local.getKeyData() : null;
      }

      fetching.add( keyId );
    }

    try
    {
      ProvidedKey provided = requireProvider().retrieveKey( originatorId, keyId );
      if( !keyId.equals( provided.getKeyId() ) )
        throw new KeyPolicyException( "Provider answered with key " + provided.getKeyId() + " for requested key " + keyId );

      synchronized( this )
      {
        if( !storeKey( provided.getKeyBytes(), keyId, buildMetadata( provided, originatorId, KeyRole.SLAVE ), effectiveTtl( provided ) ) )
          throw new KeyPolicyException( "Key " + keyId + " was stored by another caller during its retrieval" );

        LOGGER.info( "KeyManager {} retrieved key {} originated by {}", managerId, keyId, originatorId );

        KeyEntry entry = getKey( keyId );
        return entry != null ? entry.getKeyData() : null;
      }
    }
    finally
    {
      synchronized( this )
      {
        fetching.remove( keyId );
        notifyAll();
      }
    }
  }

  /**
   * Stores a key under the policy's freshness window.
   *
   * @return false if the key id is already stored or was retired by the repository
   */
  public boolean storeKey( byte[] keyBytes, String keyId, Map<String, String> metadata ) throws KeyStorageException
  {
    return storeKey( keyBytes, keyId, metadata, policy.getTtl() );
  }

  public synchronized boolean storeKey( byte[] keyBytes, String keyId, Map<String, String> metadata, Duration ttl ) throws KeyStorageException
  {
    if( keyBytes == null || keyBytes.length == 0 )
      throw new IllegalArgumentException( "keyBytes cannot be null or empty" );
    if( keyId == null || keyId.isBlank() )
      throw new IllegalArgumentException( "keyId cannot be null or blank" );

    if( isKnown( keyId ) )
    {
      LOGGER.warn( "KeyManager {} refused to store duplicate key id {}", managerId, keyId );
      return false;
    }

    Instant  now   = clock.instant();
    KeyEntry entry = new KeyEntry( keyId, keyBytes, now, now.plus( ttl ), policy.getMaxUsage(), metadata );

    try
    {
      repository.save( entry );
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Failed to persist key " + keyId, e );
    }

    LOGGER.debug( "KeyManager {} stored key {} expiring {}", managerId, keyId, entry.getExpiresAt() );
    return true;
  }

  /**
   * Looks a key up for use. A successful return counts one use; the entry
   * turns CONSUMED when its usage limit is reached. Expired entries are marked
   * EXPIRED on the way.
   *
   * @return a snapshot of the entry including key material, or null if the
   *         key is absent, expired or already consumed
   */
  public synchronized KeyEntry getKey( String keyId ) throws KeyStorageException
  {
    try
    {
      KeyEntry entry = repository.find( keyId );
      if( entry == null || !entry.isActive() )
        return null;

      if( entry.isExpired( clock.instant() ) )
      {
        entry.markExpired();
        repository.save( entry );
        LOGGER.debug( "KeyManager {} key {} expired at {}", managerId, keyId, entry.getExpiresAt() );
        return null;
      }

      entry.recordUse();
      repository.save( entry );

      if( !entry.isActive() )
        LOGGER.debug( "KeyManager {} key {} consumed after {} uses", managerId, keyId, entry.getUsageCount() );

      return entry;
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Failed to access key " + keyId, e );
    }
  }

  /**
   * Destroys a key: the persisted copy is overwritten and removed, and the id is retired.
   */
  public synchronized boolean deleteKey( String keyId ) throws KeyStorageException
  {
    try
    {
      boolean deleted = repository.delete( keyId );
      if( deleted )
        LOGGER.info( "KeyManager {} deleted key {}", managerId, keyId );

      return deleted;
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Failed to delete key " + keyId, e );
    }
  }

  /**
   * Marks timed-out ACTIVE entries EXPIRED, then deletes every entry that is not ACTIVE.
   *
   * @return number of entries deleted
   */
  public synchronized int cleanupExpiredKeys() throws KeyStorageException
  {
    Instant now     = clock.instant();
    int     removed = 0;

    try
    {
      for( KeyEntry entry : repository.findAll() )
      {
        if( entry.isActive() && entry.isExpired( now ) )
          entry.markExpired();

        if( !entry.isActive() && repository.delete( entry.getKeyId() ) )
          removed++;
      }
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Key cleanup failed after removing " + removed + " keys", e );
    }

    LOGGER.info( "KeyManager {} cleanup removed {} keys", managerId, removed );
    return removed;
  }

  public synchronized List<KeySummary> listKeys() throws KeyStorageException
  {
    try
    {
      List<KeySummary> summaries = new ArrayList<>();
      for( KeyEntry entry : repository.findAll() )
      {
        summaries.add( entry.toSummary() );
      }
      return summaries;
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Failed to list keys", e );
    }
  }

  private boolean isKnown( String keyId ) throws KeyStorageException
  {
    try
    {
      return repository.contains( keyId ) || repository.isRetired( keyId );
    }
    catch( IOException e )
    {
      throw new KeyStorageException( "Failed to look up key " + keyId, e );
    }
  }

  private void awaitFetch( String keyId ) throws ProviderTransportException
  {
    while( fetching.contains( keyId ) )
    {
      try
      {
        wait();
      }
      catch( InterruptedException e )
      {
        Thread.currentThread().interrupt();
        throw new ProviderTransportException( "Interrupted while key " + keyId + " was being fetched", e );
      }
    }
  }

  private QkdProviderIF requireProvider()
  {
    if( provider == null )
      throw new IllegalStateException( "KeyManager " + managerId + " has no QKD provider configured" );
    return provider;
  }

  private Map<String, String> buildMetadata( ProvidedKey provided, String peerId, KeyRole role )
  {
    Map<String, String> metadata = new HashMap<>( provided.getMetadata() );
    metadata.put( KeyEntry.META_PEER,       peerId );
    metadata.put( KeyEntry.META_ROLE,       role.getLabel() );
    metadata.put( KeyEntry.META_PROVENANCE, provider.getProvenance() );
    return metadata;
  }

  private Duration effectiveTtl( ProvidedKey provided )
  {
    Duration providerTtl = provided.getExpiresIn();
    if( providerTtl != null && !providerTtl.isNegative() && !providerTtl.isZero() && providerTtl.compareTo( policy.getTtl() ) < 0 )
      return providerTtl;

    return policy.getTtl();
  }
}
