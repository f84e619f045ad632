package qkd.core.provider;

import qkd.core.exceptions.QkdException;
import qkd.core.model.ProvidedKey;

/**
 * Source of QKD keys for one party, following the ETSI GS QKD 014 split of
 * roles: the master SAE originates a key for a peer, the slave SAE picks the
 * same key up by id.
 */
public interface QkdProviderIF
{
  /**
   * Master flow: obtains a fresh key shared with {@code receiverId}.
   */
  ProvidedKey requestKey( String senderId, String receiverId, int keySizeBits ) throws QkdException;

  /**
   * Slave flow: fetches the key {@code keyId} that {@code originatorId} obtained earlier.
   */
  ProvidedKey retrieveKey( String originatorId, String keyId ) throws QkdException;

  /**
   * @return provenance label stored with every key from this provider
   */
  String getProvenance();
}
