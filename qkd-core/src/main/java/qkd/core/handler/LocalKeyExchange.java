package qkd.core.handler;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.exceptions.KeyPolicyException;
import qkd.core.exceptions.QkdException;
import qkd.core.model.KeyEntry;
import qkd.core.model.KeyRole;
import qkd.core.model.QuantumKey;
import qkd.core.simulator.QkdChannel;

/**
 * Runs one BB84 exchange between two in-process parties and deposits the
 * resulting key in both of their key managers.
 */
public class LocalKeyExchange
{
  private static final Logger LOGGER = LoggerFactory.getLogger( LocalKeyExchange.class );

  private final QkdChannel channel;

  public LocalKeyExchange( QkdChannel channel )
  {
    if( channel == null )
      throw new IllegalArgumentException( "channel cannot be null" );

    this.channel = channel;
  }

  public QuantumKey establish( KeyManager sender, KeyManager receiver, int keyLengthBits ) throws QkdException
  {
    if( sender == receiver )
      throw new IllegalArgumentException( "sender and receiver must be distinct key managers" );

    QuantumKey key = channel.establishKeyPair( sender.getManagerId(), receiver.getManagerId(), keyLengthBits );

    byte[] keyBytes = key.getKeyBytes();
    if( !sender.storeKey( keyBytes, key.getKeyId(), metadata( receiver.getManagerId(), KeyRole.MASTER, keyLengthBits ) ) )
      throw new KeyPolicyException( "Key id " + key.getKeyId() + " already known to " + sender.getManagerId() );
    if( !receiver.storeKey( keyBytes, key.getKeyId(), metadata( sender.getManagerId(), KeyRole.SLAVE, keyLengthBits ) ) )
      throw new KeyPolicyException( "Key id " + key.getKeyId() + " already known to " + receiver.getManagerId() );

    LOGGER.info( "Local exchange {} -> {} established key {}", sender.getManagerId(), receiver.getManagerId(), key.getKeyId() );
    return key;
  }

  private static Map<String, String> metadata( String peerId, KeyRole role, int keyLengthBits )
  {
    Map<String, String> meta = new HashMap<>();
    meta.put( KeyEntry.META_PEER,       peerId );
    meta.put( KeyEntry.META_ROLE,       role.getLabel() );
    meta.put( KeyEntry.META_PROVENANCE, KeyEntry.PROVENANCE_LOCAL );
    meta.put( KeyEntry.META_KEY_LENGTH, String.valueOf( keyLengthBits ) );
    return meta;
  }
}
