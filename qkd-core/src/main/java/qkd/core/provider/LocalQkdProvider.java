package qkd.core.provider;

import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.exceptions.KeyPolicyException;
import qkd.core.exceptions.QkdException;
import qkd.core.model.KeyEntry;
import qkd.core.model.ProvidedKey;
import qkd.core.model.QuantumKey;
import qkd.core.simulator.QkdChannel;

/**
 * Provider backed by the in-process BB84 simulator. Parties that share a
 * {@link QkdChannel} instance can exchange keys through it.
 */
public class LocalQkdProvider implements QkdProviderIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( LocalQkdProvider.class );

  private final QkdChannel channel;
  private final String     localPartyId;

  public LocalQkdProvider( QkdChannel channel, String localPartyId )
  {
    if( channel == null )
      throw new IllegalArgumentException( "channel cannot be null" );
    if( localPartyId == null || localPartyId.isBlank() )
      throw new IllegalArgumentException( "localPartyId cannot be null or blank" );

    this.channel      = channel;
    this.localPartyId = localPartyId;
  }

  @Override
  public ProvidedKey requestKey( String senderId, String receiverId, int keySizeBits ) throws QkdException
  {
    if( !localPartyId.equals( senderId ) )
      throw new KeyPolicyException( "Local party " + localPartyId + " cannot originate keys as " + senderId );

    QuantumKey key = channel.establishKeyPair( senderId, receiverId, keySizeBits );
    LOGGER.debug( "Local BB84 key {} originated for {} -> {}", key.getKeyId(), senderId, receiverId );

    return new ProvidedKey( key.getKeyId(), key.getKeyBytes(), provenance(), null );
  }

  @Override
  public ProvidedKey retrieveKey( String originatorId, String keyId ) throws QkdException
  {
    if( localPartyId.equals( originatorId ) )
      throw new KeyPolicyException( "Party " + localPartyId + " cannot retrieve a key it originated" );

    QuantumKey key = channel.getKey( keyId );
    return new ProvidedKey( key.getKeyId(), key.getKeyBytes(), provenance(), null );
  }

  @Override
  public String getProvenance()
  {
    return KeyEntry.PROVENANCE_LOCAL;
  }

  private Map<String, String> provenance()
  {
    Map<String, String> meta = new HashMap<>();
    meta.put( "source", "local" );
    meta.put( "standard", "BB84" );
    return meta;
  }
}
