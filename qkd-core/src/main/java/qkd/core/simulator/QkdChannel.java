package qkd.core.simulator;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.exceptions.KeyNotFoundException;
import qkd.core.exceptions.QberThresholdException;
import qkd.core.model.QuantumKey;

/**
 * In-memory key channel for parties paired inside one process. Each
 * established key is kept by id so the peer can pick it up later.
 */
public class QkdChannel
{
  private static final Logger LOGGER = LoggerFactory.getLogger( QkdChannel.class );

  private final QkdSimulator simulator;
  private final int          defaultKeyLengthBits;

  private final Map<String, QuantumKey> keyStore = new ConcurrentHashMap<>();

  public QkdChannel( QkdSimulator simulator, int defaultKeyLengthBits )
  {
    if( simulator == null )
      throw new IllegalArgumentException( "simulator cannot be null" );

    this.simulator            = simulator;
    this.defaultKeyLengthBits = defaultKeyLengthBits;
  }

  public QkdChannel()
  {
    this( new QkdSimulator(), 256 );
  }

  public QuantumKey establishKeyPair( String partyA, String partyB ) throws QberThresholdException
  {
    return establishKeyPair( partyA, partyB, defaultKeyLengthBits );
  }

  public QuantumKey establishKeyPair( String partyA, String partyB, int keyLengthBits ) throws QberThresholdException
  {
    QuantumKey key = simulator.generateQuantumKey( keyLengthBits );
    keyStore.put( key.getKeyId(), key );

    LOGGER.debug( "Established {} bit key {} between {} and {}", keyLengthBits, key.getKeyId(), partyA, partyB );
    return key;
  }

  public QuantumKey getKey( String keyId ) throws KeyNotFoundException
  {
    QuantumKey key = keyId != null ? keyStore.get( keyId ) : null;
    if( key == null )
      throw new KeyNotFoundException( keyId, "Key ID " + keyId + " not found" );

    return key;
  }

  public int getDefaultKeyLengthBits()
  {
    return defaultKeyLengthBits;
  }
}
