package qkd.core.service;

import java.io.IOException;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.crypto.EncryptionEngine;
import qkd.core.exceptions.QkdException;
import qkd.core.handler.FileKeyRepository;
import qkd.core.handler.InMemoryKeyRepository;
import qkd.core.handler.KeyManager;
import qkd.core.handler.KeyRepositoryIF;
import qkd.core.model.EncryptedPackage;
import qkd.core.processor.EnvelopeProcessor;
import qkd.core.provider.EtsiKmeClient;
import qkd.core.provider.EtsiQkdProvider;
import qkd.core.provider.LocalQkdProvider;
import qkd.core.provider.QkdProviderIF;
import qkd.core.simulator.QkdChannel;
import qkd.core.utils.QkdConfig;

/**
 * Object graph of one party: key repository, provider, key manager,
 * encryption engine and envelope processor. Parties never share state
 * except, for local providers, the simulated key channel.
 */
public class QkdParty implements AutoCloseable
{
  private static final Logger LOGGER = LoggerFactory.getLogger( QkdParty.class );

  private final String            partyId;
  private final KeyManager        keyManager;
  private final EncryptionEngine  engine;
  private final EnvelopeProcessor envelopes;
  private final EtsiKmeClient     kmeClient;

  private QkdParty( String partyId, KeyManager keyManager, EncryptionEngine engine, EnvelopeProcessor envelopes, EtsiKmeClient kmeClient )
  {
    this.partyId    = partyId;
    this.keyManager = keyManager;
    this.engine     = engine;
    this.envelopes  = envelopes;
    this.kmeClient  = kmeClient;
  }

  /**
   * Builds a party from configuration. A local provider gets a private
   * channel, which only suits a party talking to itself; use
   * {@link #fromConfig(QkdConfig, QkdChannel)} to pair local parties.
   */
  public static QkdParty fromConfig( QkdConfig config ) throws IOException, QkdException
  {
    QkdChannel channel = config.isEtsiProvider() ? null : new QkdChannel( config.getSimulator().toSimulator(), config.getKeyLengthBits() );
    return fromConfig( config, channel );
  }

  public static QkdParty fromConfig( QkdConfig config, QkdChannel channel ) throws IOException, QkdException
  {
    String partyId = config.getPartyId();
    if( partyId == null || partyId.isBlank() )
      throw new IllegalArgumentException( "partyId is required" );

    KeyRepositoryIF repository = config.getStoragePath() != null ? new FileKeyRepository( Paths.get( config.getStoragePath() ) )
                                                                 : new InMemoryKeyRepository();

    QkdProviderIF provider;
    EtsiKmeClient kmeClient = null;
    String        protocol;

    if( config.isEtsiProvider() )
    {
      if( config.getEtsi() == null )
        throw new IllegalArgumentException( "provider 'etsi' needs an etsi section" );
      if( !partyId.equals( config.getEtsi().getSaeId() ) )
        throw new IllegalArgumentException( "partyId " + partyId + " must equal the configured SAE id " + config.getEtsi().getSaeId() );

      kmeClient = new EtsiKmeClient( config.getEtsi().toSession() );
      provider  = new EtsiQkdProvider( kmeClient );
      protocol  = EncryptedPackage.PROTOCOL_ETSI;
    }
    else if( QkdConfig.PROVIDER_LOCAL.equalsIgnoreCase( config.getProvider() ) )
    {
      if( channel == null )
        throw new IllegalArgumentException( "local provider needs a QkdChannel" );

      provider = new LocalQkdProvider( channel, partyId );
      protocol = EncryptedPackage.PROTOCOL_LOCAL;
    }
    else
    {
      throw new IllegalArgumentException( "Unknown provider: " + config.getProvider() );
    }

    KeyManager        keyManager = new KeyManager( partyId, repository, provider, config.getKeyPolicy().toKeyPolicy() );
    EncryptionEngine  engine     = new EncryptionEngine( config.getEncryption().isAllowDerivedEphemeralKey() );
    EnvelopeProcessor envelopes  = new EnvelopeProcessor( partyId, keyManager, engine, protocol, config.getKeyLengthBits() );

    LOGGER.info( "Party {} ready with {} provider", partyId, config.getProvider() );
    return new QkdParty( partyId, keyManager, engine, envelopes, kmeClient );
  }

  public String            getPartyId()    { return partyId;    }
  public KeyManager        getKeyManager() { return keyManager; }
  public EncryptionEngine  getEngine()     { return engine;     }
  public EnvelopeProcessor getEnvelopes()  { return envelopes;  }

  @Override
  public void close()
  {
    if( kmeClient != null )
      kmeClient.close();
  }
}
