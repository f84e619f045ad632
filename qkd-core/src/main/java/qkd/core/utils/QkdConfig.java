package qkd.core.utils;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import qkd.core.model.KeyPolicy;
import qkd.core.provider.ProviderSession;
import qkd.core.simulator.QkdSimulator;

/**
 * Party configuration, bound from JSON.
 */
public class QkdConfig
{
  public static final String PROVIDER_LOCAL = "local";
  public static final String PROVIDER_ETSI  = "etsi";

  @JsonProperty( "partyId"       ) private String partyId;
  @JsonProperty( "storagePath"   ) private String storagePath;
  @JsonProperty( "provider"      ) private String provider      = PROVIDER_LOCAL;
  @JsonProperty( "keyLengthBits" ) private int    keyLengthBits = 256;

  @JsonProperty( "keyPolicy"  ) private KeyPolicyConfig  keyPolicy  = new KeyPolicyConfig();
  @JsonProperty( "simulator"  ) private SimulatorConfig  simulator  = new SimulatorConfig();
  @JsonProperty( "etsi"       ) private EtsiConfig       etsi;
  @JsonProperty( "encryption" ) private EncryptionConfig encryption = new EncryptionConfig();

  // Getters
  public String           getPartyId()       { return partyId;       }
  public String           getStoragePath()   { return storagePath;   }
  public String           getProvider()      { return provider;      }
  public int              getKeyLengthBits() { return keyLengthBits; }
  public KeyPolicyConfig  getKeyPolicy()     { return keyPolicy;     }
  public SimulatorConfig  getSimulator()     { return simulator;     }
  public EtsiConfig       getEtsi()          { return etsi;          }
  public EncryptionConfig getEncryption()    { return encryption;    }

  public boolean isEtsiProvider()
  {
    return PROVIDER_ETSI.equalsIgnoreCase( provider );
  }

  public static QkdConfig fromFile( String path ) throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return mapper.readValue( new File( path ), QkdConfig.class );
  }

  public static QkdConfig fromStream( InputStream in ) throws IOException
  {
    ObjectMapper mapper = new ObjectMapper();
    return mapper.readValue( in, QkdConfig.class );
  }

  // Nested Classes
  public static class KeyPolicyConfig
  {
    @JsonProperty( "ttlSeconds" ) private long ttlSeconds = 600;
    @JsonProperty( "maxUsage"   ) private int  maxUsage   = 1;

    public long getTtlSeconds() { return ttlSeconds; }
    public int  getMaxUsage()   { return maxUsage;   }

    public KeyPolicy toKeyPolicy()
    {
      return new KeyPolicy( Duration.ofSeconds( ttlSeconds ), maxUsage );
    }
  }

  public static class SimulatorConfig
  {
    @JsonProperty( "channelErrorRate"   ) private double channelErrorRate   = 0.0;
    @JsonProperty( "qberThreshold"      ) private double qberThreshold      = QkdSimulator.DEFAULT_QBER_THRESHOLD;
    @JsonProperty( "sampleSize"         ) private int    sampleSize         = QkdSimulator.DEFAULT_SAMPLE_SIZE;
    @JsonProperty( "oversamplingFactor" ) private int    oversamplingFactor = QkdSimulator.DEFAULT_OVERSAMPLING;

    public double getChannelErrorRate()   { return channelErrorRate;   }
    public double getQberThreshold()      { return qberThreshold;      }
    public int    getSampleSize()         { return sampleSize;         }
    public int    getOversamplingFactor() { return oversamplingFactor; }

    public QkdSimulator toSimulator()
    {
      return new QkdSimulator( channelErrorRate, qberThreshold, sampleSize, oversamplingFactor );
    }
  }

  public static class EtsiConfig
  {
    @JsonProperty( "accountId"      ) private String accountId;
    @JsonProperty( "kmeId"          ) private String kmeId;
    @JsonProperty( "saeId"          ) private String saeId;
    @JsonProperty( "serverCaCert"   ) private String serverCaCert;
    @JsonProperty( "saeCert"        ) private String saeCert;
    @JsonProperty( "saeKey"         ) private String saeKey;
    @JsonProperty( "timeoutSeconds" ) private int    timeoutSeconds = 10;
    @JsonProperty( "baseUrl"        ) private String baseUrl;

    public String getAccountId()      { return accountId;      }
    public String getKmeId()          { return kmeId;          }
    public String getSaeId()          { return saeId;          }
    public String getServerCaCert()   { return serverCaCert;   }
    public String getSaeCert()        { return saeCert;        }
    public String getSaeKey()         { return saeKey;         }
    public int    getTimeoutSeconds() { return timeoutSeconds; }

    public String getBaseUrl()
    {
      if( baseUrl != null && !baseUrl.isBlank() )
        return baseUrl;
      if( accountId == null || kmeId == null )
        throw new IllegalStateException( "etsi config needs either baseUrl or accountId and kmeId" );

      return ProviderSession.qukaydeeBaseUrl( accountId, kmeId );
    }

    public ProviderSession toSession()
    {
      return new ProviderSession( getBaseUrl(), saeId, path( serverCaCert ), path( saeCert ), path( saeKey ), Duration.ofSeconds( timeoutSeconds ) );
    }

    private static Path path( String value )
    {
      return value != null ? Paths.get( value ) : null;
    }
  }

  public static class EncryptionConfig
  {
    @JsonProperty( "allowDerivedEphemeralKey" ) private boolean allowDerivedEphemeralKey = false;

    public boolean isAllowDerivedEphemeralKey() { return allowDerivedEphemeralKey; }
  }
}
