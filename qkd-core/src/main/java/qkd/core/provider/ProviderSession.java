package qkd.core.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

import io.vertx.core.net.PemKeyCertOptions;
import io.vertx.core.net.PemTrustOptions;
import io.vertx.ext.web.client.WebClientOptions;

/**
 * Connection parameters of one SAE towards its KME: endpoint, mutual TLS
 * identity and request timeout. Identity travels only in the TLS handshake.
 */
public final class ProviderSession
{
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds( 10 );

  private final String   baseUrl;
  private final String   saeId;
  private final Path     serverCaCert;
  private final Path     saeCert;
  private final Path     saeKey;
  private final Duration timeout;

  public ProviderSession( String baseUrl, String saeId, Path serverCaCert, Path saeCert, Path saeKey, Duration timeout )
  {
    if( baseUrl == null || baseUrl.isBlank() )
      throw new IllegalArgumentException( "baseUrl cannot be null or blank" );
    if( saeId == null || saeId.isBlank() )
      throw new IllegalArgumentException( "saeId cannot be null or blank" );

    this.baseUrl      = baseUrl.endsWith( "/" ) ? baseUrl.substring( 0, baseUrl.length() - 1 ) : baseUrl;
    this.saeId        = saeId;
    this.serverCaCert = serverCaCert;
    this.saeCert      = saeCert;
    this.saeKey       = saeKey;
    this.timeout      = timeout != null ? timeout : DEFAULT_TIMEOUT;
  }

  /**
   * Endpoint of a QuKayDee hosted KME.
   */
  public static String qukaydeeBaseUrl( String accountId, String kmeId )
  {
    return "https://" + kmeId + ".acct-" + accountId + ".etsi-qkd-api.qukaydee.com/api/v1";
  }

  public String   getBaseUrl()      { return baseUrl;      }
  public String   getSaeId()        { return saeId;        }
  public Path     getServerCaCert() { return serverCaCert; }
  public Path     getSaeCert()      { return saeCert;      }
  public Path     getSaeKey()       { return saeKey;       }
  public Duration getTimeout()      { return timeout;      }

  public boolean isTls()
  {
    return baseUrl.regionMatches( true, 0, "https:", 0, 6 );
  }

  /**
   * Client options for this session. For https endpoints the CA and the SAE
   * certificate and key are loaded now, so unreadable files fail here rather
   * than on the first request.
   */
  public WebClientOptions toWebClientOptions() throws IOException
  {
    int timeoutMs = (int)Math.min( Integer.MAX_VALUE, timeout.toMillis() );

    WebClientOptions options = new WebClientOptions();
    options.setConnectTimeout( timeoutMs );
    options.setIdleTimeout( (int)Math.max( 1, timeout.toSeconds() ) );
    options.setUserAgentEnabled( false );

    if( !isTls() )
      return options;

    if( serverCaCert == null || saeCert == null || saeKey == null )
      throw new IllegalArgumentException( "https endpoint " + baseUrl + " needs serverCaCert, saeCert and saeKey" );

    PemTrustOptions   trust    = new PemTrustOptions().addCertValue( TlsIdentityLoader.certificatePem( serverCaCert ) );
    PemKeyCertOptions identity = new PemKeyCertOptions().setCertValue( TlsIdentityLoader.certificatePem( saeCert ) )
                                                        .setKeyValue(  TlsIdentityLoader.privateKeyAsPkcs8Pem( saeKey ) );

    options.setSsl( true );
    options.setVerifyHost( true );
    options.setTrustOptions( trust );
    options.setKeyCertOptions( identity );

    return options;
  }

  @Override
  public String toString()
  {
    return "ProviderSession{baseUrl=" + baseUrl + ", saeId=" + saeId + ", timeout=" + timeout + "}";
  }
}
