package qkd.core.provider;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.codec.BodyCodec;

import qkd.core.exceptions.ProviderProtocolException;
import qkd.core.exceptions.ProviderTransportException;
import qkd.core.exceptions.QkdException;

/**
 * Thin ETSI GS QKD 014 REST client:
 * <pre>
 *   GET  {base}/keys/{slave_SAE_ID}/status
 *   POST {base}/keys/{slave_SAE_ID}/enc_keys?number=N&amp;size=S
 *   GET  {base}/keys/{master_SAE_ID}/dec_keys?key_ID=K
 * </pre>
 * Calls block the caller until the response arrives or the session timeout
 * passes, so they must not be made from a Vert.x event loop thread.
 */
public class EtsiKmeClient implements AutoCloseable
{
  private static final Logger LOGGER = LoggerFactory.getLogger( EtsiKmeClient.class );

  public static final String F_KEYS  = "keys";
  public static final String F_KEY   = "key";
  public static final String F_ERROR = "error";
  public static final String F_ERRS  = "errors";
  public static final String F_MSG   = "message";

  private final Vertx           vertx;
  private final boolean         ownsVertx;
  private final WebClient       webClient;
  private final ProviderSession session;

  public EtsiKmeClient( Vertx vertx, ProviderSession session ) throws ProviderTransportException
  {
    this( vertx, session, false );
  }

  /**
   * Client with its own Vert.x instance, released by {@link #close()}.
   */
  public EtsiKmeClient( ProviderSession session ) throws ProviderTransportException
  {
    this( Vertx.vertx(), session, true );
  }

  private EtsiKmeClient( Vertx vertx, ProviderSession session, boolean ownsVertx ) throws ProviderTransportException
  {
    if( vertx == null || session == null )
      throw new IllegalArgumentException( "vertx and session are required" );

    this.vertx     = vertx;
    this.ownsVertx = ownsVertx;
    this.session   = session;

    try
    {
      this.webClient = WebClient.create( vertx, session.toWebClientOptions() );
    }
    catch( IOException e )
    {
      if( ownsVertx )
        vertx.close();
      throw new ProviderTransportException( "Unable to load TLS identity for SAE " + session.getSaeId(), e );
    }

    LOGGER.info( "ETSI KME client created for {}", session );
  }

  public ProviderSession getSession()
  {
    return session;
  }

  public JsonObject getStatus( String slaveSaeId ) throws QkdException
  {
    return request( HttpMethod.GET, "/keys/" + slaveSaeId + "/status", Map.of() );
  }

  public List<JsonObject> getKeys( String slaveSaeId, int number, int sizeBits ) throws QkdException
  {
    JsonObject body = request( HttpMethod.POST, "/keys/" + slaveSaeId + "/enc_keys",
                               Map.of( "number", String.valueOf( number ), "size", String.valueOf( sizeBits ) ) );
    return keyList( body );
  }

  public List<JsonObject> getKeysById( String masterSaeId, String keyId ) throws QkdException
  {
    JsonObject body = request( HttpMethod.GET, "/keys/" + masterSaeId + "/dec_keys", Map.of( "key_ID", keyId ) );
    return keyList( body );
  }

  /**
   * Returns a field whose name matches {@code name} ignoring case and
   * underscores, so {@code key_ID}, {@code key_id} and {@code keyId} all match.
   */
  public static Object tolerantField( JsonObject json, String name )
  {
    if( json.containsKey( name ) )
      return json.getValue( name );

    String wanted = normalise( name );
    for( String field : json.fieldNames() )
    {
      if( normalise( field ).equals( wanted ) )
        return json.getValue( field );
    }

    return null;
  }

  private static String normalise( String name )
  {
    return name.replace( "_", "" ).toLowerCase( Locale.ROOT );
  }

  private JsonObject request( HttpMethod method, String path, Map<String, String> params ) throws QkdException
  {
    String url = session.getBaseUrl() + path;
    LOGGER.debug( "ETSI {} {} {}", method, url, params );

    HttpRequest<String> request = webClient.requestAbs( method, url )
                                           .putHeader( "Accept", "application/json" )
                                           .timeout( session.getTimeout().toMillis() )
                                           .as( BodyCodec.string() );
    params.forEach( request::addQueryParam );

    HttpResponse<String> response = await( method == HttpMethod.POST ? request.sendJsonObject( new JsonObject() ) : request.send(), url );

    return parse( response, url );
  }

  private HttpResponse<String> await( Future<HttpResponse<String>> future, String url ) throws ProviderTransportException
  {
    // One second of slack so the request timeout normally fires first
    long waitMs = session.getTimeout().toMillis() + 1000;

    try
    {
      return future.toCompletionStage().toCompletableFuture().get( waitMs, TimeUnit.MILLISECONDS );
    }
    catch( ExecutionException e )
    {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      LOGGER.error( "ETSI request to {} failed: {}", url, cause.toString() );
      throw new ProviderTransportException( "KME request to " + url + " failed: " + cause.getMessage(), cause );
    }
    catch( TimeoutException e )
    {
      LOGGER.error( "ETSI request to {} timed out after {} ms", url, waitMs );
      throw new ProviderTransportException( "KME request to " + url + " timed out", e );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      throw new ProviderTransportException( "Interrupted while waiting for KME at " + url, e );
    }
  }

  private JsonObject parse( HttpResponse<String> response, String url ) throws QkdException
  {
    int        status = response.statusCode();
    String     text   = response.body();
    JsonObject body   = null;

    if( text != null && !text.isBlank() )
    {
      try
      {
        body = new JsonObject( text );
      }
      catch( DecodeException e )
      {
        if( status < 200 || status >= 300 )
          throw new ProviderTransportException( "KME at " + url + " returned HTTP " + status, status );
        throw new ProviderProtocolException( "KME at " + url + " returned a body that is not a JSON object", e );
      }
    }

    String apiError = body != null ? apiError( body ) : null;
    if( apiError != null )
    {
      LOGGER.warn( "KME at {} reported an error (HTTP {}): {}", url, status, apiError );
      throw new ProviderProtocolException( "KME error (HTTP " + status + "): " + apiError );
    }

    if( status < 200 || status >= 300 )
    {
      LOGGER.error( "KME at {} returned HTTP {}", url, status );
      throw new ProviderTransportException( "KME at " + url + " returned HTTP " + status, status );
    }

    if( body == null )
      throw new ProviderProtocolException( "KME at " + url + " returned an empty body" );

    return body;
  }

  private static String apiError( JsonObject body )
  {
    Object error = body.getValue( F_ERROR );
    if( error != null )
      return error.toString();

    Object errors = body.getValue( F_ERRS );
    if( errors instanceof JsonArray arr && !arr.isEmpty() )
      return arr.encode();
    if( errors != null && !( errors instanceof JsonArray ) && !errors.toString().isEmpty() )
      return errors.toString();

    // ETSI error bodies carry a message and no keys
    if( body.getValue( F_MSG ) instanceof String msg && !body.containsKey( F_KEYS ) && !body.containsKey( "stored_key_count" ) )
      return msg;

    return null;
  }

  private static List<JsonObject> keyList( JsonObject body ) throws ProviderProtocolException
  {
    Object keys = body.getValue( F_KEYS );
    if( keys == null )
      return List.of();
    if( !( keys instanceof JsonArray arr ) )
      throw new ProviderProtocolException( "KME field '" + F_KEYS + "' is not an array" );

    List<JsonObject> result = new ArrayList<>( arr.size() );
    for( Object entry : arr )
    {
      if( !( entry instanceof JsonObject obj ) )
        throw new ProviderProtocolException( "KME key entry is not an object" );
      result.add( obj );
    }

    return result;
  }

  @Override
  public void close()
  {
    webClient.close();

    if( ownsVertx )
    {
      try
      {
        vertx.close().toCompletionStage().toCompletableFuture().get( 10, TimeUnit.SECONDS );
      }
      catch( InterruptedException e )
      {
        Thread.currentThread().interrupt();
        LOGGER.warn( "Interrupted while closing Vert.x for SAE {}", session.getSaeId() );
      }
      catch( ExecutionException | TimeoutException e )
      {
        LOGGER.warn( "Vert.x shutdown for SAE {} did not complete cleanly", session.getSaeId(), e );
      }
    }
  }
}
