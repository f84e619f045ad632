package qkd.core.provider;

import java.time.Duration;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.vertx.core.json.JsonObject;

import qkd.core.exceptions.KeyNotFoundException;
import qkd.core.exceptions.KeyPolicyException;
import qkd.core.exceptions.ProviderProtocolException;
import qkd.core.exceptions.QkdException;
import qkd.core.model.KeyEntry;
import qkd.core.model.ProvidedKey;

/**
 * Provider backed by a remote KME speaking ETSI GS QKD 014. The configured
 * SAE acts as master when it originates keys and as slave when it fetches
 * keys another SAE originated.
 */
public class EtsiQkdProvider implements QkdProviderIF
{
  private static final Logger LOGGER = LoggerFactory.getLogger( EtsiQkdProvider.class );

  public static final String SOURCE   = "qukaydee";
  public static final String STANDARD = "ETSI-GS-QKD-014";

  public static final long DEFAULT_KEY_EXPIRY_SECONDS = 600;

  private static final String F_STORED_KEY_COUNT = "stored_key_count";
  private static final String F_MAX_KEY_SIZE     = "max_key_size";
  private static final String F_MIN_KEY_SIZE     = "min_key_size";
  private static final String F_KEY_EXPIRY_TIME  = "key_expiry_time";
  private static final String F_KEY_ID           = "key_ID";

  private final EtsiKmeClient client;
  private final String        saeId;

  public EtsiQkdProvider( EtsiKmeClient client )
  {
    if( client == null )
      throw new IllegalArgumentException( "client cannot be null" );

    this.client = client;
    this.saeId  = client.getSession().getSaeId();
  }

  public EtsiKmeClient getClient()
  {
    return client;
  }

  @Override
  public ProvidedKey requestKey( String senderId, String receiverId, int keySizeBits ) throws QkdException
  {
    if( !saeId.equals( senderId ) )
      throw new KeyPolicyException( "Configured SAE " + saeId + " cannot act as " + senderId );
    if( keySizeBits <= 0 || keySizeBits % 8 != 0 )
      throw new IllegalArgumentException( "keySizeBits must be a positive multiple of 8, got " + keySizeBits );

    JsonObject status = client.getStatus( receiverId );

    long storedKeys = longField( status, F_STORED_KEY_COUNT, 0 );
    if( storedKeys <= 0 )
      throw new KeyPolicyException( "No keys available in the key stream towards " + receiverId );

    long maxSize = longField( status, F_MAX_KEY_SIZE, keySizeBits );
    if( keySizeBits > maxSize )
      throw new KeyPolicyException( "Requested key too large (" + keySizeBits + " > " + maxSize + " bits)" );

    long minSize = longField( status, F_MIN_KEY_SIZE, keySizeBits );
    if( keySizeBits < minSize )
      throw new KeyPolicyException( "Requested key too small (" + keySizeBits + " < " + minSize + " bits)" );

    List<JsonObject> keys = client.getKeys( receiverId, 1, keySizeBits );
    if( keys.isEmpty() )
      throw new ProviderProtocolException( "KME returned no keys from enc_keys" );

    JsonObject entry = keys.get( 0 );
    String     keyId = keyId( entry );
    if( keyId == null )
      throw new ProviderProtocolException( "KME key entry has no " + F_KEY_ID );

    byte[] keyBytes = decodeKey( entry, keyId );
    long   expiry   = longField( status, F_KEY_EXPIRY_TIME, DEFAULT_KEY_EXPIRY_SECONDS );

    Map<String, String> metadata = provenance();
    metadata.put( "expires_in", String.valueOf( expiry ) );

    LOGGER.info( "SAE {} obtained key {} towards {} ({} bits, {} keys left)", saeId, keyId, receiverId, keySizeBits, storedKeys - 1 );
    return new ProvidedKey( keyId, keyBytes, metadata, Duration.ofSeconds( expiry ) );
  }

  @Override
  public ProvidedKey retrieveKey( String originatorId, String keyId ) throws QkdException
  {
    if( saeId.equals( originatorId ) )
      throw new KeyPolicyException( "SAE " + saeId + " cannot retrieve keys it originated" );

    List<JsonObject> keys = client.getKeysById( originatorId, keyId );
    if( keys.isEmpty() )
      throw new KeyNotFoundException( keyId, "Key " + keyId + " not found or expired at the KME" );

    JsonObject entry    = keys.get( 0 );
    String     returned = keyId( entry );
    if( returned != null && !returned.equals( keyId ) )
      throw new ProviderProtocolException( "KME returned key " + returned + " for requested key " + keyId );

    byte[] keyBytes = decodeKey( entry, keyId );

    LOGGER.info( "SAE {} retrieved key {} originated by {}", saeId, keyId, originatorId );
    return new ProvidedKey( keyId, keyBytes, provenance(), null );
  }

  @Override
  public String getProvenance()
  {
    return KeyEntry.PROVENANCE_ETSI;
  }

  private static String keyId( JsonObject entry )
  {
    Object value = EtsiKmeClient.tolerantField( entry, F_KEY_ID );
    return value instanceof String id && !id.isBlank() ? id : null;
  }

  private static byte[] decodeKey( JsonObject entry, String keyId ) throws ProviderProtocolException
  {
    if( !( entry.getValue( EtsiKmeClient.F_KEY ) instanceof String encoded ) )
      throw new ProviderProtocolException( "KME entry for key " + keyId + " carries no key material" );

    byte[] keyBytes;
    try
    {
      keyBytes = Base64.getDecoder().decode( encoded.trim() );
    }
    catch( IllegalArgumentException e )
    {
      throw new ProviderProtocolException( "Invalid base64 key material for key " + keyId, e );
    }

    if( keyBytes.length == 0 )
      throw new ProviderProtocolException( "Empty key material for key " + keyId );

    return keyBytes;
  }

  private static long longField( JsonObject json, String field, long defaultValue ) throws ProviderProtocolException
  {
    Object value = json.getValue( field );
    if( value == null )
      return defaultValue;
    if( value instanceof Number num )
      return num.longValue();

    throw new ProviderProtocolException( "KME status field " + field + " is not a number: " + value );
  }

  private static Map<String, String> provenance()
  {
    Map<String, String> meta = new HashMap<>();
    meta.put( "source",   SOURCE   );
    meta.put( "standard", STANDARD );
    return meta;
  }
}
