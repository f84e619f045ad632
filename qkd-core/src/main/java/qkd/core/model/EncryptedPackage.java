package qkd.core.model;

import java.util.Base64;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import qkd.core.crypto.EncryptionResult;
import qkd.core.exceptions.MalformedMetadataException;

/**
 * Wire envelope exchanged between sender and receiver. The metadata is kept
 * as received; it is validated only when the package is decrypted.
 */
public final class EncryptedPackage
{
  public static final String PROTOCOL_ETSI  = "ETSI-GS-QKD-014";
  public static final String PROTOCOL_LOCAL = "local-bb84";
  public static final String VERSION        = "1.0";

  private static final String F_CIPHERTEXT = "ciphertext";
  private static final String F_KEY_ID     = "key_id";
  private static final String F_METADATA   = "metadata";
  private static final String F_SENDER_ID  = "sender_id";
  private static final String F_PROTOCOL   = "protocol";
  private static final String F_VERSION    = "version";

  private final byte[]     ciphertext;
  private final String     keyId;
  private final JsonObject metadata;
  private final String     senderId;
  private final String     protocol;
  private final String     version;

  public EncryptedPackage( byte[] ciphertext, String keyId, JsonObject metadata, String senderId, String protocol, String version )
  {
    if( ciphertext == null || keyId == null || metadata == null || senderId == null )
      throw new IllegalArgumentException( "EncryptedPackage - ciphertext, keyId, metadata and senderId must be provided" );

    this.ciphertext = ciphertext.clone();
    this.keyId      = keyId;
    this.metadata   = metadata.copy();
    this.senderId   = senderId;
    this.protocol   = protocol;
    this.version    = version != null ? version : VERSION;
  }

  public static EncryptedPackage of( EncryptionResult result, String keyId, String senderId, String protocol )
  {
    return new EncryptedPackage( result.getCiphertext(), keyId, result.getMetadata().toJson(), senderId, protocol, VERSION );
  }

  public byte[]     getCiphertext() { return ciphertext.clone(); }
  public String     getKeyId()      { return keyId;              }
  public JsonObject getMetadata()   { return metadata.copy();    }
  public String     getSenderId()   { return senderId;           }
  public String     getProtocol()   { return protocol;           }
  public String     getVersion()    { return version;            }

  public JsonObject toJson()
  {
    JsonObject json = new JsonObject();
    json.put( F_CIPHERTEXT, Base64.getEncoder().encodeToString( ciphertext ) );
    json.put( F_KEY_ID,     keyId           );
    json.put( F_METADATA,   metadata.copy() );
    json.put( F_SENDER_ID,  senderId        );
    json.put( F_PROTOCOL,   protocol        );
    json.put( F_VERSION,    version         );

    return json;
  }

  public String encode()
  {
    return toJson().encode();
  }

  public static EncryptedPackage decode( String json ) throws MalformedMetadataException
  {
    try
    {
      return fromJson( new JsonObject( json ) );
    }
    catch( DecodeException e )
    {
      throw new MalformedMetadataException( "Encrypted package is not valid JSON", e );
    }
  }

  public static EncryptedPackage fromJson( JsonObject json ) throws MalformedMetadataException
  {
    String keyId    = requireString( json, F_KEY_ID     );
    String senderId = requireString( json, F_SENDER_ID  );

    if( !KeyEntry.isPortableKeyId( keyId ) )
      throw new MalformedMetadataException( "Encrypted package key id contains unsupported characters" );

    if( !( json.getValue( F_METADATA ) instanceof JsonObject metadata ) )
      throw new MalformedMetadataException( "Encrypted package has no metadata object" );

    // an empty Basic-level message has an empty ciphertext
    if( !( json.getValue( F_CIPHERTEXT ) instanceof String encoded ) )
      throw new MalformedMetadataException( "Encrypted package field " + F_CIPHERTEXT + " is missing" );

    byte[] ciphertext;
    try
    {
      ciphertext = Base64.getDecoder().decode( encoded );
    }
    catch( IllegalArgumentException e )
    {
      throw new MalformedMetadataException( "Encrypted package ciphertext is not valid base64", e );
    }

    Object protocol = json.getValue( F_PROTOCOL );
    Object version  = json.getValue( F_VERSION  );

    return new EncryptedPackage( ciphertext, keyId, metadata, senderId,
                                 protocol instanceof String p ? p : null,
                                 version  instanceof String v ? v : VERSION );
  }

  private static String requireString( JsonObject json, String field ) throws MalformedMetadataException
  {
    if( json.getValue( field ) instanceof String value && !value.isEmpty() )
      return value;

    throw new MalformedMetadataException( "Encrypted package field " + field + " is missing" );
  }
}
