package qkd.core.model;


import qkd.core.utils.AvroSchemaReader;
import qkd.core.utils.AvroUtil;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericDatumReader;
import org.apache.avro.generic.GenericDatumWriter;
import org.apache.avro.generic.GenericRecord;
import org.apache.avro.io.Decoder;
import org.apache.avro.io.DecoderFactory;
import org.apache.avro.io.Encoder;
import org.apache.avro.io.EncoderFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Persisted record of one quantum key held by a KeyManager. The key material
 * is only handed out while the entry is ACTIVE and unexpired; the entry is
 * serialised with the {@code KeyEntry} Avro schema.
 */
public class KeyEntry
{
  public static final String META_PEER       = "peer";
  public static final String META_ROLE       = "role";
  public static final String META_PROVENANCE = "provenance";
  public static final String META_KEY_LENGTH = "key_length";

  public static final String PROVENANCE_LOCAL = "local-bb84";
  public static final String PROVENANCE_ETSI  = "qukaydee/ETSI-GS-QKD-014";

  private static final String  SCHEMA_NAME    = "KeyEntry";
  private static final Pattern KEY_ID_PATTERN = Pattern.compile( "[A-Za-z0-9._-]+" );

  // Avro field names
  private static final String KeyId      = "keyId";
  private static final String KeyData    = "keyData";
  private static final String CreatedAt  = "createdAt";
  private static final String ExpiresAt  = "expiresAt";
  private static final String UsageCount = "usageCount";
  private static final String MaxUsage   = "maxUsage";
  private static final String State      = "state";
  private static final String Metadata   = "metadata";

  private static final AvroUtil avroUtil = new AvroUtil();

  private final String              keyId;
  private final byte[]              keyData;
  private final Instant             createdAt;
  private final Instant             expiresAt;
  private final int                 maxUsage;
  private final Map<String, String> metadata;

  private int      usageCount;
  private KeyState state;

  public KeyEntry( String keyId, byte[] keyData, Instant createdAt, Instant expiresAt, int maxUsage, Map<String, String> metadata )
  {
    this( keyId, keyData, createdAt, expiresAt, 0, maxUsage, KeyState.ACTIVE, metadata );
  }

  public KeyEntry( String keyId, byte[] keyData, Instant createdAt, Instant expiresAt, int usageCount, int maxUsage, KeyState state, Map<String, String> metadata )
  {
    this.keyId      = Objects.requireNonNull( keyId,     "Key ID cannot be null" );
    this.keyData    = Objects.requireNonNull( keyData,   "Key data cannot be null" ).clone();
    this.createdAt  = Objects.requireNonNull( createdAt, "Created time cannot be null" );
    this.expiresAt  = Objects.requireNonNull( expiresAt, "Expiry time cannot be null" );
    this.state      = Objects.requireNonNull( state,     "State cannot be null" );
    this.usageCount = usageCount;
    this.maxUsage   = maxUsage;
    this.metadata   = metadata != null ? new HashMap<>( metadata ) : new HashMap<>();

    if( keyId.isBlank() )
      throw new IllegalArgumentException( "Key ID cannot be blank" );
    if( expiresAt.isBefore( createdAt ) )
      throw new IllegalArgumentException( "Expiry time cannot be before created time" );
    if( usageCount < 0 || maxUsage < 0 )
      throw new IllegalArgumentException( "Usage counters cannot be negative" );
  }

  // Getters
  public String              getKeyId()      { return keyId;                                  }
  public byte[]              getKeyData()    { return keyData.clone();                        }
  public Instant             getCreatedAt()  { return createdAt;                              }
  public Instant             getExpiresAt()  { return expiresAt;                              }
  public int                 getUsageCount() { return usageCount;                             }
  public int                 getMaxUsage()   { return maxUsage;                               }
  public KeyState            getState()      { return state;                                  }
  public Map<String, String> getMetadata()   { return Collections.unmodifiableMap( metadata ); }

  /**
   * Key ids are limited to letters, digits, '.', '_' and '-' so that every
   * repository can use them as addresses, file names included.
   */
  public static boolean isPortableKeyId( String keyId )
  {
    return keyId != null && KEY_ID_PATTERN.matcher( keyId ).matches();
  }

  public String getPeer()       { return metadata.get( META_PEER );       }
  public String getRole()       { return metadata.get( META_ROLE );       }
  public String getProvenance() { return metadata.get( META_PROVENANCE ); }

  public boolean isExpired( Instant now )
  {
    return now.isAfter( expiresAt );
  }

  public boolean isActive()
  {
    return state == KeyState.ACTIVE;
  }

  public boolean isUsageExhausted()
  {
    return maxUsage != KeyPolicy.UNLIMITED && usageCount >= maxUsage;
  }

  /**
   * Counts one use. The entry becomes CONSUMED once its usage limit is reached.
   */
  public void recordUse()
  {
    if( state != KeyState.ACTIVE )
      throw new IllegalStateException( "Cannot use key " + keyId + " in state " + state );

    usageCount++;
    if( isUsageExhausted() )
      state = KeyState.CONSUMED;
  }

  public void markExpired()
  {
    if( state == KeyState.ACTIVE )
      state = KeyState.EXPIRED;
  }

  public KeyEntry copy()
  {
    return new KeyEntry( keyId, keyData, createdAt, expiresAt, usageCount, maxUsage, state, metadata );
  }

  public KeySummary toSummary()
  {
    return new KeySummary( keyId, createdAt, expiresAt, usageCount, maxUsage, state, getMetadata() );
  }

  public void clearKeyData()
  {
    Arrays.fill( keyData, (byte)0 );
  }

  // Avro Serialization
  public static byte[] serialize( KeyEntry entry ) throws IOException
  {
    Schema schema = AvroSchemaReader.getSchema( SCHEMA_NAME );

    GenericRecord rec = new GenericData.Record( schema );
    rec.put( KeyId,      entry.keyId                    );
    rec.put( KeyData,    ByteBuffer.wrap( entry.keyData ) );
    rec.put( CreatedAt,  entry.createdAt.toString()     );
    rec.put( ExpiresAt,  entry.expiresAt.toString()     );
    rec.put( UsageCount, entry.usageCount               );
    rec.put( MaxUsage,   entry.maxUsage                 );
    rec.put( State,      entry.state.name()             );
    rec.put( Metadata,   new HashMap<>( entry.metadata ) );

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Encoder enc = EncoderFactory.get().binaryEncoder( out, null );
    GenericDatumWriter<GenericRecord> writer = new GenericDatumWriter<>( schema );
    writer.write( rec, enc );
    enc.flush();

    return out.toByteArray();
  }

  public static KeyEntry deSerialize( byte[] bytes ) throws IOException
  {
    Schema schema = AvroSchemaReader.getSchema( SCHEMA_NAME );

    GenericDatumReader<GenericRecord> reader = new GenericDatumReader<>( schema );
    Decoder decoder = DecoderFactory.get().binaryDecoder( bytes, null );

    try
    {
      GenericRecord rec = reader.read( null, decoder );

      String   keyId     = avroUtil.getString(    rec, KeyId );
      byte[]   keyData   = avroUtil.getByteArray( rec, KeyData );
      Instant  created   = Instant.parse( avroUtil.getString( rec, CreatedAt ) );
      Instant  expires   = Instant.parse( avroUtil.getString( rec, ExpiresAt ) );
      int      usage     = avroUtil.getInt(       rec, UsageCount );
      int      max       = avroUtil.getInt(       rec, MaxUsage );
      KeyState state     = KeyState.valueOf( avroUtil.getString( rec, State ) );

      return new KeyEntry( keyId, keyData, created, expires, usage, max, state, avroUtil.getStringMap( rec, Metadata ) );
    }
    catch( RuntimeException e )
    {
      throw new IOException( "KeyEntry.deSerialize - invalid record: " + e.getMessage(), e );
    }
  }

  @Override
  public String toString()
  {
    return String.format( "KeyEntry{keyId='%s', state=%s, usage=%d/%d, created=%s, expires=%s}", keyId, state, usageCount, maxUsage, createdAt, expiresAt );
  }
}
