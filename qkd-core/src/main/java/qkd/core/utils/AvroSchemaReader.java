package qkd.core.utils;


import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads Avro schemas bundled on the classpath under {@code /avro-schemas}.
 */
public class AvroSchemaReader
{
  private static final Logger              LOGGER      = LoggerFactory.getLogger( AvroSchemaReader.class );
  private static final Map<String, Schema> schemas     = new ConcurrentHashMap<>();
  private static final String              SCHEMA_PATH = "/avro-schemas/";

  private AvroSchemaReader()
  {
  }

  public static Schema getSchema( String schemaName )
   throws IOException
  {
    Schema schema = schemas.get( schemaName );
    if( schema != null )
      return schema;

    String resource = SCHEMA_PATH + schemaName + ".avsc";
    try( InputStream in = AvroSchemaReader.class.getResourceAsStream( resource ) )
    {
      if( in == null )
        throw new IOException( "Avro schema not found on classpath: " + resource );

      schema = new Schema.Parser().parse( in );
    }

    LOGGER.debug( "AvroSchemaReader.getSchema - loaded schema {}", schemaName );
    Schema existing = schemas.putIfAbsent( schemaName, schema );
    return existing != null ? existing : schema;
  }
}
