package qkd.core.utils;

import java.nio.ByteBuffer;
import java.util.HashMap;
import java.util.Map;

import org.apache.avro.generic.GenericRecord;

/**
 * Typed accessors over {@link GenericRecord} fields decoded from Avro binary.
 */
public class AvroUtil
{

  public int getInt( GenericRecord result, String attrName )
  {
    Integer i = (Integer)result.get( attrName );
    
    if( i != null )
      return i.intValue();
    
    return -1;
  }

  public byte[] getByteArray( GenericRecord result, String attrName )
  {
    byte[] returnVal = null;
    
    ByteBuffer theBuf  = (ByteBuffer) result.get( attrName );
    if( theBuf != null )
    {
      ByteBuffer bufCopy = theBuf.duplicate();
      
      // Reset to the beginning of the buffer to ensure we read all data
      bufCopy.rewind();
      
      returnVal = new byte[bufCopy.remaining()];
      bufCopy.get( returnVal, 0, bufCopy.remaining() );
    }
    
    return returnVal;
  }

  public String getString( GenericRecord result, String attrName )
  {
    Object item = result.get( attrName );
    if( item != null )
      return item.toString();
    
    return null;
  }

  /**
   * Avro map fields decode with {@code Utf8} keys and values; this converts them to plain strings.
   */
  public Map<String, String> getStringMap( GenericRecord result, String attrName )
  {
    Map<String, String> out = new HashMap<>();

    Object item = result.get( attrName );
    if( item instanceof Map<?, ?> map )
    {
      for( Map.Entry<?, ?> e : map.entrySet() )
      {
        if( e.getKey() != null && e.getValue() != null )
          out.put( e.getKey().toString(), e.getValue().toString() );
      }
    }

    return out;
  }
}
