package qkd.core.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import qkd.core.model.KeyEntry;

/**
 * Volatile repository for tests and for parties configured without a storage path.
 */
public class InMemoryKeyRepository implements KeyRepositoryIF
{
  private final Map<String, KeyEntry> entries = new ConcurrentHashMap<>();
  private final Set<String>           retired = ConcurrentHashMap.newKeySet();

  @Override
  public KeyEntry find( String keyId )
  {
    KeyEntry entry = entries.get( keyId );
    return entry != null ? entry.copy() : null;
  }

  @Override
  public boolean contains( String keyId )
  {
    return entries.containsKey( keyId );
  }

  @Override
  public void save( KeyEntry entry )
  {
    entries.put( entry.getKeyId(), entry.copy() );
  }

  @Override
  public boolean delete( String keyId )
  {
    KeyEntry removed = entries.remove( keyId );
    if( removed == null )
      return false;

    retired.add( keyId );
    removed.clearKeyData();
    return true;
  }

  @Override
  public boolean isRetired( String keyId )
  {
    return retired.contains( keyId );
  }

  @Override
  public List<KeyEntry> findAll()
  {
    List<KeyEntry> result = new ArrayList<>( entries.size() );
    for( KeyEntry entry : entries.values() )
    {
      result.add( entry.copy() );
    }
    return result;
  }

  public int size()
  {
    return entries.size();
  }
}
