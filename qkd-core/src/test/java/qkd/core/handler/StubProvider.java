package qkd.core.handler;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import qkd.core.exceptions.KeyNotFoundException;
import qkd.core.exceptions.ProviderTransportException;
import qkd.core.exceptions.QkdException;
import qkd.core.model.ProvidedKey;
import qkd.core.provider.QkdProviderIF;

/**
 * Provider handing out counter-numbered keys and remembering them for retrieval.
 */
final class StubProvider implements QkdProviderIF
{
  final Map<String, byte[]> issued   = new ConcurrentHashMap<>();
  final AtomicInteger       requests = new AtomicInteger();
  final AtomicInteger       fetches  = new AtomicInteger();

  volatile String   fixedKeyId;
  volatile Duration expiresIn;

  // when set, retrieveKey counts down fetchStarted and then holds until the gate opens
  volatile CountDownLatch fetchStarted;
  volatile CountDownLatch fetchGate;

  @Override
  public ProvidedKey requestKey( String senderId, String receiverId, int keySizeBits ) throws QkdException
  {
    int    n     = requests.incrementAndGet();
    String keyId = fixedKeyId != null ? fixedKeyId : "key-" + n;
    byte[] key   = new byte[keySizeBits / 8];
    Arrays.fill( key, (byte)n );

    issued.put( keyId, key );
    return new ProvidedKey( keyId, key, Map.of( "source", "stub" ), expiresIn );
  }

  @Override
  public ProvidedKey retrieveKey( String originatorId, String keyId ) throws QkdException
  {
    fetches.incrementAndGet();
    holdAtGate();

    byte[] key = issued.get( keyId );
    if( key == null )
      throw new KeyNotFoundException( keyId, "stub has no key " + keyId );

    return new ProvidedKey( keyId, key, new HashMap<>(), null );
  }

  private void holdAtGate() throws ProviderTransportException
  {
    CountDownLatch started = fetchStarted;
    CountDownLatch gate    = fetchGate;
    if( started != null )
      started.countDown();
    if( gate == null )
      return;

    try
    {
      if( !gate.await( 10, TimeUnit.SECONDS ) )
        throw new ProviderTransportException( "stub fetch gate never opened", -1 );
    }
    catch( InterruptedException e )
    {
      Thread.currentThread().interrupt();
      throw new ProviderTransportException( "interrupted at stub fetch gate", e );
    }
  }

  @Override
  public String getProvenance()
  {
    return "stub";
  }
}
