package qkd.core.simulator;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import qkd.core.exceptions.QberThresholdException;
import qkd.core.model.QuantumKey;

/**
 * Logical BB84 exchange between two simulated parties (Alice sends, Bob
 * measures). There is no photon physics here: bits and bases are exchanged as
 * values, but the protocol steps and their statistics follow BB84.
 *
 * 1. Alice draws random bits and bases.
 * 2. Bob measures each position in a random basis. Matching bases reproduce
 *    the bit (up to channel noise), mismatching bases give a coin flip.
 * 3. Both keep only the positions where the bases agreed (sifting).
 * 4. A prefix of the sifted key is compared to estimate the QBER. Above the
 *    threshold the exchange is abandoned.
 * 5. The sifted bits are hashed down to the requested key length.
 */
public class QkdSimulator
{
  private static final Logger LOGGER = LoggerFactory.getLogger( QkdSimulator.class );

  public static final double DEFAULT_QBER_THRESHOLD     = 0.11;
  public static final int    DEFAULT_SAMPLE_SIZE        = 50;
  public static final int    DEFAULT_OVERSAMPLING       = 4;
  private static final int   KEY_ID_HEX_LENGTH          = 16;

  private final SecureRandom secureRandom = new SecureRandom();

  private final double channelErrorRate;
  private final double qberThreshold;
  private final int    sampleSize;
  private final int    oversamplingFactor;

  public QkdSimulator()
  {
    this( 0.0, DEFAULT_QBER_THRESHOLD, DEFAULT_SAMPLE_SIZE, DEFAULT_OVERSAMPLING );
  }

  public QkdSimulator( double channelErrorRate, double qberThreshold, int sampleSize, int oversamplingFactor )
  {
    if( channelErrorRate < 0.0 || channelErrorRate > 1.0 )
      throw new IllegalArgumentException( "channelErrorRate must be within [0, 1]" );
    if( qberThreshold < 0.0 || qberThreshold > 1.0 )
      throw new IllegalArgumentException( "qberThreshold must be within [0, 1]" );
    if( sampleSize <= 0 )
      throw new IllegalArgumentException( "sampleSize must be positive" );
    if( oversamplingFactor < 4 )
      throw new IllegalArgumentException( "oversamplingFactor must be at least 4" );

    this.channelErrorRate   = channelErrorRate;
    this.qberThreshold      = qberThreshold;
    this.sampleSize         = sampleSize;
    this.oversamplingFactor = oversamplingFactor;
  }

  public double getChannelErrorRate() { return channelErrorRate; }
  public double getQberThreshold()    { return qberThreshold;    }

  public byte[] generateRandomBits( int length )
  {
    byte[] bits = new byte[length];
    for( int i = 0; i < length; i++ )
    {
      bits[i] = (byte)secureRandom.nextInt( 2 );
    }
    return bits;
  }

  public Basis[] generateRandomBases( int length )
  {
    Basis[] bases = new Basis[length];
    for( int i = 0; i < length; i++ )
    {
      bases[i] = secureRandom.nextBoolean() ? Basis.DIAGONAL : Basis.RECTILINEAR;
    }
    return bases;
  }

  /**
   * Sends Alice's bits through the simulated channel. Bob picks his bases at
   * random; where they match Alice's the bit arrives intact except for a flip
   * with probability {@code errorRate}, elsewhere he reads a random bit.
   */
  public ChannelMeasurement simulateQuantumChannel( byte[] bits, Basis[] bases, double errorRate )
  {
    if( bits.length != bases.length )
      throw new IllegalArgumentException( "bits and bases must have the same length" );

    Basis[] receiverBases = generateRandomBases( bits.length );
    byte[]  receivedBits  = new byte[bits.length];

    for( int i = 0; i < bits.length; i++ )
    {
      if( bases[i] == receiverBases[i] )
      {
        boolean flip = errorRate > 0.0 && secureRandom.nextDouble() < errorRate;
        receivedBits[i] = flip ? (byte)( 1 - bits[i] ) : bits[i];
      }
      else
      {
        receivedBits[i] = (byte)secureRandom.nextInt( 2 );
      }
    }

    return new ChannelMeasurement( receivedBits, receiverBases );
  }

  /**
   * Basis reconciliation: keeps the positions where both parties used the same basis.
   */
  public SiftedKey siftKey( byte[] aliceBits, Basis[] aliceBases, byte[] bobBits, Basis[] bobBases )
  {
    int n = aliceBases.length;
    if( aliceBits.length != n || bobBits.length != n || bobBases.length != n )
      throw new IllegalArgumentException( "all sifting inputs must have the same length" );

    byte[] aliceSifted = new byte[n];
    byte[] bobSifted   = new byte[n];
    int    kept        = 0;

    for( int i = 0; i < n; i++ )
    {
      if( aliceBases[i] == bobBases[i] )
      {
        aliceSifted[kept] = aliceBits[i];
        bobSifted[kept]   = bobBits[i];
        kept++;
      }
    }

    return new SiftedKey( Arrays.copyOf( aliceSifted, kept ), Arrays.copyOf( bobSifted, kept ) );
  }

  public double estimateErrorRate( SiftedKey sifted )
  {
    return estimateErrorRate( sifted.aliceBits(), sifted.bobBits(), sampleSize );
  }

  /**
   * Compares the first {@code sampleSize} sifted bits. When fewer bits are
   * available half of them are sampled. An empty sample reports 0.
   */
  public double estimateErrorRate( byte[] aliceSifted, byte[] bobSifted, int sampleSize )
  {
    int sample = sampleSize;
    if( aliceSifted.length < sample )
      sample = aliceSifted.length / 2;

    if( sample <= 0 )
      return 0.0;

    int errors = 0;
    for( int i = 0; i < sample; i++ )
    {
      if( aliceSifted[i] != bobSifted[i] )
        errors++;
    }

    return (double)errors / sample;
  }

  /**
   * Compresses the sifted bits into exactly {@code keyLengthBits} bits. The
   * bit string is hashed with SHA-256; longer keys chain further rounds over
   * the output accumulated so far. The result depends only on the input bits.
   */
  public byte[] privacyAmplification( byte[] siftedBits, int keyLengthBits )
  {
    validateKeyLength( keyLengthBits );

    StringBuilder bitString = new StringBuilder( siftedBits.length );
    for( byte bit : siftedBits )
    {
      bitString.append( bit == 0 ? '0' : '1' );
    }

    int    keyBytes = keyLengthBits / 8;
    byte[] output   = sha256( bitString.toString().getBytes( StandardCharsets.US_ASCII ) );

    while( output.length < keyBytes )
    {
      byte[] round    = sha256( output );
      byte[] extended = Arrays.copyOf( output, output.length + round.length );
      System.arraycopy( round, 0, extended, output.length, round.length );
      output = extended;
    }

    return Arrays.copyOf( output, keyBytes );
  }

  /**
   * Runs the full exchange over the channel error rate this simulator was built with.
   */
  public QuantumKey generateQuantumKey( int keyLengthBits ) throws QberThresholdException
  {
    return generateQuantumKey( keyLengthBits, channelErrorRate );
  }

  public QuantumKey generateQuantumKey( int keyLengthBits, double errorRate ) throws QberThresholdException
  {
    validateKeyLength( keyLengthBits );

    int transmissionLength = keyLengthBits * oversamplingFactor;

    byte[]  aliceBits  = generateRandomBits( transmissionLength );
    Basis[] aliceBases = generateRandomBases( transmissionLength );

    ChannelMeasurement measurement = simulateQuantumChannel( aliceBits, aliceBases, errorRate );
    SiftedKey          sifted      = siftKey( aliceBits, aliceBases, measurement.receivedBits(), measurement.receiverBases() );

    double qber = estimateErrorRate( sifted );
    LOGGER.debug( "BB84 exchange: transmitted={}, sifted={}, qber={}", transmissionLength, sifted.length(), qber );

    if( qber > qberThreshold )
    {
      LOGGER.warn( "BB84 exchange aborted, QBER {} above threshold {}", qber, qberThreshold );
      throw new QberThresholdException( qber, qberThreshold );
    }

    byte[] key   = privacyAmplification( sifted.aliceBits(), keyLengthBits );
    String keyId = Hex.toHexString( sha256( key ) ).substring( 0, KEY_ID_HEX_LENGTH );

    return new QuantumKey( keyId, key );
  }

  private static void validateKeyLength( int keyLengthBits )
  {
    if( keyLengthBits <= 0 || keyLengthBits % 8 != 0 )
      throw new IllegalArgumentException( "Key length must be a positive multiple of 8 bits, got " + keyLengthBits );
  }

  private static byte[] sha256( byte[] input )
  {
    SHA256Digest digest = new SHA256Digest();
    digest.update( input, 0, input.length );

    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal( out, 0 );
    return out;
  }
}
