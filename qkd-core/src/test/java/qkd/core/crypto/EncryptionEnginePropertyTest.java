package qkd.core.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.KeyPair;
import java.util.Random;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import qkd.core.exceptions.CryptoIntegrityException;
import qkd.core.exceptions.KeyPolicyException;

/**
 * Round trip and tamper detection across the four security levels.
 */
class EncryptionEnginePropertyTest
{
  private static final KeyPair RECIPIENT = RsaKeyWrap.generateKeyPair();

  private final EncryptionEngine engine         = new EncryptionEngine();
  private final EncryptionEngine fallbackEngine = new EncryptionEngine( true );

  @Property( tries = 100 )
  void oneTimePadRoundTripsWithAKeyOfEqualLength( @ForAll( "plaintexts" ) byte[] plaintext, @ForAll long seed ) throws Exception
  {
    Assume.that( plaintext.length > 0 );

    byte[] key = new byte[plaintext.length];
    new Random( seed ).nextBytes( key );

    EncryptionResult result = engine.encrypt( plaintext, key, SecurityLevel.BASIC );

    assertThat( result.getCiphertext() ).hasSize( plaintext.length );
    assertThat( engine.decrypt( result.getCiphertext(), key, result.getMetadata() ) ).isEqualTo( plaintext );
  }

  @Property( tries = 50 )
  void oneTimePadRejectsShortKeys( @ForAll( "plaintexts" ) byte[] plaintext )
  {
    if( plaintext.length < 2 )
      return;

    byte[] key = new byte[plaintext.length - 1];

    assertThatThrownBy( () -> engine.encrypt( plaintext, key, SecurityLevel.BASIC ) ).isInstanceOf( KeyPolicyException.class );
  }

  @Property( tries = 100 )
  void authenticatedLevelsRoundTrip( @ForAll( "plaintexts" ) byte[] plaintext,
                                     @ForAll( "quantumKeys" ) byte[] key,
                                     @ForAll( "aeadLevels" ) SecurityLevel level ) throws Exception
  {
    EncryptionResult result = fallbackEngine.encrypt( plaintext, key, level );

    assertThat( result.getLevel() ).isEqualTo( level );
    assertThat( result.getCiphertext() ).hasSize( plaintext.length + AeadCipherIF.TAG_LENGTH );
    assertThat( fallbackEngine.decrypt( result.getCiphertext(), key, result.getMetadata().toJson() ) ).isEqualTo( plaintext );
  }

  @Property( tries = 30 )
  void rsaWrappedMaximumLevelRoundTrips( @ForAll( "plaintexts" ) byte[] plaintext,
                                         @ForAll( "quantumKeys" ) byte[] key ) throws Exception
  {
    EncryptionResult result = engine.encrypt( plaintext, key, SecurityLevel.MAXIMUM, RECIPIENT.getPublic() );

    byte[] opened = engine.decrypt( result.getCiphertext(), key, result.getMetadata().toJson(), RECIPIENT.getPrivate() );
    assertThat( opened ).isEqualTo( plaintext );
  }

  @Property( tries = 100 )
  void tamperedCiphertextNeverDecrypts( @ForAll( "plaintexts" ) byte[] plaintext,
                                        @ForAll( "quantumKeys" ) byte[] key,
                                        @ForAll( "aeadLevels" ) SecurityLevel level,
                                        @ForAll int position ) throws Exception
  {
    EncryptionResult result     = fallbackEngine.encrypt( plaintext, key, level );
    byte[]           ciphertext = result.getCiphertext();

    int index = Math.floorMod( position, ciphertext.length );
    ciphertext[index] ^= 0x01;

    assertThatThrownBy( () -> fallbackEngine.decrypt( ciphertext, key, result.getMetadata() ) )
        .isInstanceOf( CryptoIntegrityException.class );
  }

  @Property( tries = 50 )
  void wrongKeyNeverDecrypts( @ForAll( "plaintexts" ) byte[] plaintext,
                              @ForAll( "quantumKeys" ) byte[] key,
                              @ForAll( "aeadLevels" ) SecurityLevel level ) throws Exception
  {
    EncryptionResult result = fallbackEngine.encrypt( plaintext, key, level );

    byte[] otherKey = key.clone();
    otherKey[0] ^= (byte)0x80;

    assertThatThrownBy( () -> fallbackEngine.decrypt( result.getCiphertext(), otherKey, result.getMetadata() ) )
        .isInstanceOf( CryptoIntegrityException.class );
  }

  @Provide
  Arbitrary<byte[]> plaintexts()
  {
    return Arbitraries.bytes().array( byte[].class ).ofMinSize( 0 ).ofMaxSize( 2048 );
  }

  @Provide
  Arbitrary<byte[]> quantumKeys()
  {
    return Arbitraries.bytes().array( byte[].class ).ofMinSize( 16 ).ofMaxSize( 128 );
  }

  @Provide
  Arbitrary<SecurityLevel> aeadLevels()
  {
    return Arbitraries.of( SecurityLevel.STANDARD, SecurityLevel.HIGH, SecurityLevel.MAXIMUM );
  }
}
