package qkd.core.crypto;

import qkd.core.exceptions.CryptoIntegrityException;

/**
 * Authenticated cipher with a 256 bit key and 96 bit nonce. The 128 bit
 * tag is appended to the ciphertext.
 */
public interface AeadCipherIF
{
  public static final int KEY_LENGTH   = 32;
  public static final int NONCE_LENGTH = 12;
  public static final int TAG_LENGTH   = 16;

  public String getAlgorithm();

  public byte[] encrypt( byte[] key, byte[] nonce, byte[] plaintext );

  public byte[] decrypt( byte[] key, byte[] nonce, byte[] ciphertext ) throws CryptoIntegrityException;
}
