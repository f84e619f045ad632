package qkd.core.crypto;

/**
 * Ciphertext (tag appended for the AEAD levels) and the metadata needed to reverse it.
 */
public final class EncryptionResult
{
  private final byte[]         ciphertext;
  private final CipherMetadata metadata;

  public EncryptionResult( byte[] ciphertext, CipherMetadata metadata )
  {
    if( ciphertext == null || metadata == null )
      throw new IllegalArgumentException( "EncryptionResult - ciphertext and metadata must be provided" );

    this.ciphertext = ciphertext.clone();
    this.metadata   = metadata;
  }

  public byte[]         getCiphertext() { return ciphertext.clone(); }
  public CipherMetadata getMetadata()   { return metadata;           }
  public SecurityLevel  getLevel()      { return metadata.getSecurityLevel(); }
}
