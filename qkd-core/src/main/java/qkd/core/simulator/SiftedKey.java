package qkd.core.simulator;

/**
 * Sender and receiver bits kept after basis reconciliation. Both arrays have
 * the same length; they differ only where the channel flipped a bit.
 */
public record SiftedKey( byte[] aliceBits, byte[] bobBits )
{
  public int length()
  {
    return aliceBits.length;
  }
}
