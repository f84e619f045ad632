package qkd.core.exceptions;

/**
 * Thrown when the estimated quantum bit error rate of a BB84 exchange is
 * above the configured threshold. The exchange is abandoned and no key is produced.
 */
public class QberThresholdException extends QkdException
{
  private static final long serialVersionUID = 4630192837465019283L;

  private final double qber;
  private final double threshold;

  public QberThresholdException( double qber, double threshold )
  {
    super( String.format( "QBER too high: %.2f%% > %.2f%%. Possible eavesdropping", qber * 100.0, threshold * 100.0 ) );
    this.qber      = qber;
    this.threshold = threshold;
  }

  public double getQber()      { return qber;      }
  public double getThreshold() { return threshold; }
}
