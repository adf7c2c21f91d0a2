package net.larse.anomaly.algorithms;

/**
 * Thrown when the values of a series cannot be analysed, e.g. because one of them is NaN.
 * Malformed parameters are reported with {@link IllegalArgumentException} instead.
 */
public class SeriesDataException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int position;

  public SeriesDataException(String message, int position) {
    super(message);
    this.position = position;
  }

  /** Position of the first offending value. */
  public int getPosition() {
    return position;
  }
}
