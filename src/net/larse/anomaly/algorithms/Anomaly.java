package net.larse.anomaly.algorithms;

import com.google.common.base.MoreObjects;

import java.util.Objects;

/**
 * A detected anomaly: the zero-based position in the input series, the robust deviation score
 * at which it was removed, and whether it lies above (+1) or below (-1) the center.
 */
public final class Anomaly {
  private final int position;
  private final double score;
  private final int sign;

  public Anomaly(int position, double score, int sign) {
    this.position = position;
    this.score = score;
    this.sign = sign;
  }

  public int getPosition() {
    return position;
  }

  public double getScore() {
    return score;
  }

  public int getSign() {
    return sign;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Anomaly)) {
      return false;
    }
    Anomaly other = (Anomaly) o;
    return position == other.position
        && sign == other.sign
        && Double.compare(score, other.score) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, score, sign);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("position", position)
        .add("score", score)
        .add("sign", sign)
        .toString();
  }
}
