package net.larse.anomaly.algorithms;

/** Which side of the center an anomaly must lie on to be reported. */
public enum Direction {
  POS("pos"),
  NEG("neg"),
  BOTH("both");

  private final String label;

  Direction(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /** True if a candidate with the given sign (+1 above center, -1 below) is kept. */
  public boolean accepts(int sign) {
    switch (this) {
      case POS:
        return sign > 0;
      case NEG:
        return sign < 0;
      default:
        return true;
    }
  }

  /**
   * Parse "pos", "neg" or "both".
   *
   * @throws IllegalArgumentException for anything else
   */
  public static Direction fromString(String value) {
    for (Direction direction : values()) {
      if (direction.label.equals(value)) {
        return direction;
      }
    }
    throw new IllegalArgumentException("direction must be pos, neg, or both");
  }
}
