package net.larse.anomaly.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /** Find the first NaN in array, or -1 if there is none. */
  public static int firstNaN(double[] array) {
    for (int i = 0; i < array.length; i++) {
      if (Double.isNaN(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Index of the largest value in array. On ties the first occurrence wins, so callers that keep
   * their entries in position order get the earliest position.
   */
  public static int argMax(double[] array) {
    if (array.length == 0) {
      return -1;
    }
    int best = 0;
    for (int i = 1; i < array.length; i++) {
      if (array[i] > array[best]) {
        best = i;
      }
    }
    return best;
  }
}
