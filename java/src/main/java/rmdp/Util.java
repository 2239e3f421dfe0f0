package rmdp;

import java.util.function.IntToDoubleFunction;

public final class Util {
  private static final double LOOSE = 1.0e-5;

  private Util() {
  }

  public static boolean doublesEqualLoose(double d1, double d2) {
    return doubleZeroLoose(d1 - d2);
  }

  public static boolean doubleZeroLoose(double d) {
    return Math.abs(d) < LOOSE;
  }

  public static double sum(int from, int to, IntToDoubleFunction values) {
    double sum = 0.0;
    double c = 0.0;
    for (int i = from; i < to; i++) {
      double y = values.applyAsDouble(i) - c;
      double t = sum + y;
      c = (t - sum) - y;
      sum = t;
    }
    return sum;
  }

  public static double dot(double[] left, double[] right) {
    assert left.length == right.length;
    return sum(0, left.length, i -> left[i] * right[i]);
  }
}
