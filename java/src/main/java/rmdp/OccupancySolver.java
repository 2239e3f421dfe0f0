package rmdp;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * Discounted state occupancy frequencies of a fixed policy pair, computed by solving the linear
 * system {@code (I - discount * P^T) x = initial} directly. The matrix is dense, so this is only
 * suitable for moderate numbers of states.
 */
public final class OccupancySolver {
  private static final Logger log = Logger.getLogger("rmdp");

  private OccupancySolver() {}

  /**
   * @throws NumericException if the system is singular
   */
  public static double[] solve(StateTable<?> table, Transition initial, double discount, PolicyPair policy) {
    return solve(table, initial.probabilitiesVector(table.stateCount()), discount, policy);
  }

  public static double[] solve(StateTable<?> table, double[] initial, double discount, PolicyPair policy) {
    int n = table.stateCount();
    checkArgument(initial.length == n, "Initial distribution has size %s, model has %s states", initial.length, n);
    checkArgument(0.0 <= discount && discount < 1.0, "Discount %s not in [0, 1)", discount);

    RealMatrix system = TransitionMatrices.transposed(table, policy).scalarMultiply(-discount)
        .add(MatrixUtils.createRealIdentityMatrix(n));
    log.log(Level.FINE, "Solving occupancy system of size {0}", n);

    RealVector solution;
    try {
      solution = new LUDecomposition(system).getSolver().solve(new ArrayRealVector(initial));
    } catch (SingularMatrixException e) {
      throw new NumericException("Occupancy system is singular for discount %s".formatted(discount), e);
    }
    return solution.toArray();
  }

  public static double expectedReturn(double[] occupancy, double[] rewards) {
    checkArgument(occupancy.length == rewards.length);
    return Util.dot(occupancy, rewards);
  }
}
