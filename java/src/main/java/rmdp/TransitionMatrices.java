package rmdp;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Dense transition matrices of a decision process under a fixed policy pair. Terminal states get
 * zero rows (columns in the transposed matrix).
 *
 * <p>Invalid action or outcome ids fail with an {@link IndexOutOfBoundsException}, run
 * {@link PolicyValidator} first. A resolved transition leading outside the table is a
 * {@link ModelException}.
 */
public final class TransitionMatrices {
  private static final Logger log = Logger.getLogger("rmdp");

  private TransitionMatrices() {}

  public static RealMatrix forward(StateTable<?> table, PolicyPair policy) {
    policy.checkCovers(table);
    int n = table.stateCount();
    checkArgument(n > 0, "Model has no states");
    log.log(Level.FINE, "Building {0}x{0} transition matrix", n);

    double[][] matrix = new double[n][n];
    table.stateStream().parallel().forEach(s -> {
      State<?> state = table.getState(s);
      if (state.isTerminal()) {
        return;
      }
      double[] row = matrix[s];
      resolve(state, s, n, policy).forEach((target, probability, reward) -> row[target] += probability);
    });
    return new Array2DRowRealMatrix(matrix, false);
  }

  public static RealMatrix transposed(StateTable<?> table, PolicyPair policy) {
    policy.checkCovers(table);
    int n = table.stateCount();
    checkArgument(n > 0, "Model has no states");
    log.log(Level.FINE, "Building {0}x{0} transposed transition matrix", n);

    double[][] matrix = new double[n][n];
    table.stateStream().parallel().forEach(s -> {
      // terminal states cannot be resolved, their column stays zero
      State<?> state = table.getState(s);
      if (state.isTerminal()) {
        return;
      }
      resolve(state, s, n, policy).forEach((target, probability, reward) -> matrix[target][s] += probability);
    });
    return new Array2DRowRealMatrix(matrix, false);
  }

  static Transition resolve(State<?> state, int stateId, int stateCount, PolicyPair policy) {
    Transition transition = state.meanTransition(policy.action(stateId), policy.outcome(stateId));
    if (transition.maxIndex() >= stateCount) {
      throw new ModelException("State %d: target %d outside %d states"
          .formatted(stateId, transition.maxIndex(), stateCount));
    }
    return transition;
  }
}
