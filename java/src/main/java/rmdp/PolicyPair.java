package rmdp;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/**
 * The decision maker's action and nature's outcome per state. The arrays are shared, not copied;
 * equality compares their contents.
 */
@SuppressWarnings("AssignmentOrReturnOfFieldWithMutableType")
public record PolicyPair(int[] actions, int[] outcomes) {
  public PolicyPair {
    checkArgument(actions.length == outcomes.length,
        "Policy has %s actions but %s outcomes", actions.length, outcomes.length);
  }

  public static PolicyPair of(int... actions) {
    return new PolicyPair(actions, new int[actions.length]);
  }

  public int size() {
    return actions.length;
  }

  public int action(int state) {
    return actions[state];
  }

  public int outcome(int state) {
    return outcomes[state];
  }

  void checkCovers(StateTable<?> table) {
    checkArgument(actions.length >= table.stateCount(),
        "Policy covers %s states, model has %s", actions.length, table.stateCount());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof PolicyPair other
        && Arrays.equals(actions, other.actions)
        && Arrays.equals(outcomes, other.outcomes);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(actions) + Arrays.hashCode(outcomes);
  }

  @Override
  public String toString() {
    return "actions=%s, outcomes=%s".formatted(Arrays.toString(actions), Arrays.toString(outcomes));
  }
}
