package rmdp;

public final class PolicyValidator {
  public static final int VALID = -1;

  private PolicyValidator() {}

  /** First non-terminal state whose action or outcome does not exist, or {@link #VALID}. */
  public static int firstInvalidState(StateTable<?> table, PolicyPair policy) {
    policy.checkCovers(table);
    for (int s = 0; s < table.stateCount(); s++) {
      State<?> state = table.getState(s);
      if (state.isTerminal()) {
        continue;
      }
      if (!state.isActionOutcomeCorrect(policy.action(s), policy.outcome(s))) {
        return s;
      }
    }
    return VALID;
  }

  public static boolean isValid(StateTable<?> table, PolicyPair policy) {
    return firstInvalidState(table, policy) == VALID;
  }

  public static void checkPolicy(StateTable<?> table, PolicyPair policy) {
    int state = firstInvalidState(table, policy);
    if (state != VALID) {
      throw new IllegalArgumentException("Invalid policy in state %d: action %d, outcome %d (%d actions available)"
          .formatted(state, policy.action(state), policy.outcome(state), table.getState(state).actionCount()));
    }
  }
}
