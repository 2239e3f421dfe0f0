package rmdp;

public final class Rewards {
  private Rewards() {}

  /** Expected immediate reward of every state under the policy, zero for terminal states. */
  public static double[] stateRewards(StateTable<?> table, PolicyPair policy) {
    policy.checkCovers(table);
    int n = table.stateCount();
    return table.stateStream().parallel().mapToDouble(s -> {
      State<?> state = table.getState(s);
      return state.isTerminal() ? 0.0 : TransitionMatrices.resolve(state, s, n, policy).meanReward();
    }).toArray();
  }
}
