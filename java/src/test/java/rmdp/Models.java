package rmdp;

final class Models {
  private Models() {}

  /**
   * Three states, two actions each. Action 0: 0 -> 1 (reward 0), 1 -> 1 (reward 1), 2 -> 1
   * (reward 1). Action 1: 0 -> 1 (reward 0), 1 -> 2 (reward 0), 2 -> 2 (reward 1.1).
   */
  static StateTable<RegularState> threeStates() {
    StateTable<RegularState> table = StateTable.regular(3);
    table.addTransition(0, 0, 0, 1, 1.0, 0.0);
    table.addTransition(1, 0, 0, 1, 1.0, 1.0);
    table.addTransition(2, 0, 0, 1, 1.0, 1.0);

    table.addTransition(0, 1, 0, 1, 1.0, 0.0);
    table.addTransition(1, 1, 0, 2, 1.0, 0.0);
    table.addTransition(2, 1, 0, 2, 1.0, 1.1);
    return table;
  }

  /** Two non-terminal states with two outcomes per action, plus terminal state 2. */
  static StateTable<RobustState> robust() {
    StateTable<RobustState> table = StateTable.robust();
    table.addTransition(0, 0, 0, 0, 0.5, 1.0);
    table.addTransition(0, 0, 0, 1, 0.5, 2.0);
    table.addTransition(0, 0, 1, 2, 1.0, -1.0);
    table.addTransition(1, 0, 0, 0, 1.0, 3.0);
    table.addTransition(1, 0, 1, 1, 0.25, 0.0);
    table.addTransition(1, 0, 1, 2, 0.75, 4.0);
    return table;
  }
}
