package rmdp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StateTableTest {
  @Test
  void createStateFillsGapsWithTerminalStates() {
    StateTable<RegularState> table = StateTable.regular();
    RegularState state = table.createState(3);
    assertEquals(4, table.stateCount());
    assertSame(state, table.getState(3));
    assertTrue(table.states().stream().allMatch(State::isTerminal));

    table.createState(1);
    assertEquals(4, table.stateCount());
    table.createState();
    assertEquals(5, table.stateCount());
  }

  @Test
  void invalidIdsFailImmediately() {
    StateTable<RobustState> table = StateTable.robust(2);
    assertThrows(IllegalArgumentException.class, () -> table.createState(-1));
    assertThrows(IndexOutOfBoundsException.class, () -> table.getState(2));
    assertThrows(IndexOutOfBoundsException.class, () -> table.getState(-1));
    assertThrows(UnsupportedOperationException.class, () -> table.states().add(new RobustState()));
  }

  @Test
  void addTransitionCreatesTargetState() {
    StateTable<RegularState> table = StateTable.regular();
    table.addTransition(0, 1, 0, 5, 1.0, 2.0);
    assertEquals(6, table.stateCount());
    assertTrue(table.getState(5).isTerminal());
    assertEquals(2, table.getState(0).actionCount());
    assertTrue(table.getState(0).action(0).transition().isEmpty());
  }

  @Test
  void regularActionsHaveOnlyOutcomeZero() {
    StateTable<RegularState> table = StateTable.regular();
    assertThrows(IllegalArgumentException.class, () -> table.addTransition(0, 0, 1, 0, 1.0, 0.0));
  }

  @Test
  void counts() {
    StateTable<RobustState> table = Models.robust();
    assertEquals(3, table.stateCount());
    assertEquals(2, table.actionCount());
    assertEquals(4, table.outcomeCount());
    assertEquals(6, table.transitionCount());
  }

  @Test
  void normalizeIsIdempotent() {
    StateTable<RobustState> table = StateTable.robust();
    table.addTransition(0, 0, 0, 1, 2.0, 0.0);
    table.addTransition(0, 0, 0, 2, 6.0, 0.0);
    table.addTransition(0, 0, 1, 0, 0.5, 0.0);
    assertFalse(table.isNormalized());

    table.normalize();
    assertTrue(table.isNormalized());
    Transition outcome = table.getState(0).action(0).outcome(0);
    assertEquals(0.25, outcome.probabilities().getDouble(0), 1e-12);
    assertEquals(0.75, outcome.probabilities().getDouble(1), 1e-12);

    table.normalize();
    assertTrue(table.isNormalized());
    assertEquals(0.25, outcome.probabilities().getDouble(0), 1e-12);
    assertEquals(1.0, table.getState(0).action(0).outcome(1).probabilities().getDouble(0), 1e-12);
  }

  @Test
  void normalizeWithZeroWeightLeavesTableUnchanged() {
    StateTable<RobustState> table = StateTable.robust();
    table.addTransition(0, 0, 0, 1, 2.0, 0.0);
    table.addTransition(1, 0, 0, 0, 0.0, 0.0);

    ModelException exception = assertThrows(ModelException.class, table::normalize);
    assertTrue(exception.getMessage().contains("state 1"));
    assertEquals(2.0, table.getState(0).action(0).outcome(0).probabilities().getDouble(0));
  }

  @Test
  void emptyTableIsNormalized() {
    assertTrue(StateTable.regular(4).isNormalized());
  }
}
