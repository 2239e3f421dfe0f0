package rmdp;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.IntStream;

/**
 * Grow-only table of states; gaps are filled with terminal states. Not synchronized, evaluation
 * routines read it concurrently and must not overlap with modifications.
 */
public final class StateTable<S extends State<?>> {
  private final List<S> states;
  private final Supplier<S> stateFactory;

  public StateTable(Supplier<S> stateFactory, int stateCount) {
    checkArgument(stateCount >= 0);
    this.stateFactory = stateFactory;
    this.states = new ArrayList<>(stateCount);
    for (int i = 0; i < stateCount; i++) {
      states.add(stateFactory.get());
    }
  }

  public StateTable(Supplier<S> stateFactory) {
    this(stateFactory, 0);
  }

  public static StateTable<RegularState> regular(int stateCount) {
    return new StateTable<>(RegularState::new, stateCount);
  }

  public static StateTable<RegularState> regular() {
    return regular(0);
  }

  public static StateTable<RobustState> robust(int stateCount) {
    return new StateTable<>(RobustState::new, stateCount);
  }

  public static StateTable<RobustState> robust() {
    return robust(0);
  }

  public S createState(int stateId) {
    checkArgument(stateId >= 0, "Negative state id %s", stateId);
    while (states.size() <= stateId) {
      states.add(stateFactory.get());
    }
    return states.get(stateId);
  }

  public S createState() {
    return createState(states.size());
  }

  public S getState(int stateId) {
    checkElementIndex(stateId, states.size(), "state");
    return states.get(stateId);
  }

  public int stateCount() {
    return states.size();
  }

  public List<S> states() {
    return Collections.unmodifiableList(states);
  }

  public IntStream stateStream() {
    return IntStream.range(0, states.size());
  }

  public long actionCount() {
    return states.stream().mapToLong(State::actionCount).sum();
  }

  public long outcomeCount() {
    return states.stream().<Action>flatMap(state -> state.actions().stream()).mapToLong(Action::outcomeCount).sum();
  }

  public long transitionCount() {
    return states.stream().<Action>flatMap(state -> state.actions().stream())
        .flatMap(action -> action.outcomes().stream())
        .mapToLong(Transition::size)
        .sum();
  }

  // Creates missing states (including the target), actions and outcomes
  public void addTransition(int from, int action, int outcome, int to, double probability, double reward) {
    checkArgument(from >= 0 && to >= 0, "Negative state id in transition %s -> %s", from, to);
    createState(Math.max(from, to));
    createState(from).createAction(action).createOutcome(outcome).add(to, probability, reward);
  }

  public boolean isNormalized() {
    for (S state : states) {
      if (!state.isNormalized()) {
        return false;
      }
    }
    return true;
  }

  /**
   * @throws ModelException if some outcome has zero total probability; the table is left unchanged
   */
  public void normalize() {
    for (int s = 0; s < states.size(); s++) {
      List<? extends Action> actions = states.get(s).actions();
      for (int a = 0; a < actions.size(); a++) {
        List<Transition> outcomes = actions.get(a).outcomes();
        for (int o = 0; o < outcomes.size(); o++) {
          if (!(outcomes.get(o).sumProbabilities() > 0.0)) {
            throw new ModelException("Cannot normalize outcome %d of action %d in state %d: zero total probability"
                .formatted(o, a, s));
          }
        }
      }
    }
    states.forEach(State::normalize);
  }
}
