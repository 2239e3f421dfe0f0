package rmdp;

import com.google.gson.JsonObject;
import java.util.List;

/**
 * A state without actions is terminal; its value is zero and it is never resolved for transitions
 * or rewards.
 */
public interface State<A extends Action> {
  List<A> actions();

  int actionCount();

  A action(int actionId);

  A createAction(int actionId);

  A createAction();

  default boolean isTerminal() {
    return actionCount() == 0;
  }

  double meanReward(int actionId, int outcomeId);

  Transition meanTransition(int actionId, int outcomeId);

  boolean isActionOutcomeCorrect(int actionId, int outcomeId);

  boolean isNormalized();

  void normalize();

  JsonObject toJson(int stateId);
}
