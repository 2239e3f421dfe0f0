package rmdp;

import com.google.gson.JsonObject;
import java.util.List;

public interface Action {
  List<Transition> outcomes();

  int outcomeCount();

  Transition createOutcome(int outcomeId);

  boolean isOutcomeCorrect(int outcomeId);

  // ModelException if the action has no outcomes or the outcome has no targets
  Transition meanTransition(int outcomeId);

  default double meanReward(int outcomeId) {
    return meanTransition(outcomeId).meanReward();
  }

  default boolean isNormalized() {
    return outcomes().stream().allMatch(Transition::isNormalized);
  }

  default void normalize() {
    outcomes().forEach(Transition::normalize);
  }

  JsonObject toJson(int actionId);
}
