package rmdp;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class RobustAction implements Action {
  private final List<Transition> outcomes = new ArrayList<>();

  @Override
  public List<Transition> outcomes() {
    return Collections.unmodifiableList(outcomes);
  }

  @Override
  public int outcomeCount() {
    return outcomes.size();
  }

  @Override
  public Transition createOutcome(int outcomeId) {
    checkArgument(outcomeId >= 0, "Negative outcome id %s", outcomeId);
    while (outcomes.size() <= outcomeId) {
      outcomes.add(new Transition());
    }
    return outcomes.get(outcomeId);
  }

  public Transition createOutcome() {
    return createOutcome(outcomes.size());
  }

  public Transition outcome(int outcomeId) {
    checkElementIndex(outcomeId, outcomes.size(), "outcome");
    return outcomes.get(outcomeId);
  }

  @Override
  public boolean isOutcomeCorrect(int outcomeId) {
    return outcomeId >= 0 && outcomeId < outcomes.size();
  }

  @Override
  public Transition meanTransition(int outcomeId) {
    if (outcomes.isEmpty()) {
      throw new ModelException("Action has no outcomes");
    }
    Transition transition = outcomes.get(outcomeId);
    if (transition.isEmpty()) {
      throw new ModelException("Outcome %d has no target states".formatted(outcomeId));
    }
    return transition;
  }

  @Override
  public JsonObject toJson(int actionId) {
    JsonArray outcomeArray = new JsonArray(outcomes.size());
    for (int i = 0; i < outcomes.size(); i++) {
      JsonObject outcome = outcomes.get(i).toJson();
      outcome.addProperty("outcomeid", i);
      outcomeArray.add(outcome);
    }
    JsonObject object = new JsonObject();
    object.addProperty("actionid", actionId);
    object.add("outcomes", outcomeArray);
    return object;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (int i = 0; i < outcomes.size(); i++) {
      if (i > 0) {
        builder.append(' ');
      }
      builder.append(i).append(": ").append(outcomes.get(i));
    }
    return builder.toString();
  }
}
