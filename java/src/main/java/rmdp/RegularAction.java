package rmdp;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.gson.JsonObject;
import java.util.List;

/** An action with exactly one outcome (id 0); nature has no choice. */
public final class RegularAction implements Action {
  private final Transition transition = new Transition();

  public Transition transition() {
    return transition;
  }

  @Override
  public List<Transition> outcomes() {
    return List.of(transition);
  }

  @Override
  public int outcomeCount() {
    return 1;
  }

  @Override
  public Transition createOutcome(int outcomeId) {
    checkArgument(outcomeId == 0, "Regular action has only outcome 0, got %s", outcomeId);
    return transition;
  }

  @Override
  public boolean isOutcomeCorrect(int outcomeId) {
    return outcomeId == 0;
  }

  @Override
  public Transition meanTransition(int outcomeId) {
    checkElementIndex(outcomeId, 1, "outcome");
    if (transition.isEmpty()) {
      throw new ModelException("Action transition has no target states");
    }
    return transition;
  }

  @Override
  public JsonObject toJson(int actionId) {
    JsonObject object = new JsonObject();
    object.addProperty("actionid", actionId);
    object.add("transition", transition.toJson());
    return object;
  }

  @Override
  public String toString() {
    return transition.toString();
  }
}
