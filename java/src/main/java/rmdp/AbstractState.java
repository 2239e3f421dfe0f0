package rmdp;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

abstract class AbstractState<A extends Action> implements State<A> {
  private final List<A> actions = new ArrayList<>();
  private final Supplier<A> actionFactory;

  AbstractState(Supplier<A> actionFactory) {
    this.actionFactory = actionFactory;
  }

  @Override
  public List<A> actions() {
    return Collections.unmodifiableList(actions);
  }

  @Override
  public int actionCount() {
    return actions.size();
  }

  @Override
  public A action(int actionId) {
    checkElementIndex(actionId, actions.size(), "action");
    return actions.get(actionId);
  }

  @Override
  public A createAction(int actionId) {
    checkArgument(actionId >= 0, "Negative action id %s", actionId);
    while (actions.size() <= actionId) {
      actions.add(actionFactory.get());
    }
    return actions.get(actionId);
  }

  @Override
  public A createAction() {
    return createAction(actions.size());
  }

  // No bounds check beyond the list's own, these are called from the evaluation sweeps
  @Override
  public double meanReward(int actionId, int outcomeId) {
    return actions.get(actionId).meanReward(outcomeId);
  }

  @Override
  public Transition meanTransition(int actionId, int outcomeId) {
    return actions.get(actionId).meanTransition(outcomeId);
  }

  @Override
  public boolean isActionOutcomeCorrect(int actionId, int outcomeId) {
    return actionId >= 0 && actionId < actions.size() && actions.get(actionId).isOutcomeCorrect(outcomeId);
  }

  @Override
  public boolean isNormalized() {
    return actions.stream().allMatch(Action::isNormalized);
  }

  @Override
  public void normalize() {
    actions.forEach(Action::normalize);
  }

  @Override
  public JsonObject toJson(int stateId) {
    JsonArray actionArray = new JsonArray(actions.size());
    for (int i = 0; i < actions.size(); i++) {
      actionArray.add(actions.get(i).toJson(i));
    }
    JsonObject object = new JsonObject();
    object.addProperty("stateid", stateId);
    object.add("actions", actionArray);
    return object;
  }
}
