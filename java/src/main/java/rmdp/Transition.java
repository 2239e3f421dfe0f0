package rmdp;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/** One outcome of an action. Targets are sorted and unique, probabilities need not sum to one. */
public final class Transition {
  private final IntArrayList indices = new IntArrayList();
  private final DoubleArrayList probabilities = new DoubleArrayList();
  private final DoubleArrayList rewards = new DoubleArrayList();

  public Transition() {
  }

  public Transition(int[] indices, double[] probabilities, double[] rewards) {
    checkArgument(indices.length == probabilities.length && indices.length == rewards.length,
        "Mismatched lengths: %s indices, %s probabilities, %s rewards",
        indices.length, probabilities.length, rewards.length);
    for (int i = 0; i < indices.length; i++) {
      add(indices[i], probabilities[i], rewards[i]);
    }
  }

  public static Transition of(int target, double probability, double reward) {
    Transition transition = new Transition();
    transition.add(target, probability, reward);
    return transition;
  }

  // A repeated target adds its probability, the reward becomes the weighted mean
  public void add(int target, double probability, double reward) {
    checkArgument(target >= 0, "Negative target state %s", target);
    checkArgument(probability >= 0.0, "Target %s has negative probability %s", target, (Object) probability);

    int position = search(target);
    if (position >= 0) {
      double oldProbability = probabilities.getDouble(position);
      double newProbability = oldProbability + probability;
      if (newProbability > 0.0) {
        rewards.set(position, (oldProbability * rewards.getDouble(position) + probability * reward) / newProbability);
      }
      probabilities.set(position, newProbability);
      return;
    }
    int insertion = -position - 1;
    indices.add(insertion, target);
    probabilities.add(insertion, probability);
    rewards.add(insertion, reward);
  }

  private int search(int target) {
    int low = 0;
    int high = indices.size() - 1;
    while (low <= high) {
      int middle = (low + high) >>> 1;
      int value = indices.getInt(middle);
      if (value < target) {
        low = middle + 1;
      } else if (value > target) {
        high = middle - 1;
      } else {
        return middle;
      }
    }
    return -(low + 1);
  }

  public int size() {
    return indices.size();
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  public IntList indices() {
    return IntLists.unmodifiable(indices);
  }

  public DoubleList probabilities() {
    return DoubleLists.unmodifiable(probabilities);
  }

  public DoubleList rewards() {
    return DoubleLists.unmodifiable(rewards);
  }

  public int maxIndex() {
    return indices.isEmpty() ? -1 : indices.getInt(indices.size() - 1);
  }

  public double sumProbabilities() {
    return Util.sum(0, probabilities.size(), probabilities::getDouble);
  }

  public boolean isNormalized() {
    return Util.doublesEqualLoose(sumProbabilities(), 1.0);
  }

  /**
   * @throws ModelException if the probabilities sum to zero, which includes the empty transition
   */
  public void normalize() {
    double sum = sumProbabilities();
    if (!(sum > 0.0)) {
      throw new ModelException("Probabilities sum to %s and cannot be normalized".formatted(sum));
    }
    for (int i = 0; i < probabilities.size(); i++) {
      probabilities.set(i, probabilities.getDouble(i) / sum);
    }
  }

  // Not divided by the total probability
  public double meanReward() {
    if (indices.isEmpty()) {
      throw new ModelException("Transition with no target states");
    }
    return Util.sum(0, indices.size(), i -> probabilities.getDouble(i) * rewards.getDouble(i));
  }

  public double[] probabilitiesVector(int size) {
    checkArgument(maxIndex() < size, "Target state %s does not fit into size %s", maxIndex(), size);
    double[] vector = new double[size];
    for (int i = 0; i < indices.size(); i++) {
      vector[indices.getInt(i)] += probabilities.getDouble(i);
    }
    return vector;
  }

  public void forEach(TransitionConsumer consumer) {
    for (int i = 0; i < indices.size(); i++) {
      consumer.accept(indices.getInt(i), probabilities.getDouble(i), rewards.getDouble(i));
    }
  }

  public JsonObject toJson() {
    JsonArray stateIds = new JsonArray(indices.size());
    JsonArray probabilityArray = new JsonArray(indices.size());
    JsonArray rewardArray = new JsonArray(indices.size());
    forEach((target, probability, reward) -> {
      stateIds.add(target);
      probabilityArray.add(probability);
      rewardArray.add(reward);
    });
    JsonObject object = new JsonObject();
    object.add("stateids", stateIds);
    object.add("probabilities", probabilityArray);
    object.add("rewards", rewardArray);
    return object;
  }

  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder(indices.size() * 20);
    builder.append('{');
    for (int i = 0; i < indices.size(); i++) {
      builder.append(indices.getInt(i)).append(": ").append(probabilities.getDouble(i))
          .append(" (").append(rewards.getDouble(i)).append(')');
      if (i < indices.size() - 1) {
        builder.append(", ");
      }
    }
    builder.append('}');
    return builder.toString();
  }

  @FunctionalInterface
  public interface TransitionConsumer {
    void accept(int target, double probability, double reward);
  }
}
