package rmdp;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public final class ModelWriter {
  public static final String CSV_HEADER = "idstatefrom,idaction,idoutcome,idstateto,probability,reward";

  private static final Gson gson = new GsonBuilder().create();

  private ModelWriter() {}

  // States without actions produce no rows
  public static void writeCsv(StateTable<?> table, Appendable output, boolean header) throws IOException {
    if (header) {
      output.append(CSV_HEADER).append('\n');
    }
    List<? extends State<?>> states = table.states();
    for (int s = 0; s < states.size(); s++) {
      List<? extends Action> actions = states.get(s).actions();
      for (int a = 0; a < actions.size(); a++) {
        List<Transition> outcomes = actions.get(a).outcomes();
        for (int o = 0; o < outcomes.size(); o++) {
          Transition transition = outcomes.get(o);
          for (int i = 0; i < transition.size(); i++) {
            output.append(String.valueOf(s)).append(',')
                .append(String.valueOf(a)).append(',')
                .append(String.valueOf(o)).append(',')
                .append(String.valueOf(transition.indices().getInt(i))).append(',')
                .append(String.valueOf(transition.probabilities().getDouble(i))).append(',')
                .append(String.valueOf(transition.rewards().getDouble(i))).append('\n');
          }
        }
      }
    }
  }

  public static void writeCsv(StateTable<?> table, Path path, boolean header) throws IOException {
    try (Writer writer = Files.newBufferedWriter(path)) {
      writeCsv(table, writer, header);
    }
  }

  public static String toCsv(StateTable<?> table, boolean header) {
    StringBuilder builder = new StringBuilder();
    try {
      writeCsv(table, builder, header);
    } catch (IOException e) {
      throw new AssertionError("StringBuilder does not throw", e);
    }
    return builder.toString();
  }

  public static JsonObject toJsonTree(StateTable<?> table) {
    List<? extends State<?>> states = table.states();
    JsonArray stateArray = new JsonArray(states.size());
    for (int s = 0; s < states.size(); s++) {
      stateArray.add(states.get(s).toJson(s));
    }
    JsonObject object = new JsonObject();
    object.add("states", stateArray);
    return object;
  }

  public static String toJson(StateTable<?> table) {
    return gson.toJson(toJsonTree(table));
  }

  public static String toText(StateTable<?> table) {
    StringBuilder builder = new StringBuilder();
    List<? extends State<?>> states = table.states();
    for (int s = 0; s < states.size(); s++) {
      State<?> state = states.get(s);
      builder.append(s).append(" : ").append(state.actionCount()).append('\n');
      List<? extends Action> actions = state.actions();
      for (int a = 0; a < actions.size(); a++) {
        builder.append("    ").append(a).append(" : ").append(actions.get(a)).append('\n');
      }
    }
    return builder.toString();
  }
}
