package rmdp;

import com.google.gson.annotations.SerializedName;
import java.time.Duration;
import javax.annotation.Nullable;

public record Result(
    InputData input,
    ModelData model,
    @Nullable
    Evaluation evaluation
) {
  public record InputData(
      String name,
      String[] args
  ) {}

  public record ModelData(
      int states,
      long actions,
      long outcomes,
      long transitions,
      @SerializedName("terminal_states")
      long terminalStates,
      boolean normalized
  ) {}

  public record Evaluation(
      double discount,
      @SerializedName("invalid_state")
      int invalidState,
      @Nullable
      double[] rewards,
      @Nullable
      double[] occupancy,
      @Nullable
      @SerializedName("expected_return")
      Double expectedReturn,
      Duration time
  ) {}
}
