package rmdp;

import static com.google.common.base.Preconditions.checkArgument;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(name = "evaluate", mixinStandardHelpOptions = true, version = "1.0",
    description = "Evaluates a fixed policy pair on a (robust) MDP given as CSV")
public final class Main implements Callable<Integer> {
  private static final Logger log = Logger.getLogger("rmdp");
  private final String[] args;

  @Option(names = {"-m", "--model"}, description = "Model file (CSV: idstatefrom,idaction,idoutcome,idstateto,probability,reward)", required = true)
  private Path modelFile;
  @Option(names = {"--robust"}, description = "Read a robust model with several outcomes per action")
  private boolean robust;
  @Option(names = {"--no-header"}, description = "Model file has no header line")
  private boolean noHeader;
  @Option(names = {"-p", "--policy"}, description = "Action of every state", split = ",", required = true)
  private List<Integer> policy;
  @Option(names = {"-n", "--nature"}, description = "Outcome of every state (default all 0)", split = ",")
  @Nullable
  private List<Integer> nature;
  @Option(names = {"-d", "--discount"}, description = "Discount factor in [0, 1)", defaultValue = "0.9")
  private double discount;
  @Option(names = {"-i", "--initial"}, description = "Initial state (default uniform over all states)")
  @Nullable
  private Integer initialState;
  @Option(names = {"--normalize"}, description = "Normalize all outcomes before evaluation")
  private boolean normalize;
  @Option(names = {"-o", "--output"}, description = "Output (- for stdout)")
  private String outputFile;

  public Main(String[] args) {
    this.args = args;
  }

  @Override
  public Integer call() throws Exception {
    StateTable<?> table = robust
        ? ModelReader.readCsv(modelFile, !noHeader, StateTable.robust())
        : ModelReader.readCsv(modelFile, !noHeader, StateTable.regular());
    int states = table.stateCount();
    checkArgument(states > 0, "Model %s has no states", modelFile);
    if (normalize) {
      table.normalize();
    }

    long terminalStates = table.states().stream().filter(State::isTerminal).count();
    var modelData = new Result.ModelData(states, table.actionCount(), table.outcomeCount(),
        table.transitionCount(), terminalStates, table.isNormalized());
    log.log(Level.INFO, "Model has {0} states ({1} terminal), {2} actions, {3} outcomes, {4} transitions",
        new Object[] {states, terminalStates, modelData.actions(), modelData.outcomes(), modelData.transitions()});

    checkArgument(policy.size() == states, "Policy has %s entries, model has %s states", policy.size(), states);
    int[] actions = policy.stream().mapToInt(Integer::intValue).toArray();
    int[] outcomes = nature == null ? new int[states] : nature.stream().mapToInt(Integer::intValue).toArray();
    checkArgument(outcomes.length == states, "Nature policy has %s entries, model has %s states", outcomes.length, states);
    PolicyPair policyPair = new PolicyPair(actions, outcomes);

    long start = System.nanoTime();
    Result.Evaluation evaluation;
    int invalidState = PolicyValidator.firstInvalidState(table, policyPair);
    if (invalidState == PolicyValidator.VALID) {
      double[] initial;
      if (initialState == null) {
        initial = new double[states];
        Arrays.fill(initial, 1.0 / states);
      } else {
        initial = Transition.of(initialState, 1.0, 0.0).probabilitiesVector(states);
      }
      double[] rewards = Rewards.stateRewards(table, policyPair);
      double[] occupancy = OccupancySolver.solve(table, initial, discount, policyPair);
      double expectedReturn = OccupancySolver.expectedReturn(occupancy, rewards);
      log.log(Level.INFO, "Expected discounted return {0}", expectedReturn);
      evaluation = new Result.Evaluation(discount, invalidState, rewards, occupancy, expectedReturn,
          Duration.ofNanos(System.nanoTime() - start));
    } else {
      log.log(Level.WARNING, "Policy is invalid in state {0}", invalidState);
      evaluation = new Result.Evaluation(discount, invalidState, null, null, null,
          Duration.ofNanos(System.nanoTime() - start));
    }

    Result result = new Result(new Result.InputData(modelFile.getFileName().toString(), args), modelData, evaluation);

    GsonBuilder gsonBuilder = new GsonBuilder();
    if (outputFile == null || outputFile.equals("-")) {
      gsonBuilder.setPrettyPrinting();
    }
    gsonBuilder.registerTypeAdapter(Duration.class, (JsonSerializer<Duration>) (src, typeOfSrc, context) ->
        new JsonPrimitive(src.toSeconds() + (src.getNano() / (double) TimeUnit.SECONDS.toNanos(1))));
    Gson gson = gsonBuilder.create();
    try (Writer writer = (outputFile == null || outputFile.equals("-"))
        ? new OutputStreamWriter(System.out) : Files.newBufferedWriter(Path.of(outputFile))) {
      gson.toJson(result, writer);
    }
    return invalidState == PolicyValidator.VALID ? 0 : 1;
  }

  public static void main(String[] args) {
    System.exit(new CommandLine(new Main(args)).execute(args));
  }
}
