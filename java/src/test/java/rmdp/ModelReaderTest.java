package rmdp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import java.io.IOException;
import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Random;
import org.junit.jupiter.api.Test;

class ModelReaderTest {
  private static Multiset<String> rows(String csv) {
    return HashMultiset.create(csv.lines().toList());
  }

  @Test
  void readsFixture() throws IOException, URISyntaxException {
    Path path = Path.of(Objects.requireNonNull(getClass().getResource("/robust.csv")).toURI());
    StateTable<RobustState> table = ModelReader.readCsv(path, true, StateTable.robust());

    assertEquals(4, table.stateCount());
    assertTrue(table.getState(3).isTerminal());
    assertEquals(2, table.getState(0).actionCount());
    assertEquals(2, table.getState(0).action(1).outcomeCount());
    assertTrue(table.isNormalized());
    assertEquals(PolicyValidator.VALID,
        PolicyValidator.firstInvalidState(table, new PolicyPair(new int[] {1, 0, 0, 0}, new int[] {1, 0, 0, 0})));
  }

  @Test
  void roundTripPreservesRows() throws IOException {
    Random random = new Random(7);
    StateTable<RobustState> table = StateTable.robust();
    for (int s = 0; s < 20; s++) {
      int actions = 1 + random.nextInt(3);
      for (int a = 0; a < actions; a++) {
        int outcomes = 1 + random.nextInt(3);
        for (int o = 0; o < outcomes; o++) {
          for (int k = 0; k < 3; k++) {
            table.addTransition(s, a, o, random.nextInt(25), random.nextDouble(), random.nextGaussian());
          }
        }
      }
    }
    String exported = ModelWriter.toCsv(table, true);
    StateTable<RobustState> imported = ModelReader.readCsv(new StringReader(exported), true, StateTable.robust());
    assertEquals(rows(exported), rows(ModelWriter.toCsv(imported, true)));
    assertEquals(ModelWriter.toJson(table), ModelWriter.toJson(imported));
  }

  @Test
  void regularRoundTrip() throws IOException {
    String exported = ModelWriter.toCsv(Models.threeStates(), false);
    StateTable<RegularState> imported = ModelReader.readCsv(new StringReader(exported), false, StateTable.regular());
    assertEquals(exported, ModelWriter.toCsv(imported, false));
  }

  @Test
  void malformedRows() {
    assertThrows(IllegalArgumentException.class,
        () -> ModelReader.readCsv(new StringReader("0,0,0,1,1.0\n"), false, StateTable.regular()));
    assertThrows(IllegalArgumentException.class,
        () -> ModelReader.readCsv(new StringReader("0,0,0,1,x,0\n"), false, StateTable.regular()));
    assertThrows(IllegalArgumentException.class,
        () -> ModelReader.readCsv(new StringReader("0,0,0,1,-1.0,0\n"), false, StateTable.regular()));
    IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
        () -> ModelReader.readCsv(new StringReader("h\n0,0,0,1,1.0,0\n0,0,1,1,1.0,0\n"), true, StateTable.regular()));
    assertTrue(exception.getMessage().startsWith("Line 3"));
  }
}
