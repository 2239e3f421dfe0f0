package rmdp;

import static com.google.common.base.Preconditions.checkArgument;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ModelReader {
  private ModelReader() {}

  public static <S extends State<?>> StateTable<S> readCsv(Reader input, boolean header, StateTable<S> table)
      throws IOException {
    BufferedReader reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
    int lineNumber = 0;
    if (header) {
      reader.readLine();
      lineNumber += 1;
    }
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber += 1;
      String stripped = line.strip();
      if (stripped.isEmpty()) {
        continue;
      }
      String[] row = stripped.split(",");
      checkArgument(row.length == 6, "Line %s: expected 6 columns, got %s", lineNumber, row.length);
      try {
        int from = Integer.parseInt(row[0].strip());
        int action = Integer.parseInt(row[1].strip());
        int outcome = Integer.parseInt(row[2].strip());
        int to = Integer.parseInt(row[3].strip());
        double probability = Double.parseDouble(row[4].strip());
        double reward = Double.parseDouble(row[5].strip());
        table.addTransition(from, action, outcome, to, probability, reward);
      } catch (IllegalArgumentException e) {
        // also covers NumberFormatException
        throw new IllegalArgumentException("Line %d: %s".formatted(lineNumber, e.getMessage()), e);
      }
    }
    return table;
  }

  public static <S extends State<?>> StateTable<S> readCsv(Path path, boolean header, StateTable<S> table)
      throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path)) {
      return readCsv(reader, header, table);
    }
  }
}
