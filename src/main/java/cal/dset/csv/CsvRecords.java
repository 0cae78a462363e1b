package cal.dset.csv;

import cal.dset.types.Config;
import cal.dset.types.Row;
import cal.prim.MalformedDataException;
import cal.prim.collect.ArraySet;
import com.google.common.base.Equivalence;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads CSV files into {@link ArraySet ArraySets} of {@link Row Rows}.
 */
public abstract class CsvRecords {

  /**
   * Read every record of a file.  Blank lines are skipped, as is the first line
   * when {@link Config#header()} is set.  Duplicate records are dropped.
   *
   * @param file the file to read
   * @param config the charset and header settings
   * @param requiredWidth the minimum number of fields in each record
   * @return the distinct records, in file order
   * @throws IOException if the file cannot be read
   * @throws MalformedDataException if a record has fewer than <code>requiredWidth</code> fields
   */
  public static ArraySet<Row> read(Path file, Config config, int requiredWidth) throws IOException, MalformedDataException {
    ArraySet<Row> rows = new ArraySet<>(Equivalence.equals());
    try (BufferedReader in = Files.newBufferedReader(file, config.charset())) {
      int lineNumber = 0;
      String line;
      while ((line = in.readLine()) != null) {
        ++lineNumber;
        if (lineNumber == 1 && config.header()) {
          continue;
        }
        if (line.isBlank()) {
          continue;
        }
        Row row = new Row(CsvLine.parse(line));
        if (row.width() < requiredWidth) {
          throw new MalformedDataException(file + ":" + lineNumber + ": expected at least " + requiredWidth + " fields, found " + row.width());
        }
        rows.add(row).orElseThrow();
      }
    }
    return rows;
  }

}
