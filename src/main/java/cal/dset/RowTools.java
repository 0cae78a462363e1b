package cal.dset;

import cal.dset.types.Row;
import cal.prim.collect.ArraySet;
import cal.prim.collect.ArraySets;
import cal.prim.collect.Result;
import com.google.common.base.Equivalence;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

public abstract class RowTools {

  /**
   * Keep the rows that have a field containing <code>text</code>, ignoring case.
   */
  public static Result<ArraySet<Row>> search(ArraySet<Row> rows, String text) {
    String needle = text.toLowerCase(Locale.ROOT);
    return ArraySets.filter(rows, row -> row.fields().stream()
            .anyMatch(field -> field.toLowerCase(Locale.ROOT).contains(needle)));
  }

  /**
   * Remove every row whose field in <code>column</code> equals <code>value</code>.
   *
   * @return the number of rows removed
   */
  public static int removeWhere(ArraySet<Row> rows, int column, String value) {
    // Collect first: removing while iterating would invalidate the iterator.
    List<Row> doomed = new ArrayList<>();
    for (Row row : rows) {
      if (row.field(column).equals(value)) {
        doomed.add(row);
      }
    }
    int removed = 0;
    for (Row row : doomed) {
      if (rows.remove(row)) {
        ++removed;
      }
    }
    return removed;
  }

  /**
   * The distinct values of one column, in first-seen order.
   */
  public static Result<ArraySet<String>> column(ArraySet<Row> rows, int column) {
    return project(rows, row -> row.field(column));
  }

  /**
   * The {@link Row#toString() textual form} of every row.
   */
  public static Result<ArraySet<String>> render(ArraySet<Row> rows) {
    return project(rows, Row::toString);
  }

  private static Result<ArraySet<String>> project(ArraySet<Row> rows, Function<Row, String> f) {
    List<String> values = new ArrayList<>(rows.size());
    for (Row row : rows) {
      values.add(f.apply(row));
    }
    return ArraySet.of(Equivalence.equals(), values);
  }

}
