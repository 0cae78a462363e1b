package cal.dset.report;

import cal.dset.types.Row;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Counts rows by the value of one column, for charts and summaries.
 *
 * <p>Groups are ordered by size, largest first (equal sizes by label, descending).
 * Only the first <code>maxGroups</code> groups whose share of all rows is above
 * the threshold are reported individually; the rest are folded into one
 * trailing {@link #OTHER} group.
 */
public abstract class GroupCounts {

  public static final String OTHER = "Other";

  public record Group(String label, int count, double percent) {
    @Override
    public String toString() {
      return String.format(Locale.ROOT, "%s: %d (%.1f%%)", label, count, percent);
    }
  }

  public static List<Group> compute(Iterable<Row> rows, int column, int maxGroups, double thresholdPercent) {
    if (maxGroups < 1) {
      throw new IllegalArgumentException("maxGroups must be positive, was " + maxGroups);
    }

    Map<String, Integer> counts = new LinkedHashMap<>();
    int total = 0;
    for (Row row : rows) {
      counts.merge(row.field(column), 1, Integer::sum);
      ++total;
    }

    List<Map.Entry<String, Integer>> sorted = new ArrayList<>(counts.entrySet());
    sorted.sort(Map.Entry.<String, Integer>comparingByValue()
            .thenComparing(Map.Entry.<String, Integer>comparingByKey())
            .reversed());

    List<Group> result = new ArrayList<>();
    int other = 0;
    for (int i = 0; i < sorted.size(); ++i) {
      String label = sorted.get(i).getKey();
      int count = sorted.get(i).getValue();
      double percent = 100.0 * count / total;
      if (i < maxGroups && percent > thresholdPercent) {
        result.add(new Group(label, count, percent));
      } else {
        other += count;
      }
    }

    if (other > 0) {
      result.add(new Group(OTHER, other, 100.0 * other / total));
    }
    return result;
  }

}
