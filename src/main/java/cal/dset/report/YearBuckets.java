package cal.dset.report;

import cal.dset.types.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Counts rows by the year found in one column, in equal-width intervals.
 *
 * <p>The interval starts at {@value #INITIAL_INTERVAL} years and is widened by
 * half (rounding down) until the span from the earliest to the latest year fits
 * in <code>maxBuckets</code> intervals.  Rows without a year are reported to a
 * diagnostic sink and otherwise ignored.
 */
public abstract class YearBuckets {

  public static final int EARLIEST_YEAR = 100;
  public static final int LATEST_YEAR = 2024;
  public static final int INITIAL_INTERVAL = 50;

  public record Bucket(int start, int end, int count) {
    @Override
    public String toString() {
      return start + "-" + end + ": " + count;
    }
  }

  public record Histogram(int interval, List<Bucket> buckets) {
  }

  /**
   * Find the first run of three or four digits that reads as a year in
   * [{@value #EARLIEST_YEAR}, {@value #LATEST_YEAR}].  Longer or shorter runs
   * of digits are skipped.
   *
   * @param text free text, such as <code>"c. 1450-1460"</code>
   * @return the year, or empty if there is none
   */
  public static OptionalInt findYear(String text) {
    int runStart = -1;
    for (int i = 0; i <= text.length(); ++i) {
      boolean digit = i < text.length() && isAsciiDigit(text.charAt(i));
      if (digit) {
        if (runStart < 0) {
          runStart = i;
        }
      } else if (runStart >= 0) {
        int length = i - runStart;
        if (length == 3 || length == 4) {
          int year = Integer.parseInt(text, runStart, i, 10);
          if (year >= EARLIEST_YEAR && year <= LATEST_YEAR) {
            return OptionalInt.of(year);
          }
        }
        runStart = -1;
      }
    }
    return OptionalInt.empty();
  }

  public static boolean containsYear(String text) {
    return findYear(text).isPresent();
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }

  /**
   * Pick the narrowest interval, starting from {@value #INITIAL_INTERVAL} and
   * widening by half, that covers <code>[minYear, maxYear]</code> in at most
   * <code>maxBuckets</code> intervals.
   */
  static int interval(int minYear, int maxYear, int maxBuckets) {
    int interval = INITIAL_INTERVAL;
    while ((maxYear - minYear) / interval + 1 > maxBuckets) {
      interval = interval * 3 / 2;
    }
    return interval;
  }

  public static Histogram compute(Iterable<Row> rows, int column, int maxBuckets, Consumer<String> diagnostics) {
    if (maxBuckets < 1) {
      throw new IllegalArgumentException("maxBuckets must be positive, was " + maxBuckets);
    }

    List<Integer> years = new ArrayList<>();
    for (Row row : rows) {
      OptionalInt year = findYear(row.field(column));
      if (year.isPresent()) {
        years.add(year.getAsInt());
      } else {
        diagnostics.accept("No valid year in record: " + row);
      }
    }

    if (years.isEmpty()) {
      return new Histogram(INITIAL_INTERVAL, List.of());
    }

    int min = LATEST_YEAR;
    int max = EARLIEST_YEAR;
    for (int year : years) {
      min = Math.min(min, year);
      max = Math.max(max, year);
    }

    int interval = interval(min, max, maxBuckets);
    TreeMap<Integer, Integer> counts = new TreeMap<>();
    for (int year : years) {
      int start = min + (year - min) / interval * interval;
      counts.merge(start, 1, Integer::sum);
    }

    List<Bucket> buckets = new ArrayList<>();
    counts.forEach((start, count) -> buckets.add(new Bucket(start, start + interval - 1, count)));
    return new Histogram(interval, buckets);
  }

}
