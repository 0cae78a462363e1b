package cal.dset.types;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * One record of a CSV file.  Two rows are equal if all of their fields are equal.
 */
public record Row(ImmutableList<String> fields) {

  public Row {
    Objects.requireNonNull(fields);
  }

  public static Row of(String... fields) {
    return new Row(ImmutableList.copyOf(fields));
  }

  public static Row of(List<String> fields) {
    return new Row(ImmutableList.copyOf(fields));
  }

  public int width() {
    return fields.size();
  }

  public String field(int column) {
    return fields.get(column);
  }

  @Override
  public String toString() {
    return String.join(", ", fields);
  }

}
