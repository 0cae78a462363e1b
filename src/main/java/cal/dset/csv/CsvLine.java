package cal.dset.csv;

import com.google.common.collect.ImmutableList;

/**
 * Splits one line of comma-separated values into fields.
 *
 * <p>A double quote starts a quoted section in which commas are ordinary
 * characters; the next lone double quote ends it.  Inside a quoted section
 * <code>""</code> stands for one literal quote.  Quotes may appear anywhere in a
 * field and are not part of its value.  Fields are trimmed.  An unterminated
 * quoted section runs to the end of the line.
 */
public abstract class CsvLine {

  private enum State {
    NORMAL,
    QUOTED
  }

  public static ImmutableList<String> parse(String line) {
    ImmutableList.Builder<String> fields = ImmutableList.builder();
    StringBuilder value = new StringBuilder();
    State state = State.NORMAL;

    for (int i = 0; i < line.length(); ++i) {
      char c = line.charAt(i);
      switch (state) {
        case NORMAL:
          if (c == ',') {
            fields.add(value.toString().trim());
            value.setLength(0);
          } else if (c == '"') {
            state = State.QUOTED;
          } else {
            value.append(c);
          }
          break;
        case QUOTED:
          if (c == '"') {
            if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
              value.append('"');
              ++i;
            } else {
              state = State.NORMAL;
            }
          } else {
            value.append(c);
          }
          break;
      }
    }

    fields.add(value.toString().trim());
    return fields.build();
  }

}
