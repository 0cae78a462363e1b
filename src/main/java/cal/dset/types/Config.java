package cal.dset.types;

import lombok.NonNull;
import lombok.Value;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

@Value
public class Config {
  public static final Config DEFAULTS = new Config(2.0, 10, true, StandardCharsets.UTF_8);

  /** groups at or below this share of all records are folded into "Other" */
  double otherThresholdPercent;

  /** the most groups reported before "Other", and the most year intervals */
  int maxGroups;

  /** whether the first line of every CSV file is a header */
  boolean header;

  @NonNull Charset charset;
}
