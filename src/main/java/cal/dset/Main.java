package cal.dset;

import cal.dset.csv.CsvRecords;
import cal.dset.report.GroupCounts;
import cal.dset.report.YearBuckets;
import cal.dset.types.Config;
import cal.dset.types.Row;
import cal.prim.MalformedDataException;
import cal.prim.collect.ArraySet;
import cal.prim.collect.ArraySets;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class Main {

  private static final String HOME = System.getProperty("user.home");
  private static final Path CFG_FILE = Paths.get(HOME, ".dset-config.json").toAbsolutePath();

  private static Options options() {
    Options options = new Options();

    // flags
    options.addOption("h", "help", false, "Show help and quit");
    options.addOption("c", "column", true, "Work on column N (0-based) instead of whole records");
    options.addOption(Option.builder().longOpt("no-header").desc("The first line of each file is a record, not a header").build());
    options.addOption(Option.builder().longOpt("config").hasArg().desc("Configuration file (default " + CFG_FILE + ')').build());

    // actions
    options.addOption("u", "union", false, "Combine FILE and FILE2 by union");
    options.addOption("i", "intersect", false, "Combine FILE and FILE2 by intersection");
    options.addOption("m", "match", true, "Keep only records with a field containing TEXT (ignoring case)");
    options.addOption("r", "remove", true, "Remove records whose column (see -c, default 0) equals VALUE");
    options.addOption("g", "group-by", true, "Show record counts grouped by column N");
    options.addOption("y", "years", true, "Show record counts per interval of the year found in column N");
    options.addOption("o", "output", true, "Save the resulting set to a file");
    return options;
  }

  private static void showHelp(Options options, PrintStream out) {
    PrintWriter w = new PrintWriter(out);
    new HelpFormatter().printHelp(w, HelpFormatter.DEFAULT_WIDTH, "dset [options] FILE [FILE2]", null, options,
            HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    w.flush();
  }

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) {
      System.exit(status);
    }
  }

  static int run(String[] args, PrintStream out, PrintStream err) {
    Options options = options();

    CommandLine cli;
    try {
      cli = new DefaultParser().parse(options, args);
    } catch (ParseException e) {
      err.println("Failed to parse options: " + e);
      showHelp(options, err);
      return 1;
    }

    if (cli.hasOption('h')) {
      showHelp(options, out);
      return 0;
    }

    final boolean union = cli.hasOption('u');
    final boolean intersect = cli.hasOption('i');
    final List<String> files = cli.getArgList();

    if (union && intersect) {
      err.println("Pass at most one of '-u' and '-i'.");
      return 1;
    }
    if (files.isEmpty() || files.size() > 2) {
      err.println("Expected one or two input files, got " + files.size());
      showHelp(options, err);
      return 1;
    }
    if ((union || intersect) != (files.size() == 2)) {
      err.println("A second file requires '-u' or '-i', and '-u'/'-i' require a second file.");
      return 1;
    }

    try {
      final @Nullable Integer column = cli.hasOption('c') ? parseColumn(cli.getOptionValue('c')) : null;
      final @Nullable Integer groupBy = cli.hasOption('g') ? parseColumn(cli.getOptionValue('g')) : null;
      final @Nullable Integer years = cli.hasOption('y') ? parseColumn(cli.getOptionValue('y')) : null;
      final int removeColumn = column != null ? column : 0;

      Config config = cli.hasOption("config")
              ? loadConfig(Paths.get(cli.getOptionValue("config")), true)
              : loadConfig(CFG_FILE, false);
      if (cli.hasOption("no-header")) {
        config = new Config(config.otherThresholdPercent(), config.maxGroups(), false, config.charset());
      }

      int requiredWidth = 1;
      if (column != null) requiredWidth = Math.max(requiredWidth, column + 1);
      if (groupBy != null) requiredWidth = Math.max(requiredWidth, groupBy + 1);
      if (years != null) requiredWidth = Math.max(requiredWidth, years + 1);
      if (cli.hasOption('r')) requiredWidth = Math.max(requiredWidth, removeColumn + 1);

      ArraySet<Row> rows = CsvRecords.read(Paths.get(files.get(0)), config, requiredWidth);
      if (files.size() == 2) {
        ArraySet<Row> rows2 = CsvRecords.read(Paths.get(files.get(1)), config, requiredWidth);
        rows = (union ? ArraySets.union(rows, rows2) : ArraySets.intersection(rows, rows2)).orElseThrow();
      }

      if (cli.hasOption('r')) {
        int removed = RowTools.removeWhere(rows, removeColumn, cli.getOptionValue('r'));
        err.println("Removed " + removed + " record(s)");
      }

      if (cli.hasOption('m')) {
        rows = RowTools.search(rows, cli.getOptionValue('m')).orElseThrow();
      }

      if (groupBy != null) {
        for (GroupCounts.Group g : GroupCounts.compute(rows, groupBy, config.maxGroups(), config.otherThresholdPercent())) {
          out.println(g);
        }
      }

      if (years != null) {
        YearBuckets.Histogram h = YearBuckets.compute(rows, years, config.maxGroups(), err::println);
        out.println("Records per " + h.interval() + " years:");
        for (YearBuckets.Bucket b : h.buckets()) {
          out.println(b);
        }
      }

      ArraySet<String> result = (column != null ? RowTools.column(rows, column) : RowTools.render(rows)).orElseThrow();
      out.println(result);

      if (cli.hasOption('o')) {
        ArraySets.save(result, Paths.get(cli.getOptionValue('o')), err::println);
      }
    } catch (IOException | MalformedDataException | IllegalArgumentException e) {
      err.println("error: " + e.getMessage());
      return 1;
    }

    return 0;
  }

  private static int parseColumn(String text) {
    int n;
    try {
      n = Integer.parseInt(text);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not a column number: '" + text + '\'', e);
    }
    if (n < 0) {
      throw new IllegalArgumentException("column numbers start at 0, got " + n);
    }
    return n;
  }

  private static class RawConfig {
    public @Nullable Double otherThresholdPercent;
    public @Nullable Integer maxGroups;
    public @Nullable Boolean header;
    public @Nullable String charset;
  }

  /**
   * Read the JSON configuration file.  Absent keys take their {@link Config#DEFAULTS default}.
   *
   * @param target the file
   * @param required whether a missing file is an error (otherwise it means "all defaults")
   */
  static Config loadConfig(Path target, boolean required) throws IOException {
    if (!required && !Files.exists(target)) {
      return Config.DEFAULTS;
    }

    JsonFactory f = new JsonFactory();
    f.enable(JsonParser.Feature.ALLOW_COMMENTS);
    ObjectMapper mapper = new ObjectMapper(f);

    RawConfig r;
    try (InputStream in = Files.newInputStream(target)) {
      r = mapper.readValue(in, RawConfig.class);
    }

    Config d = Config.DEFAULTS;
    double threshold = r.otherThresholdPercent != null ? r.otherThresholdPercent : d.otherThresholdPercent();
    if (!(threshold >= 0 && threshold <= 100)) {
      throw new IllegalArgumentException("Config at " + target + " has \"otherThresholdPercent\" outside [0, 100]: " + threshold);
    }

    int maxGroups = r.maxGroups != null ? r.maxGroups : d.maxGroups();
    if (maxGroups < 1) {
      throw new IllegalArgumentException("Config at " + target + " has \"maxGroups\" below 1: " + maxGroups);
    }

    Charset charset = d.charset();
    if (r.charset != null) {
      try {
        charset = Charset.forName(r.charset);
      } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
        throw new IllegalArgumentException("Config at " + target + " names an unknown charset: " + r.charset, e);
      }
    }

    boolean header = r.header != null ? r.header : d.header();
    return new Config(threshold, maxGroups, header, charset);
  }

}
