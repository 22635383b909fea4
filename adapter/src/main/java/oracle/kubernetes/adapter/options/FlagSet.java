// Copyright (c) 2026, Oracle and/or its affiliates.
// Licensed under the Universal Permissive License v 1.0 as shown at https://oss.oracle.com/licenses/upl.

package oracle.kubernetes.adapter.options;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/**
 * Long command-line flags, each bound to the setter of the option it controls. Parsing a command
 * line invokes the setter of every flag that appears on it, in registration order. Registering a
 * flag name twice replaces the earlier registration.
 */
public class FlagSet {

  private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");

  private final Options options = new Options();
  private final Map<String, FlagBinding> bindings = new LinkedHashMap<>();

  public Options getOptions() {
    return options;
  }

  public boolean hasFlag(String name) {
    return bindings.containsKey(name);
  }

  /**
   * Registers a flag which takes a string value.
   * @param name the flag name, without leading dashes
   * @param defaultValue the value used when the flag is absent, shown in the help text
   * @param usage a description of the flag
   * @param setter receives the value
   */
  public void addStringFlag(String name, String defaultValue, String usage, Consumer<String> setter) {
    addFlag(valueOption(name, "string", usage, quoted(defaultValue)), cli -> setter.accept(cli.getOptionValue(name)));
  }

  /**
   * Registers a flag which takes an integer value.
   * @param name the flag name, without leading dashes
   * @param defaultValue the value used when the flag is absent, shown in the help text
   * @param usage a description of the flag
   * @param setter receives the value
   */
  public void addIntFlag(String name, int defaultValue, String usage, IntConsumer setter) {
    addFlag(valueOption(name, "int", usage, String.valueOf(defaultValue)),
          cli -> setter.accept(parseInt(name, cli.getOptionValue(name))));
  }

  /**
   * Registers a boolean flag. The flag alone means true; an explicit value may follow it, as in
   * {@code --profiling=false}.
   * @param name the flag name, without leading dashes
   * @param defaultValue the value used when the flag is absent, shown in the help text
   * @param usage a description of the flag
   * @param setter receives the value
   */
  public void addBooleanFlag(String name, boolean defaultValue, String usage, Consumer<Boolean> setter) {
    Option option = Option.builder()
          .longOpt(name)
          .hasArg()
          .optionalArg(true)
          .argName("bool")
          .desc(withDefault(usage, String.valueOf(defaultValue)))
          .build();
    addFlag(option, cli -> setter.accept(parseBoolean(name, cli.getOptionValue(name))));
  }

  /**
   * Registers a flag which takes a duration, written as in "10s", "1m30s" or "500ms".
   * @param name the flag name, without leading dashes
   * @param defaultValue the value used when the flag is absent, shown in the help text
   * @param usage a description of the flag
   * @param setter receives the value
   */
  public void addDurationFlag(String name, Duration defaultValue, String usage, Consumer<Duration> setter) {
    addFlag(valueOption(name, "duration", usage, formatDuration(defaultValue)),
          cli -> setter.accept(parseDuration(name, cli.getOptionValue(name))));
  }

  /**
   * Registers a flag which takes a comma-separated list. The flag may be repeated; the values of all
   * occurrences are combined.
   * @param name the flag name, without leading dashes
   * @param defaultValue the value used when the flag is absent, shown in the help text
   * @param usage a description of the flag
   * @param setter receives the value
   */
  public void addStringListFlag(String name, List<String> defaultValue, String usage, Consumer<List<String>> setter) {
    addFlag(valueOption(name, "strings", usage, "[" + String.join(",", defaultValue) + "]"),
          cli -> setter.accept(splitValues(cli.getOptionValues(name))));
  }

  private Option valueOption(String name, String argName, String usage, String defaultText) {
    return Option.builder().longOpt(name).hasArg().argName(argName).desc(withDefault(usage, defaultText)).build();
  }

  private String withDefault(String usage, String defaultText) {
    return defaultText == null ? usage : usage + " (default " + defaultText + ")";
  }

  private String quoted(String value) {
    return value == null || value.isEmpty() ? null : "\"" + value + "\"";
  }

  private void addFlag(Option option, FlagBinding binding) {
    options.addOption(option);
    bindings.put(option.getLongOpt(), binding);
  }

  /**
   * Parses a command line and applies the value of every flag it names.
   * @param args the command-line arguments
   * @return the parsed command line, which holds any positional arguments
   * @throws ParseException if a flag is unknown or has a malformed value
   */
  public CommandLine parse(String... args) throws ParseException {
    CommandLine cli = new DefaultParser().parse(options, args);
    for (Map.Entry<String, FlagBinding> entry : bindings.entrySet()) {
      if (cli.hasOption(entry.getKey())) {
        entry.getValue().apply(cli);
      }
    }
    return cli;
  }

  private static int parseInt(String name, String value) throws ParseException {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw invalidArgument(name, value);
    }
  }

  private static boolean parseBoolean(String name, String value) throws ParseException {
    if (value == null || value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw invalidArgument(name, value);
  }

  private static List<String> splitValues(String[] values) {
    List<String> result = new ArrayList<>();
    if (values != null) {
      Arrays.stream(values)
            .flatMap(v -> Arrays.stream(v.split(",")))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .forEach(result::add);
    }
    return result;
  }

  static Duration parseDuration(String name, String value) throws ParseException {
    if (value == null) {
      throw invalidArgument(name, null);
    }
    String text = value.trim();
    boolean negative = text.startsWith("-");
    if (negative || text.startsWith("+")) {
      text = text.substring(1);
    }
    if (text.equals("0")) {
      return Duration.ZERO;
    }

    Matcher matcher = DURATION_PART.matcher(text);
    Duration result = Duration.ZERO;
    int position = 0;
    try {
      while (position < text.length() && matcher.find(position) && matcher.start() == position) {
        result = result.plus(toDuration(new BigDecimal(matcher.group(1)), matcher.group(2)));
        position = matcher.end();
      }
      // durations must fit in a signed 64-bit count of nanoseconds
      result.toNanos();
    } catch (ArithmeticException e) {
      throw invalidArgument(name, value);
    }
    if (position == 0 || position != text.length()) {
      throw invalidArgument(name, value);
    }
    return negative ? result.negated() : result;
  }

  private static Duration toDuration(BigDecimal amount, String unit) {
    return Duration.ofNanos(amount.multiply(BigDecimal.valueOf(nanosPer(unit)))
          .setScale(0, RoundingMode.DOWN)
          .longValueExact());
  }

  private static long nanosPer(String unit) {
    switch (unit) {
      case "ns":
        return 1L;
      case "us":
      case "µs":
        return 1_000L;
      case "ms":
        return 1_000_000L;
      case "s":
        return 1_000_000_000L;
      case "m":
        return 60_000_000_000L;
      default:
        return 3_600_000_000_000L;
    }
  }

  /**
   * Writes a duration the way it would be given on the command line, e.g. "1m30s".
   * @param duration the duration to format
   * @return the text
   */
  static String formatDuration(Duration duration) {
    if (duration.isZero()) {
      return "0s";
    }
    List<String> parts = new ArrayList<>();
    if (duration.toHours() > 0) {
      parts.add(duration.toHours() + "h");
    }
    if (duration.toMinutesPart() > 0) {
      parts.add(duration.toMinutesPart() + "m");
    }
    if (duration.toSecondsPart() > 0) {
      parts.add(duration.toSecondsPart() + "s");
    }
    if (duration.toMillisPart() > 0) {
      parts.add(duration.toMillisPart() + "ms");
    }
    return parts.isEmpty() ? duration.toNanos() + "ns" : parts.stream().collect(Collectors.joining());
  }

  private static ParseException invalidArgument(String name, String value) {
    return new ParseException("invalid argument \"" + value + "\" for \"--" + name + "\" flag");
  }

  @FunctionalInterface
  private interface FlagBinding {
    void apply(CommandLine cli) throws ParseException;
  }
}
