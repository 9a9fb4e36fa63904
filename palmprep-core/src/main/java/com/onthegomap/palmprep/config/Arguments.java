package com.onthegomap.palmprep.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key/value options for a pipeline run, read from the command line, JVM properties, environmental variables or a
 * properties file.
 * <p>
 * Keys are matched ignoring case and treating {@code -}, {@code .} and {@code _} alike, so {@code --tmp-dir},
 * {@code tmp_dir} and {@code PALMPREP_TMP_DIR} name the same option. A key of the form {@code "new_name|old_name"}
 * reads {@code new_name} first and falls back to the deprecated {@code old_name} with a warning.
 */
public class Arguments {

  private static final Logger LOGGER = LoggerFactory.getLogger(Arguments.class);

  /** Looks up a canonical key, returns null when absent. */
  private final UnaryOperator<String> lookup;

  private Arguments(UnaryOperator<String> lookup) {
    this.lookup = lookup;
  }

  /** Options passed as {@code -Dpalmprep.key=value}. */
  public static Arguments fromJvmProperties() {
    return fromJvmProperties(System::getProperty);
  }

  static Arguments fromJvmProperties(UnaryOperator<String> getter) {
    return prefixed(getter, "palmprep", '.', false);
  }

  /** Options passed as {@code PALMPREP_KEY=value} environmental variables. */
  public static Arguments fromEnvironment() {
    return fromEnvironment(System::getenv);
  }

  static Arguments fromEnvironment(UnaryOperator<String> getter) {
    return prefixed(getter, "PALMPREP", '_', true);
  }

  public static Arguments from(Properties properties) {
    return new Arguments(properties::getProperty);
  }

  /**
   * Parses {@code key=value}, {@code --key value} and bare {@code --flag} (meaning {@code flag=true}) command-line
   * arguments.
   */
  public static Arguments fromArgs(String... args) {
    Map<String, String> parsed = new LinkedHashMap<>();
    int i = 0;
    while (i < args.length) {
      String arg = args[i++].strip();
      int eq = arg.indexOf('=');
      if (eq >= 0) {
        parsed.put(stripDashes(arg.substring(0, eq)), arg.substring(eq + 1));
      } else if (arg.startsWith("-") && i < args.length && !args[i].strip().startsWith("-")) {
        parsed.put(stripDashes(arg), args[i++].strip());
      } else {
        parsed.put(stripDashes(arg), "true");
      }
    }
    return of(parsed);
  }

  /** Reads options from a {@code .properties} file. */
  public static Arguments fromConfigFile(Path path) {
    Properties properties = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      properties.load(reader);
    } catch (IOException e) {
      throw new IllegalArgumentException("Unable to load config file: " + path, e);
    }
    return from(properties);
  }

  /**
   * Combines every source, earlier ones winning: command line, JVM properties, environment, then the properties file
   * named by the {@code config} option if any of those set it.
   */
  public static Arguments fromArgsOrConfigFile(String... args) {
    Arguments direct = fromArgs(args).orElse(fromJvmProperties()).orElse(fromEnvironment());
    Path configFile = direct.file("config", "path to config file", null);
    return configFile == null ? direct : direct.orElse(fromConfigFile(configFile));
  }

  public static Arguments of(Map<String, String> map) {
    Map<String, String> canonical = new LinkedHashMap<>();
    map.forEach((key, value) -> canonical.put(canonical(key), value));
    return new Arguments(canonical::get);
  }

  /** Builds arguments from alternating keys and values. */
  public static Arguments of(Object... keysAndValues) {
    Map<String, String> map = new TreeMap<>();
    for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
      map.put(keysAndValues[i].toString(), keysAndValues[i + 1].toString());
    }
    return of(map);
  }

  private static String stripDashes(String key) {
    return key.replaceFirst("^[\\s-]+", "");
  }

  private static String canonical(String key) {
    return key.strip().replaceAll("[.-]", "_").toLowerCase(Locale.ROOT);
  }

  private static Arguments prefixed(UnaryOperator<String> getter, String prefix, char separator, boolean upperCase) {
    return new Arguments(key -> {
      String name = (prefix + separator + key).replaceAll("[._-]", String.valueOf(separator));
      return getter.apply(upperCase ? name.toUpperCase(Locale.ROOT) : name.toLowerCase(Locale.ROOT));
    });
  }

  private String lookup(String key) {
    String[] names = key.split("\\|");
    for (int i = 0; i < names.length; i++) {
      String value = lookup.apply(canonical(names[i]));
      if (value != null) {
        if (i > 0) {
          LOGGER.warn("Argument '{}' is deprecated, use '{}'", names[i].strip(), names[0].strip());
        }
        return value;
      }
    }
    return null;
  }

  /** Returns arguments that read from {@code this} first and then from {@code fallback}. */
  public Arguments orElse(Arguments fallback) {
    return new Arguments(key -> {
      String value = lookup(key);
      return value != null ? value : fallback.lookup(key);
    });
  }

  private <T> T value(String key, String description, Function<String, T> parser, T defaultValue) {
    String raw = lookup(key);
    T result = raw == null ? defaultValue : parser.apply(raw.strip());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug("argument: {}={} ({})", key.replaceFirst("\\|.*$", ""), result, description);
    }
    return result;
  }

  public String getString(String key, String description, String defaultValue) {
    return value(key, description, Function.identity(), defaultValue);
  }

  public Path file(String key, String description, Path defaultValue) {
    return value(key, description, Path::of, defaultValue);
  }

  /** Only {@code "true"} (any case) is true. */
  public boolean getBoolean(String key, String description, boolean defaultValue) {
    return value(key, description, "true"::equalsIgnoreCase, defaultValue);
  }

  /** Comma-separated values, blanks dropped. */
  public List<String> getList(String key, String description, List<String> defaultValue) {
    return value(key, description, Arguments::splitList, defaultValue);
  }

  /**
   * Returns an ordered map parsed from {@code name=path,name=path}.
   *
   * @throws IllegalArgumentException if an entry is not a {@code name=path} pair
   */
  public Map<String, Path> getNamedPaths(String key, String description) {
    Map<String, Path> result = new LinkedHashMap<>();
    for (String entry : getList(key, description, List.of())) {
      String[] kv = entry.split("=", 2);
      if (kv.length != 2 || kv[0].isBlank() || kv[1].isBlank()) {
        throw new IllegalArgumentException("Bad " + key + " entry '" + entry + "' expected name=path");
      }
      result.put(kv[0].strip(), Path.of(kv[1].strip()));
    }
    return result;
  }

  /** @throws NumberFormatException if the value is not an integer */
  public int getInteger(String key, String description, int defaultValue) {
    return value(key, description, Integer::parseInt, defaultValue);
  }

  /** @throws NumberFormatException if the value is not a number */
  public double getDouble(String key, String description, double defaultValue) {
    return value(key, description, Double::parseDouble, defaultValue);
  }

  /**
   * Returns a duration written like {@code 10s}, {@code 90m} or {@code 1h30m}.
   *
   * @throws DateTimeParseException if the value or the default is not a duration
   */
  public Duration getDuration(String key, String description, String defaultValue) {
    return value(key, description, Arguments::parseDuration, parseDuration(defaultValue));
  }

  private static Duration parseDuration(String text) {
    return Duration.parse("PT" + text.strip());
  }

  private static List<String> splitList(String text) {
    return Stream.of(text.split(",")).map(String::strip).filter(item -> !item.isEmpty()).toList();
  }
}
