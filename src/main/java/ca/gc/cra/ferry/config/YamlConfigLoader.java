package ca.gc.cra.ferry.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a transfer YAML file into the flat key/value form consumed by {@link ConfigMerger}.
 *
 * <p>The {@code common} section is applied first, then the command section (for example {@code upload}) on top.
 * Nested mappings become dotted keys, so {@code body: {mode: upsert}} yields {@code body.mode=upsert}. Scalars may
 * reference environment variables as {@code ${NAME}}; a reference to an unset variable is an error. Lists are
 * rejected.</p>
 */
public final class YamlConfigLoader {
  private static final String COMMON_SECTION = "common";
  private static final Pattern ENV_REFERENCE = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");

  private YamlConfigLoader() {}

  /**
   * Loads {@code path}, resolving {@code ${NAME}} references from the process environment.
   *
   * @param path YAML file
   * @param section command section applied over {@code common}
   * @return flat settings, or empty when the file does not exist
   * @throws IOException when the file exists but cannot be read
   * @throws IllegalArgumentException when the document is malformed or references an unset variable
   */
  public static Optional<Map<String, String>> load(Path path, String section) throws IOException {
    return load(path, section, System::getenv);
  }

  static Optional<Map<String, String>> load(Path path, String section, UnaryOperator<String> environment)
      throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(section, "section");
    if (Files.notExists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, section, path.toString(), environment));
    }
  }

  static Map<String, String> parse(Reader reader, String section, String source, UnaryOperator<String> environment) {
    Object document;
    try {
      document = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return Map.of();
    }
    if (!(document instanceof Map<?, ?> root)) {
      throw new IllegalArgumentException(source + ": top level must be a mapping of sections");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    String wanted = section.trim().toLowerCase(Locale.ROOT);
    for (String name : new String[] {COMMON_SECTION, wanted}) {
      Object body = sectionNamed(root, name);
      if (body == null) {
        continue;
      }
      if (!(body instanceof Map<?, ?> mapping)) {
        throw new IllegalArgumentException(source + ": section '" + name + "' must be a mapping");
      }
      collect(mapping, null, settings, environment);
    }
    return Map.copyOf(settings);
  }

  private static Object sectionNamed(Map<?, ?> root, String name) {
    for (Map.Entry<?, ?> entry : root.entrySet()) {
      if (entry.getKey() instanceof String key && key.trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void collect(
      Map<?, ?> mapping, String prefix, Map<String, String> into, UnaryOperator<String> environment) {
    for (Map.Entry<?, ?> entry : mapping.entrySet()) {
      if (!(entry.getKey() instanceof String name) || name.isBlank()) {
        throw new IllegalArgumentException("YAML keys must be non-blank strings (found '" + entry.getKey()
            + "' under " + (prefix == null ? "section root" : prefix) + ")");
      }
      String key = prefix == null ? name : prefix + '.' + name;
      Object value = entry.getValue();
      if (value instanceof Map<?, ?> nested) {
        collect(nested, key, into, environment);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML lists are not supported (key " + key + ")");
      } else {
        into.put(key, value == null ? "" : resolve(key, value.toString(), environment));
      }
    }
  }

  private static String resolve(String key, String raw, UnaryOperator<String> environment) {
    Matcher matcher = ENV_REFERENCE.matcher(raw);
    StringBuilder resolved = new StringBuilder();
    while (matcher.find()) {
      String variable = matcher.group(1);
      String value = environment.apply(variable);
      if (value == null) {
        throw new IllegalArgumentException(
            "Environment variable " + variable + " referenced by " + key + " is not set");
      }
      matcher.appendReplacement(resolved, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(resolved);
    return resolved.toString();
  }
}
