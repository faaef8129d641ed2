package ca.gc.cra.ferry.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and explicit overrides with precedence overrides > YAML > defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param overrides explicit key/value overrides (may be {@code null})
   * @param defaults embedded defaults (may be {@code null})
   * @param warn consumer invoked when an override replaces a YAML value; may be {@code null}
   * @return immutable merged map; {@code null} override values are ignored
   */
  public static Map<String, String> merge(
      Optional<Map<String, String>> yaml,
      Map<String, String> overrides,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (overrides != null) {
      for (Map.Entry<String, String> entry : overrides.entrySet()) {
        String key = entry.getKey();
        String value = entry.getValue();
        if (key == null || value == null) {
          continue;
        }
        if (warn != null && yamlValues.containsKey(key) && !value.equals(yamlValues.get(key))) {
          warn.accept("Override replaces YAML value for key: " + key);
        }
        merged.put(key, value);
      }
    }
    return Map.copyOf(merged);
  }
}
