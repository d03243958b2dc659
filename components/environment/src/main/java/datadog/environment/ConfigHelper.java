package datadog.environment;

import java.util.Locale;
import javax.annotation.Nullable;

/**
 * Resolves a setting from a system property first, then from an environment variable. Blank values
 * count as missing.
 */
public final class ConfigHelper {
  private ConfigHelper() {}

  /**
   * Derives the environment variable name for a dotted property: {@code dd.api.key} becomes {@code
   * DD_API_KEY}.
   */
  public static String toEnvironmentVariableName(String property) {
    return property.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  public static @Nullable String lookup(String property) {
    return lookup(property, toEnvironmentVariableName(property));
  }

  public static @Nullable String lookup(String property, String environmentVariable) {
    String value = property(property, null);
    if (isBlank(value)) {
      value = EnvironmentVariables.get(environmentVariable);
    }
    return isBlank(value) ? null : value.trim();
  }

  /** Reads a system property, falling back to {@code defaultValue} when it is unset or denied. */
  public static String property(String name, String defaultValue) {
    try {
      return System.getProperty(name, defaultValue);
    } catch (SecurityException e) {
      return defaultValue;
    }
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.trim().isEmpty();
  }
}
