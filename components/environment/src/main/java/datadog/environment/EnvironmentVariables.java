package datadog.environment;

import javax.annotation.Nullable;

/**
 * Safely queries environment variables against security manager.
 *
 * <p>The lookup goes through a replaceable {@link Provider} so tests can simulate an environment
 * without touching the real process one.
 */
public final class EnvironmentVariables {
  private EnvironmentVariables() {}

  @FunctionalInterface
  public interface Provider {
    @Nullable
    String get(String name);
  }

  private static final Provider SYSTEM = System::getenv;

  private static volatile Provider provider = SYSTEM;

  /**
   * Replaces the environment lookup.
   *
   * @param replacement the lookup to use, {@code null} restores the process environment.
   */
  public static void setProvider(@Nullable Provider replacement) {
    provider = replacement == null ? SYSTEM : replacement;
  }

  /**
   * Gets an environment variable value.
   *
   * @param name The environment variable name.
   * @return The environment variable value, {@code null} if missing, can't be retrieved, or the
   *     environment variable name is {@code null}.
   */
  public static @Nullable String get(String name) {
    return getOrDefault(name, null);
  }

  /**
   * Gets an environment variable value, or default value if missing or can't be retrieved.
   *
   * @param name The environment variable name.
   * @param defaultValue The default value to return if the environment variable is missing or can't
   *     be retrieved.
   * @return The environment variable value, {@code defaultValue} if missing, can't be retrieved or
   *     the environment variable name is {@code null}.
   */
  public static String getOrDefault(String name, String defaultValue) {
    if (name == null) {
      return defaultValue;
    }
    try {
      String value = provider.get(name);
      return value == null ? defaultValue : value;
    } catch (SecurityException e) {
      return defaultValue;
    }
  }
}
