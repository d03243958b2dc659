package datadog.environment;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EnvironmentVariablesTest {
  private static final String EXISTING_ENV_VAR = "DD_SITE";
  private static final String MISSING_ENV_VAR = "UNDEFINED_ENV_VAR";

  private final Map<String, String> env = new HashMap<>();

  @AfterEach
  void restore() {
    EnvironmentVariables.setProvider(null);
  }

  @Test
  void testGet() {
    env.put(EXISTING_ENV_VAR, "datadoghq.eu");
    EnvironmentVariables.setProvider(env::get);

    assertEquals("datadoghq.eu", EnvironmentVariables.get(EXISTING_ENV_VAR));
    assertNull(EnvironmentVariables.get(MISSING_ENV_VAR));
    assertNull(EnvironmentVariables.get(null));
  }

  @Test
  void testGetOrDefault() {
    env.put(EXISTING_ENV_VAR, "datadoghq.eu");
    EnvironmentVariables.setProvider(env::get);

    assertEquals("datadoghq.eu", EnvironmentVariables.getOrDefault(EXISTING_ENV_VAR, null));
    assertEquals("", EnvironmentVariables.getOrDefault(MISSING_ENV_VAR, ""));
    assertNull(EnvironmentVariables.getOrDefault(MISSING_ENV_VAR, null));
    assertEquals("", EnvironmentVariables.getOrDefault(null, ""));
  }

  @Test
  void testSecurityExceptionFallsBackToDefault() {
    EnvironmentVariables.setProvider(
        name -> {
          throw new SecurityException("denied");
        });

    assertEquals("fallback", EnvironmentVariables.getOrDefault(EXISTING_ENV_VAR, "fallback"));
    assertNull(EnvironmentVariables.get(EXISTING_ENV_VAR));
  }

  @Test
  void testProcessEnvironmentIsRestored() {
    EnvironmentVariables.setProvider(name -> "fake");
    EnvironmentVariables.setProvider(null);

    assertNull(EnvironmentVariables.get(MISSING_ENV_VAR));
  }
}
