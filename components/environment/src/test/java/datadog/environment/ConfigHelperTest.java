package datadog.environment;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigHelperTest {
  private static final String PROPERTY = "dd.test.helper.key";

  private final Map<String, String> env = new HashMap<>();

  @BeforeEach
  void setup() {
    EnvironmentVariables.setProvider(env::get);
  }

  @AfterEach
  void cleanup() {
    EnvironmentVariables.setProvider(null);
    System.clearProperty(PROPERTY);
  }

  @Test
  void environmentVariableName() {
    assertEquals("DD_API_KEY", ConfigHelper.toEnvironmentVariableName("dd.api.key"));
    assertEquals("DD_SITE", ConfigHelper.toEnvironmentVariableName("dd.site"));
    assertEquals("DD_HTTP_TIMEOUT", ConfigHelper.toEnvironmentVariableName("dd.http-timeout"));
  }

  @Test
  void systemPropertyWinsOverEnvironment() {
    env.put("DD_TEST_HELPER_KEY", "from-env");
    assertEquals("from-env", ConfigHelper.lookup(PROPERTY));

    System.setProperty(PROPERTY, "from-property");
    assertEquals("from-property", ConfigHelper.lookup(PROPERTY));
  }

  @Test
  void blankValuesAreMissing() {
    env.put("DD_TEST_HELPER_KEY", "   ");
    System.setProperty(PROPERTY, "");

    assertNull(ConfigHelper.lookup(PROPERTY));
  }

  @Test
  void propertyDefaultsWhenUnset() {
    assertEquals("fallback", ConfigHelper.property(PROPERTY, "fallback"));
    assertNull(ConfigHelper.property(PROPERTY, null));

    System.setProperty(PROPERTY, "set");
    assertEquals("set", ConfigHelper.property(PROPERTY, "fallback"));
    assertNotNull(ConfigHelper.property("java.version", null));
  }
}
