package datadog.api.client;

import static org.junit.jupiter.api.Assertions.*;

import datadog.communication.http.HttpRetryPolicy;
import datadog.environment.EnvironmentVariables;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConfigurationTest {

  private final Map<String, String> env = new HashMap<>();

  @BeforeEach
  void setup() {
    EnvironmentVariables.setProvider(env::get);
  }

  @AfterEach
  void cleanup() {
    EnvironmentVariables.setProvider(null);
    System.clearProperty(Configuration.SITE_PROPERTY);
    System.clearProperty(Configuration.API_KEY_PROPERTY);
    System.clearProperty(Configuration.APP_KEY_PROPERTY);
  }

  @Test
  void defaults() {
    Configuration configuration = new Configuration();

    assertEquals("https://api.datadoghq.com", configuration.getServerUrl("v2.listLogs"));
    assertEquals(
        "https://http-intake.logs.datadoghq.com", configuration.getServerUrl("v2.submitLog"));
    assertTrue(configuration.isCompress());
    assertFalse(configuration.isDebug());
    assertFalse(configuration.isRetryEnabled());
    assertEquals(Configuration.DEFAULT_MAX_RETRIES, configuration.getMaxRetries());
    assertEquals(Configuration.DEFAULT_TIMEOUT_MILLIS, configuration.getTimeoutMillis());
    assertTrue(configuration.getUserAgent().startsWith("datadog-api-client-java/"));
    assertNull(configuration.getApiKey(Configuration.API_KEY_AUTH));
  }

  @Test
  void fromEnvironment() {
    env.put("DD_SITE", "datadoghq.eu");
    env.put("DD_API_KEY", "env-api-key");
    env.put("DD_APP_KEY", "env-app-key");
    System.setProperty(Configuration.APP_KEY_PROPERTY, "property-app-key");

    Configuration configuration = Configuration.fromEnvironment();

    assertEquals("https://api.datadoghq.eu", configuration.getServerUrl("v2.listLogs"));
    assertEquals(
        "https://http-intake.logs.datadoghq.eu", configuration.getServerUrl("v2.submitLog"));
    assertEquals("env-api-key", configuration.getApiKey(Configuration.API_KEY_AUTH));
    assertEquals("property-app-key", configuration.getApiKey(Configuration.APP_KEY_AUTH));
  }

  @Test
  void unknownSiteIsRejected() {
    Configuration configuration = new Configuration().setServerVariable("site", "example.com");

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> configuration.getServerUrl("v2.listLogs"));
    assertEquals(
        "The variable site in the server URL has invalid value example.com.", e.getMessage());

    configuration.setServerIndex(2);
    assertEquals("https://api.example.com", configuration.getServerUrl("v2.listLogs"));
  }

  @Test
  void namedServer() {
    Map<String, String> variables = new HashMap<>();
    variables.put("protocol", "http");
    variables.put("name", "localhost:8080");
    Configuration configuration = new Configuration().setServerIndex(1);
    configuration.setServerVariables(variables);

    assertEquals("http://localhost:8080", configuration.getServerUrl("v2.listLogs"));
    assertEquals("http://localhost:8080", configuration.getServerUrl("v2.submitLog"));
  }

  @Test
  void operationServerOverrides() {
    Configuration configuration =
        new Configuration()
            .setOperationServerIndex("v2.submitLog", 1)
            .setOperationServerVariables(
                "v2.submitLog", Collections.singletonMap("name", "intake.example.com"));

    assertEquals("https://intake.example.com", configuration.getServerUrl("v2.submitLog"));
    assertEquals("https://api.datadoghq.com", configuration.getServerUrl("v2.listLogs"));
    assertEquals(3, configuration.getOperationServers("v2.submitLog").size());
    assertTrue(configuration.getOperationServers("v2.listLogs").isEmpty());
  }

  @Test
  void invalidServerIndex() {
    Configuration configuration = new Configuration().setServerIndex(3);

    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> configuration.getServerUrl("v2.listLogs"));
    assertEquals(
        "Invalid index 3 when selecting the host settings. Must be less than 3", e.getMessage());
  }

  @Test
  void unstableOperations() {
    Configuration configuration = new Configuration();

    assertTrue(configuration.isUnstableOperation("v2.listIncidents"));
    assertFalse(configuration.isUnstableOperationEnabled("v2.listIncidents"));
    assertTrue(configuration.setUnstableOperationEnabled("v2.listIncidents", true));
    assertTrue(configuration.isUnstableOperationEnabled("v2.listIncidents"));

    assertFalse(configuration.isUnstableOperation("v2.listLogs"));
    assertFalse(configuration.setUnstableOperationEnabled("v2.listLogs", true));
    assertFalse(configuration.isUnstableOperationEnabled("v2.listLogs"));
  }

  @Test
  void apiKeys() {
    Map<String, String> keys = new HashMap<>();
    keys.put(Configuration.API_KEY_AUTH, "api");
    keys.put(Configuration.APP_KEY_AUTH, "app");
    Configuration configuration = new Configuration().configureApiKeys(keys);

    assertEquals("api", configuration.getApiKey(Configuration.API_KEY_AUTH));
    assertEquals("app", configuration.getApiKey(Configuration.APP_KEY_AUTH));
    assertEquals("DD-API-KEY", Configuration.authHeader(Configuration.API_KEY_AUTH));
    assertEquals("DD-APPLICATION-KEY", Configuration.authHeader(Configuration.APP_KEY_AUTH));
    assertNull(Configuration.authHeader("basicAuth"));

    configuration.setApiKey(Configuration.APP_KEY_AUTH, null);
    assertNull(configuration.getApiKey(Configuration.APP_KEY_AUTH));
  }

  @Test
  void retrySettingsAreValidated() {
    Configuration configuration = new Configuration();

    assertThrows(IllegalArgumentException.class, () -> configuration.setMaxRetries(-1));
    assertThrows(IllegalArgumentException.class, () -> configuration.setBackOffBase(1));
    assertThrows(IllegalArgumentException.class, () -> configuration.setBackOffMultiplier(0.5));
    assertThrows(IllegalArgumentException.class, () -> configuration.setTimeoutMillis(0));
  }

  @Test
  void retryPolicyFollowsRetryEnabled() {
    Configuration configuration = new Configuration();
    assertSame(HttpRetryPolicy.Factory.NEVER_RETRY, configuration.retryPolicyFactory());

    configuration.setRetryEnabled(true).setMaxRetries(5);
    HttpRetryPolicy.Factory factory = configuration.retryPolicyFactory();
    assertNotSame(HttpRetryPolicy.Factory.NEVER_RETRY, factory);
    assertEquals(5, factory.getMaxRetries());
  }
}
