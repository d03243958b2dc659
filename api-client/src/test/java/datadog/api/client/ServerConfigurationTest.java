package datadog.api.client;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ServerConfigurationTest {

  private static ServerConfiguration regional() {
    Map<String, ServerVariable> variables = new LinkedHashMap<>();
    variables.put(
        "site",
        new ServerVariable(
            "The regional site.",
            "datadoghq.com",
            new LinkedHashSet<>(Arrays.asList("datadoghq.com", "datadoghq.eu"))));
    variables.put("subdomain", new ServerVariable("The subdomain.", "api"));
    return new ServerConfiguration("https://{subdomain}.{site}", "regional", variables);
  }

  @Test
  void defaultsFillMissingVariables() {
    assertEquals("https://api.datadoghq.com", regional().url(null));
    assertEquals(
        "https://api.datadoghq.eu",
        regional().url(Collections.singletonMap("site", "datadoghq.eu")));
  }

  @Test
  void unrestrictedVariableAcceptsAnything() {
    Map<String, String> values = new HashMap<>();
    values.put("subdomain", "http-intake.logs");
    assertEquals("https://http-intake.logs.datadoghq.com", regional().url(values));
  }

  @Test
  void restrictedVariableRejectsOtherValues() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> regional().url(Collections.singletonMap("site", "example.com")));
    assertEquals(
        "The variable site in the server URL has invalid value example.com.", e.getMessage());
  }

  @Test
  void selectsServerByIndex() {
    Map<String, ServerVariable> named = new LinkedHashMap<>();
    named.put("name", new ServerVariable("Full site DNS name.", "localhost"));
    named.put("protocol", new ServerVariable("The protocol.", "https"));
    List<ServerConfiguration> servers =
        Arrays.asList(regional(), new ServerConfiguration("{protocol}://{name}", "named", named));

    assertEquals(
        "https://intake.example.com",
        ServerConfiguration.url(
            servers, 1, Collections.singletonMap("name", "intake.example.com")));
    assertThrows(
        IllegalArgumentException.class, () -> ServerConfiguration.url(servers, 2, null));
    assertThrows(
        IllegalArgumentException.class, () -> ServerConfiguration.url(servers, -1, null));
  }
}
