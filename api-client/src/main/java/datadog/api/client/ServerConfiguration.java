package datadog.api.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** A server URL template, such as {@code https://{subdomain}.{site}}, with its variables. */
public final class ServerConfiguration {
  private final String url;
  private final String description;
  private final Map<String, ServerVariable> variables;

  public ServerConfiguration(
      String url, String description, Map<String, ServerVariable> variables) {
    this.url = url;
    this.description = description;
    this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
  }

  public String getUrl() {
    return url;
  }

  public String getDescription() {
    return description;
  }

  public Map<String, ServerVariable> getVariables() {
    return variables;
  }

  /**
   * Formats the URL, taking values from {@code values} and defaults for the others.
   *
   * @throws IllegalArgumentException if a value is not one of the variable's allowed values.
   */
  public String url(@Nullable Map<String, String> values) {
    String result = url;
    for (Map.Entry<String, ServerVariable> entry : variables.entrySet()) {
      String name = entry.getKey();
      ServerVariable variable = entry.getValue();
      String value = variable.getDefaultValue();
      if (values != null && values.containsKey(name)) {
        value = values.get(name);
        if (!variable.accepts(value)) {
          throw new IllegalArgumentException(
              "The variable " + name + " in the server URL has invalid value " + value + ".");
        }
      }
      result = result.replace("{" + name + "}", value);
    }
    return result;
  }

  /** Selects the server at {@code index} and formats its URL. */
  public static String url(
      List<ServerConfiguration> servers, int index, @Nullable Map<String, String> values) {
    if (index < 0 || index >= servers.size()) {
      throw new IllegalArgumentException(
          "Invalid index "
              + index
              + " when selecting the host settings. Must be less than "
              + servers.size());
    }
    return servers.get(index).url(values);
  }
}
