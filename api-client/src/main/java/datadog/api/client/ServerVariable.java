package datadog.api.client;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** A variable of a server URL template. An empty enum set accepts any value. */
public final class ServerVariable {
  private final String description;
  private final String defaultValue;
  private final Set<String> enumValues;

  public ServerVariable(String description, String defaultValue, Set<String> enumValues) {
    this.description = description;
    this.defaultValue = defaultValue;
    this.enumValues = Collections.unmodifiableSet(new LinkedHashSet<>(enumValues));
  }

  public ServerVariable(String description, String defaultValue) {
    this(description, defaultValue, Collections.<String>emptySet());
  }

  public String getDescription() {
    return description;
  }

  public String getDefaultValue() {
    return defaultValue;
  }

  public Set<String> getEnumValues() {
    return enumValues;
  }

  public boolean accepts(String value) {
    return enumValues.isEmpty() || enumValues.contains(value);
  }
}
