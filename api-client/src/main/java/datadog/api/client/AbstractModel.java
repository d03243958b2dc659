package datadog.api.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Base class of every API model.
 *
 * <p>Properties the model does not declare are kept in {@link #getAdditionalProperties()} and
 * written back when the model is serialized. When the JSON could not be bound to the declared
 * fields, for example because of an enum value this client does not know yet, the raw object is
 * kept in {@link #getUnparsedObject()} and serialized verbatim.
 *
 * <p>Equality and {@link #toString()} are based on the JSON form of the model.
 */
public abstract class AbstractModel {
  @Nullable transient Map<String, Object> additionalProperties;
  @Nullable transient Map<String, Object> unparsedObject;

  /** Sets a property this model does not declare. It overrides a declared one with that name. */
  public void putAdditionalProperty(String key, @Nullable Object value) {
    if (additionalProperties == null) {
      additionalProperties = new LinkedHashMap<>();
    }
    additionalProperties.put(key, value);
  }

  public Map<String, Object> getAdditionalProperties() {
    return additionalProperties == null
        ? Collections.<String, Object>emptyMap()
        : Collections.unmodifiableMap(additionalProperties);
  }

  @Nullable
  public Object getAdditionalProperty(String key) {
    return additionalProperties == null ? null : additionalProperties.get(key);
  }

  /** Whether this model, or one it contains, could not be bound to its declared fields. */
  public boolean isUnparsed() {
    return unparsedObject != null;
  }

  @Nullable
  public Map<String, Object> getUnparsedObject() {
    return unparsedObject == null ? null : Collections.unmodifiableMap(unparsedObject);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return Objects.equals(JsonSupport.toJsonValue(this), JsonSupport.toJsonValue(o));
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(JsonSupport.toJsonValue(this));
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + JsonSupport.toJson(this);
  }
}
