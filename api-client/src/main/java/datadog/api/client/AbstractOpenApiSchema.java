package datadog.api.client;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Base class of a value that matches exactly one of the schemas listed by the {@link OneOf}
 * annotation of the subclass. When the JSON matches none or several of them, the raw object is
 * kept in {@link #getUnparsedObject()}.
 */
public abstract class AbstractOpenApiSchema {
  @Nullable private Object actualInstance;
  @Nullable private Map<String, Object> unparsedObject;

  public List<Class<?>> getSchemas() {
    OneOf oneOf = getClass().getAnnotation(OneOf.class);
    if (oneOf == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(Arrays.<Class<?>>asList(oneOf.value()));
  }

  @Nullable
  public Object getActualInstance() {
    return actualInstance;
  }

  /**
   * @throws IllegalArgumentException if {@code instance} is not one of the listed schemas.
   */
  public void setActualInstance(Object instance) {
    for (Class<?> schema : getSchemas()) {
      if (schema.isInstance(instance)) {
        this.actualInstance = instance;
        this.unparsedObject = null;
        return;
      }
    }
    throw new IllegalArgumentException("Invalid instance type. Must be one of " + schemaNames());
  }

  void setUnparsedObject(Map<String, Object> unparsedObject) {
    this.actualInstance = null;
    this.unparsedObject = unparsedObject;
  }

  public boolean isUnparsed() {
    return unparsedObject != null;
  }

  @Nullable
  public Map<String, Object> getUnparsedObject() {
    return unparsedObject == null ? null : Collections.unmodifiableMap(unparsedObject);
  }

  @SuppressWarnings("unchecked")
  protected <T> T getActualInstance(Class<T> schema) {
    if (!schema.isInstance(actualInstance)) {
      throw new ClassCastException(
          "Actual instance is "
              + (actualInstance == null ? "null" : actualInstance.getClass().getSimpleName())
              + ", not "
              + schema.getSimpleName());
    }
    return (T) actualInstance;
  }

  private String schemaNames() {
    StringBuilder names = new StringBuilder();
    for (Class<?> schema : getSchemas()) {
      if (names.length() > 0) {
        names.append(", ");
      }
      names.append(schema.getSimpleName());
    }
    return names.toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AbstractOpenApiSchema that = (AbstractOpenApiSchema) o;
    return Objects.equals(actualInstance, that.actualInstance)
        && Objects.equals(unparsedObject, that.unparsedObject);
  }

  @Override
  public int hashCode() {
    return Objects.hash(actualInstance, unparsedObject);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + JsonSupport.toJson(this);
  }
}
