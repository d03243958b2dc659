package datadog.api.client;

import com.squareup.moshi.Json;
import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps Moshi's reflective adapter of every {@link AbstractModel} to check required properties,
 * collect undeclared properties and fall back to the raw object when binding fails.
 */
final class ModelJsonAdapterFactory implements JsonAdapter.Factory {

  @Nullable
  @Override
  public JsonAdapter<?> create(Type type, Set<? extends Annotation> annotations, Moshi moshi) {
    if (!annotations.isEmpty()) {
      return null;
    }
    Class<?> rawType = Types.getRawType(type);
    if (!AbstractModel.class.isAssignableFrom(rawType)
        || Modifier.isAbstract(rawType.getModifiers())) {
      return null;
    }
    JsonAdapter<Object> delegate = moshi.nextAdapter(this, type, annotations);
    return new ModelJsonAdapter(rawType, delegate);
  }

  private static final class Property {
    final String name;
    final Field field;
    final boolean required;

    Property(String name, Field field, boolean required) {
      this.name = name;
      this.field = field;
      this.required = required;
    }
  }

  static final class ModelJsonAdapter extends JsonAdapter<Object> {
    private static final Logger log = LoggerFactory.getLogger(ModelJsonAdapter.class);

    /** Number of models being decoded on this thread, the outermost one counting as 1. */
    private static final ThreadLocal<int[]> DEPTH =
        new ThreadLocal<int[]>() {
          @Override
          protected int[] initialValue() {
            return new int[1];
          }
        };

    private final Class<?> rawType;
    private final JsonAdapter<Object> delegate;
    private final List<Property> properties;
    private final Set<String> names;

    ModelJsonAdapter(Class<?> rawType, JsonAdapter<Object> delegate) {
      this.rawType = rawType;
      this.delegate = delegate;
      this.properties = propertiesOf(rawType);
      this.names = new LinkedHashSet<>();
      for (Property property : properties) {
        names.add(property.name);
      }
    }

    private static List<Property> propertiesOf(Class<?> rawType) {
      List<Property> properties = new ArrayList<>();
      for (Class<?> c = rawType; c != AbstractModel.class; c = c.getSuperclass()) {
        for (Field field : c.getDeclaredFields()) {
          int modifiers = field.getModifiers();
          if (Modifier.isStatic(modifiers) || Modifier.isTransient(modifiers)) {
            continue;
          }
          field.setAccessible(true);
          Json json = field.getAnnotation(Json.class);
          String name = json != null ? json.name() : field.getName();
          properties.add(
              new Property(name, field, field.isAnnotationPresent(RequiredProperty.class)));
        }
      }
      return properties;
    }

    /**
     * A missing required property fails the outermost model only. Nested models missing one keep
     * their raw JSON, which marks their parents unparsed.
     */
    @Nullable
    @Override
    public Object fromJson(JsonReader reader) throws IOException {
      if (reader.peek() == JsonReader.Token.NULL) {
        return reader.nextNull();
      }
      int[] depth = DEPTH.get();
      depth[0]++;
      try {
        return decode(reader, depth[0] == 1);
      } finally {
        depth[0]--;
      }
    }

    @SuppressWarnings("unchecked")
    private Object decode(JsonReader reader, boolean outermost) throws IOException {
      String path = reader.getPath();
      Object json = JsonSupport.readValue(reader);
      if (!(json instanceof Map)) {
        throw new JsonDataException(
            "Expected an object for " + rawType.getSimpleName() + " at path " + path);
      }
      Map<String, Object> raw = (Map<String, Object>) json;
      for (Property property : properties) {
        if (property.required && raw.get(property.name) == null) {
          if (outermost) {
            throw new JsonDataException("required field " + property.name + " missing");
          }
          log.debug(
              "Keeping raw {} at path {}: required field {} missing",
              rawType.getSimpleName(),
              path,
              property.name);
          return unparsed(raw);
        }
      }

      Map<String, Object> known = new LinkedHashMap<>();
      Map<String, Object> additional = new LinkedHashMap<>();
      for (Map.Entry<String, Object> entry : raw.entrySet()) {
        (names.contains(entry.getKey()) ? known : additional).put(entry.getKey(), entry.getValue());
      }

      AbstractModel model;
      try {
        model = (AbstractModel) delegate.fromJsonValue(known);
      } catch (JsonDataException | IllegalArgumentException e) {
        log.debug(
            "Keeping raw {} at path {}: {}", rawType.getSimpleName(), path, e.getMessage());
        return unparsed(raw);
      }
      clearAbsentProperties(model, known);
      if (!additional.isEmpty()) {
        model.additionalProperties = additional;
      }
      if (hasUnparsedProperty(model)) {
        model.unparsedObject = raw;
      }
      return model;
    }

    private AbstractModel unparsed(Map<String, Object> raw) throws IOException {
      AbstractModel model =
          (AbstractModel) delegate.fromJsonValue(Collections.<String, Object>emptyMap());
      clearAbsentProperties(model, Collections.<String, Object>emptyMap());
      model.unparsedObject = raw;
      return model;
    }

    /** Drops the defaults set by the constructor for properties the payload did not carry. */
    private void clearAbsentProperties(AbstractModel model, Map<String, Object> present) {
      for (Property property : properties) {
        if (present.get(property.name) != null || property.field.getType().isPrimitive()) {
          continue;
        }
        try {
          property.field.set(model, null);
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Cannot write " + property.field, e);
        }
      }
    }

    private boolean hasUnparsedProperty(AbstractModel model) {
      for (Property property : properties) {
        try {
          if (JsonSupport.isUnparsed(property.field.get(model))) {
            return true;
          }
        } catch (IllegalAccessException e) {
          throw new IllegalStateException("Cannot read " + property.field, e);
        }
      }
      return false;
    }

    @Override
    @SuppressWarnings("unchecked")
    public void toJson(JsonWriter writer, @Nullable Object value) throws IOException {
      if (value == null) {
        writer.nullValue();
        return;
      }
      AbstractModel model = (AbstractModel) value;
      if (model.unparsedObject != null) {
        writer.jsonValue(model.unparsedObject);
        return;
      }
      Object json = delegate.toJsonValue(value);
      if (model.additionalProperties != null && !model.additionalProperties.isEmpty()) {
        Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) json);
        merged.putAll(model.additionalProperties);
        json = merged;
      }
      writer.jsonValue(json);
    }

    @Override
    public String toString() {
      return "ModelJsonAdapter(" + rawType.getSimpleName() + ")";
    }
  }
}
