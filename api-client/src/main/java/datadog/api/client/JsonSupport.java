package datadog.api.client;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;

/** The {@link Moshi} instance that reads and writes API models. */
public final class JsonSupport {
  private static final Moshi MOSHI =
      new Moshi.Builder()
          .add(new UntypedValueJsonAdapterFactory())
          .add(OffsetDateTime.class, new OffsetDateTimeJsonAdapter())
          .add(new OneOfJsonAdapterFactory())
          .add(new ModelJsonAdapterFactory())
          .build();

  private JsonSupport() {}

  /** Reads and writes values of declared type {@code Object} without losing numeric digits. */
  private static final class UntypedValueJsonAdapterFactory implements JsonAdapter.Factory {
    @Nullable
    @Override
    public JsonAdapter<?> create(Type type, Set<? extends Annotation> annotations, Moshi moshi) {
      if (type != Object.class || !annotations.isEmpty()) {
        return null;
      }
      final JsonAdapter<Object> delegate = moshi.nextAdapter(this, type, annotations);
      return new JsonAdapter<Object>() {
        @Nullable
        @Override
        public Object fromJson(JsonReader reader) throws IOException {
          return readValue(reader);
        }

        @Override
        public void toJson(JsonWriter writer, @Nullable Object value) throws IOException {
          if (value instanceof BigDecimal) {
            writer.value((BigDecimal) value);
          } else {
            delegate.toJson(writer, value);
          }
        }
      };
    }
  }

  public static String toJson(@Nullable Object value) {
    if (value == null) {
      return "null";
    }
    return adapterFor(value).toJson(value);
  }

  @Nullable
  public static Object toJsonValue(@Nullable Object value) {
    if (value == null) {
      return null;
    }
    return adapterFor(value).toJsonValue(value);
  }

  /** Adapter for the runtime type of {@code value}; collections are written element by element. */
  @SuppressWarnings("unchecked")
  private static JsonAdapter<Object> adapterFor(Object value) {
    Class<?> type = value.getClass();
    if (value instanceof List) {
      type = List.class;
    } else if (value instanceof Set) {
      type = Set.class;
    } else if (value instanceof Map) {
      type = Map.class;
    }
    return (JsonAdapter<Object>) MOSHI.adapter(type);
  }

  @Nullable
  public static <T> T fromJson(String json, Type type) throws IOException {
    return MOSHI.<T>adapter(type).fromJson(json);
  }

  /** Whether a decoded value, or anything nested in it, kept its raw JSON. */
  static boolean isUnparsed(@Nullable Object value) {
    if (value instanceof AbstractModel) {
      return ((AbstractModel) value).isUnparsed();
    }
    if (value instanceof AbstractOpenApiSchema) {
      return ((AbstractOpenApiSchema) value).isUnparsed();
    }
    if (value instanceof Collection) {
      for (Object item : (Collection<?>) value) {
        if (isUnparsed(item)) {
          return true;
        }
      }
    } else if (value instanceof Map) {
      for (Object item : ((Map<?, ?>) value).values()) {
        if (isUnparsed(item)) {
          return true;
        }
      }
    }
    return false;
  }

  /**
   * Reads the next value as maps, lists, strings, booleans and numbers. Integral numbers become
   * {@code Long}, or {@code BigDecimal} beyond its range, so no digit is lost.
   */
  @Nullable
  static Object readValue(JsonReader reader) throws IOException {
    switch (reader.peek()) {
      case BEGIN_OBJECT:
        Map<String, Object> object = new LinkedHashMap<>();
        reader.beginObject();
        while (reader.hasNext()) {
          String name = reader.nextName();
          object.put(name, readValue(reader));
        }
        reader.endObject();
        return object;
      case BEGIN_ARRAY:
        List<Object> array = new ArrayList<>();
        reader.beginArray();
        while (reader.hasNext()) {
          array.add(readValue(reader));
        }
        reader.endArray();
        return array;
      case STRING:
        return reader.nextString();
      case NUMBER:
        return parseNumber(reader.nextString());
      case BOOLEAN:
        return reader.nextBoolean();
      case NULL:
        return reader.nextNull();
      default:
        throw new JsonDataException(
            "Expected a value but was " + reader.peek() + " at path " + reader.getPath());
    }
  }

  static Number parseNumber(String literal) {
    if (literal.indexOf('.') < 0 && literal.indexOf('e') < 0 && literal.indexOf('E') < 0) {
      try {
        return Long.parseLong(literal);
      } catch (NumberFormatException e) {
        return new BigDecimal(literal);
      }
    }
    double value = Double.parseDouble(literal);
    return Double.isInfinite(value) ? new BigDecimal(literal) : value;
  }
}
