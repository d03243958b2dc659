package datadog.api.client;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import com.squareup.moshi.Moshi;
import com.squareup.moshi.Types;
import java.io.IOException;
import java.lang.annotation.Annotation;
import java.lang.reflect.Type;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Decodes an {@link AbstractOpenApiSchema} by trying each of its {@link OneOf} schemas. */
final class OneOfJsonAdapterFactory implements JsonAdapter.Factory {
  private static final Logger log = LoggerFactory.getLogger(OneOfJsonAdapterFactory.class);

  @Nullable
  @Override
  public JsonAdapter<?> create(
      Type type, Set<? extends Annotation> annotations, final Moshi moshi) {
    Class<?> rawType = Types.getRawType(type);
    if (!annotations.isEmpty()
        || !AbstractOpenApiSchema.class.isAssignableFrom(rawType)
        || rawType.getAnnotation(OneOf.class) == null) {
      return null;
    }
    final Class<? extends AbstractOpenApiSchema> schemaType =
        rawType.asSubclass(AbstractOpenApiSchema.class);
    final Class<?>[] candidates = schemaType.getAnnotation(OneOf.class).value();

    return new JsonAdapter<Object>() {
      @Nullable
      @Override
      @SuppressWarnings("unchecked")
      public Object fromJson(JsonReader reader) throws IOException {
        if (reader.peek() == JsonReader.Token.NULL) {
          return reader.nextNull();
        }
        Object raw = JsonSupport.readValue(reader);
        Object match = null;
        int matches = 0;
        for (Class<?> candidate : candidates) {
          try {
            Object decoded = moshi.adapter(candidate).fromJsonValue(raw);
            if (decoded != null && !JsonSupport.isUnparsed(decoded)) {
              match = decoded;
              matches++;
            }
          } catch (JsonDataException | IllegalArgumentException e) {
            log.debug("Value is not a {}: {}", candidate.getSimpleName(), e.getMessage());
          }
        }

        AbstractOpenApiSchema schema = newInstance();
        if (matches == 1) {
          schema.setActualInstance(match);
        } else if (raw instanceof Map) {
          log.debug("{} matched {} schemas of {}", raw, matches, schemaType.getSimpleName());
          schema.setUnparsedObject((Map<String, Object>) raw);
        } else {
          throw new JsonDataException(
              "Expected an object for " + schemaType.getSimpleName() + " but was " + raw);
        }
        return schema;
      }

      private AbstractOpenApiSchema newInstance() {
        try {
          return schemaType.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
          throw new IllegalStateException("Cannot instantiate " + schemaType.getName(), e);
        }
      }

      @Override
      @SuppressWarnings("unchecked")
      public void toJson(JsonWriter writer, @Nullable Object value) throws IOException {
        if (value == null) {
          writer.nullValue();
          return;
        }
        AbstractOpenApiSchema schema = (AbstractOpenApiSchema) value;
        if (schema.isUnparsed()) {
          writer.jsonValue(schema.getUnparsedObject());
          return;
        }
        Object actual = schema.getActualInstance();
        if (actual == null) {
          writer.nullValue();
          return;
        }
        JsonAdapter<?> adapter = moshi.adapter(actual.getClass());
        ((JsonAdapter<Object>) adapter).toJson(writer, actual);
      }
    };
  }
}
