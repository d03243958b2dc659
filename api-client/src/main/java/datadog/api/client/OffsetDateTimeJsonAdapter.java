package datadog.api.client;

import com.squareup.moshi.JsonAdapter;
import com.squareup.moshi.JsonDataException;
import com.squareup.moshi.JsonReader;
import com.squareup.moshi.JsonWriter;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import javax.annotation.Nullable;

/** RFC3339 timestamps. Milliseconds are written only when the value has a sub-second part. */
public class OffsetDateTimeJsonAdapter extends JsonAdapter<OffsetDateTime> {
  private static final DateTimeFormatter SECONDS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssXXX");
  private static final DateTimeFormatter MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSXXX");

  public static String format(OffsetDateTime value) {
    return (value.getNano() == 0 ? SECONDS : MILLIS).format(value);
  }

  @Nullable
  @Override
  public OffsetDateTime fromJson(JsonReader reader) throws IOException {
    if (reader.peek() == JsonReader.Token.NULL) {
      return reader.nextNull();
    }
    String s = reader.nextString();
    try {
      return OffsetDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new JsonDataException("Invalid date-time '" + s + "' at path " + reader.getPath(), e);
    }
  }

  @Override
  public void toJson(JsonWriter writer, @Nullable OffsetDateTime value) throws IOException {
    if (value == null) {
      writer.nullValue();
      return;
    }
    writer.value(format(value));
  }
}
