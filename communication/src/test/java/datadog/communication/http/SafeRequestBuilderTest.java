package datadog.communication.http;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.junit.jupiter.api.Test;

class SafeRequestBuilderTest {

  private static final HttpUrl URL = HttpUrl.get("https://api.datadoghq.com/api/v2/incidents");
  private static final String SECRET = "abc123\nsecret";

  @Test
  void invalidHeaderValueDoesNotLeak() {
    IllegalArgumentException header =
        assertThrows(
            IllegalArgumentException.class,
            () -> new SafeRequestBuilder().url(URL).header("DD-API-KEY", SECRET));
    assertEquals(
        "InvalidArgumentException at header() for header: DD-API-KEY", header.getMessage());
    assertFalse(header.getMessage().contains("secret"));

    IllegalArgumentException addHeader =
        assertThrows(
            IllegalArgumentException.class,
            () -> new SafeRequestBuilder().url(URL).addHeader("DD-APPLICATION-KEY", SECRET));
    assertFalse(addHeader.getMessage().contains("secret"));
  }

  @Test
  void nullHeaderValueIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SafeRequestBuilder().url(URL).header("DD-API-KEY", null));
  }

  @Test
  void headersMapReplacesValues() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", "text/plain");
    Request request =
        new SafeRequestBuilder()
            .url(URL)
            .header("Accept", "application/json")
            .headers(headers)
            .addHeader("X-Extra", "1")
            .addHeader("X-Extra", "2")
            .method("GET", null)
            .build();

    assertEquals("text/plain", request.header("Accept"));
    assertEquals(2, request.headers("X-Extra").size());
    assertEquals(URL, request.url());
  }
}
