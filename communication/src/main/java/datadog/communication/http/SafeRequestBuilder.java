package datadog.communication.http;

import java.util.Map;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

/*
The purpose of this class is to wrap okhttp3.Request.Builder.
Request.Builder.header() and addHeader() echo the offending value when a header contains invalid
characters, which would print API and application keys to logs.
 */
public final class SafeRequestBuilder {

  private final Request.Builder requestBuilder;

  public SafeRequestBuilder() {
    this.requestBuilder = new Request.Builder();
  }

  public SafeRequestBuilder url(HttpUrl url) {
    this.requestBuilder.url(url);
    return this;
  }

  public SafeRequestBuilder header(String name, String value) {
    try {
      this.requestBuilder.header(name, value);
      return this;
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException(
          "InvalidArgumentException at header() for header: " + name);
    }
  }

  public SafeRequestBuilder addHeader(String name, String value) {
    try {
      this.requestBuilder.addHeader(name, value);
      return this;
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalArgumentException(
          "InvalidArgumentException at addHeader() for header: " + name);
    }
  }

  /** Sets every header of the map, replacing earlier values with the same name. */
  public SafeRequestBuilder headers(Map<String, String> headers) {
    for (Map.Entry<String, String> e : headers.entrySet()) {
      header(e.getKey(), e.getValue());
    }
    return this;
  }

  public SafeRequestBuilder method(String method, @Nullable RequestBody body) {
    this.requestBuilder.method(method, body);
    return this;
  }

  public Request build() {
    return this.requestBuilder.build();
  }
}
