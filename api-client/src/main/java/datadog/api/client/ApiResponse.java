package datadog.api.client;

import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Status code, headers and decoded body of a successful call. */
public class ApiResponse<T> {
  private final int statusCode;
  private final Map<String, List<String>> headers;
  @Nullable private final T data;

  public ApiResponse(int statusCode, Map<String, List<String>> headers, @Nullable T data) {
    this.statusCode = statusCode;
    this.headers = headers;
    this.data = data;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public Map<String, List<String>> getHeaders() {
    return headers;
  }

  @Nullable
  public T getData() {
    return data;
  }
}
