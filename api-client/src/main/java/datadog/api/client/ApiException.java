package datadog.api.client;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Failure of an API call: an error status, an undecodable body or a transport error. */
public class ApiException extends Exception {

  private final int code;
  private final Map<String, List<String>> responseHeaders;
  @Nullable private final String responseBody;
  @Nullable private final Object errorModel;

  public ApiException(String message) {
    this(message, null, 0, null, null, null);
  }

  public ApiException(String message, Throwable cause) {
    this(message, cause, 0, null, null, null);
  }

  public ApiException(int code, String message) {
    this(message, null, code, null, null, null);
  }

  public ApiException(
      String message,
      @Nullable Throwable cause,
      int code,
      @Nullable Map<String, List<String>> responseHeaders,
      @Nullable String responseBody,
      @Nullable Object errorModel) {
    super(message, cause);
    this.code = code;
    this.responseHeaders =
        responseHeaders == null
            ? Collections.<String, List<String>>emptyMap()
            : Collections.unmodifiableMap(responseHeaders);
    this.responseBody = responseBody;
    this.errorModel = errorModel;
  }

  /** HTTP status code, {@code 0} when no response was received. */
  public int getCode() {
    return code;
  }

  public Map<String, List<String>> getResponseHeaders() {
    return responseHeaders;
  }

  @Nullable
  public String getResponseBody() {
    return responseBody;
  }

  /**
   * The error body decoded into the model the operation declares for this status code, for
   * example {@code APIErrorResponse}. {@code null} when the body could not be decoded.
   */
  @Nullable
  public Object getErrorModel() {
    return errorModel;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("ApiException{code=").append(code);
    sb.append(", message=").append(getMessage());
    if (responseBody != null) {
      sb.append(", responseBody=").append(responseBody);
    }
    return sb.append('}').toString();
  }
}
