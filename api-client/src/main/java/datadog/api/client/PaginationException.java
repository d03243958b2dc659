package datadog.api.client;

/**
 * Unchecked carrier of the failure that ended a paginated iteration, since {@link
 * java.util.Iterator} methods cannot throw checked exceptions.
 */
public class PaginationException extends RuntimeException {

  public PaginationException(String message, Throwable cause) {
    super(message, cause);
  }

  public PaginationException(ApiException cause) {
    super(cause.getMessage(), cause);
  }

  /** The failed API call, or {@code null} when the iteration ended for another reason. */
  public ApiException getApiException() {
    return getCause() instanceof ApiException ? (ApiException) getCause() : null;
  }
}
