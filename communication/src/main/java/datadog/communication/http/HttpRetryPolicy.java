package datadog.communication.http;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a failed call is attempted again and how long to wait first.
 *
 * <ul>
 *   <li>connect failures and <b>5XX</b> responses are retried while retries are left, each wait
 *       being the previous one multiplied by the delay factor
 *   <li><b>429</b> responses wait for the number of seconds in <b>x-ratelimit-reset</b> plus a
 *       jitter below 401ms, as a final retry. Resets above 10 seconds are not retried and a missing
 *       or malformed header falls back to a regular retry
 *   <li>everything else fails immediately
 * </ul>
 *
 * <p>One instance per call.
 */
@NotThreadSafe
public class HttpRetryPolicy {

  private static final Logger log = LoggerFactory.getLogger(HttpRetryPolicy.class);

  private static final int NO_RESPONSE = -1;
  private static final int TOO_MANY_REQUESTS = 429;
  static final String X_RATELIMIT_RESET_HTTP_HEADER = "x-ratelimit-reset";
  private static final long UNKNOWN_RESET = -1;
  private static final long MAX_RESET_SECONDS = 10;
  private static final int RESET_JITTER_BOUND_MILLIS = 401;

  private int retriesLeft;
  private long delay;
  private final double delayFactor;

  private HttpRetryPolicy(int retriesLeft, long delay, double delayFactor) {
    this.retriesLeft = retriesLeft;
    this.delay = delay;
    this.delayFactor = delayFactor;
  }

  public boolean shouldRetry(IOException e) {
    return e instanceof ConnectException && shouldRetry((Response) null);
  }

  public boolean shouldRetry(@Nullable Response response) {
    if (retriesLeft <= 0) {
      return false;
    }
    int code = response != null ? response.code() : NO_RESPONSE;
    if (code == TOO_MANY_REQUESTS) {
      long resetSeconds = rateLimitReset(response);
      if (resetSeconds == UNKNOWN_RESET) {
        retriesLeft--;
        return true;
      }
      if (resetSeconds > MAX_RESET_SECONDS) {
        log.debug("Rate limited for {}s, giving up", resetSeconds);
        return false;
      }
      retriesLeft = 0;
      delay =
          TimeUnit.SECONDS.toMillis(resetSeconds)
              + ThreadLocalRandom.current().nextInt(RESET_JITTER_BOUND_MILLIS);
      return true;
    }
    if (code >= 500 || code == NO_RESPONSE) {
      retriesLeft--;
      return true;
    }
    return false;
  }

  private static long rateLimitReset(Response response) {
    String header = response.header(X_RATELIMIT_RESET_HTTP_HEADER);
    if (header == null) {
      return UNKNOWN_RESET;
    }
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds < 0 ? UNKNOWN_RESET : seconds;
    } catch (NumberFormatException e) {
      log.warn("Could not parse {} header contents: {}", X_RATELIMIT_RESET_HTTP_HEADER, header);
      return UNKNOWN_RESET;
    }
  }

  long nextDelay() {
    long current = delay;
    delay = (long) (delay * delayFactor);
    return current;
  }

  int getRetriesLeft() {
    return retriesLeft;
  }

  /** Sleeps before the next attempt; an interrupt keeps the flag set and aborts the call. */
  public void backoff() throws InterruptedIOException {
    long millis = nextDelay();
    log.debug("Retrying request in {} ms, {} retries left", millis, retriesLeft);
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new InterruptedIOException("interrupted while waiting to retry");
    }
  }

  public static class Factory {
    public static final Factory NEVER_RETRY = new Factory(0, 0, 0);

    private final int maxRetries;
    private final long initialDelayMillis;
    private final double delayFactor;

    public Factory(int maxRetries, long initialDelayMillis, double delayFactor) {
      if (maxRetries < 0) {
        throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
      }
      this.maxRetries = maxRetries;
      this.initialDelayMillis = initialDelayMillis;
      this.delayFactor = delayFactor;
    }

    /**
     * Exponential backoff where the first retry waits {@code baseSeconds * multiplier} seconds and
     * each following one multiplies the previous wait by {@code multiplier}.
     */
    public static Factory exponential(int maxRetries, int baseSeconds, double multiplier) {
      long initialDelay = (long) (TimeUnit.SECONDS.toMillis(baseSeconds) * multiplier);
      return new Factory(maxRetries, initialDelay, multiplier);
    }

    public int getMaxRetries() {
      return maxRetries;
    }

    public HttpRetryPolicy create() {
      return new HttpRetryPolicy(maxRetries, initialDelayMillis, delayFactor);
    }
  }
}
