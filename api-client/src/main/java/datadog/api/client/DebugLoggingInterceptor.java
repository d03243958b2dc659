package datadog.api.client;

import static datadog.communication.http.OkHttpUtils.CONTENT_ENCODING;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okio.Buffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs every request and response at INFO, with API and application keys redacted. */
final class DebugLoggingInterceptor implements Interceptor {
  private static final Logger log = LoggerFactory.getLogger(DebugLoggingInterceptor.class);

  static final String REDACTED = "REDACTED";
  private static final long MAX_LOGGED_BODY_BYTES = 64 * 1024;

  private final Configuration configuration;

  DebugLoggingInterceptor(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();
    log.info("\n{}", redact(dumpRequest(request)));
    Response response = chain.proceed(request);
    log.info("\n{}", redact(dumpResponse(response)));
    return response;
  }

  private static String dumpRequest(Request request) throws IOException {
    StringBuilder dump = new StringBuilder();
    dump.append(request.method()).append(' ').append(request.url()).append('\n');
    appendHeaders(dump, request.headers());
    RequestBody body = request.body();
    if (body != null) {
      dump.append('\n');
      if (request.header(CONTENT_ENCODING) != null) {
        dump.append("(").append(request.header(CONTENT_ENCODING)).append(" encoded body)");
      } else {
        Buffer buffer = new Buffer();
        body.writeTo(buffer);
        dump.append(buffer.readString(StandardCharsets.UTF_8));
      }
    }
    return dump.toString();
  }

  private static String dumpResponse(Response response) throws IOException {
    StringBuilder dump = new StringBuilder();
    dump.append(response.protocol().toString().toUpperCase(Locale.ROOT))
        .append(' ')
        .append(response.code())
        .append(' ')
        .append(response.message())
        .append('\n');
    appendHeaders(dump, response.headers());
    dump.append('\n');
    if (response.header(CONTENT_ENCODING) != null) {
      dump.append("(").append(response.header(CONTENT_ENCODING)).append(" encoded body)");
    } else {
      dump.append(response.peekBody(MAX_LOGGED_BODY_BYTES).string());
    }
    return dump.toString();
  }

  private static void appendHeaders(StringBuilder dump, Headers headers) {
    for (int i = 0; i < headers.size(); i++) {
      dump.append(headers.name(i)).append(": ").append(headers.value(i)).append('\n');
    }
  }

  String redact(String dump) {
    String redacted = dump;
    for (String secret : configuration.secrets()) {
      if (!secret.isEmpty()) {
        redacted = redacted.replace(secret, REDACTED);
      }
    }
    return redacted;
  }
}
