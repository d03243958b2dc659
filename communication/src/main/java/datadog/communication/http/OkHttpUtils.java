package datadog.communication.http;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

import datadog.communication.util.IOUtils;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.InflaterInputStream;
import javax.annotation.Nullable;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSink;
import okio.DeflaterSink;
import okio.GzipSink;
import okio.Okio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class OkHttpUtils {
  private static final Logger log = LoggerFactory.getLogger(OkHttpUtils.class);

  public static final String ACCEPT_ENCODING = "Accept-Encoding";
  public static final String CONTENT_ENCODING = "Content-Encoding";
  public static final String GZIP_ENCODING = "gzip";
  public static final String DEFLATE_ENCODING = "deflate";
  public static final String IDENTITY_ENCODING = "identity";

  private OkHttpUtils() {}

  public static OkHttpClient buildHttpClient(
      final long timeoutMillis, final List<Interceptor> interceptors) {
    final OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(timeoutMillis, MILLISECONDS)
            .writeTimeout(timeoutMillis, MILLISECONDS)
            .readTimeout(timeoutMillis, MILLISECONDS)
            // retries are driven by HttpRetryPolicy only
            .retryOnConnectionFailure(false);

    for (Interceptor interceptor : interceptors) {
      builder.addInterceptor(interceptor);
    }

    return builder.build();
  }

  public static RequestBody jsonRequestBodyOf(byte[] json) {
    return new JsonRequestBody(json);
  }

  public static RequestBody gzippedRequestBodyOf(RequestBody delegate) {
    return new GZipRequestBodyDecorator(delegate);
  }

  public static RequestBody deflatedRequestBodyOf(RequestBody delegate) {
    return new DeflateRequestBodyDecorator(delegate);
  }

  private static class JsonRequestBody extends RequestBody {

    private static final MediaType JSON = MediaType.get("application/json");

    private final byte[] json;

    private JsonRequestBody(byte[] json) {
      this.json = json;
    }

    @Override
    public long contentLength() {
      return json.length;
    }

    @Override
    public MediaType contentType() {
      return JSON;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      sink.write(json);
    }
  }

  private static final class GZipRequestBodyDecorator extends RequestBody {
    private final RequestBody delegate;

    private GZipRequestBodyDecorator(RequestBody delegate) {
      this.delegate = delegate;
    }

    @Nullable
    @Override
    public MediaType contentType() {
      return delegate.contentType();
    }

    @Override
    public long contentLength() {
      return -1;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      BufferedSink gzipSink = Okio.buffer(new GzipSink(sink));
      delegate.writeTo(gzipSink);
      gzipSink.close();
    }
  }

  private static final class DeflateRequestBodyDecorator extends RequestBody {
    private final RequestBody delegate;

    private DeflateRequestBodyDecorator(RequestBody delegate) {
      this.delegate = delegate;
    }

    @Nullable
    @Override
    public MediaType contentType() {
      return delegate.contentType();
    }

    @Override
    public long contentLength() {
      return -1;
    }

    @Override
    public void writeTo(BufferedSink sink) throws IOException {
      BufferedSink deflateSink = Okio.buffer(new DeflaterSink(sink, new Deflater()));
      delegate.writeTo(deflateSink);
      deflateSink.close();
    }
  }

  public static Response sendWithRetries(
      OkHttpClient httpClient, HttpRetryPolicy.Factory retryPolicyFactory, Request request)
      throws IOException {
    HttpRetryPolicy retryPolicy = retryPolicyFactory.create();
    while (true) {
      try {
        Response response = httpClient.newCall(request).execute();
        if (response.isSuccessful() || !retryPolicy.shouldRetry(response)) {
          return response;
        }
        log.debug(
            "{} {} returned {}, will retry", request.method(), request.url(), response.code());
        closeQuietly(response);
      } catch (IOException ex) {
        if (!retryPolicy.shouldRetry(ex)) {
          throw ex;
        }
        log.debug("{} {} failed: {}, will retry", request.method(), request.url(), ex.toString());
      }
      retryPolicy.backoff();
    }
  }

  /** Opens the response body, unzipping it when the server compressed it. */
  public static InputStream streamFromResponse(Response response) throws IOException {
    ResponseBody body = response.body();
    if (body == null) {
      return new ByteArrayInputStream(new byte[0]);
    }
    InputStream responseBodyStream = body.byteStream();
    String contentEncoding = response.header(CONTENT_ENCODING);
    if (GZIP_ENCODING.equalsIgnoreCase(contentEncoding)) {
      log.debug("Response content encoding is {}, unzipping response body", contentEncoding);
      responseBodyStream = new GZIPInputStream(responseBodyStream);
    } else if (DEFLATE_ENCODING.equalsIgnoreCase(contentEncoding)) {
      log.debug("Response content encoding is {}, inflating response body", contentEncoding);
      responseBodyStream = new InflaterInputStream(responseBodyStream);
    }
    return responseBodyStream;
  }

  public static String bodyAsString(Response response) throws IOException {
    try (InputStream responseBodyStream = streamFromResponse(response)) {
      return IOUtils.readFully(responseBodyStream, StandardCharsets.UTF_8);
    }
  }

  public static void closeQuietly(Response response) {
    try {
      response.close();
    } catch (Exception e) {
      // ignore
    }
  }
}
