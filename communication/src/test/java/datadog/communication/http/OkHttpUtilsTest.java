package datadog.communication.http;

import static org.junit.jupiter.api.Assertions.*;

import datadog.communication.util.IOUtils;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OkHttpUtilsTest {

  private static final String URL_PATH = "/api/v2/logs";
  private static final String PAYLOAD = "[{\"message\":\"hello\"}]";

  private final MockWebServer server = new MockWebServer();
  private HttpUrl url;
  private OkHttpClient client;

  @BeforeEach
  void setup() throws IOException {
    server.start();
    url = server.url(URL_PATH);
    client = OkHttpUtils.buildHttpClient(5_000, Collections.<Interceptor>emptyList());
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void timeoutsAreApplied() {
    assertEquals(5_000, client.connectTimeoutMillis());
    assertEquals(5_000, client.readTimeoutMillis());
    assertEquals(5_000, client.writeTimeoutMillis());
    assertFalse(client.retryOnConnectionFailure());
  }

  @Test
  void gzippedBodyIsCompressed() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202));

    Request request =
        new SafeRequestBuilder()
            .url(url)
            .header(OkHttpUtils.CONTENT_ENCODING, OkHttpUtils.GZIP_ENCODING)
            .method(
                "POST",
                OkHttpUtils.gzippedRequestBodyOf(
                    OkHttpUtils.jsonRequestBodyOf(PAYLOAD.getBytes(StandardCharsets.UTF_8))))
            .build();
    try (Response response =
        OkHttpUtils.sendWithRetries(client, HttpRetryPolicy.Factory.NEVER_RETRY, request)) {
      assertEquals(202, response.code());
    }

    RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
    assertNotNull(recorded);
    assertEquals("gzip", recorded.getHeader("Content-Encoding"));
    assertTrue(recorded.getHeader("Content-Type").startsWith("application/json"));
    String body =
        IOUtils.readFully(
            new GZIPInputStream(recorded.getBody().inputStream()), StandardCharsets.UTF_8);
    assertEquals(PAYLOAD, body);
  }

  @Test
  void deflatedBodyIsCompressed() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202));

    Request request =
        new SafeRequestBuilder()
            .url(url)
            .method(
                "POST",
                OkHttpUtils.deflatedRequestBodyOf(
                    OkHttpUtils.jsonRequestBodyOf(PAYLOAD.getBytes(StandardCharsets.UTF_8))))
            .build();
    OkHttpUtils.closeQuietly(
        OkHttpUtils.sendWithRetries(client, HttpRetryPolicy.Factory.NEVER_RETRY, request));

    RecordedRequest recorded = server.takeRequest(1, TimeUnit.SECONDS);
    String body =
        IOUtils.readFully(
            new InflaterInputStream(recorded.getBody().inputStream()), StandardCharsets.UTF_8);
    assertEquals(PAYLOAD, body);
  }

  @Test
  void serverErrorsAreRetried() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(500));
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

    Request request = new SafeRequestBuilder().url(url).method("GET", null).build();
    try (Response response =
        OkHttpUtils.sendWithRetries(client, new HttpRetryPolicy.Factory(3, 10, 1.0), request)) {
      assertEquals(200, response.code());
      assertEquals("{}", OkHttpUtils.bodyAsString(response));
    }
    assertEquals(3, server.getRequestCount());
  }

  @Test
  void lastResponseIsReturnedWhenRetriesAreExhausted() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    Request request = new SafeRequestBuilder().url(url).method("GET", null).build();
    try (Response response =
        OkHttpUtils.sendWithRetries(client, new HttpRetryPolicy.Factory(1, 10, 1.0), request)) {
      assertEquals(503, response.code());
      assertEquals("unavailable", OkHttpUtils.bodyAsString(response));
    }
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void gzippedResponseIsUnzipped() throws Exception {
    ByteArrayOutputStream compressed = new ByteArrayOutputStream();
    try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
      gzip.write(PAYLOAD.getBytes(StandardCharsets.UTF_8));
    }
    server.enqueue(
        new MockResponse()
            .setHeader("Content-Encoding", "gzip")
            .setBody(new Buffer().write(compressed.toByteArray())));

    Request request =
        new SafeRequestBuilder()
            .url(url)
            .header(OkHttpUtils.ACCEPT_ENCODING, OkHttpUtils.GZIP_ENCODING)
            .method("GET", null)
            .build();
    try (Response response =
        OkHttpUtils.sendWithRetries(client, HttpRetryPolicy.Factory.NEVER_RETRY, request)) {
      assertEquals(PAYLOAD, OkHttpUtils.bodyAsString(response));
    }
  }

  @Test
  void interceptorsAreInstalled() throws Exception {
    server.enqueue(new MockResponse().setBody("ok"));
    Interceptor tagging =
        chain -> chain.proceed(chain.request().newBuilder().header("X-Test", "1").build());
    OkHttpClient intercepted =
        OkHttpUtils.buildHttpClient(5_000, Collections.singletonList(tagging));

    Request request = new SafeRequestBuilder().url(url).method("GET", null).build();
    try (Response response =
        OkHttpUtils.sendWithRetries(intercepted, HttpRetryPolicy.Factory.NEVER_RETRY, request)) {
      assertEquals("ok", OkHttpUtils.bodyAsString(response));
    }
    assertEquals("1", server.takeRequest(1, TimeUnit.SECONDS).getHeader("X-Test"));
  }

  @Test
  void ioUtilsCopiesStreams() throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    IOUtils.readFully(new ByteArrayInputStream(PAYLOAD.getBytes(StandardCharsets.UTF_8)), out);
    assertEquals(PAYLOAD, new String(out.toByteArray(), StandardCharsets.UTF_8));
  }
}
