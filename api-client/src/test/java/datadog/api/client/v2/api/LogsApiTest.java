package datadog.api.client.v2.api;

import static org.junit.jupiter.api.Assertions.*;

import datadog.api.client.ApiException;
import datadog.api.client.v2.model.ContentEncoding;
import datadog.api.client.v2.model.HTTPLogErrors;
import datadog.api.client.v2.model.HTTPLogItem;
import datadog.api.client.v2.model.Log;
import datadog.api.client.v2.model.LogsListRequest;
import datadog.api.client.v2.model.LogsListRequestPage;
import datadog.api.client.v2.model.LogsListResponse;
import datadog.api.client.v2.model.LogsQueryFilter;
import datadog.api.client.v2.model.LogsStorageTier;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPInputStream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

class LogsApiTest extends ApiTestSupport {

  private static String logs(String after, String... ids) {
    StringBuilder json = new StringBuilder("{\"data\":[");
    for (int i = 0; i < ids.length; i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append("{\"id\":\"")
          .append(ids[i])
          .append("\",\"type\":\"log\",\"attributes\":{\"message\":\"m\",\"attributes\":{")
          .append("\"duration\":")
          .append(i)
          .append("}}}");
    }
    json.append("],\"meta\":{\"status\":\"done\"");
    if (after != null) {
      json.append(",\"page\":{\"after\":\"").append(after).append("\"}");
    }
    return json.append("}}").toString();
  }

  private static String gunzip(InputStream compressed) throws IOException {
    try (InputStream in = new GZIPInputStream(compressed)) {
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      byte[] buffer = new byte[1024];
      int read;
      while ((read = in.read(buffer)) != -1) {
        out.write(buffer, 0, read);
      }
      return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }
  }

  @Test
  void listLogs() throws Exception {
    respond(logs(null, "a"));
    LogsApi api = new LogsApi(apiClient);

    LogsListResponse response =
        api.listLogs(
            new LogsApi.ListLogsOptionalParameters()
                .body(new LogsListRequest().filter(new LogsQueryFilter().query("service:web"))));

    Log log = response.getData().get(0);
    assertEquals("a", log.getId());
    assertEquals(0L, log.getAttributes().getAttributes().get("duration"));
    RecordedRequest request = takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals("/api/v2/logs/events/search", request.getPath());
    assertEquals(
        "{\"filter\":{\"from\":\"now-15m\",\"query\":\"service:web\",\"to\":\"now\"}}",
        request.getBody().readUtf8());
  }

  @Test
  void listLogsWithoutBodySendsEmptyPost() throws Exception {
    respond(logs(null));
    LogsApi api = new LogsApi(apiClient);

    assertTrue(api.listLogs().getData().isEmpty());
    RecordedRequest request = takeRequest();
    assertEquals("POST", request.getMethod());
    assertEquals(0, request.getBodySize());
  }

  @Test
  void listLogsWithPaginationWritesCursorInBody() throws Exception {
    respond(logs("c1", "a", "b"));
    respond(logs("c2", "c"));
    LogsApi api = new LogsApi(apiClient);
    LogsListRequest body = new LogsListRequest().page(new LogsListRequestPage().limit(2));

    List<String> ids = new ArrayList<>();
    for (Log log :
        api.listLogsWithPagination(new LogsApi.ListLogsOptionalParameters().body(body))) {
      ids.add(log.getId());
    }

    assertEquals(Arrays.asList("a", "b", "c"), ids);
    assertEquals("{\"page\":{\"limit\":2}}", takeRequest().getBody().readUtf8());
    assertEquals(
        "{\"page\":{\"cursor\":\"c1\",\"limit\":2}}", takeRequest().getBody().readUtf8());
  }

  @Test
  void listLogsGetWithPagination() throws Exception {
    respond(logs("c1", "a", "b"));
    respond(logs(null, "c", "d"));
    LogsApi api = new LogsApi(apiClient);

    List<String> ids = new ArrayList<>();
    for (Log log :
        api.listLogsGetWithPagination(
            new LogsApi.ListLogsGetOptionalParameters()
                .filterIndexes(Arrays.asList("main", "audit"))
                .filterStorageTier(LogsStorageTier.ONLINE_ARCHIVES)
                .pageLimit(2))) {
      ids.add(log.getId());
    }

    assertEquals(Arrays.asList("a", "b", "c", "d"), ids);
    assertEquals(2, server.getRequestCount());
    assertEquals(
        "/api/v2/logs/events?filter%5Bindexes%5D=main%2Caudit"
            + "&filter%5Bstorage_tier%5D=online-archives&page%5Blimit%5D=2",
        takeRequest().getPath());
    assertEquals(
        "/api/v2/logs/events?filter%5Bindexes%5D=main%2Caudit"
            + "&filter%5Bstorage_tier%5D=online-archives&page%5Bcursor%5D=c1&page%5Blimit%5D=2",
        takeRequest().getPath());
  }

  @Test
  void submitLogUsesApiKeyOnly() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202).setBody("{}"));
    LogsApi api = new LogsApi(apiClient);

    Object response =
        api.submitLog(
            Collections.singletonList(new HTTPLogItem("hello").ddsource("java")),
            new LogsApi.SubmitLogOptionalParameters().ddtags("env:test"));

    assertEquals(Collections.emptyMap(), response);
    RecordedRequest request = takeRequest();
    assertEquals("/api/v2/logs?ddtags=env%3Atest", request.getPath());
    assertEquals("api-key", request.getHeader("DD-API-KEY"));
    assertNull(request.getHeader("DD-APPLICATION-KEY"));
    assertNull(request.getHeader("Content-Encoding"));
    assertEquals(
        "[{\"ddsource\":\"java\",\"message\":\"hello\"}]", request.getBody().readUtf8());
  }

  @Test
  void submitLogCompressesBody() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(202).setBody("{}"));
    LogsApi api = new LogsApi(apiClient);

    api.submitLog(
        Collections.singletonList(new HTTPLogItem("hello")),
        new LogsApi.SubmitLogOptionalParameters().contentEncoding(ContentEncoding.GZIP));

    RecordedRequest request = takeRequest();
    assertEquals("gzip", request.getHeader("Content-Encoding"));
    assertEquals("[{\"message\":\"hello\"}]", gunzip(request.getBody().inputStream()));
  }

  @Test
  void submitLogErrorsUseIntakeModel() {
    server.enqueue(
        new MockResponse()
            .setResponseCode(413)
            .setBody("{\"errors\":[{\"status\":\"413\",\"title\":\"Payload Too Large\"}]}"));
    LogsApi api = new LogsApi(apiClient);

    ApiException e =
        assertThrows(
            ApiException.class,
            () -> api.submitLog(Collections.singletonList(new HTTPLogItem("hello"))));

    assertEquals(413, e.getCode());
    HTTPLogErrors errors = (HTTPLogErrors) e.getErrorModel();
    assertEquals("Payload Too Large", errors.getErrors().get(0).getTitle());
  }

  @Test
  void submitLogUsesIntakeServer() {
    configuration.setServerIndex(0);

    assertEquals(
        "https://http-intake.logs.datadoghq.com", configuration.getServerUrl("v2.submitLog"));
    assertEquals("https://api.datadoghq.com", configuration.getServerUrl("v2.listLogs"));
  }
}
