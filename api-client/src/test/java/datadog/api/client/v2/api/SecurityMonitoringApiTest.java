package datadog.api.client.v2.api;

import static org.junit.jupiter.api.Assertions.*;

import datadog.api.client.ApiException;
import datadog.api.client.ApiResponse;
import datadog.api.client.PaginationException;
import datadog.api.client.PaginationIterable;
import datadog.api.client.v2.model.APIErrorResponse;
import datadog.api.client.v2.model.SecurityMonitoringRuleResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignal;
import datadog.api.client.v2.model.SecurityMonitoringSignalArchiveReason;
import datadog.api.client.v2.model.SecurityMonitoringSignalListRequest;
import datadog.api.client.v2.model.SecurityMonitoringSignalListRequestFilter;
import datadog.api.client.v2.model.SecurityMonitoringSignalListRequestPage;
import datadog.api.client.v2.model.SecurityMonitoringSignalState;
import datadog.api.client.v2.model.SecurityMonitoringSignalStateUpdateAttributes;
import datadog.api.client.v2.model.SecurityMonitoringSignalStateUpdateData;
import datadog.api.client.v2.model.SecurityMonitoringSignalStateUpdateRequest;
import datadog.api.client.v2.model.SecurityMonitoringSignalTriageUpdateResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalsListResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalsSort;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.Test;

class SecurityMonitoringApiTest extends ApiTestSupport {

  private static String signals(String after, String... ids) {
    StringBuilder json = new StringBuilder("{\"data\":[");
    for (int i = 0; i < ids.length; i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append("{\"id\":\"").append(ids[i]).append("\",\"type\":\"signal\"}");
    }
    json.append("],\"meta\":{\"page\":{");
    if (after != null) {
      json.append("\"after\":\"").append(after).append('"');
    }
    return json.append("}}}").toString();
  }

  private static List<String> ids(Iterable<SecurityMonitoringSignal> signals) {
    List<String> ids = new ArrayList<>();
    for (SecurityMonitoringSignal signal : signals) {
      ids.add(signal.getId());
    }
    return ids;
  }

  @Test
  void listSignals() throws Exception {
    respond(signals("next", "a", "b"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    ApiResponse<SecurityMonitoringSignalsListResponse> response =
        api.listSecurityMonitoringSignalsWithHttpInfo(
            new SecurityMonitoringApi.ListSecurityMonitoringSignalsOptionalParameters()
                .filterQuery("security:attack")
                .sort(SecurityMonitoringSignalsSort.TIMESTAMP_ASCENDING)
                .pageLimit(2));

    assertEquals(200, response.getStatusCode());
    assertEquals(2, response.getData().getData().size());
    assertEquals("next", response.getData().getMeta().getPage().getAfter());
    RecordedRequest request = takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals(
        "/api/v2/security_monitoring/signals"
            + "?filter%5Bquery%5D=security%3Aattack&sort=timestamp&page%5Blimit%5D=2",
        request.getPath());
    assertEquals("api-key", request.getHeader("DD-API-KEY"));
    assertEquals("app-key", request.getHeader("DD-APPLICATION-KEY"));
  }

  @Test
  void listSignalsWithPaginationFollowsCursor() throws Exception {
    respond(signals("cursor-1", "a", "b"));
    respond(signals("cursor-2", "c", "d"));
    respond(signals("cursor-3", "e"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    PaginationIterable<SecurityMonitoringSignal> signals =
        api.listSecurityMonitoringSignalsWithPagination(
            new SecurityMonitoringApi.ListSecurityMonitoringSignalsOptionalParameters()
                .pageLimit(2));

    assertEquals(2, signals.getPageSize());
    assertEquals(Arrays.asList("a", "b", "c", "d", "e"), ids(signals));
    assertEquals(3, server.getRequestCount());
    assertFalse(takeRequest().getPath().contains("page%5Bcursor%5D"));
    assertTrue(takeRequest().getPath().contains("page%5Bcursor%5D=cursor-1"));
    assertTrue(takeRequest().getPath().contains("page%5Bcursor%5D=cursor-2"));
  }

  @Test
  void paginationStopsWithoutCursor() throws Exception {
    respond(signals(null, "a", "b"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    PaginationIterable<SecurityMonitoringSignal> signals =
        api.listSecurityMonitoringSignalsWithPagination(
            new SecurityMonitoringApi.ListSecurityMonitoringSignalsOptionalParameters()
                .pageLimit(2));

    assertEquals(Arrays.asList("a", "b"), ids(signals));
    assertEquals(1, server.getRequestCount());
  }

  @Test
  void paginationUsesDefaultPageSize() throws Exception {
    respond(signals("next", "a"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    PaginationIterable<SecurityMonitoringSignal> signals =
        api.listSecurityMonitoringSignalsWithPagination();

    assertEquals(PaginationIterable.DEFAULT_PAGE_SIZE, signals.getPageSize());
    assertEquals(Arrays.asList("a"), ids(signals));
    assertTrue(takeRequest().getPath().endsWith("page%5Blimit%5D=10"));
  }

  @Test
  void searchSignalsWithPaginationWritesCursorInBody() throws Exception {
    respond(signals("cursor-1", "a", "b"));
    respond(signals(null));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);
    SecurityMonitoringSignalListRequest body =
        new SecurityMonitoringSignalListRequest()
            .filter(new SecurityMonitoringSignalListRequestFilter().query("status:high"))
            .page(new SecurityMonitoringSignalListRequestPage().limit(2));

    PaginationIterable<SecurityMonitoringSignal> signals =
        api.searchSecurityMonitoringSignalsWithPagination(
            new SecurityMonitoringApi.SearchSecurityMonitoringSignalsOptionalParameters()
                .body(body));

    assertEquals(2, signals.getPageSize());
    assertEquals(Arrays.asList("a", "b"), ids(signals));
    RecordedRequest first = takeRequest();
    assertEquals("POST", first.getMethod());
    assertEquals("/api/v2/security_monitoring/signals/search", first.getPath());
    assertEquals(
        "{\"filter\":{\"query\":\"status:high\"},\"page\":{\"limit\":2}}",
        first.getBody().readUtf8());
    assertEquals(
        "{\"filter\":{\"query\":\"status:high\"},\"page\":{\"cursor\":\"cursor-1\",\"limit\":2}}",
        takeRequest().getBody().readUtf8());
  }

  @Test
  void paginationFailureSurfacesAsPaginationException() {
    respond(signals("cursor-1", "a", "b"));
    server.enqueue(new MockResponse().setResponseCode(429).setBody("{\"errors\":[\"Slow down\"]}"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    List<String> received = new ArrayList<>();
    PaginationException e =
        assertThrows(
            PaginationException.class,
            () -> {
              for (SecurityMonitoringSignal signal :
                  api.listSecurityMonitoringSignalsWithPagination(
                      new SecurityMonitoringApi.ListSecurityMonitoringSignalsOptionalParameters()
                          .pageLimit(2))) {
                received.add(signal.getId());
              }
            });

    assertEquals(Arrays.asList("a", "b"), received);
    ApiException cause = e.getApiException();
    assertEquals(429, cause.getCode());
    assertEquals(
        "Slow down", ((APIErrorResponse) cause.getErrorModel()).getErrors().get(0));
  }

  @Test
  void getSignalRequiresId() {
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    ApiException e = assertThrows(ApiException.class, () -> api.getSecurityMonitoringSignal(null));
    assertEquals(400, e.getCode());
    assertEquals(
        "Missing the required parameter 'signalId' when calling getSecurityMonitoringSignal",
        e.getMessage());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void getSignalEscapesId() throws Exception {
    respond("{\"data\":{\"id\":\"a/b\",\"type\":\"signal\"}}");
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    assertEquals("a/b", api.getSecurityMonitoringSignal("a/b").getData().getId());
    assertEquals("/api/v2/security_monitoring/signals/a%2Fb", takeRequest().getPath());
  }

  @Test
  void editSignalState() throws Exception {
    respond(
        "{\"data\":{\"id\":\"sig\",\"type\":\"signal_metadata\",\"attributes\":{"
            + "\"archive_reason\":\"false_positive\",\"state\":\"archived\",\"incident_ids\":[],"
            + "\"assignee\":{\"uuid\":\"\"}}}}");
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);
    SecurityMonitoringSignalStateUpdateRequest body =
        new SecurityMonitoringSignalStateUpdateRequest(
            new SecurityMonitoringSignalStateUpdateData(
                new SecurityMonitoringSignalStateUpdateAttributes(
                        SecurityMonitoringSignalState.ARCHIVED)
                    .archiveReason(SecurityMonitoringSignalArchiveReason.FALSE_POSITIVE)));

    SecurityMonitoringSignalTriageUpdateResponse response =
        api.editSecurityMonitoringSignalState("sig", body);

    assertEquals(
        SecurityMonitoringSignalState.ARCHIVED, response.getData().getAttributes().getState());
    RecordedRequest request = takeRequest();
    assertEquals("PATCH", request.getMethod());
    assertEquals("/api/v2/security_monitoring/signals/sig/state", request.getPath());
    assertEquals(
        "{\"data\":{\"attributes\":{\"archive_reason\":\"false_positive\",\"state\":\"archived\"},"
            + "\"type\":\"signal_metadata\"}}",
        request.getBody().readUtf8());
  }

  @Test
  void getRuleDecodesOneOf() throws Exception {
    respond(
        "{\"id\":\"rule\",\"type\":\"signal_correlation\",\"isEnabled\":true,"
            + "\"queries\":[{\"ruleId\":\"other\",\"aggregation\":\"event_count\"}]}");
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    SecurityMonitoringRuleResponse rule = api.getSecurityMonitoringRule("rule");

    assertTrue(rule.isSecurityMonitoringSignalRuleResponse());
    assertTrue(rule.getSecurityMonitoringSignalRuleResponse().getIsEnabled());
    assertEquals("/api/v2/security_monitoring/rules/rule", takeRequest().getPath());
  }

  @Test
  void listRules() throws Exception {
    respond(
        "{\"data\":[{\"id\":\"a\",\"type\":\"log_detection\"},"
            + "{\"id\":\"b\",\"type\":\"signal_correlation\"}],"
            + "\"meta\":{\"page\":{\"total_count\":2,\"total_filtered_count\":2}}}");
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    List<SecurityMonitoringRuleResponse> rules =
        api.listSecurityMonitoringRules(
                new SecurityMonitoringApi.ListSecurityMonitoringRulesOptionalParameters()
                    .pageSize(2L)
                    .pageNumber(0L))
            .getData();

    assertTrue(rules.get(0).isSecurityMonitoringStandardRuleResponse());
    assertTrue(rules.get(1).isSecurityMonitoringSignalRuleResponse());
    assertEquals(
        "/api/v2/security_monitoring/rules?page%5Bsize%5D=2&page%5Bnumber%5D=0",
        takeRequest().getPath());
  }

  @Test
  void deleteRule() throws Exception {
    server.enqueue(new MockResponse().setResponseCode(204));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    ApiResponse<Void> response = api.deleteSecurityMonitoringRuleWithHttpInfo("rule");

    assertEquals(204, response.getStatusCode());
    assertNull(response.getData());
    assertEquals("DELETE", takeRequest().getMethod());
  }

  @Test
  void notFoundCarriesErrorModel() {
    server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"errors\":[\"Not found\"]}"));
    SecurityMonitoringApi api = new SecurityMonitoringApi(apiClient);

    ApiException e = assertThrows(ApiException.class, () -> api.deleteSecurityMonitoringRule("x"));
    assertEquals(404, e.getCode());
    assertTrue(e.getErrorModel() instanceof APIErrorResponse);
  }
}
