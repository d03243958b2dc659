package datadog.api.client.v2.api;

import static org.junit.jupiter.api.Assertions.*;

import datadog.api.client.ApiException;
import datadog.api.client.PaginationIterable;
import datadog.api.client.v2.model.RUMEvent;
import datadog.api.client.v2.model.RUMEventsResponse;
import datadog.api.client.v2.model.RUMQueryFilter;
import datadog.api.client.v2.model.RUMQueryPageOptions;
import datadog.api.client.v2.model.RUMResponseStatus;
import datadog.api.client.v2.model.RUMSearchEventsRequest;
import datadog.api.client.v2.model.RUMSort;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class RumApiTest extends ApiTestSupport {

  private static String events(String after, String... ids) {
    StringBuilder json = new StringBuilder("{\"data\":[");
    for (int i = 0; i < ids.length; i++) {
      if (i > 0) {
        json.append(',');
      }
      json.append("{\"id\":\"").append(ids[i]).append("\",\"type\":\"rum\"}");
    }
    json.append("],\"meta\":{\"status\":\"done\"");
    if (after != null) {
      json.append(",\"page\":{\"after\":\"").append(after).append("\"}");
    }
    return json.append("},\"links\":{}}").toString();
  }

  private static List<String> ids(Iterable<RUMEvent> events) {
    List<String> ids = new ArrayList<>();
    for (RUMEvent event : events) {
      ids.add(event.getId());
    }
    return ids;
  }

  @Test
  void listEvents() throws Exception {
    respond(events(null, "a"));
    RumApi api = new RumApi(apiClient);

    RUMEventsResponse response =
        api.listRUMEvents(
            new RumApi.ListRUMEventsOptionalParameters()
                .filterQuery("@type:session")
                .filterFrom(OffsetDateTime.of(2021, 11, 11, 11, 11, 11, 0, ZoneOffset.UTC))
                .sort(RUMSort.TIMESTAMP_DESCENDING));

    assertEquals(RUMResponseStatus.DONE, response.getMeta().getStatus());
    assertEquals(
        "/api/v2/rum/events?filter%5Bquery%5D=%40type%3Asession"
            + "&filter%5Bfrom%5D=2021-11-11T11%3A11%3A11Z&sort=-timestamp",
        takeRequest().getPath());
  }

  @Test
  void listEventsWithPagination() throws Exception {
    respond(events("c1", "a", "b"));
    respond(events("", "c", "d"));
    RumApi api = new RumApi(apiClient);

    PaginationIterable<RUMEvent> events =
        api.listRUMEventsWithPagination(new RumApi.ListRUMEventsOptionalParameters().pageLimit(2));

    assertEquals(Arrays.asList("a", "b", "c", "d"), ids(events));
    assertEquals(2, server.getRequestCount());
  }

  @Test
  void searchEventsRequiresBody() {
    RumApi api = new RumApi(apiClient);

    ApiException e = assertThrows(ApiException.class, () -> api.searchRUMEvents(null));
    assertEquals(
        "Missing the required parameter 'body' when calling searchRUMEvents", e.getMessage());
  }

  @Test
  void searchEventsWithPaginationRequiresBody() {
    RumApi api = new RumApi(apiClient);

    ApiException e =
        assertThrows(ApiException.class, () -> api.searchRUMEventsWithPagination(null));
    assertEquals(400, e.getCode());
    assertEquals(
        "Missing the required parameter 'body' when calling searchRUMEvents", e.getMessage());
    assertEquals(0, server.getRequestCount());
  }

  @Test
  void searchEventsWithPagination() throws Exception {
    respond(events("c1", "a", "b"));
    respond(events("c2"));
    RumApi api = new RumApi(apiClient);
    RUMSearchEventsRequest body =
        new RUMSearchEventsRequest()
            .filter(new RUMQueryFilter().query("@type:view"))
            .page(new RUMQueryPageOptions().limit(2));

    assertEquals(Arrays.asList("a", "b"), ids(api.searchRUMEventsWithPagination(body)));
    assertEquals(
        "{\"filter\":{\"from\":\"now-15m\",\"query\":\"@type:view\",\"to\":\"now\"},"
            + "\"page\":{\"limit\":2}}",
        takeRequest().getBody().readUtf8());
    assertEquals(
        "{\"filter\":{\"from\":\"now-15m\",\"query\":\"@type:view\",\"to\":\"now\"},"
            + "\"page\":{\"cursor\":\"c1\",\"limit\":2}}",
        takeRequest().getBody().readUtf8());
  }
}
