package datadog.api.client;

import static org.junit.jupiter.api.Assertions.*;

import com.squareup.moshi.JsonDataException;
import datadog.api.client.v2.model.IncidentResponse;
import datadog.api.client.v2.model.IncidentResponseData;
import datadog.api.client.v2.model.IncidentType;
import datadog.api.client.v2.model.IncidentsResponse;
import datadog.api.client.v2.model.LogsListRequest;
import datadog.api.client.v2.model.LogsQueryFilter;
import datadog.api.client.v2.model.LogsSort;
import datadog.api.client.v2.model.ResponseMetaAttributes;
import datadog.api.client.v2.model.SecurityMonitoringRuleResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignal;
import datadog.api.client.v2.model.SecurityMonitoringSignalRuleResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalRuleType;
import datadog.api.client.v2.model.SecurityMonitoringSignalState;
import datadog.api.client.v2.model.SecurityMonitoringSignalStateUpdateAttributes;
import datadog.api.client.v2.model.SecurityMonitoringSignalsListResponse;
import datadog.api.client.v2.model.SecurityMonitoringStandardRuleResponse;
import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonSupportTest {

  private static final String SIGNAL =
      "{\"id\":\"AAAAA\",\"type\":\"signal\",\"attributes\":{"
          + "\"message\":\"Brute force\",\"tags\":[\"env:prod\"],"
          + "\"timestamp\":\"2021-01-01T10:00:00Z\","
          + "\"custom\":{\"count\":3,\"ratio\":0.5},\"workflow\":{\"triage\":\"open\"}}}";

  @Test
  void decodesDeclaredFields() throws Exception {
    SecurityMonitoringSignal signal = JsonSupport.fromJson(SIGNAL, SecurityMonitoringSignal.class);

    assertEquals("AAAAA", signal.getId());
    assertEquals("Brute force", signal.getAttributes().getMessage());
    assertEquals(Arrays.asList("env:prod"), signal.getAttributes().getTags());
    assertEquals(
        OffsetDateTime.of(2021, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC),
        signal.getAttributes().getTimestamp());
    assertFalse(signal.isUnparsed());
  }

  @Test
  void undeclaredPropertiesAreKept() throws Exception {
    SecurityMonitoringSignal signal = JsonSupport.fromJson(SIGNAL, SecurityMonitoringSignal.class);

    Map<String, Object> additional = signal.getAttributes().getAdditionalProperties();
    assertEquals(1, additional.size());
    assertTrue(additional.get("workflow") instanceof Map);
    assertEquals(3L, signal.getAttributes().getCustom().get("count"));

    String json = JsonSupport.toJson(signal);
    assertTrue(json.contains("\"workflow\":{\"triage\":\"open\"}"), json);
    assertTrue(json.contains("\"count\":3,"), json);
    assertEquals(signal, JsonSupport.fromJson(json, SecurityMonitoringSignal.class));
  }

  @Test
  void additionalPropertyOverridesDeclaredOne() {
    LogsQueryFilter filter = new LogsQueryFilter().query("service:web");
    filter.putAdditionalProperty("query", "service:api");

    Map<?, ?> json = (Map<?, ?>) JsonSupport.toJsonValue(filter);
    assertEquals("service:api", json.get("query"));
  }

  @Test
  void unknownEnumValueKeepsRawObject() throws Exception {
    String json = "{\"state\":\"escalated\",\"archive_comment\":\"n/a\",\"version\":3}";

    SecurityMonitoringSignalStateUpdateAttributes attributes =
        JsonSupport.fromJson(json, SecurityMonitoringSignalStateUpdateAttributes.class);

    assertTrue(attributes.isUnparsed());
    assertNull(attributes.getState());
    assertEquals("escalated", attributes.getUnparsedObject().get("state"));
    assertEquals(3L, attributes.getUnparsedObject().get("version"));
    assertEquals(json, JsonSupport.toJson(attributes));
  }

  @Test
  void unparsedChildMarksParent() throws Exception {
    String json =
        "{\"data\":[{\"id\":\"A\",\"type\":\"signal\"},{\"id\":\"B\",\"type\":\"alert\"}]}";

    SecurityMonitoringSignalsListResponse response =
        JsonSupport.fromJson(json, SecurityMonitoringSignalsListResponse.class);

    assertTrue(response.isUnparsed());
    assertEquals(2, response.getData().size());
    assertFalse(response.getData().get(0).isUnparsed());
    assertTrue(response.getData().get(1).isUnparsed());
    assertEquals("B", response.getData().get(1).getUnparsedObject().get("id"));
  }

  @Test
  void missingRequiredPropertyFailsOutermostModel() {
    JsonDataException e =
        assertThrows(
            JsonDataException.class,
            () -> JsonSupport.fromJson("{\"type\":\"incidents\"}", IncidentResponseData.class));
    assertEquals("required field id missing", e.getMessage());
  }

  @Test
  void nestedMissingRequiredPropertyKeepsRawObject() throws Exception {
    String json = "{\"data\":{\"id\":\"123\",\"type\":\"incidents\",\"attributes\":{}}}";

    IncidentResponse response = JsonSupport.fromJson(json, IncidentResponse.class);

    assertTrue(response.isUnparsed());
    assertEquals("123", response.getData().getId());
    assertTrue(response.getData().getAttributes().isUnparsed());
    assertNull(response.getData().getAttributes().getTitle());
    assertEquals(json, JsonSupport.toJson(response));
  }

  @Test
  void listItemWithoutIdKeepsOtherItems() throws Exception {
    String json =
        "{\"data\":[{\"id\":\"1\",\"type\":\"incidents\"},{\"type\":\"incidents\"}]}";

    IncidentsResponse response = JsonSupport.fromJson(json, IncidentsResponse.class);

    assertTrue(response.isUnparsed());
    assertEquals(2, response.getData().size());
    assertEquals("1", response.getData().get(0).getId());
    assertFalse(response.getData().get(0).isUnparsed());
    IncidentResponseData broken = response.getData().get(1);
    assertTrue(broken.isUnparsed());
    assertNull(broken.getId());
    assertNull(broken.getType());
    assertEquals("incidents", broken.getUnparsedObject().get("type"));
  }

  @Test
  void requiredPropertySet() throws Exception {
    String json =
        "{\"data\":{\"id\":\"123\",\"type\":\"incidents\",\"attributes\":{\"title\":\"Outage\"}}}";

    IncidentResponse response = JsonSupport.fromJson(json, IncidentResponse.class);

    assertEquals("Outage", response.getData().getAttributes().getTitle());
    assertEquals(IncidentType.INCIDENTS, response.getData().getType());
  }

  @Test
  void nullFieldsAreOmitted() {
    LogsListRequest request = new LogsListRequest().sort(LogsSort.TIMESTAMP_DESCENDING);

    assertEquals("{\"sort\":\"-timestamp\"}", JsonSupport.toJson(request));
  }

  @Test
  void defaultsAreWritten() {
    assertEquals(
        "{\"from\":\"now-15m\",\"query\":\"*\",\"to\":\"now\"}",
        JsonSupport.toJson(new LogsQueryFilter()));
  }

  @Test
  void decodedModelsOnlyCarryReceivedFields() throws Exception {
    String json = "{\"indexes\":[\"main\"]}";

    LogsQueryFilter filter = JsonSupport.fromJson(json, LogsQueryFilter.class);

    assertFalse(filter.hasFrom());
    assertFalse(filter.hasQuery());
    assertTrue(filter.hasIndexes());
    assertEquals(json, JsonSupport.toJson(filter));
    assertNotEquals(new LogsQueryFilter().indexes(Arrays.asList("main")), filter);
  }

  @Test
  void presenceChecks() {
    LogsQueryFilter filter = new LogsQueryFilter();

    assertTrue(filter.hasFrom());
    assertFalse(filter.hasIndexes());
    assertFalse(filter.hasStorageTier());
    filter.setFrom(null);
    filter.addIndexItem("main");
    assertFalse(filter.hasFrom());
    assertTrue(filter.hasIndexes());
  }

  @Test
  void largeNumbersKeepEveryDigit() throws Exception {
    String json =
        "{\"page\":{\"total_count\":9007199254740993},"
            + "\"huge\":123456789012345678901234567890,\"ratio\":0.25}";

    ResponseMetaAttributes meta = JsonSupport.fromJson(json, ResponseMetaAttributes.class);

    assertEquals(9007199254740993L, meta.getPage().getTotalCount().longValue());
    assertEquals(
        new BigDecimal("123456789012345678901234567890"), meta.getAdditionalProperty("huge"));
    assertEquals(0.25, meta.getAdditionalProperty("ratio"));
    assertEquals(json, JsonSupport.toJson(meta));
  }

  @Test
  void oneOfSelectsTheOnlyMatchingSchema() throws Exception {
    String json =
        "{\"id\":\"abc\",\"name\":\"Correlation\","
            + "\"queries\":[{\"correlatedByFields\":[\"host\"],\"ruleId\":\"def\"}],"
            + "\"type\":\"signal_correlation\"}";

    SecurityMonitoringRuleResponse rule =
        JsonSupport.fromJson(json, SecurityMonitoringRuleResponse.class);

    assertFalse(rule.isUnparsed());
    assertTrue(rule.isSecurityMonitoringSignalRuleResponse());
    SecurityMonitoringSignalRuleResponse signalRule =
        rule.getSecurityMonitoringSignalRuleResponse();
    assertEquals(SecurityMonitoringSignalRuleType.SIGNAL_CORRELATION, signalRule.getType());
    assertEquals("def", signalRule.getQueries().get(0).getRuleId());
    assertThrows(ClassCastException.class, rule::getSecurityMonitoringStandardRuleResponse);
    assertEquals(json, JsonSupport.toJson(rule));
  }

  @Test
  void oneOfStandardRule() throws Exception {
    String json =
        "{\"id\":\"abc\",\"type\":\"log_detection\",\"queries\":[{\"query\":\"source:nginx\"}]}";

    SecurityMonitoringRuleResponse rule =
        JsonSupport.fromJson(json, SecurityMonitoringRuleResponse.class);

    assertTrue(rule.isSecurityMonitoringStandardRuleResponse());
    assertEquals(
        "source:nginx",
        rule.getSecurityMonitoringStandardRuleResponse().getQueries().get(0).getQuery());
  }

  @Test
  void oneOfWithoutMatchKeepsRawObject() throws Exception {
    String json = "{\"id\":\"abc\",\"type\":\"anomaly_detection\"}";

    SecurityMonitoringRuleResponse rule =
        JsonSupport.fromJson(json, SecurityMonitoringRuleResponse.class);

    assertTrue(rule.isUnparsed());
    assertNull(rule.getActualInstance());
    assertEquals("anomaly_detection", rule.getUnparsedObject().get("type"));
    assertEquals(json, JsonSupport.toJson(rule));
  }

  @Test
  void oneOfWithSeveralMatchesKeepsRawObject() throws Exception {
    SecurityMonitoringRuleResponse rule =
        JsonSupport.fromJson("{\"id\":\"abc\"}", SecurityMonitoringRuleResponse.class);

    assertTrue(rule.isUnparsed());
  }

  @Test
  void oneOfRejectsOtherTypes() {
    SecurityMonitoringRuleResponse rule =
        new SecurityMonitoringRuleResponse(new SecurityMonitoringStandardRuleResponse().id("a"));

    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> rule.setActualInstance("rule"));
    assertEquals(
        "Invalid instance type. Must be one of SecurityMonitoringStandardRuleResponse, "
            + "SecurityMonitoringSignalRuleResponse",
        e.getMessage());
  }

  @Test
  void modelEquality() {
    SecurityMonitoringSignalStateUpdateAttributes first =
        new SecurityMonitoringSignalStateUpdateAttributes(SecurityMonitoringSignalState.ARCHIVED);
    SecurityMonitoringSignalStateUpdateAttributes second =
        new SecurityMonitoringSignalStateUpdateAttributes(SecurityMonitoringSignalState.ARCHIVED);

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    second.putAdditionalProperty("extra", true);
    assertNotEquals(first, second);
    assertEquals(
        "SecurityMonitoringSignalStateUpdateAttributes{\"state\":\"archived\",\"extra\":true}",
        second.toString());
  }

  @Test
  void dateTimeFormat() {
    assertEquals(
        "2021-01-01T10:00:00Z",
        OffsetDateTimeJsonAdapter.format(
            OffsetDateTime.of(2021, 1, 1, 10, 0, 0, 0, ZoneOffset.UTC)));
    assertEquals(
        "2021-01-01T10:00:00.120+02:00",
        OffsetDateTimeJsonAdapter.format(
            OffsetDateTime.of(2021, 1, 1, 10, 0, 0, 120_000_000, ZoneOffset.ofHours(2))));
    assertThrows(
        JsonDataException.class,
        () -> JsonSupport.fromJson("\"yesterday\"", OffsetDateTime.class));
  }

  @Test
  void enumFromValue() {
    assertEquals(LogsSort.TIMESTAMP_DESCENDING, LogsSort.fromValue("-timestamp"));
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> LogsSort.fromValue("desc"));
    assertEquals("Unexpected value 'desc' for LogsSort", e.getMessage());
  }
}
