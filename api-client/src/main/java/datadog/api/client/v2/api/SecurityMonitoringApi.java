package datadog.api.client.v2.api;

import datadog.api.client.ApiClient;
import datadog.api.client.ApiException;
import datadog.api.client.ApiResponse;
import datadog.api.client.Configuration;
import datadog.api.client.PaginationIterable;
import datadog.api.client.Pair;
import datadog.api.client.v2.model.APIErrorResponse;
import datadog.api.client.v2.model.SecurityMonitoringListRulesResponse;
import datadog.api.client.v2.model.SecurityMonitoringRuleResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignal;
import datadog.api.client.v2.model.SecurityMonitoringSignalListRequest;
import datadog.api.client.v2.model.SecurityMonitoringSignalListRequestPage;
import datadog.api.client.v2.model.SecurityMonitoringSignalResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalStateUpdateRequest;
import datadog.api.client.v2.model.SecurityMonitoringSignalTriageUpdateResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalsListResponse;
import datadog.api.client.v2.model.SecurityMonitoringSignalsListResponseMeta;
import datadog.api.client.v2.model.SecurityMonitoringSignalsSort;
import java.lang.reflect.Type;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Security signals and detection rules. */
public class SecurityMonitoringApi {
  private static final String[] AUTH_NAMES = {
    Configuration.API_KEY_AUTH, Configuration.APP_KEY_AUTH
  };

  private static final Map<Integer, Type> ERROR_TYPES;

  static {
    Map<Integer, Type> errorTypes = new HashMap<>();
    for (int code : new int[] {400, 403, 404, 429}) {
      errorTypes.put(code, APIErrorResponse.class);
    }
    ERROR_TYPES = Collections.unmodifiableMap(errorTypes);
  }

  private ApiClient apiClient;

  public SecurityMonitoringApi() {
    this(ApiClient.getDefaultApiClient());
  }

  public SecurityMonitoringApi(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public ApiClient getApiClient() {
    return apiClient;
  }

  public void setApiClient(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  /** Optional parameters of {@link #listSecurityMonitoringSignals}. */
  public static class ListSecurityMonitoringSignalsOptionalParameters {
    private String filterQuery;
    private OffsetDateTime filterFrom;
    private OffsetDateTime filterTo;
    private SecurityMonitoringSignalsSort sort;
    private String pageCursor;
    private Integer pageLimit;

    /** The search query for security signals. */
    public ListSecurityMonitoringSignalsOptionalParameters filterQuery(String filterQuery) {
      this.filterQuery = filterQuery;
      return this;
    }

    /** The minimum timestamp for requested security signals. */
    public ListSecurityMonitoringSignalsOptionalParameters filterFrom(OffsetDateTime filterFrom) {
      this.filterFrom = filterFrom;
      return this;
    }

    /** The maximum timestamp for requested security signals. */
    public ListSecurityMonitoringSignalsOptionalParameters filterTo(OffsetDateTime filterTo) {
      this.filterTo = filterTo;
      return this;
    }

    public ListSecurityMonitoringSignalsOptionalParameters sort(
        SecurityMonitoringSignalsSort sort) {
      this.sort = sort;
      return this;
    }

    /** A list of results using the cursor provided in the previous query. */
    public ListSecurityMonitoringSignalsOptionalParameters pageCursor(String pageCursor) {
      this.pageCursor = pageCursor;
      return this;
    }

    /** The maximum number of security signals in the response. */
    public ListSecurityMonitoringSignalsOptionalParameters pageLimit(Integer pageLimit) {
      this.pageLimit = pageLimit;
      return this;
    }
  }

  public SecurityMonitoringSignalsListResponse listSecurityMonitoringSignals()
      throws ApiException {
    return listSecurityMonitoringSignalsWithHttpInfo(
            new ListSecurityMonitoringSignalsOptionalParameters())
        .getData();
  }

  public SecurityMonitoringSignalsListResponse listSecurityMonitoringSignals(
      ListSecurityMonitoringSignalsOptionalParameters parameters) throws ApiException {
    return listSecurityMonitoringSignalsWithHttpInfo(parameters).getData();
  }

  /**
   * Returns the security signals that match a search query, one page at a time.
   *
   * @see #listSecurityMonitoringSignalsWithPagination(
   *     ListSecurityMonitoringSignalsOptionalParameters)
   */
  public ApiResponse<SecurityMonitoringSignalsListResponse>
      listSecurityMonitoringSignalsWithHttpInfo(
          ListSecurityMonitoringSignalsOptionalParameters parameters) throws ApiException {
    List<Pair> queryParams = new ArrayList<>();
    queryParams.addAll(ApiClient.parameterToPairs("filter[query]", parameters.filterQuery));
    queryParams.addAll(ApiClient.parameterToPairs("filter[from]", parameters.filterFrom));
    queryParams.addAll(ApiClient.parameterToPairs("filter[to]", parameters.filterTo));
    queryParams.addAll(ApiClient.parameterToPairs("sort", parameters.sort));
    queryParams.addAll(ApiClient.parameterToPairs("page[cursor]", parameters.pageCursor));
    queryParams.addAll(ApiClient.parameterToPairs("page[limit]", parameters.pageLimit));
    return apiClient.invokeApi(
        "v2.listSecurityMonitoringSignals",
        "GET",
        "/api/v2/security_monitoring/signals",
        queryParams,
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        SecurityMonitoringSignalsListResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<SecurityMonitoringSignal>
      listSecurityMonitoringSignalsWithPagination() {
    return listSecurityMonitoringSignalsWithPagination(
        new ListSecurityMonitoringSignalsOptionalParameters());
  }

  /**
   * Iterates over every security signal matching the query, following {@code meta.page.after}.
   * The page cursor of {@code parameters} is updated as pages are fetched.
   */
  public PaginationIterable<SecurityMonitoringSignal> listSecurityMonitoringSignalsWithPagination(
      final ListSecurityMonitoringSignalsOptionalParameters parameters) {
    if (parameters.pageLimit == null) {
      parameters.pageLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        parameters.pageLimit,
        () -> listSecurityMonitoringSignals(parameters),
        SecurityMonitoringSignalsListResponse::getData,
        page -> {
          String cursor = nextCursor(page);
          if (cursor == null) {
            return false;
          }
          parameters.pageCursor(cursor);
          return true;
        });
  }

  /** Optional parameters of {@link #searchSecurityMonitoringSignals}. */
  public static class SearchSecurityMonitoringSignalsOptionalParameters {
    private SecurityMonitoringSignalListRequest body;

    public SearchSecurityMonitoringSignalsOptionalParameters body(
        SecurityMonitoringSignalListRequest body) {
      this.body = body;
      return this;
    }
  }

  public SecurityMonitoringSignalsListResponse searchSecurityMonitoringSignals()
      throws ApiException {
    return searchSecurityMonitoringSignalsWithHttpInfo(
            new SearchSecurityMonitoringSignalsOptionalParameters())
        .getData();
  }

  public SecurityMonitoringSignalsListResponse searchSecurityMonitoringSignals(
      SearchSecurityMonitoringSignalsOptionalParameters parameters) throws ApiException {
    return searchSecurityMonitoringSignalsWithHttpInfo(parameters).getData();
  }

  public ApiResponse<SecurityMonitoringSignalsListResponse>
      searchSecurityMonitoringSignalsWithHttpInfo(
          SearchSecurityMonitoringSignalsOptionalParameters parameters) throws ApiException {
    return apiClient.invokeApi(
        "v2.searchSecurityMonitoringSignals",
        "POST",
        "/api/v2/security_monitoring/signals/search",
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        parameters.body,
        AUTH_NAMES,
        SecurityMonitoringSignalsListResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<SecurityMonitoringSignal>
      searchSecurityMonitoringSignalsWithPagination() {
    return searchSecurityMonitoringSignalsWithPagination(
        new SearchSecurityMonitoringSignalsOptionalParameters());
  }

  /**
   * Iterates over every security signal matching the search request, writing the next cursor into
   * {@code page.cursor} of the request body.
   */
  public PaginationIterable<SecurityMonitoringSignal>
      searchSecurityMonitoringSignalsWithPagination(
          final SearchSecurityMonitoringSignalsOptionalParameters parameters) {
    if (parameters.body == null) {
      parameters.body(new SecurityMonitoringSignalListRequest());
    }
    if (parameters.body.getPage() == null) {
      parameters.body.setPage(new SecurityMonitoringSignalListRequestPage());
    }
    final SecurityMonitoringSignalListRequestPage requestPage = parameters.body.getPage();
    if (requestPage.getLimit() == null) {
      requestPage.setLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        requestPage.getLimit(),
        () -> searchSecurityMonitoringSignals(parameters),
        SecurityMonitoringSignalsListResponse::getData,
        page -> {
          String cursor = nextCursor(page);
          if (cursor == null) {
            return false;
          }
          requestPage.setCursor(cursor);
          return true;
        });
  }

  @Nullable
  private static String nextCursor(SecurityMonitoringSignalsListResponse page) {
    SecurityMonitoringSignalsListResponseMeta meta = page.getMeta();
    if (meta == null || meta.getPage() == null) {
      return null;
    }
    String after = meta.getPage().getAfter();
    return after == null || after.isEmpty() ? null : after;
  }

  public SecurityMonitoringSignalResponse getSecurityMonitoringSignal(String signalId)
      throws ApiException {
    return getSecurityMonitoringSignalWithHttpInfo(signalId).getData();
  }

  public ApiResponse<SecurityMonitoringSignalResponse> getSecurityMonitoringSignalWithHttpInfo(
      String signalId) throws ApiException {
    ApiClient.requireParameter(signalId, "signalId", "getSecurityMonitoringSignal");
    return apiClient.invokeApi(
        "v2.getSecurityMonitoringSignal",
        "GET",
        "/api/v2/security_monitoring/signals/" + ApiClient.escapeString(signalId),
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        SecurityMonitoringSignalResponse.class,
        ERROR_TYPES);
  }

  public SecurityMonitoringSignalTriageUpdateResponse editSecurityMonitoringSignalState(
      String signalId, SecurityMonitoringSignalStateUpdateRequest body) throws ApiException {
    return editSecurityMonitoringSignalStateWithHttpInfo(signalId, body).getData();
  }

  /** Changes the triage state of a security signal. */
  public ApiResponse<SecurityMonitoringSignalTriageUpdateResponse>
      editSecurityMonitoringSignalStateWithHttpInfo(
          String signalId, SecurityMonitoringSignalStateUpdateRequest body) throws ApiException {
    ApiClient.requireParameter(signalId, "signalId", "editSecurityMonitoringSignalState");
    ApiClient.requireParameter(body, "body", "editSecurityMonitoringSignalState");
    return apiClient.invokeApi(
        "v2.editSecurityMonitoringSignalState",
        "PATCH",
        "/api/v2/security_monitoring/signals/" + ApiClient.escapeString(signalId) + "/state",
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        body,
        AUTH_NAMES,
        SecurityMonitoringSignalTriageUpdateResponse.class,
        ERROR_TYPES);
  }

  public SecurityMonitoringRuleResponse getSecurityMonitoringRule(String ruleId)
      throws ApiException {
    return getSecurityMonitoringRuleWithHttpInfo(ruleId).getData();
  }

  /**
   * Returns a rule, which is either a {@link
   * datadog.api.client.v2.model.SecurityMonitoringStandardRuleResponse} or a {@link
   * datadog.api.client.v2.model.SecurityMonitoringSignalRuleResponse}.
   */
  public ApiResponse<SecurityMonitoringRuleResponse> getSecurityMonitoringRuleWithHttpInfo(
      String ruleId) throws ApiException {
    ApiClient.requireParameter(ruleId, "ruleId", "getSecurityMonitoringRule");
    return apiClient.invokeApi(
        "v2.getSecurityMonitoringRule",
        "GET",
        "/api/v2/security_monitoring/rules/" + ApiClient.escapeString(ruleId),
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        SecurityMonitoringRuleResponse.class,
        ERROR_TYPES);
  }

  /** Optional parameters of {@link #listSecurityMonitoringRules}. */
  public static class ListSecurityMonitoringRulesOptionalParameters {
    private Long pageSize;
    private Long pageNumber;

    /** Size for a given page. The maximum allowed value is 100. */
    public ListSecurityMonitoringRulesOptionalParameters pageSize(Long pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /** Specific page number to return. */
    public ListSecurityMonitoringRulesOptionalParameters pageNumber(Long pageNumber) {
      this.pageNumber = pageNumber;
      return this;
    }
  }

  public SecurityMonitoringListRulesResponse listSecurityMonitoringRules() throws ApiException {
    return listSecurityMonitoringRulesWithHttpInfo(
            new ListSecurityMonitoringRulesOptionalParameters())
        .getData();
  }

  public SecurityMonitoringListRulesResponse listSecurityMonitoringRules(
      ListSecurityMonitoringRulesOptionalParameters parameters) throws ApiException {
    return listSecurityMonitoringRulesWithHttpInfo(parameters).getData();
  }

  public ApiResponse<SecurityMonitoringListRulesResponse> listSecurityMonitoringRulesWithHttpInfo(
      ListSecurityMonitoringRulesOptionalParameters parameters) throws ApiException {
    List<Pair> queryParams = new ArrayList<>();
    queryParams.addAll(ApiClient.parameterToPairs("page[size]", parameters.pageSize));
    queryParams.addAll(ApiClient.parameterToPairs("page[number]", parameters.pageNumber));
    return apiClient.invokeApi(
        "v2.listSecurityMonitoringRules",
        "GET",
        "/api/v2/security_monitoring/rules",
        queryParams,
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        SecurityMonitoringListRulesResponse.class,
        ERROR_TYPES);
  }

  public void deleteSecurityMonitoringRule(String ruleId) throws ApiException {
    deleteSecurityMonitoringRuleWithHttpInfo(ruleId);
  }

  public ApiResponse<Void> deleteSecurityMonitoringRuleWithHttpInfo(String ruleId)
      throws ApiException {
    ApiClient.requireParameter(ruleId, "ruleId", "deleteSecurityMonitoringRule");
    return apiClient.invokeApi(
        "v2.deleteSecurityMonitoringRule",
        "DELETE",
        "/api/v2/security_monitoring/rules/" + ApiClient.escapeString(ruleId),
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        null,
        ERROR_TYPES);
  }
}
