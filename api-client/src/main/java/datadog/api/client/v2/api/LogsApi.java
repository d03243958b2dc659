package datadog.api.client.v2.api;

import datadog.api.client.ApiClient;
import datadog.api.client.ApiException;
import datadog.api.client.ApiResponse;
import datadog.api.client.Configuration;
import datadog.api.client.PaginationIterable;
import datadog.api.client.Pair;
import datadog.api.client.v2.model.APIErrorResponse;
import datadog.api.client.v2.model.ContentEncoding;
import datadog.api.client.v2.model.HTTPLogErrors;
import datadog.api.client.v2.model.HTTPLogItem;
import datadog.api.client.v2.model.Log;
import datadog.api.client.v2.model.LogsListRequest;
import datadog.api.client.v2.model.LogsListRequestPage;
import datadog.api.client.v2.model.LogsListResponse;
import datadog.api.client.v2.model.LogsResponseMetadata;
import datadog.api.client.v2.model.LogsSort;
import datadog.api.client.v2.model.LogsStorageTier;
import java.lang.reflect.Type;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Search and submit logs. */
public class LogsApi {
  private static final String[] AUTH_NAMES = {
    Configuration.API_KEY_AUTH, Configuration.APP_KEY_AUTH
  };
  private static final String[] SUBMIT_AUTH_NAMES = {Configuration.API_KEY_AUTH};

  private static final Map<Integer, Type> ERROR_TYPES;
  private static final Map<Integer, Type> SUBMIT_ERROR_TYPES;

  static {
    Map<Integer, Type> errorTypes = new HashMap<>();
    for (int code : new int[] {400, 403, 429}) {
      errorTypes.put(code, APIErrorResponse.class);
    }
    ERROR_TYPES = Collections.unmodifiableMap(errorTypes);

    Map<Integer, Type> submitErrorTypes = new HashMap<>();
    for (int code : new int[] {400, 401, 403, 408, 413, 429, 500, 503}) {
      submitErrorTypes.put(code, HTTPLogErrors.class);
    }
    SUBMIT_ERROR_TYPES = Collections.unmodifiableMap(submitErrorTypes);
  }

  private ApiClient apiClient;

  public LogsApi() {
    this(ApiClient.getDefaultApiClient());
  }

  public LogsApi(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public ApiClient getApiClient() {
    return apiClient;
  }

  public void setApiClient(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  /** Optional parameters of {@link #listLogs}. */
  public static class ListLogsOptionalParameters {
    private LogsListRequest body;

    public ListLogsOptionalParameters body(LogsListRequest body) {
      this.body = body;
      return this;
    }
  }

  public LogsListResponse listLogs() throws ApiException {
    return listLogsWithHttpInfo(new ListLogsOptionalParameters()).getData();
  }

  public LogsListResponse listLogs(ListLogsOptionalParameters parameters) throws ApiException {
    return listLogsWithHttpInfo(parameters).getData();
  }

  /** Returns the logs matching a search request, one page at a time. */
  public ApiResponse<LogsListResponse> listLogsWithHttpInfo(ListLogsOptionalParameters parameters)
      throws ApiException {
    return apiClient.invokeApi(
        "v2.listLogs",
        "POST",
        "/api/v2/logs/events/search",
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        parameters.body,
        AUTH_NAMES,
        LogsListResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<Log> listLogsWithPagination() {
    return listLogsWithPagination(new ListLogsOptionalParameters());
  }

  /** Iterates over every log matching the search request, following {@code meta.page.after}. */
  public PaginationIterable<Log> listLogsWithPagination(
      final ListLogsOptionalParameters parameters) {
    if (parameters.body == null) {
      parameters.body(new LogsListRequest());
    }
    if (parameters.body.getPage() == null) {
      parameters.body.setPage(new LogsListRequestPage());
    }
    final LogsListRequestPage requestPage = parameters.body.getPage();
    if (requestPage.getLimit() == null) {
      requestPage.setLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        requestPage.getLimit(),
        () -> listLogs(parameters),
        LogsListResponse::getData,
        page -> {
          String cursor = nextCursor(page);
          if (cursor == null) {
            return false;
          }
          requestPage.setCursor(cursor);
          return true;
        });
  }

  /** Optional parameters of {@link #listLogsGet}. */
  public static class ListLogsGetOptionalParameters {
    private String filterQuery;
    private List<String> filterIndexes;
    private OffsetDateTime filterFrom;
    private OffsetDateTime filterTo;
    private LogsStorageTier filterStorageTier;
    private LogsSort sort;
    private String pageCursor;
    private Integer pageLimit;

    /** Search query following logs syntax. */
    public ListLogsGetOptionalParameters filterQuery(String filterQuery) {
      this.filterQuery = filterQuery;
      return this;
    }

    /** For customers with multiple indexes, the indexes to search. */
    public ListLogsGetOptionalParameters filterIndexes(List<String> filterIndexes) {
      this.filterIndexes = filterIndexes;
      return this;
    }

    public ListLogsGetOptionalParameters filterFrom(OffsetDateTime filterFrom) {
      this.filterFrom = filterFrom;
      return this;
    }

    public ListLogsGetOptionalParameters filterTo(OffsetDateTime filterTo) {
      this.filterTo = filterTo;
      return this;
    }

    public ListLogsGetOptionalParameters filterStorageTier(LogsStorageTier filterStorageTier) {
      this.filterStorageTier = filterStorageTier;
      return this;
    }

    public ListLogsGetOptionalParameters sort(LogsSort sort) {
      this.sort = sort;
      return this;
    }

    /** List following results with a cursor provided in the previous query. */
    public ListLogsGetOptionalParameters pageCursor(String pageCursor) {
      this.pageCursor = pageCursor;
      return this;
    }

    /** Maximum number of logs in the response. */
    public ListLogsGetOptionalParameters pageLimit(Integer pageLimit) {
      this.pageLimit = pageLimit;
      return this;
    }
  }

  public LogsListResponse listLogsGet() throws ApiException {
    return listLogsGetWithHttpInfo(new ListLogsGetOptionalParameters()).getData();
  }

  public LogsListResponse listLogsGet(ListLogsGetOptionalParameters parameters)
      throws ApiException {
    return listLogsGetWithHttpInfo(parameters).getData();
  }

  public ApiResponse<LogsListResponse> listLogsGetWithHttpInfo(
      ListLogsGetOptionalParameters parameters) throws ApiException {
    List<Pair> queryParams = new ArrayList<>();
    queryParams.addAll(ApiClient.parameterToPairs("filter[query]", parameters.filterQuery));
    queryParams.addAll(
        ApiClient.parameterToPairs("csv", "filter[indexes]", parameters.filterIndexes));
    queryParams.addAll(ApiClient.parameterToPairs("filter[from]", parameters.filterFrom));
    queryParams.addAll(ApiClient.parameterToPairs("filter[to]", parameters.filterTo));
    queryParams.addAll(
        ApiClient.parameterToPairs("filter[storage_tier]", parameters.filterStorageTier));
    queryParams.addAll(ApiClient.parameterToPairs("sort", parameters.sort));
    queryParams.addAll(ApiClient.parameterToPairs("page[cursor]", parameters.pageCursor));
    queryParams.addAll(ApiClient.parameterToPairs("page[limit]", parameters.pageLimit));
    return apiClient.invokeApi(
        "v2.listLogsGet",
        "GET",
        "/api/v2/logs/events",
        queryParams,
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        LogsListResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<Log> listLogsGetWithPagination() {
    return listLogsGetWithPagination(new ListLogsGetOptionalParameters());
  }

  public PaginationIterable<Log> listLogsGetWithPagination(
      final ListLogsGetOptionalParameters parameters) {
    if (parameters.pageLimit == null) {
      parameters.pageLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        parameters.pageLimit,
        () -> listLogsGet(parameters),
        LogsListResponse::getData,
        page -> {
          String cursor = nextCursor(page);
          if (cursor == null) {
            return false;
          }
          parameters.pageCursor(cursor);
          return true;
        });
  }

  @Nullable
  private static String nextCursor(LogsListResponse page) {
    LogsResponseMetadata meta = page.getMeta();
    if (meta == null || meta.getPage() == null) {
      return null;
    }
    String after = meta.getPage().getAfter();
    return after == null || after.isEmpty() ? null : after;
  }

  /** Optional parameters of {@link #submitLog}. */
  public static class SubmitLogOptionalParameters {
    private ContentEncoding contentEncoding;
    private String ddtags;

    /** Compresses the request body. */
    public SubmitLogOptionalParameters contentEncoding(ContentEncoding contentEncoding) {
      this.contentEncoding = contentEncoding;
      return this;
    }

    /** Log tags can be passed as query parameters with {@code text/plain} content type. */
    public SubmitLogOptionalParameters ddtags(String ddtags) {
      this.ddtags = ddtags;
      return this;
    }
  }

  public Object submitLog(List<HTTPLogItem> body) throws ApiException {
    return submitLogWithHttpInfo(body, new SubmitLogOptionalParameters()).getData();
  }

  public Object submitLog(List<HTTPLogItem> body, SubmitLogOptionalParameters parameters)
      throws ApiException {
    return submitLogWithHttpInfo(body, parameters).getData();
  }

  /**
   * Sends logs to the logs intake, which has its own servers: see {@link
   * Configuration#getOperationServers(String)}. The request is authenticated by the API key only.
   */
  public ApiResponse<Object> submitLogWithHttpInfo(
      List<HTTPLogItem> body, SubmitLogOptionalParameters parameters) throws ApiException {
    ApiClient.requireParameter(body, "body", "submitLog");
    Map<String, String> headerParams = new HashMap<>();
    if (parameters.contentEncoding != null) {
      headerParams.put("Content-Encoding", parameters.contentEncoding.getValue());
    }
    return apiClient.invokeApi(
        "v2.submitLog",
        "POST",
        "/api/v2/logs",
        ApiClient.parameterToPairs("ddtags", parameters.ddtags),
        headerParams,
        body,
        SUBMIT_AUTH_NAMES,
        Object.class,
        SUBMIT_ERROR_TYPES);
  }
}
