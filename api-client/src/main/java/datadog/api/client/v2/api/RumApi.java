package datadog.api.client.v2.api;

import datadog.api.client.ApiClient;
import datadog.api.client.ApiException;
import datadog.api.client.ApiResponse;
import datadog.api.client.Configuration;
import datadog.api.client.PaginationIterable;
import datadog.api.client.Pair;
import datadog.api.client.v2.model.APIErrorResponse;
import datadog.api.client.v2.model.RUMEvent;
import datadog.api.client.v2.model.RUMEventsResponse;
import datadog.api.client.v2.model.RUMQueryPageOptions;
import datadog.api.client.v2.model.RUMResponseMetadata;
import datadog.api.client.v2.model.RUMSearchEventsRequest;
import datadog.api.client.v2.model.RUMSort;
import java.lang.reflect.Type;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/** Search Real User Monitoring events. */
public class RumApi {
  private static final String[] AUTH_NAMES = {
    Configuration.API_KEY_AUTH, Configuration.APP_KEY_AUTH
  };

  private static final Map<Integer, Type> ERROR_TYPES;

  static {
    Map<Integer, Type> errorTypes = new HashMap<>();
    for (int code : new int[] {400, 403, 429}) {
      errorTypes.put(code, APIErrorResponse.class);
    }
    ERROR_TYPES = Collections.unmodifiableMap(errorTypes);
  }

  private ApiClient apiClient;

  public RumApi() {
    this(ApiClient.getDefaultApiClient());
  }

  public RumApi(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public ApiClient getApiClient() {
    return apiClient;
  }

  public void setApiClient(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  /** Optional parameters of {@link #listRUMEvents}. */
  public static class ListRUMEventsOptionalParameters {
    private String filterQuery;
    private OffsetDateTime filterFrom;
    private OffsetDateTime filterTo;
    private RUMSort sort;
    private String pageCursor;
    private Integer pageLimit;

    /** Search query following RUM syntax. */
    public ListRUMEventsOptionalParameters filterQuery(String filterQuery) {
      this.filterQuery = filterQuery;
      return this;
    }

    public ListRUMEventsOptionalParameters filterFrom(OffsetDateTime filterFrom) {
      this.filterFrom = filterFrom;
      return this;
    }

    public ListRUMEventsOptionalParameters filterTo(OffsetDateTime filterTo) {
      this.filterTo = filterTo;
      return this;
    }

    public ListRUMEventsOptionalParameters sort(RUMSort sort) {
      this.sort = sort;
      return this;
    }

    public ListRUMEventsOptionalParameters pageCursor(String pageCursor) {
      this.pageCursor = pageCursor;
      return this;
    }

    /** Maximum number of events in the response. */
    public ListRUMEventsOptionalParameters pageLimit(Integer pageLimit) {
      this.pageLimit = pageLimit;
      return this;
    }
  }

  public RUMEventsResponse listRUMEvents() throws ApiException {
    return listRUMEventsWithHttpInfo(new ListRUMEventsOptionalParameters()).getData();
  }

  public RUMEventsResponse listRUMEvents(ListRUMEventsOptionalParameters parameters)
      throws ApiException {
    return listRUMEventsWithHttpInfo(parameters).getData();
  }

  public ApiResponse<RUMEventsResponse> listRUMEventsWithHttpInfo(
      ListRUMEventsOptionalParameters parameters) throws ApiException {
    List<Pair> queryParams = new ArrayList<>();
    queryParams.addAll(ApiClient.parameterToPairs("filter[query]", parameters.filterQuery));
    queryParams.addAll(ApiClient.parameterToPairs("filter[from]", parameters.filterFrom));
    queryParams.addAll(ApiClient.parameterToPairs("filter[to]", parameters.filterTo));
    queryParams.addAll(ApiClient.parameterToPairs("sort", parameters.sort));
    queryParams.addAll(ApiClient.parameterToPairs("page[cursor]", parameters.pageCursor));
    queryParams.addAll(ApiClient.parameterToPairs("page[limit]", parameters.pageLimit));
    return apiClient.invokeApi(
        "v2.listRUMEvents",
        "GET",
        "/api/v2/rum/events",
        queryParams,
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        RUMEventsResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<RUMEvent> listRUMEventsWithPagination() {
    return listRUMEventsWithPagination(new ListRUMEventsOptionalParameters());
  }

  public PaginationIterable<RUMEvent> listRUMEventsWithPagination(
      final ListRUMEventsOptionalParameters parameters) {
    if (parameters.pageLimit == null) {
      parameters.pageLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        parameters.pageLimit,
        () -> listRUMEvents(parameters),
        RUMEventsResponse::getData,
        page -> {
          String cursor = nextCursor(page);
          if (cursor == null) {
            return false;
          }
          parameters.pageCursor(cursor);
          return true;
        });
  }

  public RUMEventsResponse searchRUMEvents(RUMSearchEventsRequest body) throws ApiException {
    return searchRUMEventsWithHttpInfo(body).getData();
  }

  public ApiResponse<RUMEventsResponse> searchRUMEventsWithHttpInfo(RUMSearchEventsRequest body)
      throws ApiException {
    ApiClient.requireParameter(body, "body", "searchRUMEvents");
    return apiClient.invokeApi(
        "v2.searchRUMEvents",
        "POST",
        "/api/v2/rum/events/search",
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        body,
        AUTH_NAMES,
        RUMEventsResponse.class,
        ERROR_TYPES);
  }

  /**
   * Iterates over every event matching {@code body}, writing the next cursor into its {@code
   * page.cursor}.
   */
  public PaginationIterable<RUMEvent> searchRUMEventsWithPagination(
      final RUMSearchEventsRequest body) throws ApiException {
    ApiClient.requireParameter(body, "body", "searchRUMEvents");
    if (body.getPage() == null) {
      body.setPage(new RUMQueryPageOptions());
    }
    final RUMQueryPageOptions requestPage = body.getPage();
    if (requestPage.getLimit() == null) {
      requestPage.setLimit(PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    return PaginationIterable.create(
        requestPage.getLimit(),
        () -> searchRUMEvents(body),
        RUMEventsResponse::getData,
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
  private static String nextCursor(RUMEventsResponse page) {
    RUMResponseMetadata meta = page.getMeta();
    if (meta == null || meta.getPage() == null) {
      return null;
    }
    String after = meta.getPage().getAfter();
    return after == null || after.isEmpty() ? null : after;
  }
}
