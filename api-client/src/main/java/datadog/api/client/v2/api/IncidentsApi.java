package datadog.api.client.v2.api;

import datadog.api.client.ApiClient;
import datadog.api.client.ApiException;
import datadog.api.client.ApiResponse;
import datadog.api.client.Configuration;
import datadog.api.client.PaginationIterable;
import datadog.api.client.Pair;
import datadog.api.client.v2.model.APIErrorResponse;
import datadog.api.client.v2.model.IncidentCreateRequest;
import datadog.api.client.v2.model.IncidentRelatedObject;
import datadog.api.client.v2.model.IncidentResponse;
import datadog.api.client.v2.model.IncidentResponseData;
import datadog.api.client.v2.model.IncidentUpdateRequest;
import datadog.api.client.v2.model.IncidentsResponse;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Incident management. Every operation is unstable and must be enabled with {@link
 * Configuration#setUnstableOperationEnabled(String, boolean)} before use.
 */
public class IncidentsApi {
  private static final String[] AUTH_NAMES = {
    Configuration.API_KEY_AUTH, Configuration.APP_KEY_AUTH
  };

  private static final Map<Integer, Type> ERROR_TYPES;

  static {
    Map<Integer, Type> errorTypes = new HashMap<>();
    for (int code : new int[] {400, 401, 403, 404, 429}) {
      errorTypes.put(code, APIErrorResponse.class);
    }
    ERROR_TYPES = Collections.unmodifiableMap(errorTypes);
  }

  private ApiClient apiClient;

  public IncidentsApi() {
    this(ApiClient.getDefaultApiClient());
  }

  public IncidentsApi(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public ApiClient getApiClient() {
    return apiClient;
  }

  public void setApiClient(ApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public IncidentResponse createIncident(IncidentCreateRequest body) throws ApiException {
    return createIncidentWithHttpInfo(body).getData();
  }

  public ApiResponse<IncidentResponse> createIncidentWithHttpInfo(IncidentCreateRequest body)
      throws ApiException {
    ApiClient.requireParameter(body, "body", "createIncident");
    return apiClient.invokeApi(
        "v2.createIncident",
        "POST",
        "/api/v2/incidents",
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        body,
        AUTH_NAMES,
        IncidentResponse.class,
        ERROR_TYPES);
  }

  public void deleteIncident(String incidentId) throws ApiException {
    deleteIncidentWithHttpInfo(incidentId);
  }

  public ApiResponse<Void> deleteIncidentWithHttpInfo(String incidentId) throws ApiException {
    ApiClient.requireParameter(incidentId, "incidentId", "deleteIncident");
    return apiClient.invokeApi(
        "v2.deleteIncident",
        "DELETE",
        "/api/v2/incidents/" + ApiClient.escapeString(incidentId),
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        null,
        ERROR_TYPES);
  }

  /** Optional parameters of {@link #getIncident}. */
  public static class GetIncidentOptionalParameters {
    private List<IncidentRelatedObject> include;

    /** Related objects to include in the response. */
    public GetIncidentOptionalParameters include(List<IncidentRelatedObject> include) {
      this.include = include;
      return this;
    }
  }

  public IncidentResponse getIncident(String incidentId) throws ApiException {
    return getIncidentWithHttpInfo(incidentId, new GetIncidentOptionalParameters()).getData();
  }

  public IncidentResponse getIncident(String incidentId, GetIncidentOptionalParameters parameters)
      throws ApiException {
    return getIncidentWithHttpInfo(incidentId, parameters).getData();
  }

  public ApiResponse<IncidentResponse> getIncidentWithHttpInfo(
      String incidentId, GetIncidentOptionalParameters parameters) throws ApiException {
    ApiClient.requireParameter(incidentId, "incidentId", "getIncident");
    return apiClient.invokeApi(
        "v2.getIncident",
        "GET",
        "/api/v2/incidents/" + ApiClient.escapeString(incidentId),
        ApiClient.parameterToPairs("csv", "include", parameters.include),
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        IncidentResponse.class,
        ERROR_TYPES);
  }

  /** Optional parameters of {@link #listIncidents}. */
  public static class ListIncidentsOptionalParameters {
    private List<IncidentRelatedObject> include;
    private Long pageSize;
    private Long pageOffset;

    /** Related objects to include in the response. */
    public ListIncidentsOptionalParameters include(List<IncidentRelatedObject> include) {
      this.include = include;
      return this;
    }

    /** Size for a given page. The maximum allowed value is 100. */
    public ListIncidentsOptionalParameters pageSize(Long pageSize) {
      this.pageSize = pageSize;
      return this;
    }

    /** Specific offset to use as the beginning of the returned page. */
    public ListIncidentsOptionalParameters pageOffset(Long pageOffset) {
      this.pageOffset = pageOffset;
      return this;
    }
  }

  public IncidentsResponse listIncidents() throws ApiException {
    return listIncidentsWithHttpInfo(new ListIncidentsOptionalParameters()).getData();
  }

  public IncidentsResponse listIncidents(ListIncidentsOptionalParameters parameters)
      throws ApiException {
    return listIncidentsWithHttpInfo(parameters).getData();
  }

  public ApiResponse<IncidentsResponse> listIncidentsWithHttpInfo(
      ListIncidentsOptionalParameters parameters) throws ApiException {
    List<Pair> queryParams = new ArrayList<>();
    queryParams.addAll(ApiClient.parameterToPairs("csv", "include", parameters.include));
    queryParams.addAll(ApiClient.parameterToPairs("page[size]", parameters.pageSize));
    queryParams.addAll(ApiClient.parameterToPairs("page[offset]", parameters.pageOffset));
    return apiClient.invokeApi(
        "v2.listIncidents",
        "GET",
        "/api/v2/incidents",
        queryParams,
        Collections.<String, String>emptyMap(),
        null,
        AUTH_NAMES,
        IncidentsResponse.class,
        ERROR_TYPES);
  }

  public PaginationIterable<IncidentResponseData> listIncidentsWithPagination() {
    return listIncidentsWithPagination(new ListIncidentsOptionalParameters());
  }

  /**
   * Iterates over every incident. The page offset of {@code parameters} is moved forward by the
   * page size after each page.
   */
  public PaginationIterable<IncidentResponseData> listIncidentsWithPagination(
      final ListIncidentsOptionalParameters parameters) {
    if (parameters.pageSize == null) {
      parameters.pageSize((long) PaginationIterable.DEFAULT_PAGE_SIZE);
    }
    if (parameters.pageOffset == null) {
      parameters.pageOffset(0L);
    }
    final long pageSize = parameters.pageSize;
    if (pageSize <= 0 || pageSize > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Page size out of range: " + pageSize);
    }
    return PaginationIterable.create(
        (int) pageSize,
        () -> listIncidents(parameters),
        IncidentsResponse::getData,
        page -> {
          parameters.pageOffset(parameters.pageOffset + pageSize);
          return true;
        });
  }

  public IncidentResponse updateIncident(String incidentId, IncidentUpdateRequest body)
      throws ApiException {
    return updateIncidentWithHttpInfo(incidentId, body).getData();
  }

  public ApiResponse<IncidentResponse> updateIncidentWithHttpInfo(
      String incidentId, IncidentUpdateRequest body) throws ApiException {
    ApiClient.requireParameter(incidentId, "incidentId", "updateIncident");
    ApiClient.requireParameter(body, "body", "updateIncident");
    return apiClient.invokeApi(
        "v2.updateIncident",
        "PATCH",
        "/api/v2/incidents/" + ApiClient.escapeString(incidentId),
        Collections.<Pair>emptyList(),
        Collections.<String, String>emptyMap(),
        body,
        AUTH_NAMES,
        IncidentResponse.class,
        ERROR_TYPES);
  }
}
