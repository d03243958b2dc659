package datadog.api.client;

import static datadog.communication.http.OkHttpUtils.ACCEPT_ENCODING;
import static datadog.communication.http.OkHttpUtils.CONTENT_ENCODING;
import static datadog.communication.http.OkHttpUtils.DEFLATE_ENCODING;
import static datadog.communication.http.OkHttpUtils.GZIP_ENCODING;
import static datadog.communication.http.OkHttpUtils.IDENTITY_ENCODING;

import com.squareup.moshi.JsonDataException;
import datadog.communication.http.OkHttpUtils;
import datadog.communication.http.SafeRequestBuilder;
import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.lang.reflect.Type;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends API requests described by the generated API classes and decodes their responses.
 *
 * <p>An instance is thread-safe and should be shared: it holds the connection pool.
 */
public class ApiClient {
  private static final Logger log = LoggerFactory.getLogger(ApiClient.class);

  private static final String ACCEPT = "Accept";
  private static final String USER_AGENT = "User-Agent";
  private static final String APPLICATION_JSON = "application/json";
  private static final byte[] NO_CONTENT = new byte[0];

  private static volatile ApiClient defaultApiClient;

  private final Configuration configuration;
  private final OkHttpClient httpClient;

  public ApiClient() {
    this(Configuration.fromEnvironment());
  }

  public ApiClient(Configuration configuration) {
    this.configuration = configuration;
    List<Interceptor> interceptors =
        configuration.isDebug()
            ? Collections.<Interceptor>singletonList(new DebugLoggingInterceptor(configuration))
            : Collections.<Interceptor>emptyList();
    this.httpClient =
        OkHttpUtils.buildHttpClient(configuration.getTimeoutMillis(), interceptors);
  }

  /** The client used by API classes built without one, configured from the environment. */
  public static ApiClient getDefaultApiClient() {
    ApiClient client = defaultApiClient;
    if (client == null) {
      synchronized (ApiClient.class) {
        client = defaultApiClient;
        if (client == null) {
          client = new ApiClient();
          defaultApiClient = client;
        }
      }
    }
    return client;
  }

  public static void setDefaultApiClient(ApiClient client) {
    defaultApiClient = client;
  }

  public Configuration getConfiguration() {
    return configuration;
  }

  OkHttpClient getHttpClient() {
    return httpClient;
  }

  /**
   * Sends a request and decodes its response.
   *
   * @param operationId operation id such as {@code v2.listIncidents}, used to look up unstable
   *     operations and operation servers
   * @param path request path, with path parameters already escaped
   * @param body request body, {@code null} for none
   * @param authNames security schemes whose credentials are sent
   * @param returnType type of the response body, {@code null} when the operation returns nothing
   * @param errorTypes types of error bodies, by status code
   * @throws ApiException if the status code is 300 or more, the response cannot be decoded or the
   *     request cannot be sent
   */
  public <T> ApiResponse<T> invokeApi(
      String operationId,
      String method,
      String path,
      List<Pair> queryParams,
      Map<String, String> headerParams,
      @Nullable Object body,
      String[] authNames,
      @Nullable Type returnType,
      Map<Integer, Type> errorTypes)
      throws ApiException {
    if (configuration.isUnstableOperation(operationId)) {
      if (!configuration.isUnstableOperationEnabled(operationId)) {
        throw new ApiException(String.format("Unstable operation '%s' is disabled", operationId));
      }
      log.warn("Using unstable operation '{}'", operationId);
    }

    Request request =
        buildRequest(operationId, method, path, queryParams, headerParams, body, authNames);
    Response response;
    try {
      response =
          OkHttpUtils.sendWithRetries(httpClient, configuration.retryPolicyFactory(), request);
    } catch (IOException e) {
      throw new ApiException(
          "Failed to call " + method + " " + request.url().encodedPath() + ": " + e.getMessage(),
          e);
    }
    try {
      return handleResponse(response, returnType, errorTypes);
    } finally {
      response.close();
    }
  }

  Request buildRequest(
      String operationId,
      String method,
      String path,
      List<Pair> queryParams,
      Map<String, String> headerParams,
      @Nullable Object body,
      String[] authNames)
      throws ApiException {
    String serverUrl;
    try {
      serverUrl = configuration.getServerUrl(operationId);
    } catch (IllegalArgumentException e) {
      throw new ApiException(e.getMessage(), e);
    }
    HttpUrl base = HttpUrl.parse(serverUrl + path);
    if (base == null) {
      throw new ApiException("Invalid URL: " + serverUrl + path);
    }
    HttpUrl.Builder url = base.newBuilder();
    for (Pair param : queryParams) {
      url.addQueryParameter(param.getName(), param.getValue());
    }

    SafeRequestBuilder builder =
        new SafeRequestBuilder()
            .url(url.build())
            .header(ACCEPT, APPLICATION_JSON)
            .header(USER_AGENT, configuration.getUserAgent())
            .header(ACCEPT_ENCODING, configuration.isCompress() ? GZIP_ENCODING : IDENTITY_ENCODING)
            .headers(headerParams);
    for (String authName : authNames) {
      String header = Configuration.authHeader(authName);
      String key = configuration.getApiKey(authName);
      if (header != null && key != null) {
        builder.header(header, key);
      }
    }
    RequestBody requestBody = requestBody(method, body, headerParams.get(CONTENT_ENCODING));
    return builder.method(method, requestBody).build();
  }

  @Nullable
  private static RequestBody requestBody(
      String method, @Nullable Object body, @Nullable String contentEncoding) throws ApiException {
    if (body == null) {
      return requiresBody(method) ? RequestBody.create(null, NO_CONTENT) : null;
    }
    RequestBody json =
        OkHttpUtils.jsonRequestBodyOf(JsonSupport.toJson(body).getBytes(StandardCharsets.UTF_8));
    if (contentEncoding == null || IDENTITY_ENCODING.equalsIgnoreCase(contentEncoding)) {
      return json;
    }
    if (GZIP_ENCODING.equalsIgnoreCase(contentEncoding)) {
      return OkHttpUtils.gzippedRequestBodyOf(json);
    }
    if (DEFLATE_ENCODING.equalsIgnoreCase(contentEncoding)) {
      return OkHttpUtils.deflatedRequestBodyOf(json);
    }
    throw new ApiException("Unsupported Content-Encoding: " + contentEncoding);
  }

  private static boolean requiresBody(String method) {
    return "POST".equals(method) || "PUT".equals(method) || "PATCH".equals(method);
  }

  private <T> ApiResponse<T> handleResponse(
      Response response, @Nullable Type returnType, Map<Integer, Type> errorTypes)
      throws ApiException {
    int code = response.code();
    Map<String, List<String>> headers = response.headers().toMultimap();
    String body;
    try {
      body = OkHttpUtils.bodyAsString(response);
    } catch (IOException e) {
      throw new ApiException("Failed to read response body", e, code, headers, null, null);
    }

    if (code >= 300) {
      Object errorModel = null;
      Type errorType = errorTypes.get(code);
      if (errorType != null && !body.isEmpty()) {
        try {
          errorModel = JsonSupport.fromJson(body, errorType);
        } catch (IOException | JsonDataException e) {
          log.debug("Could not decode error body of status {}: {}", code, e.getMessage());
        }
      }
      String message = response.message().isEmpty() ? "" : " " + response.message();
      throw new ApiException(code + message, null, code, headers, body, errorModel);
    }

    if (returnType == null || body.isEmpty()) {
      return new ApiResponse<>(code, headers, null);
    }
    try {
      T data = JsonSupport.fromJson(body, returnType);
      return new ApiResponse<>(code, headers, data);
    } catch (IOException | JsonDataException e) {
      throw new ApiException(
          "Failed to decode response body: " + e.getMessage(), e, code, headers, body, null);
    }
  }

  /**
   * @throws ApiException with code 400 when a required parameter of {@code operation} is {@code
   *     null}
   */
  public static void requireParameter(@Nullable Object value, String name, String operation)
      throws ApiException {
    if (value == null) {
      throw new ApiException(
          400, "Missing the required parameter '" + name + "' when calling " + operation);
    }
  }

  /** Escapes a path parameter. */
  public static String escapeString(String str) {
    try {
      return URLEncoder.encode(str, "UTF-8").replaceAll("\\+", "%20");
    } catch (UnsupportedEncodingException e) {
      return str;
    }
  }

  /**
   * Formats a parameter value: enums by their wire value, date-times as RFC3339 and collections
   * as comma separated values.
   */
  public static String parameterToString(@Nullable Object param) {
    if (param == null) {
      return "";
    }
    if (param instanceof OffsetDateTime) {
      return OffsetDateTimeJsonAdapter.format((OffsetDateTime) param);
    }
    if (param instanceof Collection) {
      return join((Collection<?>) param, ",");
    }
    return String.valueOf(param);
  }

  /**
   * Formats a query parameter as pairs.
   *
   * @param collectionFormat {@code multi} repeats the name for each element, {@code csv}, {@code
   *     ssv}, {@code tsv} and {@code pipes} join the elements; ignored for single values
   * @return no pairs for a {@code null} value or an empty collection
   */
  public static List<Pair> parameterToPairs(
      String collectionFormat, String name, @Nullable Object value) {
    List<Pair> params = new ArrayList<>();
    if (name == null || name.isEmpty() || value == null) {
      return params;
    }
    if (!(value instanceof Collection)) {
      params.add(new Pair(name, parameterToString(value)));
      return params;
    }
    Collection<?> values = (Collection<?>) value;
    if (values.isEmpty()) {
      return params;
    }
    String format =
        collectionFormat == null || collectionFormat.isEmpty() ? "csv" : collectionFormat;
    switch (format) {
      case "multi":
        for (Object item : values) {
          params.add(new Pair(name, parameterToString(item)));
        }
        return params;
      case "ssv":
        params.add(new Pair(name, join(values, " ")));
        return params;
      case "tsv":
        params.add(new Pair(name, join(values, "\t")));
        return params;
      case "pipes":
        params.add(new Pair(name, join(values, "|")));
        return params;
      case "csv":
        params.add(new Pair(name, join(values, ",")));
        return params;
      default:
        throw new IllegalArgumentException("Unknown collection format: " + collectionFormat);
    }
  }

  public static List<Pair> parameterToPairs(String name, @Nullable Object value) {
    return parameterToPairs("", name, value);
  }

  private static String join(Collection<?> values, String separator) {
    StringBuilder sb = new StringBuilder();
    boolean first = true;
    for (Object item : values) {
      if (!first) {
        sb.append(separator);
      }
      first = false;
      sb.append(parameterToString(item));
    }
    return sb.toString();
  }
}
