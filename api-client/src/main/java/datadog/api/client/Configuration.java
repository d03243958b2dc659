package datadog.api.client;

import datadog.communication.http.HttpRetryPolicy;
import datadog.environment.ConfigHelper;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings shared by every API call of an {@link ApiClient}: servers, credentials, compression,
 * retries and the unstable operations the caller opted into.
 *
 * <p>Changing a configuration while an {@link ApiClient} uses it is not safe; build a new client
 * instead.
 */
public class Configuration {
  private static final Logger log = LoggerFactory.getLogger(Configuration.class);

  public static final String API_KEY_AUTH = "apiKeyAuth";
  public static final String APP_KEY_AUTH = "appKeyAuth";

  static final String SITE_PROPERTY = "dd.site";
  static final String API_KEY_PROPERTY = "dd.api.key";
  static final String APP_KEY_PROPERTY = "dd.app.key";

  public static final String DEFAULT_SITE = "datadoghq.com";
  public static final int DEFAULT_TIMEOUT_MILLIS = 60_000;
  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final int DEFAULT_BACKOFF_BASE = 2;
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

  private static final List<String> SITES =
      Arrays.asList(
          "datadoghq.com",
          "us3.datadoghq.com",
          "us5.datadoghq.com",
          "ap1.datadoghq.com",
          "datadoghq.eu",
          "ddog-gov.com");

  private static final String REGIONAL_URL = "https://{subdomain}.{site}";
  private static final String SUBDOMAIN_DESCRIPTION = "The subdomain where the API is deployed.";

  private static final List<String> UNSTABLE_OPERATIONS =
      Arrays.asList(
          "v2.createIncident",
          "v2.deleteIncident",
          "v2.getIncident",
          "v2.listIncidents",
          "v2.updateIncident");

  private final List<ServerConfiguration> servers;
  private int serverIndex;
  private final Map<String, String> serverVariables = new HashMap<>();

  private final Map<String, List<ServerConfiguration>> operationServers;
  private final Map<String, Integer> operationServerIndex = new HashMap<>();
  private final Map<String, Map<String, String>> operationServerVariables = new HashMap<>();

  private final Map<String, String> apiKeys = new HashMap<>();
  private final Map<String, Boolean> unstableOperations = new LinkedHashMap<>();

  private boolean compress = true;
  private boolean debug;
  private boolean retryEnabled;
  private int maxRetries = DEFAULT_MAX_RETRIES;
  private int backOffBase = DEFAULT_BACKOFF_BASE;
  private double backOffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
  private int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
  private String userAgent = defaultUserAgent();

  public Configuration() {
    servers = Collections.unmodifiableList(hostServers("api", "api.datadoghq.com"));
    Map<String, List<ServerConfiguration>> byOperation = new HashMap<>();
    byOperation.put(
        "v2.submitLog",
        Collections.unmodifiableList(
            hostServers("http-intake.logs", "http-intake.logs.datadoghq.com")));
    operationServers = Collections.unmodifiableMap(byOperation);
    for (String operation : UNSTABLE_OPERATIONS) {
      unstableOperations.put(operation, false);
    }
  }

  /**
   * Builds a configuration from {@code DD_SITE}, {@code DD_API_KEY} and {@code DD_APP_KEY}. The
   * system properties {@code dd.site}, {@code dd.api.key} and {@code dd.app.key} take precedence.
   */
  public static Configuration fromEnvironment() {
    Configuration configuration = new Configuration();
    String site = ConfigHelper.lookup(SITE_PROPERTY);
    if (site != null) {
      configuration.setServerVariable("site", site);
    }
    String apiKey = ConfigHelper.lookup(API_KEY_PROPERTY);
    if (apiKey != null) {
      configuration.setApiKey(API_KEY_AUTH, apiKey);
    }
    String appKey = ConfigHelper.lookup(APP_KEY_PROPERTY);
    if (appKey != null) {
      configuration.setApiKey(APP_KEY_AUTH, appKey);
    }
    return configuration;
  }

  private static List<ServerConfiguration> hostServers(String subdomain, String defaultName) {
    List<ServerConfiguration> hosts = new ArrayList<>();

    Map<String, ServerVariable> regional = new LinkedHashMap<>();
    regional.put(
        "site",
        new ServerVariable(
            "The regional site for customers.", DEFAULT_SITE, new LinkedHashSet<>(SITES)));
    regional.put("subdomain", new ServerVariable(SUBDOMAIN_DESCRIPTION, subdomain));
    hosts.add(new ServerConfiguration(REGIONAL_URL, "No description provided", regional));

    Map<String, ServerVariable> named = new LinkedHashMap<>();
    named.put("name", new ServerVariable("Full site DNS name.", defaultName));
    named.put("protocol", new ServerVariable("The protocol for accessing the API.", "https"));
    hosts.add(new ServerConfiguration("{protocol}://{name}", "No description provided", named));

    Map<String, ServerVariable> open = new LinkedHashMap<>();
    open.put("site", new ServerVariable("Any Datadog deployment.", DEFAULT_SITE));
    open.put("subdomain", new ServerVariable(SUBDOMAIN_DESCRIPTION, subdomain));
    hosts.add(new ServerConfiguration(REGIONAL_URL, "No description provided", open));
    return hosts;
  }

  private static String defaultUserAgent() {
    return "datadog-api-client-java/"
        + ClientVersion.CLIENT_VERSION
        + " (java "
        + ConfigHelper.property("java.version", "unknown")
        + "; os "
        + ConfigHelper.property("os.name", "unknown")
        + "; os_version "
        + ConfigHelper.property("os.version", "unknown")
        + "; arch "
        + ConfigHelper.property("os.arch", "unknown")
        + ")";
  }

  /** Base URL for the operation, using its own servers when it has any. */
  public String getServerUrl(String operationId) {
    List<ServerConfiguration> hosts = operationServers.get(operationId);
    if (hosts != null) {
      Integer index = operationServerIndex.get(operationId);
      Map<String, String> variables = new HashMap<>(serverVariables);
      Map<String, String> overrides = operationServerVariables.get(operationId);
      if (overrides != null) {
        variables.putAll(overrides);
      }
      return ServerConfiguration.url(hosts, index == null ? serverIndex : index, variables);
    }
    return ServerConfiguration.url(servers, serverIndex, serverVariables);
  }

  public List<ServerConfiguration> getServers() {
    return servers;
  }

  public List<ServerConfiguration> getOperationServers(String operationId) {
    List<ServerConfiguration> hosts = operationServers.get(operationId);
    return hosts == null ? Collections.<ServerConfiguration>emptyList() : hosts;
  }

  public int getServerIndex() {
    return serverIndex;
  }

  public Configuration setServerIndex(int serverIndex) {
    this.serverIndex = serverIndex;
    return this;
  }

  public Map<String, String> getServerVariables() {
    return Collections.unmodifiableMap(serverVariables);
  }

  public Configuration setServerVariable(String name, String value) {
    serverVariables.put(name, value);
    return this;
  }

  public Configuration setServerVariables(Map<String, String> variables) {
    serverVariables.clear();
    serverVariables.putAll(variables);
    return this;
  }

  public Configuration setOperationServerIndex(String operationId, int index) {
    operationServerIndex.put(operationId, index);
    return this;
  }

  public Configuration setOperationServerVariables(
      String operationId, Map<String, String> variables) {
    operationServerVariables.put(operationId, new HashMap<>(variables));
    return this;
  }

  @Nullable
  public String getApiKey(String authName) {
    return apiKeys.get(authName);
  }

  public Configuration setApiKey(String authName, @Nullable String value) {
    if (value == null) {
      apiKeys.remove(authName);
    } else {
      apiKeys.put(authName, value);
    }
    return this;
  }

  public Configuration configureApiKeys(Map<String, String> keys) {
    for (Map.Entry<String, String> entry : keys.entrySet()) {
      setApiKey(entry.getKey(), entry.getValue());
    }
    return this;
  }

  /** Header carrying the credential of a security scheme. */
  @Nullable
  static String authHeader(String authName) {
    if (API_KEY_AUTH.equals(authName)) {
      return "DD-API-KEY";
    }
    if (APP_KEY_AUTH.equals(authName)) {
      return "DD-APPLICATION-KEY";
    }
    return null;
  }

  Iterable<String> secrets() {
    return apiKeys.values();
  }

  public boolean isUnstableOperation(String operationId) {
    return unstableOperations.containsKey(operationId);
  }

  public boolean isUnstableOperationEnabled(String operationId) {
    Boolean enabled = unstableOperations.get(operationId);
    return enabled != null && enabled;
  }

  /**
   * Opts into an unstable operation.
   *
   * @return {@code false} when {@code operationId} is not an unstable operation.
   */
  public boolean setUnstableOperationEnabled(String operationId, boolean enabled) {
    if (!unstableOperations.containsKey(operationId)) {
      log.warn("'{}' is not an unstable operation, can't enable it", operationId);
      return false;
    }
    unstableOperations.put(operationId, enabled);
    return true;
  }

  public boolean isCompress() {
    return compress;
  }

  public Configuration setCompress(boolean compress) {
    this.compress = compress;
    return this;
  }

  public boolean isDebug() {
    return debug;
  }

  public Configuration setDebug(boolean debug) {
    this.debug = debug;
    return this;
  }

  public boolean isRetryEnabled() {
    return retryEnabled;
  }

  public Configuration setRetryEnabled(boolean retryEnabled) {
    this.retryEnabled = retryEnabled;
    return this;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public Configuration setMaxRetries(int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be greater than or equal to 0");
    }
    this.maxRetries = maxRetries;
    return this;
  }

  public int getBackOffBase() {
    return backOffBase;
  }

  public Configuration setBackOffBase(int backOffBase) {
    if (backOffBase < 2) {
      throw new IllegalArgumentException("backOffBase must be greater than or equal to 2");
    }
    this.backOffBase = backOffBase;
    return this;
  }

  public double getBackOffMultiplier() {
    return backOffMultiplier;
  }

  public Configuration setBackOffMultiplier(double backOffMultiplier) {
    if (backOffMultiplier < 1) {
      throw new IllegalArgumentException("backOffMultiplier must be greater than or equal to 1");
    }
    this.backOffMultiplier = backOffMultiplier;
    return this;
  }

  public int getTimeoutMillis() {
    return timeoutMillis;
  }

  public Configuration setTimeoutMillis(int timeoutMillis) {
    if (timeoutMillis <= 0) {
      throw new IllegalArgumentException("timeoutMillis must be positive");
    }
    this.timeoutMillis = timeoutMillis;
    return this;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Configuration setUserAgent(String userAgent) {
    this.userAgent = userAgent;
    return this;
  }

  HttpRetryPolicy.Factory retryPolicyFactory() {
    if (!retryEnabled) {
      return HttpRetryPolicy.Factory.NEVER_RETRY;
    }
    return HttpRetryPolicy.Factory.exponential(maxRetries, backOffBase, backOffMultiplier);
  }
}
