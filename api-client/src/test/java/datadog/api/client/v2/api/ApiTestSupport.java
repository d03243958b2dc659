package datadog.api.client.v2.api;

import datadog.api.client.ApiClient;
import datadog.api.client.Configuration;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

/** Points an {@link ApiClient} at a {@link MockWebServer}. */
abstract class ApiTestSupport {
  protected final MockWebServer server = new MockWebServer();
  protected Configuration configuration;
  protected ApiClient apiClient;

  @BeforeEach
  void startServer() throws IOException {
    server.start();
    configuration =
        new Configuration()
            .setServerIndex(1)
            .setServerVariable("protocol", "http")
            .setServerVariable("name", server.getHostName() + ":" + server.getPort())
            .setApiKey(Configuration.API_KEY_AUTH, "api-key")
            .setApiKey(Configuration.APP_KEY_AUTH, "app-key")
            .setCompress(false);
    apiClient = new ApiClient(configuration);
  }

  @AfterEach
  void stopServer() throws IOException {
    server.shutdown();
  }

  protected void respond(String json) {
    server.enqueue(
        new MockResponse().setHeader("Content-Type", "application/json").setBody(json));
  }

  protected RecordedRequest takeRequest() throws InterruptedException {
    return server.takeRequest(1, TimeUnit.SECONDS);
  }
}
