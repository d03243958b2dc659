package datadog.api.client;

import datadog.communication.util.IOUtils;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ClientVersion {
  private static final Logger log = LoggerFactory.getLogger(ClientVersion.class);

  static final String UNKNOWN_VERSION = "0.0.0";

  public static final String CLIENT_VERSION =
      readVersion(
          ClientVersion.class.getClassLoader().getResourceAsStream("datadog-api-client.version"));

  private ClientVersion() {}

  /** Reads the version from {@code in} and closes it. Unreadable versions are unknown. */
  static String readVersion(@Nullable InputStream in) {
    if (in == null) {
      return UNKNOWN_VERSION;
    }
    try (InputStream versionStream = in) {
      String version = IOUtils.readFully(versionStream, StandardCharsets.ISO_8859_1).trim();
      return version.isEmpty() || version.startsWith("$") ? UNKNOWN_VERSION : version;
    } catch (IOException e) {
      log.debug("Could not read the client version", e);
      return UNKNOWN_VERSION;
    }
  }
}
