package datadog.api.client;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ClientVersionTest {

  private static InputStream stream(String content) {
    return new ByteArrayInputStream(content.getBytes(StandardCharsets.ISO_8859_1));
  }

  @Test
  void readsTrimmedVersion() {
    assertEquals("2.31.0", ClientVersion.readVersion(stream("2.31.0\n")));
  }

  @Test
  void missingOrUnfilteredVersionIsUnknown() {
    assertEquals(ClientVersion.UNKNOWN_VERSION, ClientVersion.readVersion(null));
    assertEquals(ClientVersion.UNKNOWN_VERSION, ClientVersion.readVersion(stream("")));
    assertEquals(
        ClientVersion.UNKNOWN_VERSION, ClientVersion.readVersion(stream("${project.version}")));
  }

  @Test
  void readFailureIsUnknown() {
    InputStream failing =
        new InputStream() {
          @Override
          public int read() throws IOException {
            throw new IOException("disk gone");
          }
        };
    assertEquals(ClientVersion.UNKNOWN_VERSION, ClientVersion.readVersion(failing));
  }

  @Test
  void packagedVersionIsResolved() {
    assertNotNull(ClientVersion.CLIENT_VERSION);
    assertFalse(ClientVersion.CLIENT_VERSION.startsWith("$"));
  }
}
