package datadog.communication.util;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.Charset;

public abstract class IOUtils {

  private static final int DEFAULT_BUFFER_SIZE = 4096;

  private IOUtils() {}

  public static @NonNull String readFully(InputStream input, Charset charset) throws IOException {
    return new String(readAllBytes(input), charset);
  }

  public static @NonNull byte[] readAllBytes(InputStream input) throws IOException {
    ByteArrayOutputStream output = new ByteArrayOutputStream();
    readFully(input, output);
    return output.toByteArray();
  }

  public static void readFully(InputStream input, OutputStream output) throws IOException {
    byte[] buffer = new byte[DEFAULT_BUFFER_SIZE];
    int count;
    while ((count = input.read(buffer)) != -1) {
      output.write(buffer, 0, count);
    }
  }
}
