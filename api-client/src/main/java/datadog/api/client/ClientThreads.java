package datadog.api.client;

import org.slf4j.LoggerFactory;

/** Starts all client {@link Thread}s as daemons in a shared thread group. */
public final class ClientThreads {
  public static final ThreadGroup CLIENT_THREAD_GROUP = new ThreadGroup("dd-api-client");

  public enum ClientThread {
    PAGINATOR("dd-api-client-paginator");

    public final String threadName;

    ClientThread(final String threadName) {
      this.threadName = threadName;
    }
  }

  private ClientThreads() {}

  /**
   * Constructs a new client {@code Thread} as a daemon with a null ContextClassLoader.
   *
   * @param clientThread the client thread to create.
   * @param runnable work to run on the new thread.
   */
  public static Thread newClientThread(final ClientThread clientThread, final Runnable runnable) {
    final Thread thread = new Thread(CLIENT_THREAD_GROUP, runnable, clientThread.threadName);
    thread.setDaemon(true);
    thread.setContextClassLoader(null);
    thread.setUncaughtExceptionHandler(
        new Thread.UncaughtExceptionHandler() {
          @Override
          public void uncaughtException(final Thread thread, final Throwable e) {
            LoggerFactory.getLogger(runnable.getClass())
                .error("Uncaught exception {} in {}", e, clientThread.threadName, e);
          }
        });
    return thread;
  }
}
