package datadog.api.client;

import static datadog.api.client.ClientThreads.ClientThread.PAGINATOR;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Items of a paginated listing, fetched page after page by a background thread.
 *
 * <p>The producer thread starts on the first call to {@link #iterator()} and hands items over
 * through a queue that holds at most one page, so it never runs more than a page ahead of the
 * consumer. It stops after a page that is empty or shorter than the page size, when there is no
 * next page, or when a request fails. A failure is rethrown by the iterator as a {@link
 * PaginationException}.
 *
 * <p>{@link #close()} stops the producer; it should be called when the iteration is abandoned
 * before the end. The items can only be iterated once.
 *
 * @param <T> item type
 */
public final class PaginationIterable<T> implements Iterable<T>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(PaginationIterable.class);

  public static final int DEFAULT_PAGE_SIZE = 10;

  /** Fetches the page the request currently points at. */
  @FunctionalInterface
  public interface PageFetcher<P> {
    P fetch() throws ApiException;
  }

  /**
   * Points the request at the page after {@code page}.
   *
   * @return {@code false} when there is no next page.
   */
  @FunctionalInterface
  public interface NextPage<P> {
    boolean advance(P page);
  }

  /** One step of the producer. */
  private interface PageSource<T> {
    /** The items of the next page, or {@code null} when the listing is exhausted. */
    @Nullable
    List<T> next() throws ApiException;
  }

  private static final Object END = new Object();

  private static final class Failure {
    final Exception cause;

    Failure(Exception cause) {
      this.cause = cause;
    }
  }

  private final int pageSize;
  private final PageSource<T> source;
  private final BlockingQueue<Object> queue;
  private final AtomicBoolean started = new AtomicBoolean();
  private volatile boolean cancelled;
  @Nullable private volatile Thread producer;

  private PaginationIterable(int pageSize, PageSource<T> source) {
    this.pageSize = pageSize;
    this.source = source;
    this.queue = new ArrayBlockingQueue<>(pageSize);
  }

  /**
   * @param pageSize number of items requested per page
   * @param fetcher fetches the current page
   * @param items extracts the items of a page, may return {@code null}
   * @param nextPage moves the request to the following page
   */
  public static <P, T> PaginationIterable<T> create(
      final int pageSize,
      final PageFetcher<P> fetcher,
      final Function<P, List<T>> items,
      final NextPage<P> nextPage) {
    if (pageSize <= 0) {
      throw new IllegalArgumentException("Page size must be positive: " + pageSize);
    }
    PageSource<T> source =
        new PageSource<T>() {
          private boolean exhausted;

          @Nullable
          @Override
          public List<T> next() throws ApiException {
            if (exhausted) {
              return null;
            }
            P page = fetcher.fetch();
            List<T> pageItems = page == null ? null : items.apply(page);
            if (pageItems == null || pageItems.isEmpty()) {
              exhausted = true;
              return null;
            }
            if (pageItems.size() < pageSize || !nextPage.advance(page)) {
              exhausted = true;
            }
            return pageItems;
          }
        };
    return new PaginationIterable<>(pageSize, source);
  }

  public int getPageSize() {
    return pageSize;
  }

  @Override
  public Iterator<T> iterator() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Paginated results can only be iterated once");
    }
    Thread thread = ClientThreads.newClientThread(PAGINATOR, this::produce);
    producer = thread;
    thread.start();
    return new QueueIterator();
  }

  public Stream<T> stream() {
    return StreamSupport.stream(spliterator(), false).onClose(this::close);
  }

  private void produce() {
    try {
      List<T> items;
      while (!cancelled && (items = source.next()) != null) {
        for (T item : items) {
          if (cancelled) {
            return;
          }
          if (item != null) {
            queue.put(item);
          }
        }
      }
      if (!cancelled) {
        queue.put(END);
      }
    } catch (InterruptedException e) {
      log.debug("Pagination cancelled");
      Thread.currentThread().interrupt();
    } catch (ApiException | RuntimeException e) {
      if (!cancelled) {
        log.debug("Pagination stopped by a failed request", e);
        enqueueQuietly(new Failure(e));
      }
    }
  }

  private void enqueueQuietly(Object element) {
    try {
      queue.put(element);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Stops fetching pages. Iteration ends after this call. */
  @Override
  public void close() {
    cancelled = true;
    Thread thread = producer;
    if (thread != null) {
      thread.interrupt();
    }
    queue.clear();
    // wakes up a consumer blocked on an empty queue
    queue.offer(END);
  }

  public boolean isCancelled() {
    return cancelled;
  }

  private final class QueueIterator implements Iterator<T> {
    @Nullable private Object next;
    private boolean done;

    @Override
    public boolean hasNext() {
      if (done) {
        return false;
      }
      if (next == null) {
        try {
          next = queue.take();
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          done = true;
          throw new PaginationException("Interrupted while waiting for the next page", e);
        }
      }
      if (cancelled || next == END) {
        done = true;
        next = null;
        return false;
      }
      if (next instanceof Failure) {
        done = true;
        Exception cause = ((Failure) next).cause;
        next = null;
        if (cause instanceof ApiException) {
          throw new PaginationException((ApiException) cause);
        }
        throw new PaginationException(cause.getMessage(), cause);
      }
      return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public T next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      T item = (T) next;
      next = null;
      return item;
    }
  }
}
