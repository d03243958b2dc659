package datadog.api.client;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class PaginationIterableTest {

  /** Serves numbered items from fixed pages, moving a page index like a cursor would. */
  private static final class Pages {
    final List<List<Integer>> pages;
    final AtomicInteger fetches = new AtomicInteger();
    int index;

    Pages(List<List<Integer>> pages) {
      this.pages = pages;
    }

    List<Integer> fetch() {
      fetches.incrementAndGet();
      return index < pages.size() ? pages.get(index) : Collections.<Integer>emptyList();
    }

    PaginationIterable<Integer> iterable(int pageSize) {
      return PaginationIterable.create(
          pageSize,
          this::fetch,
          page -> page,
          page -> {
            index++;
            return true;
          });
    }
  }

  private static List<Integer> range(int from, int to) {
    List<Integer> items = new ArrayList<>();
    for (int i = from; i < to; i++) {
      items.add(i);
    }
    return items;
  }

  private static List<Integer> collect(Iterable<Integer> iterable) {
    List<Integer> items = new ArrayList<>();
    for (Integer item : iterable) {
      items.add(item);
    }
    return items;
  }

  @Test
  void stopsAfterShortPage() {
    Pages pages = new Pages(Arrays.asList(range(0, 3), range(3, 6), range(6, 7), range(7, 9)));

    assertEquals(range(0, 7), collect(pages.iterable(3)));
    assertEquals(3, pages.fetches.get());
  }

  @Test
  void stopsAfterEmptyPage() {
    Pages pages = new Pages(Arrays.asList(range(0, 2), range(2, 4)));

    assertEquals(range(0, 4), collect(pages.iterable(2)));
    assertEquals(3, pages.fetches.get());
  }

  @Test
  void stopsWhenThereIsNoNextPage() {
    final AtomicInteger fetches = new AtomicInteger();
    PaginationIterable<Integer> iterable =
        PaginationIterable.create(
            2,
            () -> {
              fetches.incrementAndGet();
              return range(0, 2);
            },
            page -> page,
            page -> false);

    assertEquals(range(0, 2), collect(iterable));
    assertEquals(1, fetches.get());
  }

  @Test
  void missingItemsEndIteration() {
    PaginationIterable<Integer> iterable =
        PaginationIterable.create(2, () -> "page", page -> null, page -> true);

    assertFalse(iterable.iterator().hasNext());
  }

  @Test
  void failureSurfacesAfterPreviousItems() {
    final AtomicInteger fetches = new AtomicInteger();
    PaginationIterable<Integer> iterable =
        PaginationIterable.create(
            2,
            () -> {
              if (fetches.incrementAndGet() > 1) {
                throw new ApiException("500 Internal Server Error", null, 500, null, "{}", null);
              }
              return range(0, 2);
            },
            page -> page,
            page -> true);

    Iterator<Integer> iterator = iterable.iterator();
    assertEquals(0, iterator.next());
    assertEquals(1, iterator.next());
    PaginationException e = assertThrows(PaginationException.class, iterator::hasNext);
    assertEquals(500, e.getApiException().getCode());
    assertFalse(iterator.hasNext());
  }

  @Test
  void iteratesOnce() {
    PaginationIterable<Integer> iterable = new Pages(Arrays.asList(range(0, 1))).iterable(2);
    iterable.iterator();

    assertThrows(IllegalStateException.class, iterable::iterator);
  }

  @Test
  void producerRunsAtMostOnePageAhead() throws Exception {
    final CountDownLatch secondFetch = new CountDownLatch(1);
    final AtomicInteger fetches = new AtomicInteger();
    PaginationIterable<Integer> iterable =
        PaginationIterable.create(
            2,
            () -> {
              if (fetches.incrementAndGet() == 2) {
                secondFetch.countDown();
              }
              return range(0, 2);
            },
            page -> page,
            page -> true);

    Iterator<Integer> iterator = iterable.iterator();
    assertTrue(iterator.hasNext());
    // the queue holds one page, so the producer blocks while queueing the second one
    assertTrue(secondFetch.await(5, TimeUnit.SECONDS));
    Thread.sleep(100);
    assertEquals(2, fetches.get());

    iterable.close();
    assertTrue(iterable.isCancelled());
    assertFalse(iterator.hasNext());
  }

  @Test
  void closeStopsProducer() throws Exception {
    final CountDownLatch fetched = new CountDownLatch(1);
    final List<Thread> producers = new ArrayList<>();
    PaginationIterable<Integer> iterable =
        PaginationIterable.create(
            1,
            () -> {
              synchronized (producers) {
                producers.add(Thread.currentThread());
              }
              fetched.countDown();
              return range(0, 1);
            },
            page -> page,
            page -> true);

    Iterator<Integer> iterator = iterable.iterator();
    assertEquals(0, iterator.next());
    assertTrue(fetched.await(5, TimeUnit.SECONDS));
    iterable.close();

    Thread producer;
    synchronized (producers) {
      producer = producers.get(0);
    }
    producer.join(5_000);
    assertFalse(producer.isAlive());
    assertTrue(producer.isDaemon());
    assertEquals("dd-api-client-paginator", producer.getName());
    assertFalse(iterator.hasNext());
  }

  @Test
  void streamClosesIterable() {
    PaginationIterable<Integer> iterable =
        new Pages(Arrays.asList(range(0, 2), range(2, 4), range(4, 5))).iterable(2);

    List<Integer> firstThree;
    try (Stream<Integer> stream = iterable.stream()) {
      firstThree = stream.limit(3).collect(Collectors.toList());
    }

    assertEquals(range(0, 3), firstThree);
    assertTrue(iterable.isCancelled());
  }

  @Test
  @SuppressWarnings("unchecked")
  void advancesPastEveryFullPage() throws Exception {
    PaginationIterable.PageFetcher<List<Integer>> fetcher =
        mock(PaginationIterable.PageFetcher.class);
    PaginationIterable.NextPage<List<Integer>> next = mock(PaginationIterable.NextPage.class);
    List<Integer> first = Arrays.asList(1, 2);
    List<Integer> second = Arrays.asList(3);
    when(fetcher.fetch()).thenReturn(first, second);
    when(next.advance(first)).thenReturn(true);

    assertEquals(
        Arrays.asList(1, 2, 3),
        collect(PaginationIterable.create(2, fetcher, page -> page, next)));

    InOrder order = inOrder(fetcher, next);
    order.verify(fetcher).fetch();
    order.verify(next).advance(first);
    order.verify(fetcher).fetch();
    order.verifyNoMoreInteractions();
  }

  @Test
  void pageSizeMustBePositive() {
    assertThrows(
        IllegalArgumentException.class,
        () -> PaginationIterable.create(0, () -> "page", page -> null, page -> true));
  }
}
