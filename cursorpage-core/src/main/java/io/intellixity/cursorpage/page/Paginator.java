package io.intellixity.cursorpage.page;

import io.intellixity.cursorpage.config.PaginationSettings;
import io.intellixity.cursorpage.cursor.Cursor;
import io.intellixity.cursorpage.cursor.CursorCodec;
import io.intellixity.cursorpage.order.OrderNormalizer;
import io.intellixity.cursorpage.order.OrderSpec;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.source.PageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Keyset paginator over a {@link PageSource}.
 *
 * <p>The ordering is normalized at construction (so an unsupported ordering fails before any
 * query). Everything else is computed on first access and cached: one over-fetch of
 * {@code pageSize + 1} rows and, only if {@link #total()} is read, one count.</p>
 *
 * <p>Backward traversal fetches with every direction flipped and reverses the slice, so
 * {@link #records()} is always in display order.</p>
 *
 * <p>Request-scoped and single owner: not safe for concurrent use.</p>
 */
public final class Paginator<T> {
  private static final Logger log = LoggerFactory.getLogger(Paginator.class);

  private final PageSource<T> source;
  private final PageSource<T> sorted;
  private final OrderSpec orderSpec;
  private final int pageSize;
  private final String cursor;
  private final TraversalDirection direction;
  private final CursorCodec codec;
  private final BoundaryPredicateBuilder boundaries;

  private List<T> recordsPlusOne;
  private List<T> records;
  private Long total;
  private boolean boundaryCursorsEncoded;
  private String startCursor;
  private String endCursor;

  public Paginator(PageSource<T> source, Integer pageSize, String cursor, TraversalDirection direction) {
    this(source, pageSize, cursor, direction, PaginationSettings.shared(), new CursorCodec());
  }

  public Paginator(PageSource<T> source,
                   Integer pageSize,
                   String cursor,
                   TraversalDirection direction,
                   PaginationSettings settings,
                   CursorCodec codec) {
    this.source = Objects.requireNonNull(source, "source");
    this.pageSize = Objects.requireNonNull(settings, "settings").resolvePageSize(pageSize);
    this.cursor = (cursor == null || cursor.isBlank()) ? null : cursor;
    this.direction = (direction == null) ? TraversalDirection.FORWARD : direction;
    this.codec = Objects.requireNonNull(codec, "codec");
    this.boundaries = new BoundaryPredicateBuilder();

    this.orderSpec = new OrderNormalizer().normalize(source.order(), source.idField());
    OrderSpec effective = isForward() ? orderSpec : orderSpec.reversed();
    this.sorted = source.reorder(effective.fields());
  }

  public static <T> Paginator<T> forward(PageSource<T> source, Integer pageSize, String cursor) {
    return new Paginator<>(source, pageSize, cursor, TraversalDirection.FORWARD);
  }

  public static <T> Paginator<T> backward(PageSource<T> source, Integer pageSize, String cursor) {
    return new Paginator<>(source, pageSize, cursor, TraversalDirection.BACKWARD);
  }

  public boolean isForward() { return direction == TraversalDirection.FORWARD; }
  public TraversalDirection direction() { return direction; }
  public OrderSpec orderSpec() { return orderSpec; }
  public int pageSize() { return pageSize; }

  /** Page content in display order. */
  public List<T> records() {
    if (records == null) {
      List<T> plusOne = recordsPlusOne();
      List<T> page = new ArrayList<>(plusOne.subList(0, Math.min(pageSize, plusOne.size())));
      if (!isForward()) Collections.reverse(page);
      records = Collections.unmodifiableList(page);
    }
    return records;
  }

  /** Row count of the source, ignoring ordering and the cursor boundary. */
  public long total() {
    if (total == null) {
      long start = System.nanoTime();
      total = source.count();
      if (log.isDebugEnabled()) {
        log.debug("cursorpage.count total={} durationMs={}", total, (System.nanoTime() - start) / 1_000_000.0);
      }
    }
    return total;
  }

  /**
   * Forward: a cursor was supplied (it was the end of some page). Backward: the over-fetch found
   * a row beyond this page.
   */
  public boolean hasPrevious() {
    if (isForward()) return cursor != null;
    return recordsPlusOne().size() > pageSize;
  }

  /**
   * Forward: the over-fetch found a row beyond this page. Backward: always true, the cursor was
   * the start of a page that follows this one.
   */
  public boolean hasNext() {
    if (isForward()) return recordsPlusOne().size() > pageSize;
    return true;
  }

  /** Token of the first record in display order, null for an empty page. */
  public String startCursor() {
    encodeBoundaryCursors();
    return startCursor;
  }

  /** Token of the last record in display order, null for an empty page. */
  public String endCursor() {
    encodeBoundaryCursors();
    return endCursor;
  }

  public CursorPage<T> page() {
    return new CursorPage<>(records(), hasNext(), hasPrevious(), startCursor(), endCursor(), total());
  }

  private void encodeBoundaryCursors() {
    if (boundaryCursorsEncoded) return;
    List<T> r = records();
    if (!r.isEmpty()) {
      startCursor = codec.encode(r.get(0), orderSpec, source.reader());
      endCursor = codec.encode(r.get(r.size() - 1), orderSpec, source.reader());
    }
    boundaryCursorsEncoded = true;
  }

  private List<T> recordsPlusOne() {
    if (recordsPlusOne == null) {
      PageSource<T> filtered = filtered();
      long start = System.nanoTime();
      recordsPlusOne = filtered.fetch(pageSize + 1);
      if (log.isDebugEnabled()) {
        log.debug("cursorpage.fetch direction={} order={} pageSize={} hasCursor={} fetched={} durationMs={}",
            direction, orderSpec, pageSize, cursor != null, recordsPlusOne.size(),
            (System.nanoTime() - start) / 1_000_000.0);
      }
    }
    return recordsPlusOne;
  }

  private PageSource<T> filtered() {
    if (cursor == null) return sorted;
    Cursor decoded = codec.decode(cursor, orderSpec);
    QueryElement boundary = boundaries.build(orderSpec, decoded, direction);
    return sorted.where(boundary);
  }
}
