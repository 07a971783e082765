package io.intellixity.cursorpage.page;

import java.util.List;

/**
 * Immutable snapshot of one page. {@code records} are in display order whatever the traversal
 * direction; cursors are null when the page is empty.
 */
public record CursorPage<T>(List<T> records,
                            boolean hasNext,
                            boolean hasPrevious,
                            String startCursor,
                            String endCursor,
                            long total) {
  public CursorPage {
    records = List.copyOf(records == null ? List.of() : records);
  }

  public boolean isEmpty() { return records.isEmpty(); }
}
