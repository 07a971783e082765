package io.intellixity.cursorpage.source;

import io.intellixity.cursorpage.order.OrderExpression;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.query.SortField;

import java.util.List;

/**
 * Storage collaborator consumed by {@link io.intellixity.cursorpage.page.Paginator}.
 *
 * <p>Implementations are immutable: {@link #reorder(List)} and {@link #where(QueryElement)} return
 * new instances and leave the receiver untouched. Store failures propagate as the implementation's
 * own unchecked exceptions.</p>
 */
public interface PageSource<T> {
  /** Caller ordering, possibly empty. */
  List<OrderExpression> order();

  /** Field whose value is unique per record. */
  default String idField() { return "id"; }

  /** Replace the ordering with the given effective sort. */
  PageSource<T> reorder(List<SortField> sort);

  /** Restrict to rows satisfying the predicate, in addition to any existing filter. */
  PageSource<T> where(QueryElement predicate);

  /** Up to {@code limit} rows in the current order. */
  List<T> fetch(int limit);

  /** Row count honouring filters; ordering is irrelevant. */
  long count();

  FieldReader<T> reader();
}
