package io.intellixity.cursorpage.memory;

import io.intellixity.cursorpage.order.OrderExpression;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.query.QueryFilters;
import io.intellixity.cursorpage.query.SortField;
import io.intellixity.cursorpage.source.FieldReader;
import io.intellixity.cursorpage.source.PageSource;

import java.util.*;

/**
 * {@link PageSource} over a list held in memory.
 *
 * <p>Filters are evaluated by {@link PredicateEvaluator}; sorting compares values with
 * {@link Values#compare(Object, Object)} (nulls first when ascending). The backing list is copied
 * once and shared between derived sources.</p>
 */
public final class InMemoryPageSource<T> implements PageSource<T> {
  private final List<T> rows;
  private final FieldReader<T> reader;
  private final String idField;
  private final List<OrderExpression> order;
  private final List<SortField> sort;
  private final QueryElement filter;

  private InMemoryPageSource(List<T> rows, FieldReader<T> reader, String idField,
                             List<OrderExpression> order, List<SortField> sort, QueryElement filter) {
    this.rows = rows;
    this.reader = reader;
    this.idField = idField;
    this.order = order;
    this.sort = sort;
    this.filter = filter;
  }

  public static <T> InMemoryPageSource<T> of(Collection<T> rows, FieldReader<T> reader) {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(reader, "reader");
    return new InMemoryPageSource<>(List.copyOf(rows), reader, "id", List.of(), List.of(), null);
  }

  public static InMemoryPageSource<Map<String, Object>> ofMaps(Collection<? extends Map<String, Object>> rows) {
    List<Map<String, Object>> copy = new ArrayList<>(rows);
    return of(copy, Map::get);
  }

  /** Caller ordering, replacing any previous one. */
  public InMemoryPageSource<T> orderBy(OrderExpression... expressions) {
    return new InMemoryPageSource<>(rows, reader, idField, List.of(expressions), sort, filter);
  }

  public InMemoryPageSource<T> withIdField(String idField) {
    return new InMemoryPageSource<>(rows, reader, Objects.requireNonNull(idField, "idField"), order, sort, filter);
  }

  @Override public List<OrderExpression> order() { return order; }
  @Override public String idField() { return idField; }
  @Override public FieldReader<T> reader() { return reader; }

  /** Effective sort applied by {@link #fetch(int)}; empty means insertion order. */
  public List<SortField> sort() { return sort; }

  public QueryElement filter() { return filter; }

  @Override
  public InMemoryPageSource<T> reorder(List<SortField> sort) {
    return new InMemoryPageSource<>(rows, reader, idField, order, List.copyOf(sort == null ? List.of() : sort), filter);
  }

  @Override
  public InMemoryPageSource<T> where(QueryElement predicate) {
    return new InMemoryPageSource<>(rows, reader, idField, order, sort, QueryFilters.both(filter, predicate));
  }

  @Override
  public List<T> fetch(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    return rows.stream()
        .filter(new PredicateEvaluator<>(reader).compile(filter))
        .sorted(comparator())
        .limit(limit)
        .toList();
  }

  @Override
  public long count() {
    return rows.stream().filter(new PredicateEvaluator<>(reader).compile(filter)).count();
  }

  private Comparator<T> comparator() {
    Comparator<T> c = (a, b) -> 0;
    for (SortField sf : sort) {
      String field = sf.field();
      Comparator<T> byField = (a, b) -> Values.compare(reader.read(a, field), reader.read(b, field));
      c = c.thenComparing(sf.direction() == SortField.Direction.DESC ? byField.reversed() : byField);
    }
    return c;
  }
}
