package io.intellixity.cursorpage.page;

import io.intellixity.cursorpage.cursor.Cursor;
import io.intellixity.cursorpage.cursor.InvalidCursorException;
import io.intellixity.cursorpage.order.OrderSpec;
import io.intellixity.cursorpage.query.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexicographic keyset predicate selecting rows strictly after the cursor in traversal order.
 *
 * <pre>
 * (f1 &gt; c1) OR (f1 = c1 AND f2 &gt; c2) OR ... OR (f1 = c1 AND ... AND fn &gt; cn)
 * </pre>
 *
 * The comparison for {@code fk} is {@code GT} when its effective direction is ascending and
 * {@code LT} otherwise. Backward traversal flips every field's direction.
 */
public final class BoundaryPredicateBuilder {

  public QueryElement build(OrderSpec spec, Cursor cursor, TraversalDirection direction) {
    if (cursor.size() != spec.size() || !cursor.fields().equals(spec.names())) {
      throw new InvalidCursorException("The given cursor is mismatched with current query");
    }
    OrderSpec effective = (direction == TraversalDirection.BACKWARD) ? spec.reversed() : spec;

    List<QueryElement> orTerms = new ArrayList<>(effective.size());
    for (int i = 0; i < effective.size(); i++) {
      List<QueryElement> andTerms = new ArrayList<>(i + 1);

      // equalities for 0..i-1
      for (int j = 0; j < i; j++) {
        String field = effective.fields().get(j).field();
        andTerms.add(QueryFilters.eq(field, requireValue(cursor, j)));
      }

      SortField sf = effective.fields().get(i);
      Object v = requireValue(cursor, i);
      andTerms.add(sf.direction() == SortField.Direction.ASC
          ? QueryFilters.gt(sf.field(), v)
          : QueryFilters.lt(sf.field(), v));

      orTerms.add(andTerms.size() == 1 ? andTerms.get(0) : new LogicalGroup(Clause.AND, andTerms));
    }
    return orTerms.size() == 1 ? orTerms.get(0) : new LogicalGroup(Clause.OR, orTerms);
  }

  private static Object requireValue(Cursor cursor, int index) {
    Object v = cursor.value(index);
    if (v == null) {
      throw new InvalidCursorException("Cursor value for order field '" + cursor.entries().get(index).field()
          + "' is null; keyset pagination requires non-null order values");
    }
    return v;
  }
}
