package io.intellixity.cursorpage.memory;

import io.intellixity.cursorpage.query.*;
import io.intellixity.cursorpage.source.FieldReader;

import java.util.Collection;
import java.util.List;
import java.util.function.IntPredicate;
import java.util.function.Predicate;

/**
 * Compiles a {@link QueryElement} into a {@link Predicate} over records.
 *
 * <p>Comparisons against a null record value are false, as in SQL; {@code EQ null} / {@code NE null}
 * test for null.</p>
 */
final class PredicateEvaluator<T> implements QueryVisitor<Predicate<T>> {
  private final FieldReader<T> reader;

  PredicateEvaluator(FieldReader<T> reader) {
    this.reader = reader;
  }

  Predicate<T> compile(QueryElement el) {
    return (el == null) ? r -> true : el.accept(this);
  }

  @Override
  public Predicate<T> visit(Condition c) {
    String field = c.property();
    Object value = c.value();
    return switch (c.operator()) {
      case EQ -> r -> Values.equal(reader.read(r, field), value);
      case NE -> r -> !Values.equal(reader.read(r, field), value);
      case GT -> r -> ordered(reader.read(r, field), value, cmp -> cmp > 0);
      case GE -> r -> ordered(reader.read(r, field), value, cmp -> cmp >= 0);
      case LT -> r -> ordered(reader.read(r, field), value, cmp -> cmp < 0);
      case LE -> r -> ordered(reader.read(r, field), value, cmp -> cmp <= 0);
      case IN -> r -> contains(value, reader.read(r, field));
      case NIN -> r -> !contains(value, reader.read(r, field));
    };
  }

  @Override
  public Predicate<T> visit(LogicalGroup group) {
    List<Predicate<T>> parts = group.elements().stream().map(this::compile).toList();
    if (group.clause() == Clause.OR) return r -> parts.stream().anyMatch(p -> p.test(r));
    return r -> parts.stream().allMatch(p -> p.test(r));
  }

  @Override
  public Predicate<T> visit(NotElement not) {
    return compile(not.element()).negate();
  }

  // null never satisfies an ordering comparison
  private static boolean ordered(Object recordValue, Object value, IntPredicate test) {
    if (recordValue == null || value == null) return false;
    return test.test(Values.compare(recordValue, value));
  }

  private static boolean contains(Object values, Object v) {
    if (!(values instanceof Collection<?> c)) return Values.equal(values, v);
    for (Object x : c) if (Values.equal(x, v)) return true;
    return false;
  }
}
