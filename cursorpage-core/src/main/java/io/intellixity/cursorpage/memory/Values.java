package io.intellixity.cursorpage.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Value comparison for in-memory evaluation.
 *
 * - Numbers compare by numeric value across boxed types (a cursor decoded from JSON may carry an
 *   Integer where the record holds a Long, or a BigDecimal where it holds a Double).\n
 * - A string facing a value of another type is converted to that type first, the way a cursor
 *   value was written: temporal values come back from a cursor as ISO strings.\n
 * - Offset and zoned date-times compare by instant.\n
 * - null sorts before everything.
 */
final class Values {
  private static final ObjectMapper JSON = new ObjectMapper().registerModule(new JavaTimeModule());

  private Values() {}

  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object a, Object b) {
    if (a == b) return 0;
    if (a == null) return -1;
    if (b == null) return 1;
    if (a instanceof String && !(b instanceof String)) a = convert(a, typeOf(b));
    else if (b instanceof String && !(a instanceof String)) b = convert(b, typeOf(a));

    if (a instanceof Number na && b instanceof Number nb) return toBigDecimal(na).compareTo(toBigDecimal(nb));
    a = onTimeline(a);
    b = onTimeline(b);
    if (typeOf(a) == typeOf(b) && a instanceof Comparable ca) return ca.compareTo(b);
    throw new IllegalArgumentException("Values are not comparable: "
        + a.getClass().getName() + " and " + b.getClass().getName());
  }

  static boolean equal(Object a, Object b) {
    if (a == null || b == null) return Objects.equals(a, b);
    return compare(a, b) == 0;
  }

  private static Object convert(Object text, Class<?> type) {
    try {
      return JSON.convertValue(text, type);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Value '" + text + "' is not a valid " + type.getSimpleName(), e);
    }
  }

  // enum constants with a body are anonymous subclasses
  private static Class<?> typeOf(Object v) {
    return (v instanceof Enum<?> e) ? e.getDeclaringClass() : v.getClass();
  }

  private static Object onTimeline(Object v) {
    if (v instanceof OffsetDateTime odt) return odt.toInstant();
    if (v instanceof ZonedDateTime zdt) return zdt.toInstant();
    return v;
  }

  private static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof BigInteger bi) return new BigDecimal(bi);
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return BigDecimal.valueOf(n.longValue());
  }
}
