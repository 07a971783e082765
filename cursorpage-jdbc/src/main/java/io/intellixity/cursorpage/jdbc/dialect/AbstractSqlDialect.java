package io.intellixity.cursorpage.jdbc.dialect;

import io.intellixity.cursorpage.jdbc.Bind;
import io.intellixity.cursorpage.jdbc.SqlStatement;
import io.intellixity.cursorpage.jdbc.TableRef;
import io.intellixity.cursorpage.query.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.*;
import java.util.*;

/**
 * Generic SQL rendering shared by dialects.\n
 *
 * Renders:\n
 * - {@code SELECT <projection> FROM <table> [WHERE <filter>] [ORDER BY ...] <limit>}\n
 * - {@code SELECT COUNT(1) FROM <table> [WHERE <filter>]}\n
 *
 * Filters are rendered from the {@link QueryElement} tree with named binds ({@code :b1}, ...).
 * NOT over a group is pushed down with De Morgan; {@code EQ null} / {@code NE null} become
 * {@code IS NULL} / {@code IS NOT NULL}.\n
 *
 * Bound values are converted to the field's type hint ({@link TableRef#typeOf(String)}), so a
 * cursor value that came back from JSON as a string binds as a timestamp, uuid, etc.\n
 *
 * DB-specific dialects override identifier quoting and the limit clause.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Object value, String userTypeId) {
      binds.add(new Bind(value, userTypeId));
      return ":b" + (n++);
    }
    public List<Bind> binds() { return binds; }
  }

  @Override
  public final SqlStatement select(TableRef table, List<String> projection, QueryElement filter,
                                   List<SortField> sort, int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(renderProjection(table, projection))
        .append(" FROM ").append(quoteIdent(table.name()));
    appendWhere(sql, table, filter, ctx);
    appendSort(sql, table, sort);
    return new SqlStatement(applyLimit(sql.toString(), limit), ctx.binds());
  }

  @Override
  public final SqlStatement count(TableRef table, QueryElement filter) {
    RenderCtx ctx = new RenderCtx();
    StringBuilder sql = new StringBuilder("SELECT COUNT(1) FROM ").append(quoteIdent(table.name()));
    appendWhere(sql, table, filter, ctx);
    return new SqlStatement(sql.toString(), ctx.binds());
  }

  /** ANSI row limiting; dialects override (Postgres LIMIT, etc.). */
  protected String applyLimit(String sql, int limit) {
    return sql + " FETCH FIRST " + limit + " ROWS ONLY";
  }

  protected abstract String quoteIdent(String ident);

  /** Empty projection: every column, plus every mapped field under its own name. */
  protected String renderProjection(TableRef table, List<String> projection) {
    if (projection == null || projection.isEmpty()) {
      if (table.columns().isEmpty()) return "*";
      List<String> items = new ArrayList<>();
      items.add(quoteIdent(table.name()) + ".*");
      table.columns().forEach((field, expr) -> items.add(expr + " AS " + quoteIdent(field)));
      return String.join(", ", items);
    }
    List<String> items = new ArrayList<>(projection.size());
    for (String field : projection) {
      String mapped = table.columns().get(field);
      items.add(mapped == null ? quoteIdent(field) : mapped + " AS " + quoteIdent(field));
    }
    return String.join(", ", items);
  }

  protected void appendSort(StringBuilder sql, TableRef table, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> parts = new ArrayList<>(sort.size());
    for (SortField sf : sort) {
      parts.add(resolveSqlExpr(table, sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    sql.append(" ORDER BY ").append(String.join(", ", parts));
  }

  private void appendWhere(StringBuilder sql, TableRef table, QueryElement filter, RenderCtx ctx) {
    if (filter == null) return;
    String predicate = renderPredicateSql(table, filter, ctx, false);
    if (predicate.isBlank()) return;
    sql.append(" WHERE ").append(predicate);
  }

  /** Mapped expression for a field, else the quoted field name. */
  protected String resolveSqlExpr(TableRef table, String field) {
    String mapped = table.columns().get(field);
    return (mapped == null || mapped.isBlank()) ? quoteIdent(field) : mapped;
  }

  private String renderPredicateSql(TableRef table, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(table, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(table, c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String expr = resolveSqlExpr(table, c.property());
    String userTypeId = table.typeOf(c.property());
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, negate)
          : unarySql(expr, "=", value, userTypeId, negate, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, negate)
          : unarySql(expr, "<>", value, userTypeId, negate, ctx);
      case GT -> unaryNonNull(expr, ">", value, userTypeId, negate, ctx);
      case GE -> unaryNonNull(expr, ">=", value, userTypeId, negate, ctx);
      case LT -> unaryNonNull(expr, "<", value, userTypeId, negate, ctx);
      case LE -> unaryNonNull(expr, "<=", value, userTypeId, negate, ctx);
      case IN -> listSql(expr, "IN", toList(value), userTypeId, negate, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), userTypeId, negate, ctx);
    };
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String unarySql(String expr, String op, Object value, String userTypeId, boolean not, RenderCtx ctx) {
    String sql = expr + " " + op + " " + ctx.add(coerceScalar(userTypeId, value), userTypeId);
    return not ? "NOT (" + sql + ")" : sql;
  }

  private String unaryNonNull(String expr, String op, Object value, String userTypeId, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, userTypeId, not, ctx);
  }

  private String listSql(String expr, String op, List<Object> vals, String userTypeId, boolean not, RenderCtx ctx) {
    if (vals.isEmpty()) {
      // "IN ()" matches nothing, "NOT IN ()" matches everything
      boolean matchesAll = op.startsWith("NOT") ^ not;
      return matchesAll ? "1 = 1" : "1 = 0";
    }
    List<String> ph = new ArrayList<>(vals.size());
    for (Object x : vals) ph.add(ctx.add(coerceScalar(userTypeId, x), userTypeId));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  /**
   * Converts a bound value to the JDBC type of its type hint. Values without a hint, and hints this
   * dialect does not know, bind as given. Dialects may override to add their own types.
   */
  protected Object coerceScalar(String userTypeId, Object value) {
    if (value == null || userTypeId == null) return value;
    try {
      return switch (userTypeId.toLowerCase(Locale.ROOT)) {
        case TableRef.UUID -> (value instanceof UUID) ? value : UUID.fromString(text(value));
        case TableRef.TIMESTAMP -> (value instanceof String) ? LocalDateTime.parse(text(value)) : value;
        case TableRef.TIMESTAMPTZ -> toOffsetDateTime(value);
        case TableRef.DATE -> (value instanceof String) ? LocalDate.parse(text(value)) : value;
        case TableRef.TIME -> (value instanceof String) ? LocalTime.parse(text(value)) : value;
        case TableRef.DECIMAL -> toBigDecimal(value);
        case TableRef.BIGINT -> (value instanceof Number n && !(value instanceof BigDecimal))
            ? Long.valueOf(n.longValue()) : Long.valueOf(text(value));
        default -> value;
      };
    } catch (DateTimeException | IllegalArgumentException e) {
      throw new IllegalArgumentException("Value '" + value + "' is not a valid " + userTypeId, e);
    }
  }

  private static Object toOffsetDateTime(Object value) {
    if (value instanceof Instant i) return i.atOffset(ZoneOffset.UTC);
    if (value instanceof ZonedDateTime z) return z.toOffsetDateTime();
    if (value instanceof String) return OffsetDateTime.parse(text(value));
    return value;
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value instanceof BigDecimal bd) return bd;
    if (value instanceof BigInteger bi) return new BigDecimal(bi);
    if (value instanceof Double || value instanceof Float) return BigDecimal.valueOf(((Number) value).doubleValue());
    if (value instanceof Number n) return BigDecimal.valueOf(n.longValue());
    return new BigDecimal(text(value));
  }

  private static String text(Object value) {
    return String.valueOf(value).trim();
  }

  @SuppressWarnings("unchecked")
  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof List<?> l) return (List<Object>) l;
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
