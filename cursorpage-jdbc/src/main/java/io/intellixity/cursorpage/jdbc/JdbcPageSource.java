package io.intellixity.cursorpage.jdbc;

import io.intellixity.cursorpage.jdbc.dialect.SqlDialect;
import io.intellixity.cursorpage.order.OrderExpression;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.query.QueryFilters;
import io.intellixity.cursorpage.query.SortField;
import io.intellixity.cursorpage.source.FieldReader;
import io.intellixity.cursorpage.source.PageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.*;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.*;

/**
 * {@link PageSource} over one table reached through a {@link DataSource}.
 *
 * <p>Rows are {@code Map<String, Object>} keyed by column label. When a projection is set, every
 * sort field missing from it is selected too, so cursors can always be built from fetched rows.</p>
 *
 * <p>Columns with a {@link TableRef} type hint are read as that type. Other {@code java.sql}
 * temporal values are read as {@link LocalDateTime} / {@link LocalDate} / {@link LocalTime}, which
 * is the form cursor values are written in.</p>
 *
 * <p>A connection is borrowed per {@link #fetch(int)} / {@link #count()} and returned before the
 * call completes. {@link SQLException}s surface as {@link JdbcExecutionException}.</p>
 */
public final class JdbcPageSource implements PageSource<Map<String, Object>> {
  private static final Logger log = LoggerFactory.getLogger(JdbcPageSource.class);
  private static final FieldReader<Map<String, Object>> READER = Map::get;

  private final DataSource ds;
  private final SqlDialect dialect;
  private final TableRef table;
  private final List<String> projection;
  private final List<OrderExpression> order;
  private final List<SortField> sort;
  private final QueryElement filter;
  private final String idField;

  private JdbcPageSource(DataSource ds, SqlDialect dialect, TableRef table, List<String> projection,
                         List<OrderExpression> order, List<SortField> sort, QueryElement filter, String idField) {
    this.ds = ds;
    this.dialect = dialect;
    this.table = table;
    this.projection = projection;
    this.order = order;
    this.sort = sort;
    this.filter = filter;
    this.idField = idField;
  }

  public static JdbcPageSource of(DataSource ds, SqlDialect dialect, String table) {
    return of(ds, dialect, TableRef.of(table));
  }

  public static JdbcPageSource of(DataSource ds, SqlDialect dialect, TableRef table) {
    return new JdbcPageSource(
        Objects.requireNonNull(ds, "ds"),
        Objects.requireNonNull(dialect, "dialect"),
        Objects.requireNonNull(table, "table"),
        List.of(), List.of(), List.of(), null, "id");
  }

  public JdbcPageSource select(String... fields) {
    return new JdbcPageSource(ds, dialect, table, List.of(fields), order, sort, filter, idField);
  }

  /** Caller ordering, replacing any previous one. */
  public JdbcPageSource orderBy(OrderExpression... expressions) {
    return new JdbcPageSource(ds, dialect, table, projection, List.of(expressions), sort, filter, idField);
  }

  public JdbcPageSource withIdField(String idField) {
    return new JdbcPageSource(ds, dialect, table, projection, order, sort, filter,
        Objects.requireNonNull(idField, "idField"));
  }

  @Override public List<OrderExpression> order() { return order; }
  @Override public String idField() { return idField; }
  @Override public FieldReader<Map<String, Object>> reader() { return READER; }

  @Override
  public JdbcPageSource reorder(List<SortField> sort) {
    return new JdbcPageSource(ds, dialect, table, projection, order,
        List.copyOf(sort == null ? List.of() : sort), filter, idField);
  }

  @Override
  public JdbcPageSource where(QueryElement predicate) {
    return new JdbcPageSource(ds, dialect, table, projection, order, sort,
        QueryFilters.both(filter, predicate), idField);
  }

  /** The statement {@link #fetch(int)} executes. */
  public SqlStatement selectStatement(int limit) {
    return dialect.select(table, projectionWithSortFields(), filter, sort, limit);
  }

  /** The statement {@link #count()} executes. */
  public SqlStatement countStatement() {
    return dialect.count(table, filter);
  }

  @Override
  public List<Map<String, Object>> fetch(int limit) {
    SqlStatement ss = selectStatement(limit);
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("SELECT", ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        List<Map<String, Object>> out = new ArrayList<>();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>(n * 2);
          for (int i = 1; i <= n; i++) {
            String label = md.getColumnLabel(i);
            row.put(label, readColumn(rs, i, table.typeOf(label)));
          }
          out.add(row);
        }
        debugDone("SELECT", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("Failed to fetch page rows from " + table.name(), e);
    }
  }

  @Override
  public long count() {
    SqlStatement ss = countStatement();
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("COUNT", ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        long v = rs.next() ? rs.getLong(1) : 0;
        debugDone("COUNT", v, System.nanoTime() - start);
        return v;
      }
    } catch (SQLException e) {
      throw new JdbcExecutionException("Failed to count rows of " + table.name(), e);
    }
  }

  private List<String> projectionWithSortFields() {
    if (projection.isEmpty()) return projection;
    List<String> out = new ArrayList<>(projection);
    for (SortField sf : sort) {
      if (!out.contains(sf.field())) out.add(sf.field());
    }
    return out;
  }

  private static Object readColumn(ResultSet rs, int i, String userTypeId) throws SQLException {
    Class<?> type = (userTypeId == null) ? null : switch (userTypeId.toLowerCase(Locale.ROOT)) {
      case TableRef.TIMESTAMP -> LocalDateTime.class;
      case TableRef.TIMESTAMPTZ -> OffsetDateTime.class;
      case TableRef.DATE -> LocalDate.class;
      case TableRef.TIME -> LocalTime.class;
      case TableRef.UUID -> UUID.class;
      case TableRef.DECIMAL -> BigDecimal.class;
      default -> null;
    };
    if (type != null) return rs.getObject(i, type);

    Object v = rs.getObject(i);
    if (v instanceof Timestamp ts) return ts.toLocalDateTime();
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof Time t) return t.toLocalTime();
    return v;
  }

  private static void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    int idx = 1;
    for (Bind b : ss.binds()) ps.setObject(idx++, b.value());
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("cursorpage.jdbc op={} dialect={} table={} bindCount={} sql={}",
        op, dialect.id(), table.name(), ss.binds().size(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("cursorpage.jdbc bind index={} userTypeId={} valueType={} valueLen={}",
            idx++, b.userTypeId(), vType, vLen);
      }
    }
  }

  private static void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("cursorpage.jdbc_done op={} durationMs={} result={}", op, durationNanos / 1_000_000.0, result);
  }
}
