package io.intellixity.cursorpage.jdbc;

import io.intellixity.cursorpage.jdbc.dialect.AbstractSqlDialect;
import io.intellixity.cursorpage.order.OrderExpression;
import io.intellixity.cursorpage.query.QueryFilters;
import io.intellixity.cursorpage.query.SortField;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcPageSourceTest {
  private static final class TestDialect extends AbstractSqlDialect {
    @Override public String id() { return "test"; }
    @Override protected String quoteIdent(String ident) { return ident; }
    @Override protected String applyLimit(String sql, int limit) { return sql + " LIMIT " + limit; }
  }

  /** Never hands out a connection. */
  private static final class FailingDataSource implements DataSource {
    @Override public Connection getConnection() throws SQLException { throw new SQLException("down"); }
    @Override public Connection getConnection(String u, String p) throws SQLException { throw new SQLException("down"); }
    @Override public PrintWriter getLogWriter() { return null; }
    @Override public void setLogWriter(PrintWriter out) {}
    @Override public void setLoginTimeout(int seconds) {}
    @Override public int getLoginTimeout() { return 0; }
    @Override public Logger getParentLogger() { return Logger.getGlobal(); }
    @Override public <T> T unwrap(Class<T> iface) throws SQLException { throw new SQLException("not a wrapper"); }
    @Override public boolean isWrapperFor(Class<?> iface) { return false; }
  }

  private final JdbcPageSource source = JdbcPageSource.of(new FailingDataSource(), new TestDialect(), "posts");

  @Test
  void addsSortFieldsMissingFromProjection() {
    SqlStatement st = source.select("title")
        .reorder(List.of(SortField.desc("display_index"), SortField.asc("id")))
        .selectStatement(3);
    assertEquals("SELECT title, display_index, id FROM posts ORDER BY display_index DESC, id ASC LIMIT 3", st.sql());
  }

  @Test
  void andsBoundaryWithCallerFilter() {
    JdbcPageSource filtered = source.where(QueryFilters.eq("published", true))
        .reorder(List.of(SortField.asc("id")))
        .where(QueryFilters.gt("id", 10));

    assertEquals("SELECT * FROM posts WHERE (published = :b1 AND id > :b2) ORDER BY id ASC LIMIT 4",
        filtered.selectStatement(4).sql());
    assertEquals("SELECT COUNT(1) FROM posts WHERE (published = :b1 AND id > :b2)", filtered.countStatement().sql());
  }

  @Test
  void keepsCallerOrderAndIdField() {
    JdbcPageSource s = source.orderBy(OrderExpression.text("display_index desc")).withIdField("post_id");
    assertEquals(List.of(OrderExpression.text("display_index desc")), s.order());
    assertEquals("post_id", s.idField());
    assertEquals(3, s.reader().read(Map.of("display_index", 3), "display_index"));
  }

  @Test
  void wrapsSqlExceptions() {
    JdbcExecutionException fetch = assertThrows(JdbcExecutionException.class, () -> source.fetch(2));
    assertEquals("down", fetch.getCause().getMessage());
    assertThrows(JdbcExecutionException.class, source::count);
  }

  @Test
  void selectsMappedSortFieldsUnderTheirOwnName() {
    TableRef t = TableRef.of("posts").withColumn("title_key", "UPPER(title)");
    SqlStatement st = JdbcPageSource.of(new FailingDataSource(), new TestDialect(), t)
        .reorder(List.of(SortField.asc("title_key"), SortField.asc("id")))
        .selectStatement(3);
    assertEquals("SELECT posts.*, UPPER(title) AS title_key FROM posts ORDER BY UPPER(title) ASC, id ASC LIMIT 3",
        st.sql());
  }
}
