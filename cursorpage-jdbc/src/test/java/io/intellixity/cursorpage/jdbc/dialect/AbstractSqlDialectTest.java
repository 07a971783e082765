package io.intellixity.cursorpage.jdbc.dialect;

import io.intellixity.cursorpage.jdbc.Bind;
import io.intellixity.cursorpage.jdbc.SqlStatement;
import io.intellixity.cursorpage.jdbc.TableRef;
import io.intellixity.cursorpage.query.QueryElement;
import io.intellixity.cursorpage.query.SortField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static io.intellixity.cursorpage.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class AbstractSqlDialectTest {
  private static final class AnsiDialect extends AbstractSqlDialect {
    @Override public String id() { return "ansi"; }
    @Override protected String quoteIdent(String ident) { return "\"" + ident + "\""; }
  }

  private final AnsiDialect d = new AnsiDialect();

  private static List<Object> values(SqlStatement st) {
    return st.binds().stream().map(Bind::value).toList();
  }

  @Test
  void rendersSelectWithoutFilter() {
    SqlStatement st = d.select(TableRef.of("posts"), List.of(), null,
        List.of(SortField.desc("display_index"), SortField.asc("id")), 3);
    assertEquals("SELECT * FROM \"posts\" ORDER BY \"display_index\" DESC, \"id\" ASC FETCH FIRST 3 ROWS ONLY", st.sql());
    assertTrue(st.binds().isEmpty());
  }

  @Test
  void rendersKeysetBoundaryAsNestedGroups() {
    QueryElement boundary = or(lt("display_index", 4), and(eq("display_index", 4), gt("id", 5)));
    SqlStatement st = d.select(TableRef.of("posts"), List.of("id", "display_index"), boundary,
        List.of(SortField.desc("display_index"), SortField.asc("id")), 3);

    assertEquals("SELECT \"id\", \"display_index\" FROM \"posts\""
        + " WHERE (\"display_index\" < :b1 OR (\"display_index\" = :b2 AND \"id\" > :b3))"
        + " ORDER BY \"display_index\" DESC, \"id\" ASC FETCH FIRST 3 ROWS ONLY", st.sql());
    assertEquals(List.of(4, 4, 5), values(st));
  }

  @Test
  void usesColumnMappingForFieldsAndProjection() {
    TableRef t = TableRef.of("posts").withColumn("displayIndex", "p.display_index");
    SqlStatement st = d.select(t, List.of("displayIndex"), gt("displayIndex", 1), List.of(SortField.asc("displayIndex")), 2);
    assertEquals("SELECT p.display_index AS \"displayIndex\" FROM \"posts\" WHERE p.display_index > :b1"
        + " ORDER BY p.display_index ASC FETCH FIRST 2 ROWS ONLY", st.sql());
  }

  @Test
  void pushesNotThroughGroups() {
    SqlStatement st = d.count(TableRef.of("posts"), not(or(eq("a", 1), eq("b", null))));
    assertEquals("SELECT COUNT(1) FROM \"posts\" WHERE (NOT (\"a\" = :b1) AND NOT (\"b\" IS NULL))", st.sql());
    assertEquals(List.of(1), values(st));
  }

  @Test
  void rendersMembershipAndEmptyLists() {
    assertEquals("SELECT COUNT(1) FROM \"posts\" WHERE \"id\" IN (:b1, :b2)",
        d.count(TableRef.of("posts"), in("id", List.of(1, 2))).sql());
    assertEquals("SELECT COUNT(1) FROM \"posts\" WHERE 1 = 0",
        d.count(TableRef.of("posts"), in("id", List.of())).sql());
    assertEquals("SELECT COUNT(1) FROM \"posts\" WHERE 1 = 1",
        d.count(TableRef.of("posts"), nin("id", List.of())).sql());
  }

  @Test
  void rejectsOrderingComparisonWithNull() {
    assertThrows(IllegalArgumentException.class,
        () -> d.count(TableRef.of("posts"), gt("id", null)));
  }

  @Test
  void projectsMappedFieldsWhenNoProjectionIsGiven() {
    TableRef t = TableRef.of("posts").withColumn("displayIndex", "p.display_index");
    SqlStatement st = d.select(t, List.of(), null, List.of(SortField.asc("displayIndex"), SortField.asc("id")), 2);
    assertEquals("SELECT \"posts\".*, p.display_index AS \"displayIndex\" FROM \"posts\""
        + " ORDER BY p.display_index ASC, \"id\" ASC FETCH FIRST 2 ROWS ONLY", st.sql());
  }

  @Test
  void convertsBoundValuesToTheFieldsTypeHint() {
    TableRef t = TableRef.of("events")
        .withType("created_at", TableRef.TIMESTAMP)
        .withType("seen_at", TableRef.TIMESTAMPTZ)
        .withType("ref", TableRef.UUID)
        .withType("amount", TableRef.DECIMAL);
    UUID ref = UUID.fromString("3f2c1a9e-8d4b-4c6f-9a7e-1b2c3d4e5f60");

    SqlStatement st = d.count(t, and(
        gt("created_at", "2024-01-01T10:00:00"),
        lt("seen_at", Instant.parse("2024-01-01T10:00:00.500Z")),
        eq("ref", ref.toString()),
        ge("amount", 12),
        in("id", List.of("1", "2"))));

    assertEquals(List.of(
        LocalDateTime.of(2024, 1, 1, 10, 0),
        OffsetDateTime.of(2024, 1, 1, 10, 0, 0, 500_000_000, ZoneOffset.UTC),
        ref,
        BigDecimal.valueOf(12),
        "1", "2"), values(st));
    assertEquals(TableRef.TIMESTAMP, st.binds().get(0).userTypeId());
    assertNull(st.binds().get(4).userTypeId());
  }

  @Test
  void rejectsValueThatDoesNotMatchTheTypeHint() {
    TableRef t = TableRef.of("events").withType("created_at", TableRef.TIMESTAMP);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> d.count(t, gt("created_at", "yesterday")));
    assertTrue(ex.getMessage().contains("timestamp"));
  }
}
