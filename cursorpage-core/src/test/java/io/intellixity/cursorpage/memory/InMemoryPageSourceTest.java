package io.intellixity.cursorpage.memory;

import io.intellixity.cursorpage.order.OrderExpression;
import io.intellixity.cursorpage.query.SortField;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.*;

import static io.intellixity.cursorpage.query.QueryFilters.*;
import static org.junit.jupiter.api.Assertions.*;

final class InMemoryPageSourceTest {
  private record Item(long id, String name, Integer rank) {}

  private static InMemoryPageSource<Item> items() {
    List<Item> rows = List.of(
        new Item(1, "b", 2),
        new Item(2, "a", null),
        new Item(3, "c", 1),
        new Item(4, "a", 3));
    return InMemoryPageSource.of(rows, (r, f) -> switch (f) {
      case "id" -> r.id();
      case "name" -> r.name();
      case "rank" -> r.rank();
      default -> throw new IllegalArgumentException("unknown field " + f);
    });
  }

  private static List<Long> ids(List<Item> rows) {
    return rows.stream().map(Item::id).toList();
  }

  @Test
  void sortsByEveryFieldInTurn() {
    var sorted = items().reorder(List.of(SortField.asc("name"), SortField.desc("id")));
    assertEquals(List.of(4L, 2L, 1L, 3L), ids(sorted.fetch(10)));
  }

  @Test
  void nullsSortFirstAscending() {
    assertEquals(List.of(2L, 3L, 1L, 4L), ids(items().reorder(List.of(SortField.asc("rank"))).fetch(10)));
    assertEquals(List.of(4L, 1L, 3L, 2L), ids(items().reorder(List.of(SortField.desc("rank"))).fetch(10)));
  }

  @Test
  void comparesNumbersAcrossBoxedTypes() {
    // cursor values decoded from JSON are Integers while the record holds longs
    assertEquals(List.of(3L, 4L), ids(items().where(gt("id", 2)).reorder(List.of(SortField.asc("id"))).fetch(10)));
    assertEquals(List.of(2L), ids(items().where(eq("id", 2)).fetch(10)));
  }

  @Test
  void comparesIsoStringsAsTheRecordsTemporalType() {
    Map<String, Object> whole = new HashMap<>(Map.of("id", 1, "at", Instant.parse("2024-01-01T10:00:00Z")));
    Map<String, Object> half = new HashMap<>(Map.of("id", 2, "at", Instant.parse("2024-01-01T10:00:00.500Z")));
    InMemoryPageSource<Map<String, Object>> source = InMemoryPageSource.ofMaps(List.of(whole, half));

    // lexically "...00.500Z" sorts before "...00Z"
    assertEquals(List.of(half), source.where(gt("at", "2024-01-01T10:00:00Z")).fetch(10));
    assertEquals(List.of(whole), source.where(lt("at", "2024-01-01T10:00:00.500Z")).fetch(10));

    Map<String, Object> local = new HashMap<>(Map.of("id", 3, "at", LocalDateTime.of(2024, 1, 1, 10, 0)));
    InMemoryPageSource<Map<String, Object>> locals = InMemoryPageSource.ofMaps(List.of(local));
    assertEquals(List.of(local), locals.where(eq("at", "2024-01-01T10:00:00")).fetch(10));
  }

  @Test
  void comparesOffsetDateTimesByInstant() {
    Map<String, Object> row = new HashMap<>(Map.of("id", 1, "at", OffsetDateTime.parse("2024-01-01T12:00:00+02:00")));
    InMemoryPageSource<Map<String, Object>> source = InMemoryPageSource.ofMaps(List.of(row));
    assertEquals(1, source.where(eq("at", "2024-01-01T10:00:00Z")).count());
  }

  @Test
  void rejectsStringsThatAreNotTheRecordsType() {
    InMemoryPageSource<Item> source = items();
    assertThrows(IllegalArgumentException.class, () -> source.where(gt("id", "abc")).fetch(10));
  }

  @Test
  void comparisonsAgainstNullNeverMatch() {
    assertEquals(List.of(4L), ids(items().where(gt("rank", 2)).fetch(10)));
    assertEquals(List.of(3L), ids(items().where(lt("rank", 2)).fetch(10)));
    assertEquals(List.of(2L), ids(items().where(eq("rank", null)).fetch(10)));
  }

  @Test
  void evaluatesGroupsAndNegation() {
    var filtered = items()
        .where(or(eq("name", "a"), and(ge("rank", 1), le("rank", 1))))
        .where(not(eq("id", 4)))
        .reorder(List.of(SortField.asc("id")));
    assertEquals(List.of(2L, 3L), ids(filtered.fetch(10)));
    assertEquals(2, filtered.count());
  }

  @Test
  void evaluatesMembership() {
    assertEquals(List.of(1L, 3L), ids(items().where(in("name", List.of("b", "c"))).fetch(10)));
    assertEquals(List.of(2L, 4L), ids(items().where(nin("name", List.of("b", "c"))).fetch(10)));
    assertEquals(List.of(1L, 2L, 3L), ids(items().where(ne("id", 4)).fetch(10)));
  }

  @Test
  void limitsAndLeavesReceiverUntouched() {
    InMemoryPageSource<Item> base = items().orderBy(OrderExpression.desc("rank"));
    var derived = base.where(gt("id", 1)).reorder(List.of(SortField.desc("id")));

    assertEquals(List.of(4L, 3L), ids(derived.fetch(2)));
    assertNull(base.filter());
    assertTrue(base.sort().isEmpty());
    assertEquals(4, base.count());
    assertEquals(List.of(OrderExpression.desc("rank")), base.order());
  }

  @Test
  void readsMapRows() {
    Map<String, Object> row = new HashMap<>();
    row.put("id", 1);
    InMemoryPageSource<Map<String, Object>> source = InMemoryPageSource.ofMaps(List.of(row));
    assertEquals(1, source.reader().read(row, "id"));
    assertEquals("id", source.idField());
  }
}
