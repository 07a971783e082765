package io.intellixity.cursorpage.cursor;

import java.util.*;

/** Position of one record under an ordering: one entry per order field, in order. */
public record Cursor(List<Entry> entries) {
  public Cursor {
    entries = List.copyOf(entries == null ? List.of() : entries);
  }

  public record Entry(String field, Object value) {
    public Entry {
      Objects.requireNonNull(field, "field");
    }
  }

  public int size() { return entries.size(); }

  public List<String> fields() {
    List<String> out = new ArrayList<>(entries.size());
    for (Entry e : entries) out.add(e.field());
    return out;
  }

  public Object value(int index) { return entries.get(index).value(); }

  /** Values keyed by field, in order. */
  public Map<String, Object> asMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Entry e : entries) out.put(e.field(), e.value());
    return out;
  }
}
