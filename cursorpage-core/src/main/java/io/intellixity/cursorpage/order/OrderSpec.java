package io.intellixity.cursorpage.order;

import io.intellixity.cursorpage.query.SortField;

import java.util.*;

/**
 * Canonical ordering: non-empty, no duplicate field, last field is the unique identifier.
 * Built only by {@link OrderNormalizer}.
 */
public record OrderSpec(List<SortField> fields) {
  public OrderSpec {
    if (fields == null || fields.isEmpty()) throw new IllegalArgumentException("fields must not be empty");
    fields = List.copyOf(fields);
    Set<String> seen = new HashSet<>();
    for (SortField f : fields) {
      if (!seen.add(f.field())) throw new IllegalArgumentException("duplicate order field: " + f.field());
    }
  }

  public int size() { return fields.size(); }

  public List<String> names() {
    List<String> out = new ArrayList<>(fields.size());
    for (SortField f : fields) out.add(f.field());
    return out;
  }

  /** The tie-break field. */
  public SortField last() { return fields.get(fields.size() - 1); }

  /** Every direction flipped; used to walk the sequence backward. */
  public OrderSpec reversed() {
    List<SortField> out = new ArrayList<>(fields.size());
    for (SortField f : fields) out.add(f.reversed());
    return new OrderSpec(out);
  }

  @Override
  public String toString() {
    StringJoiner j = new StringJoiner(", ", "[", "]");
    for (SortField f : fields) j.add(f.field() + " " + f.direction().name().toLowerCase(Locale.ROOT));
    return j.toString();
  }
}
