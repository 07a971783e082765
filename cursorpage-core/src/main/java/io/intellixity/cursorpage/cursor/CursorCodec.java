package io.intellixity.cursorpage.cursor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.intellixity.cursorpage.order.OrderSpec;
import io.intellixity.cursorpage.query.SortField;
import io.intellixity.cursorpage.source.FieldReader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Opaque cursor tokens.\n
 *
 * <p>Token format: standard Base64 of a JSON array holding one single-key object per order field,
 * in order, e.g. {@code [{"display_index":3},{"id":17}]}.</p>
 *
 * <p>A token only decodes against the ordering it was produced under: same length, same field
 * names in the same order.</p>
 *
 * <p>Fractional numbers decode as {@link java.math.BigDecimal} so decimal keys keep every digit.
 * Temporal values decode as their ISO-8601 strings; sources convert them back to the column or
 * record type before comparing.</p>
 */
public final class CursorCodec {
  private static final ObjectMapper DEFAULT_JSON = new ObjectMapper()
      .registerModule(new JavaTimeModule())
      .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private final ObjectMapper json;

  public CursorCodec() {
    this(DEFAULT_JSON);
  }

  public CursorCodec(ObjectMapper json) {
    this.json = Objects.requireNonNull(json, "json");
  }

  public <T> Cursor cursorOf(T record, OrderSpec spec, FieldReader<? super T> reader) {
    Objects.requireNonNull(record, "record");
    List<Cursor.Entry> entries = new ArrayList<>(spec.size());
    for (SortField f : spec.fields()) {
      entries.add(new Cursor.Entry(f.field(), reader.read(record, f.field())));
    }
    return new Cursor(entries);
  }

  public <T> String encode(T record, OrderSpec spec, FieldReader<? super T> reader) {
    return encode(cursorOf(record, spec, reader));
  }

  public String encode(Cursor cursor) {
    List<Map<String, Object>> out = new ArrayList<>(cursor.size());
    for (Cursor.Entry e : cursor.entries()) {
      Map<String, Object> m = new LinkedHashMap<>(2);
      m.put(e.field(), e.value());
      out.add(m);
    }
    try {
      return Base64.getEncoder().encodeToString(json.writeValueAsBytes(out));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Cursor values are not serializable: " + cursor.fields(), e);
    }
  }

  public Cursor decode(String token, OrderSpec spec) {
    Cursor cursor = parse(token);
    if (!cursor.fields().equals(spec.names())) {
      throw new InvalidCursorException("The given cursor is mismatched with current query: cursor fields "
          + cursor.fields() + ", order fields " + spec.names());
    }
    return cursor;
  }

  private Cursor parse(String token) {
    if (token == null) throw new InvalidCursorException("The given cursor could not be decoded");

    JsonNode root;
    try {
      root = json.readTree(Base64.getDecoder().decode(token.getBytes(StandardCharsets.US_ASCII)));
    } catch (IllegalArgumentException | IOException e) {
      throw new InvalidCursorException("The given cursor could not be decoded", e);
    }
    if (root == null || !root.isArray()) {
      throw new InvalidCursorException("The given cursor could not be decoded");
    }

    List<Cursor.Entry> entries = new ArrayList<>(root.size());
    for (JsonNode n : root) {
      if (!n.isObject() || n.size() != 1) {
        throw new InvalidCursorException("The given cursor could not be decoded: expected single-key objects");
      }
      Map.Entry<String, JsonNode> f = n.fields().next();
      entries.add(new Cursor.Entry(f.getKey(), valueOf(f.getValue())));
    }
    return new Cursor(entries);
  }

  private Object valueOf(JsonNode node) {
    if (node.isFloatingPointNumber()) return node.decimalValue();
    return json.convertValue(node, Object.class);
  }
}
