package io.intellixity.cursorpage.jdbc;

/** One positional parameter value, in placeholder order, with the field's type hint (may be null). */
public record Bind(Object value, String userTypeId) {}
