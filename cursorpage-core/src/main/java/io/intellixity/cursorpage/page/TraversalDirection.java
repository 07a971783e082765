package io.intellixity.cursorpage.page;

/** Which way to walk from the cursor. Independent of each field's own ASC/DESC. */
public enum TraversalDirection {
  FORWARD,
  BACKWARD
}
