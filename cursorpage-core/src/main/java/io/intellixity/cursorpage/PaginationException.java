package io.intellixity.cursorpage;

/**
 * Request-level pagination failure. Never retriable: the caller supplied an ordering or cursor
 * that cannot be paginated and no partial page is produced.
 */
public class PaginationException extends RuntimeException {
  public PaginationException(String message) {
    super(message);
  }

  public PaginationException(String message, Throwable cause) {
    super(message, cause);
  }
}
