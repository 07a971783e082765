package io.intellixity.cursorpage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Page size defaults.\n
 *
 * <p>{@link #load()} reads every {@code META-INF/cursorpage.properties} on the classpath (the first
 * resource defining a key wins), then applies JVM system properties of the same names:</p>
 *
 * <pre>
 * cursorpage.page-size.default=10
 * cursorpage.page-size.max=1000
 * </pre>
 */
public record PaginationSettings(int defaultPageSize, int maxPageSize) {
  private static final Logger log = LoggerFactory.getLogger(PaginationSettings.class);

  public static final String RESOURCE = "META-INF/cursorpage.properties";
  public static final String DEFAULT_PAGE_SIZE = "cursorpage.page-size.default";
  public static final String MAX_PAGE_SIZE = "cursorpage.page-size.max";

  public static final PaginationSettings DEFAULTS = new PaginationSettings(10, 1000);

  public PaginationSettings {
    if (defaultPageSize <= 0) throw new IllegalArgumentException("defaultPageSize must be > 0");
    if (maxPageSize < defaultPageSize) throw new IllegalArgumentException("maxPageSize must be >= defaultPageSize");
  }

  /** Resolve a requested page size: null means default; out of range is rejected. */
  public int resolvePageSize(Integer requested) {
    if (requested == null) return defaultPageSize;
    if (requested <= 0) throw new IllegalArgumentException("pageSize must be > 0");
    if (requested > maxPageSize) {
      throw new IllegalArgumentException("pageSize must be <= " + maxPageSize + " but was " + requested);
    }
    return requested;
  }

  /** Settings loaded once per class loader of this class, on first use. */
  public static PaginationSettings shared() {
    return Holder.SHARED;
  }

  public static PaginationSettings load() {
    return load(Thread.currentThread().getContextClassLoader(), System.getProperties());
  }

  public static PaginationSettings load(ClassLoader cl, Properties overrides) {
    if (cl == null) cl = PaginationSettings.class.getClassLoader();

    Properties merged = new Properties();
    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }
      for (String k : p.stringPropertyNames()) merged.putIfAbsent(k, p.getProperty(k));
    }
    if (overrides != null) {
      for (String k : List.of(DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE)) {
        String v = overrides.getProperty(k);
        if (v != null) merged.setProperty(k, v);
      }
    }

    PaginationSettings s = new PaginationSettings(
        intProp(merged, DEFAULT_PAGE_SIZE, DEFAULTS.defaultPageSize()),
        intProp(merged, MAX_PAGE_SIZE, DEFAULTS.maxPageSize()));
    log.debug("cursorpage.settings defaultPageSize={} maxPageSize={}", s.defaultPageSize(), s.maxPageSize());
    return s;
  }

  private static int intProp(Properties p, String key, int fallback) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return fallback;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
    }
  }

  private static final class Holder {
    static final PaginationSettings SHARED = load(PaginationSettings.class.getClassLoader(), System.getProperties());
  }
}
