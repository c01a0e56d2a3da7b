package io.eventlog.jdbc.dialect;

import io.eventlog.jdbc.spi.Dialect;
import io.eventlog.spi.ConnectionProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Looks up event-store dialects registered in
 * {@code META-INF/services/io.eventlog.jdbc.spi.Dialect}.
 *
 * <p>A store built without an explicit dialect asks {@link #detect(ConnectionProvider)}
 * which opens one connection and matches its URL against each dialect's prefixes:
 *
 * <pre>{@code
 * Dialect fromPool = Dialects.detect(dataSource);
 * Dialect fromUrl = Dialects.detect("jdbc:mariadb://db/events");   // mysql
 * Dialect byName = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  // Registration order, keyed by lower-case name
  private static final Map<String, Dialect> REGISTERED = load();

  private Dialects() {
  }

  private static Map<String, Dialect> load() {
    Map<String, Dialect> dialects = new LinkedHashMap<>();
    for (Dialect dialect : ServiceLoader.load(Dialect.class, Dialects.class.getClassLoader())) {
      Dialect previous = dialects.putIfAbsent(dialect.name().toLowerCase(Locale.ROOT), dialect);
      if (previous != null) {
        throw new IllegalStateException("Two dialects named " + dialect.name() + ": "
            + previous.getClass().getName() + " and " + dialect.getClass().getName());
      }
    }
    return Collections.unmodifiableMap(dialects);
  }

  public static List<Dialect> all() {
    return List.copyOf(REGISTERED.values());
  }

  public static Set<String> names() {
    return REGISTERED.keySet();
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static Dialect get(String name) {
    Dialect dialect = name == null ? null : REGISTERED.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect " + name + ", expected one of " + names());
    }
    return dialect;
  }

  /**
   * The dialect whose URL prefix matches, if any.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    return REGISTERED.values().stream()
        .filter(d -> d.jdbcUrlPrefixes().stream().anyMatch(jdbcUrl::startsWith))
        .findFirst();
  }

  /**
   * @throws IllegalArgumentException if the URL is empty or matches no dialect
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No event-store dialect for " + jdbcUrl + ", registered: " + names()));
  }

  public static Dialect detect(DataSource dataSource) {
    return detect((ConnectionProvider) dataSource::getConnection);
  }

  /**
   * Opens one connection and detects the dialect from its metadata URL.
   *
   * @throws IllegalStateException if no connection or metadata could be obtained
   */
  public static Dialect detect(ConnectionProvider connectionProvider) {
    String url;
    try (Connection conn = connectionProvider.getConnection()) {
      url = conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Cannot read the JDBC URL to detect the dialect", e);
    }
    return detect(url);
  }
}
