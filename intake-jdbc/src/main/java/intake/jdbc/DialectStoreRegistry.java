package intake.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ServiceLoader}-backed lookup of {@link DialectStore}s by name or JDBC URL.
 *
 * @param <T> store type, also the service interface
 */
public final class DialectStoreRegistry<T extends DialectStore> {
  private final String kind;
  private final List<T> stores;
  private final Map<String, T> byName = new ConcurrentHashMap<>();

  public DialectStoreRegistry(Class<T> service, String kind) {
    this.kind = Objects.requireNonNull(kind, "kind");
    this.stores = ServiceLoader.load(service, service.getClassLoader())
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();
    for (T store : stores) {
      byName.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  public List<T> all() {
    return stores;
  }

  /**
   * @throws IllegalArgumentException if no store has that name
   */
  public T get(String name) {
    Objects.requireNonNull(name, "name");
    T store = byName.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown " + kind + ": " + name + ". Available: " + byName.keySet());
    }
    return store;
  }

  /**
   * @throws IllegalStateException if the URL cannot be read from the data source
   * @throws IllegalArgumentException if no store handles the URL
   */
  public T detect(DataSource dataSource) {
    return detect(jdbcUrl(dataSource));
  }

  /**
   * @throws IllegalArgumentException if no store handles the URL
   */
  public T detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (T store : stores) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No " + kind + " found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  public static String jdbcUrl(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return conn.getMetaData().getURL();
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to read JDBC URL from DataSource", e);
    }
  }

  private List<String> allPrefixes() {
    return stores.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
