package intake.jdbc.queue;

import intake.jdbc.DialectStoreRegistry;
import intake.jdbc.JsonCodec;

import javax.sql.DataSource;
import java.util.List;
import java.util.Objects;

/**
 * Registry for JDBC queue stores with auto-detection support.
 *
 * <p>Queue stores are loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/intake.jdbc.queue.AbstractJdbcQueueStore}.
 *
 * <pre>{@code
 * AbstractJdbcQueueStore store = JdbcQueueStores.detect(dataSource);
 * AbstractJdbcQueueStore h2 = JdbcQueueStores.get("h2");
 * }</pre>
 */
public final class JdbcQueueStores {
  private static final DialectStoreRegistry<AbstractJdbcQueueStore> REGISTRY =
      new DialectStoreRegistry<>(AbstractJdbcQueueStore.class, "queue store");

  private JdbcQueueStores() {
  }

  public static List<AbstractJdbcQueueStore> all() {
    return REGISTRY.all();
  }

  public static AbstractJdbcQueueStore get(String name) {
    return REGISTRY.get(name);
  }

  public static AbstractJdbcQueueStore detect(DataSource dataSource) {
    return REGISTRY.detect(dataSource);
  }

  public static AbstractJdbcQueueStore detect(String jdbcUrl) {
    return REGISTRY.detect(jdbcUrl);
  }

  public static AbstractJdbcQueueStore detect(DataSource dataSource, JsonCodec jsonCodec) {
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return REGISTRY.detect(dataSource).withJsonCodec(jsonCodec);
  }
}
