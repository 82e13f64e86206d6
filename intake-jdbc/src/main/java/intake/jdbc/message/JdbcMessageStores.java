package intake.jdbc.message;

import intake.jdbc.DialectStoreRegistry;
import intake.jdbc.JsonCodec;

import javax.sql.DataSource;
import java.util.List;
import java.util.Objects;

/**
 * Registry for JDBC message stores, loaded via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/intake.jdbc.message.AbstractJdbcMessageStore}.
 */
public final class JdbcMessageStores {
  private static final DialectStoreRegistry<AbstractJdbcMessageStore> REGISTRY =
      new DialectStoreRegistry<>(AbstractJdbcMessageStore.class, "message store");

  private JdbcMessageStores() {
  }

  public static List<AbstractJdbcMessageStore> all() {
    return REGISTRY.all();
  }

  public static AbstractJdbcMessageStore get(String name) {
    return REGISTRY.get(name);
  }

  public static AbstractJdbcMessageStore detect(DataSource dataSource) {
    return REGISTRY.detect(dataSource);
  }

  public static AbstractJdbcMessageStore detect(String jdbcUrl) {
    return REGISTRY.detect(jdbcUrl);
  }

  public static AbstractJdbcMessageStore detect(DataSource dataSource, JsonCodec jsonCodec) {
    Objects.requireNonNull(jsonCodec, "jsonCodec");
    return REGISTRY.detect(dataSource).withJsonCodec(jsonCodec);
  }
}
