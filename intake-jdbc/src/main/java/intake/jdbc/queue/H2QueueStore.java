package intake.jdbc.queue;

import intake.jdbc.JsonCodec;

import java.util.List;

/**
 * H2 queue store. Primarily for tests and single-process deployments.
 *
 * <p>Uses the subquery-based two-phase claim from {@link AbstractJdbcQueueStore}.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

  public H2QueueStore() {
    super();
  }

  public H2QueueStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2QueueStore(jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
