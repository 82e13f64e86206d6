package intake.jdbc.message;

import intake.jdbc.JsonCodec;

import java.util.List;

/**
 * H2 message store. Upserts with {@code MERGE INTO ... KEY}.
 */
public final class H2MessageStore extends AbstractJdbcMessageStore {

  public H2MessageStore() {
    super();
  }

  public H2MessageStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcMessageStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2MessageStore(jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }

  @Override
  protected String upsertSql() {
    return "MERGE INTO " + TABLE + " (" + String.join(", ", COLUMNS) + ")" +
        " KEY (source_id, message_id) VALUES (" + placeholders() + ")";
  }
}
