package intake.jdbc.message;

import intake.jdbc.JsonCodec;

import java.util.List;
import java.util.stream.Collectors;

/**
 * PostgreSQL message store. Upserts with {@code INSERT ... ON CONFLICT DO UPDATE}.
 */
public final class PostgresMessageStore extends AbstractJdbcMessageStore {

  public PostgresMessageStore() {
    super();
  }

  public PostgresMessageStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcMessageStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresMessageStore(jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String upsertSql() {
    String updates = COLUMNS.stream()
        .filter(c -> !c.equals("source_id") && !c.equals("message_id"))
        .map(c -> c + "=EXCLUDED." + c)
        .collect(Collectors.joining(", "));
    return "INSERT INTO " + TABLE + " (" + String.join(", ", COLUMNS) + ")" +
        " VALUES (" + placeholders() + ")" +
        " ON CONFLICT (source_id, message_id) DO UPDATE SET " + updates;
  }
}
