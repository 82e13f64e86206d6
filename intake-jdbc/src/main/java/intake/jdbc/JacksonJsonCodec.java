package intake.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}. Instants are written as
 * ISO-8601 strings; unknown properties are ignored so rows written by newer versions
 * still decode.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(defaultMapper());

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
  }

  @Override
  public String toJson(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IntakeStoreException("Failed to encode " + value.getClass().getSimpleName() + " as JSON", e);
    }
  }

  @Override
  public <T> T fromJson(String json, Class<T> type) {
    if (json == null) {
      return null;
    }
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IntakeStoreException("Failed to decode JSON as " + type.getSimpleName(), e);
    }
  }

  @Override
  public <T> T fromJson(String json, TypeReference<T> type) {
    if (json == null) {
      return null;
    }
    try {
      return mapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IntakeStoreException("Failed to decode JSON as " + type.getType(), e);
    }
  }
}
