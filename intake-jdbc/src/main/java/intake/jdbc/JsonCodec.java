package intake.jdbc;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * JSON encoding of the structured columns (media references, metadata, enrichment
 * records, attempt histories).
 *
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * @throws IntakeStoreException if the value cannot be encoded
   */
  String toJson(Object value);

  /**
   * @return the decoded value, or {@code null} for SQL NULL
   * @throws IntakeStoreException if the text is not valid JSON for {@code type}
   */
  <T> T fromJson(String json, Class<T> type);

  <T> T fromJson(String json, TypeReference<T> type);
}
