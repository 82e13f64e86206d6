package intake.spam;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A weighted pattern. By default the pattern is searched in the message text; a rule
 * with a {@code metadataKey} is searched in that metadata value instead.
 *
 * @param id          stable rule id, reported in {@link intake.model.SpamVerdict#matchedRules()}
 * @param pattern     case-insensitive pattern, found anywhere in the input
 * @param weight      confidence the rule contributes, in (0, 1]
 * @param metadataKey metadata key to test, or {@code null} for the text
 */
public record SpamRule(String id, Pattern pattern, double weight, String metadataKey) {
  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

  public SpamRule {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) {
      throw new IllegalArgumentException("rule id cannot be blank");
    }
    Objects.requireNonNull(pattern, "pattern");
    if (!(weight > 0.0 && weight <= 1.0)) {
      throw new IllegalArgumentException("weight must be in (0, 1]: " + weight);
    }
  }

  public static SpamRule regex(String id, String regex, double weight) {
    return new SpamRule(id, Pattern.compile(regex, FLAGS), weight, null);
  }

  /** Matches if any of the phrases occurs as a literal substring. */
  public static SpamRule phrases(String id, double weight, String... phrases) {
    if (phrases.length == 0) {
      throw new IllegalArgumentException("at least one phrase is required");
    }
    String alternation = Arrays.stream(phrases)
        .map(Pattern::quote)
        .collect(Collectors.joining("|"));
    return new SpamRule(id, Pattern.compile(alternation, FLAGS), weight, null);
  }

  public static SpamRule onMetadata(String id, String metadataKey, String regex, double weight) {
    return new SpamRule(id, Pattern.compile(regex, FLAGS), weight,
        Objects.requireNonNull(metadataKey, "metadataKey"));
  }

  boolean matches(String text, Map<String, String> metadata) {
    String input = metadataKey == null ? text : metadata.get(metadataKey);
    return input != null && pattern.matcher(input).find();
  }
}
