package intake.model;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Classifier output.
 *
 * @param osintScore intelligence value of the message, 0 to 100
 * @param topics     topic labels, never {@code null}
 * @param sentiment  overall tone
 */
public record Classification(int osintScore, Set<String> topics, Sentiment sentiment) {
  public Classification {
    if (osintScore < 0 || osintScore > 100) {
      throw new IllegalArgumentException("osintScore must be in [0, 100]: " + osintScore);
    }
    topics = Collections.unmodifiableSet(new TreeSet<>(Objects.requireNonNull(topics, "topics")));
    Objects.requireNonNull(sentiment, "sentiment");
  }
}
