package intake.enrich.builtin;

import intake.model.Classification;
import intake.model.Sentiment;
import intake.spi.EnrichmentService;
import intake.util.TextNormalizer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Keyword classifier used when no model-backed classifier is configured.
 *
 * <p>Topics come from fixed keyword lists; a message without any hit is
 * {@code general}. The OSINT score rewards topical hits and concrete detail (numbers,
 * coordinates) and is capped at 100. Sentiment compares positive and negative lexicon
 * hits.
 */
public final class KeywordTopicClassifier implements EnrichmentService<Classification> {
  public static final Set<String> TOPICS = Set.of("combat", "civilian", "diplomatic", "equipment", "general");

  private static final Map<String, List<String>> TOPIC_KEYWORDS = new LinkedHashMap<>();
  static {
    TOPIC_KEYWORDS.put("combat", List.of("attack", "assault", "offensive", "shelling", "strike",
        "frontline", "front line", "battle", "штурм", "атака", "обстріл", "бій"));
    TOPIC_KEYWORDS.put("civilian", List.of("civilian", "evacuation", "humanitarian", "refugee",
        "hospital", "school", "цивільн", "евакуац"));
    TOPIC_KEYWORDS.put("diplomatic", List.of("negotiation", "talks", "sanction", "summit",
        "ambassador", "treaty", "переговор", "санкці"));
    TOPIC_KEYWORDS.put("equipment", List.of("tank", "artillery", "howitzer", "himars", "atacms",
        "drone", "uav", "ammunition", "missile", "танк", "артилер", "дрон"));
  }

  private static final List<String> POSITIVE = List.of("liberated", "repelled", "success",
      "victory", "delivered", "звільнен", "перемог");
  private static final List<String> NEGATIVE = List.of("killed", "wounded", "destroyed",
      "casualties", "lost", "damaged", "загин", "поранен", "зруйнов");

  @Override
  public Classification invoke(String text, Map<String, String> metadata) {
    String matchText = TextNormalizer.forMatching(text);
    if (matchText.isEmpty()) {
      return new Classification(0, Set.of("general"), Sentiment.UNKNOWN);
    }

    Set<String> topics = new TreeSet<>();
    int keywordHits = 0;
    for (Map.Entry<String, List<String>> entry : TOPIC_KEYWORDS.entrySet()) {
      int hits = countHits(matchText, entry.getValue());
      if (hits > 0) {
        topics.add(entry.getKey());
        keywordHits += hits;
      }
    }
    if (topics.isEmpty()) {
      topics.add("general");
    }

    int score = 10 + 15 * (topics.contains("general") ? 0 : topics.size()) + 5 * keywordHits;
    if (matchText.chars().anyMatch(Character::isDigit)) {
      score += 10;
    }
    return new Classification(Math.min(100, score), topics, sentiment(matchText));
  }

  private static Sentiment sentiment(String matchText) {
    int positive = countHits(matchText, POSITIVE);
    int negative = countHits(matchText, NEGATIVE);
    if (positive > negative) {
      return Sentiment.POSITIVE;
    }
    if (negative > positive) {
      return Sentiment.NEGATIVE;
    }
    return Sentiment.NEUTRAL;
  }

  private static int countHits(String matchText, List<String> keywords) {
    int hits = 0;
    for (String keyword : keywords) {
      if (matchText.contains(keyword)) {
        hits++;
      }
    }
    return hits;
  }
}
