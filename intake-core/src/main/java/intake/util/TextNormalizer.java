package intake.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical text form shared by the spam gate, enrichment and routing: NFKC,
 * whitespace runs collapsed to one space, trimmed. {@link #forMatching} also lowercases
 * with {@link Locale#ROOT}.
 */
public final class TextNormalizer {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private TextNormalizer() {}

  public static String normalize(String text) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    String nfkc = Normalizer.normalize(text, Normalizer.Form.NFKC);
    return WHITESPACE.matcher(nfkc).replaceAll(" ").trim();
  }

  public static String forMatching(String text) {
    return normalize(text).toLowerCase(Locale.ROOT);
  }
}
