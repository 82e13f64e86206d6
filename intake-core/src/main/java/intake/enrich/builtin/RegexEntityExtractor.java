package intake.enrich.builtin;

import intake.model.ExtractedEntities;
import intake.spi.EnrichmentService;
import intake.util.TextNormalizer;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based entity extractor for English, Ukrainian and Russian military
 * reporting. Matches are deduplicated case-insensitively; the first spelling seen is
 * kept. Front-line directions are reported as locations.
 */
public final class RegexEntityExtractor implements EnrichmentService<ExtractedEntities> {
  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS;

  private static final List<Pattern> MILITARY_UNITS = compile(
      "\\b\\d{1,3}(?:st|nd|rd|th)?\\s+(?:Mechanized|Airborne|Infantry|Tank|Artillery)\\s+(?:Brigade|Battalion|Regiment|Division)\\b",
      "\\b\\d{1,3}(?:st|nd|rd|th)?\\s+(?:Brigade|Battalion|Regiment|Division)\\b",
      "\\b\\d{1,3}\\s*ОМБр\\b",
      "\\b\\d{1,3}\\s*ОШБр\\b",
      "\\b\\d{1,3}\\s*ОДШБр\\b",
      "\\bWagner\\s+Group\\b",
      "\\bAzov\\s+(?:Battalion|Regiment|Brigade)\\b",
      "\\bKraken\\s+(?:Battalion|Regiment|Unit)\\b",
      "\\b(?:AFU|Armed Forces of Ukraine|UAF)\\b",
      "\\bЗСУ\\b",
      "\\b(?:Russian Forces|Armed Forces of Russia)\\b",
      "\\bВС\\s+РФ\\b");

  private static final List<Pattern> LOCATIONS = compile(
      "\\bBakhmut\\w*\\b", "\\bБахмут[іуа]?\\b",
      "\\b(?:Kyiv|Kiev)\\w*\\b", "\\bКи[їі]в[іуа]?\\b",
      "\\bKharkiv\\w*\\b", "\\bХарк[іо]в[іуа]?\\b",
      "\\bMariupol\\w*\\b", "\\bМаріупол[ьіюя]?\\b",
      "\\bDonetsk\\w*\\b", "\\bДонецьк[уа]?\\b",
      "\\bLuhansk\\w*\\b", "\\bЛуганськ[уа]?\\b",
      "\\bDnipro\\w*\\b", "\\bДніпр[оуа]?\\b",
      "\\b(?:Odesa|Odessa)\\w*\\b", "\\bОдес[іуа]?\\b",
      "\\bZaporizhzhia\\w*\\b", "\\bЗапоріжж[яі]?\\b",
      "\\bKherson\\w*\\b", "\\bХерсон[іуа]?\\b",
      "\\bMykolaiv\\w*\\b", "\\bМиколаїв[іуа]?\\b",
      "\\bLviv\\w*\\b", "\\bЛьвів[іуа]?\\b",
      "\\bSeverodonetsk\\w*\\b", "\\bСєвєродонецьк[уа]?\\b",
      "\\bLysychansk\\w*\\b", "\\bЛисичанськ[уа]?\\b",
      "\\bAvdiivka\\w*\\b", "\\bАвдіївк[іа]?\\b",
      "\\bVuhledar\\w*\\b", "\\bВугледар[уа]?\\b",
      "\\bChasiv\\s+Yar\\w*\\b", "\\bЧасів\\s+Яр[уа]?\\b",
      "\\bSoledar\\w*\\b", "\\bСоледар[уа]?\\b",
      // directions
      "\\b(?:Eastern\\s+Front|Східний\\s+фронт)\\b",
      "\\b(?:Southern\\s+Front|Південний\\s+фронт)\\b",
      "\\b(?:Northern\\s+Front|Північний\\s+фронт)\\b",
      "\\b(?:Donbas|Донбас)\\b",
      "\\b(?:Crimea|Крим)\\b");

  private static final List<Pattern> ORGANIZATIONS = compile(
      "\\bNATO\\b", "\\bНАТО\\b",
      "\\b(?:United Nations|UN)\\b", "\\bООН\\b",
      "\\bOSCE\\b", "\\bIAEA\\b", "\\bМАГАТЕ\\b",
      "\\bRed\\s+Cross\\b", "\\bЧервоний\\s+Хрест\\b",
      "\\bEuropean\\s+Union\\b");

  private static final Pattern PERSON_WITH_TITLE = Pattern.compile(
      "\\b(?:President|General|Minister|Colonel|Commander)\\s+(\\p{Lu}[\\p{L}'-]+(?:\\s+\\p{Lu}[\\p{L}'-]+)?)",
      Pattern.UNICODE_CHARACTER_CLASS);

  @Override
  public ExtractedEntities invoke(String text, Map<String, String> metadata) {
    String normalized = TextNormalizer.normalize(text);
    if (normalized.isEmpty()) {
      return ExtractedEntities.none();
    }
    return new ExtractedEntities(
        people(normalized),
        extract(normalized, ORGANIZATIONS),
        extract(normalized, LOCATIONS),
        extract(normalized, MILITARY_UNITS));
  }

  private static Set<String> extract(String text, List<Pattern> patterns) {
    Set<String> seen = new HashSet<>();
    Set<String> found = new TreeSet<>();
    for (Pattern pattern : patterns) {
      Matcher m = pattern.matcher(text);
      while (m.find()) {
        String entity = m.group().strip();
        if (seen.add(entity.toLowerCase(Locale.ROOT))) {
          found.add(entity);
        }
      }
    }
    return found;
  }

  private static Set<String> people(String text) {
    Set<String> found = new TreeSet<>();
    Matcher m = PERSON_WITH_TITLE.matcher(text);
    while (m.find()) {
      found.add(m.group(1));
    }
    return found;
  }

  private static List<Pattern> compile(String... regexes) {
    return Arrays.stream(regexes).map(r -> Pattern.compile(r, FLAGS)).toList();
  }
}
