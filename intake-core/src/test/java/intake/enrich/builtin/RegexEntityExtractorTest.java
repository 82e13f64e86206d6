package intake.enrich.builtin;

import intake.model.ExtractedEntities;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RegexEntityExtractorTest {
  private final RegexEntityExtractor extractor = new RegexEntityExtractor();

  @Test
  void extractsEveryCategory() {
    ExtractedEntities e = extractor.invoke(
        "General Zaluzhnyi said the 47th Mechanized Brigade held positions near Bakhmut. "
            + "NATO observers and the IAEA were informed.",
        Map.of());

    assertEquals(Set.of("Zaluzhnyi"), e.people());
    assertEquals(Set.of("IAEA", "NATO"), e.organizations());
    assertEquals(Set.of("Bakhmut"), e.locations());
    assertEquals(Set.of("47th Mechanized Brigade"), e.militaryUnits());
  }

  @Test
  void deduplicatesCaseInsensitivelyKeepingFirstSpelling() {
    ExtractedEntities e = extractor.invoke("Kyiv reports calm. KYIV again. kyiv.", Map.of());

    assertEquals(Set.of("Kyiv"), e.locations());
  }

  @Test
  void cyrillicNamesAndUnits() {
    ExtractedEntities e = extractor.invoke("ЗСУ відбили атаку біля Бахмута, НАТО стежить", Map.of());

    assertTrue(e.militaryUnits().contains("ЗСУ"));
    assertTrue(e.locations().contains("Бахмута"));
    assertTrue(e.organizations().contains("НАТО"));
  }

  @Test
  void directionsAreLocations() {
    ExtractedEntities e = extractor.invoke("Heavy fighting on the Eastern Front and in Donbas", Map.of());

    assertEquals(Set.of("Donbas", "Eastern Front"), e.locations());
  }

  @Test
  void titledPersonWithTwoNames() {
    ExtractedEntities e = extractor.invoke("President Volodymyr Zelensky visited Kharkiv", Map.of());

    assertEquals(Set.of("Volodymyr Zelensky"), e.people());
    assertEquals(Set.of("Kharkiv"), e.locations());
  }

  @Test
  void emptyTextHasNoEntities() {
    assertEquals(0, extractor.invoke("", Map.of()).total());
  }
}
