package intake.enrich.builtin;

import intake.model.GeoLocation;
import intake.spi.EnrichmentService;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves explicit coordinates in the text: signed decimal pairs
 * ({@code 48.5952, 38.0003}) and hemisphere notation ({@code 48.5952°N 38.0003°E}).
 * Out-of-range pairs are skipped. Spans are offsets into the text as given.
 */
public final class CoordinateGeolocator implements EnrichmentService<List<GeoLocation>> {
  private static final Pattern DECIMAL_PAIR = Pattern.compile(
      "(?<![\\d.])(-?\\d{1,2}\\.\\d{3,})\\s*[,;]\\s*(-?\\d{1,3}\\.\\d{3,})(?![\\d.])");
  private static final Pattern HEMISPHERE_PAIR = Pattern.compile(
      "(\\d{1,2}\\.\\d+)\\s*°?\\s*([NSns])[,\\s]+(\\d{1,3}\\.\\d+)\\s*°?\\s*([EWew])");

  @Override
  public List<GeoLocation> invoke(String text, Map<String, String> metadata) {
    List<GeoLocation> found = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return found;
    }
    Matcher m = HEMISPHERE_PAIR.matcher(text);
    while (m.find()) {
      double lat = Double.parseDouble(m.group(1)) * (m.group(2).equalsIgnoreCase("S") ? -1 : 1);
      double lon = Double.parseDouble(m.group(3)) * (m.group(4).equalsIgnoreCase("W") ? -1 : 1);
      add(found, lat, lon, m.start(), m.end());
    }
    m = DECIMAL_PAIR.matcher(text);
    while (m.find()) {
      if (overlaps(found, m.start(), m.end())) {
        continue;
      }
      add(found, Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)), m.start(), m.end());
    }
    found.sort((a, b) -> Integer.compare(a.spanStart(), b.spanStart()));
    return found;
  }

  private static void add(List<GeoLocation> found, double lat, double lon, int start, int end) {
    if (Math.abs(lat) <= 90 && Math.abs(lon) <= 180) {
      found.add(new GeoLocation(lat, lon, start, end));
    }
  }

  private static boolean overlaps(List<GeoLocation> found, int start, int end) {
    for (GeoLocation g : found) {
      if (start < g.spanEnd() && g.spanStart() < end) {
        return true;
      }
    }
    return false;
  }
}
