package intake.model;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named entities found in a message. Each set is sorted and deduplicated.
 */
public record ExtractedEntities(
    Set<String> people,
    Set<String> organizations,
    Set<String> locations,
    Set<String> militaryUnits
) {
  public ExtractedEntities {
    people = sorted(people);
    organizations = sorted(organizations);
    locations = sorted(locations);
    militaryUnits = sorted(militaryUnits);
  }

  public static ExtractedEntities none() {
    return new ExtractedEntities(Set.of(), Set.of(), Set.of(), Set.of());
  }

  public int total() {
    return people.size() + organizations.size() + locations.size() + militaryUnits.size();
  }

  private static Set<String> sorted(Set<String> values) {
    return values == null ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(values));
  }
}
