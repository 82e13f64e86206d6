package intake.model;

/**
 * A coordinate pair resolved from the message text.
 *
 * @param latitude  decimal degrees, -90 to 90
 * @param longitude decimal degrees, -180 to 180
 * @param spanStart inclusive start offset of the matched text
 * @param spanEnd   exclusive end offset of the matched text
 */
public record GeoLocation(double latitude, double longitude, int spanStart, int spanEnd) {
  public GeoLocation {
    if (latitude < -90 || latitude > 90) {
      throw new IllegalArgumentException("latitude out of range: " + latitude);
    }
    if (longitude < -180 || longitude > 180) {
      throw new IllegalArgumentException("longitude out of range: " + longitude);
    }
    if (spanStart < 0 || spanEnd < spanStart) {
      throw new IllegalArgumentException("invalid span [" + spanStart + ", " + spanEnd + ")");
    }
  }
}
