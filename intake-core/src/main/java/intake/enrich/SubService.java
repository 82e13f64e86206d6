package intake.enrich;

/** The enrichment sub-services, in the order their results appear in a record. */
public enum SubService {
  CLASSIFICATION("classification"),
  ENTITIES("entities"),
  GEOLOCATION("geolocation"),
  ENGAGEMENT("engagement");

  private final String serviceName;

  SubService(String serviceName) {
    this.serviceName = serviceName;
  }

  /** Name used in stored failure lists and metric tags. */
  public String serviceName() {
    return serviceName;
  }
}
