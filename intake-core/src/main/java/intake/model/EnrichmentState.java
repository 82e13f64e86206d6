package intake.model;

/** How complete the enrichment of a stored message is. */
public enum EnrichmentState {
  /** Every sub-service succeeded. */
  FULL,
  /** At least one but not all sub-services failed. */
  PARTIAL,
  /** Rejected by the spam gate; never enriched. */
  SPAM
}
