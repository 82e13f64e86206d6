package intake.model;

public enum Sentiment {
  POSITIVE,
  NEGATIVE,
  NEUTRAL,
  UNKNOWN
}
