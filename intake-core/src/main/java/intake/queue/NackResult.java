package intake.queue;

/** What a nack did. */
public enum NackResult {
  /** The delivery will become claimable again after a backoff delay. */
  RETRY_SCHEDULED,
  /** The retry bound was exceeded; the envelope now lives in the dead-letter store. */
  DEAD_LETTERED,
  /** The token no longer matches the delivery's claim; nothing changed. */
  STALE_TOKEN
}
