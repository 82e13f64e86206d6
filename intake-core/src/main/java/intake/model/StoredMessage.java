package intake.model;

import intake.MessageEnvelope;
import intake.MessageIdentity;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The persisted result of processing one envelope. Spam messages carry only the
 * verdict: no enrichment, no routing, no media.
 *
 * @param envelope        original envelope
 * @param spamVerdict     spam gate outcome
 * @param enrichment      enrichment output, {@code null} for spam
 * @param enrichmentState FULL, PARTIAL or SPAM
 * @param failedServices  names of sub-services that failed, empty unless PARTIAL
 * @param routing         routing decision, {@code null} for spam
 * @param media           archived media, in reference order
 */
public record StoredMessage(
    MessageEnvelope envelope,
    SpamVerdict spamVerdict,
    EnrichmentRecord enrichment,
    EnrichmentState enrichmentState,
    Set<String> failedServices,
    RoutingDecision routing,
    List<MediaFile> media
) {
  public StoredMessage {
    Objects.requireNonNull(envelope, "envelope");
    Objects.requireNonNull(spamVerdict, "spamVerdict");
    Objects.requireNonNull(enrichmentState, "enrichmentState");
    failedServices = failedServices == null ? Collections.emptySortedSet()
        : Collections.unmodifiableSortedSet(new TreeSet<>(failedServices));
    media = media == null ? List.of() : List.copyOf(media);
    if (enrichmentState == EnrichmentState.SPAM) {
      if (enrichment != null || routing != null) {
        throw new IllegalArgumentException("spam messages carry no enrichment or routing");
      }
    } else {
      Objects.requireNonNull(enrichment, "enrichment");
      Objects.requireNonNull(routing, "routing");
    }
  }

  public static StoredMessage spam(MessageEnvelope envelope, SpamVerdict verdict) {
    return new StoredMessage(envelope, verdict, null, EnrichmentState.SPAM, Set.of(), null, List.of());
  }

  public MessageIdentity identity() {
    return envelope.identity();
  }

  /** Content hashes of {@link #media()}, in reference order. */
  public List<String> mediaHashes() {
    return media.stream().map(MediaFile::contentHash).toList();
  }
}
