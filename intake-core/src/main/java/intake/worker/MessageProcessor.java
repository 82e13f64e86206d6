package intake.worker;

import intake.MessageEnvelope;
import intake.StoreUnavailableException;
import intake.TotalEnrichmentFailureException;
import intake.enrich.EnrichmentOutcome;
import intake.media.ContentHash;
import intake.media.FetchedMedia;
import intake.model.Classification;
import intake.model.MediaFile;
import intake.model.RoutingDecision;
import intake.model.SpamVerdict;
import intake.model.StoredMessage;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Runs one envelope through the pipeline stages:
 *
 * <ol>
 *   <li>Spam gate. Spam is stored with its verdict only; media is not fetched and
 *       enrichment is not called.</li>
 *   <li>Media archiving: every reference is fetched and stored by content hash,
 *       keeping its size and MIME type.</li>
 *   <li>Enrichment. A partial result is stored and acked; a total failure throws.</li>
 *   <li>Routing on the text and the classifier's topics.</li>
 *   <li>Upsert keyed by ({@code sourceId}, {@code messageId}).</li>
 * </ol>
 *
 * <p>Any exception leaves the message unstored or stored with identical content, so
 * the caller can nack and retry safely.
 */
public final class MessageProcessor {
  private static final Logger logger = Logger.getLogger(MessageProcessor.class.getName());

  private final WorkerDependencies deps;

  public MessageProcessor(WorkerDependencies deps) {
    this.deps = Objects.requireNonNull(deps, "deps");
  }

  public StoredMessage process(MessageEnvelope envelope) {
    SpamVerdict verdict = deps.spamFilter().check(envelope.text(), envelope.rawMetadata());
    if (verdict.spam()) {
      StoredMessage spam = StoredMessage.spam(envelope, verdict);
      upsert(spam);
      deps.metrics().incrementSpam();
      logger.fine("Rejected " + envelope.identity() + " as spam, rules=" + verdict.matchedRules());
      return spam;
    }

    List<MediaFile> media = archiveMedia(envelope);

    EnrichmentOutcome outcome = deps.enrichment().enrich(envelope.text(), envelope.rawMetadata());
    if (outcome.totalFailure()) {
      throw new TotalEnrichmentFailureException(outcome.failures());
    }
    if (!outcome.failures().isEmpty()) {
      logger.warning("Partial enrichment for " + envelope.identity() + ", failed: " + outcome.failures());
    }

    Classification classification = outcome.record().classification();
    Set<String> topics = classification == null ? Set.of() : classification.topics();
    RoutingDecision routing = deps.router().route(envelope.text(), topics);

    StoredMessage stored = new StoredMessage(envelope, verdict, outcome.record(), outcome.state(),
        outcome.failedServices(), routing, media);
    upsert(stored);
    deps.metrics().incrementEnriched(outcome.state());
    return stored;
  }

  private List<MediaFile> archiveMedia(MessageEnvelope envelope) {
    List<MediaFile> archived = new ArrayList<>(envelope.mediaRefs().size());
    for (String ref : envelope.mediaRefs()) {
      FetchedMedia fetched = deps.mediaFetcher().download(ref);
      byte[] content = fetched.content();
      String hash = ContentHash.sha256(content);
      if (!deps.mediaStore().exists(hash)) {
        String stored = deps.mediaStore().put(content);
        if (!hash.equals(stored)) {
          throw new StoreUnavailableException("Media store returned " + stored + " for content " + hash);
        }
      }
      archived.add(MediaFile.of(hash, content.length, fetched.mimeType()));
    }
    return archived;
  }

  private void upsert(StoredMessage message) {
    try (Connection conn = deps.connectionProvider().getConnection()) {
      conn.setAutoCommit(true);
      deps.messageStore().upsert(conn, message);
    } catch (SQLException | RuntimeException e) {
      throw new StoreUnavailableException("Failed to store " + message.identity(), e);
    }
  }
}
