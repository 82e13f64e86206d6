package intake;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of work handed to the pipeline by an upstream scraper.
 *
 * <p>Identity is the pair ({@code sourceId}, {@code messageId}); the origin assigns
 * {@code messageId} and guarantees it is unique within a source. Everything else is
 * payload. {@code postedAt} is truncated to milliseconds so that envelopes survive a
 * round trip through a database column unchanged.
 *
 * @see MessageIdentity
 */
public final class MessageEnvelope {
    private final String sourceId;
    private final String messageId;
    private final String text;
    private final List<String> mediaRefs;
    private final Instant postedAt;
    private final Map<String, String> rawMetadata;

    private MessageEnvelope(Builder builder) {
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId");
        if (sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId cannot be blank");
        }
        this.messageId = Objects.requireNonNull(builder.messageId, "messageId");
        if (messageId.isBlank()) {
            throw new IllegalArgumentException("messageId cannot be blank");
        }
        this.text = builder.text == null ? "" : builder.text;
        Instant posted = builder.postedAt == null ? Instant.now() : builder.postedAt;
        this.postedAt = posted.truncatedTo(ChronoUnit.MILLIS);

        List<String> refs = new ArrayList<>(builder.mediaRefs);
        if (refs.contains(null)) {
            throw new IllegalArgumentException("mediaRefs cannot contain null");
        }
        this.mediaRefs = Collections.unmodifiableList(refs);

        Map<String, String> metadata = new LinkedHashMap<>(builder.rawMetadata);
        if (metadata.containsKey(null) || metadata.containsValue(null)) {
            throw new IllegalArgumentException("rawMetadata cannot contain null keys or values");
        }
        this.rawMetadata = Collections.unmodifiableMap(metadata);
    }

    public static Builder builder(String sourceId, String messageId) {
        return new Builder(sourceId, messageId);
    }

    public static Builder builder(String sourceId, long messageId) {
        return new Builder(sourceId, Long.toString(messageId));
    }

    public String sourceId() {
        return sourceId;
    }

    public String messageId() {
        return messageId;
    }

    public MessageIdentity identity() {
        return new MessageIdentity(sourceId, messageId);
    }

    public String text() {
        return text;
    }

    public List<String> mediaRefs() {
        return mediaRefs;
    }

    public Instant postedAt() {
        return postedAt;
    }

    /**
     * Opaque key/value bag carried through from the origin (view counts, forward
     * source, and so on). Never interpreted by the queue.
     *
     * @return unmodifiable metadata map
     */
    public Map<String, String> rawMetadata() {
        return rawMetadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageEnvelope other)) return false;
        return sourceId.equals(other.sourceId)
                && messageId.equals(other.messageId)
                && text.equals(other.text)
                && mediaRefs.equals(other.mediaRefs)
                && postedAt.equals(other.postedAt)
                && rawMetadata.equals(other.rawMetadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, messageId, text, mediaRefs, postedAt, rawMetadata);
    }

    @Override
    public String toString() {
        return "MessageEnvelope{" + sourceId + "/" + messageId
                + ", textLength=" + text.length()
                + ", mediaRefs=" + mediaRefs.size()
                + ", postedAt=" + postedAt + '}';
    }

    /** Builder for {@link MessageEnvelope}. */
    public static final class Builder {
        private final String sourceId;
        private final String messageId;
        private String text;
        private final List<String> mediaRefs = new ArrayList<>();
        private Instant postedAt;
        private final Map<String, String> rawMetadata = new LinkedHashMap<>();

        private Builder(String sourceId, String messageId) {
            this.sourceId = sourceId;
            this.messageId = messageId;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder mediaRef(String mediaRef) {
            this.mediaRefs.add(mediaRef);
            return this;
        }

        public Builder mediaRefs(List<String> mediaRefs) {
            this.mediaRefs.clear();
            if (mediaRefs != null) {
                this.mediaRefs.addAll(mediaRefs);
            }
            return this;
        }

        public Builder postedAt(Instant postedAt) {
            this.postedAt = postedAt;
            return this;
        }

        public Builder metadata(String key, String value) {
            this.rawMetadata.put(key, value);
            return this;
        }

        public Builder rawMetadata(Map<String, String> rawMetadata) {
            this.rawMetadata.clear();
            if (rawMetadata != null) {
                this.rawMetadata.putAll(rawMetadata);
            }
            return this;
        }

        public MessageEnvelope build() {
            return new MessageEnvelope(this);
        }
    }
}
