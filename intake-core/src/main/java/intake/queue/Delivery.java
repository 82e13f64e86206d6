package intake.queue;

import intake.MessageEnvelope;

/**
 * A claimed envelope together with the token needed to settle it.
 *
 * @param token    ack/nack token
 * @param envelope payload
 * @param attempts failed attempts before this claim
 */
public record Delivery(DeliveryToken token, MessageEnvelope envelope, int attempts) {}
