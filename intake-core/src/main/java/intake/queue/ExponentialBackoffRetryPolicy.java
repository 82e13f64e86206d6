package intake.queue;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with multiplicative jitter.
 *
 * <p>{@code delay(n) = min(max, base * 2^(n-1)) * jitter}, where jitter is drawn from
 * [0.5, 1.5) and the result is capped at {@code max} again.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseMs;
  private final long maxMs;
  private final DoubleSupplier jitter;

  public ExponentialBackoffRetryPolicy(Duration base, Duration max) {
    this(base, max, () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
  }

  ExponentialBackoffRetryPolicy(Duration base, Duration max, DoubleSupplier jitter) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(max, "max");
    if (base.isZero() || base.isNegative()) {
      throw new IllegalArgumentException("base must be positive, got: " + base);
    }
    if (max.compareTo(base) < 0) {
      throw new IllegalArgumentException("max must be >= base, got: " + max);
    }
    this.baseMs = base.toMillis();
    this.maxMs = max.toMillis();
    this.jitter = Objects.requireNonNull(jitter, "jitter");
  }

  @Override
  public Duration delayAfter(int attempts) {
    if (attempts <= 0) {
      return Duration.ZERO;
    }
    long exponential;
    if (attempts >= 63) {
      exponential = maxMs;
    } else {
      long factor = 1L << (attempts - 1);
      // overflow guard
      exponential = factor > maxMs / baseMs ? maxMs : baseMs * factor;
    }
    long capped = Math.min(maxMs, exponential);
    long jittered = (long) (capped * jitter.getAsDouble());
    return Duration.ofMillis(Math.min(maxMs, Math.max(0L, jittered)));
  }
}
