package intake.enrich;

/**
 * Result of calling one sub-service, after at most one retry.
 *
 * @param <T> value type
 */
public sealed interface SubResult<T> permits SubResult.Success, SubResult.Failure {

  /** Number of calls made, 1 or 2. */
  int calls();

  record Success<T>(T value, int calls) implements SubResult<T> {}

  record Failure<T>(String error, int calls) implements SubResult<T> {}
}
