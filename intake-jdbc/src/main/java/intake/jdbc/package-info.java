/**
 * JDBC implementations of the intake persistence SPIs.
 *
 * <p>{@link intake.jdbc.queue.JdbcQueueStores} and
 * {@link intake.jdbc.message.JdbcMessageStores} pick the H2 or PostgreSQL variant
 * from the JDBC URL; {@link intake.jdbc.dead.JdbcDeadLetterStore} is portable.
 * {@link intake.jdbc.JdbcSchema} installs the tables those stores expect.
 * JSON columns go through {@link intake.jdbc.JsonCodec}, Jackson by default.
 */
package intake.jdbc;
