/**
 * Extension points. JDBC implementations of the stores live in {@code intake-jdbc};
 * the Micrometer exporter lives in {@code intake-micrometer}.
 */
package intake.spi;
