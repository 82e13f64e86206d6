/**
 * Micrometer bridge for the intake {@link intake.spi.MetricsExporter} SPI.
 */
package intake.micrometer;
