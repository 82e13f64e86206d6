/**
 * Concurrent enrichment with per-service timeouts.
 *
 * <p>{@link intake.enrich.EnrichmentOrchestrator} degrades gracefully: a failed
 * sub-service yields a partial record that is still stored and acked. Only when every
 * sub-service fails does the worker treat the attempt as failed.
 */
package intake.enrich;
