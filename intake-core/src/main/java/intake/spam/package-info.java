/**
 * Rule-based spam gate evaluated before any media download or enrichment call.
 */
package intake.spam;
