/**
 * Spring Boot auto-configuration for the intake pipeline, bound to {@code intake.*}
 * properties.
 */
package intake.spring.boot;
