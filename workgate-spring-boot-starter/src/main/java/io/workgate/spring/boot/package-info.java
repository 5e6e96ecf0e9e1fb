/**
 * Spring Boot auto-configuration for WorkGate.
 *
 * <p>Properties live under {@code workgate.*}; see
 * {@link io.workgate.spring.boot.WorkGateProperties}.
 */
package io.workgate.spring.boot;
