/**
 * Service provider interfaces for the collaborators WorkGate talks to: the shared cache,
 * the control plane, the item source, the task queue, dead-letter storage and metrics.
 */
package io.workgate.spi;
