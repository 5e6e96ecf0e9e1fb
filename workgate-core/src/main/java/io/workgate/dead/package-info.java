/**
 * Dead-letter inspection and replay.
 */
package io.workgate.dead;
