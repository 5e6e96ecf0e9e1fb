/**
 * Retried, circuit-broken task submission with dead-letter routing.
 *
 * <h2>Failure classes</h2>
 * <ul>
 *   <li><b>Lost</b>: the task was never confirmed (submission error, open breaker, poll
 *       timeout or poll budget exhausted). Retried with linear backoff.</li>
 *   <li><b>Failed</b>: the task ran and reported an error. Dead-lettered as
 *       {@code execution_error} without retry unless configured otherwise.</li>
 * </ul>
 *
 * @see io.workgate.execution.TaskExecutionEngine
 * @see io.workgate.dead.DeadLetterManager
 */
package io.workgate.execution;
