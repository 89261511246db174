/**
 * Cycle orchestration.
 *
 * <p>{@link io.taskvault.runtime.TaskVaultRuntime} owns one pass over the vault under the run
 * lock. {@link io.taskvault.runtime.TaskStateMachine} is the only writer of task status.
 */
package io.taskvault.runtime;
