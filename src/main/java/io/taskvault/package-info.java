/**
 * TaskVault source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskvault.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskvault.cli.TaskVaultCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.taskvault.runtime.TaskVaultRuntime} drives one cycle: ingest, route, approve, execute, project.</li>
 *   <li>{@code io.taskvault.escalation.EscalationLadder} decides what happens to a failing action.</li>
 *   <li>{@code io.taskvault.storage.StateStore} is the authoritative persistence layer.</li>
 * </ul>
 */
package io.taskvault;
