/**
 * ShotRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.shotrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.shotrelay.cli.ShotRelayCommand} maps commands to lifecycle and runtime APIs.</li>
 *   <li>{@code io.shotrelay.lifecycle.ReleaseLifecycleManager} owns every release and run state change.</li>
 *   <li>{@code io.shotrelay.storage.TaskQueue} is the durable capture/diff task queue.</li>
 *   <li>{@code io.shotrelay.coordinator.WorkCoordinator} runs crawl, capture request and task items.</li>
 * </ul>
 */
package io.shotrelay;
