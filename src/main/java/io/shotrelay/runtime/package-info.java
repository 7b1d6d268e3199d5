/**
 * Runtime wiring package.
 *
 * <p>{@link io.shotrelay.runtime.ShotRelayRuntime} builds storage, the lifecycle manager and the
 * coordinator for one data root; {@link io.shotrelay.runtime.TaskPump} feeds leased tasks into the
 * coordinator and reclaims expired leases.
 */
package io.shotrelay.runtime;
