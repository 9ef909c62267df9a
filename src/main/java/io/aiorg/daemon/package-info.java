/**
 * Daemon supervision package.
 *
 * <p>{@link io.aiorg.daemon.AiorgDaemon} wires the cache, file watcher, dispatcher and both
 * transports, and reports their state through {@link io.aiorg.daemon.HealthStatus}.
 */
package io.aiorg.daemon;
