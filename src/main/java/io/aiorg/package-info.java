/**
 * aiorg source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.aiorg.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.aiorg.cli.AiorgCommand} maps commands to the daemon and its socket client.</li>
 *   <li>{@code io.aiorg.daemon.AiorgDaemon} owns component startup, health and shutdown.</li>
 *   <li>{@code io.aiorg.rpc.RpcDispatcher} routes JSON-RPC methods to handlers.</li>
 *   <li>{@code io.aiorg.cache.VaultCache} serves task reads from memory.</li>
 * </ul>
 */
package io.aiorg;
