/**
 * snapbridge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.snapbridge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.snapbridge.cli.SnapBridgeCommand} runs the broker or talks to a running one.</li>
 *   <li>{@code io.snapbridge.runtime.SnapBridgeRuntime} owns the broker state and lifecycle.</li>
 *   <li>{@code io.snapbridge.web.SnapApiServer} exposes operator routes and agent channels over HTTP.</li>
 * </ul>
 */
package io.snapbridge;
