/**
 * BundleMesh source tree root.
 *
 * <p>Where to start reading:
 *
 * <ul>
 *   <li>{@code io.bundlemesh.Main} starts the CLI process.</li>
 *   <li>{@code io.bundlemesh.cli.BundleMeshCommand} maps commands onto node calls.</li>
 *   <li>{@code io.bundlemesh.runtime.BundleNode} wires store, identity and exchange worker together.</li>
 *   <li>{@code io.bundlemesh.storage.BundleStore} is the only place bundles are persisted.</li>
 *   <li>{@code io.bundlemesh.propagation.ExchangeSession} is the neighbor exchange protocol.</li>
 * </ul>
 */
package io.bundlemesh;
