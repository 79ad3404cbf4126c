/**
 * Node runtime.
 *
 * <p>{@link io.bundlemesh.runtime.BundleNode} owns one node's store, identity,
 * audit log, reaper and exchange worker, and exposes submission, delivery,
 * propagation and operational calls to the CLI.
 */
package io.bundlemesh.runtime;
