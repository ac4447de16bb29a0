/**
 * Application context package.
 *
 * <p>{@link io.possync.runtime.PosSyncRuntime} owns startup, login serialization, logout, act-as
 * switching and the unauthorized-token policy, and hands out the local store for reads.
 */
package io.possync.runtime;
