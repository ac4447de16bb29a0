/**
 * PosSync source tree root: the offline-first identity and data engine behind a point-of-sale client.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.possync.runtime.PosSyncRuntime} wires the components and exposes the client-facing API.</li>
 *   <li>{@code io.possync.auth.CredentialVerifier} decides which source authenticates a login.</li>
 *   <li>{@code io.possync.sync.SyncEngine} mirrors the authority's dataset into the local store.</li>
 *   <li>{@code io.possync.storage.LocalStore} is the embedded persistence layer.</li>
 * </ul>
 */
package io.possync;
