/**
 * Pull and push orchestration.
 *
 * <p>{@link io.rtmmirror.sync.TreeReconciler} applies one remote tree to the local store.
 * {@link io.rtmmirror.sync.SyncEngine} sequences kind scopes, resolves cross-kind links after
 * every tree is in place, and reports per-node failures instead of throwing.
 */
package io.rtmmirror.sync;
