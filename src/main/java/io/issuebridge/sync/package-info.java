/**
 * Online/offline facade over the remote client and the local cache.
 *
 * <p>{@link io.issuebridge.sync.CachingIssueTracker} writes successful reads through to the cache,
 * queues mutations it cannot deliver and replays them from {@code synchronize()}.
 */
package io.issuebridge.sync;
