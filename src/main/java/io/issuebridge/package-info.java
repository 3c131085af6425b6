/**
 * IssueBridge source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.issuebridge.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.issuebridge.client.TrackerRestClient} talks to the remote tracker with retries and backoff.</li>
 *   <li>{@code io.issuebridge.storage.LocalCacheStore} is the SQLite cache and offline change queue.</li>
 *   <li>{@code io.issuebridge.sync.CachingIssueTracker} switches between the remote and the cache.</li>
 * </ul>
 */
package io.issuebridge;
