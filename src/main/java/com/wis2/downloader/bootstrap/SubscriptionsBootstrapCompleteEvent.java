package com.wis2.downloader.bootstrap;

/**
 * =====================================================================
 * SubscriptionsBootstrapCompleteEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Signals that the transport is open and every configured topic has been
 * subscribed, so workers may start draining the job queue.
 *
 *   ┌──────────────────────────┐
 *   │ SubscriptionBootstrapper  │
 *   └────────────┬─────────────┘
 *                │ publishes
 *                ▼
 *   ┌──────────────────────────┐
 *   │ DownloadWorkerPool.start  │
 *   └──────────────────────────┘
 *
 * Published exactly once. Delivered synchronously on the bootstrap
 * thread. Carries the number of topics subscribed at startup.
 */
public record SubscriptionsBootstrapCompleteEvent(int subscribedTopics) {
}
