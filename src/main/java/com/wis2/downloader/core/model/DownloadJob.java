package com.wis2.downloader.core.model;

import java.util.List;
import java.util.Objects;

/**
 * =====================================================================
 * DownloadJob
 * =====================================================================
 *
 * PURPOSE ------- One unit of work derived from a single WIS2 notification.
 * Carries everything a worker needs to fetch, verify and place the announced
 * file: the originating topic, the data id, the advertised links and the
 * optional integrity block.
 *
 * This model is: - Transport-neutral (no NATS classes) - Immutable (safe to
 * hand from the ingestion thread to any worker)
 *
 * OWNERSHIP --------- A job sitting in the queue belongs to nobody. Once
 * dequeued it is visible to exactly one worker.
 *
 * CANONICAL LINKS --------------- Only links whose relation equals
 * {@link #CANONICAL} are downloaded. Zero canonical links make the job a no-op.
 */
public record DownloadJob(

		/**
		 * Topic the notification was received on (not the subscription pattern that
		 * matched it).
		 */
		String topic,

		/**
		 * Identifier of the announced file, exactly as published. May contain colons
		 * and slashes; see OutputPathResolver for how it becomes a path.
		 */
		String dataId,

		/**
		 * Links in the order they were published.
		 */
		List<JobLink> links,

		/**
		 * Expected digest, or {@code null} when the notification carried none.
		 */
		Integrity integrity) {

	/** Link relation that marks the retrievable location of the file. */
	public static final String CANONICAL = "canonical";

	public DownloadJob {
		Objects.requireNonNull(topic, "topic");
		Objects.requireNonNull(dataId, "dataId");
		links = links == null ? List.of() : List.copyOf(links);
	}

	/**
	 * Links that must be fetched, in publication order.
	 */
	public List<JobLink> canonicalLinks() {
		return links.stream().filter(JobLink::isCanonical).toList();
	}
}
