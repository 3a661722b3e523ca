package com.wis2.downloader.core.path;

import com.wis2.downloader.core.model.DownloadJob;
import com.wis2.downloader.subscription.SubscriptionTable;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Derives where the file of a {@link DownloadJob} is written.
 *
 * <h2>Layout</h2>
 * <pre>
 * {downloadDirectory}/{yyyy}/{mm}/{dd}/{dataId without colons}
 * </pre>
 *
 * <ul>
 *   <li>{@code downloadDirectory} is looked up in the {@link SubscriptionTable} by the job's topic, falling back to
 *       the default directory. The lookup happens here, once per job, at processing time.</li>
 *   <li>The date is the processing date on the resolver's clock (local wall clock in production), not the
 *       notification date. The same data id processed on two days lands in two places.</li>
 *   <li>Colons are removed from the data id; leading slashes are dropped so the id stays relative. Slashes inside
 *       the id become sub-directories.</li>
 *   <li>A data id that would climb out of the date partition (e.g. through {@code ..}) is rejected.</li>
 * </ul>
 */
public class OutputPathResolver {

    private final SubscriptionTable subscriptions;
    private final Path defaultDirectory;
    private final Clock clock;

    public OutputPathResolver(SubscriptionTable subscriptions, Path defaultDirectory, Clock clock) {
        this.subscriptions = Objects.requireNonNull(subscriptions, "subscriptions");
        this.defaultDirectory = Objects.requireNonNull(defaultDirectory, "defaultDirectory");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalArgumentException if the data id is empty after normalization or escapes the date partition
     */
    public Path resolve(DownloadJob job) {
        Path directory = subscriptions.get(job.topic(), defaultDirectory);
        LocalDate today = LocalDate.now(clock);

        Path partition = directory
                .resolve(String.format("%04d", today.getYear()))
                .resolve(String.format("%02d", today.getMonthValue()))
                .resolve(String.format("%02d", today.getDayOfMonth()));

        String relative = normalizeDataId(job.dataId());
        if (relative.isEmpty()) {
            throw new IllegalArgumentException("Empty data_id after normalization: '" + job.dataId() + "'");
        }

        Path output = partition.resolve(relative).normalize();
        if (!output.startsWith(partition.normalize()) || output.equals(partition.normalize())) {
            throw new IllegalArgumentException("data_id escapes the download directory: '" + job.dataId() + "'");
        }
        return output;
    }

    /**
     * Removes every colon, then any leading slashes.
     */
    static String normalizeDataId(String dataId) {
        String s = dataId.replace(":", "");
        int i = 0;
        while (i < s.length() && (s.charAt(i) == '/' || s.charAt(i) == '\\')) {
            i++;
        }
        return s.substring(i);
    }
}
