package com.wis2.downloader.subscription;

import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * =====================================================================
 * SubscriptionTable
 * =====================================================================
 *
 * PURPOSE
 * -------
 * The single shared mutable structure of the pipeline: which topics are
 * subscribed and where files announced on each topic are written.
 *
 *   topic ──▶ download directory
 *
 * WHO TOUCHES IT
 * --------------
 *  - Workers      : {@link #get} once per job, many threads at a time
 *  - Control plane: {@link #add} / {@link #remove} / {@link #snapshot}
 *
 * CONCURRENCY
 * -----------
 * Backed by a {@link ConcurrentHashMap}. Every update is one atomic
 * insert-if-absent or erase; entries are never mutated in place. Readers
 * therefore see an entry either fully present or fully absent, and a
 * reader never waits on a writer.
 *
 * IDEMPOTENCE
 * -----------
 *  - add on an existing topic reports "already present" and keeps the
 *    original directory
 *  - remove on an absent topic reports "not removed"; it is not an error
 */
public class SubscriptionTable {

    private final ConcurrentHashMap<String, Path> entries = new ConcurrentHashMap<>();

    /**
     * Directory for a topic, or {@code defaultDirectory} when the topic is not (or no longer) present.
     */
    public Path get(String topic, Path defaultDirectory) {
        if (topic == null) {
            return defaultDirectory;
        }
        return entries.getOrDefault(topic, defaultDirectory);
    }

    /**
     * Inserts the entry only if the topic is absent.
     *
     * @return true when the entry was inserted, false when the topic was already present
     */
    public boolean add(String topic, Path directory) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(directory, "directory");
        return entries.putIfAbsent(topic, directory) == null;
    }

    /**
     * @return true when an entry was removed
     */
    public boolean remove(String topic) {
        if (topic == null) {
            return false;
        }
        return entries.remove(topic) != null;
    }

    /**
     * Removes the entry only while it still maps to {@code directory}.
     * Used to roll back an insertion whose transport subscribe failed.
     */
    public boolean remove(String topic, Path directory) {
        return entries.remove(topic, directory);
    }

    public boolean contains(String topic) {
        return topic != null && entries.containsKey(topic);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Point-in-time copy, sorted by topic, with directories rendered as strings.
     */
    public Map<String, String> snapshot() {
        Map<String, String> copy = new TreeMap<>();
        entries.forEach((topic, dir) -> copy.put(topic, dir.toString()));
        return Collections.unmodifiableMap(copy);
    }
}
