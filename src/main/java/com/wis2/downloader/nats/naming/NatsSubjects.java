package com.wis2.downloader.nats.naming;

import java.util.regex.Pattern;

/**
 * Maps WIS2 topics onto NATS subjects and back.
 *
 * <h2>Mapping</h2>
 * <pre>
 *   WIS2 topic                           NATS subject
 *   ---------------------------------    ---------------------------------
 *   origin/a/wis2/de-dwd/data/core       origin.a.wis2.de-dwd.data.core
 *   origin/a/wis2/+/data/#               origin.a.wis2.*.data.&gt;
 * </pre>
 *
 * <ul>
 *   <li>Level separator {@code /} becomes token separator {@code .}.</li>
 *   <li>Single-level wildcard {@code +} becomes {@code *}.</li>
 *   <li>Multi-level wildcard {@code #} becomes {@code >} and must be the last level.</li>
 * </ul>
 *
 * <p>Topic levels may not contain {@code .}, whitespace, or the NATS wildcard characters, and may not be empty.
 * Such topics have no faithful subject and are rejected.</p>
 */
public final class NatsSubjects {

    private static final Pattern ILLEGAL_LEVEL_CHARS = Pattern.compile("[.*>\\s]");

    private NatsSubjects() {}

    /**
     * @throws IllegalArgumentException if the topic cannot be expressed as a NATS subject
     */
    public static String fromTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }

        String[] levels = topic.split("/", -1);
        StringBuilder subject = new StringBuilder(topic.length());

        for (int i = 0; i < levels.length; i++) {
            String level = levels[i];
            if (i > 0) {
                subject.append('.');
            }

            if (level.equals("+")) {
                subject.append('*');
            } else if (level.equals("#")) {
                if (i != levels.length - 1) {
                    throw new IllegalArgumentException("'#' must be the last level of topic: " + topic);
                }
                subject.append('>');
            } else {
                if (level.isEmpty()) {
                    throw new IllegalArgumentException("Empty level in topic: " + topic);
                }
                if (level.contains("+") || level.contains("#") || ILLEGAL_LEVEL_CHARS.matcher(level).find()) {
                    throw new IllegalArgumentException("Illegal character in level '" + level + "' of topic: " + topic);
                }
                subject.append(level);
            }
        }
        return subject.toString();
    }

    /**
     * Inverse of {@link #fromTopic} for concrete (wildcard-free) subjects, as delivered on received messages.
     */
    public static String toTopic(String subject) {
        if (subject == null) {
            return null;
        }
        return subject.replace('.', '/');
    }
}
