package com.wis2.downloader.admin;

/**
 * A subscription request arrived without a {@code topic} parameter.
 */
public class MissingTopicException extends RuntimeException {

	public MissingTopicException() {
		super("No topic passed");
	}
}
