package com.wis2.downloader.admin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps control-plane failures to {@code {code, message}} bodies. None of these reach the workers or the ingestion
 * path; a failed request only fails that request.
 */
@RestControllerAdvice(assignableTypes = SubscriptionController.class)
public class ApiExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

	public record ApiError(String code, String message) {
	}

	@ExceptionHandler(MissingTopicException.class)
	public ResponseEntity<ApiError> missingTopic(MissingTopicException e) {
		return ResponseEntity.badRequest().body(new ApiError("no_topic", e.getMessage()));
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
		log.warn("Rejected subscription request: {}", e.getMessage());
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> unexpected(Exception e) {
		log.error("Subscription request failed", e);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
				.body(new ApiError("internal_error", "Internal error"));
	}
}
