package com.wis2.downloader.admin;

import com.wis2.downloader.ingest.IngestionAdapter;
import com.wis2.downloader.ingest.SubscriptionChange;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP control surface over the subscription operations of {@link IngestionAdapter}.
 *
 * <pre>
 * GET /wis2/subscriptions/list
 * GET /wis2/subscriptions/add?topic=T[&amp;directory=D]
 * GET /wis2/subscriptions/delete?topic=T
 * </pre>
 *
 * Every endpoint answers with the subscription table after the operation, topic to directory.
 */
@RestController
@RequestMapping(path = "/wis2/subscriptions", produces = MediaType.APPLICATION_JSON_VALUE)
public class SubscriptionController {

	private final IngestionAdapter adapter;

	public SubscriptionController(IngestionAdapter adapter) {
		this.adapter = adapter;
	}

	@GetMapping("/list")
	public Map<String, String> list() {
		return adapter.listSubscriptions();
	}

	@GetMapping("/add")
	public Map<String, String> add(@RequestParam(name = "topic", required = false) String topic,
			@RequestParam(name = "directory", required = false) String directory) {
		SubscriptionChange change = adapter.addSubscription(requireTopic(topic), directory);
		return change.subscriptions();
	}

	@GetMapping("/delete")
	public Map<String, String> delete(@RequestParam(name = "topic", required = false) String topic) {
		SubscriptionChange change = adapter.deleteSubscription(requireTopic(topic));
		return change.subscriptions();
	}

	private static String requireTopic(String topic) {
		if (topic == null || topic.isBlank()) {
			throw new MissingTopicException();
		}
		return topic;
	}
}
