package indi.spider.hook.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

import indi.spider.session.Session;
import indi.spider.task.Task;

class RandomUserAgentHookTest {

	@Test
	void loadDefaultUserAgentsTest() {
		RandomUserAgentHook hook = new RandomUserAgentHook();
		assertFalse(hook.getUserAgents().isEmpty());
		hook.getUserAgents().forEach(ua -> assertFalse(ua.trim().isEmpty()));
		assertTrue(hook.getUserAgents().stream().anyMatch(ua -> ua.startsWith("Mozilla/")));
	}

	@Test
	void overrideUserAgentTest() {
		RandomUserAgentHook hook = new RandomUserAgentHook(Collections.singletonList("test-agent"));
		Task task = Task.builder("http://example.com").withHeader("user-agent", "mine").build();

		Task result = hook.beforeDownload(null, task).getValue();
		assertEquals("test-agent", result.getHeaders().get("User-Agent"));
		assertEquals(1, result.getHeaders().size());
	}

	@Test
	void sessionKeepsUserAgentTest() {
		RandomUserAgentHook hook = new RandomUserAgentHook(Arrays.asList("a", "b", "c", "d", "e", "f", "g", "h"));
		Session session = Session.create();
		String first = null;
		for (int i = 0; i < 20; i++) {
			Task task = Task.builder("http://example.com/" + i).withSession(session).build();
			String ua = hook.beforeDownload(null, task).getValue().getHeaders().get(RandomUserAgentHook.USER_AGENT);
			if (first == null) {
				first = ua;
			}
			assertEquals(first, ua);
		}
	}

	@Test
	void randomWithoutSessionTest() {
		RandomUserAgentHook hook = new RandomUserAgentHook(Arrays.asList("a", "b", "c", "d", "e", "f", "g", "h"));
		Set<String> picked = new HashSet<>();
		for (int i = 0; i < 200; i++) {
			Task task = Task.of("http://example.com/" + i);
			picked.add(hook.beforeDownload(null, task).getValue().getHeaders().get(RandomUserAgentHook.USER_AGENT));
		}
		assertTrue(picked.size() > 1);
	}

	@Test
	void emptyUserAgentsTest() {
		assertThrows(IllegalArgumentException.class, () -> new RandomUserAgentHook(Collections.emptyList()));
	}
}
