package indi.spider.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableSet;

class SpiderConfigTest {

	@Test
	void defaultsTest() {
		SpiderConfig config = SpiderConfig.defaults();
		assertEquals(Runtime.getRuntime().availableProcessors() * 2, config.getWorkers());
		assertEquals(Duration.ofSeconds(30), config.getTimeout());
		assertNull(config.getConnectTimeout());
		assertEquals(Duration.ZERO, config.getDownloadDelay());
		assertTrue(config.isRandomDownloadDelay());
		assertEquals(3, config.getRetryTimes());
		assertEquals(ImmutableSet.of(500, 502, 503, 504, 408, 429), config.getRetryCodes());
		assertEquals(Duration.ofSeconds(3), config.getRetryDelay());
		assertEquals(SpiderConfig.DEFAULT_USER_AGENT, config.getDefaultHeaders().get("User-Agent"));
		assertTrue(config.isVerifyTls());
		assertEquals(SpiderConfig.AbortPolicy.FINISH_IN_FLIGHT, config.getAbortPolicy());
	}

	@Test
	void toBuilderTest() {
		SpiderConfig config = SpiderConfig.builder()
				.withWorkers(1)
				.withRetryCodes(503)
				.withDefaultHeader("Accept", "text/html")
				.withRandomDownloadDelay(false)
				.withConnectTimeout(Duration.ofSeconds(2))
				.build();
		SpiderConfig copy = config.toBuilder().withRetryTimes(0).build();

		assertEquals(1, copy.getWorkers());
		assertEquals(ImmutableSet.of(503), copy.getRetryCodes());
		assertEquals("text/html", copy.getDefaultHeaders().get("Accept"));
		assertFalse(copy.isRandomDownloadDelay());
		assertEquals(Duration.ofSeconds(2), copy.getConnectTimeout());
		assertEquals(0, copy.getRetryTimes());
		assertEquals(3, config.getRetryTimes());
	}

	@Test
	void defaultHeadersTest() {
		SpiderConfig config = SpiderConfig.builder().withDefaultHeaders(Collections.singletonMap("X-A", "1")).build();
		assertEquals(1, config.getDefaultHeaders().size());
		assertFalse(config.getDefaultHeaders().containsKey("User-Agent"));
	}

	@Test
	void validateTest() {
		assertThrows(IllegalArgumentException.class, () -> SpiderConfig.builder().withWorkers(0).build());
		assertThrows(IllegalArgumentException.class, () -> SpiderConfig.builder().withRetryTimes(-1).build());
		assertThrows(IllegalArgumentException.class, () -> SpiderConfig.builder().withTimeout(Duration.ZERO).build());
		assertThrows(IllegalArgumentException.class,
				() -> SpiderConfig.builder().withDownloadDelay(Duration.ofSeconds(-1)).build());
		assertThrows(IllegalArgumentException.class,
				() -> SpiderConfig.builder().withRandomDownloadDelay(true, 2, 1).build());
		assertThrows(IllegalArgumentException.class, () -> SpiderConfig.builder().withRetryCodes(200).build());
		assertThrows(NullPointerException.class, () -> SpiderConfig.builder().withTimeout(null).build());
		assertThrows(IllegalArgumentException.class,
				() -> SpiderConfig.builder().withConnectTimeout(Duration.ZERO).build());
	}
}
