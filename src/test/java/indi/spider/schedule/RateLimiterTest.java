package indi.spider.schedule;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import indi.spider.task.Task;

class RateLimiterTest {

	@Test
	void noDelayTest() throws InterruptedException {
		RateLimiter limiter = new RateLimiter(Duration.ZERO, true, 0.5, 1.5);
		assertEquals(Duration.ZERO, limiter.nextDelay());
		long begin = System.nanoTime();
		limiter.await(Task.of("http://example.com"));
		assertTrue(System.nanoTime() - begin < Duration.ofMillis(100).toNanos());
	}

	@Test
	void fixedDelayTest() {
		RateLimiter limiter = new RateLimiter(Duration.ofMillis(200), false, 0.5, 1.5);
		assertEquals(Duration.ofMillis(200), limiter.nextDelay());
	}

	@Test
	void randomDelayTest() {
		RateLimiter limiter = new RateLimiter(Duration.ofSeconds(1), true, 0.5, 1.5);
		for (int i = 0; i < 100; i++) {
			Duration delay = limiter.nextDelay();
			assertTrue(delay.compareTo(Duration.ofMillis(500)) >= 0, delay::toString);
			assertTrue(delay.compareTo(Duration.ofMillis(1500)) <= 0, delay::toString);
		}
	}

	@Test
	void sameScaleTest() {
		RateLimiter limiter = new RateLimiter(Duration.ofSeconds(1), true, 2, 2);
		assertEquals(Duration.ofSeconds(2), limiter.nextDelay());
	}

	@Test
	void awaitTest() throws InterruptedException {
		RateLimiter limiter = new RateLimiter(Duration.ofMillis(100), false, 1, 1);
		long begin = System.nanoTime();
		limiter.await(Task.of("http://example.com"));
		assertTrue(System.nanoTime() - begin >= Duration.ofMillis(90).toNanos());
	}
}
