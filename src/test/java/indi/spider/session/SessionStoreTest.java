package indi.spider.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.Closeable;
import java.net.URI;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import indi.spider.task.Task;

class SessionStoreTest {

	@Test
	void resolveTest() {
		SessionStore store = new SessionStore();
		Session session = Session.create();
		ConnectionContext first = store.resolve(Task.builder("http://example.com/a").withSession(session).build());
		ConnectionContext second = store.resolve(Task.builder("http://example.com/b").withSession(session).build());
		ConnectionContext named = store.resolve(
				Task.builder("http://example.com/c").withSession(Session.named(session.getKey())).build());

		assertSame(first, second);
		assertSame(first, named);
		assertTrue(first.isShared());
		assertEquals(1, store.size());
	}

	@Test
	void oneShotTest() {
		SessionStore store = new SessionStore();
		Task task = Task.of("http://example.com");
		ConnectionContext first = store.resolve(task);
		ConnectionContext second = store.resolve(task);

		assertNotSame(first, second);
		assertFalse(first.isShared());
		assertNull(first.getKey());
		assertEquals(0, store.size());
	}

	@Test
	void createUniqueTest() {
		assertNotEquals(Session.create(), Session.create());
		assertEquals(Session.named("shop"), Session.named("shop"));
	}

	@Test
	void applyDefaultsTest() {
		SessionStore store = new SessionStore();
		Task plain = Task.of("http://example.com");
		assertSame(plain, store.applyDefaults(plain));

		Session session = Session.create(SessionDefaults.builder()
				.withHeader("Referer", "http://example.com")
				.withCookie("sid", "1")
				.withHTTPProxy("127.0.0.1", 1080)
				.withVerifyTls(false)
				.build());
		Task task = Task.builder("http://example.com").withSession(session).withCookie("sid", "2")
				.withTimeout(Duration.ofSeconds(3)).build();
		Task merged = store.applyDefaults(task);

		assertEquals("http://example.com", merged.getHeaders().get("referer"));
		assertEquals("2", merged.getCookies().get("sid"));
		assertEquals(1080, merged.getProxy().getPort());
		assertFalse(merged.getVerifyTls());
		assertEquals(Duration.ofSeconds(3), merged.getTimeout());
		// 合并得到的是新任务
		assertTrue(task.getHeaders().isEmpty());
	}

	@Test
	void closeTest() {
		SessionStore store = new SessionStore();
		ConnectionContext context = store.resolve(Task.builder("http://example.com").withSession(Session.create()).build());
		context.getCookieJar().add("a=1", URI.create("http://example.com"));
		AtomicBoolean closed = new AtomicBoolean();
		context.computeAttribute("connection", Closeable.class, key -> () -> closed.set(true));

		store.close();
		assertTrue(closed.get());
		assertTrue(context.getCookieJar().getCookies().isEmpty());
		assertNull(context.getAttribute("connection", Closeable.class));
		assertEquals(0, store.size());
	}

	@Test
	void computeAttributeTest() {
		ConnectionContext context = ConnectionContext.oneShot();
		Object first = context.computeAttribute("token", Object.class, key -> new Object());
		Object second = context.computeAttribute("token", Object.class, key -> new Object());
		assertSame(first, second);
		assertThrows(ClassCastException.class, () -> context.computeAttribute("token", String.class, key -> "token"));
	}
}
