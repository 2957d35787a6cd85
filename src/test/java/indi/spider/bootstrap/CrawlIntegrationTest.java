package indi.spider.bootstrap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.jsoup.nodes.Element;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import indi.spider.exception.SpiderError;
import indi.spider.session.Session;
import indi.spider.task.Task;
import indi.spider.testutil.RecordingSpider;

/**
 * 使用默认的HttpClientFetcher爬取本地站点
 */
@Timeout(30)
class CrawlIntegrationTest {
	private HttpServer server;
	private String base;
	private final AtomicInteger flaky = new AtomicInteger();

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/index", exchange -> html(exchange, 200,
				"<a class='page' href='page/1'>1</a><a class='page' href='page/2'>2</a>"
						+ "<a class='page' href='/flaky'>3</a><a class='page' href='/missing'>4</a>"));
		server.createContext("/page/", exchange -> html(exchange, 200,
				"<h1>" + exchange.getRequestURI().getPath() + "</h1>"));
		server.createContext("/flaky", exchange -> {
			if (flaky.incrementAndGet() == 1) {
				html(exchange, 503, "busy");
			} else {
				html(exchange, 200, "<h1>/flaky</h1>");
			}
		});
		server.createContext("/missing", exchange -> html(exchange, 404, "<h1>404</h1>"));
		server.createContext("/login", exchange -> {
			exchange.getResponseHeaders().add("Set-Cookie", "sid=s3cret; Path=/");
			html(exchange, 200, "<a class='page' href='/me'>me</a>");
		});
		server.createContext("/me", exchange -> {
			String cookie = exchange.getRequestHeaders().getFirst("Cookie");
			html(exchange, 200, "<h1>" + cookie + "</h1>");
		});
		server.start();
		base = "http://127.0.0.1:" + server.getAddress().getPort();
	}

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.stop(0);
		}
	}

	private void html(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = ("<html><body>" + body + "</body></html>").getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "text/html; charset=UTF-8");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	private RecordingSpider spider(Object... entries) {
		return new RecordingSpider(entries)
				.withConfig(RecordingSpider.fastConfig().withRetryTimes(1).build())
				.withParser(response -> {
					List<Object> results = new ArrayList<>();
					for (Element link : response.select("a.page")) {
						results.add(Task.of(link.attr("href")));
					}
					for (Element title : response.select("h1")) {
						results.add(response.getStatus() + " " + title.text());
					}
					return results;
				});
	}

	@Test
	void crawlTest() {
		RecordingSpider spider = spider(base + "/index");
		SpiderJob job = SpiderJob.build(spider);
		job.start();

		assertEquals(new HashSet<>(Arrays.asList("200 /page/1", "200 /page/2", "200 /flaky", "404 404")),
				new HashSet<>(spider.items));
		assertTrue(spider.errors.isEmpty(), spider.errors::toString);
		assertEquals(2, flaky.get());
		assertEquals(1, job.getScheduler().getStats().getRetries());
	}

	@Test
	void sessionTest() {
		RecordingSpider spider = spider(Task.builder(base + "/login").withSession(Session.create()).build());
		SpiderJob.build(spider).start();

		assertEquals(Arrays.asList("200 sid=s3cret"), spider.items);
	}

	@Test
	void unreachableTest() {
		server.stop(0);
		server = null;
		RecordingSpider spider = spider(base + "/index");
		SpiderJob job = SpiderJob.build(spider);
		job.start();

		assertEquals(1, spider.errors.size());
		assertEquals(SpiderError.Kind.DOWNLOAD_ERROR, spider.errors.get(0).getKind());
		assertEquals(Arrays.asList(base + "/index"), job.getScheduler().getStats().getFailedUrls());
	}
}
