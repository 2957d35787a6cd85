package indi.spider.fetch;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.config.RequestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.google.common.io.ByteStreams;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import indi.spider.session.ConnectionContext;
import indi.spider.session.MemoryCookieJar;
import indi.spider.task.HttpMethod;
import indi.spider.task.RequestBody;
import indi.spider.task.Task;

/**
 * 使用JDK自带的HttpServer作为服务端，服务端把收到的请求写回响应体
 */
@Timeout(20)
class HttpClientFetcherTest {
	private HttpServer server;
	private HttpClientFetcher fetcher;
	private String base;

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/echo", this::echo);
		server.createContext("/status", exchange -> reply(exchange, 503, "busy"));
		server.createContext("/redirect", exchange -> {
			exchange.getResponseHeaders().add("Location", base + "/echo?from=redirect");
			reply(exchange, 302, "");
		});
		server.createContext("/cookie", exchange -> {
			exchange.getResponseHeaders().add("Set-Cookie", "sid=1; Path=/");
			exchange.getResponseHeaders().add("Set-Cookie", "lang=zh; Path=/");
			reply(exchange, 200, "ok");
		});
		server.start();
		base = "http://127.0.0.1:" + server.getAddress().getPort();
		fetcher = new HttpClientFetcher();
	}

	@AfterEach
	void tearDown() throws IOException {
		fetcher.close();
		server.stop(0);
	}

	private void echo(HttpExchange exchange) throws IOException {
		StringBuilder sb = new StringBuilder();
		sb.append(exchange.getRequestMethod()).append(" ").append(exchange.getRequestURI()).append("\n");
		String cookie = exchange.getRequestHeaders().getFirst("Cookie");
		sb.append("cookie: ").append(cookie).append("\n");
		sb.append("content-type: ").append(exchange.getRequestHeaders().getFirst("Content-Type")).append("\n");
		sb.append("x-test: ").append(exchange.getRequestHeaders().getFirst("X-Test")).append("\n");
		sb.append(new String(ByteStreams.toByteArray(exchange.getRequestBody()), StandardCharsets.UTF_8));
		reply(exchange, 200, sb.toString());
	}

	private void reply(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().add("Content-Type", "text/plain; charset=UTF-8");
		if (bytes.length == 0 || "HEAD".equals(exchange.getRequestMethod())) {
			exchange.sendResponseHeaders(status, -1);
			exchange.close();
			return;
		}
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

	/**
	 * HttpServer会改写响应头名称的大小写
	 */
	private List<String> header(FetchResult result, String name) {
		return result.getHeaders().entries().stream()
				.filter(e -> e.getKey().equalsIgnoreCase(name))
				.map(Map.Entry::getValue)
				.collect(Collectors.toList());
	}

	private String text(FetchResult result) {
		return new String(result.getBody(), StandardCharsets.UTF_8);
	}

	@Test
	void getTest() throws IOException {
		Task task = Task.builder(base + "/echo?a=1")
				.withQuery("b", "2")
				.withHeader("X-Test", "yes")
				.withCookie("sid", "abc")
				.withCookie("lang", "en")
				.build();
		FetchResult result = fetcher.fetch(task, ConnectionContext.oneShot());

		assertEquals(200, result.getStatus());
		String body = text(result);
		assertTrue(body.startsWith("GET /echo?a=1&b=2\n"), body);
		assertTrue(body.contains("cookie: lang=en; sid=abc\n"), body);
		assertTrue(body.contains("x-test: yes\n"), body);
		assertEquals("text/plain; charset=UTF-8", header(result, "Content-Type").get(0));
		assertTrue(result.getElapsed().compareTo(Duration.ZERO) >= 0);
	}

	@Test
	void formTest() throws IOException {
		Map<String, String> form = new LinkedHashMap<>();
		form.put("name", "小明");
		form.put("age", "18");
		Task task = Task.builder(base + "/echo").withMethod(HttpMethod.POST).withForm(form).build();
		String body = text(fetcher.fetch(task, ConnectionContext.oneShot()));

		assertTrue(body.startsWith("POST /echo\n"), body);
		assertTrue(body.contains("content-type: application/x-www-form-urlencoded; charset=UTF-8"), body);
		assertTrue(body.endsWith("name=%E5%B0%8F%E6%98%8E&age=18"), body);
	}

	@Test
	void jsonTest() throws IOException {
		Task task = Task.builder(base + "/echo").withMethod(HttpMethod.PUT)
				.withJson(Collections.singletonMap("name", "spider")).build();
		String body = text(fetcher.fetch(task, ConnectionContext.oneShot()));

		assertTrue(body.startsWith("PUT /echo\n"), body);
		assertTrue(body.contains("content-type: application/json"), body);
		assertTrue(body.endsWith("{\"name\":\"spider\"}"), body);
	}

	@Test
	void multipartTest() throws IOException {
		Map<String, Object> parts = new LinkedHashMap<>();
		parts.put("title", "hello");
		parts.put("file", "content".getBytes(StandardCharsets.UTF_8));
		Task task = Task.builder(base + "/echo").withMethod(HttpMethod.POST)
				.withBody(RequestBody.multipart(parts)).build();
		String body = text(fetcher.fetch(task, ConnectionContext.oneShot()));

		assertTrue(body.contains("content-type: multipart/form-data"), body);
		assertTrue(body.contains("name=\"title\""), body);
		assertTrue(body.contains("hello"), body);
		assertTrue(body.contains("filename=\"file\""), body);
	}

	@Test
	void redirectTest() throws IOException {
		FetchResult result = fetcher.fetch(Task.of(base + "/redirect"), ConnectionContext.oneShot());
		assertEquals(200, result.getStatus());
		assertEquals(URI.create(base + "/echo?from=redirect"), result.getUri());
		assertTrue(text(result).startsWith("GET /echo?from=redirect\n"));
	}

	@Test
	void errorStatusTest() throws IOException {
		FetchResult result = fetcher.fetch(Task.of(base + "/status"), ConnectionContext.oneShot());
		assertEquals(503, result.getStatus());
		assertArrayEquals("busy".getBytes(StandardCharsets.UTF_8), result.getBody());
	}

	@Test
	void headTest() throws IOException {
		Task task = Task.builder(base + "/status").withMethod(HttpMethod.HEAD).build();
		FetchResult result = fetcher.fetch(task, ConnectionContext.oneShot());
		assertEquals(503, result.getStatus());
		assertEquals(0, result.getBody().length);
	}

	@Test
	void setCookieNotManagedTest() throws IOException {
		ConnectionContext context = new ConnectionContext("session", new MemoryCookieJar());
		FetchResult result = fetcher.fetch(Task.of(base + "/cookie"), context);
		assertEquals(2, header(result, "Set-Cookie").size());

		// HttpClient自身不保存cookie，cookie由会话的cookie库负责
		String body = text(fetcher.fetch(Task.of(base + "/echo"), context));
		assertTrue(body.contains("cookie: null\n"), body);
		assertEquals("session", context.getAttribute(HttpClientFetcher.class.getName() + ".userToken", String.class));
	}

	@Test
	void connectionRefusedTest() throws IOException {
		int port;
		try (ServerSocket socket = new ServerSocket(0)) {
			port = socket.getLocalPort();
		}
		Task task = Task.builder("http://127.0.0.1:" + port + "/").withTimeout(Duration.ofSeconds(2)).build();
		IOException e = assertThrows(IOException.class, () -> fetcher.fetch(task, ConnectionContext.oneShot()));
		assertTrue(!(e instanceof ClientProtocolException), e::toString);
	}

	@Test
	void illegalJsonBodyTest() {
		Task task = Task.builder(base + "/echo").withMethod(HttpMethod.POST).withJson(new Object()).build();
		assertThrows(ClientProtocolException.class, () -> fetcher.fetch(task, ConnectionContext.oneShot()));
	}

	@Test
	void timeoutConfigTest() throws IOException {
		RequestConfig separate = fetcher.buildRequest(Task.builder(base + "/")
				.withTimeout(Duration.ofSeconds(10))
				.withConnectTimeout(Duration.ofSeconds(2))
				.build()).getConfig();
		assertEquals(2000, separate.getConnectTimeout());
		assertEquals(2000, separate.getConnectionRequestTimeout());
		assertEquals(10000, separate.getSocketTimeout());

		// 未设置连接超时时间时与下载超时时间相同
		RequestConfig shared = fetcher.buildRequest(Task.builder(base + "/").withTimeout(Duration.ofSeconds(4)).build())
				.getConfig();
		assertEquals(4000, shared.getConnectTimeout());
		assertEquals(4000, shared.getSocketTimeout());
	}
}
