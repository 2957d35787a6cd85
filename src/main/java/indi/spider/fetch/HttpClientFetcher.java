package indi.spider.fetch;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

import javax.net.ssl.SSLContext;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.NameValuePair;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpHead;
import org.apache.http.client.methods.HttpOptions;
import org.apache.http.client.methods.HttpPatch;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustAllStrategy;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.entity.mime.MultipartEntityBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.util.EntityUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import indi.spider.exception.SpiderException;
import indi.spider.session.ConnectionContext;
import indi.spider.task.RequestBody;
import indi.spider.task.Task;
import indi.spider.util.ObjectMapperUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于HttpClient的下载器
 *
 * <p>cookie由会话的cookie库管理，因此关闭了HttpClient自身的cookie管理，cookie随任务以Cookie请求头发出。
 * 同一会话的请求带有相同的用户令牌，连接池只会在同一会话内复用有状态的连接
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public class HttpClientFetcher implements Fetcher, Closeable {
    private static final int DEFAULT_MAX_TOTAL = 200;
    private static final int DEFAULT_MAX_PER_ROUTE = 20;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    private static final String USER_TOKEN = HttpClientFetcher.class.getName() + ".userToken";

    private final CloseableHttpClient client;
    /** 不校验证书的客户端，用于verifyTls为false的任务 */
    private final CloseableHttpClient trustAllClient;
    /** 正在执行的请求，用于强制中止 */
    private final Set<HttpRequestBase> inFlight = ConcurrentHashMap.newKeySet();

    public HttpClientFetcher() {
        this(DEFAULT_MAX_TOTAL, DEFAULT_MAX_PER_ROUTE);
    }

    public HttpClientFetcher(int maxTotal, int maxPerRoute) {
        log.info("use default httpclient");
        PoolingHttpClientConnectionManager manager = new PoolingHttpClientConnectionManager();
        manager.setMaxTotal(maxTotal);
        manager.setDefaultMaxPerRoute(maxPerRoute);
        client = createClient(manager);

        PoolingHttpClientConnectionManager trustAllManager = new PoolingHttpClientConnectionManager(createTrustAllRegistry());
        trustAllManager.setMaxTotal(maxTotal);
        trustAllManager.setDefaultMaxPerRoute(maxPerRoute);
        trustAllClient = createClient(trustAllManager);
    }

    private CloseableHttpClient createClient(PoolingHttpClientConnectionManager manager) {
        return HttpClientBuilder.create()
                // 默认会根据状态码(301)，对GET/HEAD请求进行重定向，可见：DefaultRedirectStrategy
                .setConnectionManager(manager)
                .disableCookieManagement()
                .disableAutomaticRetries()
                .build();
    }

    private Registry<ConnectionSocketFactory> createTrustAllRegistry() {
        SSLContext sslContext;
        try {
            sslContext = new SSLContextBuilder().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
        } catch (GeneralSecurityException e) {
            throw new SpiderException("无法创建不校验证书的SSLContext", e);
        }
        return RegistryBuilder.<ConnectionSocketFactory>create()
                .register("http", PlainConnectionSocketFactory.getSocketFactory())
                .register("https", new SSLConnectionSocketFactory(sslContext, NoopHostnameVerifier.INSTANCE))
                .build();
    }

    @Override
    public FetchResult fetch(Task task, ConnectionContext context) throws IOException {
        HttpRequestBase request = buildRequest(task);
        HttpClientContext httpContext = HttpClientContext.create();
        if (context.isShared()) {
            httpContext.setUserToken(context.computeAttribute(USER_TOKEN, String.class, key -> context.getKey()));
        }
        CloseableHttpClient selected = Boolean.FALSE.equals(task.getVerifyTls()) ? trustAllClient : client;

        inFlight.add(request);
        long start = System.nanoTime();
        try (CloseableHttpResponse response = selected.execute(request, httpContext)) {
            int status = response.getStatusLine().getStatusCode();
            ListMultimap<String, String> headers = ArrayListMultimap.create();
            for (Header header : response.getAllHeaders()) {
                headers.put(header.getName(), header.getValue());
            }
            HttpEntity entity = response.getEntity();
            byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            return new FetchResult(status, headers, body, elapsed, finalUri(request, httpContext));
        } finally {
            inFlight.remove(request);
        }
    }

    /**
     * 获取重定向后的地址；重定向地址按重定向顺序存放
     */
    private URI finalUri(HttpRequestBase request, HttpClientContext httpContext) {
        List<URI> locations = httpContext.getRedirectLocations();
        if (locations == null || locations.isEmpty()) {
            return request.getURI();
        }
        return locations.get(locations.size() - 1);
    }

    /**
     * 根据任务构建请求
     *
     * @throws ClientProtocolException 请求不合法，如URI无法解析、请求体无法序列化
     */
    HttpRequestBase buildRequest(Task task) throws ClientProtocolException {
        URI uri = buildUri(task);
        HttpRequestBase request;
        switch (task.getMethod()) {
        case GET:
            request = new HttpGet(uri);
            break;
        case POST:
            request = new HttpPost(uri);
            break;
        case PUT:
            request = new HttpPut(uri);
            break;
        case PATCH:
            request = new HttpPatch(uri);
            break;
        case DELETE:
            request = new HttpDelete(uri);
            break;
        case HEAD:
            request = new HttpHead(uri);
            break;
        case OPTIONS:
            request = new HttpOptions(uri);
            break;
        default:
            throw new ClientProtocolException("Illegal request method: " + task.getMethod());
        }
        // 若请求可携带请求实体（方法是POST/PUT/PATCH），则设置请求实体
        if (request instanceof HttpEntityEnclosingRequestBase && task.getBody() != null) {
            ((HttpEntityEnclosingRequestBase) request).setEntity(buildEntity(task.getBody()));
        }
        task.getHeaders().forEach(request::setHeader);
        attachCookies(task, request);
        request.setConfig(buildConfig(task));
        return request;
    }

    private URI buildUri(Task task) throws ClientProtocolException {
        if (task.getQuery().isEmpty()) {
            return task.getUri();
        }
        try {
            URIBuilder builder = new URIBuilder(task.getUri());
            task.getQuery().forEach(builder::addParameter);
            return builder.build();
        } catch (URISyntaxException e) {
            throw new ClientProtocolException("Illegal uri: " + task.getUri(), e);
        }
    }

    private void attachCookies(Task task, HttpRequestBase request) {
        if (task.getCookies().isEmpty()) {
            return;
        }
        String cookies = task.getCookies().entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining("; "));
        Header explicit = request.getFirstHeader("Cookie");
        if (explicit != null) {
            cookies = explicit.getValue() + "; " + cookies;
        }
        request.setHeader("Cookie", cookies);
    }

    private HttpEntity buildEntity(RequestBody body) throws ClientProtocolException {
        switch (body.getType()) {
        case FORM:
            List<NameValuePair> pairs = body.getFields().entrySet().stream()
                    .map(e -> new BasicNameValuePair(e.getKey(), String.valueOf(e.getValue())))
                    .collect(Collectors.toList());
            return new UrlEncodedFormEntity(pairs, StandardCharsets.UTF_8);
        case JSON:
            try {
                String json = ObjectMapperUtils.getMapper().writeValueAsString(body.getJson());
                return new StringEntity(json, ContentType.APPLICATION_JSON);
            } catch (JsonProcessingException e) {
                throw new ClientProtocolException("无法序列化请求体", e);
            }
        case MULTIPART:
            MultipartEntityBuilder builder = MultipartEntityBuilder.create().setCharset(StandardCharsets.UTF_8);
            for (Map.Entry<String, Object> part : body.getFields().entrySet()) {
                Object value = part.getValue();
                if (value instanceof byte[]) {
                    builder.addBinaryBody(part.getKey(), (byte[]) value, ContentType.DEFAULT_BINARY, part.getKey());
                } else if (value instanceof File) {
                    builder.addBinaryBody(part.getKey(), (File) value);
                } else if (value instanceof InputStream) {
                    builder.addBinaryBody(part.getKey(), (InputStream) value);
                } else {
                    builder.addTextBody(part.getKey(), String.valueOf(value),
                            ContentType.create("text/plain", StandardCharsets.UTF_8));
                }
            }
            return builder.build();
        default:
            throw new ClientProtocolException("Not support body type " + body.getType());
        }
    }

    /**
     * 未设置连接超时时间时，建立连接与读取数据使用同一个超时时间
     */
    private RequestConfig buildConfig(Task task) {
        int timeout = (int) (task.getTimeout() == null ? DEFAULT_TIMEOUT : task.getTimeout()).toMillis();
        int connectTimeout = task.getConnectTimeout() == null ? timeout : (int) task.getConnectTimeout().toMillis();
        return RequestConfig.custom()
                .setConnectTimeout(connectTimeout)
                .setSocketTimeout(timeout)
                .setConnectionRequestTimeout(connectTimeout)
                .setProxy(task.getProxy())
                .setCookieSpec(CookieSpecs.IGNORE_COOKIES)
                .build();
    }

    @Override
    public void abort() {
        for (HttpRequestBase request : inFlight) {
            request.abort();
        }
    }

    @Override
    public void close() throws IOException {
        try {
            client.close();
        } finally {
            trustAllClient.close();
        }
        log.info("HttpClient已关闭");
    }
}
