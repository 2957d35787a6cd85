package indi.spider.task;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import javax.annotation.Nullable;

import org.apache.http.HttpHost;

import com.google.common.base.Preconditions;

import indi.spider.session.Session;
import lombok.Getter;
import lombok.ToString;

/**
 * 描述一个爬虫任务，即一次（或其重试的）HTTP请求
 *
 * <p>任务创建后不可变，重试时通过{@link #nextAttempt()}得到尝试次数加一的副本。请求头、cookie、查询参数三个映射
 * 仅由当前执行该任务的爬虫线程持有，下载前的钩子可以直接修改它们，修改对之后的钩子可见。
 *
 * <p>state 是任务与其响应之间的纽带，以引用的形式传递给响应与重试的副本，引擎不会修改它；多个任务共享同一个state对象时，
 * 需由使用者自行保证线程安全
 *
 * @since 2026.10.19
 */
@Getter
@ToString(of = { "method", "uri", "attempt", "session" })
public final class Task {
    private final URI uri;
    private final HttpMethod method;
    private final Map<String, String> headers;
    private final Map<String, String> cookies;
    private final Map<String, String> query;
    @Nullable
    private final RequestBody body;
    @Nullable
    private final HttpHost proxy;
    /** 为null时取会话或全局的默认值 */
    @Nullable
    private final Boolean verifyTls;
    /** 为null时取会话或全局的默认值 */
    @Nullable
    private final Duration timeout;
    /** 建立连接的超时时间，为null时取会话或全局的默认值，都没有时与timeout相同 */
    @Nullable
    private final Duration connectTimeout;
    /** 为null时使用Spider#parse */
    @Nullable
    private final Extractor extractor;
    @Nullable
    private final Session session;
    /** 由解析函数产生且未声明会话时，是否沿用父任务的会话 */
    private final boolean inheritSession;
    @Nullable
    private final Object state;
    /** 第几次尝试，从1开始 */
    private final int attempt;

    private Task(Builder builder) {
        this.uri = builder.uri;
        this.method = builder.method;
        this.headers = builder.headers;
        this.cookies = builder.cookies;
        this.query = builder.query;
        this.body = builder.body;
        this.proxy = builder.proxy;
        this.verifyTls = builder.verifyTls;
        this.timeout = builder.timeout;
        this.connectTimeout = builder.connectTimeout;
        this.extractor = builder.extractor;
        this.session = builder.session;
        this.inheritSession = builder.inheritSession;
        this.state = builder.state;
        this.attempt = builder.attempt;
    }

    public static Task of(String url) {
        return builder(url).build();
    }

    public static Task of(URI uri) {
        return builder(uri).build();
    }

    public static Builder builder(String url) {
        return new Builder(URI.create(url));
    }

    public static Builder builder(URI uri) {
        return new Builder(uri);
    }

    /**
     * 将入口返回的对象转化为任务，支持Task、String与URI
     */
    public static Task from(Object entry) {
        if (entry instanceof Task) {
            return (Task) entry;
        }
        if (entry instanceof String) {
            return of((String) entry);
        }
        if (entry instanceof URI) {
            return of((URI) entry);
        }
        throw new IllegalArgumentException("Not support entry: " + entry);
    }

    /**
     * 以当前任务为模板创建新的构建器；各映射会被复制
     */
    public Builder toBuilder() {
        Builder builder = new Builder(uri);
        builder.method = method;
        builder.headers.putAll(headers);
        builder.cookies.putAll(cookies);
        builder.query.putAll(query);
        builder.body = body;
        builder.proxy = proxy;
        builder.verifyTls = verifyTls;
        builder.timeout = timeout;
        builder.connectTimeout = connectTimeout;
        builder.extractor = extractor;
        builder.session = session;
        builder.inheritSession = inheritSession;
        builder.state = state;
        builder.attempt = attempt;
        return builder;
    }

    /**
     * 重试用的副本，尝试次数加一，state共享同一引用
     */
    public Task nextAttempt() {
        Builder builder = toBuilder();
        builder.attempt = attempt + 1;
        return builder.build();
    }

    /**
     * 以 (method, uri, attempt) 作为日志中的身份标识
     */
    public String getIdentity() {
        return new StringBuilder(method.name())
                .append(" ").append(uri)
                .append(" #").append(attempt)
                .toString();
    }

    public boolean isRetry() {
        return attempt > 1;
    }

    /**
     * 各方法只修改构建器自身，build时生成新的任务
     */
    public static class Builder {
        private URI uri;
        private HttpMethod method = HttpMethod.GET;
        private Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private Map<String, String> cookies = new TreeMap<>();
        private Map<String, String> query = new TreeMap<>();
        private RequestBody body;
        private HttpHost proxy;
        private Boolean verifyTls;
        private Duration timeout;
        private Duration connectTimeout;
        private Extractor extractor;
        private Session session;
        private boolean inheritSession = true;
        private Object state;
        private int attempt = 1;

        private Builder(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
        }

        public Builder withUri(URI uri) {
            this.uri = Objects.requireNonNull(uri, "uri");
            return this;
        }

        public Builder withMethod(HttpMethod method) {
            this.method = Objects.requireNonNull(method, "method");
            return this;
        }

        public Builder withMethod(String method) {
            return withMethod(HttpMethod.valueOf(method.toUpperCase(Locale.ROOT)));
        }

        public Builder withHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder withHeaders(Map<String, String> headers) {
            this.headers.putAll(headers);
            return this;
        }

        /**
         * 仅当不存在同名请求头时设置
         */
        public Builder withDefaultHeader(String name, String value) {
            headers.putIfAbsent(name, value);
            return this;
        }

        public Builder withCookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder withCookies(Map<String, String> cookies) {
            this.cookies.putAll(cookies);
            return this;
        }

        public Builder withQuery(String name, String value) {
            query.put(name, value);
            return this;
        }

        public Builder withQuery(Map<String, String> query) {
            this.query.putAll(query);
            return this;
        }

        public Builder withBody(RequestBody body) {
            this.body = body;
            return this;
        }

        public Builder withForm(Map<String, String> form) {
            return withBody(RequestBody.form(form));
        }

        public Builder withJson(Object json) {
            return withBody(RequestBody.json(json));
        }

        public Builder withHTTPProxy(String hostname, int port) {
            this.proxy = new HttpHost(hostname, port);
            return this;
        }

        public Builder withProxy(HttpHost proxy) {
            this.proxy = proxy;
            return this;
        }

        public Builder withVerifyTls(Boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withExtractor(Extractor extractor) {
            this.extractor = extractor;
            return this;
        }

        public Builder withSession(Session session) {
            this.session = session;
            return this;
        }

        public Builder withInheritSession(boolean inheritSession) {
            this.inheritSession = inheritSession;
            return this;
        }

        public Builder withState(Object state) {
            this.state = state;
            return this;
        }

        public Task build() {
            Preconditions.checkArgument(attempt >= 1, "attempt must be positive: %s", attempt);
            if (body != null) {
                Preconditions.checkArgument(method.isEntityEnclosing(), "%s request can not carry a body", method);
            }
            // 构建后构建器不再持有这些映射，避免两个任务共享
            Task task = new Task(this);
            headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
            headers.putAll(task.headers);
            cookies = new TreeMap<>(task.cookies);
            query = new TreeMap<>(task.query);
            return task;
        }
    }
}
