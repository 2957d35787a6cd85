package indi.spider.session;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;

import org.apache.http.HttpHost;

import com.google.common.collect.ImmutableMap;

import indi.spider.task.Task;
import lombok.Getter;
import lombok.ToString;

/**
 * 会话级别的任务默认值，相当于任务的部分字段
 *
 * @since 2026.10.19
 */
@Getter
@ToString
public final class SessionDefaults {
    private final ImmutableMap<String, String> headers;
    private final ImmutableMap<String, String> cookies;
    private final ImmutableMap<String, String> query;
    private final HttpHost proxy;
    private final Boolean verifyTls;
    private final Duration timeout;
    private final Duration connectTimeout;

    private SessionDefaults(Builder builder) {
        this.headers = ImmutableMap.copyOf(builder.headers);
        this.cookies = ImmutableMap.copyOf(builder.cookies);
        this.query = ImmutableMap.copyOf(builder.query);
        this.proxy = builder.proxy;
        this.verifyTls = builder.verifyTls;
        this.timeout = builder.timeout;
        this.connectTimeout = builder.connectTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 将默认值合并到任务中，任务显式设置的字段优先；映射按key合并
     */
    public Task mergeInto(Task task) {
        Task.Builder builder = task.toBuilder();
        headers.forEach(builder::withDefaultHeader);
        Map<String, String> mergedCookies = new TreeMap<>(cookies);
        mergedCookies.putAll(task.getCookies());
        builder.withCookies(mergedCookies);
        Map<String, String> mergedQuery = new TreeMap<>(query);
        mergedQuery.putAll(task.getQuery());
        builder.withQuery(mergedQuery);
        if (task.getProxy() == null) {
            builder.withProxy(proxy);
        }
        if (task.getVerifyTls() == null) {
            builder.withVerifyTls(verifyTls);
        }
        if (task.getTimeout() == null) {
            builder.withTimeout(timeout);
        }
        if (task.getConnectTimeout() == null) {
            builder.withConnectTimeout(connectTimeout);
        }
        return builder.build();
    }

    public static class Builder {
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> cookies = new TreeMap<>();
        private final Map<String, String> query = new TreeMap<>();
        private HttpHost proxy;
        private Boolean verifyTls;
        private Duration timeout;
        private Duration connectTimeout;

        private Builder() {
        }

        public Builder withHeader(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder withCookie(String name, String value) {
            cookies.put(name, value);
            return this;
        }

        public Builder withQuery(String name, String value) {
            query.put(name, value);
            return this;
        }

        public Builder withHTTPProxy(String hostname, int port) {
            this.proxy = new HttpHost(hostname, port);
            return this;
        }

        public Builder withVerifyTls(boolean verifyTls) {
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

        public SessionDefaults build() {
            return new SessionDefaults(this);
        }
    }
}
