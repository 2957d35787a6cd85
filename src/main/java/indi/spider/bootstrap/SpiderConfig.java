package indi.spider.bootstrap;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import lombok.Getter;
import lombok.ToString;

/**
 * 爬虫的配置，创建后不可变
 *
 * <pre>
 * SpiderConfig config = SpiderConfig.builder()
 *         .withWorkers(4)
 *         .withRetryTimes(2)
 *         .withDownloadDelay(Duration.ofMillis(500))
 *         .build();
 * </pre>
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Getter
@ToString
public final class SpiderConfig {
    public static final int DEFAULT_WORKERS = Runtime.getRuntime().availableProcessors() * 2;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_RETRY_TIMES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(3);
    public static final ImmutableSet<Integer> DEFAULT_RETRY_CODES = ImmutableSet.of(500, 502, 503, 504, 408, 429);
    public static final double DEFAULT_RANDOM_DELAY_LOW = 0.5;
    public static final double DEFAULT_RANDOM_DELAY_HIGH = 1.5;
    public static final String DEFAULT_USER_AGENT = "indi-spider";

    /** 并发的爬虫线程数 */
    private final int workers;
    /** 下载超时时间，任务与会话未设置时使用 */
    private final Duration timeout;
    /** 建立连接的超时时间，为null时与timeout相同 */
    @Nullable
    private final Duration connectTimeout;
    /** 每次下载前的等待时间 */
    private final Duration downloadDelay;
    /** 是否在 [low * downloadDelay, high * downloadDelay] 内随机等待 */
    private final boolean randomDownloadDelay;
    private final double randomDelayLow;
    private final double randomDelayHigh;
    /** 最大重试次数 */
    private final int retryTimes;
    /** 需要重试的状态码；DNS、连接等传输层面的失败总是会重试 */
    private final ImmutableSet<Integer> retryCodes;
    /** 重试前的等待时间 */
    private final Duration retryDelay;
    /** 任务进入任务池前补充的请求头，不覆盖任务已有的请求头 */
    private final ImmutableMap<String, String> defaultHeaders;
    private final boolean verifyTls;
    private final AbortPolicy abortPolicy;

    /**
     * 强制结束爬虫时，对正在执行的任务的处理方式
     */
    public enum AbortPolicy {
        /** 等待正在执行的任务完成 */
        FINISH_IN_FLIGHT,
        /** 中断爬虫线程，放弃正在执行的任务 */
        INTERRUPT_IN_FLIGHT;
    }

    private SpiderConfig(Builder builder) {
        this.workers = builder.workers;
        this.timeout = builder.timeout;
        this.connectTimeout = builder.connectTimeout;
        this.downloadDelay = builder.downloadDelay;
        this.randomDownloadDelay = builder.randomDownloadDelay;
        this.randomDelayLow = builder.randomDelayLow;
        this.randomDelayHigh = builder.randomDelayHigh;
        this.retryTimes = builder.retryTimes;
        this.retryCodes = ImmutableSet.copyOf(builder.retryCodes);
        this.retryDelay = builder.retryDelay;
        this.defaultHeaders = ImmutableMap.copyOf(builder.defaultHeaders);
        this.verifyTls = builder.verifyTls;
        this.abortPolicy = builder.abortPolicy;
    }

    public static SpiderConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .withWorkers(workers)
                .withTimeout(timeout)
                .withConnectTimeout(connectTimeout)
                .withDownloadDelay(downloadDelay)
                .withRandomDownloadDelay(randomDownloadDelay, randomDelayLow, randomDelayHigh)
                .withRetryTimes(retryTimes)
                .withRetryCodes(retryCodes)
                .withRetryDelay(retryDelay)
                .withDefaultHeaders(defaultHeaders)
                .withVerifyTls(verifyTls)
                .withAbortPolicy(abortPolicy);
    }

    public static class Builder {
        private int workers = DEFAULT_WORKERS;
        private Duration timeout = DEFAULT_TIMEOUT;
        private Duration connectTimeout;
        private Duration downloadDelay = Duration.ZERO;
        private boolean randomDownloadDelay = true;
        private double randomDelayLow = DEFAULT_RANDOM_DELAY_LOW;
        private double randomDelayHigh = DEFAULT_RANDOM_DELAY_HIGH;
        private int retryTimes = DEFAULT_RETRY_TIMES;
        private Collection<Integer> retryCodes = DEFAULT_RETRY_CODES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private Map<String, String> defaultHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private boolean verifyTls = true;
        private AbortPolicy abortPolicy = AbortPolicy.FINISH_IN_FLIGHT;

        private Builder() {
            defaultHeaders.put("User-Agent", DEFAULT_USER_AGENT);
        }

        public Builder withWorkers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withConnectTimeout(@Nullable Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder withDownloadDelay(Duration downloadDelay) {
            this.downloadDelay = downloadDelay;
            return this;
        }

        public Builder withRandomDownloadDelay(boolean randomDownloadDelay) {
            this.randomDownloadDelay = randomDownloadDelay;
            return this;
        }

        /**
         * 在 [low * downloadDelay, high * downloadDelay] 内随机等待
         */
        public Builder withRandomDownloadDelay(boolean randomDownloadDelay, double low, double high) {
            this.randomDownloadDelay = randomDownloadDelay;
            this.randomDelayLow = low;
            this.randomDelayHigh = high;
            return this;
        }

        public Builder withRetryTimes(int retryTimes) {
            this.retryTimes = retryTimes;
            return this;
        }

        public Builder withRetryCodes(Collection<Integer> retryCodes) {
            this.retryCodes = retryCodes;
            return this;
        }

        public Builder withRetryCodes(Integer... retryCodes) {
            this.retryCodes = ImmutableSet.copyOf(retryCodes);
            return this;
        }

        public Builder withRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder withDefaultHeader(String name, String value) {
            defaultHeaders.put(name, value);
            return this;
        }

        /**
         * 替换全部默认请求头
         */
        public Builder withDefaultHeaders(Map<String, String> headers) {
            defaultHeaders.clear();
            defaultHeaders.putAll(headers);
            return this;
        }

        public Builder withVerifyTls(boolean verifyTls) {
            this.verifyTls = verifyTls;
            return this;
        }

        public Builder withAbortPolicy(AbortPolicy abortPolicy) {
            this.abortPolicy = abortPolicy;
            return this;
        }

        public SpiderConfig build() {
            Preconditions.checkArgument(workers > 0, "workers must be positive: %s", workers);
            Preconditions.checkArgument(retryTimes >= 0, "retryTimes can not be negative: %s", retryTimes);
            Preconditions.checkNotNull(timeout, "timeout");
            Preconditions.checkArgument(!timeout.isNegative() && !timeout.isZero(), "timeout must be positive: %s",
                    timeout);
            Preconditions.checkArgument(connectTimeout == null || !connectTimeout.isNegative() && !connectTimeout.isZero(),
                    "connectTimeout must be positive: %s", connectTimeout);
            Preconditions.checkNotNull(downloadDelay, "downloadDelay");
            Preconditions.checkArgument(!downloadDelay.isNegative(), "downloadDelay can not be negative: %s",
                    downloadDelay);
            Preconditions.checkNotNull(retryDelay, "retryDelay");
            Preconditions.checkArgument(!retryDelay.isNegative(), "retryDelay can not be negative: %s", retryDelay);
            Preconditions.checkArgument(randomDelayLow > 0 && randomDelayHigh > 0,
                    "random delay scales must be positive: [%s, %s]", randomDelayLow, randomDelayHigh);
            Preconditions.checkArgument(randomDelayLow <= randomDelayHigh,
                    "random delay low scale is greater than high scale: [%s, %s]", randomDelayLow, randomDelayHigh);
            for (Integer code : retryCodes) {
                Preconditions.checkArgument(code != null && code >= 400 && code < 600,
                        "retry code must be in [400, 600): %s", code);
            }
            Preconditions.checkNotNull(abortPolicy, "abortPolicy");
            return new SpiderConfig(this);
        }
    }
}
