package indi.spider.schedule;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Set;

import javax.net.ssl.SSLException;
import javax.net.ssl.SSLHandshakeException;

import org.apache.http.ConnectionClosedException;
import org.apache.http.NoHttpResponseException;
import org.apache.http.TruncatedChunkException;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.conn.ConnectTimeoutException;

import com.google.common.collect.ImmutableMap;

import indi.spider.bootstrap.SpiderConfig;
import indi.spider.exception.SpiderException;
import indi.spider.task.Task;
import lombok.Getter;

/**
 * 重试策略，判断下载失败后能否重试
 *
 * <p>传输层面的异常（DNS、连接、超时、连接被关闭、TLS）总是可以重试；ClientProtocolException表示请求本身有问题，不再重试；
 * 其他异常均不重试。状态码只有在重试状态码集合内才重试，其余状态码（包括4xx/5xx）都视为成功的下载
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
public class RetryPolicy {
    private final ImmutableMap<Class<? extends Throwable>, Decision> decisions;
    @Getter
    private final int retryTimes;
    @Getter
    private final Duration retryDelay;
    private final Set<Integer> retryCodes;

    public enum Decision {
        /** 可以重试 */
        RETRY,
        /** 不再重试，报告错误 */
        TERMINAL,
        /** 状态码不需要重试，进入后续流程 */
        PASS;
    }

    public RetryPolicy(SpiderConfig config) {
        this(config.getRetryTimes(), config.getRetryCodes(), config.getRetryDelay());
    }

    public RetryPolicy(int retryTimes, Set<Integer> retryCodes, Duration retryDelay) {
        this.retryTimes = retryTimes;
        this.retryCodes = retryCodes;
        this.retryDelay = retryDelay;
        // 按异常的继承关系由具体到宽泛查找，先找到者为准
        decisions = ImmutableMap.<Class<? extends Throwable>, Decision>builder()
                .put(ClientProtocolException.class, Decision.TERMINAL)
                .put(ConnectionClosedException.class, Decision.RETRY)
                .put(NoHttpResponseException.class, Decision.RETRY)
                .put(TruncatedChunkException.class, Decision.RETRY)
                .put(SSLHandshakeException.class, Decision.RETRY)
                .put(SSLException.class, Decision.RETRY)
                .put(UnknownHostException.class, Decision.RETRY)
                .put(ConnectException.class, Decision.RETRY)
                .put(ConnectTimeoutException.class, Decision.RETRY)
                .put(SocketTimeoutException.class, Decision.RETRY)
                .put(SocketException.class, Decision.RETRY)
                .put(InterruptedIOException.class, Decision.RETRY)
                .put(IOException.class, Decision.RETRY)
                .build();
    }

    /**
     * 判断异常能否重试
     */
    public Decision classify(Throwable throwable) {
        // 还原被 SpiderException 封装的异常
        Throwable actual = throwable;
        while (actual instanceof SpiderException && actual.getCause() != null) {
            actual = actual.getCause();
        }
        for (Class<?> c = actual.getClass(); c != null && c != Object.class; c = c.getSuperclass()) {
            Decision decision = decisions.get(c);
            if (decision != null) {
                return decision;
            }
        }
        return Decision.TERMINAL;
    }

    /**
     * 判断状态码能否重试；不在重试状态码集合内的状态码直接进入后续流程
     */
    public Decision classify(int status) {
        return retryCodes.contains(status) ? Decision.RETRY : Decision.PASS;
    }

    /**
     * 任务失败后是否还能再尝试；第 retryTimes + 1 次尝试失败后不再重试
     */
    public boolean hasAttemptsLeft(Task task) {
        return task.getAttempt() <= retryTimes;
    }

    public Task nextAttempt(Task task) {
        return task.nextAttempt();
    }
}
