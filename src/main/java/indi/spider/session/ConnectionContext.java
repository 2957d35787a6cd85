package indi.spider.session;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

import javax.annotation.Nullable;

import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * 连接上下文，保存一个会话（或一次性任务）的cookie与下载器的连接状态
 *
 * <p>下载器可以通过{@link #computeAttribute(String, Class, Function)}在上下文中保存自己的状态，如HttpClient连接池的用户令牌
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
@ToString(of = "key")
public class ConnectionContext implements Closeable {
    /** 一次性上下文为null */
    @Getter
    @Nullable
    private final String key;
    @Getter
    private final CookieJar cookieJar;
    private final ConcurrentMap<String, Object> attributes = new ConcurrentHashMap<>();

    public ConnectionContext(@Nullable String key, CookieJar cookieJar) {
        this.key = key;
        this.cookieJar = cookieJar;
    }

    /**
     * 创建不属于任何会话的一次性上下文
     */
    public static ConnectionContext oneShot() {
        return new ConnectionContext(null, new MemoryCookieJar());
    }

    public boolean isShared() {
        return key != null;
    }

    /**
     * 获取属性，不存在时用factory创建
     *
     * @throws ClassCastException 已有的属性不是给定类型
     */
    public <T> T computeAttribute(String name, Class<T> type, Function<String, ? extends T> factory) {
        return type.cast(attributes.computeIfAbsent(name, factory));
    }

    @Nullable
    public <T> T getAttribute(String name, Class<T> type) {
        return type.cast(attributes.get(name));
    }

    /**
     * 释放上下文：关闭可关闭的属性，清空cookie
     */
    @Override
    public void close() {
        for (Object attribute : attributes.values()) {
            if (attribute instanceof Closeable) {
                try {
                    ((Closeable) attribute).close();
                } catch (IOException e) {
                    log.warn("关闭连接上下文 {} 的属性失败", key, e);
                }
            }
        }
        attributes.clear();
        cookieJar.clear();
    }
}
