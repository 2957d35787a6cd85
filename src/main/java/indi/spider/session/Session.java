package indi.spider.session;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.Nullable;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 会话的声明。引用同一个key的任务共用同一个连接上下文（cookie、连接状态）
 *
 * <pre>
 * Session login = Session.create();
 * Task.builder(url).withSession(login).build();
 * </pre>
 *
 * @since 2026.10.19
 */
@Getter
@ToString
@EqualsAndHashCode(of = "key")
public final class Session {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String key;
    @Nullable
    private final SessionDefaults defaults;

    private Session(String key, @Nullable SessionDefaults defaults) {
        this.key = Objects.requireNonNull(key, "key");
        this.defaults = defaults;
    }

    /**
     * 声明一个新的会话，key在进程内唯一
     */
    public static Session create() {
        return create(null);
    }

    /**
     * 声明一个带默认值的新会话；默认值会合并到使用该会话的每个任务中，任务显式设置的值优先
     */
    public static Session create(@Nullable SessionDefaults defaults) {
        return new Session("session-" + SEQUENCE.incrementAndGet(), defaults);
    }

    /**
     * 以给定名称声明会话，便于在不同地方引用同一个会话
     */
    public static Session named(String key) {
        return new Session(key, null);
    }

    public static Session named(String key, @Nullable SessionDefaults defaults) {
        return new Session(key, defaults);
    }
}
