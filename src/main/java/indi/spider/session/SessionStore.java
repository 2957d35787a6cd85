package indi.spider.session;

import java.io.Closeable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import indi.spider.task.Task;
import lombok.extern.slf4j.Slf4j;

/**
 * 会话库，按会话的key维护连接上下文
 *
 * <p>同一个key的上下文只会被创建一次，此后被所有引用该key的任务共用，直到爬虫结束
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public class SessionStore implements Closeable {
    private final ConcurrentMap<String, ConnectionContext> contexts = new ConcurrentHashMap<>();

    /**
     * 获取任务对应的连接上下文；未声明会话的任务每次都得到新的一次性上下文
     */
    public ConnectionContext resolve(Task task) {
        Session session = task.getSession();
        if (session == null) {
            return ConnectionContext.oneShot();
        }
        return contexts.computeIfAbsent(session.getKey(), key -> {
            log.debug("创建会话：{}", key);
            return new ConnectionContext(key, new MemoryCookieJar());
        });
    }

    /**
     * 将会话的默认值合并到任务中，任务显式设置的字段优先
     */
    public Task applyDefaults(Task task) {
        Session session = task.getSession();
        if (session == null || session.getDefaults() == null) {
            return task;
        }
        return session.getDefaults().mergeInto(task);
    }

    public int size() {
        return contexts.size();
    }

    /**
     * 释放所有会话
     */
    @Override
    public void close() {
        int size = contexts.size();
        contexts.values().forEach(ConnectionContext::close);
        contexts.clear();
        if (size > 0) {
            log.debug("已释放 {} 个会话", size);
        }
    }
}
