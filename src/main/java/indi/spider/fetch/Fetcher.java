package indi.spider.fetch;

import java.io.IOException;

import indi.spider.session.ConnectionContext;
import indi.spider.task.Task;

/**
 * 下载器，执行一次HTTP交换
 *
 * <p>实现必须是线程安全的，会被多个爬虫线程同时调用
 */
public interface Fetcher {

    /**
     * @param task 已合并会话默认值、cookie等的最终任务
     * @param context 任务所属会话（或一次性）的连接上下文
     * @throws IOException 传输层面的失败，如DNS、连接、超时；请求本身不合法时抛出ClientProtocolException
     */
    FetchResult fetch(Task task, ConnectionContext context) throws IOException;

    /**
     * 中止所有正在进行的下载，用于强制结束爬虫
     */
    default void abort() {
    }
}
