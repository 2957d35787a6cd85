package indi.spider.schedule;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.ImmutableList;

import indi.spider.exception.SpiderError;

/**
 * 爬虫运行过程中的计数
 *
 * @since 2026.10.19
 */
public class CrawlStats {
    /** 进入任务池的任务数（不含重试） */
    private final AtomicLong requests = new AtomicLong();
    /** 收到的响应数 */
    private final AtomicLong responses = new AtomicLong();
    private final AtomicLong retries = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    /** 交给collect的结果数 */
    private final AtomicLong items = new AtomicLong();
    /** 重试耗尽或无法下载的地址 */
    private final ConcurrentLinkedQueue<String> failedUrls = new ConcurrentLinkedQueue<>();

    void request() {
        requests.incrementAndGet();
    }

    void response() {
        responses.incrementAndGet();
    }

    void retry() {
        retries.incrementAndGet();
    }

    void item() {
        items.incrementAndGet();
    }

    void error(SpiderError error) {
        errors.incrementAndGet();
        if (error.getKind() == SpiderError.Kind.DOWNLOAD_ERROR) {
            failedUrls.add(error.getTask().getUri().toString());
        }
    }

    public long getRequests() {
        return requests.get();
    }

    public long getResponses() {
        return responses.get();
    }

    public long getRetries() {
        return retries.get();
    }

    public long getErrors() {
        return errors.get();
    }

    public long getItems() {
        return items.get();
    }

    public List<String> getFailedUrls() {
        return ImmutableList.copyOf(failedUrls);
    }

    @Override
    public String toString() {
        return new StringBuilder("requests=").append(requests)
                .append(", responses=").append(responses)
                .append(", retries=").append(retries)
                .append(", errors=").append(errors)
                .append(", items=").append(items)
                .toString();
    }
}
