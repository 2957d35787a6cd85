package indi.spider.schedule;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import indi.spider.Spider;
import indi.spider.bootstrap.SpiderConfig;
import indi.spider.exception.SpiderError;
import indi.spider.fetch.Fetcher;
import indi.spider.hook.HookChain;
import indi.spider.session.SessionStore;
import indi.spider.task.Task;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 调度器，中间枢纽，负责各模块的调度
 *
 * <p>一个调度器只能运行一次：{@link #run(Iterable)} 将入口任务放入任务池，启动爬虫线程，并阻塞直到所有任务都已完成或被中止。
 * onStart 与 onFinish 在运行前后各调用一次，即使所有任务都失败了，onFinish 也会被调用
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
@Getter
public class Scheduler {
    private final SpiderConfig config;
    private final Spider spider;
    private final HookChain hooks;
    private final Fetcher fetcher;
    private final TaskPool taskPool;
    private final SessionStore sessionStore;
    private final RetryPolicy retryPolicy;
    private final RateLimiter rateLimiter;
    private final CrawlStats stats;
    private final TaskPipeline pipeline;
    private final DownloaderPool downloaderPool;
    private final AtomicBoolean started = new AtomicBoolean();

    public Scheduler(SpiderConfig config, Spider spider, HookChain hooks, Fetcher fetcher) {
        this.config = config;
        this.spider = spider;
        this.hooks = hooks;
        this.fetcher = fetcher;
        this.taskPool = new BlockingQueueTaskPool();
        this.sessionStore = new SessionStore();
        this.retryPolicy = new RetryPolicy(config);
        this.rateLimiter = new RateLimiter(config);
        this.stats = new CrawlStats();
        this.pipeline = new TaskPipeline(this);
        this.downloaderPool = new DownloaderPool(taskPool, pipeline, config.getWorkers());
    }

    public void run() {
        run(Collections.emptyList());
    }

    /**
     * 开始执行爬虫任务，阻塞直到结束；入口在onStart之后从Spider#entry获取
     *
     * @param seeds 额外的入口，元素可以是Task、String或URI
     */
    public void run(Iterable<?> seeds) {
        Preconditions.checkState(started.compareAndSet(false, true), "Scheduler can only run once");
        long begin = System.currentTimeMillis();
        log.info("Spider is running...");
        try {
            spider.onStart();
            Iterable<?> entries = spider.entry();
            if (entries == null) {
                entries = Collections.emptyList();
            }
            for (Object entry : Iterables.<Object>concat(entries, seeds)) {
                Preconditions.checkArgument(entry != null, "entry can not be null");
                offer(Task.from(entry));
            }
            downloaderPool.start();
            downloaderPool.awaitTermination();
        } catch (InterruptedException e) {
            log.warn("等待爬虫结束时被中断，开始强制结束爬虫");
            taskPool.abort();
            interruptInFlight();
            downloaderPool.awaitTerminationUninterruptibly();
            Thread.currentThread().interrupt();
        } finally {
            downloaderPool.shutdown();
            sessionStore.close();
            logAtEnd(begin);
            spider.onFinish();
        }
    }

    private void logAtEnd(long begin) {
        long millis = System.currentTimeMillis() - begin;
        log.info(String.format(Locale.ROOT, "Spider exited; running time: %.2fs.", millis / 1000.0));
        log.info("## {}; use total memory {} mb", stats, Runtime.getRuntime().totalMemory() / 1024 / 1024);
        List<String> urls = stats.getFailedUrls();
        if (!urls.isEmpty()) {
            log.info("Cannot download from {} url{}:\n{}", urls.size(), urls.size() > 1 ? "s" : "",
                    String.join("\n", urls));
        }
    }

    /**
     * 强制结束爬虫：丢弃尚未执行的任务，爬虫线程不再领取任务；按配置决定是否中断正在执行的任务
     */
    public void stop() {
        int dropped = taskPool.abort();
        log.info("开始强制结束爬虫，丢弃了 {} 个尚未执行的任务", dropped);
        if (config.getAbortPolicy() == SpiderConfig.AbortPolicy.INTERRUPT_IN_FLIGHT) {
            interruptInFlight();
        }
    }

    private void interruptInFlight() {
        downloaderPool.interrupt();
        fetcher.abort();
    }

    /**
     * 添加新任务，进入任务池前补充默认请求头
     *
     * @return 任务池已中止时返回false
     */
    public boolean offer(Task task) {
        Task.Builder builder = task.toBuilder();
        config.getDefaultHeaders().forEach(builder::withDefaultHeader);
        Task prepared = builder.build();
        boolean offered = taskPool.offer(prepared);
        if (offered) {
            stats.request();
        }
        return offered;
    }

    /**
     * 向爬虫报告终止性的错误；错误处理函数抛出的异常只记录日志
     */
    public void report(SpiderError error) {
        stats.error(error);
        try {
            spider.onError(error);
        } catch (Throwable e) {
            log.error("Error in error handler!", e);
        }
    }
}
