package indi.spider.bootstrap;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import indi.spider.Spider;
import indi.spider.fetch.Fetcher;
import indi.spider.fetch.HttpClientFetcher;
import indi.spider.hook.HookChain;
import indi.spider.hook.http.LogDetailHook;
import indi.spider.schedule.Scheduler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 爬虫项目启动类
 *
 * <pre>
 * SpiderJob.build(new QuotesSpider())
 *         .withConfig(SpiderConfig.builder().withWorkers(4).build())
 *         .start();
 * </pre>
 *
 * @author DragonBoom
 */
@Slf4j
public class SpiderJob {
    @Getter
    private final Spider spider;
    private SpiderConfig config;
    /** 为空时使用默认的HttpClientFetcher，并在结束时关闭 */
    private Fetcher fetcher;
    private boolean detailLog;
    /** 启动前手动添加的入口 */
    private final List<Object> seeds = new LinkedList<>();
    private final AtomicBoolean started = new AtomicBoolean();
    private volatile boolean stopRequested;
    @Getter
    private volatile Scheduler scheduler;

    private SpiderJob(Spider spider) {
        this.spider = Objects.requireNonNull(spider, "spider");
    }

    public static SpiderJob build(Spider spider) {
        return new SpiderJob(spider);
    }

    /**
     * 使用给定的配置，而不是Spider#config
     */
    public SpiderJob withConfig(SpiderConfig config) {
        this.config = config;
        return this;
    }

    public SpiderJob withFetcher(Fetcher fetcher) {
        this.fetcher = fetcher;
        return this;
    }

    /**
     * 在爬虫注册的钩子之后添加详细日志钩子，记录请求头与响应头
     */
    public SpiderJob withDetailLog() {
        this.detailLog = true;
        return this;
    }

    /**
     * 添加入口，与Spider#entry一同放入任务池
     */
    public SpiderJob withSeed(Object seed) {
        seeds.add(Objects.requireNonNull(seed, "seed"));
        return this;
    }

    /**
     * 开始执行爬虫，阻塞直到结束；不能重复执行，会抛异常
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Job Already Started !");
        }
        HookChain.Builder hooks = HookChain.builder();
        spider.configureHooks(hooks);
        if (detailLog) {
            hooks.withHook(new LogDetailHook());
        }
        SpiderConfig actualConfig = config != null ? config : spider.config();
        boolean ownFetcher = fetcher == null;
        Fetcher actualFetcher = ownFetcher ? new HttpClientFetcher() : fetcher;
        try {
            scheduler = new Scheduler(actualConfig, spider, hooks.build(), actualFetcher);
            if (stopRequested) {
                scheduler.stop();
            }
            scheduler.run(seeds);
        } finally {
            if (ownFetcher) {
                closeQuietly((Closeable) actualFetcher);
            }
        }
    }

    private void closeQuietly(Closeable closeable) {
        try {
            closeable.close();
        } catch (IOException e) {
            log.warn("关闭下载器失败", e);
        }
    }

    /**
     * 强制结束爬虫；可以在其他线程或回调中调用
     */
    public void stop() {
        stopRequested = true;
        Scheduler current = scheduler;
        if (current != null) {
            current.stop();
        }
    }
}
