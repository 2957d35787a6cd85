package indi.spider.schedule;

import java.net.HttpCookie;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import javax.annotation.Nullable;

import indi.spider.Spider;
import indi.spider.bootstrap.SpiderConfig;
import indi.spider.exception.SpiderError;
import indi.spider.fetch.FetchResult;
import indi.spider.fetch.Fetcher;
import indi.spider.hook.HookChain;
import indi.spider.hook.HookResult;
import indi.spider.schedule.RetryPolicy.Decision;
import indi.spider.session.ConnectionContext;
import indi.spider.session.SessionStore;
import indi.spider.task.Extractor;
import indi.spider.task.Outcome;
import indi.spider.task.Response;
import indi.spider.task.Task;
import lombok.extern.slf4j.Slf4j;

/**
 * 在爬虫线程上执行一个任务的完整流程：下载前的钩子、下载、下载后的钩子、解析、输出管道
 *
 * <p>所有失败都在这里转化为对爬虫的报告或重试，不会向爬虫线程抛出
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public class TaskPipeline {
    private final Scheduler scheduler;
    private final SpiderConfig config;
    private final Spider spider;
    private final HookChain hooks;
    private final Fetcher fetcher;
    private final SessionStore sessionStore;
    private final RateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;
    private final TaskPool taskPool;
    private final CrawlStats stats;

    public TaskPipeline(Scheduler scheduler) {
        this.scheduler = scheduler;
        this.config = scheduler.getConfig();
        this.spider = scheduler.getSpider();
        this.hooks = scheduler.getHooks();
        this.fetcher = scheduler.getFetcher();
        this.sessionStore = scheduler.getSessionStore();
        this.rateLimiter = scheduler.getRateLimiter();
        this.retryPolicy = scheduler.getRetryPolicy();
        this.taskPool = scheduler.getTaskPool();
        this.stats = scheduler.getStats();
    }

    /**
     * 执行任务
     */
    public void execute(Task task) {
        // 1. 下载前的钩子
        Task prepared = beforeDownload(task);
        if (prepared == null) {
            return;
        }
        // 2. 下载
        Outcome outcome;
        try {
            outcome = download(prepared);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("任务被中断：{}", prepared.getIdentity());
            return;
        } catch (Throwable e) {
            // 合并默认值、处理响应时的异常，不重试
            log.warn("处理下载时发生异常：{}", prepared.getIdentity(), e);
            outcome = Outcome.failure(SpiderError.downloadError(prepared, null, e), false);
        }
        switch (outcome.getResult()) {
        case RETRYABLE:
            retryOrGiveUp(prepared, outcome.getError());
            return;
        case FAILED:
            scheduler.report(outcome.getError());
            return;
        default:
        }
        // 3. 下载后的钩子
        Response response = afterDownload(outcome.getResponse());
        if (response == null) {
            return;
        }
        // 4. 解析，并处理得到的任务与结果
        extract(response);
    }

    @Nullable
    private Task beforeDownload(Task task) {
        try {
            HookResult<Task> result = hooks.beforeDownload(spider, task);
            if (result.getResult() == HookResult.Result.KEEP_GOING) {
                return result.getValue();
            }
            scheduler.report(SpiderError.requestIgnored(task, null));
        } catch (Throwable e) {
            scheduler.report(SpiderError.requestIgnored(task, e));
        }
        return null;
    }

    /**
     * 合并默认值与cookie后下载，并按重试策略对结果分类
     */
    Outcome download(Task task) throws InterruptedException {
        Task effective = resolveDefaults(task);
        ConnectionContext context = sessionStore.resolve(effective);
        try {
            effective = attachCookies(effective, context);
            rateLimiter.await(effective);

            FetchResult result;
            try {
                result = fetcher.fetch(effective, context);
            } catch (Throwable e) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("下载被中止：" + effective.getIdentity());
                }
                Decision decision = retryPolicy.classify(e);
                log.warn("下载失败({})：{} {}", decision, effective.getIdentity(), e.toString());
                return Outcome.failure(SpiderError.downloadError(task, null, e), decision == Decision.RETRY);
            }
            stats.response();
            log.info(String.format(Locale.ROOT, "\"%s %s\" %d %.2fs", effective.getMethod(), effective.getUri(),
                    result.getStatus(), result.getElapsed().toMillis() / 1000.0));

            Response response = new Response(task, result.getStatus(), result.getHeaders(), result.getBody(),
                    result.getElapsed(), result.getUri());
            storeCookies(response, context);
            if (retryPolicy.classify(result.getStatus()) == Decision.RETRY) {
                return Outcome.failure(SpiderError.downloadError(task, response, null), true);
            }
            return Outcome.success(response);
        } finally {
            if (!context.isShared()) {
                context.close();
            }
        }
    }

    /**
     * 按会话默认值、全局配置的顺序补充任务未设置的字段
     */
    private Task resolveDefaults(Task task) {
        Task merged = sessionStore.applyDefaults(task);
        Task.Builder builder = merged.toBuilder();
        if (merged.getVerifyTls() == null) {
            builder.withVerifyTls(config.isVerifyTls());
        }
        if (merged.getTimeout() == null) {
            builder.withTimeout(config.getTimeout());
        }
        if (merged.getConnectTimeout() == null && config.getConnectTimeout() != null) {
            builder.withConnectTimeout(config.getConnectTimeout());
        }
        return builder.build();
    }

    /**
     * 从cookie库中取出cookie，任务显式设置的同名cookie优先
     */
    private Task attachCookies(Task task, ConnectionContext context) {
        if (task.getUri().getHost() == null) {
            return task;
        }
        List<HttpCookie> stored = context.getCookieJar().get(task.getUri());
        if (stored.isEmpty()) {
            return task;
        }
        Map<String, String> cookies = new LinkedHashMap<>();
        for (HttpCookie cookie : stored) {
            cookies.put(cookie.getName(), cookie.getValue());
        }
        cookies.putAll(task.getCookies());
        return task.toBuilder().withCookies(cookies).build();
    }

    /**
     * 保存服务器返回的cookie
     */
    private void storeCookies(Response response, ConnectionContext context) {
        URI uri = response.getUri();
        if (uri.getHost() == null) {
            return;
        }
        for (String setCookie : response.getHeaders("Set-Cookie")) {
            context.getCookieJar().add(setCookie, uri);
        }
    }

    private void retryOrGiveUp(Task task, SpiderError error) {
        if (!retryPolicy.hasAttemptsLeft(task)) {
            log.warn("任务超过最大重试次数：{} 次，将停止工作：{}", retryPolicy.getRetryTimes(), task.getIdentity());
            scheduler.report(error);
            return;
        }
        Task next = retryPolicy.nextAttempt(task);
        stats.retry();
        log.info("重试任务(第 {} / {} 次)：{}", next.getAttempt() - 1, retryPolicy.getRetryTimes(), next.getUri());
        // 不占用爬虫线程，放到任务池的延时队列中等待
        if (!taskPool.deferral(next, retryPolicy.getRetryDelay())) {
            log.info("任务池已中止，放弃重试：{}", next.getIdentity());
        }
    }

    @Nullable
    private Response afterDownload(Response response) {
        try {
            HookResult<Response> result = hooks.afterDownload(spider, response);
            switch (result.getResult()) {
            case KEEP_GOING:
                return result.getValue();
            case RESCHEDULE:
                offerChild(response, result.getTask());
                scheduler.report(SpiderError.responseIgnored(response, null));
                return null;
            default:
                scheduler.report(SpiderError.responseIgnored(response, null));
                return null;
            }
        } catch (Throwable e) {
            scheduler.report(SpiderError.responseIgnored(response, e));
            return null;
        }
    }

    /**
     * 执行解析函数：任务的解析函数优先，否则使用Spider#parse；逐个处理解析得到的任务与结果
     */
    private void extract(Response response) {
        Extractor extractor = response.getTask().getExtractor();
        try {
            Iterable<?> results = extractor == null ? spider.parse(response) : extractor.extract(response);
            if (results == null) {
                return;
            }
            for (Object result : results) {
                if (result == null) {
                    continue;
                }
                if (result instanceof Task) {
                    offerChild(response, (Task) result);
                } else {
                    collect(result, response);
                }
            }
        } catch (Throwable e) {
            scheduler.report(SpiderError.parseError(response, e));
        }
    }

    /**
     * 子任务与重新调度的任务的相对地址以响应的最终地址为基准；未声明会话的任务沿用父任务的会话
     */
    private void offerChild(Response response, Task child) {
        Task parent = response.getTask();
        boolean relative = !child.getUri().isAbsolute();
        boolean inherit = child.getSession() == null && child.isInheritSession() && parent.getSession() != null;
        if (!relative && !inherit) {
            scheduler.offer(child);
            return;
        }
        Task.Builder builder = child.toBuilder();
        if (relative) {
            builder.withUri(response.getUri().resolve(child.getUri()));
        }
        if (inherit) {
            builder.withSession(parent.getSession());
        }
        scheduler.offer(builder.build());
    }

    /**
     * 依次执行输出管道，最后交给Spider#collect；异常只影响当前结果
     */
    private void collect(Object item, Response response) {
        try {
            Object piped = hooks.pipe(spider, item, response);
            if (piped == null) {
                return;
            }
            spider.collect(piped, response);
            stats.item();
        } catch (Throwable e) {
            scheduler.report(SpiderError.pipeError(response, e));
        }
    }
}
