package indi.spider;

import java.util.Collections;

import indi.spider.bootstrap.SpiderConfig;
import indi.spider.exception.SpiderError;
import indi.spider.hook.HookChain;
import indi.spider.hook.http.RandomUserAgentHook;
import indi.spider.task.Response;
import lombok.extern.slf4j.Slf4j;

/**
 * 爬虫，由使用者继承并实现具体的业务逻辑
 *
 * <pre>
 * public class QuotesSpider extends Spider {
 *     public Iterable&lt;?&gt; entry() {
 *         return List.of("https://quotes.toscrape.com/");
 *     }
 *
 *     public Iterable&lt;?&gt; parse(Response response) {
 *         List&lt;Object&gt; results = new ArrayList&lt;&gt;();
 *         for (Element quote : response.select(".quote .text")) {
 *             results.add(quote.text());
 *         }
 *         Element next = response.select("li.next a").first();
 *         if (next != null) {
 *             results.add(Task.of(response.resolve(next.attr("href"))));
 *         }
 *         return results;
 *     }
 * }
 *
 * SpiderJob.build(new QuotesSpider()).start();
 * </pre>
 *
 * <p>onError、parse、collect 会在多个爬虫线程上同时被调用，实现需要保证线程安全
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public abstract class Spider {

    /**
     * 入口，元素可以是Task、String或URI
     */
    public abstract Iterable<?> entry();

    /**
     * 开始运行前调用，只调用一次
     */
    public void onStart() {
    }

    /**
     * 运行结束后调用，只调用一次；即使所有任务都失败了也会调用
     */
    public void onFinish() {
    }

    /**
     * 每个终止性错误调用一次，可能被多个线程同时调用；抛出的异常只会被记录
     */
    public void onError(SpiderError error) {
        log.error(error.getMessage(), error.getCause());
    }

    /**
     * 默认的解析函数，返回的元素为Task时作为新任务，否则作为结果交给输出管道；返回null表示没有结果
     */
    public Iterable<?> parse(Response response) throws Exception {
        return Collections.singletonList(response);
    }

    /**
     * 最后一个输出管道
     */
    public void collect(Object item, Response response) throws Exception {
        log.info("{}", item);
    }

    /**
     * 注册钩子；默认注册 {@link RandomUserAgentHook}，重写时不调用super将从空的钩子链开始
     */
    public void configureHooks(HookChain.Builder hooks) {
        hooks.withBeforeDownload(new RandomUserAgentHook());
    }

    /**
     * 爬虫的配置，可被 SpiderJob#withConfig 覆盖
     */
    public SpiderConfig config() {
        return SpiderConfig.defaults();
    }
}
