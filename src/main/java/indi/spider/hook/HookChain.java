package indi.spider.hook;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import indi.spider.Spider;
import indi.spider.task.Response;
import indi.spider.task.Task;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * 钩子链，包含下载前、下载后与输出三条相互独立的链，各自按注册顺序执行
 *
 * <p>构建后不可变，可以被多个爬虫线程同时使用；钩子自身的线程安全由钩子负责
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
@Getter
@ToString
public class HookChain {
    private final List<BeforeDownloadHook> beforeDownloadHooks;
    private final List<AfterDownloadHook> afterDownloadHooks;
    private final List<Pipe> pipes;

    private HookChain(Builder builder) {
        this.beforeDownloadHooks = builder.beforeDownloadHooks.build();
        this.afterDownloadHooks = builder.afterDownloadHooks.build();
        this.pipes = builder.pipes.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 依次执行下载前的钩子
     *
     * @return 最终的任务（KEEP_GOING）或DROP；钩子抛出的异常直接向上抛出
     */
    public HookResult<Task> beforeDownload(Spider spider, Task task) throws Exception {
        Task current = task;
        for (BeforeDownloadHook hook : beforeDownloadHooks) {
            HookResult<Task> result = hook.beforeDownload(spider, current);
            if (result == null || result.getResult() == HookResult.Result.DROP) {
                log.debug("任务被钩子 {} 放弃：{}", hook, current.getIdentity());
                return HookResult.drop();
            }
            if (result.getResult() == HookResult.Result.RESCHEDULE) {
                throw new IllegalStateException("下载前的钩子不支持重新调度：" + hook);
            }
            current = result.getValue();
        }
        return HookResult.keepGoing(current);
    }

    /**
     * 依次执行下载后的钩子；遇到DROP或RESCHEDULE时立即返回
     */
    public HookResult<Response> afterDownload(Spider spider, Response response) throws Exception {
        Response current = response;
        for (AfterDownloadHook hook : afterDownloadHooks) {
            HookResult<Response> result = hook.afterDownload(spider, current);
            if (result == null || result.getResult() == HookResult.Result.DROP) {
                log.debug("响应被钩子 {} 放弃：{}", hook, current.getTask().getIdentity());
                return HookResult.drop();
            }
            if (result.getResult() == HookResult.Result.RESCHEDULE) {
                return result;
            }
            current = result.getValue();
        }
        return HookResult.keepGoing(current);
    }

    /**
     * 依次执行输出管道
     *
     * @return 最后一个管道的输出；为null表示结果被某个管道丢弃
     */
    @Nullable
    public Object pipe(Spider spider, Object item, Response response) throws Exception {
        Object current = item;
        for (Pipe pipe : pipes) {
            current = pipe.pipe(spider, current, response);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    public static class Builder {
        private final ImmutableList.Builder<BeforeDownloadHook> beforeDownloadHooks = ImmutableList.builder();
        private final ImmutableList.Builder<AfterDownloadHook> afterDownloadHooks = ImmutableList.builder();
        private final ImmutableList.Builder<Pipe> pipes = ImmutableList.builder();

        private Builder() {
        }

        public Builder withBeforeDownload(BeforeDownloadHook hook) {
            beforeDownloadHooks.add(hook);
            return this;
        }

        public Builder withAfterDownload(AfterDownloadHook hook) {
            afterDownloadHooks.add(hook);
            return this;
        }

        /**
         * 同时注册为下载前与下载后的钩子
         */
        public <H extends BeforeDownloadHook & AfterDownloadHook> Builder withHook(H hook) {
            beforeDownloadHooks.add(hook);
            afterDownloadHooks.add(hook);
            return this;
        }

        public Builder withPipe(Pipe pipe) {
            pipes.add(pipe);
            return this;
        }

        public HookChain build() {
            return new HookChain(this);
        }
    }
}
