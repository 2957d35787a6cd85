package indi.spider.exception;

import java.net.URI;

import javax.annotation.Nullable;

import indi.spider.task.Response;
import indi.spider.task.Task;
import lombok.Getter;
import lombok.ToString;

/**
 * 报告给爬虫的终止性错误。只携带数据，不会被抛出
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Getter
@ToString(of = { "kind", "message" })
public final class SpiderError {
    private final Kind kind;
    private final String message;
    @Nullable
    private final Throwable cause;
    private final Task task;
    @Nullable
    private final Response response;

    public enum Kind {
        /** 被下载前的钩子拦截，或钩子抛出了异常 */
        REQUEST_IGNORED("Request was ignored for %s"),
        /** 被下载后的钩子拦截、重新调度，或钩子抛出了异常 */
        RESPONSE_IGNORED("Response was ignored for %s"),
        /** 重试次数耗尽，或遇到不可重试的异常 */
        DOWNLOAD_ERROR("Cannot download from %s"),
        /** 解析函数抛出了异常 */
        PARSE_ERROR("Error occurred when parsing response from %s"),
        /** 管道或collect抛出了异常 */
        PIPE_ERROR("Error occurred when collecting results from %s");

        private final String template;

        Kind(String template) {
            this.template = template;
        }

        public String format(URI uri) {
            return String.format(template, uri);
        }
    }

    private SpiderError(Kind kind, URI uri, @Nullable Throwable cause, Task task, @Nullable Response response) {
        this.kind = kind;
        this.message = kind.format(uri);
        this.cause = cause;
        this.task = task;
        this.response = response;
    }

    public static SpiderError requestIgnored(Task task, @Nullable Throwable cause) {
        return new SpiderError(Kind.REQUEST_IGNORED, task.getUri(), cause, task, null);
    }

    public static SpiderError responseIgnored(Response response, @Nullable Throwable cause) {
        return new SpiderError(Kind.RESPONSE_IGNORED, response.getUri(), cause, response.getTask(), response);
    }

    public static SpiderError downloadError(Task task, @Nullable Response response, @Nullable Throwable cause) {
        URI uri = response == null ? task.getUri() : response.getUri();
        return new SpiderError(Kind.DOWNLOAD_ERROR, uri, cause, task, response);
    }

    public static SpiderError parseError(Response response, Throwable cause) {
        return new SpiderError(Kind.PARSE_ERROR, response.getUri(), cause, response.getTask(), response);
    }

    public static SpiderError pipeError(Response response, Throwable cause) {
        return new SpiderError(Kind.PIPE_ERROR, response.getUri(), cause, response.getTask(), response);
    }
}
