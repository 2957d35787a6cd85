package indi.spider.task;

import javax.annotation.Nullable;

import indi.spider.exception.SpiderError;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一次下载的结果：得到响应，或者失败；失败时标明能否重试
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Getter
@ToString
@AllArgsConstructor
public class Outcome {
    private final Result result;
    @Nullable
    private final Response response;
    @Nullable
    private final SpiderError error;

    public enum Result {
        /** 得到了可以交给下游处理的响应 */
        SUCCESS,
        /** 失败，可以重试 */
        RETRYABLE,
        /** 失败，不再重试 */
        FAILED;
    }

    public static Outcome success(Response response) {
        return new Outcome(Result.SUCCESS, response, null);
    }

    public static Outcome failure(SpiderError error, boolean retryable) {
        return new Outcome(retryable ? Result.RETRYABLE : Result.FAILED, error.getResponse(), error);
    }

    public boolean isSuccess() {
        return result == Result.SUCCESS;
    }

    public boolean isRetryable() {
        return result == Result.RETRYABLE;
    }
}
