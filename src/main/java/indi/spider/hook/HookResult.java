package indi.spider.hook;

import java.util.Objects;

import javax.annotation.Nullable;

import indi.spider.task.Task;
import lombok.Getter;
import lombok.ToString;

/**
 * 钩子的返回值
 *
 * @param <T> 钩子处理的对象类型：下载前为Task，下载后为Response
 * @author DragonBoom
 * @since 2026.10.19
 */
@Getter
@ToString
public final class HookResult<T> {
    private final Result result;
    @Nullable
    private final T value;
    /** 仅RESCHEDULE时有值 */
    @Nullable
    private final Task task;

    public enum Result {
        /** 继续执行之后的钩子 */
        KEEP_GOING,
        /** 放弃当前的任务或响应 */
        DROP,
        /** 放弃当前响应，并将给定任务作为新任务加入任务池；只适用于下载后的钩子 */
        RESCHEDULE;
    }

    private HookResult(Result result, @Nullable T value, @Nullable Task task) {
        this.result = result;
        this.value = value;
        this.task = task;
    }

    public static <T> HookResult<T> keepGoing(T value) {
        return new HookResult<>(Result.KEEP_GOING, Objects.requireNonNull(value, "value"), null);
    }

    public static <T> HookResult<T> drop() {
        return new HookResult<>(Result.DROP, null, null);
    }

    public static <T> HookResult<T> reschedule(Task task) {
        return new HookResult<>(Result.RESCHEDULE, null, Objects.requireNonNull(task, "task"));
    }
}
