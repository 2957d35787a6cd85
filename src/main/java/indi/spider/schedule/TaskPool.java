package indi.spider.schedule;

import java.time.Duration;

import javax.annotation.Nullable;

import indi.spider.task.Task;

/**
 * 任务池，负责任务的存放、出租与结束判断
 *
 * <p>需要保证<b>任务最多只存在于可用队列、出租集合及延时队列的其中一个</b>
 *
 * @author DragonBoom
 */
public interface TaskPool {

    /**
     * 添加可以立即执行的任务
     *
     * @return 任务池已被中止时返回false
     */
    boolean offer(Task task);

    /**
     * 添加延期执行的任务，用于重试
     *
     * @return 任务池已被中止时返回false
     */
    boolean deferral(Task task, Duration delay);

    /**
     * 出租一个任务，没有可用任务但仍有任务在执行或等待时阻塞
     *
     * @return 所有任务都已完成或任务池被中止时返回null
     */
    @Nullable
    Task poll() throws InterruptedException;

    /**
     * 归还出租的任务，无论任务执行的结果如何都必须调用
     */
    void complete(Task task);

    /**
     * 中止任务池，丢弃所有尚未执行的任务
     *
     * @return 被丢弃的任务数
     */
    int abort();

    boolean isAborted();

    int getLeasedSize();

    int getAvailableSize();

    int getDeferralSize();
}
