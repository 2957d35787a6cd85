package indi.spider.schedule;

import indi.spider.task.Task;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 爬虫线程的工作内容：从任务池领取任务并执行，直到任务池结束
 *
 * <p>为了配合线程池使用，不继承Thread。实际执行任务的线程由 {@link DownloaderPool} 创建
 *
 * @author DragonBoom
 */
@Slf4j
public class Downloader implements Runnable {
    private final TaskPool taskPool;
    private final TaskPipeline pipeline;
    @Getter
    private volatile boolean retire;
    private volatile Task currentTask;
    /** 工作次数 */
    @Getter
    private int workTimes;

    public Downloader(TaskPool taskPool, TaskPipeline pipeline) {
        this.taskPool = taskPool;
        this.pipeline = pipeline;
    }

    @Override
    public void run() {
        while (!retire) {
            Task task;
            try {
                task = taskPool.poll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("爬虫线程在领取任务时被中断");
                break;
            }
            // 任务池已结束
            if (task == null) {
                break;
            }
            currentTask = task;
            try {
                pipeline.execute(task);
                workTimes++;
            } catch (Throwable e) {
                // 不应执行到这里，记录后继续领取其他任务
                log.error("执行任务时发生了未处理的异常：{}", task.getIdentity(), e);
            } finally {
                currentTask = null;
                taskPool.complete(task);
            }
        }
        log.debug("爬虫线程结束，共执行了 {} 个任务", workTimes);
    }

    public void retire() {
        retire = true;
    }

    public boolean isWorking() {
        return currentTask != null;
    }
}
