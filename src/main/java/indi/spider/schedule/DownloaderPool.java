package indi.spider.schedule;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 爬虫线程池，线程名为 downloader-N
 *
 * @author DragonBoom
 */
@Slf4j
public class DownloaderPool {
    private final TaskPool taskPool;
    private final TaskPipeline pipeline;
    @Getter
    private final int size;
    private final ThreadPoolExecutor executor;
    /** 线程池中的爬虫，用于越过线程池操作爬虫 */
    private final List<Downloader> downloaders = new CopyOnWriteArrayList<>();
    private volatile boolean started;

    public DownloaderPool(TaskPool taskPool, TaskPipeline pipeline, int size) {
        this.taskPool = taskPool;
        this.pipeline = pipeline;
        this.size = size;
        executor = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat("downloader-%d").build());
    }

    /**
     * 启动所有爬虫线程；线程在任务池结束后自行退出
     */
    public synchronized void start() {
        Preconditions.checkState(!started, "Downloader pool already started");
        started = true;
        for (int i = 0; i < size; i++) {
            Downloader downloader = new Downloader(taskPool, pipeline);
            downloaders.add(downloader);
            executor.execute(downloader);
        }
        executor.shutdown();// 不再接收新的任务
        log.info("已启动爬虫线程池 [{}]", size);
    }

    /**
     * 等待所有爬虫线程结束
     */
    public void awaitTermination() throws InterruptedException {
        while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
            log.trace("active downloaders: {}", executor.getActiveCount());
        }
    }

    public void awaitTerminationUninterruptibly() {
        Uninterruptibles.awaitTerminationUninterruptibly(executor);
    }

    /**
     * 中断所有爬虫线程，放弃正在执行的任务
     */
    public void interrupt() {
        for (Downloader downloader : downloaders) {
            downloader.retire();
        }
        executor.shutdownNow();
    }

    /**
     * 关闭线程池；尚未启动时直接结束
     */
    public void shutdown() {
        executor.shutdown();
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }
}
