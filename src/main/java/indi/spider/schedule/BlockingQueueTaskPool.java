package indi.spider.schedule;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import indi.spider.task.Task;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于内存的阻塞队列的任务池
 *
 * <p>可用队列、延时队列与出租计数由同一把锁保护，是否结束也在这把锁内判断：当且仅当可用队列为空、没有延期任务、
 * 也没有出租中的任务时，任务池结束，所有等待的线程都会被唤醒并得到null
 *
 * <p>延期任务不再需要单独的线程定时唤醒：poll时按最近的唤醒时间限时等待，到期后移入可用队列
 *
 * @author DragonBoom
 */
@Slf4j
public class BlockingQueueTaskPool implements TaskPool {
    private final ReentrantLock lock = new ReentrantLock();
    /** 可用队列、延时队列或出租计数变化时通知 */
    private final Condition changed = lock.newCondition();
    /**
     * 就绪队列，该队列中的任务随时可以取出进行处理
     */
    private final ArrayDeque<Task> availables = new ArrayDeque<>();
    /**
     * 等待队列，按唤醒时间进行排序
     */
    private final PriorityQueue<Deferral> deferrals = new PriorityQueue<>(
            Comparator.comparingLong((Deferral d) -> d.wakeUpNanos).thenComparingLong(d -> d.sequence));
    /** 已出租的任务数 */
    private int leased;
    private long sequence;
    private volatile boolean aborted;
    private boolean terminated;

    @AllArgsConstructor
    private static class Deferral {
        private final Task task;
        private final long wakeUpNanos;
        private final long sequence;
    }

    public BlockingQueueTaskPool() {
        log.debug("使用本地内存的阻塞队列任务池");
    }

    @Override
    public boolean offer(Task task) {
        Objects.requireNonNull(task);
        lock.lock();
        try {
            if (aborted) {
                log.debug("任务池已中止，忽略任务：{}", task.getIdentity());
                return false;
            }
            availables.offer(task);
            changed.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean deferral(Task task, Duration delay) {
        Objects.requireNonNull(task);
        lock.lock();
        try {
            if (aborted) {
                log.debug("任务池已中止，忽略延期任务：{}", task.getIdentity());
                return false;
            }
            deferrals.offer(new Deferral(task, System.nanoTime() + delay.toNanos(), sequence++));
            // 等待中的线程需要按新的唤醒时间重新计算等待时长
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Task poll() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (aborted || terminated) {
                    return null;
                }
                long now = System.nanoTime();
                // 将到期的延期任务移入可用队列
                while (!deferrals.isEmpty() && deferrals.peek().wakeUpNanos - now <= 0) {
                    availables.offer(deferrals.poll().task);
                }
                Task task = availables.poll();
                if (task != null) {
                    leased++;
                    return task;
                }
                if (leased == 0 && deferrals.isEmpty()) {
                    terminated = true;
                    log.debug("所有任务都已完成");
                    changed.signalAll();
                    return null;
                }
                if (deferrals.isEmpty()) {
                    changed.await();
                } else {
                    changed.awaitNanos(deferrals.peek().wakeUpNanos - now);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete(Task task) {
        lock.lock();
        try {
            if (leased <= 0) {
                throw new IllegalStateException("归还了未出租的任务：" + task.getIdentity());
            }
            leased--;
            if (leased == 0) {
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int abort() {
        lock.lock();
        try {
            aborted = true;
            int dropped = availables.size() + deferrals.size();
            availables.forEach(task -> log.info("丢弃任务：{}", task.getIdentity()));
            deferrals.forEach(d -> log.info("丢弃延期任务：{}", d.task.getIdentity()));
            availables.clear();
            deferrals.clear();
            changed.signalAll();
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isAborted() {
        return aborted;
    }

    /**
     * 是否已经判定所有任务都已完成
     */
    public boolean isTerminated() {
        lock.lock();
        try {
            return terminated;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getLeasedSize() {
        lock.lock();
        try {
            return leased;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getAvailableSize() {
        lock.lock();
        try {
            return availables.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getDeferralSize() {
        lock.lock();
        try {
            return deferrals.size();
        } finally {
            lock.unlock();
        }
    }
}
