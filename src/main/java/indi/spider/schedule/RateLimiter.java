package indi.spider.schedule;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

import indi.spider.bootstrap.SpiderConfig;
import indi.spider.task.Task;
import lombok.extern.slf4j.Slf4j;

/**
 * 下载限速，在每次下载前于爬虫线程上等待
 *
 * <p>各爬虫线程分别等待，不会相互阻塞
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public class RateLimiter {
    private final long delayNanos;
    private final boolean random;
    private final double low;
    private final double high;

    public RateLimiter(SpiderConfig config) {
        this(config.getDownloadDelay(), config.isRandomDownloadDelay(), config.getRandomDelayLow(),
                config.getRandomDelayHigh());
    }

    public RateLimiter(Duration delay, boolean random, double low, double high) {
        this.delayNanos = delay.toNanos();
        this.random = random;
        this.low = low;
        this.high = high;
    }

    /**
     * 计算下一次下载前需要等待的时间
     */
    public Duration nextDelay() {
        if (delayNanos <= 0) {
            return Duration.ZERO;
        }
        if (!random || low == high) {
            return Duration.ofNanos((long) (delayNanos * (random ? low : 1)));
        }
        double scale = ThreadLocalRandom.current().nextDouble(low, high);
        return Duration.ofNanos((long) (delayNanos * scale));
    }

    /**
     * 在当前线程上等待，可被中断
     */
    public void await(Task task) throws InterruptedException {
        Duration delay = nextDelay();
        if (delay.isZero()) {
            return;
        }
        log.debug("等待 {} ms 后下载：{}", delay.toMillis(), task.getIdentity());
        TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    }
}
