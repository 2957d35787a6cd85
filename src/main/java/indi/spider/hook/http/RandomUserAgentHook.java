package indi.spider.hook.http;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ThreadLocalRandom;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;

import indi.spider.Spider;
import indi.spider.exception.SpiderException;
import indi.spider.hook.BeforeDownloadHook;
import indi.spider.hook.HookResult;
import indi.spider.session.Session;
import indi.spider.task.Task;
import lombok.extern.slf4j.Slf4j;

/**
 * 随机设置User-Agent
 *
 * <p>未声明会话的任务每次下载都重新选取；属于会话的任务在整个会话中沿用第一次选取的User-Agent
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
public class RandomUserAgentHook implements BeforeDownloadHook {
    public static final String USER_AGENT = "User-Agent";
    private static final String DEFAULT_RESOURCE = "indi/spider/hook/http/useragents.txt";

    private final List<String> userAgents;
    private final ConcurrentMap<String, String> sessionUserAgents = new ConcurrentHashMap<>();

    public RandomUserAgentHook() {
        this(loadDefaultUserAgents());
    }

    public RandomUserAgentHook(List<String> userAgents) {
        Preconditions.checkArgument(!userAgents.isEmpty(), "userAgents can not be empty");
        this.userAgents = ImmutableList.copyOf(userAgents);
        log.debug("已加载 {} 个User-Agent", this.userAgents.size());
    }

    private static List<String> loadDefaultUserAgents() {
        URL resource = Resources.getResource(DEFAULT_RESOURCE);
        try {
            return Resources.readLines(resource, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .collect(ImmutableList.toImmutableList());
        } catch (IOException e) {
            throw new SpiderException("无法读取User-Agent列表：" + DEFAULT_RESOURCE, e);
        }
    }

    @Override
    public HookResult<Task> beforeDownload(Spider spider, Task task) {
        Session session = task.getSession();
        String userAgent = session == null
                ? pick()
                : sessionUserAgents.computeIfAbsent(session.getKey(), key -> pick());
        task.getHeaders().put(USER_AGENT, userAgent);
        return HookResult.keepGoing(task);
    }

    private String pick() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

    public List<String> getUserAgents() {
        return userAgents;
    }
}
