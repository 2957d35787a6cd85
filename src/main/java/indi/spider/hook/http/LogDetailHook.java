package indi.spider.hook.http;

import java.util.Map;

import indi.spider.Spider;
import indi.spider.hook.AfterDownloadHook;
import indi.spider.hook.BeforeDownloadHook;
import indi.spider.hook.HookResult;
import indi.spider.task.Response;
import indi.spider.task.Task;
import lombok.extern.slf4j.Slf4j;

/**
 * 详细日志钩子，记录发出的请求头与收到的响应头
 *
 * @author DragonBoom
 */
@Slf4j
public class LogDetailHook implements BeforeDownloadHook, AfterDownloadHook {

    /**
     * 将请求头转化为字符串
     */
    private String stringifyHeaders(Iterable<? extends Map.Entry<String, String>> headers) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> h : headers) {
            sb.append("[").append(h.getKey()).append("=").append(h.getValue()).append("] ");
        }
        return sb.toString();
    }

    @Override
    public HookResult<Task> beforeDownload(Spider spider, Task task) {
        String message = new StringBuilder("->>> Send HTTP Request-> ")
                .append(task.getMethod().name()).append(" ")
                .append(task.getUri())
                .append(" [").append(stringifyHeaders(task.getHeaders().entrySet())).append("]")
                .toString();
        log.info(message);
        return HookResult.keepGoing(task);
    }

    @Override
    public HookResult<Response> afterDownload(Spider spider, Response response) {
        String message = new StringBuilder("-<<<  Receive Response-> ")
                .append(response.getUri()).append("  ")
                .append(response.getStatus())
                .append(" [").append(stringifyHeaders(response.getHeaders().entries())).append("]")
                .toString();
        log.info(message);
        return HookResult.keepGoing(response);
    }
}
