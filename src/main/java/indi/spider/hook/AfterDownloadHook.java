package indi.spider.hook;

import indi.spider.Spider;
import indi.spider.task.Response;

/**
 * 下载后的钩子，可以修改或替换响应、放弃响应，或者重新调度一个任务
 */
@FunctionalInterface
public interface AfterDownloadHook {

    HookResult<Response> afterDownload(Spider spider, Response response) throws Exception;
}
