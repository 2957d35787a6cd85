package indi.spider.hook;

import indi.spider.Spider;
import indi.spider.task.Task;

/**
 * 下载前的钩子，可以修改或替换任务，或者放弃任务
 */
@FunctionalInterface
public interface BeforeDownloadHook {

    /**
     * @return {@link HookResult#keepGoing(Object)} 携带（可能被替换的）任务；{@link HookResult#drop()} 或null表示放弃
     */
    HookResult<Task> beforeDownload(Spider spider, Task task) throws Exception;
}
