package indi.spider.hook;

import indi.spider.Spider;
import indi.spider.task.Response;

/**
 * 输出管道，依次处理解析得到的结果
 */
@FunctionalInterface
public interface Pipe {

    /**
     * @param item 上一个管道的输出
     * @param response 产生该结果的响应
     * @return 交给下一个管道的结果；返回null将丢弃该结果
     */
    Object pipe(Spider spider, Object item, Response response) throws Exception;
}
