package indi.spider.task;

/**
 * 解析响应的函数，返回新的爬虫任务（{@link Task}）或待收集的结果
 *
 * <p>返回值会被逐个、立即消费；返回null视为没有结果
 *
 * @since 2026.10.19
 */
@FunctionalInterface
public interface Extractor {

    Iterable<?> extract(Response response) throws Exception;
}
