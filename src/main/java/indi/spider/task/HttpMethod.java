package indi.spider.task;

/**
 * 爬虫任务支持的HTTP方法
 */
public enum HttpMethod {
    GET, POST, PUT, PATCH, DELETE, HEAD, OPTIONS;

    /**
     * 能否携带请求实体
     */
    public boolean isEntityEnclosing() {
        return this == POST || this == PUT || this == PATCH;
    }
}
