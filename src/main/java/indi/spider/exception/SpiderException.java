package indi.spider.exception;

/**
 * 爬虫引擎的非受查异常，用于包装受查异常或表示引擎层面的错误
 *
 * @author DragonBoom
 */
public class SpiderException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SpiderException(String message) {
        super(message);
    }

    public SpiderException(Throwable cause) {
        super(cause);
    }

    public SpiderException(String message, Throwable cause) {
        super(message, cause);
    }
}
