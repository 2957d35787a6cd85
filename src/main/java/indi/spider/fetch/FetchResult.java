package indi.spider.fetch;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

import com.google.common.collect.ListMultimap;

import lombok.Getter;
import lombok.ToString;

/**
 * 一次HTTP交换的原始结果
 */
@Getter
@ToString(exclude = "body")
public class FetchResult {
    private final int status;
    private final ListMultimap<String, String> headers;
    private final byte[] body;
    private final Duration elapsed;
    /** 重定向后的最终地址 */
    private final URI uri;

    public FetchResult(int status, ListMultimap<String, String> headers, byte[] body, Duration elapsed, URI uri) {
        this.status = status;
        this.headers = Objects.requireNonNull(headers, "headers");
        this.body = Objects.requireNonNull(body, "body");
        this.elapsed = Objects.requireNonNull(elapsed, "elapsed");
        this.uri = Objects.requireNonNull(uri, "uri");
    }
}
