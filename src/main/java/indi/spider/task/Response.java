package indi.spider.task;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import javax.annotation.Nullable;

import org.apache.http.ParseException;
import org.apache.http.entity.ContentType;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.select.Elements;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import indi.spider.util.ObjectMapperUtils;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

/**
 * 下载得到的响应
 *
 * <p>响应只会被处理其任务的爬虫线程持有；attributes 供钩子向下游传递数据
 *
 * @author DragonBoom
 * @since 2026.10.19
 */
@Slf4j
@Getter
@ToString(of = { "status", "uri", "elapsed" })
public class Response {
    private final Task task;
    private final int status;
    /** 请求头名称统一为小写 */
    private final ImmutableListMultimap<String, String> headers;
    private final byte[] body;
    private final Duration elapsed;
    /** 重定向后的最终地址 */
    private final URI uri;
    private final Map<String, Object> attributes = new HashMap<>();
    private String text;
    private Document document;

    public Response(Task task, int status, ListMultimap<String, String> headers, byte[] body, Duration elapsed,
            URI uri) {
        this.task = Objects.requireNonNull(task, "task");
        this.status = status;
        ImmutableListMultimap.Builder<String, String> builder = ImmutableListMultimap.builder();
        headers.entries().forEach(e -> builder.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue()));
        this.headers = builder.build();
        this.body = body == null ? new byte[0] : body;
        this.elapsed = elapsed;
        this.uri = uri == null ? task.getUri() : uri;
    }

    /**
     * 任务的state，与任务持有同一个引用
     */
    @Nullable
    public Object getState() {
        return task.getState();
    }

    /**
     * 获取第一个同名响应头，忽略大小写
     */
    @Nullable
    public String getHeader(String name) {
        List<String> values = getHeaders(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> getHeaders(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    /**
     * 按Content-Type中的编码解析响应体，缺省为UTF-8
     */
    public String getText() {
        if (text == null) {
            text = new String(body, getCharset());
        }
        return text;
    }

    public Charset getCharset() {
        String contentType = getHeader("Content-Type");
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        try {
            Charset charset = ContentType.parse(contentType).getCharset();
            return charset == null ? StandardCharsets.UTF_8 : charset;
        } catch (ParseException | IllegalArgumentException e) {
            log.debug("无法解析Content-Type：{}，使用UTF-8", contentType);
            return StandardCharsets.UTF_8;
        }
    }

    public <T> T json(Class<T> type) throws IOException {
        return ObjectMapperUtils.getMapper().readValue(body, type);
    }

    public JsonNode json() throws IOException {
        return ObjectMapperUtils.getMapper().readTree(body);
    }

    /**
     * 将响应体解析为HTML文档，只解析一次
     */
    public Document getDocument() {
        if (document == null) {
            document = Jsoup.parse(getText(), uri.toString());
        }
        return document;
    }

    /**
     * 用CSS选择器查询文档
     */
    public Elements select(String cssQuery) {
        return getDocument().select(cssQuery);
    }

    /**
     * 以响应的最终地址为基准解析相对地址
     */
    public URI resolve(String href) {
        return uri.resolve(href);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
