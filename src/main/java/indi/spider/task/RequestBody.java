package indi.spider.task;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;

import lombok.Getter;
import lombok.ToString;

/**
 * 请求实体，三选一：表单、JSON、multipart
 *
 * <p>本类只描述实体内容，具体的编码方式由Fetcher决定
 *
 * @since 2026.10.19
 */
@Getter
@ToString
public final class RequestBody {

    public enum Type {
        FORM, JSON, MULTIPART
    }

    private final Type type;
    /** 表单字段或multipart分段；JSON实体时为空 */
    private final Map<String, Object> fields;
    /** JSON实体，将被序列化后发送 */
    private final Object json;

    private RequestBody(Type type, Map<String, Object> fields, Object json) {
        this.type = type;
        this.fields = fields;
        this.json = json;
    }

    public static RequestBody form(Map<String, String> fields) {
        Objects.requireNonNull(fields, "fields");
        return new RequestBody(Type.FORM, ImmutableMap.<String, Object>copyOf(fields), null);
    }

    public static RequestBody json(Object json) {
        Objects.requireNonNull(json, "json");
        return new RequestBody(Type.JSON, ImmutableMap.of(), json);
    }

    /**
     *
     * @param parts 值可以是String、byte[]、File或InputStream
     */
    public static RequestBody multipart(Map<String, ?> parts) {
        Objects.requireNonNull(parts, "parts");
        // 保留插入顺序，且允许值为任意类型
        return new RequestBody(Type.MULTIPART, Collections.unmodifiableMap(new LinkedHashMap<String, Object>(parts)), null);
    }
}
