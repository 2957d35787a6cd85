package indi.spider.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * 共用的ObjectMapper，配置完成后线程安全
 */
public class ObjectMapperUtils {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ObjectMapperUtils() {
    }

    public static ObjectMapper getMapper() {
        return MAPPER;
    }
}
