package indi.spider.session;

import java.net.HttpCookie;
import java.net.URI;
import java.util.List;

/**
 * Cookie存取库
 *
 * @since 2026.10.19
 */
public interface CookieJar {

    /**
     * 获取该uri可用的所有cookie
     */
    List<HttpCookie> get(URI uri);

    /**
     * 解析并保存服务器返回的set-cookie字段
     */
    void add(String setCookie, URI uri);

    void add(HttpCookie cookie);

    List<HttpCookie> getCookies();

    boolean clear();
}
