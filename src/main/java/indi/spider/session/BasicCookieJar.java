package indi.spider.session;

import java.net.HttpCookie;
import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.net.InetAddresses;

import lombok.extern.slf4j.Slf4j;

/**
 * 负责解析set-cookie字段与域名，具体的存储由子类实现
 *
 * @since 2026.10.19
 */
@Slf4j
public abstract class BasicCookieJar implements CookieJar {
    protected static final int DEFAULT_COOKIE_VERSION = 0;

    /**
     * 获取domain对应的所有cookie，实现时注意确保返回的cookie不能重复
     */
    protected abstract Collection<HttpCookie> get0(String domain);

    /**
     * 储存cookie，实现时注意cookie重复的情况
     */
    protected abstract void add0(HttpCookie cookie);

    protected abstract boolean clear0();

    /**
     * 获取该uri所需的cookie；同名cookie以域名更具体者为准
     */
    @Override
    public List<HttpCookie> get(URI uri) {
        String host = uri.getHost();
        Objects.requireNonNull(host, "uri=" + uri);
        List<String> domains = parseAllDomain(host);
        // domains从具体到宽泛排列，先放入者优先
        Map<String, HttpCookie> cookies = new LinkedHashMap<>();
        for (String domain : domains) {
            Collection<HttpCookie> tmp = get0(domain);
            if (tmp != null) {
                for (HttpCookie cookie : tmp) {
                    if (!cookie.hasExpired()) {
                        cookies.putIfAbsent(cookie.getName(), cookie);
                    }
                }
            }
        }
        return new LinkedList<>(cookies.values());
    }

    /**
     * 解析、保存服务器返回的set-cookie字段
     */
    @Override
    public void add(String setCookie, URI uri) {
        List<HttpCookie> cookies;
        try {
            cookies = HttpCookie.parse(setCookie);
        } catch (IllegalArgumentException e) {
            log.warn("无法解析set-cookie字段，已跳过：{} ({})", setCookie, e.getMessage());
            return;
        }
        String host = uri.getHost();
        for (HttpCookie cookie : cookies) {
            String domain = cookie.getDomain();
            if (Strings.isNullOrEmpty(domain) || domain.equals("null")) {
                cookie.setDomain(host);
            }
            cookie.setVersion(DEFAULT_COOKIE_VERSION);
            add0(cookie);
        }
    }

    @Override
    public void add(HttpCookie cookie) {
        Objects.requireNonNull(cookie.getDomain(), "cookie domain");
        cookie.setVersion(DEFAULT_COOKIE_VERSION);
        add0(cookie);
    }

    @Override
    public boolean clear() {
        return clear0();
    }

    /**
     * 解析域名，得到所有可能保存了对应cookie的域名，按从具体到宽泛排序<br>
     * 如 www.baidu.com 对应 “www.baidu.com”， “.www.baidu.com”， “baidu.com”， “.baidu.com”；不包含顶级域名
     */
    public static List<String> parseAllDomain(String host) {
        String lowerHost = host.toLowerCase(Locale.ROOT);
        LinkedList<String> result = new LinkedList<>();
        result.add(lowerHost);
        if (InetAddresses.isInetAddress(lowerHost)) {
            return result;
        }
        result.add("." + lowerHost);
        List<String> parts = Splitter.on('.').omitEmptyStrings().splitToList(lowerHost);
        // 至少保留两段，跳过顶级域名
        for (int i = 1; i < parts.size() - 1; i++) {
            String parent = String.join(".", parts.subList(i, parts.size()));
            result.add(parent);
            result.add("." + parent);
        }
        return result;
    }
}
