package indi.spider.session;

import java.net.HttpCookie;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.Table;

/**
 * 基于内存的cookie库，会话结束时随之丢弃
 */
public class MemoryCookieJar extends BasicCookieJar {
    /**
     * Table<\Domain(String), CookieName(String), HttpCookie>。
     *
     * 用Table而不是Multimap是为了解决cookie的Key重复的问题
     */
    private final Table<String, String, HttpCookie> store = HashBasedTable.create();

    /**
     * 返回副本，避免调用者遍历时与写入冲突
     */
    @Override
    protected synchronized Collection<HttpCookie> get0(String domain) {
        return new ArrayList<>(store.row(domain).values());
    }

    /**
     * 简单用synchronized处理并发问题；已过期的cookie视为删除
     */
    @Override
    protected synchronized void add0(HttpCookie cookie) {
        String domain = cookie.getDomain();
        if (cookie.hasExpired()) {
            store.remove(domain, cookie.getName());
            return;
        }
        store.put(domain, cookie.getName(), cookie);
    }

    @Override
    public synchronized List<HttpCookie> getCookies() {
        return new ArrayList<>(store.values());
    }

    @Override
    protected synchronized boolean clear0() {
        boolean changed = !store.isEmpty();
        store.clear();
        return changed;
    }
}
