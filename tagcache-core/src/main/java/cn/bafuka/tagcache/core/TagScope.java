package cn.bafuka.tagcache.core;

import java.lang.reflect.Type;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * 绑定了一组标签的缓存视图
 *
 * <pre>
 * taggedCache.tags("users", "user:42").set("profile", user, Duration.ofMinutes(10));
 * taggedCache.tags("users").flush();
 * </pre>
 */
public class TagScope {

    private final TaggedCache taggedCache;

    private final List<String> tags;

    public TagScope(TaggedCache taggedCache, Collection<String> tags) {
        this.taggedCache = taggedCache;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
    }

    public <T> T get(String key, Type type) {
        return taggedCache.get(tags, key, type);
    }

    public boolean set(String key, Object value) {
        return taggedCache.set(tags, key, value, null);
    }

    public boolean set(String key, Object value, Duration ttl) {
        return taggedCache.set(tags, key, value, ttl);
    }

    public boolean delete(String key) {
        return taggedCache.delete(tags, key);
    }

    public <T> T remember(String key, Duration ttl, Type type, Supplier<T> producer) {
        return taggedCache.remember(tags, key, ttl, type, producer);
    }

    public <T> T rememberWithLock(String key, Duration ttl, Type type, Supplier<T> producer) {
        return taggedCache.rememberWithLock(tags, key, ttl, type, producer);
    }

    public boolean flush() {
        return taggedCache.flush(tags);
    }

    public List<String> getTags() {
        return tags;
    }
}
