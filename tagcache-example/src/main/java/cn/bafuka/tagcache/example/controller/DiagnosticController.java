package cn.bafuka.tagcache.example.controller;

import cn.bafuka.tagcache.core.CacheManager;
import cn.bafuka.tagcache.core.CacheStats;
import cn.bafuka.tagcache.core.TaggedCache;
import cn.bafuka.tagcache.store.Store;
import cn.bafuka.tagcache.store.StoreKind;
import cn.bafuka.tagcache.store.StoreRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 诊断控制器
 * 用于查看 TagCache 的运行状态，以及手动失效标签
 */
@Slf4j
@RestController
@RequestMapping("/api/diagnostic")
public class DiagnosticController {

    @Autowired
    private CacheManager cacheManager;

    @Autowired
    private TaggedCache taggedCache;

    @Autowired
    private StoreRegistry storeRegistry;

    /**
     * 查看缓存统计
     */
    @GetMapping("/stats")
    public Map<String, Object> getStats() {
        CacheStats stats = cacheManager.getStats();

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("hits", stats.getHitCount());
        result.put("misses", stats.getMissCount());
        result.put("sets", stats.getSetCount());
        result.put("deletes", stats.getDeleteCount());
        result.put("errors", stats.getErrorCount());
        result.put("hitRate", String.format("%.2f%%", stats.hitRate() * 100));
        return result;
    }

    /**
     * 重置缓存统计
     */
    @PostMapping("/stats/reset")
    public Map<String, Object> resetStats() {
        cacheManager.resetStats();
        log.info("缓存统计已重置");

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("message", "统计已重置");
        return result;
    }

    /**
     * 查看已创建的后端
     */
    @GetMapping("/stores")
    public Map<String, Object> getStores() {
        Map<String, String> stores = new LinkedHashMap<>();
        for (Map.Entry<StoreKind, Store> entry : storeRegistry.getAll().entrySet()) {
            stores.put(entry.getKey().name(), entry.getValue().getClass().getSimpleName());
        }

        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("primary", storeRegistry.getPrimaryKind());
        result.put("keyPrefix", cacheManager.prefixedKey(""));
        result.put("defaultTtl", String.valueOf(cacheManager.getDefaultTtl()));
        result.put("stores", stores);
        return result;
    }

    /**
     * 手动失效标签，多个标签用逗号分隔
     */
    @PostMapping("/flush")
    public Map<String, Object> flush(@RequestParam String tags) {
        List<String> tagList = Arrays.asList(tags.split(","));
        Map<String, Object> result = new HashMap<>();
        try {
            boolean flushed = taggedCache.flush(tagList);
            log.info("手动失效标签: tags={}, flushed={}", tagList, flushed);
            result.put("success", flushed);
            result.put("tags", tagList);
        } catch (IllegalArgumentException e) {
            result.put("success", false);
            result.put("message", e.getMessage());
        }
        return result;
    }
}
