package cn.bafuka.tagcache.store.impl;

import cn.bafuka.tagcache.exception.TagCacheException;
import cn.bafuka.tagcache.store.CacheEntry;
import cn.bafuka.tagcache.store.Store;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 数据库表 Store
 * 表结构：(cache_key VARCHAR(512) 主键, cache_value BLOB, expires_at BIGINT)
 *
 * <p>不支持原子自增，计数器走 CacheManager 的模拟路径。
 */
@Slf4j
public class JdbcTableStore implements Store {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final RowMapper<CacheEntry> ROW_MAPPER = (rs, rowNum) ->
            new CacheEntry(rs.getBytes("cache_value"), rs.getLong("expires_at"));

    /**
     * JDBC 模板
     */
    private final JdbcTemplate jdbcTemplate;

    /**
     * 时钟
     */
    private final Clock clock;

    private final String tableName;

    private final String selectSql;

    private final String updateSql;

    private final String insertSql;

    private final String deleteSql;

    private final String deleteExpiredSql;

    private final String clearSql;

    public JdbcTableStore(JdbcTemplate jdbcTemplate, String tableName, boolean createTable, Clock clock) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw TagCacheException.configurationError("非法的缓存表名: " + tableName);
        }

        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
        this.tableName = tableName;
        this.selectSql = "SELECT cache_value, expires_at FROM " + tableName + " WHERE cache_key = ?";
        this.updateSql = "UPDATE " + tableName + " SET cache_value = ?, expires_at = ? WHERE cache_key = ?";
        this.insertSql = "INSERT INTO " + tableName + " (cache_key, cache_value, expires_at) VALUES (?, ?, ?)";
        this.deleteSql = "DELETE FROM " + tableName + " WHERE cache_key = ?";
        this.deleteExpiredSql = "DELETE FROM " + tableName + " WHERE cache_key = ? AND expires_at = ?";
        this.clearSql = "DELETE FROM " + tableName;

        if (createTable) {
            createTableIfMissing();
        }
        log.info("构建数据库表 Store，表名: {}", tableName);
    }

    @Override
    public byte[] get(String key) {
        List<CacheEntry> rows;
        try {
            rows = jdbcTemplate.query(selectSql, ROW_MAPPER, key);
        } catch (DataAccessException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }

        if (rows.isEmpty()) {
            return null;
        }

        CacheEntry entry = rows.get(0);
        if (entry.isExpired(clock.millis())) {
            try {
                // 带上过期时间作为条件，避免删除并发写入的新值
                jdbcTemplate.update(deleteExpiredSql, key, entry.getExpiresAt());
                log.debug("数据库表 Store 条目已过期: key={}", key);
            } catch (DataAccessException e) {
                log.warn("删除过期条目失败: table={}, key={}", tableName, key, e);
            }
            return null;
        }
        return entry.getValue();
    }

    @Override
    public boolean set(String key, byte[] value, Duration ttl) {
        long expiresAt = CacheEntry.expiresAt(ttl, clock);
        try {
            if (jdbcTemplate.update(updateSql, value, expiresAt, key) > 0) {
                return true;
            }
            try {
                return jdbcTemplate.update(insertSql, key, value, expiresAt) > 0;
            } catch (DuplicateKeyException e) {
                // 并发插入，改为更新
                return jdbcTemplate.update(updateSql, value, expiresAt, key) > 0;
            }
        } catch (DataAccessException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            jdbcTemplate.update(deleteSql, key);
            return true;
        } catch (DataAccessException e) {
            throw TagCacheException.backendUnavailable(getName(), key, e);
        }
    }

    @Override
    public boolean clear() {
        try {
            int removed = jdbcTemplate.update(clearSql);
            log.info("数据库表 Store 已清空: table={}, removed={}", tableName, removed);
            return true;
        } catch (DataAccessException e) {
            throw TagCacheException.backendUnavailable(getName(), null, e);
        }
    }

    @Override
    public boolean has(String key) {
        return get(key) != null;
    }

    @Override
    public String getName() {
        return "table";
    }

    private void createTableIfMissing() {
        try {
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + tableName + " ("
                    + "cache_key VARCHAR(512) NOT NULL PRIMARY KEY, "
                    + "cache_value BLOB NOT NULL, "
                    + "expires_at BIGINT NOT NULL)");
        } catch (DataAccessException e) {
            throw new TagCacheException("无法创建缓存表: " + tableName, e, null,
                    TagCacheException.FailureReason.CONFIGURATION_ERROR);
        }
    }
}
