package cn.bafuka.tagcache.exception;

/**
 * TagCache 异常
 * Store 访问失败、缓存数据损坏或配置错误时抛出
 *
 * @author TagCache Team
 * @since 1.0
 */
public class TagCacheException extends RuntimeException {

    /**
     * 相关的缓存键（可能为空）
     */
    private final String key;

    /**
     * 失败原因
     */
    private final FailureReason reason;

    public TagCacheException(String message, String key, FailureReason reason) {
        super(message);
        this.key = key;
        this.reason = reason;
    }

    public TagCacheException(String message, Throwable cause, String key, FailureReason reason) {
        super(message, cause);
        this.key = key;
        this.reason = reason;
    }

    public static TagCacheException backendUnavailable(String store, String key, Throwable cause) {
        return new TagCacheException(
                String.format("Store unavailable: store=%s, key=%s", store, key),
                cause, key, FailureReason.BACKEND_UNAVAILABLE);
    }

    public static TagCacheException corruptEntry(String key, Throwable cause) {
        return new TagCacheException(
                String.format("Corrupt cache entry: key=%s", key),
                cause, key, FailureReason.CORRUPT_ENTRY);
    }

    public static TagCacheException configurationError(String message) {
        return new TagCacheException(message, null, FailureReason.CONFIGURATION_ERROR);
    }

    public String getKey() {
        return key;
    }

    public FailureReason getReason() {
        return reason;
    }

    /**
     * 失败原因枚举
     */
    public enum FailureReason {
        /**
         * 后端存储不可用（I/O 错误、连接失败）
         */
        BACKEND_UNAVAILABLE("后端存储不可用"),

        /**
         * 缓存数据无法反序列化
         */
        CORRUPT_ENTRY("缓存数据损坏"),

        /**
         * 启动时的配置错误
         */
        CONFIGURATION_ERROR("配置错误"),

        /**
         * 被拦截方法回源失败
         */
        LOAD_FAILURE("回源加载失败");

        private final String description;

        FailureReason(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    @Override
    public String toString() {
        return "TagCacheException{" +
                "key=" + key +
                ", reason=" + reason +
                ", message=" + getMessage() +
                '}';
    }
}
