package cn.bafuka.tagcache.support;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 键摘要工具
 */
public final class KeyHasher {

    private KeyHasher() {
    }

    /**
     * 计算 SHA-256 十六进制摘要
     *
     * @param input 输入
     * @return 64 位十六进制字符串
     */
    public static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            // 每个 JRE 都必须提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
