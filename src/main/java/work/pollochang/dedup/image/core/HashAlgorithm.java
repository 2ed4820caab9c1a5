package work.pollochang.dedup.image.core;

import java.util.Locale;

/**
 * 支援的感知雜湊演算法。
 */
public enum HashAlgorithm {
    DHASH("dHash"),
    PHASH("pHash"),
    AHASH("aHash");

    private final String displayName;

    HashAlgorithm(String displayName) { this.displayName = displayName; }

    public String getDisplayName() { return displayName; }

    /**
     * 依名稱解析演算法，接受 {@code dhash}、{@code dHash}、{@code DHASH} 等寫法。
     * @param name 演算法名稱
     * @return 對應的演算法
     * @throws InvalidParameterException 名稱無法辨識時
     */
    public static HashAlgorithm fromName(String name) {
        if (name == null) {
            throw new InvalidParameterException("演算法名稱不可為空");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new InvalidParameterException("不支援的雜湊演算法: " + name);
    }
}
