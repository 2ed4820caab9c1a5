package work.pollochang.dedup.image.signature;

import work.pollochang.dedup.image.core.HashValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 一張圖片在所有設定組合下的簽章。
 *
 * <p>每個設定組合要嘛有雜湊值，要嘛在 {@link #failures()} 中留有失敗原因，不會無聲缺漏。
 * 建立後不可變，可在多個比對執行緒間共用。</p>
 */
public final class SignatureBundle {

    private static final SignatureBundle EMPTY_FAILED = new SignatureBundle(Map.of(), Map.of(), false, true);

    private final Map<SignatureKey, HashValue> entries;
    private final Map<SignatureKey, String> failures;
    private final boolean uniformColor;
    private final boolean failed;

    private SignatureBundle(Map<SignatureKey, HashValue> entries, Map<SignatureKey, String> failures,
                            boolean uniformColor, boolean failed) {
        this.entries = entries;
        this.failures = failures;
        this.uniformColor = uniformColor;
        this.failed = failed;
    }

    /**
     * @return 整張圖片都無法產生簽章時使用的空簽章
     */
    public static SignatureBundle failed() {
        return EMPTY_FAILED;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return 指定組合的雜湊值，沒有時為 {@code null}
     */
    public HashValue get(SignatureKey key) {
        return entries.get(key);
    }

    public Map<SignatureKey, HashValue> entries() {
        return entries;
    }

    public Map<SignatureKey, String> failures() {
        return failures;
    }

    public int entryCount() {
        return entries.size();
    }

    public boolean isUniformColor() {
        return uniformColor;
    }

    /**
     * @return 是否整張圖片都失敗 (解碼失敗等)，此時不參與比對
     */
    public boolean isFailed() {
        return failed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SignatureBundle)) return false;
        SignatureBundle that = (SignatureBundle) o;
        return uniformColor == that.uniformColor && failed == that.failed
                && entries.equals(that.entries) && failures.equals(that.failures);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, failures, uniformColor, failed);
    }

    @Override
    public String toString() {
        return "SignatureBundle{entries=" + entries.size() + ", failures=" + failures.size()
                + ", uniformColor=" + uniformColor + ", failed=" + failed + "}";
    }

    public static final class Builder {
        private final Map<SignatureKey, HashValue> entries = new LinkedHashMap<>();
        private final Map<SignatureKey, String> failures = new LinkedHashMap<>();
        private boolean uniformColor;

        private Builder() {}

        public Builder put(SignatureKey key, HashValue value) {
            entries.put(Objects.requireNonNull(key), Objects.requireNonNull(value));
            failures.remove(key);
            return this;
        }

        public Builder fail(SignatureKey key, String reason) {
            if (!entries.containsKey(key)) {
                failures.put(Objects.requireNonNull(key), reason == null ? "unknown" : reason);
            }
            return this;
        }

        public Builder uniformColor(boolean uniformColor) {
            this.uniformColor = uniformColor;
            return this;
        }

        public SignatureBundle build() {
            return new SignatureBundle(
                    Collections.unmodifiableMap(new LinkedHashMap<>(entries)),
                    Collections.unmodifiableMap(new LinkedHashMap<>(failures)),
                    uniformColor,
                    false);
        }
    }
}
