package work.pollochang.dedup.image.config;

import lombok.With;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.HashPrimitives;
import work.pollochang.dedup.image.core.InvalidParameterException;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 單次分析的不可變設定。
 *
 * <p>預設值刻意保持較小的組合數：4 個角度 x 3 個縮放比例 x 1 個雜湊大小 = 12 種組合，
 * 每種組合計算 3 種演算法，每張圖片共 36 筆簽章。組合數直接決定簽章產生與比對的成本。</p>
 *
 * @param dhashThreshold dHash 漢明距離門檻 (含)
 * @param phashThreshold pHash 漢明距離門檻 (含)
 * @param ahashThreshold aHash 漢明距離門檻 (含)
 * @param detectPureColor 是否偵測並排除純色圖片
 * @param pureColorStdThreshold 純色判定的標準差門檻
 * @param detectRotation 是否比對旋轉角度
 * @param recursiveScan 是否遞迴掃描子目錄 (由檔案掃描器使用)
 * @param angles 簽章使用的順時針旋轉角度
 * @param scales 簽章使用的縮放比例
 * @param hashSizes 簽章使用的雜湊大小，第一個為比對時的參考大小
 * @param algorithms 啟用的演算法
 * @param prefilterEnabled 是否先以單一演算法做粗篩
 * @param prefilterAlgorithm 粗篩使用的演算法
 * @param prefilterThreshold 粗篩門檻，應寬鬆於正式門檻
 * @param compareAllScales 正式比對時是否額外比較所有縮放比例
 * @param workerThreads 工作執行緒數量
 */
@With
public record AnalysisParameters(
        int dhashThreshold,
        int phashThreshold,
        int ahashThreshold,
        boolean detectPureColor,
        double pureColorStdThreshold,
        boolean detectRotation,
        boolean recursiveScan,
        List<Integer> angles,
        List<Double> scales,
        List<Integer> hashSizes,
        List<HashAlgorithm> algorithms,
        boolean prefilterEnabled,
        HashAlgorithm prefilterAlgorithm,
        int prefilterThreshold,
        boolean compareAllScales,
        int workerThreads
) {

    public static final int MIN_HASH_SIZE = 2;
    public static final double MAX_SCALE = 4.0;

    public AnalysisParameters {
        angles = List.copyOf(Objects.requireNonNull(angles, "angles must not be null"));
        scales = List.copyOf(Objects.requireNonNull(scales, "scales must not be null"));
        hashSizes = List.copyOf(Objects.requireNonNull(hashSizes, "hashSizes must not be null"));
        algorithms = List.copyOf(Objects.requireNonNull(algorithms, "algorithms must not be null"));
        Objects.requireNonNull(prefilterAlgorithm, "prefilterAlgorithm must not be null");
    }

    /**
     * @return 預設設定 (dHash 8、pHash 2、aHash 2，偵測純色與旋轉)
     */
    public static AnalysisParameters defaults() {
        return new AnalysisParameters(
                8,
                2,
                2,
                true,
                3.0,
                true,
                true,
                List.of(0, 90, 180, 270),
                List.of(0.75, 1.0, 1.25),
                List.of(8),
                List.of(HashAlgorithm.DHASH, HashAlgorithm.PHASH, HashAlgorithm.AHASH),
                true,
                HashAlgorithm.DHASH,
                16,
                false,
                Math.max(1, Runtime.getRuntime().availableProcessors())
        );
    }

    /**
     * 驗證設定，任何批次工作開始前呼叫。
     * @return this，方便串接
     * @throws InvalidParameterException 任何一項設定不合法時
     */
    public AnalysisParameters validate() {
        requireNonEmptyDistinct(angles, "angles");
        requireNonEmptyDistinct(scales, "scales");
        requireNonEmptyDistinct(hashSizes, "hash_sizes");
        requireNonEmptyDistinct(algorithms, "algorithms");

        for (int angle : angles) {
            if (angle < 0 || angle >= 360) {
                throw new InvalidParameterException("旋轉角度必須介於 0 與 359 之間: " + angle);
            }
        }
        for (double scale : scales) {
            if (!(scale > 0) || scale > MAX_SCALE) {
                throw new InvalidParameterException("縮放比例必須介於 0 (不含) 與 " + MAX_SCALE + " 之間: " + scale);
            }
        }
        for (int size : hashSizes) {
            if (size < MIN_HASH_SIZE || size > HashPrimitives.MAX_DCT_HASH_SIZE) {
                throw new InvalidParameterException("雜湊大小必須介於 " + MIN_HASH_SIZE + " 與 "
                        + HashPrimitives.MAX_DCT_HASH_SIZE + " 之間: " + size);
            }
        }

        int maxBits = referenceHashSize() * referenceHashSize();
        requireThreshold(dhashThreshold, maxBits, "dhash_threshold");
        requireThreshold(phashThreshold, maxBits, "phash_threshold");
        requireThreshold(ahashThreshold, maxBits, "ahash_threshold");
        requireThreshold(prefilterThreshold, maxBits, "prefilter_threshold");

        if (!(pureColorStdThreshold >= 0)) {
            throw new InvalidParameterException("純色標準差門檻不可為負數: " + pureColorStdThreshold);
        }
        if (workerThreads < 1) {
            throw new InvalidParameterException("工作執行緒數量至少為 1: " + workerThreads);
        }
        return this;
    }

    public int thresholdFor(HashAlgorithm algorithm) {
        switch (algorithm) {
            case DHASH:
                return dhashThreshold;
            case PHASH:
                return phashThreshold;
            case AHASH:
                return ahashThreshold;
            default:
                throw new InvalidParameterException("不支援的雜湊演算法: " + algorithm);
        }
    }

    /**
     * @return 比對時的參考縮放比例：設定中有 1.0 就用 1.0，否則用第一個
     */
    public double referenceScale() {
        return scales.contains(1.0) ? 1.0 : scales.get(0);
    }

    public int referenceHashSize() {
        return hashSizes.get(0);
    }

    /**
     * @return 比對時第二張圖片使用的角度：設定中有 0° 就用 0°，否則用第一個角度
     */
    public int baseAngle() {
        return angles.contains(0) ? 0 : angles.get(0);
    }

    /**
     * @return 比對時第一張圖片檢查的角度；未啟用旋轉偵測時只比較基準角度
     */
    public List<Integer> matchAngles() {
        return detectRotation ? angles : List.of(baseAngle());
    }

    /**
     * @return 每張圖片的簽章筆數 = 角度 x 縮放 x 雜湊大小 x 演算法
     */
    public int signatureEntriesPerImage() {
        return angles.size() * scales.size() * hashSizes.size() * algorithms.size();
    }

    /**
     * @return 影響簽章內容的設定摘要，用於判斷快取是否可重用
     */
    public String signatureFingerprint(String primitivesName) {
        return "v1"
                + "|p=" + primitivesName
                + "|a=" + join(angles)
                + "|s=" + join(scales)
                + "|h=" + join(hashSizes)
                + "|alg=" + algorithms.stream().map(Enum::name).collect(Collectors.joining(","))
                + "|pc=" + detectPureColor + ":" + pureColorStdThreshold;
    }

    private static String join(List<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    private static void requireNonEmptyDistinct(List<?> values, String name) {
        if (values.isEmpty()) {
            throw new InvalidParameterException(name + " 不可為空");
        }
        if (new HashSet<>(values).size() != values.size()) {
            throw new InvalidParameterException(name + " 不可包含重複值: " + values);
        }
    }

    private static void requireThreshold(int threshold, int maxBits, String name) {
        if (threshold < 0 || threshold > maxBits) {
            throw new InvalidParameterException(name + " 必須介於 0 與 " + maxBits + " 之間: " + threshold);
        }
    }
}
