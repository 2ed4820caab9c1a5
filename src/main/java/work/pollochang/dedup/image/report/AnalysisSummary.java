package work.pollochang.dedup.image.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 分析統計。
 *
 * @param totalImages 列舉到的圖片數
 * @param processedImages 已產生 (或沿用) 簽章的圖片數
 * @param duplicateGroups 重複群組數
 * @param duplicateImages 可刪除的重複圖片數 (每個群組的成員數減一後加總)
 * @param uniformColorImages 純色圖片數
 * @param failedImages 失敗的圖片數
 * @param comparisonFailures 比對時發生錯誤的配對數
 * @param reasons 分組原因 → 群組數
 * @param elapsedMillis 耗時 (毫秒)
 * @param interrupted 是否提前結束
 */
public record AnalysisSummary(int totalImages,
                              int processedImages,
                              int duplicateGroups,
                              int duplicateImages,
                              int uniformColorImages,
                              int failedImages,
                              long comparisonFailures,
                              Map<String, Integer> reasons,
                              long elapsedMillis,
                              boolean interrupted) {

    public AnalysisSummary {
        reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }
}
