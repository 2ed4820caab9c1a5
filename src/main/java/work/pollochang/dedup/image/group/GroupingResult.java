package work.pollochang.dedup.image.group;

import java.util.List;

/**
 * 分組結果。
 *
 * @param groups 重複群組
 * @param comparedPairs 實際做完整比對的配對數
 * @param prefilteredPairs 被粗篩排除的配對數
 * @param comparisonFailures 比對時發生錯誤的配對數
 * @param interrupted 是否因停止訊號或中斷而提前結束
 */
public record GroupingResult(List<DuplicateGroup> groups,
                             long comparedPairs,
                             long prefilteredPairs,
                             long comparisonFailures,
                             boolean interrupted) {

    public GroupingResult {
        groups = List.copyOf(groups);
    }
}
