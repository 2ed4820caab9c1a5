package work.pollochang.dedup.image.report;

import work.pollochang.dedup.image.group.DuplicateGroup;

import java.util.List;

/**
 * 一次分析的完整結果，交給 {@link ResultExporter} 輸出。
 */
public record AnalysisReport(List<DuplicateGroup> groups,
                             List<String> uniformColorImages,
                             List<FailedImage> failures,
                             AnalysisSummary summary) {

    public AnalysisReport {
        groups = List.copyOf(groups);
        uniformColorImages = List.copyOf(uniformColorImages);
        failures = List.copyOf(failures);
    }
}
