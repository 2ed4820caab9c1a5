package work.pollochang.dedup.image.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 將分析結果輸出為 JSON、CSV 與文字摘要，檔名帶有時間戳記。
 */
@Slf4j
public class ResultExporter {

    private static final DateTimeFormatter SUMMARY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String RULE = "=".repeat(50);

    private final Path outputDir;
    private final ObjectMapper mapper;

    public ResultExporter(Path outputDir) {
        this.outputDir = outputDir;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 輸出三種格式。
     * @return 產生的檔案 (JSON、CSV、摘要)
     * @throws IOException 寫入失敗時
     */
    public List<Path> exportAll(AnalysisReport report, LocalDateTime time) throws IOException {
        FileTools.ensureDirectoryExists(outputDir);
        return List.of(writeJson(report, time), writeCsv(report, time), writeSummary(report, time));
    }

    public Path writeJson(AnalysisReport report, LocalDateTime time) throws IOException {
        Path target = outputDir.resolve(FileTools.timestampedName("duplicates", "json", time));
        mapper.writeValue(target.toFile(), report);
        log.info("JSON 結果已輸出: {}", target);
        return target;
    }

    /**
     * 每個群組成員一列：{@code group_id,duplicate_reason,file_path}。
     */
    public Path writeCsv(AnalysisReport report, LocalDateTime time) throws IOException {
        Path target = outputDir.resolve(FileTools.timestampedName("duplicates", "csv", time));
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            writer.write("group_id,duplicate_reason,file_path");
            writer.newLine();
            for (DuplicateGroup group : report.groups()) {
                for (String file : group.files()) {
                    writer.write(group.groupId() + "," + csvField(group.reason()) + "," + csvField(file));
                    writer.newLine();
                }
            }
        }
        log.info("CSV 結果已輸出: {}", target);
        return target;
    }

    public Path writeSummary(AnalysisReport report, LocalDateTime time) throws IOException {
        Path target = outputDir.resolve(FileTools.timestampedName("summary", "txt", time));
        Files.writeString(target, summaryText(report, time), StandardCharsets.UTF_8);
        log.info("統計摘要已輸出: {}", target);
        return target;
    }

    static String summaryText(AnalysisReport report, LocalDateTime time) {
        AnalysisSummary summary = report.summary();
        StringBuilder sb = new StringBuilder();
        sb.append("圖片查重統計摘要 - ").append(SUMMARY_TIME.format(time)).append('\n');
        sb.append(RULE).append("\n\n");
        sb.append("總圖片數: ").append(summary.totalImages()).append('\n');
        sb.append("已處理圖片數: ").append(summary.processedImages()).append('\n');
        sb.append("重複圖片組數: ").append(summary.duplicateGroups()).append('\n');
        sb.append("重複圖片總數: ").append(summary.duplicateImages()).append('\n');
        if (summary.uniformColorImages() > 0) {
            sb.append("純色圖片數: ").append(summary.uniformColorImages()).append('\n');
        }
        if (summary.failedImages() > 0) {
            sb.append("失敗圖片數: ").append(summary.failedImages()).append('\n');
        }
        if (summary.comparisonFailures() > 0) {
            sb.append("比對失敗配對數: ").append(summary.comparisonFailures()).append('\n');
        }
        sb.append("耗時: ").append(summary.elapsedMillis() / 1000.0).append(" 秒\n");
        if (summary.interrupted()) {
            sb.append("注意: 分析提前結束，結果僅包含已完成的部分\n");
        }
        sb.append('\n');

        sb.append("按重複原因統計:\n");
        for (Map.Entry<String, Integer> entry : summary.reasons().entrySet()) {
            sb.append("  - ").append(entry.getKey()).append(": ").append(entry.getValue()).append("組\n");
        }
        if (!report.failures().isEmpty()) {
            sb.append("\n失敗的圖片:\n");
            for (FailedImage failure : report.failures()) {
                sb.append("  - ").append(failure.path()).append(" (").append(failure.status().getDescription()).append(")\n");
            }
        }
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
