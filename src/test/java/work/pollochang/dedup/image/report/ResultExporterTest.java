package work.pollochang.dedup.image.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.GroupEdge;
import work.pollochang.dedup.image.match.AlgorithmDistance;
import work.pollochang.dedup.image.match.MatchKind;
import work.pollochang.dedup.image.signature.RecordStatus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResultExporterTest {

    private static final LocalDateTime TIME = LocalDateTime.of(2025, 10, 18, 9, 30, 0);

    private static AnalysisReport sampleReport() {
        GroupEdge exact = new GroupEdge("/p/a.jpg", "/p/b.jpg", MatchKind.EXACT, 0, List.of(), Set.of());
        GroupEdge rotated = new GroupEdge("/p/c,1.jpg", "/p/d.jpg", MatchKind.PERCEPTUAL, 90,
                List.of(new AlgorithmDistance(HashAlgorithm.DHASH, 3, 8, true)), Set.of(HashAlgorithm.DHASH));
        DuplicateGroup first = new DuplicateGroup(1, "完全相同", List.of("/p/a.jpg", "/p/b.jpg"), List.of(exact));
        DuplicateGroup second = new DuplicateGroup(2, "dHash相似(支持旋轉)", List.of("/p/c,1.jpg", "/p/d.jpg"), List.of(rotated));

        Map<String, Integer> reasons = new LinkedHashMap<>();
        reasons.put("完全相同", 1);
        reasons.put("dHash相似(支持旋轉)", 1);
        AnalysisSummary summary = new AnalysisSummary(6, 5, 2, 2, 1, 1, 0, reasons, 1500, false);
        return new AnalysisReport(List.of(first, second), List.of("/p/white.png"),
                List.of(new FailedImage("/p/broken.jpg", RecordStatus.FAILED_DECODE, "無法解碼")), summary);
    }

    @Test
    void testExportAll_ShouldWriteTimestampedFiles(@TempDir Path tempDir) throws IOException {
        Path outputDir = tempDir.resolve("results");
        List<Path> files = new ResultExporter(outputDir).exportAll(sampleReport(), TIME);

        assertEquals(List.of(
                outputDir.resolve("duplicates_20251018_093000.json"),
                outputDir.resolve("duplicates_20251018_093000.csv"),
                outputDir.resolve("summary_20251018_093000.txt")), files);
        for (Path file : files) {
            assertTrue(Files.isRegularFile(file), file + " 應存在");
        }
    }

    /**
     * CSV 每個成員一列，含逗號的欄位需加引號
     */
    @Test
    void testWriteCsv(@TempDir Path tempDir) throws IOException {
        Path csv = new ResultExporter(tempDir).writeCsv(sampleReport(), TIME);
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(List.of(
                "group_id,duplicate_reason,file_path",
                "1,完全相同,/p/a.jpg",
                "1,完全相同,/p/b.jpg",
                "2,dHash相似(支持旋轉),\"/p/c,1.jpg\"",
                "2,dHash相似(支持旋轉),/p/d.jpg"), lines);
    }

    @Test
    void testWriteJson(@TempDir Path tempDir) throws IOException {
        Path json = new ResultExporter(tempDir).writeJson(sampleReport(), TIME);
        JsonNode root = new ObjectMapper().readTree(json.toFile());

        assertEquals(2, root.get("groups").size());
        JsonNode group = root.get("groups").get(1);
        assertEquals(2, group.get("groupId").asInt());
        assertEquals("dHash相似(支持旋轉)", group.get("reason").asText());
        assertEquals(90, group.get("edges").get(0).get("angle").asInt());
        assertEquals("/p/white.png", root.get("uniformColorImages").get(0).asText());
        assertEquals("FAILED_DECODE", root.get("failures").get(0).get("status").asText());
        assertEquals(2, root.get("summary").get("duplicateGroups").asInt());
        assertEquals(1, root.get("summary").get("reasons").get("完全相同").asInt());
    }

    @Test
    void testSummaryText() {
        String text = ResultExporter.summaryText(sampleReport(), TIME);
        assertTrue(text.startsWith("圖片查重統計摘要 - 2025-10-18 09:30:00"));
        assertTrue(text.contains("總圖片數: 6"));
        assertTrue(text.contains("重複圖片組數: 2"));
        assertTrue(text.contains("重複圖片總數: 2"));
        assertTrue(text.contains("純色圖片數: 1"));
        assertTrue(text.contains("按重複原因統計:"));
        assertTrue(text.contains("  - 完全相同: 1組"));
        assertTrue(text.contains("  - dHash相似(支持旋轉): 1組"));
        assertTrue(text.contains("/p/broken.jpg (圖片無法解碼)"));
        assertFalse(text.contains("提前結束"));
    }
}
