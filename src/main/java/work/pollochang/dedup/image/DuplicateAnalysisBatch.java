package work.pollochang.dedup.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.cache.H2SignatureCache;
import work.pollochang.dedup.image.cache.SignatureCache;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.core.HashPrimitiveSelector;
import work.pollochang.dedup.image.core.HashPrimitives;
import work.pollochang.dedup.image.group.DuplicateGroup;
import work.pollochang.dedup.image.group.GroupingEngine;
import work.pollochang.dedup.image.group.GroupingResult;
import work.pollochang.dedup.image.progress.ProgressChannel;
import work.pollochang.dedup.image.progress.ProgressListener;
import work.pollochang.dedup.image.report.AnalysisReport;
import work.pollochang.dedup.image.report.AnalysisSummary;
import work.pollochang.dedup.image.report.FailedImage;
import work.pollochang.dedup.image.scan.ImageSource;
import work.pollochang.dedup.image.signature.ImageRecord;
import work.pollochang.dedup.image.signature.SignatureGenerator;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 進行批次查重：產生所有簽章後再兩兩比對並分組。
 */
@Setter
@Slf4j
public class DuplicateAnalysisBatch {

    private static final long PROGRESS_PUMP_MILLIS = 200;

    private AnalysisParameters parameters = AnalysisParameters.defaults();
    private HashPrimitives primitives;
    private Path cachePath;
    private long timeOutHr;
    private ProgressListener progressListener = ProgressListener.NONE;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /**
     * 要求在下一張圖片 (或下一組配對) 前停止，已完成的結果仍會回傳。
     */
    public void stop() {
        log.warn("收到停止要求，將在目前的圖片處理完成後結束。");
        stopRequested.set(true);
    }

    /**
     * @param source 圖片來源
     * @return 分析結果
     * @throws IOException 圖片來源無法讀取時
     * @throws work.pollochang.dedup.image.core.InvalidParameterException 設定不合法時 (尚未開始任何工作)
     */
    public AnalysisReport execute(ImageSource source) throws IOException {
        long startMillis = System.currentTimeMillis();
        AnalysisParameters params = parameters.validate();
        HashPrimitives hashPrimitives = primitives != null ? primitives : HashPrimitiveSelector.select();
        log.info("雜湊實作: {} (加速: {})", hashPrimitives.name(), hashPrimitives.isAccelerated());
        stopRequested.set(false);

        List<Path> paths;
        try (Stream<Path> stream = source.open()) {
            paths = stream.map(path -> path.toAbsolutePath().normalize())
                    .distinct()
                    .collect(Collectors.toList());
        }
        log.info("共找到 {} 個圖片檔案，每張圖片 {} 筆簽章。", paths.size(), params.signatureEntriesPerImage());

        Thread coordinator = Thread.currentThread();
        long deadline = timeOutHr > 0
                ? System.nanoTime() + TimeUnit.HOURS.toNanos(timeOutHr)
                : Long.MAX_VALUE;
        AtomicBoolean timedOut = new AtomicBoolean(false);
        BooleanSupplier stop = () -> {
            if (timeOutHr > 0 && System.nanoTime() - deadline > 0) {
                timedOut.set(true);
                return true;
            }
            return stopRequested.get() || coordinator.isInterrupted();
        };

        ProgressListener listener = progressListener == null ? ProgressListener.NONE : progressListener;
        ProgressChannel channel = new ProgressChannel();
        ScheduledExecutorService pump = Executors.newSingleThreadScheduledExecutor();
        pump.scheduleWithFixedDelay(() -> channel.drainTo(listener),
                PROGRESS_PUMP_MILLIS, PROGRESS_PUMP_MILLIS, TimeUnit.MILLISECONDS);

        List<ImageRecord> records;
        GroupingResult grouping;
        try (SignatureCache cache = openCache(params, hashPrimitives)) {
            SignatureGenerator generator = new SignatureGenerator(params, hashPrimitives, cache);
            records = generator.generateAll(paths, channel, stop);
            long totalBytes = records.stream().mapToLong(ImageRecord::fileSize).filter(size -> size > 0).sum();
            log.info("簽章產生完成: {}/{}，檔案總大小 {}", records.size(), paths.size(),
                    FileTools.formatFileSize(totalBytes));
            cache.store(records);

            grouping = new GroupingEngine(params).group(records, channel, stop);
        } finally {
            stopPump(pump);
            channel.drainTo(listener);
        }
        if (channel.droppedCount() > 0) {
            log.debug("進度佇列已滿，丟棄 {} 筆進度事件。", channel.droppedCount());
        }
        if (timedOut.get()) {
            log.warn("執行時間超過 {} 小時，分析提前結束。", timeOutHr);
        }

        boolean interrupted = records.size() < paths.size() || grouping.interrupted();
        AnalysisReport report = buildReport(params, paths.size(), records, grouping, interrupted,
                System.currentTimeMillis() - startMillis);
        logSummary(report);
        return report;
    }

    private static void stopPump(ScheduledExecutorService pump) {
        pump.shutdown();
        try {
            if (!pump.awaitTermination(PROGRESS_PUMP_MILLIS * 5, TimeUnit.MILLISECONDS)) {
                pump.shutdownNow();
            }
        } catch (InterruptedException e) {
            pump.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        }
    }

    private SignatureCache openCache(AnalysisParameters params, HashPrimitives hashPrimitives) {
        if (cachePath == null) {
            log.info("未指定快取資料庫，所有簽章將重新計算。");
            return SignatureCache.NONE;
        }
        return new H2SignatureCache(cachePath, params.signatureFingerprint(hashPrimitives.name()));
    }

    static AnalysisReport buildReport(AnalysisParameters params, int totalImages, List<ImageRecord> records,
                                      GroupingResult grouping, boolean interrupted, long elapsedMillis) {
        List<String> uniform = new ArrayList<>();
        List<FailedImage> failures = new ArrayList<>();
        int processed = 0;
        for (ImageRecord record : records) {
            if (!record.isUsable()) {
                failures.add(new FailedImage(record.path().toString(), record.status(), record.failureReason()));
                continue;
            }
            processed++;
            if (params.detectPureColor() && record.isUniformColor()) {
                uniform.add(record.path().toString());
            }
        }

        int duplicateImages = 0;
        Map<String, Integer> reasons = new LinkedHashMap<>();
        for (DuplicateGroup group : grouping.groups()) {
            duplicateImages += group.size() - 1;
            reasons.merge(group.reason(), 1, Integer::sum);
        }

        AnalysisSummary summary = new AnalysisSummary(
                totalImages,
                processed,
                grouping.groups().size(),
                duplicateImages,
                uniform.size(),
                failures.size(),
                grouping.comparisonFailures(),
                reasons,
                elapsedMillis,
                interrupted);
        return new AnalysisReport(grouping.groups(), uniform, failures, summary);
    }

    private static void logSummary(AnalysisReport report) {
        AnalysisSummary summary = report.summary();
        log.info("========================================查重統計報告========================================");
        log.info(" 圖片總數: {}, 已處理: {}, 失敗: {}", summary.totalImages(), summary.processedImages(), summary.failedImages());
        log.info(" 重複群組: {}, 重複圖片: {}", summary.duplicateGroups(), summary.duplicateImages());
        log.info(" 純色圖片: {}", summary.uniformColorImages());
        summary.reasons().forEach((reason, count) -> log.info("  - {}: {} 組", reason, count));
        if (summary.comparisonFailures() > 0) {
            log.warn(" 比對失敗的配對: {}", summary.comparisonFailures());
        }
        log.info(" 耗時: {} 秒{}", summary.elapsedMillis() / 1000.0, summary.interrupted() ? " (提前結束，結果不完整)" : "");
        log.info("========================================查重統計報告========================================");
    }
}
