package work.pollochang.dedup.image.signature;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.cache.SignatureCache;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.core.DecodeFailureException;
import work.pollochang.dedup.image.core.DecodedImage;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.HashPrimitives;
import work.pollochang.dedup.image.core.ImageDecoder;
import work.pollochang.dedup.image.progress.ProgressEvent;
import work.pollochang.dedup.image.progress.ProgressListener;
import work.pollochang.dedup.image.tools.ImageTools;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BooleanSupplier;

/**
 * 簽章產生器：解碼 → 旋轉 → 縮放 → 雜湊。
 *
 * <p>每個角度只旋轉一次，每個 (角度, 縮放) 只縮放一次，再對同一張記憶體中的圖片
 * 計算所有雜湊大小與演算法，整個過程不經過暫存檔。</p>
 */
@Slf4j
public class SignatureGenerator {

    private final AnalysisParameters parameters;
    private final HashPrimitives primitives;
    private final SignatureCache cache;

    public SignatureGenerator(AnalysisParameters parameters, HashPrimitives primitives) {
        this(parameters, primitives, SignatureCache.NONE);
    }

    public SignatureGenerator(AnalysisParameters parameters, HashPrimitives primitives, SignatureCache cache) {
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.primitives = Objects.requireNonNull(primitives, "primitives must not be null");
        this.cache = cache == null ? SignatureCache.NONE : cache;
    }

    /**
     * 對已解碼的圖片產生所有設定組合的簽章。
     *
     * <p>純色判定只在原圖 (未旋轉、未縮放) 上做一次。
     * 任何組合失敗時記錄在 {@link SignatureBundle#failures()}，其餘組合照常產生。</p>
     *
     * @param image 原始圖片
     * @return 簽章
     */
    public SignatureBundle generate(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
        SignatureBundle.Builder builder = SignatureBundle.builder();
        if (parameters.detectPureColor()) {
            builder.uniformColor(primitives.isUniformColor(image, parameters.pureColorStdThreshold()));
        }

        for (int angle : parameters.angles()) {
            BufferedImage rotated;
            try {
                rotated = ImageTools.rotate(image, angle);
            } catch (RuntimeException e) {
                log.warn("旋轉 {}° 失敗，此角度的簽章全部記為失敗。", angle, e);
                failAll(builder, angle, parameters.scales(), "旋轉失敗: " + e.getMessage());
                continue;
            }

            for (double scale : parameters.scales()) {
                BufferedImage scaled;
                try {
                    scaled = ImageTools.resizeImage(rotated, scale);
                } catch (RuntimeException e) {
                    log.warn("縮放 {} 失敗 (角度 {}°)，此組合的簽章全部記為失敗。", scale, angle, e);
                    failAll(builder, angle, List.of(scale), "縮放失敗: " + e.getMessage());
                    continue;
                }

                for (int hashSize : parameters.hashSizes()) {
                    for (HashAlgorithm algorithm : parameters.algorithms()) {
                        SignatureKey key = new SignatureKey(algorithm, angle, scale, hashSize);
                        try {
                            builder.put(key, primitives.hash(algorithm, scaled, hashSize));
                        } catch (RuntimeException e) {
                            log.debug("{} 計算失敗", key, e);
                            builder.fail(key, e.getMessage());
                        }
                    }
                }
                if (scaled != rotated) {
                    scaled.flush();
                }
            }
            if (rotated != image) {
                rotated.flush();
            }
        }
        return builder.build();
    }

    private void failAll(SignatureBundle.Builder builder, int angle, List<Double> scales, String reason) {
        for (double scale : scales) {
            for (int hashSize : parameters.hashSizes()) {
                for (HashAlgorithm algorithm : parameters.algorithms()) {
                    builder.fail(new SignatureKey(algorithm, angle, scale, hashSize), reason);
                }
            }
        }
    }

    /**
     * 建立單一檔案的分析紀錄。任何單檔錯誤都以紀錄狀態回傳，不會拋出。
     * @param inputPath 圖片路徑
     * @return 分析紀錄
     */
    public ImageRecord createRecord(Path inputPath) {
        Path path = inputPath.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            log.warn("{} - 來源檔案不存在", path);
            return ImageRecord.failed(path, -1, -1, null, RecordStatus.FAILED_NOT_FOUND, "來源檔案不存在");
        }

        long fileSize;
        long lastModified;
        String contentHash;
        try {
            fileSize = Files.size(path);
            lastModified = Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            log.warn("{} - 讀取檔案屬性失敗", path, e);
            return ImageRecord.failed(path, -1, -1, null, RecordStatus.FAILED_IO_ERROR, e.getMessage());
        }

        Optional<ImageRecord> cached = cache.lookup(path, fileSize, lastModified);
        if (cached.isPresent()) {
            log.debug("{} - 沿用快取簽章", path);
            return cached.get();
        }

        try {
            contentHash = ContentHasher.hash(path);
        } catch (IOException e) {
            log.warn("{} - 計算內容雜湊失敗", path, e);
            return ImageRecord.failed(path, fileSize, lastModified, null, RecordStatus.FAILED_IO_ERROR, e.getMessage());
        }

        try (DecodedImage decoded = ImageDecoder.decode(path)) {
            SignatureBundle bundle = generate(decoded.image());
            log.debug("{} - 產生 {} 筆簽章 (格式: {}, 純色: {})", path.getFileName(), bundle.entryCount(),
                    decoded.formatName(), bundle.isUniformColor());
            return new ImageRecord(path, fileSize, lastModified, contentHash, RecordStatus.HASHED, bundle, null);
        } catch (DecodeFailureException e) {
            log.warn("{} - 圖片無法解碼: {}", path, e.getMessage());
            return ImageRecord.failed(path, fileSize, lastModified, contentHash, RecordStatus.FAILED_DECODE, e.getMessage());
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理時記憶體不足", path);
            return ImageRecord.failed(path, fileSize, lastModified, contentHash, RecordStatus.FAILED_OUT_OF_MEMORY, "記憶體不足");
        } catch (RuntimeException e) {
            log.error("{} - 產生簽章時發生未預期錯誤", path, e);
            return ImageRecord.failed(path, fileSize, lastModified, contentHash, RecordStatus.FAILED_UNKNOWN, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 以固定大小的執行緒池為所有檔案產生分析紀錄。
     *
     * <p>每個檔案開始前都會檢查停止訊號；收到停止訊號或協調執行緒被中斷時，
     * 尚未開始的檔案不再處理，回傳已完成的部分。</p>
     *
     * @param paths 圖片路徑
     * @param listener 每完成一個檔案呼叫一次，可能在工作執行緒中被呼叫
     * @param stopRequested 停止訊號
     * @return 已完成的紀錄，順序與輸入相同
     */
    public List<ImageRecord> generateAll(List<Path> paths, ProgressListener listener, BooleanSupplier stopRequested) {
        int total = paths.size();
        AtomicReferenceArray<ImageRecord> results = new AtomicReferenceArray<>(total);
        AtomicInteger completed = new AtomicInteger();
        ProgressListener sink = listener == null ? ProgressListener.NONE : listener;

        int threads = Math.max(1, Math.min(parameters.workerThreads(), Math.max(1, total)));
        log.info("建立固定大小為 {} 的執行緒池產生簽章，共 {} 個檔案，每個檔案 {} 筆簽章。",
                threads, total, parameters.signatureEntriesPerImage());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int i = 0; i < total; i++) {
                final int index = i;
                final Path path = paths.get(i);
                try {
                    executor.execute(() -> {
                        if (stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                            return;
                        }
                        ImageRecord record = createRecord(path);
                        results.set(index, record);
                        sink.onProgress(new ProgressEvent(ProgressEvent.Stage.SIGNATURE,
                                completed.incrementAndGet(), total, record.path().toString(),
                                record.bundle().entryCount()));
                    });
                } catch (RejectedExecutionException e) {
                    log.warn("執行緒池已停止，剩餘 {} 個檔案不再提交。", total - i);
                    break;
                }
            }
            executor.shutdown();
            boolean stopLogged = false;
            while (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                if (!stopLogged && stopRequested.getAsBoolean()) {
                    log.warn("收到停止訊號，等待進行中的檔案完成。");
                    stopLogged = true;
                }
            }
        } catch (InterruptedException e) {
            log.error("產生簽章時執行緒被中斷。", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        List<ImageRecord> records = new ArrayList<>(completed.get());
        for (int i = 0; i < total; i++) {
            ImageRecord record = results.get(i);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }
}
