package work.pollochang.dedup.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.config.ParametersLoader;
import work.pollochang.dedup.image.core.InvalidParameterException;
import work.pollochang.dedup.image.progress.LoggingProgressListener;
import work.pollochang.dedup.image.report.AnalysisReport;
import work.pollochang.dedup.image.report.ResultExporter;
import work.pollochang.dedup.image.scan.ImageFileScanner;
import work.pollochang.dedup.image.scan.ImageSource;

import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "image-dedup",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "批次圖片查重工具 (支援縮放與旋轉)")
public class Execute implements Callable<Integer> {

    static final int EXIT_INVALID_PARAMETER = 2;
    static final int EXIT_FAILURE = 1;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Input input;

    static class Input {
        @Option(names = {"-d", "--dir"}, required = true, description = "要掃描的圖片目錄。")
        File dir;

        @Option(names = {"-f", "--file-list"}, required = true, description = "包含圖片路徑的文字檔案，每行一個。")
        File fileList;
    }

    @Option(names = {"-r", "--recursive"}, negatable = true, description = "是否遞迴掃描子目錄 (預設: 依設定檔，未設定時為是)。")
    private Boolean recursive;

    @Option(names = {"-o", "--output-dir"}, defaultValue = "results", description = "結果輸出目錄 (預設: results)。")
    private File outputDir;

    @Option(names = {"--config"}, description = "JSON 格式的分析設定檔。")
    private File configFile;

    @Option(names = {"--dhash"}, description = "dHash 門檻 (預設: 8)。")
    private Integer dhashThreshold;

    @Option(names = {"--phash"}, description = "pHash 門檻 (預設: 2)。")
    private Integer phashThreshold;

    @Option(names = {"--ahash"}, description = "aHash 門檻 (預設: 2)。")
    private Integer ahashThreshold;

    @Option(names = {"--pure-color"}, negatable = true, description = "是否偵測並排除純色圖片 (預設: 是)。")
    private Boolean detectPureColor;

    @Option(names = {"--pure-color-std"}, description = "純色判定的標準差門檻 (預設: 3.0)。")
    private Double pureColorStd;

    @Option(names = {"--rotation"}, negatable = true, description = "是否偵測旋轉 (預設: 是)。")
    private Boolean detectRotation;

    @Option(names = {"--angles"}, split = ",", description = "簽章使用的順時針角度，以逗號分隔 (預設: 0,90,180,270)。")
    private List<Integer> angles;

    @Option(names = {"--scales"}, split = ",", description = "簽章使用的縮放比例，以逗號分隔 (預設: 0.75,1.0,1.25)。")
    private List<Double> scales;

    @Option(names = {"--hash-sizes"}, split = ",", description = "雜湊大小，以逗號分隔，第一個為比對參考 (預設: 8)。")
    private List<Integer> hashSizes;

    @Option(names = {"--threads"}, description = "工作執行緒數量 (預設: CPU 核心數)。")
    private Integer threads;

    @Option(names = {"--cache-db"}, description = "H2 簽章快取資料庫的檔案路徑 (未指定時不使用快取)。")
    private File h2DbFile;

    @Option(names = {"--timeOut"}, defaultValue = "24", description = "設定執行時間超時(小時) (預設: 24 小時)。")
    private long timeOutHr;

    @Override
    public Integer call() throws Exception {
        AnalysisParameters params;
        try {
            params = resolveParameters().validate();
        } catch (InvalidParameterException e) {
            log.error("參數設定錯誤: {}", e.getMessage());
            return EXIT_INVALID_PARAMETER;
        } catch (IOException e) {
            log.error("讀取設定檔失敗: {}", configFile, e);
            return EXIT_FAILURE;
        }

        ImageSource source = input.dir != null
                ? ImageFileScanner.directory(input.dir.toPath(), params.recursiveScan())
                : ImageFileScanner.fileList(input.fileList.toPath());

        log.info("========================================查重程式參數設定========================================");
        log.info("查重任務開始");
        log.info("來源: {}", input.dir != null ? input.dir.getAbsolutePath() : input.fileList.getAbsolutePath());
        log.info("遞迴掃描: {}", params.recursiveScan());
        log.info("輸出目錄: {}", outputDir.getAbsolutePath());
        log.info("門檻 dHash/pHash/aHash: {}/{}/{}", params.dhashThreshold(), params.phashThreshold(), params.ahashThreshold());
        log.info("純色偵測: {} (標準差門檻 {})", params.detectPureColor(), params.pureColorStdThreshold());
        log.info("旋轉偵測: {}", params.detectRotation());
        log.info("角度: {}, 縮放: {}, 雜湊大小: {} (每張圖片 {} 筆簽章)",
                params.angles(), params.scales(), params.hashSizes(), params.signatureEntriesPerImage());
        log.info("工作執行緒: {}", params.workerThreads());
        log.info("設定超時執行時間: {} 小時", timeOutHr);
        log.info("簽章快取資料庫: {}", h2DbFile == null ? "(未使用)" : h2DbFile.getAbsolutePath());
        log.info("========================================查重程式參數設定========================================");

        DuplicateAnalysisBatch batch = new DuplicateAnalysisBatch();
        batch.setParameters(params);
        batch.setTimeOutHr(timeOutHr);
        batch.setCachePath(h2DbFile == null ? null : h2DbFile.toPath());
        batch.setProgressListener(new LoggingProgressListener(100));

        try {
            AnalysisReport report = batch.execute(source);
            new ResultExporter(outputDir.toPath()).exportAll(report, LocalDateTime.now());
        } catch (InvalidParameterException e) {
            log.error("參數設定錯誤: {}", e.getMessage());
            return EXIT_INVALID_PARAMETER;
        } catch (Exception e) {
            log.error("查重任務失敗", e);
            return EXIT_FAILURE;
        }

        log.info("所有任務執行完畢");
        return 0; // 成功時返回 0
    }

    /**
     * 預設值 → 設定檔 → 命令列參數，後者覆蓋前者。
     */
    AnalysisParameters resolveParameters() throws IOException {
        AnalysisParameters params = configFile != null
                ? new ParametersLoader().load(configFile.toPath())
                : AnalysisParameters.defaults();
        if (recursive != null) params = params.withRecursiveScan(recursive);
        if (dhashThreshold != null) params = params.withDhashThreshold(dhashThreshold);
        if (phashThreshold != null) params = params.withPhashThreshold(phashThreshold);
        if (ahashThreshold != null) params = params.withAhashThreshold(ahashThreshold);
        if (detectPureColor != null) params = params.withDetectPureColor(detectPureColor);
        if (pureColorStd != null) params = params.withPureColorStdThreshold(pureColorStd);
        if (detectRotation != null) params = params.withDetectRotation(detectRotation);
        if (angles != null) params = params.withAngles(angles);
        if (scales != null) params = params.withScales(scales);
        if (hashSizes != null) params = params.withHashSizes(hashSizes);
        if (threads != null) params = params.withWorkerThreads(threads);
        return params;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }
}
