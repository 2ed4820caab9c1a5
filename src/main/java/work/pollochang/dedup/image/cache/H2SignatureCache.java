package work.pollochang.dedup.image.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.HashValue;
import work.pollochang.dedup.image.signature.ImageRecord;
import work.pollochang.dedup.image.signature.RecordStatus;
import work.pollochang.dedup.image.signature.SignatureBundle;
import work.pollochang.dedup.image.signature.SignatureKey;
import work.pollochang.dedup.image.tools.FileTools;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 簽章快取。
 * 負責所有與 H2 資料庫的底層互動，包括連線、資料表初始化、讀取與批次儲存。
 *
 * <p>開啟時把設定指紋相同的紀錄一次載入記憶體，執行期間只查詢記憶體；
 * 批次結束後再以單一交易寫回。檔案大小或修改時間不同的紀錄視為失效。</p>
 */
@Slf4j
public class H2SignatureCache implements SignatureCache {

    private static final int MAX_BATCH_SIZE = 1000; // 每 1000 筆執行一次

    // 使用 MERGE 陳述式來實現 "upsert" (update or insert) 功能
    private static final String MERGE_SQL = "MERGE INTO IMAGE_SIGNATURE "
            + "(PATH, FILE_SIZE, LAST_MODIFIED, CONTENT_HASH, UNIFORM, FINGERPRINT, ENTRIES) "
            + "KEY(PATH) VALUES (?, ?, ?, ?, ?, ?, ?)";

    private static final TypeReference<List<CachedEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Connection connection;
    private final String fingerprint;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, ImageRecord> snapshot = new ConcurrentHashMap<>();

    /**
     * 單一雜湊值在資料庫中的 JSON 形式。
     */
    public record CachedEntry(HashAlgorithm algorithm, int angle, double scale, int hashSize, String hex, int bits) {
    }

    /**
     * 建立連線、確認資料表並載入快取。
     * @param dbPath H2 資料庫檔案的路徑
     * @param fingerprint 簽章設定指紋，不同指紋的紀錄不會被使用
     */
    public H2SignatureCache(Path dbPath, String fingerprint) {
        this.fingerprint = fingerprint;
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            FileTools.ensureDirectoryExists(parent);
        }
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        // 使用 AUTO_SERVER=TRUE 允許多個進程安全地存取同一個資料庫
        String jdbcUrl = String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
        initSchema();
        loadAll();
    }

    private void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS IMAGE_SIGNATURE (" +
                "PATH VARCHAR(4096) PRIMARY KEY, " +
                "FILE_SIZE BIGINT, " +
                "LAST_MODIFIED BIGINT, " +
                "CONTENT_HASH VARCHAR(64), " +
                "UNIFORM BOOLEAN, " +
                "FINGERPRINT VARCHAR(1024), " +
                "ENTRIES CLOB" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("H2 資料表 'IMAGE_SIGNATURE' 已確認存在。");
        } catch (SQLException e) {
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    private void loadAll() {
        String selectSql = "SELECT PATH, FILE_SIZE, LAST_MODIFIED, CONTENT_HASH, UNIFORM, ENTRIES "
                + "FROM IMAGE_SIGNATURE WHERE FINGERPRINT = ?";
        int skipped = 0;
        try (PreparedStatement ps = connection.prepareStatement(selectSql)) {
            ps.setString(1, fingerprint);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String path = rs.getString("PATH");
                    try {
                        SignatureBundle.Builder builder = SignatureBundle.builder()
                                .uniformColor(rs.getBoolean("UNIFORM"));
                        for (CachedEntry entry : mapper.readValue(rs.getString("ENTRIES"), ENTRY_LIST)) {
                            builder.put(new SignatureKey(entry.algorithm(), entry.angle(), entry.scale(), entry.hashSize()),
                                    HashValue.fromHex(entry.hex(), entry.bits()));
                        }
                        snapshot.put(path, new ImageRecord(Paths.get(path),
                                rs.getLong("FILE_SIZE"),
                                rs.getLong("LAST_MODIFIED"),
                                rs.getString("CONTENT_HASH"),
                                RecordStatus.CACHED,
                                builder.build(),
                                null));
                    } catch (JsonProcessingException | RuntimeException e) {
                        skipped++;
                        log.warn("{} - 快取內容無法解析，將重新產生簽章", path, e);
                    }
                }
            }
        } catch (SQLException e) {
            // 即使載入失敗，也讓程式以空快取繼續執行
            log.error("從 H2 載入簽章快取時發生錯誤", e);
        }
        log.info("從 H2 資料庫成功載入 {} 筆簽章快取紀錄，略過 {} 筆。", snapshot.size(), skipped);
    }

    @Override
    public Optional<ImageRecord> lookup(Path path, long fileSize, long lastModified) {
        ImageRecord cached = snapshot.get(path.toString());
        if (cached == null || cached.fileSize() != fileSize || cached.lastModified() != lastModified) {
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    public int size() {
        return snapshot.size();
    }

    /**
     * 批次儲存新產生且完整的簽章。沿用快取、失敗或有缺漏組合的紀錄不會寫入。
     */
    @Override
    public int store(Collection<ImageRecord> records) {
        List<ImageRecord> pending = new ArrayList<>();
        for (ImageRecord record : records) {
            if (record.status() == RecordStatus.HASHED && record.bundle().failures().isEmpty()) {
                pending.add(record);
            }
        }
        if (pending.isEmpty()) {
            log.info("沒有新的簽章，無需儲存至 H2。");
            return 0;
        }

        log.info("準備將 {} 筆簽章批次寫入 H2 資料庫...", pending.size());
        int batchSize = 0;
        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);

            for (ImageRecord record : pending) {
                ps.setString(1, record.path().toString());
                ps.setLong(2, record.fileSize());
                ps.setLong(3, record.lastModified());
                ps.setString(4, record.contentHash());
                ps.setBoolean(5, record.isUniformColor());
                ps.setString(6, fingerprint);
                ps.setString(7, mapper.writeValueAsString(toEntries(record.bundle())));
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            // 執行剩餘的批次
            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit(); // 提交整個交易
            for (ImageRecord record : pending) {
                snapshot.put(record.path().toString(), record.withStatus(RecordStatus.CACHED));
            }
            log.info("成功將 {} 筆簽章儲存/更新至 H2 資料庫。", batchSize);
            return batchSize;
        } catch (SQLException | JsonProcessingException e) {
            log.error("批次儲存簽章至 H2 時發生錯誤", e);
            try {
                connection.rollback(); // 如果出錯，則回滾交易
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
            return 0;
        } finally {
            try {
                connection.setAutoCommit(true); // 恢復自動提交模式
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    private static List<CachedEntry> toEntries(SignatureBundle bundle) {
        List<CachedEntry> entries = new ArrayList<>(bundle.entryCount());
        for (Map.Entry<SignatureKey, HashValue> entry : bundle.entries().entrySet()) {
            SignatureKey key = entry.getKey();
            HashValue value = entry.getValue();
            entries.add(new CachedEntry(key.algorithm(), key.angle(), key.scale(), key.hashSize(),
                    value.hex(), value.bitLength()));
        }
        return entries;
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        try {
            log.info("正在關閉 H2 資料庫連線...");
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
