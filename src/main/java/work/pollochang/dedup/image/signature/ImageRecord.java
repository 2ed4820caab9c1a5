package work.pollochang.dedup.image.signature;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 一個圖片檔案的分析紀錄，以絕對路徑為唯一識別。建立後不可變。
 *
 * @param path 絕對且正規化的檔案路徑
 * @param fileSize 檔案大小 (bytes)，檔案不存在時為 -1
 * @param lastModified 最後修改時間 (epoch millis)，檔案不存在時為 -1
 * @param contentHash 內容雜湊 (十六進位)，無法計算時為 {@code null}
 * @param status 產生簽章的結果
 * @param bundle 簽章，失敗時為 {@link SignatureBundle#failed()}
 * @param failureReason 失敗原因，成功時為 {@code null}
 */
public record ImageRecord(Path path,
                          long fileSize,
                          long lastModified,
                          String contentHash,
                          RecordStatus status,
                          SignatureBundle bundle,
                          String failureReason) {

    public ImageRecord {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(bundle, "bundle must not be null");
    }

    public static ImageRecord failed(Path path, long fileSize, long lastModified, String contentHash,
                                     RecordStatus status, String reason) {
        return new ImageRecord(path, fileSize, lastModified, contentHash, status, SignatureBundle.failed(), reason);
    }

    /**
     * @return 是否可參與比對 (簽章產生成功或沿用快取)
     */
    public boolean isUsable() {
        return !status.isFailure() && !bundle.isFailed();
    }

    public boolean isUniformColor() {
        return bundle.isUniformColor();
    }

    public ImageRecord withStatus(RecordStatus newStatus) {
        return new ImageRecord(path, fileSize, lastModified, contentHash, newStatus, bundle, failureReason);
    }
}
