package work.pollochang.dedup.image.cache;

import work.pollochang.dedup.image.signature.ImageRecord;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Optional;

/**
 * 簽章快取。命中時可以跳過解碼與雜湊計算。
 *
 * <p>實作必須允許多個工作執行緒同時呼叫 {@link #lookup(Path, long, long)}。</p>
 */
public interface SignatureCache extends AutoCloseable {

    /** 不做任何快取 */
    SignatureCache NONE = new SignatureCache() {
        @Override
        public Optional<ImageRecord> lookup(Path path, long fileSize, long lastModified) {
            return Optional.empty();
        }

        @Override
        public int store(Collection<ImageRecord> records) {
            return 0;
        }

        @Override
        public void close() {
        }
    };

    /**
     * @param path 絕對路徑
     * @param fileSize 目前的檔案大小
     * @param lastModified 目前的最後修改時間
     * @return 檔案未變動且簽章設定相同時的快取紀錄 (狀態為 CACHED)
     */
    Optional<ImageRecord> lookup(Path path, long fileSize, long lastModified);

    /**
     * 儲存本次新產生的簽章，失敗的紀錄會被忽略。
     * @return 實際寫入的筆數
     */
    int store(Collection<ImageRecord> records);

    @Override
    void close();
}
