package work.pollochang.dedup.image.signature;

public enum RecordStatus {
    HASHED("已產生簽章"),
    CACHED("沿用快取簽章"),
    FAILED_NOT_FOUND("來源檔案不存在"),
    FAILED_DECODE("圖片無法解碼"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    RecordStatus(String description) { this.description = description; }
    public String getDescription() { return description; }

    public boolean isFailure() {
        return this != HASHED && this != CACHED;
    }
}
