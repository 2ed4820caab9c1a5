package work.pollochang.dedup.image.progress;

import java.util.Objects;

/**
 * 結構化的進度事件。
 *
 * @param stage 目前階段
 * @param index 已完成的項目數 (從 1 起算)
 * @param total 此階段的項目總數
 * @param currentFile 剛完成的檔案，沒有對應檔案時為空字串
 * @param combinationsCount 產生的簽章筆數；比對階段為已找到的相似配對數
 */
public record ProgressEvent(Stage stage, int index, int total, String currentFile, int combinationsCount) {

    public ProgressEvent {
        Objects.requireNonNull(stage, "stage must not be null");
        currentFile = currentFile == null ? "" : currentFile;
    }

    public boolean isLast() {
        return index >= total;
    }

    public enum Stage {
        SIGNATURE("產生簽章"),
        MATCHING("比對"),
        GROUPING("分組");

        private final String description;
        Stage(String description) { this.description = description; }
        public String getDescription() { return description; }
    }
}
