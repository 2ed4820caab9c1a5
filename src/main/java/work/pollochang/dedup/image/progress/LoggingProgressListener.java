package work.pollochang.dedup.image.progress;

import lombok.extern.slf4j.Slf4j;

/**
 * 將進度事件寫入日誌。每個階段只記錄每 {@code interval} 筆與最後一筆，避免大批次洗版。
 */
@Slf4j
public class LoggingProgressListener implements ProgressListener {

    private final int interval;

    public LoggingProgressListener(int interval) {
        this.interval = Math.max(1, interval);
    }

    @Override
    public void onProgress(ProgressEvent event) {
        if (event.index() % interval == 0 || event.isLast()) {
            if (event.stage() == ProgressEvent.Stage.SIGNATURE) {
                log.info("[{}] {}/{} - {} ({} 筆簽章)", event.stage().getDescription(),
                        event.index(), event.total(), event.currentFile(), event.combinationsCount());
            } else {
                log.info("[{}] {}/{} ({} 組相似)", event.stage().getDescription(),
                        event.index(), event.total(), event.combinationsCount());
            }
        } else {
            log.debug("[{}] {}/{} - {}", event.stage().getDescription(), event.index(), event.total(), event.currentFile());
        }
    }
}
