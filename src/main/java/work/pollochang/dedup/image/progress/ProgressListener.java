package work.pollochang.dedup.image.progress;

/**
 * 接收進度事件。實作可能在工作執行緒中被呼叫，不可長時間阻塞。
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = event -> { };

    void onProgress(ProgressEvent event);
}
