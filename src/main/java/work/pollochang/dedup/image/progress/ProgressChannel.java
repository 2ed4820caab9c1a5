package work.pollochang.dedup.image.progress;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 工作執行緒與進度消費者之間的有界事件通道。
 *
 * <p>工作執行緒透過 {@link #onProgress(ProgressEvent)} 發佈事件，永遠不會阻塞：
 * 佇列已滿時丟棄最舊的事件。消費者由協調執行緒定期呼叫 {@link #drainTo(ProgressListener)}。</p>
 */
@Slf4j
public class ProgressChannel implements ProgressListener {

    public static final int DEFAULT_CAPACITY = 1024;

    private final BlockingQueue<ProgressEvent> queue;
    private final AtomicLong dropped = new AtomicLong();

    public ProgressChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressChannel(int capacity) {
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    public void onProgress(ProgressEvent event) {
        while (!queue.offer(event)) {
            if (queue.poll() != null) {
                dropped.incrementAndGet();
            }
        }
    }

    /**
     * 把目前佇列中的事件依序交給監聽器。
     * @param listener 消費者
     * @return 轉交的事件數
     */
    public int drainTo(ProgressListener listener) {
        List<ProgressEvent> batch = new ArrayList<>();
        queue.drainTo(batch);
        for (ProgressEvent event : batch) {
            try {
                listener.onProgress(event);
            } catch (RuntimeException e) {
                log.warn("進度監聽器處理事件時發生錯誤: {}", event, e);
            }
        }
        return batch.size();
    }

    /**
     * @return 因佇列已滿而被丟棄的事件數
     */
    public long droppedCount() {
        return dropped.get();
    }

    public int pendingCount() {
        return queue.size();
    }
}
