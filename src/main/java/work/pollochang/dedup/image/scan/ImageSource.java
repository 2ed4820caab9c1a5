package work.pollochang.dedup.image.scan;

import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * 候選圖片路徑的來源。每次呼叫 {@link #open()} 都重新開始列舉。
 */
@FunctionalInterface
public interface ImageSource {

    /**
     * @return 延遲產生的路徑串流，呼叫端負責關閉
     * @throws IOException 來源無法讀取時
     */
    Stream<Path> open() throws IOException;
}
