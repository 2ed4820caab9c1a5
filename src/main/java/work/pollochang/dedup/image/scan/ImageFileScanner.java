package work.pollochang.dedup.image.scan;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.tools.FileTools;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 圖片檔案列舉：掃描目錄，或逐行讀取檔案清單。只保留支援的副檔名 (不分大小寫)。
 */
@Slf4j
public final class ImageFileScanner {

    public static final Set<String> SUPPORTED_EXTENSIONS =
            Set.of("jpg", "jpeg", "png", "bmp", "gif", "tif", "tiff", "webp");

    private ImageFileScanner() {}

    /**
     * @param directory 要掃描的目錄
     * @param recursive 是否包含子目錄
     * @return 目錄中的圖片來源，依路徑排序
     */
    public static ImageSource directory(Path directory, boolean recursive) {
        return () -> {
            if (!Files.isDirectory(directory)) {
                throw new IOException("目錄不存在: " + directory);
            }
            log.info("掃描目錄: {} (遞迴: {})", directory, recursive);
            Stream<Path> paths = recursive ? Files.walk(directory) : Files.list(directory);
            // 依路徑排序，讓每次執行的比對順序 (與回報的旋轉角度) 都相同
            return paths.filter(Files::isRegularFile).filter(ImageFileScanner::isSupported).sorted();
        };
    }

    /**
     * 檔案清單中每行一個路徑，空白行會被略過。
     * @param listFile 檔案清單
     * @return 清單中的圖片來源
     */
    public static ImageSource fileList(Path listFile) {
        return () -> {
            log.info("讀取檔案列表: {}", listFile);
            // 使用 Stream API 逐行讀取檔案，避免一次性將整個列表載入記憶體
            return Files.lines(listFile)
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .map(line -> Paths.get(line))
                    .filter(ImageFileScanner::isSupported);
        };
    }

    public static boolean isSupported(Path path) {
        return SUPPORTED_EXTENSIONS.contains(FileTools.extensionOf(path));
    }
}
