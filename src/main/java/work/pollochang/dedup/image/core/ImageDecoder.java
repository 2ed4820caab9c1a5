package work.pollochang.dedup.image.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;

/**
 * 圖片解碼工具類。
 *
 * <p>感知雜湊只需要很低的解析度，因此大圖會以二次取樣方式讀取，
 * 讓最長邊接近 {@link #PREFERRED_MAX_DIM}，大幅降低記憶體用量。</p>
 */
@Slf4j
public final class ImageDecoder {

    /** 解碼後最長邊的目標值 */
    public static final int PREFERRED_MAX_DIM = 1024;

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    private ImageDecoder() {}

    /**
     * 解碼指定的圖片檔案。
     * @param inputPath 圖片路徑
     * @return 解碼結果，呼叫端負責關閉
     * @throws DecodeFailureException 檔案無法讀取、格式不支援或內容損毀時
     */
    public static DecodedImage decode(Path inputPath) throws DecodeFailureException {
        try (InputStream raw = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new DecodeFailureException("無法建立圖片輸入流: " + inputPath);
            }

            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new DecodeFailureException("找不到對應的圖片讀取器: " + inputPath);
            }

            ImageReader reader = readers.next();
            reader.setInput(in, true, true);

            try {
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                if (width <= 0 || height <= 0) {
                    throw new DecodeFailureException("圖片尺寸不合法 " + width + "x" + height + ": " + inputPath);
                }

                ImageReadParam param = reader.getDefaultReadParam();
                int subsampling = subsamplingFor(width, height);
                if (subsampling > 1) {
                    log.debug("{} - 對圖片應用二次取樣，比率: {}", inputPath.getFileName(), subsampling);
                    param.setSourceSubsampling(subsampling, subsampling, 0, 0);
                }

                BufferedImage image = reader.read(0, param);
                if (image == null) {
                    throw new DecodeFailureException("讀取器未回傳任何圖片: " + inputPath);
                }
                // 此時 reader 不能關閉，DecodedImage 的 AutoCloseable 會負責關閉
                return new DecodedImage(image, reader, subsampling);
            } catch (DecodeFailureException e) {
                reader.dispose();
                throw e;
            } catch (IOException | RuntimeException e) {
                reader.dispose();
                throw new DecodeFailureException("圖片內容損毀或格式不支援: " + inputPath, e);
            }
        } catch (DecodeFailureException e) {
            throw e;
        } catch (IOException e) {
            throw new DecodeFailureException("無法讀取圖片檔案: " + inputPath, e);
        }
    }

    /**
     * 計算二次取樣率，確保是 2 的冪，對某些 JPG 解碼器更友好。
     */
    static int subsamplingFor(int width, int height) {
        int maxDim = Math.max(width, height);
        if (maxDim <= PREFERRED_MAX_DIM) {
            return 1;
        }
        int subsampling = (int) Math.floor((double) maxDim / PREFERRED_MAX_DIM);
        return Math.max(1, Integer.highestOneBit(subsampling));
    }
}
