package work.pollochang.dedup.image.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

/**
 * 封裝解碼後的圖片、其讀取器與二次取樣率，方便資源管理。
 * @param image 解碼後的圖片
 * @param reader 產生此圖片的讀取器
 * @param subsampling 解碼時套用的二次取樣率 (1 表示原尺寸)
 */
public record DecodedImage(BufferedImage image, ImageReader reader, int subsampling) implements AutoCloseable {

    /**
     * @return 讀取器提供的格式名稱 (小寫)，無法判斷時為 {@code unknown}
     */
    public String formatName() {
        if (reader == null || reader.getOriginatingProvider() == null) {
            return "unknown";
        }
        return reader.getOriginatingProvider().getFormatNames()[0].toLowerCase();
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
