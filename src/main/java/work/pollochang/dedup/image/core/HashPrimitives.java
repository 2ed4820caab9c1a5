package work.pollochang.dedup.image.core;

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * 雜湊原語提供者。
 *
 * <p>四個操作皆為無狀態的純函式，輸入為已在記憶體中的圖片 (可能已旋轉、已縮放)，
 * 絕不經由暫存檔往返。所有實作必須遵守相同的數值契約，同一張圖片在任一實作下
 * 產生的雜湊值必須完全一致。</p>
 *
 * <p>以檔案路徑為參數的預設方法僅供單一方向 (不旋轉) 的相容情境使用。</p>
 */
public interface HashPrimitives {

    /** dHash 與 aHash 的雜湊大小上限 */
    int MAX_GRADIENT_HASH_SIZE = 64;

    /** pHash 的雜湊大小上限 */
    int MAX_DCT_HASH_SIZE = 32;

    /**
     * @return 實作名稱，會寫入簽章快取的設定指紋
     */
    String name();

    /**
     * @return 是否為加速 (非程序內參考) 實作
     */
    default boolean isAccelerated() {
        return false;
    }

    /**
     * 差值雜湊：縮小為 (size+1) x size，逐列比較相鄰像素，左 &gt; 右 記為 1。
     * @param image 圖片
     * @param size 雜湊大小
     * @return size² 位元的雜湊值
     * @throws InvalidParameterException size 不在 1..{@value #MAX_GRADIENT_HASH_SIZE} 時
     */
    HashValue dHash(BufferedImage image, int size);

    /**
     * 感知雜湊：縮小為 4size x 4size，做二維 DCT，取左上 size x size 低頻區塊，
     * 與區塊平均 (不含直流分量) 比較。
     * @param image 圖片
     * @param size 雜湊大小
     * @return size² 位元的雜湊值，長度與輸入解析度無關
     * @throws InvalidParameterException size 不在 1..{@value #MAX_DCT_HASH_SIZE} 時
     */
    HashValue pHash(BufferedImage image, int size);

    /**
     * 平均雜湊：縮小為 size x size，每個像素與平均亮度比較。
     * @param image 圖片
     * @param size 雜湊大小
     * @return size² 位元的雜湊值
     * @throws InvalidParameterException size 不在 1..{@value #MAX_GRADIENT_HASH_SIZE} 時
     */
    HashValue aHash(BufferedImage image, int size);

    /**
     * 純色判定：取樣有限數量的像素，計算各色版的標準差，全部低於門檻即為純色。
     * @param image 彩色圖片
     * @param threshold 標準差門檻
     * @return 是否為純色圖片
     */
    boolean isUniformColor(BufferedImage image, double threshold);

    /**
     * 依演算法分派至對應的雜湊原語。
     */
    default HashValue hash(HashAlgorithm algorithm, BufferedImage image, int size) {
        switch (algorithm) {
            case DHASH:
                return dHash(image, size);
            case PHASH:
                return pHash(image, size);
            case AHASH:
                return aHash(image, size);
            default:
                throw new InvalidParameterException("不支援的雜湊演算法: " + algorithm);
        }
    }

    default HashValue dHash(Path imagePath, int size) throws DecodeFailureException {
        try (DecodedImage decoded = ImageDecoder.decode(imagePath)) {
            return dHash(decoded.image(), size);
        }
    }

    default HashValue pHash(Path imagePath, int size) throws DecodeFailureException {
        try (DecodedImage decoded = ImageDecoder.decode(imagePath)) {
            return pHash(decoded.image(), size);
        }
    }

    default HashValue aHash(Path imagePath, int size) throws DecodeFailureException {
        try (DecodedImage decoded = ImageDecoder.decode(imagePath)) {
            return aHash(decoded.image(), size);
        }
    }

    default boolean isUniformColor(Path imagePath, double threshold) throws DecodeFailureException {
        try (DecodedImage decoded = ImageDecoder.decode(imagePath)) {
            return isUniformColor(decoded.image(), threshold);
        }
    }
}
