package work.pollochang.dedup.image.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.dedup.image.TestImages;
import work.pollochang.dedup.image.tools.ImageTools;

import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JavaHashPrimitivesTest {

    private final JavaHashPrimitives primitives = new JavaHashPrimitives();

    /**
     * dHash 與 aHash 的位元長度為 size²，十六進位長度為 size²/4
     */
    @Test
    void testHashLength_ShouldBeSizeSquared() {
        BufferedImage image = TestImages.photo(200, 150);
        for (int size : new int[]{4, 8, 16, 32}) {
            HashValue d = primitives.dHash(image, size);
            HashValue a = primitives.aHash(image, size);
            assertEquals(size * size, d.bitLength());
            assertEquals(size * size, a.bitLength());
            assertEquals(size * size / 4, d.hex().length());
        }
    }

    /**
     * pHash 長度與輸入解析度無關
     */
    @Test
    void testPHashLength_ShouldNotDependOnResolution() {
        HashValue small = primitives.pHash(TestImages.photo(40, 30), 8);
        HashValue large = primitives.pHash(TestImages.photo(900, 700), 8);
        assertEquals(64, small.bitLength());
        assertEquals(64, large.bitLength());
        assertEquals(16, large.hex().length());
    }

    /**
     * 遞增漸層的 dHash 全為 0，遞減漸層全為 1
     */
    @Test
    void testDHashOfGradient_ShouldFollowDirection() {
        assertEquals("0000000000000000", primitives.dHash(TestImages.horizontalGradient(90, 40, true), 8).hex());
        assertEquals("ffffffffffffffff", primitives.dHash(TestImages.horizontalGradient(90, 40, false), 8).hex());
    }

    /**
     * 左黑右白的 aHash 每列為 00001111
     */
    @Test
    void testAHashOfHalfImage_ShouldMarkBrightHalf() {
        BufferedImage image = TestImages.solid(80, 80, Color.BLACK);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(40, 0, 40, 80);
        } finally {
            g.dispose();
        }
        assertEquals("0f0f0f0f0f0f0f0f", primitives.aHash(image, 8).hex());
    }

    /**
     * 旋轉 0° 不改變雜湊值
     */
    @Test
    void testRotateZero_ShouldBeNoOp() {
        BufferedImage image = TestImages.photo(160, 120);
        assertEquals(primitives.dHash(image, 8), primitives.dHash(ImageTools.rotate(image, 0), 8));
        assertEquals(primitives.pHash(image, 8), primitives.pHash(ImageTools.rotate(image, 0), 8));
    }

    /**
     * 同一張圖片重複計算結果相同，不同圖片結果不同
     */
    @Test
    void testDeterministic_ShouldProduceSameHash() {
        BufferedImage image = TestImages.photo(160, 120);
        assertEquals(primitives.pHash(image, 8), primitives.pHash(TestImages.photo(160, 120), 8));
        assertNotEquals(primitives.dHash(image, 8), primitives.dHash(TestImages.blocks(160, 120, 7L), 8));
    }

    /**
     * 雜湊大小超出範圍時拋出 InvalidParameterException
     */
    @Test
    void testInvalidSize_ShouldThrowInvalidParameterException() {
        BufferedImage image = TestImages.photo(100, 100);
        assertThrows(InvalidParameterException.class, () -> primitives.dHash(image, 0));
        assertThrows(InvalidParameterException.class, () -> primitives.aHash(image, 65));
        assertThrows(InvalidParameterException.class, () -> primitives.pHash(image, 33));
        assertThrows(InvalidParameterException.class, () -> primitives.pHash(image, -1));
    }

    /**
     * 純色判定：純色與極小圖片為純色，照片不是
     */
    @Test
    void testUniformColor_ShouldDetectSolidImages() {
        assertTrue(primitives.isUniformColor(TestImages.solid(300, 200, Color.WHITE), 3.0));
        assertTrue(primitives.isUniformColor(TestImages.solid(50, 50, new Color(128, 128, 128)), 3.0));
        assertTrue(primitives.isUniformColor(TestImages.photo(5, 5), 3.0));
        assertFalse(primitives.isUniformColor(TestImages.photo(300, 200), 3.0));
    }

    /**
     * 以檔案路徑呼叫的結果與記憶體中的圖片相同；損毀檔案回報 DecodeFailureException
     */
    @Test
    void testPathEntryPoints_ShouldMatchInMemoryResult(@TempDir Path tempDir) throws IOException {
        BufferedImage image = TestImages.photo(120, 90);
        Path file = TestImages.writePng(image, tempDir.resolve("photo.png"));
        assertEquals(primitives.dHash(image, 8), primitives.dHash(file, 8));
        assertEquals(primitives.aHash(image, 8), primitives.aHash(file, 8));
        assertEquals(primitives.pHash(image, 8), primitives.pHash(file, 8));
        assertFalse(primitives.isUniformColor(file, 3.0));

        Path broken = Files.write(tempDir.resolve("broken.png"), new byte[]{1, 2, 3, 4, 5});
        assertThrows(DecodeFailureException.class, () -> primitives.dHash(broken, 8));
    }
}
