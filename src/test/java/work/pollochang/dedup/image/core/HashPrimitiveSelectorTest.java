package work.pollochang.dedup.image.core;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashPrimitiveSelectorTest {

    /**
     * 轉呼叫程序內實作的「加速」實作，可選擇讓 dHash 結果反轉
     */
    private static class DelegatingPrimitives implements HashPrimitives {
        private final JavaHashPrimitives delegate = new JavaHashPrimitives();
        private final String name;
        private final boolean corruptDHash;

        DelegatingPrimitives(String name, boolean corruptDHash) {
            this.name = name;
            this.corruptDHash = corruptDHash;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isAccelerated() {
            return true;
        }

        @Override
        public HashValue dHash(BufferedImage image, int size) {
            HashValue value = delegate.dHash(image, size);
            return corruptDHash ? invert(value) : value;
        }

        private static HashValue invert(HashValue value) {
            StringBuilder hex = new StringBuilder();
            for (char c : value.hex().toCharArray()) {
                hex.append(Integer.toHexString(Character.digit(c, 16) ^ 0xf));
            }
            return HashValue.fromHex(hex.toString(), value.bitLength());
        }

        @Override
        public HashValue pHash(BufferedImage image, int size) {
            return delegate.pHash(image, size);
        }

        @Override
        public HashValue aHash(BufferedImage image, int size) {
            return delegate.aHash(image, size);
        }

        @Override
        public boolean isUniformColor(BufferedImage image, double threshold) {
            return delegate.isUniformColor(image, threshold);
        }
    }

    /**
     * 沒有候選者時退回程序內實作
     */
    @Test
    void testNoCandidates_ShouldFallBackToJava() {
        HashPrimitives selected = HashPrimitiveSelector.select(List.of(), false);
        assertEquals(JavaHashPrimitives.NAME, selected.name());
        assertFalse(selected.isAccelerated());
    }

    /**
     * 要求加速實作但沒有可用的候選者時拋出 PrimitiveUnavailableException
     */
    @Test
    void testRequireAccelerated_ShouldThrowWhenUnavailable() {
        assertThrows(PrimitiveUnavailableException.class,
                () -> HashPrimitiveSelector.select(List.of(), true));
        assertThrows(PrimitiveUnavailableException.class,
                () -> HashPrimitiveSelector.select(List.of(new DelegatingPrimitives("broken", true)), true));
    }

    /**
     * 輸出一致的候選者會被採用
     */
    @Test
    void testAgreeingCandidate_ShouldBeSelected() {
        HashPrimitives selected = HashPrimitiveSelector.select(List.of(new DelegatingPrimitives("fast", false)), true);
        assertEquals("fast", selected.name());
        assertTrue(selected.isAccelerated());
    }

    /**
     * 輸出不一致的候選者不會被採用，不會產生兩種語意
     */
    @Test
    void testDisagreeingCandidate_ShouldBeRejected() {
        HashPrimitives selected = HashPrimitiveSelector.select(
                List.of(new DelegatingPrimitives("broken", true), new DelegatingPrimitives("fast", false)), false);
        assertEquals("fast", selected.name());

        HashPrimitives fallback = HashPrimitiveSelector.select(List.of(new DelegatingPrimitives("broken", true)), false);
        assertEquals(JavaHashPrimitives.NAME, fallback.name());
    }

    /**
     * 沒有在 classpath 註冊任何實作時，預設挑選程序內實作
     */
    @Test
    void testDefaultSelect_ShouldUseJava() {
        assertEquals(JavaHashPrimitives.NAME, HashPrimitiveSelector.select().name());
    }

    /**
     * 校驗圖片包含一張非純色與一張純色圖片
     */
    @Test
    void testCalibrationImages_ShouldCoverBothCases() {
        List<BufferedImage> images = HashPrimitiveSelector.calibrationImages();
        JavaHashPrimitives reference = new JavaHashPrimitives();
        assertEquals(2, images.size());
        assertFalse(reference.isUniformColor(images.get(0), 3.0));
        assertTrue(reference.isUniformColor(images.get(1), 3.0));
    }
}
