package work.pollochang.dedup.image.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HashValueTest {

    private static HashValue bits(int length, int... setBits) {
        boolean[] bits = new boolean[length];
        for (int bit : setBits) {
            bits[bit] = true;
        }
        return HashValue.fromBits(bits);
    }

    /**
     * 位元以 MSB 優先打包成小寫十六進位
     */
    @Test
    void testFromBits_ShouldPackMsbFirst() {
        assertEquals("8000000000000000", bits(64, 0).hex());
        assertEquals("0000000000000001", bits(64, 63).hex());
        assertEquals("a0", bits(8, 0, 2).hex());
    }

    /**
     * 位元長度不是 4 的倍數時最後一個字元右側補 0
     */
    @Test
    void testOddLength_ShouldPadLastDigit() {
        HashValue value = bits(9, 0, 8);
        assertEquals("808", value.hex());
        assertEquals(value, HashValue.fromHex("808", 9));
    }

    /**
     * 超過 64 位元時跨越多個 long
     */
    @Test
    void testLongHash_ShouldSpanWords() {
        HashValue a = bits(256, 0, 100, 255);
        HashValue b = HashValue.fromHex(a.hex(), 256);
        assertEquals(a, b);
        assertEquals(0, a.distanceTo(b));
        assertEquals(3, a.distanceTo(bits(256)));
    }

    /**
     * 漢明距離對稱，且只有相同時為 0
     */
    @Test
    void testDistance_ShouldBeSymmetric() {
        HashValue a = bits(64, 1, 5, 9, 40);
        HashValue b = bits(64, 1, 6, 40, 63);
        assertEquals(a.distanceTo(b), b.distanceTo(a));
        assertEquals(4, a.distanceTo(b));
        assertEquals(0, a.distanceTo(a));
        assertNotEquals(0, a.distanceTo(bits(64, 1, 5, 9)));
    }

    /**
     * 長度不同時拋出例外，而不是回傳距離
     */
    @Test
    void testLengthMismatch_ShouldThrow() {
        HashValue a = bits(64);
        HashValue b = bits(16);
        HashLengthMismatchException e = assertThrows(HashLengthMismatchException.class, () -> a.distanceTo(b));
        assertTrue(e.getMessage().contains("64"));
    }

    /**
     * 非法的十六進位字串
     */
    @Test
    void testFromHex_ShouldRejectInvalidInput() {
        assertThrows(InvalidParameterException.class, () -> HashValue.fromHex("zz", 8));
        assertThrows(InvalidParameterException.class, () -> HashValue.fromHex("abc", 8));
        assertThrows(InvalidParameterException.class, () -> HashValue.fromBits(new boolean[0]));
    }
}
