package work.pollochang.dedup.image.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * 固定位元長度的雜湊值。
 *
 * <p>位元依 MSB 優先的順序打包，每 4 個位元對應一個小寫十六進位字元；
 * 位元長度不是 4 的倍數時，最後一個字元右側補 0。</p>
 *
 * <p>內部同時保留 {@code long[]} 形式，讓漢明距離以 XOR + bitCount 計算。</p>
 */
public final class HashValue {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private final long[] words;
    private final int bitLength;
    private final String hex;

    private HashValue(long[] words, int bitLength, String hex) {
        this.words = words;
        this.bitLength = bitLength;
        this.hex = hex;
    }

    /**
     * 由位元陣列建立雜湊值，{@code bits[0]} 為最高位。
     * @param bits 位元陣列，長度即為位元長度
     * @return 雜湊值
     */
    public static HashValue fromBits(boolean[] bits) {
        Objects.requireNonNull(bits, "bits must not be null");
        if (bits.length == 0) {
            throw new InvalidParameterException("雜湊位元長度必須大於 0");
        }
        long[] words = new long[(bits.length + 63) / 64];
        for (int i = 0; i < bits.length; i++) {
            if (bits[i]) {
                words[i / 64] |= 1L << (63 - (i % 64));
            }
        }
        return new HashValue(words, bits.length, toHex(words, bits.length));
    }

    /**
     * 由十六進位字串還原雜湊值 (例如讀取快取或外部實作的輸出)。
     * @param hex 十六進位字串
     * @param bitLength 位元長度，必須與字串長度相符
     * @return 雜湊值
     */
    public static HashValue fromHex(String hex, int bitLength) {
        Objects.requireNonNull(hex, "hex must not be null");
        if (bitLength <= 0 || hex.length() != (bitLength + 3) / 4) {
            throw new InvalidParameterException("十六進位字串長度 " + hex.length() + " 與位元長度 " + bitLength + " 不符");
        }
        long[] words = new long[(bitLength + 63) / 64];
        for (int i = 0; i < hex.length(); i++) {
            int nibble = Character.digit(hex.charAt(i), 16);
            if (nibble < 0) {
                throw new InvalidParameterException("非法的十六進位字元: " + hex);
            }
            for (int b = 0; b < 4; b++) {
                int bitIndex = i * 4 + b;
                if (bitIndex < bitLength && (nibble & (8 >> b)) != 0) {
                    words[bitIndex / 64] |= 1L << (63 - (bitIndex % 64));
                }
            }
        }
        return new HashValue(words, bitLength, toHex(words, bitLength));
    }

    private static String toHex(long[] words, int bitLength) {
        int digits = (bitLength + 3) / 4;
        StringBuilder sb = new StringBuilder(digits);
        for (int i = 0; i < digits; i++) {
            int nibble = 0;
            for (int b = 0; b < 4; b++) {
                int bitIndex = i * 4 + b;
                nibble <<= 1;
                if (bitIndex < bitLength && (words[bitIndex / 64] & (1L << (63 - (bitIndex % 64)))) != 0) {
                    nibble |= 1;
                }
            }
            sb.append(HEX_DIGITS[nibble]);
        }
        return sb.toString();
    }

    /**
     * 計算與另一個雜湊值的漢明距離。
     * @param other 另一個雜湊值
     * @return 不同位元的數量
     * @throws HashLengthMismatchException 兩者位元長度不同時
     */
    public int distanceTo(HashValue other) {
        Objects.requireNonNull(other, "other must not be null");
        if (other.bitLength != bitLength) {
            throw new HashLengthMismatchException(bitLength, other.bitLength);
        }
        int distance = 0;
        for (int i = 0; i < words.length; i++) {
            distance += Long.bitCount(words[i] ^ other.words[i]);
        }
        return distance;
    }

    public int bitLength() {
        return bitLength;
    }

    public String hex() {
        return hex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashValue)) return false;
        HashValue that = (HashValue) o;
        return bitLength == that.bitLength && Arrays.equals(words, that.words);
    }

    @Override
    public int hashCode() {
        return 31 * bitLength + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return hex;
    }
}
