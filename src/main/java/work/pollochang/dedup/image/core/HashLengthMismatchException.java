package work.pollochang.dedup.image.core;

/**
 * 比較兩個位元長度不同的雜湊值。屬於程式錯誤，絕不轉換成距離值。
 */
public class HashLengthMismatchException extends IllegalStateException {

    public HashLengthMismatchException(int leftBits, int rightBits) {
        super("雜湊值長度不匹配: " + leftBits + " bits vs " + rightBits + " bits");
    }
}
