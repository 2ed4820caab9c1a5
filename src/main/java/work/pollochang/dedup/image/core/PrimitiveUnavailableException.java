package work.pollochang.dedup.image.core;

/**
 * 找不到可用的雜湊原語實作，或加速實作的輸出與程序內參考實作不一致。
 */
public class PrimitiveUnavailableException extends RuntimeException {

    public PrimitiveUnavailableException(String message) {
        super(message);
    }

    public PrimitiveUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
