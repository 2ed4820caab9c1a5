package work.pollochang.dedup.image.core;

import java.io.IOException;

/**
 * 圖片無法讀取或已損毀。屬於單一檔案層級的錯誤，呼叫端應排除該檔案並繼續處理。
 */
public class DecodeFailureException extends IOException {

    public DecodeFailureException(String message) {
        super(message);
    }

    public DecodeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
