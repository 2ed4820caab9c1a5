package work.pollochang.dedup.image.core;

/**
 * 分析參數不合法 (雜湊大小、角度、縮放比例或門檻值)。
 * 在任何批次工作開始前由參數驗證拋出，整個執行因此中止。
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
