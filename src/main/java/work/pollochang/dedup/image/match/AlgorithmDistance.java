package work.pollochang.dedup.image.match;

import work.pollochang.dedup.image.core.HashAlgorithm;

/**
 * 單一演算法的比對結果。
 *
 * @param algorithm 演算法
 * @param distance 漢明距離
 * @param threshold 門檻
 * @param passed distance &lt;= threshold
 */
public record AlgorithmDistance(HashAlgorithm algorithm, int distance, int threshold, boolean passed) {

    public static AlgorithmDistance of(HashAlgorithm algorithm, int distance, int threshold) {
        return new AlgorithmDistance(algorithm, distance, threshold, distance <= threshold);
    }
}
