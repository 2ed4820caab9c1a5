package work.pollochang.dedup.image.signature;

import work.pollochang.dedup.image.core.HashAlgorithm;

import java.util.Objects;

/**
 * 簽章組合鍵：(演算法, 順時針角度, 縮放比例, 雜湊大小)。
 */
public record SignatureKey(HashAlgorithm algorithm, int angle, double scale, int hashSize) {

    public SignatureKey {
        Objects.requireNonNull(algorithm, "algorithm must not be null");
    }

    @Override
    public String toString() {
        return algorithm.getDisplayName() + "@" + angle + "°x" + scale + "/" + hashSize;
    }
}
