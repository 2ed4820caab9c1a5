package work.pollochang.dedup.image.match;

import work.pollochang.dedup.image.core.HashAlgorithm;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 兩張圖片的比對結果，只在分組過程中短暫存在。
 *
 * @param kind 相符的種類
 * @param angle 第一張圖片順時針旋轉此角度後與第二張最接近
 * @param distances 最佳角度下各演算法的距離
 * @param passedAlgorithms 最佳角度下通過門檻的演算法
 */
public record MatchResult(MatchKind kind, int angle, List<AlgorithmDistance> distances, Set<HashAlgorithm> passedAlgorithms) {

    private static final MatchResult NO_MATCH = new MatchResult(MatchKind.NONE, 0, List.of(), Set.of());
    private static final MatchResult EXACT = new MatchResult(MatchKind.EXACT, 0, List.of(), Set.of());

    public MatchResult {
        distances = List.copyOf(distances);
        passedAlgorithms = passedAlgorithms.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(passedAlgorithms));
    }

    public static MatchResult noMatch() {
        return NO_MATCH;
    }

    public static MatchResult exact() {
        return EXACT;
    }

    public static MatchResult noMatch(int angle, List<AlgorithmDistance> distances) {
        return new MatchResult(MatchKind.NONE, angle, distances, Set.of());
    }

    public boolean isMatch() {
        return kind != MatchKind.NONE;
    }

    public boolean isExact() {
        return kind == MatchKind.EXACT;
    }
}
