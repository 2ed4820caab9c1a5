package work.pollochang.dedup.image.match;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.HashValue;
import work.pollochang.dedup.image.signature.ImageRecord;
import work.pollochang.dedup.image.signature.SignatureBundle;
import work.pollochang.dedup.image.signature.SignatureKey;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 門檻比對器。
 *
 * <p>比對規則：</p>
 * <ol>
 *     <li>內容雜湊相同 → 完全相同，不再做感知比對 (純色圖片也適用)。</li>
 *     <li>任一方簽章失敗，或啟用純色偵測時任一方為純色 → 不相符。</li>
 *     <li>第一張圖片在每個比對角度、第二張圖片在基準角度，於參考縮放比例與參考雜湊大小下
 *         逐一計算各演算法的漢明距離。任何一個演算法在任何一個角度通過門檻即相符。</li>
 * </ol>
 * <p>回報的角度為有演算法通過的角度中平均距離 (以實際比較到的演算法計) 最小者，同分時取設定中較前面的角度。</p>
 *
 * <p>本類別無狀態，可在多個執行緒間共用。</p>
 */
@Slf4j
public class ThresholdMatcher {

    private final AnalysisParameters parameters;
    private final List<Integer> matchAngles;
    private final int baseAngle;
    private final double referenceScale;
    private final int referenceHashSize;
    private final int prefilterThreshold;

    public ThresholdMatcher(AnalysisParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.matchAngles = parameters.matchAngles();
        this.baseAngle = parameters.baseAngle();
        this.referenceScale = parameters.referenceScale();
        this.referenceHashSize = parameters.referenceHashSize();
        // 粗篩門檻不可比正式門檻嚴格，否則會濾掉正式比對會通過的配對
        this.prefilterThreshold = Math.max(parameters.prefilterThreshold(),
                parameters.thresholdFor(parameters.prefilterAlgorithm()));
    }

    /**
     * @return 兩筆紀錄的內容雜湊是否相同
     */
    public boolean isExactDuplicate(ImageRecord a, ImageRecord b) {
        return a.contentHash() != null && a.contentHash().equals(b.contentHash());
    }

    /**
     * @return 這筆紀錄是否可以參與感知比對
     */
    public boolean isComparable(ImageRecord record) {
        return record.isUsable() && !(parameters.detectPureColor() && record.isUniformColor());
    }

    /**
     * 完整比對兩筆紀錄。
     * @throws work.pollochang.dedup.image.core.HashLengthMismatchException 雜湊長度不一致時
     */
    public MatchResult match(ImageRecord a, ImageRecord b) {
        if (isExactDuplicate(a, b)) {
            return MatchResult.exact();
        }
        if (!isComparable(a) || !isComparable(b)) {
            return MatchResult.noMatch();
        }
        MatchResult result = compare(a.bundle(), b.bundle());
        log.trace("{} <-> {}: {} @{}° {}", a.path().getFileName(), b.path().getFileName(),
                result.kind(), result.angle(), result.distances());
        return result;
    }

    /**
     * 粗篩：只用一個演算法在參考縮放比例下比對所有比對角度，門檻較寬鬆。
     * 缺少雜湊值的角度略過；所有角度都無法比較時直接放行，交由完整比對決定。
     * @return 是否值得做完整比對
     */
    public boolean prefilter(ImageRecord a, ImageRecord b) {
        if (!parameters.prefilterEnabled()) {
            return true;
        }
        HashAlgorithm algorithm = parameters.prefilterAlgorithm();
        SignatureBundle bundleA = a.bundle();
        SignatureBundle bundleB = b.bundle();
        HashValue target = bundleB.get(new SignatureKey(algorithm, baseAngle, referenceScale, referenceHashSize));
        if (target == null) {
            return true;
        }
        boolean anyCompared = false;
        for (int angle : matchAngles) {
            HashValue candidate = bundleA.get(new SignatureKey(algorithm, angle, referenceScale, referenceHashSize));
            if (candidate == null) {
                continue;
            }
            anyCompared = true;
            if (candidate.distanceTo(target) <= prefilterThreshold) {
                return true;
            }
        }
        return !anyCompared;
    }

    /**
     * 感知比對兩份簽章 (不檢查內容雜湊與純色)。
     */
    public MatchResult compare(SignatureBundle a, SignatureBundle b) {
        int bestAngle = -1;
        double bestMean = Double.MAX_VALUE;
        List<AlgorithmDistance> bestDistances = List.of();
        Set<HashAlgorithm> bestPassed = EnumSet.noneOf(HashAlgorithm.class);

        int closestAngle = 0;
        double closestMean = Double.MAX_VALUE;
        List<AlgorithmDistance> closestDistances = List.of();

        for (int angle : matchAngles) {
            List<AlgorithmDistance> distances = new ArrayList<>(parameters.algorithms().size());
            Set<HashAlgorithm> passed = EnumSet.noneOf(HashAlgorithm.class);
            long sum = 0;
            for (HashAlgorithm algorithm : parameters.algorithms()) {
                int distance = distance(a, b, algorithm, angle);
                if (distance < 0) {
                    continue;
                }
                AlgorithmDistance result = AlgorithmDistance.of(algorithm, distance, parameters.thresholdFor(algorithm));
                distances.add(result);
                sum += distance;
                if (result.passed()) {
                    passed.add(algorithm);
                }
            }
            if (distances.isEmpty()) {
                continue;
            }
            // 平均距離以實際比較到的演算法數計算
            double mean = (double) sum / distances.size();
            if (!passed.isEmpty() && mean < bestMean) {
                bestAngle = angle;
                bestMean = mean;
                bestDistances = distances;
                bestPassed = passed;
            }
            if (mean < closestMean) {
                closestAngle = angle;
                closestMean = mean;
                closestDistances = distances;
            }
        }

        if (bestAngle < 0) {
            return MatchResult.noMatch(relativeAngle(closestAngle), closestDistances);
        }
        return new MatchResult(MatchKind.PERCEPTUAL, relativeAngle(bestAngle), bestDistances, bestPassed);
    }

    /**
     * 第二張圖片固定在基準角度，回報的是兩者之間的相對順時針角度。
     */
    private int relativeAngle(int angle) {
        return Math.floorMod(angle - baseAngle, 360);
    }

    /**
     * @return 最小距離；兩份簽章缺少對應的雜湊值時回傳 -1
     */
    private int distance(SignatureBundle a, SignatureBundle b, HashAlgorithm algorithm, int angle) {
        if (!parameters.compareAllScales()) {
            HashValue left = a.get(new SignatureKey(algorithm, angle, referenceScale, referenceHashSize));
            HashValue right = b.get(new SignatureKey(algorithm, baseAngle, referenceScale, referenceHashSize));
            if (left == null || right == null) {
                return -1;
            }
            return left.distanceTo(right);
        }

        int min = -1;
        for (double scaleA : parameters.scales()) {
            HashValue left = a.get(new SignatureKey(algorithm, angle, scaleA, referenceHashSize));
            if (left == null) {
                continue;
            }
            for (double scaleB : parameters.scales()) {
                HashValue right = b.get(new SignatureKey(algorithm, baseAngle, scaleB, referenceHashSize));
                if (right == null) {
                    continue;
                }
                int distance = left.distanceTo(right);
                if (min < 0 || distance < min) {
                    min = distance;
                }
            }
        }
        return min;
    }
}
