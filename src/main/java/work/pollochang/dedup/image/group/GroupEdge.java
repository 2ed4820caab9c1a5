package work.pollochang.dedup.image.group;

import com.fasterxml.jackson.annotation.JsonIgnore;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.match.AlgorithmDistance;
import work.pollochang.dedup.image.match.MatchKind;

import java.util.List;
import java.util.Set;

/**
 * 促成合併的一對檔案及其距離，寫入報表時使用字串路徑。
 *
 * @param left 第一個檔案
 * @param right 第二個檔案
 * @param kind 相符的種類
 * @param angle left 順時針旋轉此角度後與 right 相符
 * @param distances 各演算法的距離
 * @param passedAlgorithms 通過門檻的演算法
 */
public record GroupEdge(String left, String right, MatchKind kind, int angle,
                        List<AlgorithmDistance> distances, Set<HashAlgorithm> passedAlgorithms) {

    @JsonIgnore
    public boolean isExact() {
        return kind == MatchKind.EXACT;
    }
}
