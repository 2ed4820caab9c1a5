package work.pollochang.dedup.image.group;

import work.pollochang.dedup.image.match.MatchResult;

/**
 * 比對相符的一對紀錄 (以批次中的索引表示)，由工作執行緒交給分組的協調執行緒。
 */
public record MatchEdge(int left, int right, MatchResult result) {
}
