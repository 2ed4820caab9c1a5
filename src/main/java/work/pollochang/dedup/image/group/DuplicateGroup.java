package work.pollochang.dedup.image.group;

import java.util.List;

/**
 * 重複圖片群組 (至少兩個檔案)。
 *
 * @param groupId 群組編號，從 1 起算
 * @param reason 可讀的分組原因，例如 {@code dHash+pHash相似(支持旋轉)}
 * @param files 成員檔案，依路徑排序
 * @param edges 促成合併的配對
 */
public record DuplicateGroup(int groupId, String reason, List<String> files, List<GroupEdge> edges) {

    public DuplicateGroup {
        files = List.copyOf(files);
        edges = List.copyOf(edges);
    }

    public int size() {
        return files.size();
    }
}
