package work.pollochang.dedup.image.match;

public enum MatchKind {
    EXACT("完全相同"),
    PERCEPTUAL("相似"),
    NONE("不相似");

    private final String description;
    MatchKind(String description) { this.description = description; }
    public String getDescription() { return description; }
}
