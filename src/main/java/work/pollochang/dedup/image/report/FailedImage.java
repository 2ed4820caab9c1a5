package work.pollochang.dedup.image.report;

import work.pollochang.dedup.image.signature.RecordStatus;

public record FailedImage(String path, RecordStatus status, String reason) {}
