package work.pollochang.dedup.image.group;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.match.MatchResult;
import work.pollochang.dedup.image.match.ThresholdMatcher;
import work.pollochang.dedup.image.progress.ProgressEvent;
import work.pollochang.dedup.image.progress.ProgressListener;
import work.pollochang.dedup.image.signature.ImageRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * 分組引擎：把相符的配對以併查集合併為重複群組。
 *
 * <ol>
 *     <li>內容雜湊相同的紀錄直接合併。</li>
 *     <li>其餘可比對的紀錄兩兩比對：先做單一演算法的粗篩，通過後才做完整比對。
 *         距離計算在執行緒池中平行進行，相符的配對放入佇列。</li>
 *     <li>只有呼叫 {@link #group} 的協調執行緒會從佇列取出配對並合併集合。</li>
 * </ol>
 * <p>單一配對比對失敗只會記錄並計數，不影響其餘配對。</p>
 */
@Slf4j
public class GroupingEngine {

    public static final String EXACT_REASON = "完全相同";
    public static final String ROTATION_SUFFIX = "(支持旋轉)";

    private static final long POLL_MILLIS = 100;

    private final AnalysisParameters parameters;
    private final ThresholdMatcher matcher;

    public GroupingEngine(AnalysisParameters parameters) {
        this(parameters, new ThresholdMatcher(parameters));
    }

    public GroupingEngine(AnalysisParameters parameters, ThresholdMatcher matcher) {
        this.parameters = Objects.requireNonNull(parameters, "parameters must not be null");
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
    }

    /**
     * @param records 分析紀錄，失敗的紀錄會被排除
     * @param listener 每完成一列比對呼叫一次
     * @param stopRequested 停止訊號，收到後回傳目前為止的群組
     * @return 分組結果
     */
    public GroupingResult group(List<ImageRecord> records, ProgressListener listener, BooleanSupplier stopRequested) {
        ProgressListener sink = listener == null ? ProgressListener.NONE : listener;
        List<ImageRecord> usable = records.stream().filter(ImageRecord::isUsable).collect(Collectors.toList());
        int n = usable.size();
        DisjointSet sets = new DisjointSet(n);
        List<MatchEdge> edges = new ArrayList<>();

        int exactUnions = unionExactDuplicates(usable, sets, edges);
        log.info("內容完全相同的合併: {} 次", exactUnions);

        List<Integer> comparable = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (matcher.isComparable(usable.get(i))) {
                comparable.add(i);
            }
        }
        int m = comparable.size();
        int rows = Math.max(0, m - 1);
        log.info("可做感知比對的圖片: {} 張，排除純色或無簽章: {} 張，最多 {} 組配對。",
                m, n - m, (long) m * (m - 1) / 2);

        AtomicLong compared = new AtomicLong();
        AtomicLong prefiltered = new AtomicLong();
        AtomicLong failures = new AtomicLong();
        AtomicInteger matchesFound = new AtomicInteger();
        AtomicInteger rowsDone = new AtomicInteger();
        AtomicBoolean stopped = new AtomicBoolean(false);
        BlockingQueue<MatchEdge> queue = new LinkedBlockingQueue<>();
        CountDownLatch latch = new CountDownLatch(rows);

        boolean interrupted = false;
        int threads = Math.max(1, Math.min(parameters.workerThreads(), Math.max(1, rows)));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            for (int p = 0; p < rows; p++) {
                final int row = p;
                try {
                    executor.execute(() -> {
                        try {
                            compareRow(usable, sets, comparable, row, queue, stopRequested, stopped,
                                    compared, prefiltered, failures, matchesFound);
                        } finally {
                            int index = rowsDone.incrementAndGet();
                            sink.onProgress(new ProgressEvent(ProgressEvent.Stage.MATCHING, index, rows,
                                    usable.get(comparable.get(row)).path().toString(), matchesFound.get()));
                            latch.countDown();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    log.warn("執行緒池已停止，剩餘 {} 列比對不再提交。", rows - p);
                    for (int k = p; k < rows; k++) {
                        latch.countDown();
                    }
                    break;
                }
            }
            executor.shutdown();

            // 協調執行緒是併查集唯一的寫入者
            while (!latch.await(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                applyPending(queue, sets, edges);
            }
        } catch (InterruptedException e) {
            log.error("分組時執行緒被中斷，回傳目前為止的群組。", e);
            executor.shutdownNow();
            interrupted = true;
            Thread.currentThread().interrupt(); // 恢復中斷狀態
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }
        applyPending(queue, sets, edges);
        interrupted = interrupted || stopped.get();

        List<DuplicateGroup> groups = buildGroups(usable, sets, edges);
        sink.onProgress(new ProgressEvent(ProgressEvent.Stage.GROUPING, groups.size(), groups.size(), "", groups.size()));
        log.info("分組完成 -> 群組: {}, 完整比對: {}, 粗篩排除: {}, 比對失敗: {}{}",
                groups.size(), compared.get(), prefiltered.get(), failures.get(), interrupted ? " (提前結束)" : "");
        return new GroupingResult(groups, compared.get(), prefiltered.get(), failures.get(), interrupted);
    }

    private int unionExactDuplicates(List<ImageRecord> usable, DisjointSet sets, List<MatchEdge> edges) {
        Map<String, Integer> firstByHash = new HashMap<>();
        int unions = 0;
        for (int i = 0; i < usable.size(); i++) {
            String contentHash = usable.get(i).contentHash();
            if (contentHash == null) {
                continue;
            }
            Integer first = firstByHash.putIfAbsent(contentHash, i);
            if (first != null && sets.union(first, i)) {
                edges.add(new MatchEdge(first, i, MatchResult.exact()));
                unions++;
            }
        }
        return unions;
    }

    private void compareRow(List<ImageRecord> usable, DisjointSet sets, List<Integer> comparable, int row,
                            BlockingQueue<MatchEdge> queue, BooleanSupplier stopRequested, AtomicBoolean stopped,
                            AtomicLong compared, AtomicLong prefiltered, AtomicLong failures,
                            AtomicInteger matchesFound) {
        int i = comparable.get(row);
        ImageRecord a = usable.get(i);
        for (int q = row + 1; q < comparable.size(); q++) {
            if (stopped.get() || stopRequested.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                stopped.set(true);
                return;
            }
            int j = comparable.get(q);
            if (sets.connected(i, j)) {
                continue;
            }
            ImageRecord b = usable.get(j);
            try {
                if (!matcher.prefilter(a, b)) {
                    prefiltered.incrementAndGet();
                    continue;
                }
                compared.incrementAndGet();
                MatchResult result = matcher.match(a, b);
                if (result.isMatch()) {
                    matchesFound.incrementAndGet();
                    queue.add(new MatchEdge(i, j, result));
                }
            } catch (RuntimeException e) {
                failures.incrementAndGet();
                log.error("比對 {} 與 {} 時發生錯誤，略過此配對。", a.path(), b.path(), e);
            }
        }
    }

    private void applyPending(BlockingQueue<MatchEdge> queue, DisjointSet sets, List<MatchEdge> edges) {
        MatchEdge edge;
        while ((edge = queue.poll()) != null) {
            if (sets.union(edge.left(), edge.right())) {
                edges.add(edge);
            }
        }
    }

    private List<DuplicateGroup> buildGroups(List<ImageRecord> usable, DisjointSet sets, List<MatchEdge> edges) {
        Map<Integer, List<GroupEdge>> edgesByRoot = new HashMap<>();
        for (MatchEdge edge : edges) {
            MatchResult result = edge.result();
            GroupEdge groupEdge = new GroupEdge(
                    usable.get(edge.left()).path().toString(),
                    usable.get(edge.right()).path().toString(),
                    result.kind(), result.angle(), result.distances(), result.passedAlgorithms());
            edgesByRoot.computeIfAbsent(sets.find(edge.left()), k -> new ArrayList<>()).add(groupEdge);
        }

        List<DuplicateGroup> unnumbered = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> component : sets.components(2).entrySet()) {
            List<String> files = component.getValue().stream()
                    .map(index -> usable.get(index).path().toString())
                    .sorted()
                    .collect(Collectors.toList());
            List<GroupEdge> groupEdges = edgesByRoot.getOrDefault(component.getKey(), List.of());
            unnumbered.add(new DuplicateGroup(0, describe(groupEdges), files, groupEdges));
        }
        unnumbered.sort(Comparator.comparing(group -> group.files().get(0)));

        List<DuplicateGroup> groups = new ArrayList<>(unnumbered.size());
        for (int k = 0; k < unnumbered.size(); k++) {
            DuplicateGroup group = unnumbered.get(k);
            groups.add(new DuplicateGroup(k + 1, group.reason(), group.files(), group.edges()));
        }
        return groups;
    }

    /**
     * 依群組內的配對產生分組原因：以出現次數最多的演算法在前，
     * 有任何配對需要旋轉才相符時加上 {@value #ROTATION_SUFFIX}。
     */
    static String describe(List<GroupEdge> edges) {
        boolean hasExact = false;
        boolean rotated = false;
        Map<HashAlgorithm, Integer> frequency = new EnumMap<>(HashAlgorithm.class);
        for (GroupEdge edge : edges) {
            if (edge.isExact()) {
                hasExact = true;
                continue;
            }
            if (edge.angle() != 0) {
                rotated = true;
            }
            for (HashAlgorithm algorithm : edge.passedAlgorithms()) {
                frequency.merge(algorithm, 1, Integer::sum);
            }
        }
        if (frequency.isEmpty()) {
            return EXACT_REASON;
        }

        String similar = frequency.entrySet().stream()
                .sorted(Map.Entry.<HashAlgorithm, Integer>comparingByValue().reversed()
                        .thenComparing(Map.Entry.<HashAlgorithm, Integer>comparingByKey()))
                .map(entry -> entry.getKey().getDisplayName())
                .collect(Collectors.joining("+")) + "相似";
        if (rotated) {
            similar += ROTATION_SUFFIX;
        }
        return hasExact ? EXACT_REASON + "+" + similar : similar;
    }
}
