package work.pollochang.dedup.image.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.InvalidParameterException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 從 JSON 檔案讀取分析設定。檔案中未出現的欄位沿用 {@link AnalysisParameters#defaults()}。
 *
 * <pre>{@code
 * {
 *   "dhash_threshold": 8,
 *   "detect_rotation": true,
 *   "angles": [0, 90, 180, 270],
 *   "scales": [1.0],
 *   "hash_sizes": [8]
 * }
 * }</pre>
 */
@Slf4j
public class ParametersLoader {

    private static final Set<String> KNOWN_FIELDS = Set.of(
            "dhash_threshold", "phash_threshold", "ahash_threshold",
            "detect_pure_color", "pure_color_std_threshold", "detect_rotation", "recursive_scan",
            "angles", "scales", "hash_sizes", "algorithms",
            "prefilter_enabled", "prefilter_algorithm", "prefilter_threshold",
            "compare_all_scales", "worker_threads");

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param path JSON 設定檔路徑
     * @return 套用檔案內容後的設定 (尚未驗證)
     * @throws IOException 檔案無法讀取或不是合法 JSON 時
     * @throws InvalidParameterException 欄位型別錯誤時
     */
    public AnalysisParameters load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("設定檔不存在: " + path);
        }
        JsonNode root = mapper.readTree(path.toFile());
        log.info("讀取分析設定檔: {}", path);
        return apply(AnalysisParameters.defaults(), root);
    }

    /**
     * 將 JSON 內容疊加到既有設定上。
     */
    public AnalysisParameters apply(AnalysisParameters base, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new InvalidParameterException("設定檔內容必須是 JSON 物件");
        }
        Iterator<String> names = root.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!KNOWN_FIELDS.contains(name)) {
                log.warn("忽略無法辨識的設定欄位: {}", name);
            }
        }

        AnalysisParameters p = base;
        if (root.has("dhash_threshold")) p = p.withDhashThreshold(intValue(root, "dhash_threshold"));
        if (root.has("phash_threshold")) p = p.withPhashThreshold(intValue(root, "phash_threshold"));
        if (root.has("ahash_threshold")) p = p.withAhashThreshold(intValue(root, "ahash_threshold"));
        if (root.has("detect_pure_color")) p = p.withDetectPureColor(booleanValue(root, "detect_pure_color"));
        if (root.has("pure_color_std_threshold")) p = p.withPureColorStdThreshold(doubleValue(root, "pure_color_std_threshold"));
        if (root.has("detect_rotation")) p = p.withDetectRotation(booleanValue(root, "detect_rotation"));
        if (root.has("recursive_scan")) p = p.withRecursiveScan(booleanValue(root, "recursive_scan"));
        if (root.has("angles")) p = p.withAngles(listValue(root, "angles", node -> requireInt(node, "angles")));
        if (root.has("scales")) p = p.withScales(listValue(root, "scales", node -> requireDouble(node, "scales")));
        if (root.has("hash_sizes")) p = p.withHashSizes(listValue(root, "hash_sizes", node -> requireInt(node, "hash_sizes")));
        if (root.has("algorithms")) p = p.withAlgorithms(listValue(root, "algorithms", node -> HashAlgorithm.fromName(node.asText())));
        if (root.has("prefilter_enabled")) p = p.withPrefilterEnabled(booleanValue(root, "prefilter_enabled"));
        if (root.has("prefilter_algorithm")) p = p.withPrefilterAlgorithm(HashAlgorithm.fromName(root.get("prefilter_algorithm").asText()));
        if (root.has("prefilter_threshold")) p = p.withPrefilterThreshold(intValue(root, "prefilter_threshold"));
        if (root.has("compare_all_scales")) p = p.withCompareAllScales(booleanValue(root, "compare_all_scales"));
        if (root.has("worker_threads")) p = p.withWorkerThreads(intValue(root, "worker_threads"));
        return p;
    }

    private static int intValue(JsonNode root, String name) {
        return requireInt(root.get(name), name);
    }

    private static int requireInt(JsonNode node, String name) {
        if (node == null || !node.canConvertToInt() || !node.isIntegralNumber()) {
            throw new InvalidParameterException(name + " 必須是整數: " + node);
        }
        return node.intValue();
    }

    private static double doubleValue(JsonNode root, String name) {
        return requireDouble(root.get(name), name);
    }

    private static double requireDouble(JsonNode node, String name) {
        if (node == null || !node.isNumber()) {
            throw new InvalidParameterException(name + " 必須是數字: " + node);
        }
        return node.doubleValue();
    }

    private static boolean booleanValue(JsonNode root, String name) {
        JsonNode node = root.get(name);
        if (node == null || !node.isBoolean()) {
            throw new InvalidParameterException(name + " 必須是 true 或 false: " + node);
        }
        return node.booleanValue();
    }

    private static <T> List<T> listValue(JsonNode root, String name, Function<JsonNode, T> converter) {
        JsonNode node = root.get(name);
        if (node == null || !node.isArray()) {
            throw new InvalidParameterException(name + " 必須是陣列: " + node);
        }
        List<T> values = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            values.add(converter.apply(element));
        }
        return values;
    }
}
