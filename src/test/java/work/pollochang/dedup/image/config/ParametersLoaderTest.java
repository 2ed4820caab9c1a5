package work.pollochang.dedup.image.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.dedup.image.core.HashAlgorithm;
import work.pollochang.dedup.image.core.InvalidParameterException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ParametersLoaderTest {

    private final ParametersLoader loader = new ParametersLoader();

    /**
     * 檔案中的欄位覆蓋預設值，未出現的欄位沿用預設值
     */
    @Test
    void testLoad_ShouldOverlayDefaults(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("params.json"), "{\n"
                + "  \"dhash_threshold\": 10,\n"
                + "  \"detect_rotation\": false,\n"
                + "  \"pure_color_std_threshold\": 5,\n"
                + "  \"angles\": [0, 180],\n"
                + "  \"scales\": [1.0, 0.5],\n"
                + "  \"hash_sizes\": [16],\n"
                + "  \"algorithms\": [\"phash\", \"dHash\"],\n"
                + "  \"prefilter_algorithm\": \"PHASH\",\n"
                + "  \"worker_threads\": 2\n"
                + "}");

        AnalysisParameters params = loader.load(file).validate();

        assertEquals(10, params.dhashThreshold());
        assertEquals(2, params.phashThreshold());
        assertFalse(params.detectRotation());
        assertEquals(5.0, params.pureColorStdThreshold());
        assertEquals(List.of(0, 180), params.angles());
        assertEquals(List.of(1.0, 0.5), params.scales());
        assertEquals(List.of(16), params.hashSizes());
        assertEquals(List.of(HashAlgorithm.PHASH, HashAlgorithm.DHASH), params.algorithms());
        assertEquals(HashAlgorithm.PHASH, params.prefilterAlgorithm());
        assertEquals(2, params.workerThreads());
        assertTrue(params.detectPureColor());
    }

    /**
     * 型別錯誤或演算法名稱錯誤時拋出 InvalidParameterException
     */
    @Test
    void testLoad_ShouldRejectWrongTypes(@TempDir Path tempDir) throws IOException {
        Path badThreshold = Files.writeString(tempDir.resolve("a.json"), "{\"dhash_threshold\": \"eight\"}");
        Path badAngles = Files.writeString(tempDir.resolve("b.json"), "{\"angles\": 90}");
        Path badAlgorithm = Files.writeString(tempDir.resolve("c.json"), "{\"algorithms\": [\"whash\"]}");
        Path badRoot = Files.writeString(tempDir.resolve("d.json"), "[1, 2]");
        Path badBoolean = Files.writeString(tempDir.resolve("e.json"), "{\"detect_pure_color\": 1}");

        assertThrows(InvalidParameterException.class, () -> loader.load(badThreshold));
        assertThrows(InvalidParameterException.class, () -> loader.load(badAngles));
        assertThrows(InvalidParameterException.class, () -> loader.load(badAlgorithm));
        assertThrows(InvalidParameterException.class, () -> loader.load(badRoot));
        assertThrows(InvalidParameterException.class, () -> loader.load(badBoolean));
    }

    /**
     * 檔案不存在或不是合法 JSON 時拋出 IOException
     */
    @Test
    void testLoad_ShouldFailOnUnreadableFile(@TempDir Path tempDir) throws IOException {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.json")));
        Path broken = Files.writeString(tempDir.resolve("broken.json"), "{ not json");
        assertThrows(IOException.class, () -> loader.load(broken));
    }

    /**
     * 無法辨識的欄位只會被忽略
     */
    @Test
    void testLoad_ShouldIgnoreUnknownFields(@TempDir Path tempDir) throws IOException {
        Path file = Files.writeString(tempDir.resolve("params.json"), "{\"color_mode\": \"rgb\", \"ahash_threshold\": 4}");
        AnalysisParameters params = loader.load(file);
        assertEquals(4, params.ahashThreshold());
        assertEquals(AnalysisParameters.defaults().angles(), params.angles());
    }
}
