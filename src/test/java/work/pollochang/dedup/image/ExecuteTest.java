package work.pollochang.dedup.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.dedup.image.config.AnalysisParameters;
import work.pollochang.dedup.image.core.HashAlgorithm;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    private static Set<String> extensions(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(path -> {
                String name = path.getFileName().toString();
                return name.substring(name.lastIndexOf('.') + 1);
            }).collect(Collectors.toSet());
        }
    }

    @Test
    void testCall_ShouldWriteResults(@TempDir Path tempDir) throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("images"));
        TestImages.writePng(TestImages.photo(80, 60), images.resolve("a.png"));
        Files.copy(images.resolve("a.png"), images.resolve("b.png"));
        Path output = tempDir.resolve("out");

        int exitCode = new CommandLine(new Execute()).execute(
                "-d", images.toString(), "-o", output.toString(), "--threads", "2", "--no-recursive");

        assertEquals(0, exitCode);
        assertEquals(Set.of("json", "csv", "txt"), extensions(output));
    }

    /**
     * 不合法的參數在開始任何工作前就以代碼 2 結束
     */
    @Test
    void testCall_ShouldRejectInvalidParameters(@TempDir Path tempDir) throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("images"));
        Path output = tempDir.resolve("out");

        int exitCode = new CommandLine(new Execute()).execute(
                "-d", images.toString(), "-o", output.toString(), "--hash-sizes", "64");

        assertEquals(Execute.EXIT_INVALID_PARAMETER, exitCode);
        assertFalse(Files.exists(output));
    }

    @Test
    void testCall_ShouldFailOnMissingConfig(@TempDir Path tempDir) throws IOException {
        Path images = Files.createDirectories(tempDir.resolve("images"));
        int exitCode = new CommandLine(new Execute()).execute(
                "-d", images.toString(), "--config", tempDir.resolve("none.json").toString());
        assertEquals(Execute.EXIT_FAILURE, exitCode);
    }

    @Test
    void testCall_ShouldFailOnMissingDirectory(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new Execute()).execute(
                "-d", tempDir.resolve("missing").toString(), "-o", tempDir.resolve("out").toString());
        assertEquals(Execute.EXIT_FAILURE, exitCode);
    }

    /**
     * 來源目錄與檔案清單只能擇一
     */
    @Test
    void testParse_ShouldRequireExactlyOneSource(@TempDir Path tempDir) {
        CommandLine commandLine = new CommandLine(new Execute());
        assertNotEquals(0, commandLine.execute());
        assertNotEquals(0, new CommandLine(new Execute()).execute(
                "-d", tempDir.toString(), "-f", tempDir.resolve("list.txt").toString()));
    }

    /**
     * 命令列參數覆蓋設定檔，設定檔覆蓋預設值
     */
    @Test
    void testResolveParameters_ShouldLayerOverrides(@TempDir Path tempDir) throws IOException {
        Path config = Files.writeString(tempDir.resolve("params.json"),
                "{\"dhash_threshold\": 12, \"phash_threshold\": 5, \"algorithms\": [\"dhash\", \"phash\"]}");
        Execute execute = new Execute();
        new CommandLine(execute).parseArgs("-d", tempDir.toString(), "--config", config.toString(),
                "--dhash", "4", "--no-rotation", "--angles", "0,180", "--scales", "1.0");

        AnalysisParameters params = execute.resolveParameters();
        assertEquals(4, params.dhashThreshold());
        assertEquals(5, params.phashThreshold());
        assertEquals(2, params.ahashThreshold());
        assertFalse(params.detectRotation());
        assertEquals(List.of(0, 180), params.angles());
        assertEquals(List.of(1.0), params.scales());
        assertEquals(List.of(HashAlgorithm.DHASH, HashAlgorithm.PHASH), params.algorithms());
        assertTrue(params.recursiveScan());
    }
}
