package work.pollochang.dedup.image.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    @Test
    void testTimestampedName_ShouldIncludeTime() {
        LocalDateTime time = LocalDateTime.of(2025, 10, 18, 9, 30, 5);
        assertEquals("duplicates_20251018_093005.csv", FileTools.timestampedName("duplicates", "csv", time));
    }

    @Test
    void testExtensionOf_ShouldBeLowerCase() {
        assertEquals("jpg", FileTools.extensionOf(Paths.get("/a/b/photo.JPG")));
        assertEquals("", FileTools.extensionOf(Paths.get("README")));
        assertEquals("gz", FileTools.extensionOf(Paths.get("archive.tar.gz")));
    }

    @Test
    void testFormatFileSize_ShouldUseUnits() {
        assertEquals("0 B", FileTools.formatFileSize(0));
        assertEquals("1 KB", FileTools.formatFileSize(1024));
    }

    @Test
    void testEnsureDirectoryExists_ShouldCreateNestedDirectories(@TempDir Path tempDir) {
        Path nested = tempDir.resolve("a").resolve("b");
        FileTools.ensureDirectoryExists(nested);
        assertTrue(Files.isDirectory(nested));
        FileTools.ensureDirectoryExists(nested);
        assertTrue(Files.isDirectory(nested));
    }
}
