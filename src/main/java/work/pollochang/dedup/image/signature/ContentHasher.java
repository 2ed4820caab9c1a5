package work.pollochang.dedup.image.signature;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 檔案內容雜湊，用於找出位元組完全相同的檔案。
 *
 * <p>小檔案 (不超過 {@link #FULL_HASH_LIMIT}) 對整個檔案做 MD5；
 * 大檔案只讀取開頭、中段、結尾各 {@link #SAMPLE_SIZE}，連同檔案大小一起做 MD5。</p>
 */
public final class ContentHasher {

    public static final long FULL_HASH_LIMIT = 4L * 1024 * 1024;
    public static final int SAMPLE_SIZE = 1024 * 1024;

    private static final int BUFFER_SIZE = 64 * 1024;

    private ContentHasher() {}

    /**
     * @param path 檔案路徑
     * @return 32 個字元的小寫十六進位字串
     * @throws IOException 檔案無法讀取時
     */
    public static String hash(Path path) throws IOException {
        long size = Files.size(path);
        MessageDigest md5 = newDigest();
        if (size <= FULL_HASH_LIMIT) {
            try (InputStream in = Files.newInputStream(path)) {
                byte[] buffer = new byte[BUFFER_SIZE];
                int read;
                while ((read = in.read(buffer)) != -1) {
                    md5.update(buffer, 0, read);
                }
            }
        } else {
            md5.update(ByteBuffer.allocate(Long.BYTES).putLong(size).array());
            try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
                long[] offsets = {0, size / 2 - SAMPLE_SIZE / 2, size - SAMPLE_SIZE};
                ByteBuffer buffer = ByteBuffer.allocate(SAMPLE_SIZE);
                for (long offset : offsets) {
                    buffer.clear();
                    readFully(channel, buffer, offset);
                    buffer.flip();
                    md5.update(buffer);
                }
            }
        }
        return HexFormat.of().formatHex(md5.digest());
    }

    private static void readFully(FileChannel channel, ByteBuffer buffer, long offset) throws IOException {
        long position = offset;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, position);
            if (read < 0) {
                break;
            }
            position += read;
        }
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            // 每個 Java 平台都必須提供 MD5
            throw new IllegalStateException("MD5 不可用", e);
        }
    }
}
