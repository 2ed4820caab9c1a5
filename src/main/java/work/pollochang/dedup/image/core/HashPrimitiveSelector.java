package work.pollochang.dedup.image.core;

import lombok.extern.slf4j.Slf4j;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * 啟動時挑選雜湊原語實作 (只執行一次，之後不再逐次分支)。
 *
 * <p>加速實作透過 {@link ServiceLoader} 以 {@code META-INF/services} 註冊。
 * 每個候選者都必須在校驗圖片上與 {@link JavaHashPrimitives} 輸出完全相同才會被採用，
 * 否則退回程序內實作，確保兩條路徑的語意一致。</p>
 */
@Slf4j
public final class HashPrimitiveSelector {

    private static final int[] CALIBRATION_SIZES = {8, 16};

    private HashPrimitiveSelector() {}

    /**
     * 從 classpath 上註冊的實作中挑選，找不到可用的加速實作時使用程序內實作。
     */
    public static HashPrimitives select() {
        return select(ServiceLoader.load(HashPrimitives.class), false);
    }

    /**
     * @param candidates 候選的加速實作
     * @param requireAccelerated 為 {@code true} 時，沒有可用的加速實作即視為錯誤
     * @return 被選用的實作
     * @throws PrimitiveUnavailableException 要求加速實作但沒有任何候選者通過校驗時
     */
    public static HashPrimitives select(Iterable<? extends HashPrimitives> candidates, boolean requireAccelerated) {
        JavaHashPrimitives reference = new JavaHashPrimitives();
        List<BufferedImage> calibration = calibrationImages();

        try {
            for (HashPrimitives candidate : candidates) {
                if (candidate == null || nameOf(candidate).equals(reference.name())) {
                    continue;
                }
                try {
                    if (agrees(candidate, reference, calibration)) {
                        log.info("採用加速雜湊實作: {}", candidate.name());
                        return candidate;
                    }
                    log.warn("加速雜湊實作 {} 的輸出與程序內實作不一致，不予採用。", candidate.name());
                } catch (RuntimeException | LinkageError e) {
                    log.warn("加速雜湊實作 {} 校驗時發生錯誤，不予採用。", nameOf(candidate), e);
                }
            }
        } catch (ServiceConfigurationError e) {
            log.warn("載入雜湊實作服務時發生錯誤。", e);
        }

        if (requireAccelerated) {
            throw new PrimitiveUnavailableException("找不到可用的加速雜湊實作，且設定要求必須使用加速實作");
        }
        log.info("使用程序內雜湊實作: {}", reference.name());
        return reference;
    }

    private static String nameOf(HashPrimitives primitives) {
        try {
            return String.valueOf(primitives.name());
        } catch (RuntimeException e) {
            return primitives.getClass().getName();
        }
    }

    private static boolean agrees(HashPrimitives candidate, HashPrimitives reference, List<BufferedImage> images) {
        for (BufferedImage image : images) {
            for (int size : CALIBRATION_SIZES) {
                for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                    if (!reference.hash(algorithm, image, size).equals(candidate.hash(algorithm, image, size))) {
                        log.debug("校驗不一致: {} size={} {}x{}", algorithm.getDisplayName(), size, image.getWidth(), image.getHeight());
                        return false;
                    }
                }
            }
            if (reference.isUniformColor(image, 3.0) != candidate.isUniformColor(image, 3.0)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 產生校驗用圖片：一張漸層加色塊、一張純色。
     */
    static List<BufferedImage> calibrationImages() {
        BufferedImage pattern = new BufferedImage(97, 61, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < pattern.getHeight(); y++) {
            for (int x = 0; x < pattern.getWidth(); x++) {
                int r = (x * 255) / pattern.getWidth();
                int g = (y * 255) / pattern.getHeight();
                int b = ((x ^ y) * 7) & 0xff;
                pattern.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        Graphics2D g2d = pattern.createGraphics();
        try {
            g2d.setColor(Color.BLACK);
            g2d.fillRect(10, 8, 30, 20);
        } finally {
            g2d.dispose();
        }

        BufferedImage solid = new BufferedImage(40, 30, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = solid.createGraphics();
        try {
            g.setColor(new Color(120, 130, 140));
            g.fillRect(0, 0, 40, 30);
        } finally {
            g.dispose();
        }
        return List.of(pattern, solid);
    }
}
