package work.pollochang.dedup.image;

import javax.imageio.ImageIO;
import java.awt.*;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Random;

/**
 * 測試用圖片。
 */
public final class TestImages {

    private TestImages() {}

    /**
     * 產生純色影像
     */
    public static BufferedImage solid(int width, int height, Color color) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setPaint(color);
            g.fillRect(0, 0, width, height);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * 產生類似照片的影像：漸層背景、左上深色圓形、右下亮色矩形與一條斜線，
     * 旋轉任何 90° 倍數後都與原圖明顯不同。
     */
    public static BufferedImage photo(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = 60 + (x * 150) / width;
                int g = 40 + (y * 120) / height;
                int b = 90 + ((x + y) * 80) / (width + height);
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(new Color(20, 25, 30));
            g.fillOval(width / 10, height / 10, width / 3, height / 2);
            g.setColor(new Color(250, 240, 200));
            g.fillRect(width * 6 / 10, height * 6 / 10, width / 3, height / 3);
            g.setColor(new Color(200, 30, 30));
            g.setStroke(new BasicStroke(Math.max(2, width / 40f)));
            g.drawLine(0, height - 1, width / 2, 0);
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * 產生與 {@link #photo} 無關的影像：隨機灰階色塊拼貼。
     */
    public static BufferedImage blocks(int width, int height, long seed) {
        Random random = new Random(seed);
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            int cols = 6;
            int rows = 5;
            for (int row = 0; row < rows; row++) {
                for (int col = 0; col < cols; col++) {
                    int level = random.nextInt(256);
                    g.setColor(new Color(level, 255 - level, random.nextInt(256)));
                    g.fillRect(col * width / cols, row * height / rows, width / cols + 1, height / rows + 1);
                }
            }
        } finally {
            g.dispose();
        }
        return image;
    }

    /**
     * 由左到右的水平灰階漸層。
     */
    public static BufferedImage horizontalGradient(int width, int height, boolean increasing) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < width; x++) {
            int level = (x * 255) / (width - 1);
            if (!increasing) {
                level = 255 - level;
            }
            int rgb = (level << 16) | (level << 8) | level;
            for (int y = 0; y < height; y++) {
                image.setRGB(x, y, rgb);
            }
        }
        return image;
    }

    public static Path writePng(BufferedImage image, Path target) throws IOException {
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("沒有可用的 PNG 寫入器");
        }
        return target;
    }
}
