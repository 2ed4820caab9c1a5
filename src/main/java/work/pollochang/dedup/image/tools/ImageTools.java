package work.pollochang.dedup.image.tools;

import work.pollochang.dedup.image.core.InvalidParameterException;

import java.awt.*;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;

/**
 * 簽章管線使用的圖片轉換：旋轉與縮放，全部在記憶體中完成。
 */
public class ImageTools {

    private ImageTools() {}

    public static BufferedImage resizeImage(BufferedImage originalImage, double scale) {
        if (scale <= 0) {
            throw new InvalidParameterException("縮放比例必須大於 0: " + scale);
        }
        if (scale == 1.0) {
            return originalImage;
        }
        int newWidth = Math.max(1, (int) (originalImage.getWidth() * scale));
        int newHeight = Math.max(1, (int) (originalImage.getHeight() * scale));

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, targetType(originalImage));
        Graphics2D g2d = resizedImage.createGraphics();
        // 使用更高品質的縮放演算法
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        g2d.dispose();
        return resizedImage;
    }

    /**
     * 順時針旋轉圖片。
     *
     * <p>0°、90°、180°、270° 以像素搬移完成，沒有任何重新取樣誤差；
     * 其他角度使用仿射變換 (雙線性內插)，畫布擴大到能完整容納旋轉結果，空白處填白色。</p>
     *
     * @param image 原始圖片
     * @param angle 順時針角度，介於 0 (含) 與 360 (不含) 之間
     * @return 旋轉後的圖片；角度為 0 時直接回傳原圖
     */
    public static BufferedImage rotate(BufferedImage image, int angle) {
        if (angle < 0 || angle >= 360) {
            throw new InvalidParameterException("旋轉角度必須介於 0 與 359 之間: " + angle);
        }
        switch (angle) {
            case 0:
                return image;
            case 90:
            case 180:
            case 270:
                return rotateQuarterTurns(image, angle / 90);
            default:
                return rotateAffine(image, angle);
        }
    }

    private static BufferedImage rotateQuarterTurns(BufferedImage image, int quarterTurns) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] src = image.getRGB(0, 0, w, h, null, 0, w);

        boolean swap = quarterTurns % 2 == 1;
        int outW = swap ? h : w;
        int outH = swap ? w : h;
        int[] dst = new int[outW * outH];

        for (int y = 0; y < outH; y++) {
            for (int x = 0; x < outW; x++) {
                int sx;
                int sy;
                if (quarterTurns == 1) {
                    sx = y;
                    sy = h - 1 - x;
                } else if (quarterTurns == 2) {
                    sx = w - 1 - x;
                    sy = h - 1 - y;
                } else {
                    sx = w - 1 - y;
                    sy = x;
                }
                dst[y * outW + x] = src[sy * w + sx];
            }
        }

        // 以 INT 型別保存 getRGB 的結果，確保像素值逐一對應、不經色彩空間換算
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage rotated = new BufferedImage(outW, outH, type);
        rotated.setRGB(0, 0, outW, outH, dst, 0, outW);
        return rotated;
    }

    private static BufferedImage rotateAffine(BufferedImage image, int angle) {
        double radians = Math.toRadians(angle);
        double sin = Math.abs(Math.sin(radians));
        double cos = Math.abs(Math.cos(radians));
        int w = image.getWidth();
        int h = image.getHeight();
        int outW = Math.max(1, (int) Math.ceil(w * cos + h * sin));
        int outH = Math.max(1, (int) Math.ceil(w * sin + h * cos));

        BufferedImage rotated = new BufferedImage(outW, outH, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = rotated.createGraphics();
        try {
            g2d.setColor(Color.WHITE);
            g2d.fillRect(0, 0, outW, outH);
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            AffineTransform transform = new AffineTransform();
            transform.translate(outW / 2.0, outH / 2.0);
            transform.rotate(radians);
            transform.translate(-w / 2.0, -h / 2.0);
            g2d.drawImage(image, transform, null);
        } finally {
            g2d.dispose();
        }
        return rotated;
    }

    // 保留 Alpha 通道；調色盤圖片改用 INT 型別，避免縮放後被量化回預設調色盤
    static int targetType(BufferedImage image) {
        int imageType = image.getType();
        if (imageType == BufferedImage.TYPE_CUSTOM
                || imageType == BufferedImage.TYPE_BYTE_INDEXED
                || imageType == BufferedImage.TYPE_BYTE_BINARY) {
            imageType = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }
        return imageType;
    }
}
