package work.pollochang.dedup.image.core;

import java.awt.image.BufferedImage;

/**
 * 將彩色圖片轉為亮度並以面積平均法縮小到雜湊網格。
 *
 * <p>亮度採用 ITU-R 601：{@code L = 0.299 R + 0.587 G + 0.114 B}，忽略 Alpha。
 * 縮小時每個輸出格子取其覆蓋範圍內像素的加權平均 (含部分覆蓋)，
 * 結果只取決於像素值，與 Java2D 的繪圖提示無關。</p>
 */
final class LuminanceSampler {

    private LuminanceSampler() {}

    /**
     * @param image 來源圖片
     * @param outWidth 輸出寬度
     * @param outHeight 輸出高度
     * @return [outHeight][outWidth] 的亮度矩陣
     */
    static double[][] sample(BufferedImage image, int outWidth, int outHeight) {
        int width = image.getWidth();
        int height = image.getHeight();

        // 先逐列做水平縮小，避免整張圖的亮度矩陣佔用大量記憶體
        Coverage horizontal = Coverage.of(width, outWidth);
        double[][] rows = new double[height][];
        int[] rgbRow = new int[width];
        double[] lumRow = new double[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, rgbRow, 0, width);
            for (int x = 0; x < width; x++) {
                lumRow[x] = luminance(rgbRow[x]);
            }
            rows[y] = horizontal.apply(lumRow);
        }

        Coverage vertical = Coverage.of(height, outHeight);
        double[][] result = new double[outHeight][outWidth];
        double[] column = new double[height];
        for (int x = 0; x < outWidth; x++) {
            for (int y = 0; y < height; y++) {
                column[y] = rows[y][x];
            }
            double[] reduced = vertical.apply(column);
            for (int y = 0; y < outHeight; y++) {
                result[y][x] = reduced[y];
            }
        }
        return result;
    }

    static double luminance(int argb) {
        int r = (argb >> 16) & 0xff;
        int g = (argb >> 8) & 0xff;
        int b = argb & 0xff;
        return 0.299 * r + 0.587 * g + 0.114 * b;
    }

    /**
     * 一維面積平均的權重表。
     */
    private static final class Coverage {
        private final int[] firstIndex;
        private final double[][] weights;

        private Coverage(int[] firstIndex, double[][] weights) {
            this.firstIndex = firstIndex;
            this.weights = weights;
        }

        static Coverage of(int srcLen, int outLen) {
            int[] firstIndex = new int[outLen];
            double[][] weights = new double[outLen][];
            double step = (double) srcLen / outLen;
            for (int i = 0; i < outLen; i++) {
                double start = i * step;
                double end = (i + 1) * step;
                int first = (int) Math.floor(start);
                int last = Math.min(srcLen - 1, (int) Math.ceil(end) - 1);
                double[] w = new double[last - first + 1];
                double total = 0;
                for (int s = first; s <= last; s++) {
                    double overlap = Math.min(end, s + 1) - Math.max(start, s);
                    w[s - first] = Math.max(0, overlap);
                    total += w[s - first];
                }
                for (int k = 0; k < w.length; k++) {
                    w[k] /= total;
                }
                firstIndex[i] = first;
                weights[i] = w;
            }
            return new Coverage(firstIndex, weights);
        }

        double[] apply(double[] line) {
            double[] out = new double[weights.length];
            for (int i = 0; i < weights.length; i++) {
                double sum = 0;
                double[] w = weights[i];
                int first = firstIndex[i];
                for (int k = 0; k < w.length; k++) {
                    sum += line[first + k] * w[k];
                }
                out[i] = sum;
            }
            return out;
        }
    }
}
