package work.pollochang.dedup.image.core;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * 程序內的雜湊原語參考實作，純 Java 計算，不依賴任何原生函式庫。
 *
 * <p>其他實作必須與本類別逐位元一致，{@link HashPrimitiveSelector} 會以此為基準校驗。</p>
 */
public final class JavaHashPrimitives implements HashPrimitives {

    public static final String NAME = "java";

    /** 純色判定最多取樣的網格邊長 */
    static final int UNIFORM_SAMPLE_GRID = 32;

    /** 小於此邊長的圖片一律視為純色 */
    static final int UNIFORM_MIN_DIMENSION = 10;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public HashValue dHash(BufferedImage image, int size) {
        requireImage(image);
        requireSize(size, MAX_GRADIENT_HASH_SIZE, "dHash");

        double[][] grid = LuminanceSampler.sample(image, size + 1, size);
        boolean[] bits = new boolean[size * size];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                bits[row * size + col] = grid[row][col] > grid[row][col + 1];
            }
        }
        return HashValue.fromBits(bits);
    }

    @Override
    public HashValue pHash(BufferedImage image, int size) {
        requireImage(image);
        requireSize(size, MAX_DCT_HASH_SIZE, "pHash");

        int n = size * 4;
        double[][] grid = LuminanceSampler.sample(image, n, n);
        double[][] dct = lowFrequencyDct(grid, n, size);

        double total = 0;
        for (int u = 0; u < size; u++) {
            for (int v = 0; v < size; v++) {
                total += dct[u][v];
            }
        }
        // 直流分量與其他係數差距極大，不納入平均
        total -= dct[0][0];
        int count = size * size - 1;
        double mean = count > 0 ? total / count : 0;

        boolean[] bits = new boolean[size * size];
        for (int u = 0; u < size; u++) {
            for (int v = 0; v < size; v++) {
                bits[u * size + v] = dct[u][v] > mean;
            }
        }
        return HashValue.fromBits(bits);
    }

    @Override
    public HashValue aHash(BufferedImage image, int size) {
        requireImage(image);
        requireSize(size, MAX_GRADIENT_HASH_SIZE, "aHash");

        double[][] grid = LuminanceSampler.sample(image, size, size);
        double sum = 0;
        for (double[] row : grid) {
            for (double v : row) {
                sum += v;
            }
        }
        double mean = sum / (size * size);

        boolean[] bits = new boolean[size * size];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                bits[row * size + col] = grid[row][col] > mean;
            }
        }
        return HashValue.fromBits(bits);
    }

    @Override
    public boolean isUniformColor(BufferedImage image, double threshold) {
        requireImage(image);
        int width = image.getWidth();
        int height = image.getHeight();
        if (width < UNIFORM_MIN_DIMENSION || height < UNIFORM_MIN_DIMENSION) {
            return true;
        }

        int gridX = Math.min(UNIFORM_SAMPLE_GRID, width);
        int gridY = Math.min(UNIFORM_SAMPLE_GRID, height);
        int samples = gridX * gridY;
        double[] sum = new double[3];
        double[] sumSq = new double[3];
        for (int gy = 0; gy < gridY; gy++) {
            int y = (int) ((gy + 0.5) * height / gridY);
            for (int gx = 0; gx < gridX; gx++) {
                int x = (int) ((gx + 0.5) * width / gridX);
                int rgb = image.getRGB(x, y);
                int[] channels = {(rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff};
                for (int c = 0; c < 3; c++) {
                    sum[c] += channels[c];
                    sumSq[c] += (double) channels[c] * channels[c];
                }
            }
        }

        for (int c = 0; c < 3; c++) {
            double mean = sum[c] / samples;
            double variance = Math.max(0, sumSq[c] / samples - mean * mean);
            if (Math.sqrt(variance) >= threshold) {
                return false;
            }
        }
        return true;
    }

    /**
     * 可分離的 DCT-II (正交正規化)，只計算前 {@code keep} x {@code keep} 個低頻係數。
     */
    private static double[][] lowFrequencyDct(double[][] grid, int n, int keep) {
        double[][] cosines = new double[keep][n];
        for (int k = 0; k < keep; k++) {
            for (int i = 0; i < n; i++) {
                cosines[k][i] = Math.cos(((2 * i + 1) * k * Math.PI) / (2.0 * n));
            }
        }
        double dcScale = Math.sqrt(1.0 / n);
        double acScale = Math.sqrt(2.0 / n);

        // 先沿列方向轉換
        double[][] rowPass = new double[n][keep];
        for (int y = 0; y < n; y++) {
            for (int v = 0; v < keep; v++) {
                double s = 0;
                for (int x = 0; x < n; x++) {
                    s += grid[y][x] * cosines[v][x];
                }
                rowPass[y][v] = s * (v == 0 ? dcScale : acScale);
            }
        }

        double[][] result = new double[keep][keep];
        for (int u = 0; u < keep; u++) {
            for (int v = 0; v < keep; v++) {
                double s = 0;
                for (int y = 0; y < n; y++) {
                    s += rowPass[y][v] * cosines[u][y];
                }
                result[u][v] = s * (u == 0 ? dcScale : acScale);
            }
        }
        return result;
    }

    private static void requireImage(BufferedImage image) {
        Objects.requireNonNull(image, "image must not be null");
    }

    private static void requireSize(int size, int max, String algorithm) {
        if (size <= 0 || size > max) {
            throw new InvalidParameterException(algorithm + " 雜湊大小必須介於 1 與 " + max + " 之間: " + size);
        }
    }
}
