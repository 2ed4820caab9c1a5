package work.pollochang.dedup.image.group;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicIntegerArray;

/**
 * 以索引為元素的併查集。
 *
 * <p>只能由單一執行緒 (擁有者) 呼叫 {@link #union(int, int)}；
 * {@link #find(int)} 不做路徑壓縮寫入，任何執行緒都可以呼叫，用來略過已在同一集合的配對。
 * 其他執行緒看到的可能是稍舊的狀態，但只會讓它多比對一次，不會造成錯誤。</p>
 */
public class DisjointSet {

    private final AtomicIntegerArray parent;
    private final int[] rank;

    public DisjointSet(int size) {
        parent = new AtomicIntegerArray(size);
        rank = new int[size];
        for (int i = 0; i < size; i++) {
            parent.set(i, i);
        }
    }

    public int size() {
        return parent.length();
    }

    /**
     * 查詢代表元素 (唯讀)。
     */
    public int find(int x) {
        int root = x;
        int next;
        while ((next = parent.get(root)) != root) {
            root = next;
        }
        return root;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    /**
     * 合併兩個集合，僅限擁有者執行緒呼叫。
     * @return 兩者原本不在同一集合時為 {@code true}
     */
    public boolean union(int a, int b) {
        int rootA = compress(a);
        int rootB = compress(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            int tmp = rootA;
            rootA = rootB;
            rootB = tmp;
        }
        parent.set(rootB, rootA);
        if (rank[rootA] == rank[rootB]) {
            rank[rootA]++;
        }
        return true;
    }

    // 路徑壓縮只在擁有者執行緒進行，每次寫入都仍指向同一集合內的祖先
    private int compress(int x) {
        int root = find(x);
        int current = x;
        while (current != root) {
            int next = parent.get(current);
            parent.set(current, root);
            current = next;
        }
        return root;
    }

    /**
     * @return 代表元素 → 成員索引 (遞增排序)，只包含大小至少為 {@code minSize} 的集合
     */
    public Map<Integer, List<Integer>> components(int minSize) {
        Map<Integer, List<Integer>> all = new LinkedHashMap<>();
        for (int i = 0; i < size(); i++) {
            all.computeIfAbsent(find(i), k -> new ArrayList<>()).add(i);
        }
        all.values().removeIf(members -> members.size() < minSize);
        return all;
    }
}
