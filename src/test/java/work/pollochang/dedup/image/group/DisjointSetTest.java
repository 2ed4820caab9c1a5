package work.pollochang.dedup.image.group;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DisjointSetTest {

    @Test
    void testUnion_ShouldBeTransitive() {
        DisjointSet sets = new DisjointSet(5);
        assertTrue(sets.union(0, 1));
        assertTrue(sets.union(1, 2));
        assertFalse(sets.union(0, 2));

        assertTrue(sets.connected(0, 2));
        assertFalse(sets.connected(0, 3));
        assertEquals(sets.find(2), sets.find(0));
    }

    /**
     * 只回傳大小符合條件的集合，成員依索引排序且互不重疊
     */
    @Test
    void testComponents_ShouldPartitionElements() {
        DisjointSet sets = new DisjointSet(7);
        sets.union(4, 0);
        sets.union(6, 4);
        sets.union(2, 5);

        Map<Integer, List<Integer>> components = sets.components(2);
        assertEquals(2, components.size());
        assertTrue(components.containsValue(List.of(0, 4, 6)));
        assertTrue(components.containsValue(List.of(2, 5)));
        assertEquals(7, sets.components(1).values().stream().mapToInt(List::size).sum());
    }

    /**
     * 長鏈合併後查詢仍正確
     */
    @Test
    void testLongChain_ShouldResolveToSingleRoot() {
        DisjointSet sets = new DisjointSet(1000);
        for (int i = 1; i < 1000; i++) {
            sets.union(i - 1, i);
        }
        int root = sets.find(0);
        for (int i = 0; i < 1000; i++) {
            assertEquals(root, sets.find(i));
        }
        assertEquals(1, sets.components(2).size());
    }

    /**
     * 其他執行緒在擁有者合併期間查詢，不會出錯也不會無窮迴圈
     */
    @Test
    void testConcurrentFind_ShouldTerminate() throws InterruptedException {
        DisjointSet sets = new DisjointSet(2000);
        Thread reader = new Thread(() -> {
            for (int round = 0; round < 50; round++) {
                for (int i = 0; i < sets.size(); i++) {
                    int root = sets.find(i);
                    assertTrue(root >= 0 && root < sets.size());
                }
            }
        });
        reader.start();
        for (int i = 1; i < 2000; i++) {
            sets.union(i, i / 2);
        }
        reader.join(10_000);
        assertFalse(reader.isAlive());
        assertEquals(1, sets.components(2).size());
    }
}
