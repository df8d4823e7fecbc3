package io.github.eutro.llair.test;

import io.github.eutro.llair.util.GraphWalker;
import io.github.eutro.llair.util.Lazy;
import io.github.eutro.llair.util.Pair;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class UtilTest {
    @Test
    void lazyForcesOnce() {
        int[] calls = {0};
        Lazy<String> lazy = Lazy.lazy(() -> {
            calls[0]++;
            return "value";
        });
        assertFalse(lazy.isForced());
        assertEquals("<lazy>", lazy.toString());
        assertEquals("value", lazy.get());
        assertEquals("value", lazy.get());
        assertEquals(1, calls[0]);
        assertTrue(lazy.isForced());

        Lazy<String> patched = Lazy.lazy(() -> {
            throw new AssertionError("never forced");
        });
        patched.set("patched");
        assertEquals("patched", patched.get());
        assertEquals("x", Lazy.of("x").get());
    }

    @Test
    void pairs() {
        assertEquals(Pair.of(1, "a"), Pair.of(1, "a"));
        assertNotEquals(Pair.of(1, "a"), Pair.of(1, "b"));
        assertEquals("(1, a)", Pair.of(1, "a").toString());
    }

    private static GraphWalker<Integer> walker(Map<Integer, List<Integer>> graph, int root) {
        return new GraphWalker<>(root, n -> graph.getOrDefault(n, Collections.emptyList()));
    }

    @Test
    void postOrderVisitsChildrenFirst() {
        Map<Integer, List<Integer>> graph = new HashMap<>();
        graph.put(1, Arrays.asList(2, 3));
        graph.put(2, Collections.singletonList(4));
        graph.put(3, Collections.singletonList(4));
        assertEquals(Arrays.asList(4, 2, 3, 1), walker(graph, 1).postOrder().toList());
    }

    @Test
    void walksTerminateOnCycles() {
        Map<Integer, List<Integer>> graph = new HashMap<>();
        graph.put(1, Collections.singletonList(2));
        graph.put(2, Arrays.asList(1, 3));
        List<Integer> pre = walker(graph, 1).preOrder().toList();
        assertEquals(3, pre.size());
        assertEquals(1, (int) pre.get(0));
        assertEquals(Arrays.asList(3, 2, 1), walker(graph, 1).postOrder().toList());
    }
}
