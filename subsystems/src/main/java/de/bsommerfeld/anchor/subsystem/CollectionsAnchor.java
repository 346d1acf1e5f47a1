package de.bsommerfeld.anchor.subsystem;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.inject.Singleton;
import de.bsommerfeld.anchor.core.sink.KeepAlive;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.PriorityQueue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Collection surface beyond the parametric containers: Guava immutable and
 * multi-valued collections, JDK ordered and concurrent maps, and a stream
 * pipeline with a grouping collector.
 */
@Singleton
public class CollectionsAnchor extends AbstractSubsystemAnchor {

    @Override
    public String name() {
        return "collections";
    }

    @Override
    protected List<EntryPoint> entryPoints() {
        return List.of(
                new EntryPoint("guava-immutable", CollectionsAnchor::immutableCollections),
                new EntryPoint("guava-multimap", CollectionsAnchor::multimap),
                new EntryPoint("jdk-concurrent", CollectionsAnchor::concurrentMaps),
                new EntryPoint("jdk-ordered", CollectionsAnchor::orderedCollections),
                new EntryPoint("stream-pipeline", CollectionsAnchor::streamPipeline));
    }

    private static void immutableCollections() {
        ImmutableList<String> list = ImmutableList.<String>builder().add("a", "b").build();
        ImmutableSet<Integer> set = ImmutableSet.of(1, 2, 3);
        ImmutableMap<String, Integer> map = ImmutableMap.of("a", 1, "b", 2);
        KeepAlive.accept(list.reverse(), set.asList());
        KeepAlive.accept(map.keySet().asList());
    }

    private static void multimap() {
        ListMultimap<String, Integer> multimap = ArrayListMultimap.create();
        multimap.put("even", 2);
        multimap.put("even", 4);
        multimap.put("odd", 1);
        KeepAlive.accept(multimap.asMap());
    }

    private static void concurrentMaps() {
        ConcurrentHashMap<String, Long> counts = new ConcurrentHashMap<>();
        counts.merge("key", 1L, Long::sum);
        ConcurrentSkipListMap<Integer, String> skipList = new ConcurrentSkipListMap<>();
        skipList.put(1, "one");
        KeepAlive.accept(counts, skipList.firstEntry());
    }

    private static void orderedCollections() {
        NavigableMap<String, Integer> tree = new TreeMap<>(Map.of("b", 2, "a", 1));
        Deque<Integer> deque = new ArrayDeque<>(List.of(1, 2, 3));
        PriorityQueue<Integer> heap = new PriorityQueue<>(List.of(3, 1, 2));
        KeepAlive.accept(tree.descendingMap(), deque.pollLast());
        KeepAlive.accept(heap.poll());
    }

    private static void streamPipeline() {
        Map<Integer, Long> buckets = IntStream.range(0, 16)
                .boxed()
                .collect(Collectors.groupingBy(i -> i % 4, Collectors.counting()));
        KeepAlive.accept(buckets);
    }
}
