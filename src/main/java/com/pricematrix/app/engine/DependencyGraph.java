package com.pricematrix.app.engine;

import com.pricematrix.app.models.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Precedent/dependent edges between cells of one matrix, keyed by address.
 * The two adjacency maps are exact inverses of each other and the committed edges
 * never form a cycle. A formula whose edges would close a cycle is remembered in a
 * separate "rejected" map and contributes no edges until it can be re-admitted.
 * Not thread-safe; callers hold the matrix write lock.
 */
public class DependencyGraph {

    // Precedents: "formula cell" -> cells it reads
    private final Map<CellAddress, Set<CellAddress>> precedents = new HashMap<>();
    // Dependents: "read cell" -> formula cells that read it
    private final Map<CellAddress, Set<CellAddress>> dependents = new HashMap<>();
    // Formula cells stored as #CIRC!, with the precedents they asked for
    private final Map<CellAddress, Set<CellAddress>> rejected = new HashMap<>();

    /**
     * Replaces the precedents of a cell. Old edges are removed first; the new edges are
     * committed only if they keep the graph acyclic.
     *
     * @return false when the new edges would create a cycle (nothing is committed)
     */
    public boolean setPrecedents(CellAddress cell, Set<CellAddress> newPrecedents) {
        clearPrecedents(cell);
        if (newPrecedents.isEmpty()) {
            return true;
        }
        if (wouldCreateCycle(cell, newPrecedents)) {
            rejected.put(cell, new HashSet<>(newPrecedents));
            return false;
        }
        commit(cell, newPrecedents);
        return true;
    }

    /**
     * Removes every edge from 'cell' to what it reads, and forgets a rejected formula.
     * Edges from other cells that read 'cell' stay.
     */
    public void clearPrecedents(CellAddress cell) {
        rejected.remove(cell);
        Set<CellAddress> old = precedents.remove(cell);
        if (old == null) {
            return;
        }
        for (CellAddress target : old) {
            Set<CellAddress> readers = dependents.get(target);
            if (readers != null) {
                readers.remove(cell);
                if (readers.isEmpty()) {
                    dependents.remove(target);
                }
            }
        }
    }

    private void commit(CellAddress cell, Set<CellAddress> newPrecedents) {
        precedents.put(cell, new HashSet<>(newPrecedents));
        for (CellAddress target : newPrecedents) {
            dependents.computeIfAbsent(target, k -> new HashSet<>()).add(cell);
        }
    }

    /**
     * A cycle appears iff 'cell' reads itself or one of the new precedents already
     * (transitively) depends on 'cell'. Breadth-first over dependents; each node is
     * visited at most once.
     */
    boolean wouldCreateCycle(CellAddress cell, Set<CellAddress> newPrecedents) {
        if (newPrecedents.contains(cell)) {
            return true;
        }
        Set<CellAddress> visited = new HashSet<>();
        Deque<CellAddress> queue = new ArrayDeque<>();
        queue.add(cell);
        visited.add(cell);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress reader : dependents.getOrDefault(current, Collections.emptySet())) {
                if (newPrecedents.contains(reader)) {
                    return true;
                }
                if (visited.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        return false;
    }

    /**
     * Retries every rejected formula in row-major order and commits those that no longer
     * close a cycle.
     *
     * @return the re-admitted cells
     */
    public List<CellAddress> readmitRejected() {
        return readmitRejected(Collections.emptySet());
    }

    /**
     * Same as {@link #readmitRejected()}, but the cells in 'retryLast' are retried only
     * after all other rejected cells, so where two of them compete for one cycle the
     * cell outside 'retryLast' wins.
     */
    public List<CellAddress> readmitRejected(Set<CellAddress> retryLast) {
        List<CellAddress> candidates = new ArrayList<>();
        List<CellAddress> deferred = new ArrayList<>();
        for (CellAddress cell : new TreeSet<>(rejected.keySet())) {
            (retryLast.contains(cell) ? deferred : candidates).add(cell);
        }
        candidates.addAll(deferred);

        List<CellAddress> readmitted = new ArrayList<>();
        for (CellAddress cell : candidates) {
            Set<CellAddress> wanted = rejected.get(cell);
            if (!wouldCreateCycle(cell, wanted)) {
                rejected.remove(cell);
                commit(cell, wanted);
                readmitted.add(cell);
            }
        }
        return readmitted;
    }

    /**
     * Moves an accepted formula back to the rejected map, keeping the precedents it asked for.
     *
     * @return false if the cell has no committed edges
     */
    public boolean demote(CellAddress cell) {
        Set<CellAddress> wanted = precedents.get(cell);
        if (wanted == null) {
            return false;
        }
        clearPrecedents(cell);
        rejected.put(cell, new HashSet<>(wanted));
        return true;
    }

    public boolean isRejected(CellAddress cell) {
        return rejected.containsKey(cell);
    }

    public Set<CellAddress> getRejected() {
        return Collections.unmodifiableSet(new TreeSet<>(rejected.keySet()));
    }

    public Set<CellAddress> getPrecedents(CellAddress cell) {
        return Collections.unmodifiableSet(precedents.getOrDefault(cell, Collections.emptySet()));
    }

    public Set<CellAddress> getDependents(CellAddress cell) {
        return Collections.unmodifiableSet(dependents.getOrDefault(cell, Collections.emptySet()));
    }

    /**
     * The start cells plus everything that transitively reads any of them.
     */
    public Set<CellAddress> dependentClosure(Collection<CellAddress> starts) {
        Set<CellAddress> closure = new HashSet<>(starts);
        Deque<CellAddress> queue = new ArrayDeque<>(starts);
        while (!queue.isEmpty()) {
            CellAddress current = queue.poll();
            for (CellAddress reader : dependents.getOrDefault(current, Collections.emptySet())) {
                if (closure.add(reader)) {
                    queue.add(reader);
                }
            }
        }
        return closure;
    }

    /**
     * Kahn's algorithm restricted to 'subset': each cell comes after all of its precedents
     * that are also in the subset. Ties are broken row-major so the order is deterministic.
     */
    public List<CellAddress> topologicalOrder(Set<CellAddress> subset) {
        Map<CellAddress, Integer> inDegree = new HashMap<>();
        for (CellAddress cell : subset) {
            int degree = 0;
            for (CellAddress p : precedents.getOrDefault(cell, Collections.emptySet())) {
                if (subset.contains(p)) {
                    degree++;
                }
            }
            inDegree.put(cell, degree);
        }
        PriorityQueue<CellAddress> ready = new PriorityQueue<>();
        for (Map.Entry<CellAddress, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }
        List<CellAddress> order = new ArrayList<>(subset.size());
        while (!ready.isEmpty()) {
            CellAddress cell = ready.poll();
            order.add(cell);
            for (CellAddress reader : dependents.getOrDefault(cell, Collections.emptySet())) {
                Integer degree = inDegree.get(reader);
                if (degree != null) {
                    inDegree.put(reader, degree - 1);
                    if (degree - 1 == 0) {
                        ready.add(reader);
                    }
                }
            }
        }
        if (order.size() != subset.size()) {
            throw new IllegalStateException("Committed dependency edges contain a cycle");
        }
        return order;
    }

    public void clear() {
        precedents.clear();
        dependents.clear();
        rejected.clear();
    }

    /**
     * True when the two adjacency maps mirror each other exactly.
     */
    public boolean isConsistent() {
        int forwardEdges = 0;
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : precedents.entrySet()) {
            for (CellAddress target : entry.getValue()) {
                forwardEdges++;
                if (!dependents.getOrDefault(target, Collections.emptySet()).contains(entry.getKey())) {
                    return false;
                }
            }
        }
        int reverseEdges = 0;
        for (Set<CellAddress> readers : dependents.values()) {
            reverseEdges += readers.size();
        }
        return forwardEdges == reverseEdges;
    }

    /**
     * Precedents in A1 notation: formula cell -> sorted cells it reads.
     */
    public Map<String, List<String>> forwardView() {
        return toA1View(precedents);
    }

    /**
     * Dependents in A1 notation: cell -> sorted formula cells that read it.
     */
    public Map<String, List<String>> reverseView() {
        return toA1View(dependents);
    }

    private static Map<String, List<String>> toA1View(Map<CellAddress, Set<CellAddress>> adjacency) {
        Map<CellAddress, Set<CellAddress>> sorted = new TreeMap<>(adjacency);
        Map<String, List<String>> view = new LinkedHashMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> entry : sorted.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (CellAddress target : new TreeSet<>(entry.getValue())) {
                targets.add(target.toA1());
            }
            view.put(entry.getKey().toA1(), targets);
        }
        return view;
    }
}
