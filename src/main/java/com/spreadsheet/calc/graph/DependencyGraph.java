package com.spreadsheet.calc.graph;

import com.spreadsheet.calc.exceptions.CircularReferenceException;
import com.spreadsheet.calc.models.CellAddress;

import java.util.*;

/**
 * Directed graph of cell references, kept as two address-keyed adjacency maps.
 * An edge A -> B means "the formula in B reads A":
 * - precedents: cell -> cells its formula reads
 * - dependents: cell -> cells whose formulas read it
 * Sorted maps and sets keep every traversal in row-major address order.
 */
public class DependencyGraph {

    private enum Color { WHITE, GREY, BLACK }

    private final Map<CellAddress, Set<CellAddress>> precedents = new TreeMap<>();
    private final Map<CellAddress, Set<CellAddress>> dependents = new TreeMap<>();

    /**
     * Replaces every outgoing "reads from" edge of {@code address} with {@code targets}.
     * If the new edges close a cycle the previous edges are restored and
     * a CircularReferenceException is thrown.
     */
    public void setEdges(CellAddress address, Set<CellAddress> targets) {
        Set<CellAddress> previous = replaceEdges(address, targets);
        if (hasCycleThrough(address)) {
            replaceEdges(address, previous);
            throw new CircularReferenceException(address,
                    "Circular reference: " + address + " depends on itself");
        }
    }

    /**
     * Removes all outgoing edges of the cell; dependents pointing at it are kept.
     */
    public void removeCell(CellAddress address) {
        replaceEdges(address, Collections.emptySet());
    }

    private Set<CellAddress> replaceEdges(CellAddress address, Set<CellAddress> targets) {
        Set<CellAddress> old = precedents.getOrDefault(address, Collections.emptySet());
        Set<CellAddress> updated = new TreeSet<>(targets);

        // Remove 'address' from the reverse adjacency of cells it no longer reads
        for (CellAddress t : old) {
            if (!updated.contains(t)) {
                Set<CellAddress> revSet = dependents.get(t);
                if (revSet != null) {
                    revSet.remove(address);
                    pruneIfIsolated(t);
                }
            }
        }
        for (CellAddress t : updated) {
            dependents.computeIfAbsent(t, k -> new TreeSet<>()).add(address);
        }

        if (updated.isEmpty()) {
            precedents.remove(address);
            pruneIfIsolated(address);
        } else {
            precedents.put(address, updated);
        }
        return old;
    }

    private void pruneIfIsolated(CellAddress address) {
        Set<CellAddress> revSet = dependents.get(address);
        if (revSet != null && revSet.isEmpty()) {
            dependents.remove(address);
        }
    }

    /**
     * Depth-first search over precedents starting at {@code address}.
     * Reaching a node that is still on the current path (GREY) means a cycle.
     */
    public boolean hasCycleThrough(CellAddress address) {
        Map<CellAddress, Color> colors = new HashMap<>();
        Deque<CellAddress> path = new ArrayDeque<>();
        Deque<Iterator<CellAddress>> pending = new ArrayDeque<>();

        colors.put(address, Color.GREY);
        path.push(address);
        pending.push(getPrecedents(address).iterator());

        while (!pending.isEmpty()) {
            Iterator<CellAddress> it = pending.peek();
            if (it.hasNext()) {
                CellAddress next = it.next();
                Color color = colors.getOrDefault(next, Color.WHITE);
                if (color == Color.GREY) {
                    return true;
                }
                if (color == Color.WHITE) {
                    colors.put(next, Color.GREY);
                    path.push(next);
                    pending.push(getPrecedents(next).iterator());
                }
            } else {
                pending.pop();
                colors.put(path.pop(), Color.BLACK);
            }
        }
        return false;
    }

    /**
     * Returns the seeds and everything that transitively reads them, ordered so
     * each address comes after all of its precedents in the result.
     * Computed as the reverse post-order of a depth-first walk over dependents.
     */
    public List<CellAddress> topologicalOrder(Set<CellAddress> seeds) {
        Set<CellAddress> visited = new HashSet<>();
        List<CellAddress> postOrder = new ArrayList<>();

        // Seeds are walked in reverse so the first seed ends up first in the result
        List<CellAddress> orderedSeeds = new ArrayList<>(new TreeSet<>(seeds));
        Collections.reverse(orderedSeeds);

        for (CellAddress seed : orderedSeeds) {
            if (!visited.add(seed)) {
                continue;
            }
            Deque<CellAddress> path = new ArrayDeque<>();
            Deque<Iterator<CellAddress>> pending = new ArrayDeque<>();
            path.push(seed);
            pending.push(descendingDependents(seed));

            while (!pending.isEmpty()) {
                Iterator<CellAddress> it = pending.peek();
                if (it.hasNext()) {
                    CellAddress next = it.next();
                    if (visited.add(next)) {
                        path.push(next);
                        pending.push(descendingDependents(next));
                    }
                } else {
                    pending.pop();
                    postOrder.add(path.pop());
                }
            }
        }
        Collections.reverse(postOrder);
        return postOrder;
    }

    // Visiting dependents in descending order makes the reversed result ascending among siblings
    private Iterator<CellAddress> descendingDependents(CellAddress address) {
        Set<CellAddress> set = dependents.get(address);
        if (set == null) {
            return Collections.emptyIterator();
        }
        return ((TreeSet<CellAddress>) set).descendingIterator();
    }

    public Set<CellAddress> getPrecedents(CellAddress address) {
        return Collections.unmodifiableSet(precedents.getOrDefault(address, Collections.emptySet()));
    }

    public Set<CellAddress> getDependents(CellAddress address) {
        return Collections.unmodifiableSet(dependents.getOrDefault(address, Collections.emptySet()));
    }

    // ------------------------
    // Views for inspection
    // ------------------------

    /**
     * "cell" -> cells its formula reads, for every formula cell and every referenced cell.
     */
    public Map<String, Set<String>> getForwardGraph() {
        return snapshot(precedents, dependents.keySet());
    }

    /**
     * "cell" -> cells that read it, for every referenced cell and every formula cell.
     */
    public Map<String, Set<String>> getReverseGraph() {
        return snapshot(dependents, precedents.keySet());
    }

    private static Map<String, Set<String>> snapshot(Map<CellAddress, Set<CellAddress>> adjacency,
                                                     Set<CellAddress> otherNodes) {
        Map<CellAddress, Set<String>> sorted = new TreeMap<>();
        for (Map.Entry<CellAddress, Set<CellAddress>> e : adjacency.entrySet()) {
            Set<String> targets = new LinkedHashSet<>();
            for (CellAddress t : e.getValue()) {
                targets.add(t.toString());
            }
            sorted.put(e.getKey(), targets);
        }
        for (CellAddress node : otherNodes) {
            sorted.putIfAbsent(node, new LinkedHashSet<>());
        }
        Map<String, Set<String>> result = new LinkedHashMap<>();
        sorted.forEach((k, v) -> result.put(k.toString(), v));
        return result;
    }
}
