/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Tessella.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.tessella.tiles.spatial;

import com.hellblazer.tessella.common.IntArrayList;
import com.hellblazer.tessella.geometry.Pixel;
import com.hellblazer.tessella.geometry.Rectangle;
import com.hellblazer.tessella.tiles.spatial.entity.EntityID;
import com.hellblazer.tessella.tiles.spatial.entity.EntityIDGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Region quadtree for broad-phase queries over moving entities.
 * <p>
 * Nodes live in a flat arena and refer to each other by index. The four children of an internal node occupy a
 * contiguous block of slots starting at its first child index, in quadrant order (lower left, lower right, upper
 * left, upper right). A node is a leaf iff it holds an entity list. Blocks released by merges are kept on a free-list
 * and reused by later splits.
 * <p>
 * A leaf splits when an insertion takes it over capacity, unless it is at the maximum depth. After a removal, four
 * sibling leaves whose combined population drops below the merge threshold collapse into their parent, cascading
 * upward.
 * <p>
 * Entities are inserted under a caller supplied identifier or under one drawn from the index's
 * {@link EntityIDGenerator}; caller supplied identifiers are reserved with the generator so the two never collide.
 * <p>
 * Thread Safety: not thread safe. Callers serialize mutations against queries.
 *
 * @param <ID> the entity identifier type
 * @author hal.hildebrand
 */
public class Quadtree<ID extends EntityID> {
    public static final int DEFAULT_CAPACITY        = 10;
    public static final int DEFAULT_MAX_DEPTH       = 16;
    public static final int DEFAULT_MERGE_THRESHOLD = 5;

    private static final Logger log  = LoggerFactory.getLogger(Quadtree.class);
    private static final int    ROOT = 0;

    private final Rectangle                bounds;
    private final int                      capacity;
    private final IntArrayList             freeBlocks = new IntArrayList();
    private final EntityIDGenerator<ID>    idGenerator;
    private final int                      maxDepth;
    private final int                      mergeThreshold;
    private final List<Node<ID>>           nodes      = new ArrayList<>();
    private final Map<ID, Placement>       placements = new HashMap<>();

    public Quadtree(EntityIDGenerator<ID> idGenerator, Rectangle bounds) {
        this(idGenerator, bounds, DEFAULT_CAPACITY, DEFAULT_MERGE_THRESHOLD, DEFAULT_MAX_DEPTH);
    }

    /**
     * @param capacity       entities a leaf may hold before it splits
     * @param mergeThreshold four sibling leaves holding fewer entities than this merge into their parent; at most
     *                       {@code capacity}
     * @param maxDepth       depth below which leaves no longer split
     */
    public Quadtree(EntityIDGenerator<ID> idGenerator, Rectangle bounds, int capacity, int mergeThreshold,
                    int maxDepth) {
        if (idGenerator == null || bounds == null) {
            throw new IllegalArgumentException("Identifier generator and bounds must not be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        if (mergeThreshold < 0 || mergeThreshold > capacity) {
            throw new IllegalArgumentException("Merge threshold must be within [0, capacity]: " + mergeThreshold);
        }
        if (maxDepth < 0 || maxDepth > DEFAULT_MAX_DEPTH) {
            throw new IllegalArgumentException("Max depth must be within [0, " + DEFAULT_MAX_DEPTH + "]: " + maxDepth);
        }
        this.idGenerator = idGenerator;
        this.bounds = bounds;
        this.capacity = capacity;
        this.mergeThreshold = mergeThreshold;
        this.maxDepth = maxDepth;
        nodes.add(Node.leaf(bounds, 0, -1));
    }

    public Rectangle bounds() {
        return bounds;
    }

    /**
     * Verify the structural invariants, for tests and debugging.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void checkInvariants() {
        int found = 0;
        var stack = new IntArrayList();
        stack.push(ROOT);
        while (!stack.isEmpty()) {
            int index = stack.pop();
            var node = nodes.get(index);
            if (node.free) {
                throw new IllegalStateException("Reachable node " + index + " is on the free-list");
            }
            if (node.isLeaf()) {
                for (var id : node.entities) {
                    var placement = placements.get(id);
                    if (placement == null || placement.leaf() != index) {
                        throw new IllegalStateException(id + " is stored in leaf " + index + " but placed at "
                                                        + placement);
                    }
                    if (!node.bounds.contains(placement.position())) {
                        throw new IllegalStateException(id + " at " + placement.position() + " outside " + node.bounds);
                    }
                }
                found += node.entities.size();
            } else {
                for (int q = 0; q < 4; q++) {
                    var child = nodes.get(node.firstChild + q);
                    if (child.parent != index || !child.bounds.equals(node.bounds.quadrant(q))) {
                        throw new IllegalStateException(
                        "Child " + (node.firstChild + q) + " does not partition " + index);
                    }
                    stack.push(node.firstChild + q);
                }
            }
        }
        if (found != placements.size()) {
            throw new IllegalStateException("Leaves hold " + found + " entities, index tracks " + placements.size());
        }
    }

    /**
     * Remove every entity and collapse the tree to a single root leaf.
     */
    public void clear() {
        nodes.clear();
        freeBlocks.clear();
        placements.clear();
        nodes.add(Node.leaf(bounds, 0, -1));
    }

    public boolean contains(ID id) {
        return placements.containsKey(id);
    }

    public Set<ID> entities() {
        return Collections.unmodifiableSet(placements.keySet());
    }

    /**
     * @throws IllegalArgumentException if the id is already present or the position is outside the bounds
     */
    public void insert(ID id, Pixel position) {
        if (id == null || position == null) {
            throw new IllegalArgumentException("Entity id and position must not be null");
        }
        if (placements.containsKey(id)) {
            throw new IllegalArgumentException("Entity already present: " + id.toDebugString());
        }
        checkBounds(position);
        idGenerator.reserve(id);
        place(id, position);
    }

    /**
     * Insert a new entity under a generated identifier.
     *
     * @return the identifier assigned
     * @throws IllegalArgumentException if the position is outside the bounds
     */
    public ID insert(Pixel position) {
        if (position == null) {
            throw new IllegalArgumentException("Position must not be null");
        }
        checkBounds(position);
        ID id;
        do {
            id = idGenerator.generateID();
        } while (placements.containsKey(id));
        place(id, position);
        return id;
    }

    /**
     * The k entities nearest to the point, closest first.
     */
    public List<ID> kNearest(Pixel point, int k) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }
        var pending = new PriorityQueue<NodeDistance>(Comparator.comparingDouble(NodeDistance::distanceSquared));
        // Max heap of the best candidates so far, farthest on top
        var candidates = new PriorityQueue<Candidate<ID>>(
        Comparator.<Candidate<ID>>comparingDouble(Candidate::distanceSquared).reversed());
        pending.add(new NodeDistance(ROOT, nodes.get(ROOT).bounds.distanceSquaredTo(point)));
        while (!pending.isEmpty()) {
            var next = pending.poll();
            if (candidates.size() == k && next.distanceSquared() > candidates.peek().distanceSquared()) {
                break;
            }
            var node = nodes.get(next.index());
            if (node.isLeaf()) {
                for (var id : node.entities) {
                    double d = placements.get(id).position().distanceSquared(point);
                    if (candidates.size() < k) {
                        candidates.add(new Candidate<>(id, d));
                    } else if (d < candidates.peek().distanceSquared()) {
                        candidates.poll();
                        candidates.add(new Candidate<>(id, d));
                    }
                }
            } else {
                for (int q = 0; q < 4; q++) {
                    int child = node.firstChild + q;
                    pending.add(new NodeDistance(child, nodes.get(child).bounds.distanceSquaredTo(point)));
                }
            }
        }
        var sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingDouble(Candidate::distanceSquared));
        var result = new ArrayList<ID>(sorted.size());
        sorted.forEach(c -> result.add(c.id()));
        return result;
    }

    /**
     * Arena slots currently in use, including the root.
     */
    public int nodeCount() {
        return nodes.size() - 4 * freeBlocks.size();
    }

    public Optional<Pixel> positionOf(ID id) {
        var placement = placements.get(id);
        return placement == null ? Optional.empty() : Optional.of(placement.position());
    }

    /**
     * Entities within the radius of the center, boundary inclusive.
     */
    public List<ID> queryCircle(Pixel center, double radius) {
        if (radius < 0) {
            throw new IllegalArgumentException("Radius must be non-negative");
        }
        double radiusSquared = radius * radius;
        var result = new ArrayList<ID>();
        var stack = new IntArrayList();
        stack.push(ROOT);
        while (!stack.isEmpty()) {
            var node = nodes.get(stack.pop());
            if (!node.bounds.intersectsCircle(center, radius)) {
                continue;
            }
            if (node.isLeaf()) {
                for (var id : node.entities) {
                    var p = placements.get(id).position();
                    // bounding box first, exact distance second
                    if (Math.abs(p.x() - center.x()) <= radius && Math.abs(p.y() - center.y()) <= radius
                    && p.distanceSquared(center) <= radiusSquared) {
                        result.add(id);
                    }
                }
            } else {
                pushChildren(node, stack);
            }
        }
        return result;
    }

    /**
     * Entities whose position lies inside the region, edges inclusive.
     */
    public List<ID> queryRectangle(Rectangle region) {
        var result = new ArrayList<ID>();
        var stack = new IntArrayList();
        stack.push(ROOT);
        while (!stack.isEmpty()) {
            var node = nodes.get(stack.pop());
            if (!node.bounds.intersects(region)) {
                continue;
            }
            if (node.isLeaf()) {
                for (var id : node.entities) {
                    if (region.containsInclusive(placements.get(id).position())) {
                        result.add(id);
                    }
                }
            } else {
                pushChildren(node, stack);
            }
        }
        return result;
    }

    /**
     * @return false if the entity was not present
     */
    public boolean remove(ID id) {
        var placement = placements.remove(id);
        if (placement == null) {
            return false;
        }
        var leaf = nodes.get(placement.leaf());
        leaf.entities.remove(id);
        mergeUpward(leaf.parent);
        return true;
    }

    public int size() {
        return placements.size();
    }

    public QuadtreeStats stats() {
        int leaves = 0;
        int internal = 0;
        int empty = 0;
        int depth = 0;
        int maxPerLeaf = 0;
        var stack = new IntArrayList();
        stack.push(ROOT);
        while (!stack.isEmpty()) {
            var node = nodes.get(stack.pop());
            depth = Math.max(depth, node.depth);
            if (node.isLeaf()) {
                leaves++;
                if (node.entities.isEmpty()) {
                    empty++;
                }
                maxPerLeaf = Math.max(maxPerLeaf, node.entities.size());
            } else {
                internal++;
                pushChildren(node, stack);
            }
        }
        int entities = placements.size();
        return new QuadtreeStats(leaves + internal, leaves, internal, empty, depth, entities, maxPerLeaf,
                                 (double) entities / leaves, (double) entities / ((double) leaves * capacity));
    }

    @Override
    public String toString() {
        return "Quadtree[" + bounds + ", entities=" + placements.size() + ", nodes=" + nodeCount() + "]";
    }

    /**
     * Move an entity. Stays in place when the new position is still inside the entity's leaf.
     *
     * @throws IllegalArgumentException if the entity is unknown or the position is outside the bounds
     */
    public void update(ID id, Pixel position) {
        var placement = placements.get(id);
        if (placement == null) {
            throw new IllegalArgumentException("Unknown entity: " + (id == null ? null : id.toDebugString()));
        }
        checkBounds(position);
        var leaf = nodes.get(placement.leaf());
        if (leaf.bounds.contains(position)) {
            placements.put(id, new Placement(position, placement.leaf()));
            return;
        }
        remove(id);
        place(id, position);
    }

    private int allocateBlock() {
        if (!freeBlocks.isEmpty()) {
            return freeBlocks.pop();
        }
        int first = nodes.size();
        for (int i = 0; i < 4; i++) {
            nodes.add(null);
        }
        return first;
    }

    private void checkBounds(Pixel position) {
        if (!bounds.contains(position)) {
            throw new IllegalArgumentException("Position " + position + " is outside " + bounds);
        }
    }

    private int findLeaf(Pixel position) {
        int index = ROOT;
        var node = nodes.get(index);
        while (!node.isLeaf()) {
            index = node.firstChild + node.bounds.quadrantOf(position);
            node = nodes.get(index);
        }
        return index;
    }

    private void mergeUpward(int parentIndex) {
        while (parentIndex != -1) {
            var parent = nodes.get(parentIndex);
            int combined = 0;
            for (int q = 0; q < 4; q++) {
                var child = nodes.get(parent.firstChild + q);
                if (!child.isLeaf()) {
                    return;
                }
                combined += child.entities.size();
            }
            if (combined >= mergeThreshold) {
                return;
            }
            var merged = new ArrayList<ID>(capacity);
            for (int q = 0; q < 4; q++) {
                var child = nodes.get(parent.firstChild + q);
                merged.addAll(child.entities);
                child.entities = null;
                child.free = true;
            }
            for (var id : merged) {
                placements.put(id, new Placement(placements.get(id).position(), parentIndex));
            }
            freeBlocks.push(parent.firstChild);
            log.debug("Merged children of node {} at depth {}, {} entities", parentIndex, parent.depth, combined);
            parent.firstChild = -1;
            parent.entities = merged;
            parentIndex = parent.parent;
        }
    }

    private void place(ID id, Pixel position) {
        int leafIndex = findLeaf(position);
        var leaf = nodes.get(leafIndex);
        leaf.entities.add(id);
        placements.put(id, new Placement(position, leafIndex));
        if (leaf.entities.size() > capacity && leaf.depth < maxDepth) {
            split(leafIndex);
        }
    }

    private void pushChildren(Node<ID> node, IntArrayList stack) {
        for (int q = 0; q < 4; q++) {
            stack.push(node.firstChild + q);
        }
    }

    private void split(int leafIndex) {
        int first = allocateBlock();
        var leaf = nodes.get(leafIndex);
        for (int q = 0; q < 4; q++) {
            nodes.set(first + q, Node.leaf(leaf.bounds.quadrant(q), leaf.depth + 1, leafIndex));
        }
        var entities = leaf.entities;
        leaf.entities = null;
        leaf.firstChild = first;
        for (var id : entities) {
            var placement = placements.get(id);
            int child = first + leaf.bounds.quadrantOf(placement.position());
            nodes.get(child).entities.add(id);
            placements.put(id, new Placement(placement.position(), child));
        }
        log.debug("Split node {} at depth {}, {} entities", leafIndex, leaf.depth, entities.size());
        for (int q = 0; q < 4; q++) {
            var child = nodes.get(first + q);
            if (child.entities.size() > capacity && child.depth < maxDepth) {
                split(first + q);
            }
        }
    }

    private static final class Node<ID> {
        final Rectangle bounds;
        final int       depth;
        final int       parent;
        List<ID> entities;
        int      firstChild = -1;
        boolean  free;

        private Node(Rectangle bounds, int depth, int parent) {
            this.bounds = bounds;
            this.depth = depth;
            this.parent = parent;
        }

        static <ID> Node<ID> leaf(Rectangle bounds, int depth, int parent) {
            var node = new Node<ID>(bounds, depth, parent);
            node.entities = new ArrayList<>();
            return node;
        }

        boolean isLeaf() {
            return entities != null;
        }
    }

    private record Candidate<ID>(ID id, double distanceSquared) {
    }

    private record NodeDistance(int index, double distanceSquared) {
    }

    private record Placement(Pixel position, int leaf) {
    }
}
