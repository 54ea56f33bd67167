package com.github.micycle1.spatialindex;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spatialindex.SpatialIndexException.ErrorKind;

/**
 * Base of the quadtree and octree: a point index that recursively splits its
 * bounds into {@link #fanout()} equal children.
 * <p>
 * Nodes live in a flat arena addressed by int index. An internal node's
 * children occupy the contiguous slots {@code [firstChild, firstChild +
 * fanout)}; the root is slot 0. The tree is built once by
 * {@link #build(Collection)} and is read-only afterwards. A new build assembles
 * a fresh arena and only then replaces the old one, so queries never see a
 * partially built tree.
 *
 * @param <B> the bounds type of a node
 * @author Michael Carleton
 */
public abstract class PartitionTree<B extends Serializable> {

	private static final Logger log = LoggerFactory.getLogger(PartitionTree.class);

	protected final SpatialIndexConfig config;

	private Arena<B> arena; // null while empty
	private double buildTimeMs;
	private long lastBuildTimestamp;

	protected PartitionTree(SpatialIndexConfig config) {
		this.config = Objects.requireNonNull(config, "config");
	}

	/* ===================== Subclass contract ==================== */

	/**
	 * Number of children an internal node has.
	 */
	protected abstract int fanout();

	/**
	 * Padded root bounds enclosing all of the given (non-empty) entities.
	 */
	protected abstract B rootBounds(Collection<PositionedEntity> entities);

	/**
	 * Splits bounds into {@link #fanout()} equal children.
	 */
	protected abstract B[] split(B bounds);

	/**
	 * Whether the position lies within the bounds (boundary inclusive). A 2D
	 * position is passed with z = 0.
	 */
	protected abstract boolean encloses(B bounds, double x, double y, double z);

	protected abstract long bytesPerEntity();

	protected abstract long bytesPerLeaf();

	/* ===================== Build ==================== */

	/**
	 * Builds the tree from the given entities, replacing any previous tree. An
	 * empty collection leaves the tree empty.
	 *
	 * @throws SpatialIndexException of kind {@link ErrorKind#BOUNDS_VIOLATION} if
	 *                               an entity cannot be placed (for instance
	 *                               because a coordinate is not finite); the
	 *                               previous tree is kept in that case
	 */
	public void build(Collection<PositionedEntity> entities) {
		Objects.requireNonNull(entities, "entities");
		long start = System.nanoTime();

		if (entities.isEmpty()) {
			arena = null;
			buildTimeMs = 0;
			lastBuildTimestamp = System.currentTimeMillis();
			return;
		}

		Arena<B> fresh = new Arena<>();
		fresh.add(new Node<>(rootBounds(entities), 0));
		for (PositionedEntity entity : entities) {
			if (!insert(fresh, 0, entity)) {
				log.error("Entity {} lies outside root bounds {}", entity, fresh.get(0).bounds);
				throw new SpatialIndexException(ErrorKind.BOUNDS_VIOLATION,
						"Entity " + entity.getId() + " lies outside root bounds " + fresh.get(0).bounds);
			}
		}

		arena = fresh;
		buildTimeMs = (System.nanoTime() - start) / 1e6;
		lastBuildTimestamp = System.currentTimeMillis();
		log.debug("Built {} over {} entities: {} tree nodes in {} ms", getClass().getSimpleName(), entities.size(),
				fresh.size(), buildTimeMs);
	}

	private boolean encloses(B bounds, PositionedEntity entity) {
		return encloses(bounds, entity.getX(), entity.getY(), entity.getZOrZero());
	}

	/**
	 * Recursive insertion into the subtree rooted at {@code index}.
	 *
	 * @return false if the entity lies outside the node's bounds
	 */
	private boolean insert(Arena<B> arena, int index, PositionedEntity entity) {
		Node<B> node = arena.get(index);
		if (!encloses(node.bounds, entity)) {
			return false;
		}

		switch (node.kind) {
			case LEAF:
				// room left, or depth cutoff overrides the capacity limit
				if (node.entities.size() < config.getMaxNodesPerLeaf() || node.level >= config.getMaxDepth()) {
					node.entities.add(entity);
					return true;
				}
				subdivide(arena, index);
				break;
			case INTERNAL:
				break;
		}

		for (int c = node.firstChild; c < node.firstChild + fanout(); c++) {
			if (insert(arena, c, entity)) {
				return true;
			}
		}
		node.entities.add(entity);
		return true;
	}

	/**
	 * Turns a leaf into an internal node, appending its children to the arena and
	 * pushing its entities down. Entities no child accepts stay on the node.
	 */
	private void subdivide(Arena<B> arena, int index) {
		Node<B> node = arena.get(index);
		node.firstChild = arena.size();
		for (B childBounds : split(node.bounds)) {
			arena.add(new Node<>(childBounds, node.level + 1));
		}
		node.kind = NodeKind.INTERNAL;

		List<PositionedEntity> existing = node.entities;
		node.entities = new ArrayList<>();
		for (PositionedEntity entity : existing) {
			boolean inserted = false;
			for (int c = node.firstChild; c < node.firstChild + fanout(); c++) {
				if (insert(arena, c, entity)) {
					inserted = true;
					break;
				}
			}
			if (!inserted) {
				node.entities.add(entity);
			}
		}
	}

	/* ===================== Queries ==================== */

	/**
	 * Entities inside the region (boundary inclusive). Subtrees whose bounds the
	 * region does not intersect are skipped.
	 */
	public List<PositionedEntity> queryRegion(Region<B> region) {
		Objects.requireNonNull(region, "region");
		List<PositionedEntity> results = new ArrayList<>();
		visit(region::intersects, entity -> {
			if (region.contains(entity)) {
				results.add(entity);
			}
		});
		return results;
	}

	/**
	 * Every stored entity, in traversal order.
	 */
	public List<PositionedEntity> getAllEntities() {
		List<PositionedEntity> results = new ArrayList<>();
		visit(bounds -> true, results::add);
		return results;
	}

	/**
	 * Depth-first traversal: nodes whose bounds fail {@code descend} are pruned
	 * with their subtree; every entity stored on a visited node is passed to
	 * {@code sink}.
	 */
	void visit(Predicate<B> descend, Consumer<PositionedEntity> sink) {
		Arena<B> current = arena;
		if (current != null) {
			visit(current, 0, descend, sink);
		}
	}

	private void visit(Arena<B> arena, int index, Predicate<B> descend, Consumer<PositionedEntity> sink) {
		Node<B> node = arena.get(index);
		if (!descend.test(node.bounds)) {
			return;
		}
		for (PositionedEntity entity : node.entities) {
			sink.accept(entity);
		}
		switch (node.kind) {
			case LEAF:
				return;
			case INTERNAL:
				for (int c = node.firstChild; c < node.firstChild + fanout(); c++) {
					visit(arena, c, descend, sink);
				}
				return;
		}
	}

	/**
	 * Entities held by the deepest node whose bounds contain the position; empty
	 * if the tree is empty or the position lies outside it.
	 */
	protected List<PositionedEntity> leafEntities(double x, double y, double z) {
		Arena<B> current = arena;
		if (current == null || !encloses(current.get(0).bounds, x, y, z)) {
			return Collections.emptyList();
		}
		Node<B> node = current.get(0);
		while (node.kind == NodeKind.INTERNAL) {
			Node<B> next = null;
			for (int c = node.firstChild; c < node.firstChild + fanout() && next == null; c++) {
				if (encloses(current.get(c).bounds, x, y, z)) {
					next = current.get(c);
				}
			}
			if (next == null) {
				break;
			}
			node = next;
		}
		return Collections.unmodifiableList(node.entities);
	}

	/* ===================== Management ==================== */

	public boolean isEmpty() {
		return arena == null;
	}

	/**
	 * Discards the tree.
	 */
	public void clear() {
		arena = null;
		buildTimeMs = 0;
		lastBuildTimestamp = 0;
	}

	public SpatialIndexConfig getConfig() {
		return config;
	}

	/**
	 * @return the root bounds, or null if the tree is empty
	 */
	protected B rootBoundsOrNull() {
		Arena<B> current = arena;
		return current == null ? null : current.get(0).bounds;
	}

	/**
	 * Entity count, depth and memory figures, computed by a single pass over the
	 * arena.
	 */
	public SpatialIndexStats getStatistics() {
		Arena<B> current = arena;
		if (current == null) {
			return SpatialIndexStats.empty(buildTimeMs, lastBuildTimestamp);
		}
		int entityCount = 0;
		int maxDepth = 0;
		int leafCount = 0;
		long leafDepthSum = 0;
		for (int i = 0; i < current.size(); i++) {
			Node<B> node = current.get(i);
			entityCount += node.entities.size();
			maxDepth = Math.max(maxDepth, node.level);
			if (node.kind == NodeKind.LEAF) {
				leafCount++;
				leafDepthSum += node.level;
			}
		}
		double averageDepth = leafCount > 0 ? (double) leafDepthSum / leafCount : 0;
		long memory = entityCount * bytesPerEntity() + leafCount * bytesPerLeaf();
		return new SpatialIndexStats(entityCount, maxDepth, averageDepth, memory, buildTimeMs, lastBuildTimestamp, leafCount,
				current.size());
	}

	/**
	 * Nested snapshot of the tree, or null if it is empty.
	 */
	public TreeNodeData<B> toData() {
		Arena<B> current = arena;
		return current == null ? null : toData(current, 0);
	}

	private TreeNodeData<B> toData(Arena<B> arena, int index) {
		Node<B> node = arena.get(index);
		List<TreeNodeData<B>> children = null;
		if (node.kind == NodeKind.INTERNAL) {
			children = new ArrayList<>(fanout());
			for (int c = node.firstChild; c < node.firstChild + fanout(); c++) {
				children.add(toData(arena, c));
			}
		}
		return new TreeNodeData<>(node.bounds, new ArrayList<>(node.entities), children, node.level);
	}

	/* ===================== Supporting Classes ==================== */

	/**
	 * Node tag: a LEAF has no children; an INTERNAL node has exactly
	 * {@link #fanout()} of them.
	 */
	public enum NodeKind {
		LEAF, INTERNAL
	}

	/**
	 * An arena slot. {@code entities} is the leaf payload; on an internal node it
	 * holds only entities that no child accepted.
	 */
	static final class Node<B> {
		final B bounds;
		final int level;
		NodeKind kind;
		int firstChild; // -1 for a leaf
		List<PositionedEntity> entities;

		Node(B bounds, int level) {
			this.bounds = bounds;
			this.level = level;
			this.kind = NodeKind.LEAF;
			this.firstChild = -1;
			this.entities = new ArrayList<>();
		}
	}

	static final class Arena<B> {
		private final List<Node<B>> nodes = new ArrayList<>();

		void add(Node<B> node) {
			nodes.add(node);
		}

		Node<B> get(int index) {
			return nodes.get(index);
		}

		int size() {
			return nodes.size();
		}
	}
}
