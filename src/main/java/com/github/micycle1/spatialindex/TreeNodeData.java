package com.github.micycle1.spatialindex;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

/**
 * Plain nested snapshot of a tree node, for logging and inspection. Not a
 * stable wire format.
 *
 * @param <B> bounds type ({@link Rectangle} or {@link Box})
 */
public final class TreeNodeData<B extends Serializable> implements Serializable {

	private static final long serialVersionUID = 1L;

	private final B bounds;
	private final List<PositionedEntity> entities;
	private final List<TreeNodeData<B>> children; // null for a leaf
	private final int level;

	TreeNodeData(B bounds, List<PositionedEntity> entities, List<TreeNodeData<B>> children, int level) {
		this.bounds = bounds;
		this.entities = Collections.unmodifiableList(entities);
		this.children = children == null ? null : Collections.unmodifiableList(children);
		this.level = level;
	}

	public B getBounds() {
		return bounds;
	}

	/**
	 * Entities stored on this node itself (not its descendants).
	 */
	public List<PositionedEntity> getEntities() {
		return entities;
	}

	/**
	 * @return the child snapshots, or null if this node is a leaf
	 */
	public List<TreeNodeData<B>> getChildren() {
		return children;
	}

	public int getLevel() {
		return level;
	}

	public boolean isLeaf() {
		return children == null;
	}

	/**
	 * Entities stored at or below this node.
	 */
	public int totalEntityCount() {
		int count = entities.size();
		if (children != null) {
			for (TreeNodeData<B> child : children) {
				count += child.totalEntityCount();
			}
		}
		return count;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		appendTo(sb);
		return sb.toString();
	}

	private void appendTo(StringBuilder sb) {
		for (int i = 0; i < level; i++) {
			sb.append("  ");
		}
		sb.append(level).append(' ').append(bounds).append(" entities=").append(entities.size()).append('\n');
		if (children != null) {
			for (TreeNodeData<B> child : children) {
				child.appendTo(sb);
			}
		}
	}
}
