package com.github.micycle1.spatialindex;

/**
 * A query shape that can be tested against tree node bounds of type
 * {@code B}.
 *
 * @param <B> the bounds type of the tree being queried ({@link Rectangle} or
 *            {@link Box})
 */
public interface Region<B> {

	/**
	 * Whether this region overlaps (or touches) the given node bounds. Used to
	 * prune whole subtrees.
	 */
	boolean intersects(B bounds);

	/**
	 * Whether the entity's position lies inside this region (boundary inclusive).
	 */
	boolean contains(PositionedEntity entity);
}
