package com.github.micycle1.spatialindex;

import java.util.Collection;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Two-dimensional point index. Each internal node splits its rectangle into
 * four equal quadrants. Any z coordinate of an entity is ignored.
 *
 * <pre>{@code
 * QuadTree tree = new QuadTree(SpatialIndexConfig.DEFAULT);
 * tree.build(entities);
 * List<PositionedEntity> inView = tree.queryRegion(new Rectangle(0, 0, 100, 100));
 * List<PositionedEntity> nearby = tree.queryPoint(new Coordinate(50, 50), 25);
 * }</pre>
 *
 * @author Michael Carleton
 */
public class QuadTree extends PartitionTree<Rectangle> {

	/**
	 * Child slots, in arena order (screen orientation: y grows downwards).
	 */
	public enum Quadrant {
		TOP_LEFT, TOP_RIGHT, BOTTOM_LEFT, BOTTOM_RIGHT
	}

	public QuadTree(SpatialIndexConfig config) {
		super(config);
	}

	public QuadTree() {
		this(SpatialIndexConfig.DEFAULT);
	}

	@Override
	protected int fanout() {
		return Quadrant.values().length;
	}

	@Override
	protected Rectangle rootBounds(Collection<PositionedEntity> entities) {
		return Geometry.paddedRootRectangle(entities);
	}

	@Override
	protected Rectangle[] split(Rectangle bounds) {
		return bounds.quadrants();
	}

	@Override
	protected boolean encloses(Rectangle bounds, double x, double y, double z) {
		return bounds.contains(x, y);
	}

	@Override
	protected long bytesPerEntity() {
		return 200;
	}

	@Override
	protected long bytesPerLeaf() {
		return 100;
	}

	public List<PositionedEntity> queryRegion(Rectangle rect) {
		return queryRegion((Region<Rectangle>) rect);
	}

	public List<PositionedEntity> queryRegion(Circle circle) {
		return queryRegion((Region<Rectangle>) circle);
	}

	/**
	 * Entities within {@code radius} of the point.
	 */
	public List<PositionedEntity> queryPoint(Coordinate point, double radius) {
		return queryRegion(new Circle(point, radius));
	}

	/**
	 * Entities within the configured point-query tolerance of the point.
	 */
	public List<PositionedEntity> queryExactPoint(Coordinate point) {
		return queryPoint(point, config.getPointQueryTolerance());
	}

	/**
	 * Entities of the deepest node whose rectangle contains the point.
	 */
	public List<PositionedEntity> getLeafEntities(Coordinate point) {
		return leafEntities(point.x, point.y, 0);
	}

	/**
	 * @return the root rectangle, or {@link Rectangle#EMPTY} if the tree is empty
	 */
	public Rectangle getBounds() {
		Rectangle bounds = rootBoundsOrNull();
		return bounds == null ? Rectangle.EMPTY : bounds;
	}
}
