package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Three-dimensional point index. Each internal node splits its box into eight
 * equal octants. An entity without z is placed at z = 0.
 *
 * <pre>{@code
 * OctTree tree = new OctTree(SpatialIndexConfig.DEFAULT);
 * tree.build(entities);
 * List<PositionedEntity> inBox = tree.queryRegion(new Box(0, 0, 0, 100, 100, 100));
 * List<PositionedEntity> column = tree.queryCylinder(new Coordinate(50, 50), 10);
 * }</pre>
 *
 * @author Michael Carleton
 */
public class OctTree extends PartitionTree<Box> {

	/**
	 * Child slots, in arena order: front face (lower z) first.
	 */
	public enum Octant {
		FRONT_TOP_LEFT, FRONT_TOP_RIGHT, FRONT_BOTTOM_LEFT, FRONT_BOTTOM_RIGHT, BACK_TOP_LEFT, BACK_TOP_RIGHT,
		BACK_BOTTOM_LEFT, BACK_BOTTOM_RIGHT
	}

	public OctTree(SpatialIndexConfig config) {
		super(config);
	}

	public OctTree() {
		this(SpatialIndexConfig.DEFAULT);
	}

	@Override
	protected int fanout() {
		return Octant.values().length;
	}

	@Override
	protected Box rootBounds(Collection<PositionedEntity> entities) {
		return Geometry.paddedRootBox(entities);
	}

	@Override
	protected Box[] split(Box bounds) {
		return bounds.octants();
	}

	@Override
	protected boolean encloses(Box bounds, double x, double y, double z) {
		return bounds.contains(x, y, z);
	}

	@Override
	protected long bytesPerEntity() {
		return 300;
	}

	@Override
	protected long bytesPerLeaf() {
		return 150;
	}

	public List<PositionedEntity> queryRegion(Box box) {
		return queryRegion((Region<Box>) box);
	}

	public List<PositionedEntity> queryRegion(Sphere sphere) {
		return queryRegion((Region<Box>) sphere);
	}

	/**
	 * Entities within {@code radius} of the point (a point without z is taken at
	 * z = 0).
	 */
	public List<PositionedEntity> queryPoint(Coordinate point, double radius) {
		return queryRegion(new Sphere(point, radius));
	}

	/**
	 * Entities within the configured point-query tolerance of the point.
	 */
	public List<PositionedEntity> queryExactPoint(Coordinate point) {
		return queryPoint(point, config.getPointQueryTolerance());
	}

	/**
	 * Entities within {@code radius} of the centre in the XY plane, across the
	 * tree's whole z range. Gives 2D-style selection in a 3D scene.
	 */
	public List<PositionedEntity> queryCylinder(Coordinate center, double radius) {
		Box bounds = getBounds();
		return queryCylinder(center, radius, bounds.getZ(), bounds.getMaxZ());
	}

	/**
	 * Entities within {@code radius} of the centre in the XY plane and with z in
	 * {@code [minZ, maxZ]}. Runs a box query, then filters on the radial
	 * distance.
	 */
	public List<PositionedEntity> queryCylinder(Coordinate center, double radius, double minZ, double maxZ) {
		if (radius < 0) {
			throw new IllegalArgumentException("Cylinder radius must be non-negative: " + radius);
		}
		if (isEmpty() || maxZ < minZ) {
			return new ArrayList<>();
		}
		Box box = Box.ofExtents(center.x - radius, center.y - radius, minZ, center.x + radius, center.y + radius, maxZ);
		List<PositionedEntity> results = new ArrayList<>();
		for (PositionedEntity entity : queryRegion(box)) {
			double dx = entity.getX() - center.x;
			double dy = entity.getY() - center.y;
			if (dx * dx + dy * dy <= radius * radius) {
				results.add(entity);
			}
		}
		return results;
	}

	/**
	 * Entities of the deepest node whose box contains the point (a point without z
	 * is taken at z = 0).
	 */
	public List<PositionedEntity> getLeafEntities(Coordinate point) {
		return leafEntities(point.x, point.y, Double.isNaN(point.z) ? 0 : point.z);
	}

	/**
	 * @return the root box, or {@link Box#EMPTY} if the tree is empty
	 */
	public Box getBounds() {
		Box bounds = rootBoundsOrNull();
		return bounds == null ? Box.EMPTY : bounds;
	}
}
