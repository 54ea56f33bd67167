package com.github.micycle1.spatialindex;

import java.util.Collection;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.math.Vector2D;
import org.locationtech.jts.math.Vector3D;

/**
 * Geometry kernel: distances, vector normalisation, dimensionality tests and
 * bounding volumes over entity collections.
 * <p>
 * Points are JTS {@link Coordinate}s; a coordinate whose z is NaN is treated as
 * a 2D point.
 *
 * @author Michael Carleton
 */
public final class Geometry {

	/**
	 * Fraction of the largest extent added on every side of a tree's root bounds.
	 */
	public static final double ROOT_PADDING_RATIO = 0.1;

	/**
	 * Fixed margin added on top of {@link #ROOT_PADDING_RATIO}, so coincident or
	 * collinear inputs still get a non-degenerate root.
	 */
	public static final double ROOT_PADDING_EPSILON = 10;

	private Geometry() {
	}

	public static boolean isPoint3D(Coordinate point) {
		return !Double.isNaN(point.z);
	}

	public static boolean isRay3D(Ray ray) {
		return ray.is3D();
	}

	public static double distance2D(Coordinate a, Coordinate b) {
		return a.distance(b);
	}

	public static double distance3D(Coordinate a, Coordinate b) {
		double dx = a.x - b.x;
		double dy = a.y - b.y;
		double dz = a.z - b.z;
		return Math.sqrt(dx * dx + dy * dy + dz * dz);
	}

	/**
	 * Euclidean distance, in 3D only when both points carry a z ordinate.
	 */
	public static double distance(Coordinate a, Coordinate b) {
		if (isPoint3D(a) && isPoint3D(b)) {
			return distance3D(a, b);
		}
		return distance2D(a, b);
	}

	/**
	 * @return the unit vector in the direction of {@code v}, or the zero vector if
	 *         {@code v} has zero length
	 */
	public static Vector2D normalize(Vector2D v) {
		double length = v.length();
		if (length == 0 || Double.isNaN(length)) {
			return new Vector2D(0, 0);
		}
		return new Vector2D(v.getX() / length, v.getY() / length);
	}

	/**
	 * @return the unit vector in the direction of {@code v}, or the zero vector if
	 *         {@code v} has zero length
	 */
	public static Vector3D normalize(Vector3D v) {
		double length = v.length();
		if (length == 0 || Double.isNaN(length)) {
			return new Vector3D(0, 0, 0);
		}
		return new Vector3D(v.getX() / length, v.getY() / length, v.getZ() / length);
	}

	/**
	 * Tight bounding rectangle of the entities' x/y, grown by {@code padding} on
	 * every side. An empty collection gives {@link Rectangle#EMPTY}.
	 */
	public static Rectangle boundingRectangle(Collection<PositionedEntity> entities, double padding) {
		if (entities.isEmpty()) {
			return Rectangle.EMPTY;
		}
		Envelope env = new Envelope();
		for (PositionedEntity e : entities) {
			env.expandToInclude(e.getX(), e.getY());
		}
		return Rectangle.ofExtents(env.getMinX() - padding, env.getMinY() - padding, env.getMaxX() + padding,
				env.getMaxY() + padding);
	}

	/**
	 * Tight bounding box of the entities, grown by {@code padding} on every side.
	 * A missing z counts as 0. An empty collection gives {@link Box#EMPTY}.
	 */
	public static Box boundingBox(Collection<PositionedEntity> entities, double padding) {
		if (entities.isEmpty()) {
			return Box.EMPTY;
		}
		double minX = Double.POSITIVE_INFINITY;
		double minY = Double.POSITIVE_INFINITY;
		double minZ = Double.POSITIVE_INFINITY;
		double maxX = Double.NEGATIVE_INFINITY;
		double maxY = Double.NEGATIVE_INFINITY;
		double maxZ = Double.NEGATIVE_INFINITY;
		for (PositionedEntity e : entities) {
			double z = e.getZOrZero();
			minX = Math.min(minX, e.getX());
			minY = Math.min(minY, e.getY());
			minZ = Math.min(minZ, z);
			maxX = Math.max(maxX, e.getX());
			maxY = Math.max(maxY, e.getY());
			maxZ = Math.max(maxZ, z);
		}
		return Box.ofExtents(minX - padding, minY - padding, minZ - padding, maxX + padding, maxY + padding, maxZ + padding);
	}

	/**
	 * Root bounds for a quadtree: the bounding rectangle padded by 10% of its
	 * largest extent plus {@link #ROOT_PADDING_EPSILON}.
	 */
	public static Rectangle paddedRootRectangle(Collection<PositionedEntity> entities) {
		Rectangle tight = boundingRectangle(entities, 0);
		double padding = Math.max(tight.getWidth(), tight.getHeight()) * ROOT_PADDING_RATIO + ROOT_PADDING_EPSILON;
		return Rectangle.ofExtents(pad(tight.getX(), -padding), pad(tight.getY(), -padding), pad(tight.getMaxX(), padding),
				pad(tight.getMaxY(), padding));
	}

	/**
	 * Root bounds for an octree: the bounding box padded by 10% of its largest
	 * extent plus {@link #ROOT_PADDING_EPSILON}.
	 */
	public static Box paddedRootBox(Collection<PositionedEntity> entities) {
		Box tight = boundingBox(entities, 0);
		double padding = Math.max(tight.getWidth(), Math.max(tight.getHeight(), tight.getDepth())) * ROOT_PADDING_RATIO
				+ ROOT_PADDING_EPSILON;
		return Box.ofExtents(pad(tight.getX(), -padding), pad(tight.getY(), -padding), pad(tight.getZ(), -padding),
				pad(tight.getMaxX(), padding), pad(tight.getMaxY(), padding), pad(tight.getMaxZ(), padding));
	}

	/**
	 * Shifts a finite bound, saturating at the largest finite double. Padding of
	 * coordinates near the double range would otherwise overflow to infinity. NaN
	 * passes through.
	 */
	private static double pad(double value, double delta) {
		return Math.max(-Double.MAX_VALUE, Math.min(Double.MAX_VALUE, value + delta));
	}
}
