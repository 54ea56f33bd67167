package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ray picking against a {@link QuadTree} or {@link OctTree}.
 * <p>
 * The tree is walked depth first. A subtree is skipped when the ray misses its
 * bounds (slab test). Each entity on a visited node is then tested against the
 * ray line using the configured tolerances. Hits are returned nearest first.
 *
 * <pre>{@code
 * RaycastingSystem raycasting = new RaycastingSystem(config);
 * List<RayIntersection> hits = raycasting.raycast(Ray.create2D(0, 0, 1, 0), quadTree);
 * }</pre>
 *
 * @author Michael Carleton
 */
public class RaycastingSystem {

	private static final Logger log = LoggerFactory.getLogger(RaycastingSystem.class);

	private static final Comparator<RayIntersection> BY_DISTANCE = Comparator.comparingDouble(RayIntersection::getDistance);

	private final SpatialIndexConfig config;

	public RaycastingSystem(SpatialIndexConfig config) {
		this.config = Objects.requireNonNull(config, "config");
	}

	public SpatialIndexConfig getConfig() {
		return config;
	}

	/**
	 * Casts a ray through a quadtree. A 3D ray is projected onto the XY plane
	 * first.
	 *
	 * @return hits sorted by ascending distance along the ray
	 */
	public List<RayIntersection> raycast(Ray ray, QuadTree tree) {
		Ray flat = ray.projectTo2D();
		if (tree.isEmpty() || isDegenerate(flat)) {
			return new ArrayList<>();
		}
		double margin = config.getRayIntersectionTolerance();
		List<RayIntersection> results = new ArrayList<>();
		// an entity within tolerance of the ray may sit just outside the node the ray crosses
		tree.visit(bounds -> intersect(flat, bounds.expandedBy(margin)) != null, entity -> {
			RayIntersection hit = intersect(flat, entity);
			if (hit != null) {
				results.add(hit);
			}
		});
		results.sort(BY_DISTANCE);
		return results;
	}

	/**
	 * Casts a ray through an octree. A 2D ray is lifted into the plane through
	 * the middle of the tree's z range (z = 0 for an empty tree).
	 *
	 * @return hits sorted by ascending distance along the ray
	 */
	public List<RayIntersection> raycast(Ray ray, OctTree tree) {
		Ray spatial = ray.liftTo3D(tree.isEmpty() ? 0 : tree.getBounds().getMidZ());
		if (tree.isEmpty() || isDegenerate(spatial)) {
			return new ArrayList<>();
		}
		double margin = config.getRayIntersectionTolerance();
		List<RayIntersection> results = new ArrayList<>();
		tree.visit(bounds -> intersect(spatial, bounds.expandedBy(margin)) != null, entity -> {
			RayIntersection hit = intersect(spatial, entity);
			if (hit != null) {
				results.add(hit);
			}
		});
		results.sort(BY_DISTANCE);
		return results;
	}

	private static boolean isDegenerate(Ray ray) {
		if (ray.isDegenerate()) {
			log.debug("Ignoring ray with zero direction: {}", ray);
			return true;
		}
		return false;
	}

	/**
	 * Slab test of a ray against a rectangle; the ray is used in the XY plane.
	 *
	 * @return where the ray enters the rectangle (or leaves it, when the origin
	 *         is inside), or null if it misses
	 */
	public static BoundsHit intersect(Ray ray, Rectangle rect) {
		double[] interval = { Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY };
		clip(interval, ray.getOriginX(), ray.getDirectionX(), rect.getX(), rect.getMaxX());
		clip(interval, ray.getOriginY(), ray.getDirectionY(), rect.getY(), rect.getMaxY());
		return toHit(ray, interval);
	}

	/**
	 * Slab test of a ray against a box. A 2D ray is taken at z = 0.
	 *
	 * @return where the ray enters the box (or leaves it, when the origin is
	 *         inside), or null if it misses
	 */
	public static BoundsHit intersect(Ray ray, Box box) {
		double[] interval = { Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY };
		clip(interval, ray.getOriginX(), ray.getDirectionX(), box.getX(), box.getMaxX());
		clip(interval, ray.getOriginY(), ray.getDirectionY(), box.getY(), box.getMaxY());
		clip(interval, ray.getOriginZ(), ray.getDirectionZ(), box.getZ(), box.getMaxZ());
		return toHit(ray, interval);
	}

	/**
	 * Narrows {@code [tMin, tMax]} to the parameter range where the ray lies
	 * between the two planes of one axis. A zero direction component gives
	 * +/-Infinity, which the min/max handle as is; a 0/0 (origin on a plane) gives
	 * NaN, which fails both comparisons and leaves the interval untouched.
	 */
	private static void clip(double[] interval, double origin, double direction, double min, double max) {
		double t1 = (min - origin) / direction;
		double t2 = (max - origin) / direction;
		double near = Math.min(t1, t2);
		double far = Math.max(t1, t2);
		if (near > interval[0]) {
			interval[0] = near;
		}
		if (far < interval[1]) {
			interval[1] = far;
		}
	}

	private static BoundsHit toHit(Ray ray, double[] interval) {
		double tMin = interval[0];
		double tMax = interval[1];
		if (tMax < 0 || tMin > tMax) {
			return null;
		}
		double t = tMin >= 0 ? tMin : tMax;
		return new BoundsHit(t, ray.pointAt(t));
	}

	/**
	 * Tests one entity against the ray line. Rejects the entity if it lies
	 * further than the ray tolerance from the line, or behind the origin.
	 */
	private RayIntersection intersect(Ray ray, PositionedEntity entity) {
		double ex = entity.getX() - ray.getOriginX();
		double ey = entity.getY() - ray.getOriginY();
		double ez = ray.is3D() ? entity.getZOrZero() - ray.getOriginZ() : 0;

		double projection = ex * ray.getDirectionX() + ey * ray.getDirectionY() + ez * ray.getDirectionZ();
		Coordinate closest = ray.pointAt(projection);

		double ox = entity.getX() - closest.x;
		double oy = entity.getY() - closest.y;
		double oz = ray.is3D() ? entity.getZOrZero() - closest.z : 0;
		double rayDistance = Math.sqrt(ox * ox + oy * oy + oz * oz);

		if (rayDistance > config.getRayIntersectionTolerance()) {
			return null;
		}
		if (projection < 0) {
			return null;
		}
		boolean directHit = rayDistance < config.getPointQueryTolerance();
		return new RayIntersection(entity, projection, closest, rayDistance, directHit);
	}

	/**
	 * Where a ray meets a bounding rectangle or box.
	 */
	public static final class BoundsHit {
		private final double distance;
		private final Coordinate point;

		BoundsHit(double distance, Coordinate point) {
			this.distance = distance;
			this.point = point;
		}

		/** Ray parameter of the hit; never negative. */
		public double getDistance() {
			return distance;
		}

		public Coordinate getPoint() {
			return new Coordinate(point);
		}

		@Override
		public String toString() {
			return "BoundsHit[t=" + distance + "]";
		}
	}
}
