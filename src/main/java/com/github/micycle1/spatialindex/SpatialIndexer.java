package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spatialindex.SpatialIndexException.ErrorKind;

/**
 * Entry point of the spatial index. Picks a {@link QuadTree} or an
 * {@link OctTree} from the dimensionality of the entities handed to
 * {@link #build(Collection)}. Point, region and ray queries then go through a
 * single surface.
 * <p>
 * Intended use: rebuild once per layout pass, then query as often as needed.
 * Queries are read-only. Calls must not overlap a rebuild; the indexer does no
 * locking.
 *
 * <pre>{@code
 * SpatialIndexer indexer = new SpatialIndexer(SpatialIndexConfig.DEFAULT);
 * indexer.build(layoutEntities);
 * List<PositionedEntity> nearby = indexer.queryPoint(new Coordinate(100, 200), 50);
 * RayIntersection picked = RayIntersections.closest(indexer.queryRay(Ray.fromScreen(mx, my, w, h)));
 * }</pre>
 *
 * @author Michael Carleton
 */
public class SpatialIndexer {

	private static final Logger log = LoggerFactory.getLogger(SpatialIndexer.class);

	/**
	 * First radius tried by {@link #findNearest(Coordinate, double)}; doubled
	 * until something is found.
	 */
	static final double INITIAL_SEARCH_RADIUS = 50;

	private SpatialIndexConfig config;
	private RaycastingSystem raycasting;

	private QuadTree quadTree;
	private OctTree octTree;
	private List<PositionedEntity> entities = Collections.emptyList();
	private double buildTimeMs;
	private long lastBuildTimestamp;

	public SpatialIndexer() {
		this(SpatialIndexConfig.DEFAULT);
	}

	public SpatialIndexer(SpatialIndexConfig config) {
		this.config = Objects.requireNonNull(config, "config");
		this.raycasting = new RaycastingSystem(config);
	}

	/* ===================== Build ==================== */

	/**
	 * Replaces the index with one built over the given entities. A null or empty
	 * collection gives an empty index. If any entity carries z an octree is
	 * built, otherwise a quadtree. If the build fails, the previous index keeps
	 * serving queries.
	 *
	 * @throws SpatialIndexException {@link ErrorKind#CONFIGURATION} when 2D and 3D
	 *                               entities are mixed;
	 *                               {@link ErrorKind#BOUNDS_VIOLATION} when an
	 *                               entity cannot be placed
	 */
	public void build(Collection<PositionedEntity> entities) {
		long start = System.nanoTime();
		List<PositionedEntity> snapshot = entities == null ? new ArrayList<>() : new ArrayList<>(entities);

		if (snapshot.isEmpty()) {
			clear();
			finishBuild(start);
			return;
		}

		if (detect3D(snapshot)) {
			OctTree tree = new OctTree(config);
			tree.build(snapshot);
			octTree = tree;
			quadTree = null;
		} else {
			QuadTree tree = new QuadTree(config);
			tree.build(snapshot);
			quadTree = tree;
			octTree = null;
		}
		this.entities = snapshot;
		finishBuild(start);
	}

	/**
	 * Same as {@link #build(Collection)}.
	 */
	public void rebuild(Collection<PositionedEntity> entities) {
		build(entities);
	}

	private void finishBuild(long start) {
		buildTimeMs = (System.nanoTime() - start) / 1e6;
		lastBuildTimestamp = System.currentTimeMillis();
	}

	/**
	 * @return true if at least one entity carries z; throws if only some do
	 */
	private static boolean detect3D(List<PositionedEntity> entities) {
		int withZ = 0;
		for (PositionedEntity entity : entities) {
			if (entity.hasZ()) {
				withZ++;
			}
		}
		if (withZ > 0 && withZ < entities.size()) {
			throw new SpatialIndexException(ErrorKind.CONFIGURATION, "Mixed 2D/3D input: " + withZ + " of " + entities.size()
					+ " entities carry a z coordinate");
		}
		return withZ > 0;
	}

	/**
	 * Discards the index and the retained entities.
	 */
	public void clear() {
		quadTree = null;
		octTree = null;
		entities = Collections.emptyList();
		buildTimeMs = 0;
		lastBuildTimestamp = 0;
	}

	/* ===================== Queries ==================== */

	/**
	 * Entities at exactly the given point (radius 0).
	 */
	public List<PositionedEntity> queryPoint(Coordinate point) {
		return queryPoint(point, 0);
	}

	/**
	 * Entities within {@code radius} of the point. On a 3D index a point without
	 * z selects a vertical cylinder spanning the whole index.
	 */
	public List<PositionedEntity> queryPoint(Coordinate point, double radius) {
		Objects.requireNonNull(point, "point");
		if (octTree != null) {
			return Geometry.isPoint3D(point) ? octTree.queryPoint(point, radius) : octTree.queryCylinder(point, radius);
		}
		if (quadTree != null) {
			return quadTree.queryPoint(point, radius);
		}
		return new ArrayList<>();
	}

	/**
	 * Entities inside the rectangle. On a 3D index the rectangle spans every z.
	 */
	public List<PositionedEntity> queryRegion(Rectangle rect) {
		Objects.requireNonNull(rect, "rect");
		if (octTree != null) {
			return octTree.queryRegion(Box.fromRectangle(rect));
		}
		if (quadTree != null) {
			return quadTree.queryRegion(rect);
		}
		return new ArrayList<>();
	}

	/**
	 * Entities inside the circle. On a 3D index the circle spans every z.
	 */
	public List<PositionedEntity> queryRegion(Circle circle) {
		Objects.requireNonNull(circle, "circle");
		if (octTree != null) {
			return octTree.queryCylinder(circle.getCenter(), circle.getRadius());
		}
		if (quadTree != null) {
			return quadTree.queryRegion(circle);
		}
		return new ArrayList<>();
	}

	/**
	 * Entities inside the box. On a 2D index the z extent is ignored.
	 */
	public List<PositionedEntity> queryRegion(Box box) {
		Objects.requireNonNull(box, "box");
		if (octTree != null) {
			return octTree.queryRegion(box);
		}
		if (quadTree != null) {
			return quadTree.queryRegion(box.toRectangle());
		}
		return new ArrayList<>();
	}

	/**
	 * Entities inside the sphere. On a 2D index the sphere is taken as a circle of
	 * the same radius.
	 */
	public List<PositionedEntity> queryRegion(Sphere sphere) {
		Objects.requireNonNull(sphere, "sphere");
		if (octTree != null) {
			return octTree.queryRegion(sphere);
		}
		if (quadTree != null) {
			return quadTree.queryRegion(sphere.toCircle());
		}
		return new ArrayList<>();
	}

	/**
	 * Entities near the ray, nearest first.
	 */
	public List<RayIntersection> queryRay(Ray ray) {
		Objects.requireNonNull(ray, "ray");
		if (octTree != null) {
			return raycasting.raycast(ray, octTree);
		}
		if (quadTree != null) {
			return raycasting.raycast(ray, quadTree);
		}
		return new ArrayList<>();
	}

	/**
	 * The entity closest to the point, with no distance limit.
	 */
	public PositionedEntity findNearest(Coordinate point) {
		return findNearest(point, Double.POSITIVE_INFINITY);
	}

	/**
	 * The entity closest to the point, searching outward with a doubling radius.
	 *
	 * @return the nearest entity, or null if none lies within
	 *         {@code maxDistance}
	 */
	public PositionedEntity findNearest(Coordinate point, double maxDistance) {
		Objects.requireNonNull(point, "point");
		if (isEmpty() || !(maxDistance >= 0)) {
			return null;
		}
		double radius = Math.min(INITIAL_SEARCH_RADIUS, maxDistance);
		List<PositionedEntity> candidates = queryPoint(point, radius);
		while (candidates.isEmpty() && radius < maxDistance) {
			radius = Math.min(radius * 2, maxDistance);
			candidates = queryPoint(point, radius);
		}

		PositionedEntity nearest = null;
		double best = maxDistance;
		for (PositionedEntity candidate : candidates) {
			double d = distanceTo(point, candidate);
			if (d <= best) {
				if (nearest == null || d < best) {
					nearest = candidate;
				}
				best = d;
			}
		}
		return nearest;
	}

	/**
	 * Entities within {@code maxDistance} of the point, nearest first.
	 */
	public List<EntityDistance> getEntitiesWithinDistance(Coordinate point, double maxDistance) {
		List<EntityDistance> results = new ArrayList<>();
		for (PositionedEntity entity : queryPoint(point, maxDistance)) {
			results.add(new EntityDistance(entity, distanceTo(point, entity)));
		}
		results.sort(Comparator.comparingDouble(EntityDistance::getDistance));
		return results;
	}

	/**
	 * 3D distance on an octree for a point with z; planar distance otherwise.
	 */
	private double distanceTo(Coordinate point, PositionedEntity entity) {
		double dx = entity.getX() - point.x;
		double dy = entity.getY() - point.y;
		if (octTree != null && Geometry.isPoint3D(point)) {
			double dz = entity.getZOrZero() - point.z;
			return Math.sqrt(dx * dx + dy * dy + dz * dz);
		}
		return Math.sqrt(dx * dx + dy * dy);
	}

	/* ===================== Management ==================== */

	/**
	 * Tree statistics. The build time covers dimensionality detection as well as
	 * the tree build.
	 */
	public SpatialIndexStats getStatistics() {
		PartitionTree<?> index = getIndex();
		if (index == null) {
			return SpatialIndexStats.empty(buildTimeMs, lastBuildTimestamp);
		}
		return index.getStatistics().withBuildTiming(buildTimeMs, lastBuildTimestamp);
	}

	/**
	 * Nested snapshot of the active tree, or null if the index is empty.
	 */
	public TreeNodeData<?> toData() {
		PartitionTree<?> index = getIndex();
		return index == null ? null : index.toData();
	}

	/**
	 * Replaces the configuration. A non-empty index is rebuilt at once from the
	 * retained entities, so it never serves queries under stale settings.
	 */
	public void setConfig(SpatialIndexConfig config) {
		this.config = Objects.requireNonNull(config, "config");
		this.raycasting = new RaycastingSystem(config);
		if (!entities.isEmpty()) {
			log.debug("Configuration changed to {}; rebuilding over {} entities", config, entities.size());
			build(entities);
		}
	}

	public SpatialIndexConfig getConfig() {
		return config;
	}

	public boolean isEmpty() {
		return quadTree == null && octTree == null;
	}

	/**
	 * Whether the active index is an octree.
	 */
	public boolean is3D() {
		return octTree != null;
	}

	/**
	 * The entities of the last successful build.
	 */
	public List<PositionedEntity> getEntities() {
		return Collections.unmodifiableList(entities);
	}

	/**
	 * The active tree, for advanced queries; null if the index is empty.
	 */
	public PartitionTree<?> getIndex() {
		if (octTree != null) {
			return octTree;
		}
		return quadTree;
	}

	/**
	 * An entity paired with its distance from a query point.
	 */
	public static final class EntityDistance {
		private final PositionedEntity entity;
		private final double distance;

		public EntityDistance(PositionedEntity entity, double distance) {
			this.entity = entity;
			this.distance = distance;
		}

		public PositionedEntity getEntity() {
			return entity;
		}

		public double getDistance() {
			return distance;
		}

		@Override
		public String toString() {
			return entity.getId() + " @ " + distance;
		}
	}
}
