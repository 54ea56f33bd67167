package com.github.micycle1.spatialindex;

import static com.github.micycle1.spatialindex.QuadTreeTest.ids;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import com.github.micycle1.spatialindex.SpatialIndexException.ErrorKind;
import com.github.micycle1.spatialindex.SpatialIndexer.EntityDistance;

public class SpatialIndexerTest {

	private SpatialIndexer indexer;

	@BeforeEach
	public void setUp() {
		indexer = new SpatialIndexer();
	}

	private static List<PositionedEntity> flatEntities() {
		return List.of(new PositionedEntity("a", 0, 0), new PositionedEntity("b", 100, 0), new PositionedEntity("c", 500, 500),
				new PositionedEntity("d", 10, 10));
	}

	private static List<PositionedEntity> spatialEntities() {
		return List.of(new PositionedEntity("a", 0, 0, 0), new PositionedEntity("b", 0, 0, 100),
				new PositionedEntity("c", 100, 0, 50), new PositionedEntity("d", 10, 10, -20));
	}

	@Test
	public void testDispatchesOnDimensionality() {
		indexer.build(flatEntities());
		assertFalse(indexer.is3D());
		assertTrue(indexer.getIndex() instanceof QuadTree);

		indexer.build(spatialEntities());
		assertTrue(indexer.is3D());
		assertTrue(indexer.getIndex() instanceof OctTree);
		assertEquals(4, indexer.getEntities().size());
	}

	@Test
	public void testMixedDimensionalityIsRejected() {
		List<PositionedEntity> mixed = List.of(new PositionedEntity("flat", 0, 0), new PositionedEntity("deep", 0, 0, 5));

		SpatialIndexException e = assertThrows(SpatialIndexException.class, () -> indexer.build(mixed));
		assertEquals(ErrorKind.CONFIGURATION, e.getKind());
		assertTrue(e.getMessage().startsWith("[CONFIGURATION]"));
		assertTrue(indexer.isEmpty());
	}

	@Test
	public void testFailedBuildKeepsPreviousIndex() {
		indexer.build(flatEntities());

		List<PositionedEntity> mixed = new ArrayList<>(flatEntities());
		mixed.add(new PositionedEntity("deep", 1, 1, 1));
		assertThrows(SpatialIndexException.class, () -> indexer.build(mixed));

		List<PositionedEntity> broken = new ArrayList<>(flatEntities());
		broken.add(new PositionedEntity("nan", Double.NaN, 1));
		SpatialIndexException e = assertThrows(SpatialIndexException.class, () -> indexer.build(broken));
		assertEquals(ErrorKind.BOUNDS_VIOLATION, e.getKind());

		assertFalse(indexer.is3D());
		assertEquals(4, indexer.getEntities().size());
		assertEquals(Set.of("a", "d"), ids(indexer.queryRegion(new Rectangle(-1, -1, 20, 20))));
	}

	@Test
	public void testEmptyIndex() {
		indexer.build(Collections.emptyList());
		assertTrue(indexer.isEmpty());
		indexer.build(null);
		assertTrue(indexer.isEmpty());

		assertTrue(indexer.queryPoint(new Coordinate(0, 0), 100).isEmpty());
		assertTrue(indexer.queryRegion(new Rectangle(-100, -100, 200, 200)).isEmpty());
		assertTrue(indexer.queryRegion(new Sphere(new Coordinate(0, 0, 0), 100)).isEmpty());
		assertTrue(indexer.queryRay(Ray.create2D(0, 0, 1, 0)).isEmpty());
		assertNull(indexer.findNearest(new Coordinate(0, 0)));
		assertTrue(indexer.getEntitiesWithinDistance(new Coordinate(0, 0), 1000).isEmpty());
		assertNull(indexer.toData());
		assertNull(indexer.getIndex());
		assertEquals(0, indexer.getStatistics().getEntityCount());
		assertEquals(0, indexer.getStatistics().getMemoryUsageBytes());
	}

	@Test
	public void testPointQueries2D() {
		indexer.build(flatEntities());

		assertEquals(Set.of("a"), ids(indexer.queryPoint(new Coordinate(0, 0))));
		assertEquals(Set.of("a", "d"), ids(indexer.queryPoint(new Coordinate(0, 0), 15)));
		assertEquals(Set.of("a", "d"), ids(indexer.queryRegion(new Circle(new Coordinate(5, 5), 8))));
	}

	@Test
	public void testPointQueries3D() {
		indexer.build(spatialEntities());

		assertEquals(Set.of("a"), ids(indexer.queryPoint(new Coordinate(0, 0, 0), 5)));
		// no z: a full-depth cylinder
		assertEquals(Set.of("a", "b"), ids(indexer.queryPoint(new Coordinate(0, 0), 5)));
		assertEquals(Set.of("a", "b", "d"), ids(indexer.queryRegion(new Circle(new Coordinate(0, 0), 15))));
	}

	@Test
	public void testRegionQueriesAcrossDimensions() {
		indexer.build(spatialEntities());
		// a rectangle spans every depth
		assertEquals(Set.of("a", "b", "d"), ids(indexer.queryRegion(new Rectangle(-5, -5, 20, 20))));
		assertEquals(Set.of("a", "d"), ids(indexer.queryRegion(new Box(-5, -5, -50, 20, 20, 60))));
		assertEquals(Set.of("b", "c"), ids(indexer.queryRegion(new Sphere(new Coordinate(50, 0, 75), 60))));

		indexer.build(flatEntities());
		// a box or sphere drops its depth
		assertEquals(Set.of("a", "d"), ids(indexer.queryRegion(new Box(-5, -5, 500, 20, 20, 1))));
		assertEquals(Set.of("a", "b", "d"), ids(indexer.queryRegion(new Sphere(new Coordinate(50, 0, 999), 50))));
	}

	@Test
	public void testRayQueries() {
		indexer.build(flatEntities());
		List<RayIntersection> hits = indexer.queryRay(Ray.create2D(-50, 0, 1, 0));
		assertEquals(List.of("a", "b"), hits.stream().map(RayIntersection::getEntityId).collect(Collectors.toList()));
		assertEquals("a", RayIntersections.closest(hits).getEntityId());

		indexer.build(spatialEntities());
		hits = indexer.queryRay(Ray.create3D(0, 0, -100, 0, 0, 1));
		assertEquals(List.of("a", "b"), hits.stream().map(RayIntersection::getEntityId).collect(Collectors.toList()));
		assertEquals(100, hits.get(0).getDistance(), 1e-9);
	}

	@Test
	public void testFindNearest() {
		indexer.build(flatEntities());

		assertEquals("b", indexer.findNearest(new Coordinate(90, 0)).getId());
		assertEquals("d", indexer.findNearest(new Coordinate(9, 9)).getId());
		// needs several radius doublings
		assertEquals("c", indexer.findNearest(new Coordinate(1000, 1000)).getId());
		assertNull(indexer.findNearest(new Coordinate(1000, 1000), 100));
		assertEquals("c", indexer.findNearest(new Coordinate(1000, 1000), 800).getId());
		assertNull(indexer.findNearest(new Coordinate(0, 0), -1));
	}

	@Test
	public void testFindNearestAgainstBruteForce() {
		Random random = new Random(31);
		List<PositionedEntity> entities = new ArrayList<>();
		for (int i = 0; i < 500; i++) {
			entities.add(new PositionedEntity("e" + i, random.nextDouble() * 5000, random.nextDouble() * 5000));
		}
		indexer.build(entities);

		for (int q = 0; q < 50; q++) {
			Coordinate query = new Coordinate(random.nextDouble() * 6000 - 500, random.nextDouble() * 6000 - 500);
			double best = entities.stream().mapToDouble(e -> query.distance(e.getCoordinate())).min().getAsDouble();
			PositionedEntity nearest = indexer.findNearest(query);
			assertNotNull(nearest);
			assertEquals(best, query.distance(nearest.getCoordinate()), 1e-9);
		}
	}

	@Test
	public void testFindNearest3D() {
		indexer.build(spatialEntities());

		assertEquals("b", indexer.findNearest(new Coordinate(0, 0, 90)).getId());
		assertEquals("c", indexer.findNearest(new Coordinate(100, 0, 0)).getId());
	}

	@Test
	public void testEntitiesWithinDistance() {
		indexer.build(flatEntities());

		List<EntityDistance> within = indexer.getEntitiesWithinDistance(new Coordinate(0, 0), 100);
		assertEquals(List.of("a", "d", "b"), within.stream().map(d -> d.getEntity().getId()).collect(Collectors.toList()));
		assertEquals(0, within.get(0).getDistance(), 1e-9);
		assertEquals(Math.sqrt(200), within.get(1).getDistance(), 1e-9);
		assertEquals(100, within.get(2).getDistance(), 1e-9);
	}

	@Test
	public void testSetConfigRebuilds() {
		Random random = new Random(41);
		List<PositionedEntity> entities = new ArrayList<>();
		for (int i = 0; i < 200; i++) {
			entities.add(new PositionedEntity("e" + i, random.nextDouble() * 1000, random.nextDouble() * 1000));
		}
		indexer.build(entities);
		int leavesBefore = indexer.getStatistics().getLeafCount();

		SpatialIndexConfig finer = SpatialIndexConfig.DEFAULT.withMaxNodesPerLeaf(2);
		indexer.setConfig(finer);

		assertSame(finer, indexer.getConfig());
		assertSame(finer, indexer.getIndex().getConfig());
		assertTrue(indexer.getStatistics().getLeafCount() > leavesBefore);
		assertEquals(200, indexer.getStatistics().getEntityCount());
	}

	@Test
	public void testSetConfigOnEmptyIndex() {
		indexer.setConfig(SpatialIndexConfig.precise());
		assertTrue(indexer.isEmpty());

		indexer.build(flatEntities());
		assertEquals(SpatialIndexConfig.precise(), indexer.getIndex().getConfig());
	}

	@Test
	public void testStatistics() {
		indexer.build(spatialEntities());

		SpatialIndexStats stats = indexer.getStatistics();
		assertEquals(4, stats.getEntityCount());
		assertEquals(4 * 300 + 150, stats.getMemoryUsageBytes());
		assertEquals(1, stats.getLeafCount());
		assertEquals(0, stats.getMaxDepth());
		assertTrue(stats.getBuildTimeMs() >= 0);
		assertTrue(stats.getLastBuildTimestamp() > 0);
	}

	@Test
	public void testToData() {
		indexer.build(flatEntities());

		TreeNodeData<?> data = indexer.toData();
		assertNotNull(data);
		assertTrue(data.isLeaf());
		assertEquals(4, data.totalEntityCount());
		assertTrue(data.getBounds() instanceof Rectangle);
	}

	@Test
	public void testClearAndRebuild() {
		indexer.build(flatEntities());
		indexer.clear();
		assertTrue(indexer.isEmpty());
		assertTrue(indexer.getEntities().isEmpty());
		assertEquals(0, indexer.getStatistics().getBuildTimeMs());
		assertEquals(0, indexer.getStatistics().getLastBuildTimestamp());

		indexer.rebuild(spatialEntities());
		assertTrue(indexer.is3D());
		assertEquals(4, indexer.getStatistics().getEntityCount());
	}

	@Test
	public void testEntitySnapshotIsIndependentOfInput() {
		List<PositionedEntity> input = new ArrayList<>(flatEntities());
		indexer.build(input);
		input.clear();

		assertEquals(4, indexer.getEntities().size());
		assertThrows(UnsupportedOperationException.class, () -> indexer.getEntities().clear());
	}
}
