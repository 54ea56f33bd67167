package com.github.micycle1.spatialindex;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;
import org.locationtech.jts.math.Vector3D;

public class GeometryTest {

	private static final double EPSILON = 1e-12;

	@Test
	public void testDistances() {
		assertEquals(5, Geometry.distance2D(new Coordinate(0, 0), new Coordinate(3, 4)), EPSILON);
		assertEquals(Math.sqrt(50), Geometry.distance3D(new Coordinate(0, 0, 0), new Coordinate(3, 4, 5)), EPSILON);
		// 3D only when both carry z
		assertEquals(5, Geometry.distance(new Coordinate(0, 0, 0), new Coordinate(3, 4)), EPSILON);
		assertEquals(Math.sqrt(50), Geometry.distance(new Coordinate(0, 0, 0), new Coordinate(3, 4, 5)), EPSILON);
	}

	@Test
	public void testNormalize() {
		Vector2D unit = Geometry.normalize(new Vector2D(3, 4));
		assertEquals(0.6, unit.getX(), EPSILON);
		assertEquals(0.8, unit.getY(), EPSILON);

		Vector3D unit3 = Geometry.normalize(new Vector3D(0, 0, -7));
		assertEquals(-1, unit3.getZ(), EPSILON);

		Vector2D zero = Geometry.normalize(new Vector2D(0, 0));
		assertEquals(0, zero.getX());
		assertEquals(0, zero.getY());
		assertEquals(0, Geometry.normalize(new Vector3D(0, 0, 0)).length());
	}

	@Test
	public void testDimensionalityPredicates() {
		assertTrue(Geometry.isPoint3D(new Coordinate(1, 2, 3)));
		assertFalse(Geometry.isPoint3D(new Coordinate(1, 2)));
		assertTrue(Geometry.isRay3D(Ray.create3D(0, 0, 0, 1, 0, 0)));
		assertFalse(Geometry.isRay3D(Ray.create2D(0, 0, 1, 0)));
		assertTrue(new PositionedEntity("a", 0, 0, 0).hasZ());
		assertFalse(new PositionedEntity("a", 0, 0).hasZ());
	}

	@Test
	public void testBoundingVolumes() {
		List<PositionedEntity> entities = List.of(new PositionedEntity("a", -10, 5), new PositionedEntity("b", 30, 25, 8));

		assertEquals(new Rectangle(-10, 5, 40, 20), Geometry.boundingRectangle(entities, 0));
		assertEquals(new Rectangle(-12, 3, 44, 24), Geometry.boundingRectangle(entities, 2));
		// missing z counts as 0
		assertEquals(Box.ofExtents(-10, 5, 0, 30, 25, 8), Geometry.boundingBox(entities, 0));

		assertEquals(Rectangle.EMPTY, Geometry.boundingRectangle(Collections.emptyList(), 5));
		assertEquals(Box.EMPTY, Geometry.boundingBox(Collections.emptyList(), 5));
	}

	@Test
	public void testPaddedRootIsNeverDegenerate() {
		List<PositionedEntity> coincident = List.of(new PositionedEntity("a", 3, 3, 3), new PositionedEntity("b", 3, 3, 3));

		Rectangle rect = Geometry.paddedRootRectangle(coincident);
		assertEquals(new Rectangle(-7, -7, 20, 20), rect);
		Box box = Geometry.paddedRootBox(coincident);
		assertEquals(20 * 20 * 20, box.volume(), EPSILON);

		List<PositionedEntity> collinear = List.of(new PositionedEntity("a", 0, 0), new PositionedEntity("b", 100, 0));
		Rectangle flat = Geometry.paddedRootRectangle(collinear);
		assertEquals(40, flat.getHeight(), EPSILON);
		assertEquals(140, flat.getWidth(), EPSILON);
	}

	@Test
	public void testPaddedRootSaturatesAtDoubleRange() {
		List<PositionedEntity> wide = List.of(new PositionedEntity("a", -1e308, 0, -1e308), new PositionedEntity("b", 1e308, 0, 1e308));

		Rectangle rect = Geometry.paddedRootRectangle(wide);
		assertEquals(Rectangle.ofExtents(-Double.MAX_VALUE, -Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE), rect);
		assertTrue(rect.contains(1e308, 0));
		assertEquals(0, rect.getCenter().x);

		Box box = Geometry.paddedRootBox(wide);
		assertEquals(-Double.MAX_VALUE, box.getZ());
		assertEquals(Double.MAX_VALUE, box.getMaxZ());
		assertTrue(box.contains(-1e308, 0, -1e308));
	}

	@Test
	public void testExpandedBy() {
		assertEquals(new Rectangle(-1, 1, 12, 7), new Rectangle(0, 2, 10, 5).expandedBy(1));
		assertEquals(Box.ofExtents(-2, -2, -2, 3, 3, 3), new Box(0, 0, 0, 1, 1, 1).expandedBy(2));
	}

	@Test
	public void testRectangleShape() {
		Rectangle rect = Rectangle.fromCenter(new Coordinate(10, 10), 4, 6);
		assertEquals(new Rectangle(8, 7, 4, 6), rect);
		assertEquals(24, rect.area(), EPSILON);
		assertTrue(rect.contains(12, 13));
		assertFalse(rect.contains(12.01, 13));
		assertTrue(rect.intersects(new Rectangle(12, 13, 5, 5)));
		assertFalse(rect.intersects(new Rectangle(12.5, 13, 5, 5)));
		assertEquals(rect, Rectangle.fromEnvelope(rect.toEnvelope()));
		assertThrows(IllegalArgumentException.class, () -> new Rectangle(0, 0, -1, 1));
	}

	@Test
	public void testBoxShape() {
		Box box = Box.fromCenter(new Coordinate(0, 0, 0), 2, 4, 6);
		assertEquals(Box.ofExtents(-1, -2, -3, 1, 2, 3), box);
		assertEquals(48, box.volume(), EPSILON);
		assertTrue(box.contains(1, 2, 3));
		assertFalse(box.contains(1, 2, 3.5));
		assertTrue(box.intersects(new Box(1, 2, 3, 1, 1, 1)));
		assertEquals(new Rectangle(-1, -2, 2, 4), box.toRectangle());
		assertThrows(IllegalArgumentException.class, () -> new Box(0, 0, 0, 1, 1, -1));

		Box lifted = Box.fromRectangle(new Rectangle(0, 0, 10, 10));
		assertTrue(lifted.contains(5, 5, -1e300));
		assertTrue(lifted.contains(5, 5, 1e300));
		assertFalse(lifted.contains(11, 5, 0));
		assertEquals(Double.POSITIVE_INFINITY, lifted.getMaxZ());
	}

	@Test
	public void testCircleAndSphere() {
		Circle circle = new Circle(new Coordinate(0, 0, 99), 2);
		assertEquals(4 * Math.PI, circle.area(), EPSILON);
		assertTrue(circle.contains(new PositionedEntity("edge", 2, 0)));
		assertTrue(circle.intersects(new Rectangle(1, 1, 5, 5)));
		assertFalse(circle.intersects(new Rectangle(1.5, 1.5, 5, 5)));

		Sphere sphere = new Sphere(new Coordinate(0, 0), 3);
		assertEquals(36 * Math.PI, sphere.volume(), EPSILON);
		assertEquals(0, sphere.getCenter().z);
		assertTrue(sphere.contains(new PositionedEntity("flat", 3, 0)));
		assertFalse(sphere.contains(new PositionedEntity("deep", 0, 0, 3.1)));
		assertTrue(sphere.intersects(new Box(2, 2, -1, 5, 5, 2)));
		assertFalse(sphere.intersects(new Box(2, 2, 2, 5, 5, 5)));
		assertEquals(3, sphere.toCircle().getRadius());

		assertThrows(IllegalArgumentException.class, () -> new Circle(new Coordinate(0, 0), -1));
		assertThrows(IllegalArgumentException.class, () -> new Sphere(new Coordinate(0, 0, 0), -1));
	}
}
