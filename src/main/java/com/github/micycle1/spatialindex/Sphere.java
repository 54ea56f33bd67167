package com.github.micycle1.spatialindex;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A spherical 3D query region. A centre without z is placed at z = 0.
 */
public final class Sphere implements Region<Box> {

	private final Coordinate center;
	private final double radius;

	public Sphere(Coordinate center, double radius) {
		if (radius < 0) {
			throw new IllegalArgumentException("Sphere radius must be non-negative: " + radius);
		}
		Objects.requireNonNull(center, "center");
		this.center = new Coordinate(center.x, center.y, Double.isNaN(center.z) ? 0 : center.z);
		this.radius = radius;
	}

	public Coordinate getCenter() {
		return new Coordinate(center);
	}

	public double getRadius() {
		return radius;
	}

	public double volume() {
		return (4.0 / 3.0) * Math.PI * radius * radius * radius;
	}

	/**
	 * Drops the z ordinate, keeping the radius.
	 */
	public Circle toCircle() {
		return new Circle(center, radius);
	}

	/**
	 * Closest point on the box to the centre, compared against the radius.
	 */
	@Override
	public boolean intersects(Box bounds) {
		double closestX = Math.max(bounds.getX(), Math.min(center.x, bounds.getMaxX()));
		double closestY = Math.max(bounds.getY(), Math.min(center.y, bounds.getMaxY()));
		double closestZ = Math.max(bounds.getZ(), Math.min(center.z, bounds.getMaxZ()));
		double dx = center.x - closestX;
		double dy = center.y - closestY;
		double dz = center.z - closestZ;
		return dx * dx + dy * dy + dz * dz <= radius * radius;
	}

	@Override
	public boolean contains(PositionedEntity entity) {
		double dx = entity.getX() - center.x;
		double dy = entity.getY() - center.y;
		double dz = entity.getZOrZero() - center.z;
		return dx * dx + dy * dy + dz * dz <= radius * radius;
	}

	@Override
	public String toString() {
		return "Sphere[center=(" + center.x + ", " + center.y + ", " + center.z + "), r=" + radius + "]";
	}
}
