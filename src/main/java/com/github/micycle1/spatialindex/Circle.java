package com.github.micycle1.spatialindex;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A circular 2D query region. Any z ordinate of the centre is ignored.
 */
public final class Circle implements Region<Rectangle> {

	private final Coordinate center;
	private final double radius;

	public Circle(Coordinate center, double radius) {
		if (radius < 0) {
			throw new IllegalArgumentException("Circle radius must be non-negative: " + radius);
		}
		this.center = new Coordinate(Objects.requireNonNull(center, "center").x, center.y);
		this.radius = radius;
	}

	public Coordinate getCenter() {
		return new Coordinate(center);
	}

	public double getRadius() {
		return radius;
	}

	public double area() {
		return Math.PI * radius * radius;
	}

	/**
	 * Closest point on the rectangle to the centre, compared against the radius.
	 */
	@Override
	public boolean intersects(Rectangle bounds) {
		double closestX = Math.max(bounds.getX(), Math.min(center.x, bounds.getMaxX()));
		double closestY = Math.max(bounds.getY(), Math.min(center.y, bounds.getMaxY()));
		double dx = center.x - closestX;
		double dy = center.y - closestY;
		return dx * dx + dy * dy <= radius * radius;
	}

	@Override
	public boolean contains(PositionedEntity entity) {
		double dx = entity.getX() - center.x;
		double dy = entity.getY() - center.y;
		return dx * dx + dy * dy <= radius * radius;
	}

	@Override
	public String toString() {
		return "Circle[center=(" + center.x + ", " + center.y + "), r=" + radius + "]";
	}
}
