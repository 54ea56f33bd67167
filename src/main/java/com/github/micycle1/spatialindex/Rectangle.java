package com.github.micycle1.spatialindex;

import java.io.Serializable;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * Axis-aligned 2D bounds, given by the min corner and non-negative width and
 * height. Containment and intersection are delegated to a JTS
 * {@link Envelope}; both are boundary inclusive.
 *
 * @author Michael Carleton
 */
public final class Rectangle implements Region<Rectangle>, Serializable {

	private static final long serialVersionUID = 1L;

	public static final Rectangle EMPTY = new Rectangle(0, 0, 0, 0);

	private final double x;
	private final double y;
	private final double width;
	private final double height;
	private final Envelope envelope;

	public Rectangle(double x, double y, double width, double height) {
		this(x, y, x + width, y + height, width, height);
	}

	private Rectangle(double minX, double minY, double maxX, double maxY, double width, double height) {
		if (width < 0 || height < 0) {
			throw new IllegalArgumentException("Rectangle extents must be non-negative: " + width + " x " + height);
		}
		this.x = minX;
		this.y = minY;
		this.width = width;
		this.height = height;
		this.envelope = new Envelope(minX, maxX, minY, maxY);
	}

	/**
	 * Creates a rectangle from its min and max corners. The corners are kept as
	 * given even where the width or height overflows to infinity.
	 */
	public static Rectangle ofExtents(double minX, double minY, double maxX, double maxY) {
		return new Rectangle(minX, minY, maxX, maxY, maxX - minX, maxY - minY);
	}

	/**
	 * Creates a rectangle of the given size centred on a point.
	 */
	public static Rectangle fromCenter(Coordinate center, double width, double height) {
		return new Rectangle(center.x - width / 2, center.y - height / 2, width, height);
	}

	/**
	 * Creates the rectangle covered by a (non-null) JTS envelope.
	 */
	public static Rectangle fromEnvelope(Envelope env) {
		return ofExtents(env.getMinX(), env.getMinY(), env.getMaxX(), env.getMaxY());
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getWidth() {
		return width;
	}

	public double getHeight() {
		return height;
	}

	public double getMaxX() {
		return envelope.getMaxX();
	}

	public double getMaxY() {
		return envelope.getMaxY();
	}

	public Coordinate getCenter() {
		return new Coordinate(x / 2 + getMaxX() / 2, y / 2 + getMaxY() / 2);
	}

	/**
	 * @return a defensive copy of the backing envelope
	 */
	public Envelope toEnvelope() {
		return new Envelope(envelope);
	}

	public boolean contains(double px, double py) {
		return envelope.covers(px, py);
	}

	@Override
	public boolean contains(PositionedEntity entity) {
		return contains(entity.getX(), entity.getY());
	}

	@Override
	public boolean intersects(Rectangle other) {
		return envelope.intersects(other.envelope);
	}

	public double area() {
		return width * height;
	}

	/**
	 * @return a copy grown by {@code margin} on every side
	 */
	public Rectangle expandedBy(double margin) {
		return ofExtents(x - margin, y - margin, getMaxX() + margin, getMaxY() + margin);
	}

	/**
	 * Splits this rectangle into four equal quadrants, ordered top-left,
	 * top-right, bottom-left, bottom-right (screen orientation, y grows
	 * downwards).
	 */
	Rectangle[] quadrants() {
		double maxX = getMaxX();
		double maxY = getMaxY();
		// halves first, so the midpoint cannot overflow
		double midX = x / 2 + maxX / 2;
		double midY = y / 2 + maxY / 2;
		return new Rectangle[] { ofExtents(x, y, midX, midY), ofExtents(midX, y, maxX, midY), ofExtents(x, midY, midX, maxY),
				ofExtents(midX, midY, maxX, maxY) };
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Rectangle)) {
			return false;
		}
		Rectangle other = (Rectangle) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0 && Double.compare(width, other.width) == 0
				&& Double.compare(height, other.height) == 0;
	}

	@Override
	public int hashCode() {
		int h = Double.hashCode(x);
		h = 31 * h + Double.hashCode(y);
		h = 31 * h + Double.hashCode(width);
		return 31 * h + Double.hashCode(height);
	}

	@Override
	public String toString() {
		return "Rectangle[x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "]";
	}
}
