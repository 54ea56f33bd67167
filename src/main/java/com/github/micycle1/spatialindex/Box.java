package com.github.micycle1.spatialindex;

import java.io.Serializable;

import org.locationtech.jts.geom.Coordinate;

/**
 * Axis-aligned 3D bounds. Stored as min/max extents so that a box may be
 * unbounded along an axis (see {@link #fromRectangle(Rectangle)}).
 * Containment and intersection are boundary inclusive.
 *
 * @author Michael Carleton
 */
public final class Box implements Region<Box>, Serializable {

	private static final long serialVersionUID = 1L;

	public static final Box EMPTY = new Box(0, 0, 0, 0, 0, 0);

	private final double minX;
	private final double minY;
	private final double minZ;
	private final double maxX;
	private final double maxY;
	private final double maxZ;

	public Box(double x, double y, double z, double width, double height, double depth) {
		this(x, y, z, x + width, y + height, z + depth, width, height, depth);
	}

	private Box(double minX, double minY, double minZ, double maxX, double maxY, double maxZ, double width, double height,
			double depth) {
		if (width < 0 || height < 0 || depth < 0) {
			throw new IllegalArgumentException("Box extents must be non-negative: " + width + " x " + height + " x " + depth);
		}
		this.minX = minX;
		this.minY = minY;
		this.minZ = minZ;
		this.maxX = maxX;
		this.maxY = maxY;
		this.maxZ = maxZ;
	}

	/**
	 * Creates a box from its min and max corners.
	 */
	public static Box ofExtents(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {
		return new Box(minX, minY, minZ, maxX, maxY, maxZ, maxX - minX, maxY - minY, maxZ - minZ);
	}

	/**
	 * Creates a box of the given size centred on a point (a missing z counts as 0).
	 */
	public static Box fromCenter(Coordinate center, double width, double height, double depth) {
		double cz = Double.isNaN(center.z) ? 0 : center.z;
		return new Box(center.x - width / 2, center.y - height / 2, cz - depth / 2, width, height, depth);
	}

	/**
	 * Lifts a 2D rectangle into a box spanning the whole z axis.
	 */
	public static Box fromRectangle(Rectangle rect) {
		return ofExtents(rect.getX(), rect.getY(), Double.NEGATIVE_INFINITY, rect.getMaxX(), rect.getMaxY(),
				Double.POSITIVE_INFINITY);
	}

	public double getX() {
		return minX;
	}

	public double getY() {
		return minY;
	}

	public double getZ() {
		return minZ;
	}

	public double getMaxX() {
		return maxX;
	}

	public double getMaxY() {
		return maxY;
	}

	public double getMaxZ() {
		return maxZ;
	}

	public double getWidth() {
		return maxX - minX;
	}

	public double getHeight() {
		return maxY - minY;
	}

	public double getDepth() {
		return maxZ - minZ;
	}

	/**
	 * Mid point along z. For an unbounded box this is NaN.
	 */
	public double getMidZ() {
		return minZ / 2 + maxZ / 2;
	}

	public Coordinate getCenter() {
		return new Coordinate(minX / 2 + maxX / 2, minY / 2 + maxY / 2, getMidZ());
	}

	/**
	 * Drops the z extent.
	 */
	public Rectangle toRectangle() {
		return Rectangle.ofExtents(minX, minY, maxX, maxY);
	}

	public boolean contains(double px, double py, double pz) {
		return px >= minX && px <= maxX && py >= minY && py <= maxY && pz >= minZ && pz <= maxZ;
	}

	@Override
	public boolean contains(PositionedEntity entity) {
		return contains(entity.getX(), entity.getY(), entity.getZOrZero());
	}

	@Override
	public boolean intersects(Box other) {
		return !(other.minX > maxX || other.maxX < minX || other.minY > maxY || other.maxY < minY || other.minZ > maxZ
				|| other.maxZ < minZ);
	}

	public double volume() {
		return getWidth() * getHeight() * getDepth();
	}

	/**
	 * @return a copy grown by {@code margin} on every side
	 */
	public Box expandedBy(double margin) {
		return ofExtents(minX - margin, minY - margin, minZ - margin, maxX + margin, maxY + margin, maxZ + margin);
	}

	/**
	 * Splits this box into eight equal octants: front face first (lower z), each
	 * face ordered top-left, top-right, bottom-left, bottom-right.
	 */
	Box[] octants() {
		Coordinate mid = getCenter();
		Box[] octants = new Box[8];
		for (int i = 0; i < 8; i++) {
			boolean right = (i & 1) != 0;
			boolean bottom = (i & 2) != 0;
			boolean back = (i & 4) != 0;
			octants[i] = ofExtents(right ? mid.x : minX, bottom ? mid.y : minY, back ? mid.z : minZ, right ? maxX : mid.x,
					bottom ? maxY : mid.y, back ? maxZ : mid.z);
		}
		return octants;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Box)) {
			return false;
		}
		Box other = (Box) o;
		return Double.compare(minX, other.minX) == 0 && Double.compare(minY, other.minY) == 0
				&& Double.compare(minZ, other.minZ) == 0 && Double.compare(maxX, other.maxX) == 0
				&& Double.compare(maxY, other.maxY) == 0 && Double.compare(maxZ, other.maxZ) == 0;
	}

	@Override
	public int hashCode() {
		int h = Double.hashCode(minX);
		h = 31 * h + Double.hashCode(minY);
		h = 31 * h + Double.hashCode(minZ);
		h = 31 * h + Double.hashCode(maxX);
		h = 31 * h + Double.hashCode(maxY);
		return 31 * h + Double.hashCode(maxZ);
	}

	@Override
	public String toString() {
		return "Box[x=" + minX + ", y=" + minY + ", z=" + minZ + ", w=" + getWidth() + ", h=" + getHeight() + ", d="
				+ getDepth() + "]";
	}
}
