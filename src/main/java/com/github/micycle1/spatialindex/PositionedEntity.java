package com.github.micycle1.spatialindex;

import java.io.Serializable;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * An entity that a layout pass has already placed in 2D or 3D space. The index
 * stores references to these objects; it never copies or mutates them.
 * <p>
 * A missing z coordinate is stored as {@link Double#NaN}, the same convention
 * JTS uses for {@link Coordinate}.
 *
 * @author Michael Carleton
 */
public final class PositionedEntity implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String id;
	private final double x;
	private final double y;
	private final double z;

	/**
	 * Creates a 2D entity.
	 */
	public PositionedEntity(String id, double x, double y) {
		this(id, x, y, Double.NaN);
	}

	/**
	 * Creates an entity; pass {@link Double#NaN} as {@code z} for a 2D entity.
	 */
	public PositionedEntity(String id, double x, double y, double z) {
		this.id = Objects.requireNonNull(id, "id");
		this.x = x;
		this.y = y;
		this.z = z;
	}

	public String getId() {
		return id;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	/**
	 * @return the z coordinate, or NaN when this is a 2D entity
	 */
	public double getZ() {
		return z;
	}

	/**
	 * @return the z coordinate, or 0 when this is a 2D entity
	 */
	public double getZOrZero() {
		return hasZ() ? z : 0;
	}

	public boolean hasZ() {
		return !Double.isNaN(z);
	}

	/**
	 * @return a new coordinate for this entity's position (z is NaN for 2D)
	 */
	public Coordinate getCoordinate() {
		return new Coordinate(x, y, z);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PositionedEntity)) {
			return false;
		}
		PositionedEntity other = (PositionedEntity) o;
		return id.equals(other.id) && Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
				&& Double.compare(z, other.z) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, x, y, z);
	}

	@Override
	public String toString() {
		if (hasZ()) {
			return "PositionedEntity[" + id + " (" + x + ", " + y + ", " + z + ")]";
		}
		return "PositionedEntity[" + id + " (" + x + ", " + y + ")]";
	}
}
