package com.github.micycle1.spatialindex;

import org.locationtech.jts.geom.Coordinate;

/**
 * A ray/entity hit: the entity, the distance along the ray to the point on the
 * ray closest to the entity, and that point.
 */
public final class RayIntersection {

	private final PositionedEntity entity;
	private final double distance;
	private final Coordinate point;
	private final double rayDistance;
	private final boolean directHit;

	public RayIntersection(PositionedEntity entity, double distance, Coordinate point, double rayDistance, boolean directHit) {
		this.entity = entity;
		this.distance = distance;
		this.point = point;
		this.rayDistance = rayDistance;
		this.directHit = directHit;
	}

	public PositionedEntity getEntity() {
		return entity;
	}

	public String getEntityId() {
		return entity.getId();
	}

	/**
	 * Distance along the ray from its origin to {@link #getPoint()}; never
	 * negative.
	 */
	public double getDistance() {
		return distance;
	}

	/**
	 * The point on the ray closest to the entity (z is NaN for a 2D cast).
	 */
	public Coordinate getPoint() {
		return new Coordinate(point);
	}

	/**
	 * Perpendicular distance from the entity to the ray.
	 */
	public double getRayDistance() {
		return rayDistance;
	}

	/**
	 * Whether the entity lies within the point-query tolerance of the ray, as
	 * opposed to only within the wider ray tolerance.
	 */
	public boolean isDirectHit() {
		return directHit;
	}

	@Override
	public String toString() {
		return "RayIntersection[" + entity.getId() + " @ " + distance + (directHit ? ", direct" : "") + "]";
	}
}
