package com.github.micycle1.spatialindex;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.math.Vector2D;
import org.locationtech.jts.math.Vector3D;

/**
 * A half-line in 2D or 3D. The direction is normalised on construction; a
 * zero-length direction stays the zero vector (such a ray hits nothing).
 *
 * @author Michael Carleton
 */
public final class Ray {

	private final Coordinate origin;
	private final double dx;
	private final double dy;
	private final double dz;
	private final boolean threeDimensional;

	private Ray(Coordinate origin, double dx, double dy, double dz, boolean threeDimensional) {
		this.origin = origin;
		this.dx = dx;
		this.dy = dy;
		this.dz = dz;
		this.threeDimensional = threeDimensional;
	}

	/**
	 * Creates a 2D ray. Any z ordinate of the origin is dropped.
	 */
	public static Ray of(Coordinate origin, Vector2D direction) {
		Objects.requireNonNull(origin, "origin");
		Vector2D d = Geometry.normalize(direction);
		return new Ray(new Coordinate(origin.x, origin.y), d.getX(), d.getY(), 0, false);
	}

	/**
	 * Creates a 3D ray. An origin without z is placed at z = 0.
	 */
	public static Ray of(Coordinate origin, Vector3D direction) {
		Objects.requireNonNull(origin, "origin");
		Vector3D d = Geometry.normalize(direction);
		double oz = Double.isNaN(origin.z) ? 0 : origin.z;
		return new Ray(new Coordinate(origin.x, origin.y, oz), d.getX(), d.getY(), d.getZ(), true);
	}

	public static Ray create2D(double ox, double oy, double dx, double dy) {
		return of(new Coordinate(ox, oy), new Vector2D(dx, dy));
	}

	public static Ray create3D(double ox, double oy, double oz, double dx, double dy, double dz) {
		return of(new Coordinate(ox, oy, oz), new Vector3D(dx, dy, dz));
	}

	/**
	 * Ray starting at {@code start} and pointing at {@code end}. The ray is 3D
	 * when both points carry z. Identical points give a zero direction.
	 */
	public static Ray fromPoints(Coordinate start, Coordinate end) {
		if (Geometry.isPoint3D(start) && Geometry.isPoint3D(end)) {
			return of(start, new Vector3D(end.x - start.x, end.y - start.y, end.z - start.z));
		}
		return of(start, new Vector2D(end.x - start.x, end.y - start.y));
	}

	/**
	 * 2D ray cast from the centre of a viewport towards a pointer position given
	 * in viewport pixels.
	 */
	public static Ray fromScreen(double pointerX, double pointerY, double viewportWidth, double viewportHeight) {
		double centerX = viewportWidth / 2;
		double centerY = viewportHeight / 2;
		return of(new Coordinate(centerX, centerY), new Vector2D(pointerX - centerX, pointerY - centerY));
	}

	/**
	 * Approximate camera pick ray: the camera-to-target direction nudged by the
	 * pointer offset from the viewport centre. Pointer coordinates are normalised
	 * to [0, 1]. This does not model field of view or aspect ratio.
	 */
	public static Ray fromCamera(double pointerX, double pointerY, Coordinate cameraPosition, Coordinate cameraTarget) {
		Vector3D view = Geometry.normalize(new Vector3D(cameraTarget.x - cameraPosition.x, cameraTarget.y - cameraPosition.y,
				cameraTarget.z - cameraPosition.z));
		Vector3D nudged = new Vector3D(view.getX() + (pointerX - 0.5) * 0.1, view.getY() + (pointerY - 0.5) * 0.1, view.getZ());
		return of(cameraPosition, nudged);
	}

	/**
	 * @return a copy of the origin; z is NaN for a 2D ray
	 */
	public Coordinate getOrigin() {
		return new Coordinate(origin);
	}

	public double getOriginX() {
		return origin.x;
	}

	public double getOriginY() {
		return origin.y;
	}

	/**
	 * @return the origin z, or 0 for a 2D ray
	 */
	public double getOriginZ() {
		return threeDimensional ? origin.z : 0;
	}

	public double getDirectionX() {
		return dx;
	}

	public double getDirectionY() {
		return dy;
	}

	/**
	 * @return the direction's z component, 0 for a 2D ray
	 */
	public double getDirectionZ() {
		return dz;
	}

	public Vector2D getDirection2D() {
		return new Vector2D(dx, dy);
	}

	public Vector3D getDirection3D() {
		return new Vector3D(dx, dy, dz);
	}

	public boolean is3D() {
		return threeDimensional;
	}

	/**
	 * Whether the direction is the zero vector.
	 */
	public boolean isDegenerate() {
		return dx == 0 && dy == 0 && dz == 0;
	}

	/**
	 * The point at parameter {@code t} along the ray.
	 */
	public Coordinate pointAt(double t) {
		if (threeDimensional) {
			return new Coordinate(origin.x + t * dx, origin.y + t * dy, origin.z + t * dz);
		}
		return new Coordinate(origin.x + t * dx, origin.y + t * dy);
	}

	/**
	 * Projects this ray onto the XY plane, re-normalising the direction. A 2D ray
	 * is returned as is.
	 */
	public Ray projectTo2D() {
		if (!threeDimensional) {
			return this;
		}
		return of(origin, new Vector2D(dx, dy));
	}

	/**
	 * Lifts this ray into the plane {@code z}, moving parallel to it. A 3D ray is
	 * returned as is.
	 */
	public Ray liftTo3D(double z) {
		if (threeDimensional) {
			return this;
		}
		return of(new Coordinate(origin.x, origin.y, z), new Vector3D(dx, dy, 0));
	}

	@Override
	public String toString() {
		if (threeDimensional) {
			return "Ray3D[origin=(" + origin.x + ", " + origin.y + ", " + origin.z + "), dir=(" + dx + ", " + dy + ", " + dz
					+ ")]";
		}
		return "Ray2D[origin=(" + origin.x + ", " + origin.y + "), dir=(" + dx + ", " + dy + ")]";
	}
}
