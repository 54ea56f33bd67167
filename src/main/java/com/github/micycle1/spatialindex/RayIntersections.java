package com.github.micycle1.spatialindex;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers over ray-cast results.
 */
public final class RayIntersections {

	private RayIntersections() {
	}

	/**
	 * @return the intersection with the smallest distance (the first one on
	 *         ties), or null if the list is empty
	 */
	public static RayIntersection closest(List<RayIntersection> intersections) {
		RayIntersection closest = null;
		for (RayIntersection candidate : intersections) {
			if (closest == null || candidate.getDistance() < closest.getDistance()) {
				closest = candidate;
			}
		}
		return closest;
	}

	/**
	 * Intersections whose distance lies in {@code [minDistance, maxDistance]},
	 * in their original order.
	 */
	public static List<RayIntersection> filterByDistance(List<RayIntersection> intersections, double minDistance,
			double maxDistance) {
		List<RayIntersection> filtered = new ArrayList<>();
		for (RayIntersection intersection : intersections) {
			if (intersection.getDistance() >= minDistance && intersection.getDistance() <= maxDistance) {
				filtered.add(intersection);
			}
		}
		return filtered;
	}

	/**
	 * Euclidean distance between the ray points of two intersections (3D when
	 * both points carry z).
	 */
	public static double separation(RayIntersection a, RayIntersection b) {
		return Geometry.distance(a.getPoint(), b.getPoint());
	}
}
