package com.github.micycle1.spatialindex;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.spatialindex.SpatialIndexException.ErrorKind;

/**
 * Immutable tree and intersection settings. Values are validated on
 * construction; every {@code withX} method returns a validated copy.
 * <p>
 * {@code enableCaching} and {@code cacheSize} are carried for callers that
 * cache query results on top of the index; the trees themselves never cache.
 *
 * @author Michael Carleton
 */
public final class SpatialIndexConfig {

	private static final Logger log = LoggerFactory.getLogger(SpatialIndexConfig.class);

	public static final String MAX_DEPTH = "maxDepth";
	public static final String MAX_NODES_PER_LEAF = "maxNodesPerLeaf";
	public static final String RAY_INTERSECTION_TOLERANCE = "rayIntersectionTolerance";
	public static final String POINT_QUERY_TOLERANCE = "pointQueryTolerance";
	public static final String ENABLE_CACHING = "enableCaching";
	public static final String CACHE_SIZE = "cacheSize";

	public static final SpatialIndexConfig DEFAULT = new SpatialIndexConfig(10, 10, 1.0, 0.1, true, 100);

	private final int maxDepth;
	private final int maxNodesPerLeaf;
	private final double rayIntersectionTolerance;
	private final double pointQueryTolerance;
	private final boolean enableCaching;
	private final int cacheSize;

	/**
	 * @throws SpatialIndexException of kind {@link ErrorKind#CONFIGURATION} if
	 *                               any value is out of range
	 */
	public SpatialIndexConfig(int maxDepth, int maxNodesPerLeaf, double rayIntersectionTolerance, double pointQueryTolerance,
			boolean enableCaching, int cacheSize) {
		if (maxDepth <= 0) {
			throw invalid(MAX_DEPTH + " must be positive, got " + maxDepth);
		}
		if (maxNodesPerLeaf <= 0) {
			throw invalid(MAX_NODES_PER_LEAF + " must be positive, got " + maxNodesPerLeaf);
		}
		if (!(rayIntersectionTolerance >= 0)) {
			throw invalid(RAY_INTERSECTION_TOLERANCE + " must be non-negative, got " + rayIntersectionTolerance);
		}
		if (!(pointQueryTolerance >= 0)) {
			throw invalid(POINT_QUERY_TOLERANCE + " must be non-negative, got " + pointQueryTolerance);
		}
		if (cacheSize < 0) {
			throw invalid(CACHE_SIZE + " must be non-negative, got " + cacheSize);
		}
		this.maxDepth = maxDepth;
		this.maxNodesPerLeaf = maxNodesPerLeaf;
		this.rayIntersectionTolerance = rayIntersectionTolerance;
		this.pointQueryTolerance = pointQueryTolerance;
		this.enableCaching = enableCaching;
		this.cacheSize = cacheSize;
	}

	/** Shallow trees with large leaves. */
	public static SpatialIndexConfig fast() {
		return new SpatialIndexConfig(6, 20, DEFAULT.rayIntersectionTolerance, DEFAULT.pointQueryTolerance, true, 50);
	}

	/** Deep trees with small leaves and tight tolerances. */
	public static SpatialIndexConfig precise() {
		return new SpatialIndexConfig(12, 5, 0.5, 0.05, true, 200);
	}

	public static SpatialIndexConfig balanced() {
		return DEFAULT;
	}

	public static SpatialIndexConfig memoryEfficient() {
		return new SpatialIndexConfig(8, 15, DEFAULT.rayIntersectionTolerance, DEFAULT.pointQueryTolerance, false, 0);
	}

	/**
	 * Reads a configuration from properties, using {@link #DEFAULT} for any key
	 * that is absent.
	 *
	 * @throws SpatialIndexException of kind {@link ErrorKind#CONFIGURATION} for
	 *                               malformed or out-of-range values
	 */
	public static SpatialIndexConfig fromProperties(Properties props) {
		try {
			return new SpatialIndexConfig(intValue(props, MAX_DEPTH, DEFAULT.maxDepth),
					intValue(props, MAX_NODES_PER_LEAF, DEFAULT.maxNodesPerLeaf),
					doubleValue(props, RAY_INTERSECTION_TOLERANCE, DEFAULT.rayIntersectionTolerance),
					doubleValue(props, POINT_QUERY_TOLERANCE, DEFAULT.pointQueryTolerance),
					Boolean.parseBoolean(props.getProperty(ENABLE_CACHING, Boolean.toString(DEFAULT.enableCaching)).trim()),
					intValue(props, CACHE_SIZE, DEFAULT.cacheSize));
		} catch (NumberFormatException e) {
			throw new SpatialIndexException(ErrorKind.CONFIGURATION, "Malformed number in spatial index properties", e);
		}
	}

	/**
	 * Loads a properties file from the classpath and reads it with
	 * {@link #fromProperties(Properties)}.
	 */
	public static SpatialIndexConfig fromResource(String resourceName) {
		Properties props = new Properties();
		try (InputStream in = SpatialIndexConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in == null) {
				throw new SpatialIndexException(ErrorKind.CONFIGURATION, "Resource not found: " + resourceName);
			}
			props.load(in);
		} catch (IOException e) {
			throw new SpatialIndexException(ErrorKind.CONFIGURATION, "Could not read " + resourceName, e);
		}
		SpatialIndexConfig config = fromProperties(props);
		log.debug("Loaded {} from {}", config, resourceName);
		return config;
	}

	private static int intValue(Properties props, String key, int defaultValue) {
		String value = props.getProperty(key);
		return value == null ? defaultValue : Integer.parseInt(value.trim());
	}

	private static double doubleValue(Properties props, String key, double defaultValue) {
		String value = props.getProperty(key);
		return value == null ? defaultValue : Double.parseDouble(value.trim());
	}

	private static SpatialIndexException invalid(String message) {
		return new SpatialIndexException(ErrorKind.CONFIGURATION, message);
	}

	public int getMaxDepth() {
		return maxDepth;
	}

	public int getMaxNodesPerLeaf() {
		return maxNodesPerLeaf;
	}

	public double getRayIntersectionTolerance() {
		return rayIntersectionTolerance;
	}

	public double getPointQueryTolerance() {
		return pointQueryTolerance;
	}

	public boolean isCachingEnabled() {
		return enableCaching;
	}

	public int getCacheSize() {
		return cacheSize;
	}

	public SpatialIndexConfig withMaxDepth(int value) {
		return new SpatialIndexConfig(value, maxNodesPerLeaf, rayIntersectionTolerance, pointQueryTolerance, enableCaching,
				cacheSize);
	}

	public SpatialIndexConfig withMaxNodesPerLeaf(int value) {
		return new SpatialIndexConfig(maxDepth, value, rayIntersectionTolerance, pointQueryTolerance, enableCaching, cacheSize);
	}

	public SpatialIndexConfig withRayIntersectionTolerance(double value) {
		return new SpatialIndexConfig(maxDepth, maxNodesPerLeaf, value, pointQueryTolerance, enableCaching, cacheSize);
	}

	public SpatialIndexConfig withPointQueryTolerance(double value) {
		return new SpatialIndexConfig(maxDepth, maxNodesPerLeaf, rayIntersectionTolerance, value, enableCaching, cacheSize);
	}

	public SpatialIndexConfig withCaching(boolean enabled, int size) {
		return new SpatialIndexConfig(maxDepth, maxNodesPerLeaf, rayIntersectionTolerance, pointQueryTolerance, enabled, size);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SpatialIndexConfig)) {
			return false;
		}
		SpatialIndexConfig other = (SpatialIndexConfig) o;
		return maxDepth == other.maxDepth && maxNodesPerLeaf == other.maxNodesPerLeaf
				&& Double.compare(rayIntersectionTolerance, other.rayIntersectionTolerance) == 0
				&& Double.compare(pointQueryTolerance, other.pointQueryTolerance) == 0 && enableCaching == other.enableCaching
				&& cacheSize == other.cacheSize;
	}

	@Override
	public int hashCode() {
		int h = maxDepth;
		h = 31 * h + maxNodesPerLeaf;
		h = 31 * h + Double.hashCode(rayIntersectionTolerance);
		h = 31 * h + Double.hashCode(pointQueryTolerance);
		h = 31 * h + Boolean.hashCode(enableCaching);
		return 31 * h + cacheSize;
	}

	@Override
	public String toString() {
		return "SpatialIndexConfig[maxDepth=" + maxDepth + ", maxNodesPerLeaf=" + maxNodesPerLeaf + ", rayTolerance="
				+ rayIntersectionTolerance + ", pointTolerance=" + pointQueryTolerance + ", caching=" + enableCaching + "/"
				+ cacheSize + "]";
	}
}
