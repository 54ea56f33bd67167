package com.github.micycle1.spatialindex;

/**
 * Capacity diagnostics for a built index. The memory figure is a heuristic
 * estimate only.
 */
public final class SpatialIndexStats {

	private final int entityCount;
	private final int maxDepth;
	private final double averageDepth;
	private final long memoryUsageBytes;
	private final double buildTimeMs;
	private final long lastBuildTimestamp;
	private final int leafCount;
	private final int treeNodeCount;

	public SpatialIndexStats(int entityCount, int maxDepth, double averageDepth, long memoryUsageBytes, double buildTimeMs,
			long lastBuildTimestamp, int leafCount, int treeNodeCount) {
		this.entityCount = entityCount;
		this.maxDepth = maxDepth;
		this.averageDepth = averageDepth;
		this.memoryUsageBytes = memoryUsageBytes;
		this.buildTimeMs = buildTimeMs;
		this.lastBuildTimestamp = lastBuildTimestamp;
		this.leafCount = leafCount;
		this.treeNodeCount = treeNodeCount;
	}

	/**
	 * Statistics of an index holding nothing.
	 */
	public static SpatialIndexStats empty(double buildTimeMs, long lastBuildTimestamp) {
		return new SpatialIndexStats(0, 0, 0, 0, buildTimeMs, lastBuildTimestamp, 0, 0);
	}

	/**
	 * @return a copy with the timing fields replaced
	 */
	public SpatialIndexStats withBuildTiming(double buildTimeMs, long lastBuildTimestamp) {
		return new SpatialIndexStats(entityCount, maxDepth, averageDepth, memoryUsageBytes, buildTimeMs, lastBuildTimestamp,
				leafCount, treeNodeCount);
	}

	/** Entities stored in the tree. */
	public int getEntityCount() {
		return entityCount;
	}

	/** Deepest node level reached (root is 0). */
	public int getMaxDepth() {
		return maxDepth;
	}

	/** Mean level of the leaf nodes. */
	public double getAverageDepth() {
		return averageDepth;
	}

	public long getMemoryUsageBytes() {
		return memoryUsageBytes;
	}

	public double getBuildTimeMs() {
		return buildTimeMs;
	}

	/** Epoch millis at which the last build finished; 0 if never built. */
	public long getLastBuildTimestamp() {
		return lastBuildTimestamp;
	}

	public int getLeafCount() {
		return leafCount;
	}

	/** Tree nodes in the arena, leaves and internal nodes together. */
	public int getTreeNodeCount() {
		return treeNodeCount;
	}

	@Override
	public String toString() {
		return "SpatialIndexStats[entities=" + entityCount + ", maxDepth=" + maxDepth + ", avgDepth="
				+ String.format("%.2f", averageDepth) + ", leaves=" + leafCount + ", treeNodes=" + treeNodeCount + ", ~"
				+ memoryUsageBytes + "B, build=" + String.format("%.3f", buildTimeMs) + "ms]";
	}
}
