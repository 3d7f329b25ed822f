package com.github.micycle1.stageplan;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Reorders a set of points into a visiting sequence.
 * <p>
 * Implementations must return a permutation of the input: no point added,
 * removed or duplicated. The input list is not modified.
 *
 * @see TraversalOrder
 */
@FunctionalInterface
public interface PointOrdering {

	/**
	 * @param points  the points to visit
	 * @param startAt index into {@code points} of the point to visit first
	 * @return the points in visiting order
	 */
	List<Coordinate> order(List<Coordinate> points, int startAt);
}
