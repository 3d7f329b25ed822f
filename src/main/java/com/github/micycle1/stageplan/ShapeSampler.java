package com.github.micycle1.stageplan;

import org.apache.commons.math3.random.RandomGenerator;
import org.locationtech.jts.geom.Coordinate;

/**
 * Draws raw candidate points inside a shape centred on the origin.
 */
@FunctionalInterface
public interface ShapeSampler {

	/**
	 * @param random    the random source; consumed in a fixed order so a seeded
	 *                  source yields a reproducible sequence
	 * @param n         number of points to draw (&gt;= 0)
	 * @param maxWidth  full width of the shape
	 * @param maxHeight full height of the shape
	 * @return {@code n} points
	 */
	Coordinate[] sample(RandomGenerator random, int n, double maxWidth, double maxHeight);
}
