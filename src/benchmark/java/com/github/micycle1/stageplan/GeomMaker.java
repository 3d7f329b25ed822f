package com.github.micycle1.stageplan;

import java.util.SplittableRandom;

import org.locationtech.jts.algorithm.hull.ConcaveHull;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

/**
 * Random, valid polygon shells for tests and benchmarks.
 */
class GeomMaker {

	private static final GeometryFactory FACTORY = new GeometryFactory();

	/**
	 * Makes the closed shell of a concave polygon spanning roughly
	 * {@code [0, size] × [0, size]}.
	 */
	static Coordinate[] makeShell(int points, double size, long seed) {
		var coords = plasticJitteredLDS(0, 0, size, size, points, seed);
		var g = FACTORY.createMultiPointFromCoords(coords);
		Geometry hull = new ConcaveHull(g).getHull().buffer(0);
		return JtsRegion.of(hull).getShell();
	}

	/**
	 * Makes {@code n} points spread over {@code [0, size) × [0, size)}.
	 */
	static Coordinate[] makePoints(int n, double size, long seed) {
		final SplittableRandom random = new SplittableRandom(seed);
		final Coordinate[] points = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			points[i] = new Coordinate(random.nextDouble() * size, random.nextDouble() * size);
		}
		return points;
	}

	private static Coordinate[] plasticJitteredLDS(double xMin, double yMin, double xMax, double yMax, int n, long seed) {
		final double w = xMax - xMin;
		final double h = yMax - yMin;

		final SplittableRandom random = new SplittableRandom(seed);
		final double p = 1.32471795724474602596; // plastic constant
		final double a1 = 1.0 / p;
		final double a2 = 1.0 / (p * p);
		final double jitter = 0.732;

		final Coordinate[] points = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			double x = (((random.nextDouble() * jitter / Math.sqrt(i + 1d) + a1 * i) % 1) * w + xMin);
			double y = (((random.nextDouble() * jitter / Math.sqrt(i + 1d) + a2 * i) % 1) * h + yMin);
			points[i] = new Coordinate(x, y);
		}
		return points;
	}
}
