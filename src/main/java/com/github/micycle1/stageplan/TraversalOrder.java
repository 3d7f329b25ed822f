package com.github.micycle1.stageplan;

import java.util.ArrayList;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Heuristic visiting orders that keep the stage travel between consecutive
 * points short. Paths are open (the stage does not return to the start) and
 * always begin at the requested start point.
 */
public enum TraversalOrder implements PointOrdering {

	/**
	 * Greedy path: from the current point, move to the closest unvisited point
	 * (Euclidean). Ties go to the lower input index.
	 */
	NEAREST_NEIGHBOR {
		@Override
		int[] tour(List<Coordinate> points, int startAt) {
			return nearestNeighbor(points, startAt);
		}
	},

	/**
	 * Nearest-neighbour path refined by 2-opt moves: a sub-path is reversed
	 * whenever that shortens the total length, until a pass finds no improvement
	 * or {@value #MAX_TWO_OPT_PASSES} passes have run. The start point stays
	 * first.
	 */
	TWO_OPT {
		@Override
		int[] tour(List<Coordinate> points, int startAt) {
			return twoOpt(points, startAt);
		}
	};

	static final int MAX_TWO_OPT_PASSES = 1000;

	private static final double EPS = 1e-12;

	abstract int[] tour(List<Coordinate> points, int startAt);

	@Override
	public List<Coordinate> order(List<Coordinate> points, int startAt) {
		if (points.isEmpty()) {
			return new ArrayList<>();
		}
		if (startAt < 0 || startAt >= points.size()) {
			throw new IllegalArgumentException("startAt must be in [0, " + points.size() + "), got " + startAt);
		}
		final int[] tour = tour(points, startAt);
		final List<Coordinate> out = new ArrayList<>(tour.length);
		for (int i : tour) {
			out.add(points.get(i));
		}
		return out;
	}

	/**
	 * Total length of the open path visiting {@code points} in {@code tour} order.
	 */
	static double pathLength(List<Coordinate> points, int[] tour) {
		double length = 0;
		for (int i = 1; i < tour.length; i++) {
			length += points.get(tour[i - 1]).distance(points.get(tour[i]));
		}
		return length;
	}

	private static int[] nearestNeighbor(List<Coordinate> points, int startAt) {
		final int n = points.size();
		final boolean[] visited = new boolean[n];
		final int[] tour = new int[n];
		int current = startAt;
		tour[0] = current;
		visited[current] = true;
		for (int k = 1; k < n; k++) {
			final Coordinate c = points.get(current);
			int nearest = -1;
			double best = Double.POSITIVE_INFINITY;
			for (int i = 0; i < n; i++) {
				if (visited[i]) {
					continue;
				}
				final double d = c.distance(points.get(i));
				if (d < best) {
					best = d;
					nearest = i;
				}
			}
			tour[k] = nearest;
			visited[nearest] = true;
			current = nearest;
		}
		return tour;
	}

	private static int[] twoOpt(List<Coordinate> points, int startAt) {
		final int[] tour = nearestNeighbor(points, startAt);
		final int n = tour.length;
		boolean improved = true;
		int pass = 0;
		while (improved && pass < MAX_TWO_OPT_PASSES) {
			improved = false;
			for (int i = 1; i < n - 1; i++) {
				for (int j = i + 1; j < n; j++) {
					// reversing tour[i..j] replaces edge (i-1, i) and, if j is not last, (j, j+1)
					final Coordinate a = points.get(tour[i - 1]);
					final Coordinate b = points.get(tour[i]);
					final Coordinate c = points.get(tour[j]);
					double before = a.distance(b);
					double after = a.distance(c);
					if (j + 1 < n) {
						final Coordinate d = points.get(tour[j + 1]);
						before += c.distance(d);
						after += b.distance(d);
					}
					if (after < before - EPS) {
						reverse(tour, i, j);
						improved = true;
					}
				}
			}
			pass++;
		}
		return tour;
	}

	private static void reverse(int[] a, int from, int to) {
		while (from < to) {
			final int t = a[from];
			a[from++] = a[to];
			a[to--] = t;
		}
	}
}
