package com.github.micycle1.stageplan;

import java.util.Collections;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;

/**
 * Outcome of one sampling run of {@link RandomPoints}: the points in visiting
 * order and how far short of the requested count the run fell.
 */
public final class SampledPoints {

	private final List<Coordinate> points;
	private final int requested;

	SampledPoints(List<Coordinate> points, int requested) {
		this.points = Collections.unmodifiableList(points);
		this.requested = requested;
	}

	public List<Coordinate> getPoints() {
		return points;
	}

	public int getRequested() {
		return requested;
	}

	/**
	 * @return whether the requested number of points was reached
	 */
	public boolean isComplete() {
		return points.size() >= requested;
	}

	public int getShortfall() {
		return Math.max(0, requested - points.size());
	}
}
