package com.github.micycle1.stageplan;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;

/**
 * The planar shape operations a polygon plan needs from a geometry backend.
 * <p>
 * Implementations are immutable: every operation returns a new region.
 *
 * @see JtsRegion
 * @see RegionFactory
 */
public interface Region {

	/**
	 * @return whether the region is a valid, simple (non self-intersecting) area
	 */
	boolean isValid();

	boolean isEmpty();

	/**
	 * Dilates (or, for negative distances, erodes) the region using round caps and
	 * joins.
	 */
	Region buffer(double distance);

	Region convexHull();

	/**
	 * Returns a region indexed for fast repeated {@link #intersects} queries.
	 */
	Region prepare();

	/**
	 * Tests whether the axis-aligned rectangle intersects the region. Touching
	 * boundaries count as intersecting.
	 */
	boolean intersects(double minX, double minY, double maxX, double maxY);

	/**
	 * @return the axis-aligned bounds of the region
	 */
	Envelope getEnvelope();

	/**
	 * @return the closed outer ring of the region, for plotting
	 */
	Coordinate[] getShell();
}
