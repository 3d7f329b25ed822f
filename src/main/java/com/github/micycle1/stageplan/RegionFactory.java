package com.github.micycle1.stageplan;

import org.locationtech.jts.geom.Coordinate;

/**
 * Creates a {@link Region} from polygon vertices.
 */
@FunctionalInterface
public interface RegionFactory {

	/**
	 * @param vertices polygon vertices, closed or not
	 * @throws IllegalArgumentException if the vertices cannot form a polygon
	 */
	Region polygon(Coordinate[] vertices);
}
