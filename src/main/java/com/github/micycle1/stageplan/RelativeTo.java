package com.github.micycle1.stageplan;

/**
 * Point of a relative grid that sits on the origin.
 */
public enum RelativeTo {
	/** The grid is centred on the origin. */
	CENTER,
	/** The top-left cell sits on the origin. */
	TOP_LEFT
}
