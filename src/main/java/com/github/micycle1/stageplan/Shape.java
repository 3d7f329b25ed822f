package com.github.micycle1.stageplan;

/**
 * Shape of the area random points are drawn from. Both shapes are centred on
 * the origin and span {@code maxWidth × maxHeight}.
 */
public enum Shape {
	ELLIPSE, RECTANGLE
}
