package com.github.micycle1.stageplan;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;

/**
 * The {@link ShapeSampler} for each {@link Shape}.
 */
public final class ShapeSamplers {

	private static final Map<Shape, ShapeSampler> SAMPLERS;

	static {
		Map<Shape, ShapeSampler> samplers = new EnumMap<>(Shape.class);
		samplers.put(Shape.ELLIPSE, ShapeSamplers::ellipse);
		samplers.put(Shape.RECTANGLE, ShapeSamplers::rectangle);
		SAMPLERS = Collections.unmodifiableMap(samplers);
	}

	private ShapeSamplers() {
	}

	public static ShapeSampler forShape(Shape shape) {
		final ShapeSampler sampler = SAMPLERS.get(shape);
		if (sampler == null) {
			throw new IllegalArgumentException("No sampler for shape " + shape);
		}
		return sampler;
	}

	/**
	 * Draws points within the ellipse inscribed in the
	 * {@code maxWidth × maxHeight} box.
	 * <p>
	 * Each point takes three uniform draws {@code (u, v, t)}: an angle
	 * {@code θ = 2πt} and independent radial fractions on each axis,
	 * {@code x = u·(maxWidth/2)·cos θ}, {@code y = v·(maxHeight/2)·sin θ}. The
	 * result is not uniform over the ellipse's area: points concentrate towards the
	 * centre and the axes.
	 */
	static Coordinate[] ellipse(RandomGenerator random, int n, double maxWidth, double maxHeight) {
		final double rx = maxWidth / 2;
		final double ry = maxHeight / 2;
		final Coordinate[] points = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			final double u = random.nextDouble();
			final double v = random.nextDouble();
			final double angle = random.nextDouble() * 2 * FastMath.PI;
			points[i] = new Coordinate(u * rx * FastMath.cos(angle), v * ry * FastMath.sin(angle));
		}
		return points;
	}

	/**
	 * Draws points uniformly within {@code [-maxWidth/2, maxWidth/2) ×
	 * [-maxHeight/2, maxHeight/2)}.
	 */
	static Coordinate[] rectangle(RandomGenerator random, int n, double maxWidth, double maxHeight) {
		final Coordinate[] points = new Coordinate[n];
		for (int i = 0; i < n; i++) {
			final double x = random.nextDouble() * maxWidth - maxWidth / 2;
			final double y = random.nextDouble() * maxHeight - maxHeight / 2;
			points[i] = new Coordinate(x, y);
		}
		return points;
	}
}
