package com.github.micycle1.stageplan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relative plan of random points inside an ellipse or rectangle centred on the
 * origin.
 *
 * <h3>Sampling</h3>
 * <ul>
 * <li>The random source is a Mersenne Twister seeded with {@code randomSeed},
 * or an unseeded one when no seed is set. With a seed every iteration yields
 * the same points in the same order.</li>
 * <li>A {@link Position} {@code startAt} is always the first accepted point; an
 * index {@code startAt} only selects where the ordering starts.</li>
 * <li>When {@code allowOverlap} is false and a FOV is set, candidates are drawn
 * in rounds and a candidate is rejected if its FOV rectangle would overlap the
 * rectangle of an already accepted point. At most
 * {@value #MAX_RANDOM_CANDIDATES} candidates are drawn; falling short of
 * {@code numPoints} is reported, not raised.</li>
 * <li>If an {@link PointOrdering order} is set, the accepted points are visited
 * in that order, otherwise in generation order.</li>
 * </ul>
 */
public class RandomPoints implements MultiPointPlan {

	private static final Logger logger = LoggerFactory.getLogger(RandomPoints.class);

	/** Upper bound on the candidates drawn by one overlap-avoiding run. */
	public static final int MAX_RANDOM_CANDIDATES = 10000;

	private final int numPoints;
	private final double maxWidth;
	private final double maxHeight;
	private final Shape shape;
	private final Long randomSeed;
	private final boolean allowOverlap;
	private final PointOrdering order;
	private final Integer startIndex;
	private final Position startPosition;
	private final Double fovWidth;
	private final Double fovHeight;
	private final List<String> warnings;

	private RandomPoints(Builder builder) {
		this.numPoints = builder.numPoints;
		this.maxWidth = builder.maxWidth;
		this.maxHeight = builder.maxHeight;
		this.shape = builder.shape;
		this.randomSeed = builder.randomSeed;
		this.allowOverlap = builder.allowOverlap;
		this.order = builder.order;
		this.startPosition = builder.startPosition;
		this.fovWidth = builder.fovWidth;
		this.fovHeight = builder.fovHeight;

		List<String> warnings = new ArrayList<>();
		if (startPosition == null && builder.startIndex > numPoints - 1) {
			String warning = "startAt " + builder.startIndex + " is greater than the number of points. Setting startAt to last point (" + (numPoints - 1) + ").";
			logger.warn(warning);
			warnings.add(warning);
			this.startIndex = numPoints - 1;
		} else {
			this.startIndex = startPosition == null ? builder.startIndex : null;
		}
		this.warnings = Collections.unmodifiableList(warnings);
	}

	/**
	 * @param numPoints number of points to generate (&gt; 0)
	 */
	public static Builder builder(int numPoints) {
		return new Builder(numPoints);
	}

	/**
	 * Runs the sampler once.
	 *
	 * @return the points in visiting order, with any shortfall against
	 *         {@code numPoints}
	 */
	public SampledPoints samplePoints() {
		final RandomGenerator random = randomSeed == null ? new MersenneTwister() : new MersenneTwister(randomSeed);
		final ShapeSampler sampler = ShapeSamplers.forShape(shape);

		List<Coordinate> points = new ArrayList<>(numPoints);
		int needed = numPoints;
		int start = startIndex == null ? 0 : startIndex;
		if (startPosition != null) {
			points.add(startPosition.toCoordinate());
			needed--;
			start = 0;
		}

		if (allowOverlap || fovWidth == null || fovHeight == null) {
			Collections.addAll(points, sampler.sample(random, needed, maxWidth, maxHeight));
		} else {
			final int perRound = needed;
			int drawn = 0;
			int rounds = 0;
			while (drawn < MAX_RANDOM_CANDIDATES && points.size() < numPoints) {
				final Coordinate[] candidates = sampler.sample(random, perRound, maxWidth, maxHeight);
				drawn += perRound;
				rounds++;
				for (Coordinate c : candidates) {
					if (isSeparated(points, c, fovWidth, fovHeight)) {
						points.add(c);
						if (points.size() >= numPoints) {
							break;
						}
					}
				}
			}
			logger.debug("Accepted {} of {} non-overlapping points after {} rounds ({} candidates)", points.size(), numPoints, rounds, drawn);
			if (points.size() < numPoints) {
				logger.warn("Unable to generate {} non-overlapping points. Only {} points were found.", numPoints, points.size());
			}
		}

		if (order != null && !points.isEmpty()) {
			points = order.order(points, Math.min(start, points.size() - 1));
		}
		return new SampledPoints(points, numPoints);
	}

	/**
	 * Tests whether the FOV rectangle centred on {@code c} stays clear of the
	 * rectangles of all accepted points, i.e. for every accepted point the offset
	 * is at least {@code minDx} in x or at least {@code minDy} in y.
	 */
	static boolean isSeparated(List<Coordinate> accepted, Coordinate c, double minDx, double minDy) {
		for (Coordinate p : accepted) {
			if (Math.abs(c.x - p.x) < minDx && Math.abs(c.y - p.y) < minDy) {
				return false;
			}
		}
		return true;
	}

	@Override
	public Iterator<Position> iterator() {
		final Iterator<Coordinate> points = samplePoints().getPoints().iterator();
		return new Iterator<>() {
			private int index;

			@Override
			public boolean hasNext() {
				return points.hasNext();
			}

			@Override
			public Position next() {
				final Coordinate c = points.next();
				return new Position(c.x, c.y, Position.indexName(index++));
			}
		};
	}

	/**
	 * Returns the requested number of points. With overlap avoidance fewer may be
	 * yielded.
	 */
	@Override
	public int numPositions() {
		return numPoints;
	}

	@Override
	public boolean isRelative() {
		return true;
	}

	/**
	 * @return the non-fatal warnings raised while building the plan
	 */
	public List<String> getWarnings() {
		return warnings;
	}

	public int getNumPoints() {
		return numPoints;
	}

	public double getMaxWidth() {
		return maxWidth;
	}

	public double getMaxHeight() {
		return maxHeight;
	}

	public Shape getShape() {
		return shape;
	}

	public Long getRandomSeed() {
		return randomSeed;
	}

	public boolean isAllowOverlap() {
		return allowOverlap;
	}

	public PointOrdering getOrder() {
		return order;
	}

	/**
	 * @return the (clamped) start index, or {@code null} if the plan starts at a
	 *         fixed {@link #getStartPosition() position}
	 */
	public Integer getStartIndex() {
		return startIndex;
	}

	public Position getStartPosition() {
		return startPosition;
	}

	public Double getFovWidth() {
		return fovWidth;
	}

	public Double getFovHeight() {
		return fovHeight;
	}

	public static final class Builder {

		private final int numPoints;
		private double maxWidth = 1;
		private double maxHeight = 1;
		private Shape shape = Shape.ELLIPSE;
		private Long randomSeed;
		private boolean allowOverlap = true;
		private PointOrdering order = TraversalOrder.TWO_OPT;
		private int startIndex;
		private Position startPosition;
		private Double fovWidth;
		private Double fovHeight;

		private Builder(int numPoints) {
			if (numPoints <= 0) {
				throw new IllegalArgumentException("numPoints must be > 0, got " + numPoints);
			}
			this.numPoints = numPoints;
		}

		/**
		 * Sets the full width and height of the sampled shape.
		 */
		public Builder maxSize(double maxWidth, double maxHeight) {
			if (!(maxWidth > 0) || Double.isInfinite(maxWidth)) {
				throw new IllegalArgumentException("maxWidth must be > 0, got " + maxWidth);
			}
			if (!(maxHeight > 0) || Double.isInfinite(maxHeight)) {
				throw new IllegalArgumentException("maxHeight must be > 0, got " + maxHeight);
			}
			this.maxWidth = maxWidth;
			this.maxHeight = maxHeight;
			return this;
		}

		public Builder shape(Shape shape) {
			this.shape = Objects.requireNonNull(shape, "shape");
			return this;
		}

		/**
		 * @param randomSeed seed for reproducible points, or {@code null} for a
		 *                   different set on every iteration
		 */
		public Builder randomSeed(Long randomSeed) {
			this.randomSeed = randomSeed;
			return this;
		}

		public Builder randomSeed(long randomSeed) {
			return randomSeed(Long.valueOf(randomSeed));
		}

		public Builder allowOverlap(boolean allowOverlap) {
			this.allowOverlap = allowOverlap;
			return this;
		}

		/**
		 * @param order visiting order, or {@code null} for generation order
		 */
		public Builder order(PointOrdering order) {
			this.order = order;
			return this;
		}

		/**
		 * Starts the ordering at the point generated at {@code index}. An index past
		 * the last point is clamped to it, with a warning.
		 */
		public Builder startAt(int index) {
			if (index < 0) {
				throw new IllegalArgumentException("startAt must be >= 0, got " + index);
			}
			this.startIndex = index;
			this.startPosition = null;
			return this;
		}

		/**
		 * Includes {@code position} as the first point of the plan.
		 */
		public Builder startAt(Position position) {
			this.startPosition = Objects.requireNonNull(position, "position");
			this.startIndex = 0;
			return this;
		}

		public Builder fov(double fovWidth, double fovHeight) {
			if (!(fovWidth > 0) || Double.isInfinite(fovWidth)) {
				throw new IllegalArgumentException("fovWidth must be > 0, got " + fovWidth);
			}
			if (!(fovHeight > 0) || Double.isInfinite(fovHeight)) {
				throw new IllegalArgumentException("fovHeight must be > 0, got " + fovHeight);
			}
			this.fovWidth = fovWidth;
			this.fovHeight = fovHeight;
			return this;
		}

		public RandomPoints build() {
			return new RandomPoints(this);
		}
	}
}
