package com.github.micycle1.stageplan;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Base class of the grid tiling plans.
 * <p>
 * A grid plan converts a region description and a field of view (FOV) into a
 * raster of {@code rows × columns} tile centres. Subclasses supply the counts
 * and the position of the first tile centre; step sizes, counting and position
 * emission live here.
 *
 * <h3>Layout</h3>
 * <ul>
 * <li>step: {@code dx = fovWidth·(1 − overlapX/100)},
 * {@code dy = fovHeight·(1 − overlapY/100)}; a unit FOV is used when none is
 * known.</li>
 * <li>tile {@code (r, c)} lies at
 * {@code (offsetX(dx) + c·dx, offsetY(dy) − r·dy)}, so row 0 is the topmost
 * row.</li>
 * <li>tiles are emitted in the order produced by an {@link OrderMode}.</li>
 * </ul>
 *
 * <p>
 * Plans are immutable; the only way to change the FOV is
 * {@link #withFov(double, double)}, which builds a new plan.
 */
public abstract class GridPlan implements MultiPointPlan {

	private final double overlapX;
	private final double overlapY;
	private final OrderMode mode;
	private final Double fovWidth;
	private final Double fovHeight;

	protected GridPlan(Builder<?, ?> builder) {
		this.overlapX = builder.overlapX;
		this.overlapY = builder.overlapY;
		this.mode = Objects.requireNonNull(builder.mode, "mode");
		this.fovWidth = builder.fovWidth;
		this.fovHeight = builder.fovHeight;
	}

	/**
	 * Returns the number of raster rows for a vertical step of {@code dy}.
	 */
	public abstract int rowCount(double dy);

	/**
	 * Returns the number of raster columns for a horizontal step of {@code dx}.
	 */
	public abstract int columnCount(double dx);

	/**
	 * Returns the x coordinate of column 0.
	 */
	public abstract double offsetX(double dx);

	/**
	 * Returns the y coordinate of row 0.
	 */
	public abstract double offsetY(double dy);

	/**
	 * @return whether the tile count of this plan depends on the field of view
	 */
	protected abstract boolean requiresFov();

	/**
	 * Returns a builder pre-populated with the state of this plan.
	 */
	public abstract Builder<?, ?> toBuilder();

	/**
	 * Returns a copy of this plan carrying the given field of view.
	 */
	public GridPlan withFov(double fovWidth, double fovHeight) {
		return toBuilder().fov(fovWidth, fovHeight).build();
	}

	/**
	 * Computes the step between adjacent tile centres.
	 *
	 * @return {@code {dx, dy}}
	 */
	public double[] stepSize(double fovWidth, double fovHeight) {
		final double dx = fovWidth - (fovWidth * overlapX) / 100;
		final double dy = fovHeight - (fovHeight * overlapY) / 100;
		return new double[] { dx, dy };
	}

	@Override
	public int numPositions() {
		checkFov();
		final double[] step = stepSize(fovWidthOrUnit(), fovHeightOrUnit());
		return rowCount(step[1]) * columnCount(step[0]);
	}

	/**
	 * Iterates the plan in its own traversal {@link #getMode() mode}.
	 */
	@Override
	public Iterator<Position> iterator() {
		return gridPositions(null).iterator();
	}

	/**
	 * Returns the positions of this plan using its own field of view.
	 *
	 * @param order traversal order, or {@code null} for the plan's mode
	 */
	public Iterable<Position> gridPositions(OrderMode order) {
		final OrderMode traversal = order == null ? mode : order;
		return () -> new PositionIterator(traversal);
	}

	/**
	 * Returns the positions of this plan for a field of view supplied at iteration
	 * time, for instance by the instrument. The result is exactly that of
	 * {@code withFov(fovWidth, fovHeight).gridPositions(order)}.
	 *
	 * @param order traversal order, or {@code null} for the plan's mode
	 */
	public Iterable<Position> gridPositions(double fovWidth, double fovHeight, OrderMode order) {
		if (this.fovWidth != null && this.fovHeight != null && this.fovWidth == fovWidth && this.fovHeight == fovHeight) {
			return gridPositions(order);
		}
		return withFov(fovWidth, fovHeight).gridPositions(order);
	}

	/**
	 * Filter applied to every raster tile before emission. Accepts all tiles.
	 *
	 * @param x         tile centre x
	 * @param y         tile centre y
	 * @param fovWidth  tile width
	 * @param fovHeight tile height
	 */
	protected boolean acceptTile(double x, double y, double fovWidth, double fovHeight) {
		return true;
	}

	/**
	 * Called when iteration starts, before the raster is laid out.
	 */
	protected void beforeIteration() {
	}

	/**
	 * Edge-bounded count shared by plans whose extent is given as outer tile
	 * edges: the first and last tiles' outer edges exactly cover {@code span} when
	 * tiles abut.
	 *
	 * @param span extent along one axis
	 * @param fov  field of view along that axis, or {@code null} if unknown
	 * @param step step along that axis
	 */
	protected static int edgeBoundedCount(double span, Double fov, double step) {
		if (fov == null) {
			return (int) Math.ceil((span + step) / step);
		}
		if (span <= fov) {
			return 1;
		}
		// one FOV plus (n - 1) steps must cover the span
		return (int) Math.ceil((span - fov) / step) + 1;
	}

	protected void checkFov() {
		if (requiresFov() && (fovWidth == null || fovHeight == null)) {
			throw new IllegalStateException(getClass().getSimpleName() + " requires fovWidth and fovHeight to be set to determine its positions");
		}
	}

	protected double fovWidthOrUnit() {
		return fovWidth == null ? 1.0 : fovWidth;
	}

	protected double fovHeightOrUnit() {
		return fovHeight == null ? 1.0 : fovHeight;
	}

	public double getOverlapX() {
		return overlapX;
	}

	public double getOverlapY() {
		return overlapY;
	}

	public OrderMode getMode() {
		return mode;
	}

	/**
	 * @return the FOV width, or {@code null} if the instrument owns it
	 */
	public Double getFovWidth() {
		return fovWidth;
	}

	/**
	 * @return the FOV height, or {@code null} if the instrument owns it
	 */
	public Double getFovHeight() {
		return fovHeight;
	}

	private final class PositionIterator implements Iterator<Position> {

		private final Iterator<int[]> indices;
		private final double dx;
		private final double dy;
		private final double x0;
		private final double y0;
		private final double tileWidth;
		private final double tileHeight;
		private int emitted;
		private Position next;

		PositionIterator(OrderMode order) {
			beforeIteration();
			tileWidth = fovWidthOrUnit();
			tileHeight = fovHeightOrUnit();
			final double[] step = stepSize(tileWidth, tileHeight);
			dx = step[0];
			dy = step[1];
			x0 = offsetX(dx);
			y0 = offsetY(dy);
			indices = order.generateIndices(rowCount(dy), columnCount(dx));
			advance();
		}

		private void advance() {
			next = null;
			while (next == null && indices.hasNext()) {
				final int[] rc = indices.next();
				final double x = x0 + rc[1] * dx;
				final double y = y0 - rc[0] * dy;
				if (acceptTile(x, y, tileWidth, tileHeight)) {
					next = new Position(x, y, rc[0], rc[1], Position.indexName(emitted++));
				}
			}
		}

		@Override
		public boolean hasNext() {
			return next != null;
		}

		@Override
		public Position next() {
			if (next == null) {
				throw new NoSuchElementException();
			}
			final Position out = next;
			advance();
			return out;
		}
	}

	/**
	 * Shared builder state of the grid plans.
	 *
	 * @param <P> plan type
	 * @param <B> concrete builder type
	 */
	public abstract static class Builder<P extends GridPlan, B extends Builder<P, B>> {

		private double overlapX;
		private double overlapY;
		private OrderMode mode = OrderMode.ROW_WISE_SNAKE;
		private Double fovWidth;
		private Double fovHeight;

		protected Builder() {
		}

		protected Builder(GridPlan plan) {
			this.overlapX = plan.overlapX;
			this.overlapY = plan.overlapY;
			this.mode = plan.mode;
			this.fovWidth = plan.fovWidth;
			this.fovHeight = plan.fovHeight;
		}

		/**
		 * Sets the tile overlap in percent: one value for both axes, or
		 * {@code (x, y)}.
		 *
		 * @throws IllegalArgumentException if not given one or two values, or if a
		 *                                  value is not finite or is &gt;= 100
		 */
		public B overlap(double... overlap) {
			if (overlap == null || overlap.length < 1 || overlap.length > 2) {
				throw new IllegalArgumentException("overlap must be a single value or a pair of (x, y) values");
			}
			final double x = overlap[0];
			final double y = overlap.length == 2 ? overlap[1] : overlap[0];
			checkOverlap(x);
			checkOverlap(y);
			this.overlapX = x;
			this.overlapY = y;
			return self();
		}

		public B mode(OrderMode mode) {
			this.mode = Objects.requireNonNull(mode, "mode");
			return self();
		}

		/**
		 * Sets the field of view. Either value may be {@code null} to leave it to the
		 * instrument.
		 */
		public B fov(Double fovWidth, Double fovHeight) {
			this.fovWidth = checkFov("fovWidth", fovWidth);
			this.fovHeight = checkFov("fovHeight", fovHeight);
			return self();
		}

		public B fov(double fovWidth, double fovHeight) {
			return fov(Double.valueOf(fovWidth), Double.valueOf(fovHeight));
		}

		protected abstract B self();

		public abstract P build();

		private static void checkOverlap(double value) {
			if (!Double.isFinite(value) || value >= 100) {
				throw new IllegalArgumentException("overlap must be a finite percentage below 100, got " + value);
			}
		}

		private static Double checkFov(String name, Double value) {
			if (value != null && !(value > 0 && Double.isFinite(value))) {
				throw new IllegalArgumentException(name + " must be > 0, got " + value);
			}
			return value;
		}
	}
}
