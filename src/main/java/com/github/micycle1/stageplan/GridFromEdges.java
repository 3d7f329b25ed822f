package com.github.micycle1.stageplan;

/**
 * Absolute grid covering the area between four stage edges.
 * <p>
 * {@code top}, {@code left}, {@code bottom} and {@code right} are the
 * <em>outer</em> edges of the outermost tiles: the first tile centre sits half
 * a FOV inside the top-left corner.
 */
public class GridFromEdges extends GridPlan {

	private final double top;
	private final double left;
	private final double bottom;
	private final double right;

	private GridFromEdges(Builder builder) {
		super(builder);
		this.top = builder.top;
		this.left = builder.left;
		this.bottom = builder.bottom;
		this.right = builder.right;
	}

	public static Builder builder(double top, double left, double bottom, double right) {
		return new Builder(top, left, bottom, right);
	}

	@Override
	public int rowCount(double dy) {
		return edgeBoundedCount(Math.abs(top - bottom), getFovHeight(), dy);
	}

	@Override
	public int columnCount(double dx) {
		return edgeBoundedCount(Math.abs(right - left), getFovWidth(), dx);
	}

	@Override
	public double offsetX(double dx) {
		final Double fov = getFovWidth();
		return Math.min(left, right) + (fov == null ? 0 : fov) / 2;
	}

	@Override
	public double offsetY(double dy) {
		final Double fov = getFovHeight();
		return Math.max(top, bottom) - (fov == null ? 0 : fov) / 2;
	}

	@Override
	protected boolean requiresFov() {
		return true;
	}

	@Override
	public boolean isRelative() {
		return false;
	}

	@Override
	public Builder toBuilder() {
		return new Builder(this);
	}

	public double getTop() {
		return top;
	}

	public double getLeft() {
		return left;
	}

	public double getBottom() {
		return bottom;
	}

	public double getRight() {
		return right;
	}

	public static final class Builder extends GridPlan.Builder<GridFromEdges, Builder> {

		private final double top;
		private final double left;
		private final double bottom;
		private final double right;

		private Builder(double top, double left, double bottom, double right) {
			if (!Double.isFinite(top) || !Double.isFinite(left) || !Double.isFinite(bottom) || !Double.isFinite(right)) {
				throw new IllegalArgumentException("edges must be finite");
			}
			this.top = top;
			this.left = left;
			this.bottom = bottom;
			this.right = right;
		}

		private Builder(GridFromEdges plan) {
			super(plan);
			this.top = plan.top;
			this.left = plan.left;
			this.bottom = plan.bottom;
			this.right = plan.right;
		}

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public GridFromEdges build() {
			return new GridFromEdges(this);
		}
	}
}
