package com.github.micycle1.stageplan;

import java.util.Objects;

/**
 * Relative grid covering at least a given total width and height.
 * <p>
 * The column count is {@code ceil(width / dx)} and the row count
 * {@code ceil(height / dy)}, so the covered area may exceed the requested one
 * by up to one step on each axis.
 */
public class GridWidthHeight extends GridPlan {

	private final double width;
	private final double height;
	private final RelativeTo relativeTo;

	private GridWidthHeight(Builder builder) {
		super(builder);
		this.width = builder.width;
		this.height = builder.height;
		this.relativeTo = builder.relativeTo;
	}

	/**
	 * @throws IllegalArgumentException if {@code width} or {@code height} is not
	 *                                  positive
	 */
	public static Builder builder(double width, double height) {
		return new Builder(width, height);
	}

	@Override
	public int rowCount(double dy) {
		return (int) Math.ceil(height / dy);
	}

	@Override
	public int columnCount(double dx) {
		return (int) Math.ceil(width / dx);
	}

	@Override
	public double offsetX(double dx) {
		return relativeTo == RelativeTo.CENTER ? -((columnCount(dx) - 1) * dx) / 2 : 0.0;
	}

	@Override
	public double offsetY(double dy) {
		return relativeTo == RelativeTo.CENTER ? ((rowCount(dy) - 1) * dy) / 2 : 0.0;
	}

	@Override
	protected boolean requiresFov() {
		return true;
	}

	@Override
	public boolean isRelative() {
		return true;
	}

	@Override
	public Builder toBuilder() {
		return new Builder(this);
	}

	public double getWidth() {
		return width;
	}

	public double getHeight() {
		return height;
	}

	public RelativeTo getRelativeTo() {
		return relativeTo;
	}

	public static final class Builder extends GridPlan.Builder<GridWidthHeight, Builder> {

		private final double width;
		private final double height;
		private RelativeTo relativeTo = RelativeTo.CENTER;

		private Builder(double width, double height) {
			if (!(width > 0) || Double.isInfinite(width)) {
				throw new IllegalArgumentException("width must be > 0, got " + width);
			}
			if (!(height > 0) || Double.isInfinite(height)) {
				throw new IllegalArgumentException("height must be > 0, got " + height);
			}
			this.width = width;
			this.height = height;
		}

		private Builder(GridWidthHeight plan) {
			super(plan);
			this.width = plan.width;
			this.height = plan.height;
			this.relativeTo = plan.relativeTo;
		}

		public Builder relativeTo(RelativeTo relativeTo) {
			this.relativeTo = Objects.requireNonNull(relativeTo, "relativeTo");
			return this;
		}

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public GridWidthHeight build() {
			return new GridWidthHeight(this);
		}
	}
}
