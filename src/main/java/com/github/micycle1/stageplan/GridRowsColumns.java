package com.github.micycle1.stageplan;

import java.util.Objects;

/**
 * Relative grid with a fixed number of rows and columns.
 */
public class GridRowsColumns extends GridPlan {

	private final int rows;
	private final int columns;
	private final RelativeTo relativeTo;

	private GridRowsColumns(Builder builder) {
		super(builder);
		this.rows = builder.rows;
		this.columns = builder.columns;
		this.relativeTo = builder.relativeTo;
	}

	/**
	 * @throws IllegalArgumentException if {@code rows} or {@code columns} is
	 *                                  below 1
	 */
	public static Builder builder(int rows, int columns) {
		return new Builder(rows, columns);
	}

	@Override
	public int rowCount(double dy) {
		return rows;
	}

	@Override
	public int columnCount(double dx) {
		return columns;
	}

	@Override
	public double offsetX(double dx) {
		return relativeTo == RelativeTo.CENTER ? -((columns - 1) * dx) / 2 : 0.0;
	}

	@Override
	public double offsetY(double dy) {
		return relativeTo == RelativeTo.CENTER ? ((rows - 1) * dy) / 2 : 0.0;
	}

	@Override
	protected boolean requiresFov() {
		return false;
	}

	@Override
	public boolean isRelative() {
		return true;
	}

	@Override
	public Builder toBuilder() {
		return new Builder(this);
	}

	public int getRows() {
		return rows;
	}

	public int getColumns() {
		return columns;
	}

	public RelativeTo getRelativeTo() {
		return relativeTo;
	}

	public static final class Builder extends GridPlan.Builder<GridRowsColumns, Builder> {

		private final int rows;
		private final int columns;
		private RelativeTo relativeTo = RelativeTo.CENTER;

		private Builder(int rows, int columns) {
			if (rows < 1) {
				throw new IllegalArgumentException("rows must be >= 1, got " + rows);
			}
			if (columns < 1) {
				throw new IllegalArgumentException("columns must be >= 1, got " + columns);
			}
			this.rows = rows;
			this.columns = columns;
		}

		private Builder(GridRowsColumns plan) {
			super(plan);
			this.rows = plan.rows;
			this.columns = plan.columns;
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
		public GridRowsColumns build() {
			return new GridRowsColumns(this);
		}
	}
}
