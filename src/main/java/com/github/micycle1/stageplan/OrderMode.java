package com.github.micycle1.stageplan;

import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Traversal orders over the cells of a {@code rows × columns} raster.
 * <p>
 * Each mode is a pure function of the grid shape: it visits every
 * {@code (row, col)} cell exactly once, lazily, with no randomness.
 */
public enum OrderMode {

	/** Row by row, left to right. */
	ROW_WISE(true, false),
	/** Column by column, top to bottom. */
	COLUMN_WISE(false, false),
	/** Row by row, alternating left-to-right and right-to-left. */
	ROW_WISE_SNAKE(true, true),
	/** Column by column, alternating top-to-bottom and bottom-to-top. */
	COLUMN_WISE_SNAKE(false, true),
	/** Outward square spiral from the centre cell, clipped to the grid. */
	SPIRAL(false, false);

	private final boolean rowWise;
	private final boolean snake;

	OrderMode(boolean rowWise, boolean snake) {
		this.rowWise = rowWise;
		this.snake = snake;
	}

	/**
	 * Generates the traversal sequence for a grid.
	 *
	 * @param rows    number of rows (&gt;= 0)
	 * @param columns number of columns (&gt;= 0)
	 * @return an iterator of {@code {row, col}} pairs
	 */
	public Iterator<int[]> generateIndices(int rows, int columns) {
		if (rows < 0 || columns < 0) {
			throw new IllegalArgumentException("rows and columns must be >= 0");
		}
		if (this == SPIRAL) {
			return new SpiralIterator(rows, columns);
		}
		return new RectIterator(rows, columns, rowWise, snake);
	}

	private static final class RectIterator implements Iterator<int[]> {

		private final int rows;
		private final int columns;
		private final boolean rowWise;
		private final boolean snake;
		private final int total;
		private int k;

		RectIterator(int rows, int columns, boolean rowWise, boolean snake) {
			this.rows = rows;
			this.columns = columns;
			this.rowWise = rowWise;
			this.snake = snake;
			this.total = rows * columns;
		}

		@Override
		public boolean hasNext() {
			return k < total;
		}

		@Override
		public int[] next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			final int innerLength = rowWise ? columns : rows;
			final int outer = k / innerLength;
			int inner = k % innerLength;
			if (snake && (outer & 1) == 1) {
				inner = innerLength - 1 - inner;
			}
			k++;
			return rowWise ? new int[] { outer, inner } : new int[] { inner, outer };
		}
	}

	/*
	 * Walks a square spiral on the integer lattice around (0, 0), turning at the
	 * corners, and emits the lattice points that fall inside the grid once shifted
	 * so the origin lands on the centre cell. max(rows, columns)^2 steps cover
	 * every cell.
	 */
	private static final class SpiralIterator implements Iterator<int[]> {

		private final int rows;
		private final int columns;
		private final int rowShift;
		private final int colShift;
		private final long steps;

		private int x;
		private int y;
		private int dx = 0;
		private int dy = -1;
		private long step;
		private int[] next;

		SpiralIterator(int rows, int columns) {
			this.rows = rows;
			this.columns = columns;
			this.rowShift = (rows - 1) / 2;
			this.colShift = (columns - 1) / 2;
			final long m = Math.max(rows, columns);
			this.steps = rows == 0 || columns == 0 ? 0 : m * m;
			advance();
		}

		private void advance() {
			next = null;
			while (next == null && step < steps) {
				if (-columns / 2.0 < x && x <= columns / 2.0 && -rows / 2.0 < y && y <= rows / 2.0) {
					next = new int[] { y + rowShift, x + colShift };
				}
				if (x == y || (x < 0 && x == -y) || (x > 0 && x == 1 - y)) {
					final int t = dx;
					dx = -dy;
					dy = t;
				}
				x += dx;
				y += dy;
				step++;
			}
		}

		@Override
		public boolean hasNext() {
			return next != null;
		}

		@Override
		public int[] next() {
			if (next == null) {
				throw new NoSuchElementException();
			}
			final int[] out = next;
			advance();
			return out;
		}
	}
}
