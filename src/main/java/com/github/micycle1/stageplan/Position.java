package com.github.micycle1.stageplan;

import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;

/**
 * A single stage position emitted by a {@link MultiPointPlan}.
 * <p>
 * Grid plans fill in the {@code row}/{@code col} indices of the raster cell the
 * position came from; random plans leave them {@code null}. The {@code name} is
 * the zero-padded emission index and carries no identity.
 */
public final class Position {

	private final double x;
	private final double y;
	private final Integer row;
	private final Integer col;
	private final String name;

	public Position(double x, double y) {
		this(x, y, null, null, null);
	}

	public Position(double x, double y, String name) {
		this(x, y, null, null, name);
	}

	public Position(double x, double y, Integer row, Integer col, String name) {
		this.x = x;
		this.y = y;
		this.row = row;
		this.col = col;
		this.name = name;
	}

	/**
	 * Formats an emission index as a name, zero-padded to at least four digits.
	 */
	static String indexName(int index) {
		return String.format("%04d", index);
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	/**
	 * @return the raster row, or {@code null} for positions not derived from a
	 *         grid
	 */
	public Integer getRow() {
		return row;
	}

	/**
	 * @return the raster column, or {@code null} for positions not derived from a
	 *         grid
	 */
	public Integer getCol() {
		return col;
	}

	public String getName() {
		return name;
	}

	public Coordinate toCoordinate() {
		return new Coordinate(x, y);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Position)) {
			return false;
		}
		Position other = (Position) o;
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0 && Objects.equals(row, other.row) && Objects.equals(col, other.col)
				&& Objects.equals(name, other.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(x, y, row, col, name);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("Position[");
		if (name != null) {
			sb.append(name).append(": ");
		}
		sb.append('(').append(x).append(", ").append(y).append(')');
		if (row != null) {
			sb.append(" r=").append(row).append(" c=").append(col);
		}
		return sb.append(']').toString();
	}
}
