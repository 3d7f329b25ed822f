package com.github.micycle1.stageplan;

import java.util.Iterator;
import java.util.Objects;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Absolute grid covering an arbitrary simple polygon.
 * <p>
 * The plan rasterises the polygon's bounding box as an edge-bounded grid (see
 * {@link GridFromEdges}) and keeps every tile whose {@code fovWidth × fovHeight}
 * rectangle intersects the polygon. Tiles that merely touch the polygon are
 * kept. This is generate-and-filter, not exact polygon rasterisation.
 *
 * <h3>Region</h3>
 * <ul>
 * <li>The vertices must form a valid simple polygon.</li>
 * <li>If an {@code offset} is set the polygon is first buffered by it (round
 * caps and joins), and if {@code convexHull} is set it is then replaced by its
 * convex hull.</li>
 * <li>The resulting region is prepared once, at construction, so the per-tile
 * intersection tests are cheap.</li>
 * <li>The bounding box is expanded by a quarter FOV on each side so that tiles
 * straddling the boundary are not lost.</li>
 * </ul>
 *
 * <p>
 * Kept tiles retain their raster {@code row}/{@code col}; names count the
 * emitted tiles only.
 */
public class GridFromPolygon extends GridPlan {

	private static final Logger logger = LoggerFactory.getLogger(GridFromPolygon.class);

	private final Coordinate[] polygon;
	private final boolean convexHull;
	private final Double offset;
	private final RegionFactory regionFactory;

	private final Region region;
	private final Envelope boundingBox;

	private GridFromPolygon(Builder builder) {
		super(builder);
		this.polygon = builder.polygon;
		this.convexHull = builder.convexHull;
		this.offset = builder.offset;
		this.regionFactory = builder.regionFactory;

		Region shape = regionFactory.polygon(polygon);
		if (!shape.isValid()) {
			throw new IllegalArgumentException("Invalid or self-intersecting polygon");
		}
		if (offset != null) {
			shape = shape.buffer(offset);
			if (shape.isEmpty()) {
				throw new IllegalArgumentException("offset " + offset + " collapses the polygon to an empty region");
			}
		}
		if (convexHull) {
			shape = shape.convexHull();
		}
		this.region = shape.prepare();

		final Envelope bounds = region.getEnvelope();
		final double marginX = getFovWidth() == null ? 0 : getFovWidth() / 4;
		final double marginY = getFovHeight() == null ? 0 : getFovHeight() / 4;
		this.boundingBox = new Envelope(bounds.getMinX() - marginX, bounds.getMaxX() + marginX, bounds.getMinY() - marginY, bounds.getMaxY() + marginY);
		logger.debug("Prepared polygon region with bounds {} (raster bounds {})", bounds, boundingBox);
	}

	/**
	 * @param polygon at least 3 polygon vertices, closed or not
	 */
	public static Builder builder(Coordinate... polygon) {
		return new Builder(polygon);
	}

	@Override
	public int rowCount(double dy) {
		return edgeBoundedCount(boundingBox.getHeight(), getFovHeight(), dy);
	}

	@Override
	public int columnCount(double dx) {
		return edgeBoundedCount(boundingBox.getWidth(), getFovWidth(), dx);
	}

	@Override
	public double offsetX(double dx) {
		final Double fov = getFovWidth();
		return boundingBox.getMinX() + (fov == null ? 0 : fov) / 2;
	}

	@Override
	public double offsetY(double dy) {
		final Double fov = getFovHeight();
		return boundingBox.getMaxY() - (fov == null ? 0 : fov) / 2;
	}

	/**
	 * Counts the tiles that intersect the region. Rescans the raster on every call.
	 *
	 * @throws IllegalStateException if the FOV is not set
	 */
	@Override
	public int numPositions() {
		checkFov();
		int n = 0;
		for (Iterator<Position> it = iterator(); it.hasNext(); it.next()) {
			n++;
		}
		return n;
	}

	@Override
	protected boolean acceptTile(double x, double y, double fovWidth, double fovHeight) {
		return region.intersects(x - fovWidth / 2, y - fovHeight / 2, x + fovWidth / 2, y + fovHeight / 2);
	}

	@Override
	protected void beforeIteration() {
		checkFov();
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

	/**
	 * @return the raster bounds: the region's envelope expanded by a quarter FOV on
	 *         each side
	 */
	public Envelope getBoundingBox() {
		return new Envelope(boundingBox);
	}

	/**
	 * @return the prepared tiling region (after buffering and hulling)
	 */
	public Region getRegion() {
		return region;
	}

	/**
	 * @return the outer ring of the tiling region, for plotting
	 */
	public Coordinate[] getRegionShell() {
		return region.getShell();
	}

	public Coordinate[] getPolygon() {
		return CoordinateArrays.copyDeep(polygon);
	}

	public boolean isConvexHull() {
		return convexHull;
	}

	/**
	 * @return the buffer distance, or {@code null} if the polygon is not buffered
	 */
	public Double getOffset() {
		return offset;
	}

	public static final class Builder extends GridPlan.Builder<GridFromPolygon, Builder> {

		private final Coordinate[] polygon;
		private boolean convexHull;
		private Double offset;
		private RegionFactory regionFactory = JtsRegion.FACTORY;

		private Builder(Coordinate[] polygon) {
			Objects.requireNonNull(polygon, "polygon");
			if (polygon.length < 3) {
				throw new IllegalArgumentException("polygon must have at least 3 vertices, got " + polygon.length);
			}
			this.polygon = CoordinateArrays.copyDeep(polygon);
		}

		private Builder(GridFromPolygon plan) {
			super(plan);
			this.polygon = plan.polygon;
			this.convexHull = plan.convexHull;
			this.offset = plan.offset;
			this.regionFactory = plan.regionFactory;
		}

		public Builder convexHull(boolean convexHull) {
			this.convexHull = convexHull;
			return this;
		}

		/**
		 * Buffers the polygon by {@code offset} before tiling; {@code null} disables
		 * buffering.
		 */
		public Builder offset(Double offset) {
			if (offset != null && !Double.isFinite(offset)) {
				throw new IllegalArgumentException("offset must be finite, got " + offset);
			}
			this.offset = offset;
			return this;
		}

		public Builder offset(double offset) {
			return offset(Double.valueOf(offset));
		}

		/**
		 * Sets the geometry backend. Defaults to {@link JtsRegion#FACTORY}.
		 */
		public Builder regionFactory(RegionFactory regionFactory) {
			this.regionFactory = Objects.requireNonNull(regionFactory, "regionFactory");
			return this;
		}

		@Override
		protected Builder self() {
			return this;
		}

		@Override
		public GridFromPolygon build() {
			return new GridFromPolygon(this);
		}
	}
}
