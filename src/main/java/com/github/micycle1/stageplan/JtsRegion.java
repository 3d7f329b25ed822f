package com.github.micycle1.stageplan;

import java.util.Arrays;
import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.geom.util.PolygonExtracter;
import org.locationtech.jts.operation.buffer.BufferOp;
import org.locationtech.jts.operation.buffer.BufferParameters;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;

/**
 * {@link Region} backed by a JTS {@link Geometry}.
 * <p>
 * Intersection tests on a {@link #prepare() prepared} region go through a JTS
 * {@link PreparedGeometry}, which indexes the polygon edges once and answers
 * repeated rectangle queries without rebuilding topology.
 */
public final class JtsRegion implements Region {

	/** Creates regions on a floating precision {@link GeometryFactory}. */
	public static final RegionFactory FACTORY = JtsRegion::polygon;

	private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();
	private static final int BUFFER_QUADRANT_SEGMENTS = 8;

	private final Geometry geometry;
	private final PreparedGeometry prepared; // null until prepare()

	private JtsRegion(Geometry geometry, PreparedGeometry prepared) {
		this.geometry = geometry;
		this.prepared = prepared;
	}

	/**
	 * Wraps an existing geometry.
	 */
	public static JtsRegion of(Geometry geometry) {
		return new JtsRegion(geometry, null);
	}

	/**
	 * Builds a polygon from its shell vertices, closing the ring if the last
	 * vertex differs from the first.
	 *
	 * @throws IllegalArgumentException if fewer than 3 vertices are given
	 */
	public static JtsRegion polygon(Coordinate[] vertices) {
		if (vertices == null || vertices.length < 3) {
			throw new IllegalArgumentException("a polygon needs at least 3 vertices");
		}
		final boolean closed = vertices[0].equals2D(vertices[vertices.length - 1]);
		// callers keep ownership of their vertices
		Coordinate[] ring = CoordinateArrays.copyDeep(vertices);
		if (!closed) {
			ring = Arrays.copyOf(ring, ring.length + 1);
			ring[ring.length - 1] = ring[0].copy();
		}
		if (ring.length < 4) {
			throw new IllegalArgumentException("a polygon needs at least 3 distinct vertices");
		}
		return new JtsRegion(GEOMETRY_FACTORY.createPolygon(ring), null);
	}

	@Override
	public boolean isValid() {
		return new IsValidOp(geometry).isValid();
	}

	/**
	 * @return a description of why the region is invalid, or {@code null} if it
	 *         is valid
	 */
	public String getValidationError() {
		TopologyValidationError error = new IsValidOp(geometry).getValidationError();
		return error == null ? null : error.toString();
	}

	@Override
	public boolean isEmpty() {
		return geometry.isEmpty();
	}

	@Override
	public JtsRegion buffer(double distance) {
		BufferParameters params = new BufferParameters(BUFFER_QUADRANT_SEGMENTS, BufferParameters.CAP_ROUND, BufferParameters.JOIN_ROUND,
				BufferParameters.DEFAULT_MITRE_LIMIT);
		return new JtsRegion(BufferOp.bufferOp(geometry, distance, params), null);
	}

	@Override
	public JtsRegion convexHull() {
		return new JtsRegion(geometry.convexHull(), null);
	}

	@Override
	public JtsRegion prepare() {
		if (prepared != null) {
			return this;
		}
		return new JtsRegion(geometry, PreparedGeometryFactory.prepare(geometry));
	}

	@Override
	public boolean intersects(double minX, double minY, double maxX, double maxY) {
		Geometry rect = geometry.getFactory().toGeometry(new Envelope(minX, maxX, minY, maxY));
		return prepared != null ? prepared.intersects(rect) : geometry.intersects(rect);
	}

	@Override
	public Envelope getEnvelope() {
		return new Envelope(geometry.getEnvelopeInternal());
	}

	/**
	 * Returns the closed outer ring. For a multi-part result (e.g. a polygon split
	 * by a negative buffer) the shell of the largest part is returned.
	 */
	@Override
	public Coordinate[] getShell() {
		if (geometry instanceof Polygon) {
			return ((Polygon) geometry).getExteriorRing().getCoordinates();
		}
		@SuppressWarnings("unchecked")
		List<Polygon> parts = PolygonExtracter.getPolygons(geometry);
		Polygon largest = null;
		for (Polygon p : parts) {
			if (largest == null || p.getArea() > largest.getArea()) {
				largest = p;
			}
		}
		return largest == null ? new Coordinate[0] : largest.getExteriorRing().getCoordinates();
	}

	public Geometry getGeometry() {
		return geometry;
	}

	public boolean isPrepared() {
		return prepared != null;
	}
}
