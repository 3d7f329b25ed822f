package com.github.micycle1.stageplan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.io.WKTReader;

public class JtsRegionTest {

	private final WKTReader wktReader = new WKTReader();

	@Test
	public void testPolygonClosesRing() {
		JtsRegion region = JtsRegion.polygon(new Coordinate[] { new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(0, 4) });
		Coordinate[] shell = region.getShell();
		assertEquals(4, shell.length);
		assertTrue(shell[0].equals2D(shell[3]));
		assertTrue(region.isValid());
		assertNull(region.getValidationError());
		assertEquals(8, region.getGeometry().getArea(), 1e-12);
	}

	@Test
	public void testAlreadyClosedRing() {
		JtsRegion region = JtsRegion
				.polygon(new Coordinate[] { new Coordinate(0, 0), new Coordinate(4, 0), new Coordinate(4, 4), new Coordinate(0, 0) });
		assertEquals(4, region.getShell().length);
	}

	@Test
	public void testTooFewVertices() {
		assertThrows(IllegalArgumentException.class, () -> JtsRegion.polygon(new Coordinate[] { new Coordinate(0, 0), new Coordinate(1, 1) }));
		// a closed 3-coordinate ring has only two distinct vertices
		assertThrows(IllegalArgumentException.class,
				() -> JtsRegion.polygon(new Coordinate[] { new Coordinate(0, 0), new Coordinate(1, 1), new Coordinate(0, 0) }));
	}

	@Test
	public void testSelfIntersectionIsInvalid() {
		JtsRegion bowtie = JtsRegion
				.polygon(new Coordinate[] { new Coordinate(0, 0), new Coordinate(10, 10), new Coordinate(10, 0), new Coordinate(0, 10) });
		assertFalse(bowtie.isValid());
		assertNotNull(bowtie.getValidationError());
	}

	@Test
	public void testRectangleIntersection() throws Exception {
		JtsRegion region = JtsRegion.of(wktReader.read("POLYGON ((0 0, 100 0, 0 100, 0 0))"));
		JtsRegion prepared = region.prepare();
		assertFalse(region.isPrepared());
		assertTrue(prepared.isPrepared());
		assertTrue(prepared.prepare() == prepared);

		for (JtsRegion r : new JtsRegion[] { region, prepared }) {
			assertTrue(r.intersects(10, 10, 20, 20));
			assertTrue(r.intersects(-10, -10, 200, 200));
			// touching at a corner counts
			assertTrue(r.intersects(50, 50, 60, 60));
			assertFalse(r.intersects(60, 60, 70, 70));
			assertFalse(r.intersects(-20, -20, -10, -10));
		}
	}

	@Test
	public void testBufferAndHull() throws Exception {
		JtsRegion square = JtsRegion.of(wktReader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))"));

		Envelope grown = square.buffer(2).getEnvelope();
		assertEquals(new Envelope(-2, 12, -2, 12), grown);
		// rounded corners
		assertTrue(square.buffer(2).getGeometry().getArea() < 14 * 14);

		assertTrue(square.buffer(-6).isEmpty());
		assertEquals(36, square.buffer(-2).getGeometry().getArea(), 1e-9);

		JtsRegion notch = JtsRegion.of(wktReader.read("POLYGON ((0 0, 10 0, 10 10, 5 5, 0 10, 0 0))"));
		assertEquals(100, notch.convexHull().getGeometry().getArea(), 1e-9);
	}

	@Test
	public void testShellOfLargestPart() throws Exception {
		Geometry multi = wktReader.read("MULTIPOLYGON (((0 0, 1 0, 1 1, 0 1, 0 0)), ((10 10, 20 10, 20 20, 10 20, 10 10)))");
		Coordinate[] shell = JtsRegion.of(multi).getShell();
		assertEquals(5, shell.length);
		assertEquals(10, shell[0].x, 0);
	}

	@Test
	public void testEnvelopeIsCopy() throws Exception {
		JtsRegion square = JtsRegion.of(wktReader.read("POLYGON ((0 0, 10 0, 10 10, 0 10, 0 0))"));
		square.getEnvelope().expandBy(5);
		assertEquals(new Envelope(0, 10, 0, 10), square.getEnvelope());
	}
}
