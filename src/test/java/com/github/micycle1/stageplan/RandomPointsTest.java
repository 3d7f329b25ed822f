package com.github.micycle1.stageplan;

import static com.github.micycle1.stageplan.GridFromEdgesTest.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;

import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

public class RandomPointsTest {

	@Test
	public void testSeededPlanIsReproducible() {
		RandomPoints plan = RandomPoints.builder(5).maxSize(10, 10).randomSeed(0).build();
		List<Position> first = toList(plan);
		List<Position> second = toList(plan);
		List<Position> rebuilt = toList(RandomPoints.builder(5).maxSize(10, 10).randomSeed(0).build());

		assertEquals(5, first.size());
		assertEquals(first, second);
		assertEquals(first, rebuilt);
		for (int i = 0; i < first.size(); i++) {
			assertEquals(String.format("%04d", i), first.get(i).getName());
			assertNull(first.get(i).getRow());
		}
	}

	@Test
	public void testUnseededPlansDiffer() {
		RandomPoints plan = RandomPoints.builder(10).maxSize(100, 100).build();
		assertFalse(toList(plan).equals(toList(plan)));
	}

	@Test
	public void testUnorderedFollowsGenerationOrder() {
		RandomPoints plan = RandomPoints.builder(25).maxSize(30, 20).shape(Shape.RECTANGLE).randomSeed(99).order(null).build();
		Coordinate[] expected = ShapeSamplers.forShape(Shape.RECTANGLE).sample(new MersenneTwister(99L), 25, 30, 20);
		assertEquals(Arrays.asList(expected), plan.samplePoints().getPoints());
	}

	@Test
	public void testOrderingPermutesSamePoints() {
		RandomPoints unordered = RandomPoints.builder(40).maxSize(100, 100).randomSeed(5).order(null).build();
		RandomPoints ordered = RandomPoints.builder(40).maxSize(100, 100).randomSeed(5).order(TraversalOrder.TWO_OPT).startAt(7).build();

		List<Coordinate> generated = unordered.samplePoints().getPoints();
		List<Coordinate> visited = ordered.samplePoints().getPoints();
		assertEquals(new HashSet<>(generated), new HashSet<>(visited));
		assertEquals(generated.get(7), visited.get(0));
	}

	@Test
	public void testNonOverlappingPoints() {
		RandomPoints plan = RandomPoints.builder(20).maxSize(100, 100).shape(Shape.RECTANGLE).randomSeed(1).allowOverlap(false).fov(1, 1).build();
		SampledPoints sampled = plan.samplePoints();

		assertTrue(sampled.isComplete());
		assertEquals(0, sampled.getShortfall());
		List<Coordinate> points = sampled.getPoints();
		assertEquals(20, points.size());
		for (int i = 0; i < points.size(); i++) {
			for (int j = i + 1; j < points.size(); j++) {
				Coordinate a = points.get(i);
				Coordinate b = points.get(j);
				assertTrue(Math.abs(a.x - b.x) >= 1 || Math.abs(a.y - b.y) >= 1, a + " overlaps " + b);
			}
		}
	}

	@Test
	public void testShortfallIsReported() {
		// every pair of points in a 10 x 10 box is closer than a 10 x 10 FOV
		RandomPoints plan = RandomPoints.builder(5).maxSize(10, 10).shape(Shape.RECTANGLE).randomSeed(3).allowOverlap(false).fov(10, 10).build();
		SampledPoints sampled = plan.samplePoints();

		assertEquals(1, sampled.getPoints().size());
		assertEquals(5, sampled.getRequested());
		assertEquals(4, sampled.getShortfall());
		assertFalse(sampled.isComplete());
		assertEquals(1, toList(plan).size());
		assertEquals(5, plan.numPositions());
	}

	@Test
	public void testOverlapAllowedIgnoresFov() {
		RandomPoints plan = RandomPoints.builder(5).maxSize(10, 10).randomSeed(3).fov(10, 10).build();
		assertEquals(5, plan.samplePoints().getPoints().size());
		RandomPoints noFov = RandomPoints.builder(5).maxSize(10, 10).randomSeed(3).allowOverlap(false).build();
		assertEquals(5, noFov.samplePoints().getPoints().size());
	}

	@Test
	public void testStartIndexClamped() {
		RandomPoints plan = RandomPoints.builder(5).randomSeed(0).startAt(10).build();
		assertEquals(Integer.valueOf(4), plan.getStartIndex());
		assertEquals(1, plan.getWarnings().size());
		assertTrue(plan.getWarnings().get(0).contains("Setting startAt to last point (4)"));

		List<Coordinate> generated = RandomPoints.builder(5).randomSeed(0).order(null).build().samplePoints().getPoints();
		assertEquals(generated.get(4), plan.samplePoints().getPoints().get(0));
	}

	@Test
	public void testStartPositionComesFirst() {
		Position start = new Position(3, 4, "origin");
		RandomPoints plan = RandomPoints.builder(6).maxSize(10, 10).randomSeed(8).startAt(start).build();

		List<Position> positions = toList(plan);
		assertEquals(6, positions.size());
		assertEquals(3, positions.get(0).getX(), 0);
		assertEquals(4, positions.get(0).getY(), 0);
		assertEquals("0000", positions.get(0).getName());
		assertNull(plan.getStartIndex());
		assertTrue(plan.getWarnings().isEmpty());
	}

	@Test
	public void testStartPositionIsKeptWhenAvoidingOverlap() {
		Position start = new Position(0, 0);
		RandomPoints plan = RandomPoints.builder(10).maxSize(50, 50).randomSeed(2).allowOverlap(false).fov(2, 2).startAt(start).build();
		List<Coordinate> points = plan.samplePoints().getPoints();
		assertEquals(new Coordinate(0, 0), points.get(0));
		for (int i = 1; i < points.size(); i++) {
			assertTrue(RandomPoints.isSeparated(points.subList(0, i), points.get(i), 2, 2));
		}
	}

	@Test
	public void testSeparationTest() {
		List<Coordinate> accepted = Arrays.asList(new Coordinate(0, 0));
		assertFalse(RandomPoints.isSeparated(accepted, new Coordinate(0.5, 0.5), 1, 1));
		// far enough on one axis is enough
		assertTrue(RandomPoints.isSeparated(accepted, new Coordinate(0.5, 1), 1, 1));
		assertTrue(RandomPoints.isSeparated(accepted, new Coordinate(-1, 0), 1, 1));
	}

	@Test
	public void testPlanProperties() {
		RandomPoints plan = RandomPoints.builder(7).build();
		assertEquals(7, plan.numPositions());
		assertTrue(plan.isRelative());
		assertEquals(Shape.ELLIPSE, plan.getShape());
		assertEquals(TraversalOrder.TWO_OPT, plan.getOrder());
		assertTrue(plan.isAllowOverlap());
		assertEquals(Integer.valueOf(0), plan.getStartIndex());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> RandomPoints.builder(0));
		assertThrows(IllegalArgumentException.class, () -> RandomPoints.builder(1).maxSize(0, 1));
		assertThrows(IllegalArgumentException.class, () -> RandomPoints.builder(1).maxSize(1, Double.NaN));
		assertThrows(IllegalArgumentException.class, () -> RandomPoints.builder(1).fov(-1, 1));
		assertThrows(IllegalArgumentException.class, () -> RandomPoints.builder(1).startAt(-1));
		assertThrows(NullPointerException.class, () -> RandomPoints.builder(1).shape(null));
	}
}
