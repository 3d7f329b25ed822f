package com.github.micycle1.stageplan;

import static com.github.micycle1.stageplan.GridFromEdgesTest.assertPosition;
import static com.github.micycle1.stageplan.GridFromEdgesTest.toList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class GridWidthHeightTest {

	private static final double EPS = 1e-9;

	@Test
	public void testCountsRoundUp() {
		GridWidthHeight plan = GridWidthHeight.builder(250, 100).fov(100, 50).build();
		assertEquals(3, plan.columnCount(100));
		assertEquals(2, plan.rowCount(50));
		assertEquals(6, plan.numPositions());
	}

	@Test
	public void testCenteredOnOrigin() {
		GridWidthHeight plan = GridWidthHeight.builder(250, 100).fov(100, 50).overlap(20).build();
		List<Position> positions = toList(plan);

		// dx = 80 -> 4 columns, dy = 40 -> 3 rows
		assertEquals(12, positions.size());
		assertEquals(plan.numPositions(), positions.size());
		double sx = 0;
		double sy = 0;
		for (Position p : positions) {
			sx += p.getX();
			sy += p.getY();
		}
		assertEquals(0, sx, EPS);
		assertEquals(0, sy, EPS);
		assertPosition(positions.get(0), -120, 40, 0, 0, "0000");
	}

	@Test
	public void testTopLeft() {
		GridWidthHeight plan = GridWidthHeight.builder(30, 30).fov(10, 10).relativeTo(RelativeTo.TOP_LEFT).mode(OrderMode.ROW_WISE).build();
		List<Position> positions = toList(plan);
		assertEquals(9, positions.size());
		assertPosition(positions.get(0), 0, 0, 0, 0, "0000");
		assertPosition(positions.get(8), 20, -20, 2, 2, "0008");
	}

	@Test
	public void testNumPositionsRequiresFov() {
		GridWidthHeight plan = GridWidthHeight.builder(250, 100).build();
		assertThrows(IllegalStateException.class, plan::numPositions);
		assertEquals(6, plan.withFov(100, 50).numPositions());
	}

	@Test
	public void testInvalidSize() {
		assertThrows(IllegalArgumentException.class, () -> GridWidthHeight.builder(0, 10));
		assertThrows(IllegalArgumentException.class, () -> GridWidthHeight.builder(10, -1));
		assertThrows(IllegalArgumentException.class, () -> GridWidthHeight.builder(Double.NaN, 10));
	}
}
