package com.github.micycle1.stageplan;

import java.util.concurrent.TimeUnit;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Tile filtering against a prepared region versus the plain polygon.
 */
@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 1, time = 1)
@Measurement(iterations = 2, time = 2)
@Fork(value = 1)
public class BenchmarkGridFromPolygon {

	private GridFromPolygon plan;
	private JtsRegion region;
	private double[][] tiles;

	@Param({ "100", "1000", "10000" })
	public int vertices;

	@Setup(Level.Trial)
	public void setup() {
		Coordinate[] shell = GeomMaker.makeShell(vertices, 10000, 42);
		plan = GridFromPolygon.builder(shell).fov(100, 75).overlap(10).build();
		region = JtsRegion.polygon(shell);

		final Envelope bb = plan.getBoundingBox();
		GridFromEdges raster = GridFromEdges.builder(bb.getMaxY(), bb.getMinX(), bb.getMinY(), bb.getMaxX()).fov(100, 75).overlap(10).build();
		tiles = new double[raster.numPositions()][];
		int i = 0;
		for (Position p : raster) {
			tiles[i++] = new double[] { p.getX() - 50, p.getY() - 37.5, p.getX() + 50, p.getY() + 37.5 };
		}
	}

	@Benchmark
	public void testPreparedPlan(Blackhole bh) {
		for (Position p : plan) {
			bh.consume(p);
		}
	}

	@Benchmark
	public void testUnpreparedRegion(Blackhole bh) {
		for (double[] t : tiles) {
			bh.consume(region.intersects(t[0], t[1], t[2], t[3]));
		}
	}
}
