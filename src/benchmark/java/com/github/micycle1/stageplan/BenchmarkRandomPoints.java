package com.github.micycle1.stageplan;

import java.util.concurrent.TimeUnit;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

@State(Scope.Benchmark)
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@Warmup(iterations = 1, time = 1)
@Measurement(iterations = 2, time = 2)
@Fork(value = 1)
public class BenchmarkRandomPoints {

	private RandomPoints nearestNeighbor;
	private RandomPoints twoOpt;
	private RandomPoints separated;

	@Param({ "100", "500", "2000" })
	public int n;

	@Setup
	public void setup() {
		nearestNeighbor = RandomPoints.builder(n).maxSize(10000, 10000).randomSeed(1337).order(TraversalOrder.NEAREST_NEIGHBOR).build();
		twoOpt = RandomPoints.builder(n).maxSize(10000, 10000).randomSeed(1337).order(TraversalOrder.TWO_OPT).build();
		separated = RandomPoints.builder(n).maxSize(10000, 10000).randomSeed(1337).order(null).allowOverlap(false).fov(50, 50).build();
	}

	@Benchmark
	public void testNearestNeighbor(Blackhole bh) {
		bh.consume(nearestNeighbor.samplePoints());
	}

	@Benchmark
	public void testTwoOpt(Blackhole bh) {
		bh.consume(twoOpt.samplePoints());
	}

	@Benchmark
	public void testRejectionSampling(Blackhole bh) {
		bh.consume(separated.samplePoints());
	}
}
