package com.github.micycle1.stageplan;

/**
 * A plan that yields a finite sequence of stage {@link Position}s.
 * <p>
 * Plans are immutable. Every call to {@link #iterator()} recomputes the
 * sequence from the plan's state, so a plan can be iterated any number of
 * times.
 */
public interface MultiPointPlan extends Iterable<Position> {

	/**
	 * Returns the number of positions the plan yields.
	 *
	 * @throws IllegalStateException if the count depends on a field of view the
	 *                               plan does not carry
	 */
	int numPositions();

	/**
	 * @return {@code true} if positions are offsets from the current stage
	 *         position, {@code false} if they are absolute stage coordinates
	 */
	boolean isRelative();
}
