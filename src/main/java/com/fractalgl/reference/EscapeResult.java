package com.fractalgl.reference;

/**
 * Outcome of iterating one point.
 *
 * @param iteration step at which the iterate escaped (fractional when smoothed), or the
 *                  iteration count when it never did
 * @param finalZ    the iterate when the loop stopped
 * @param escaped   whether the breakout test fired
 */
public record EscapeResult(double iteration, Complex finalZ, boolean escaped) {
}
