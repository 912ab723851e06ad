package com.fractalgl.reference;

import com.fractalgl.ast.ParseNode;
import com.fractalgl.glsl.ColoringMode;
import com.fractalgl.glsl.KernelAssembler;
import com.fractalgl.settings.RenderSettings;

/**
 * Runs the fragment program's main loop on the CPU: seed, breakout test, smoothing and
 * normalisation of the escape count.
 */
public class EscapeTimeIterator {
    private static final double LN2 = Math.log(2.0);

    private final ParseNode formula;
    private final RenderSettings settings;
    private final ColoringMode mode;
    private final double breakout;
    private final FormulaEvaluator evaluator = new FormulaEvaluator();

    public EscapeTimeIterator(ParseNode formula, RenderSettings settings) {
        this.formula = formula;
        this.settings = settings;
        this.mode = ColoringMode.fromKey(settings.coloring());
        // compare against the literal the kernel prints, not the raw setting
        this.breakout = KernelAssembler.emittedValue(settings.breakout());
    }

    public EscapeResult iterate(Complex c) {
        Complex z = settings.julia() ? c : Complex.ZERO;
        double floatIter = settings.iterations();
        double iter = floatIter;
        for (int i = 0; i < settings.iterations(); i++) {
            if (!mode.isDomain() && z.squaredMagnitude() > breakout) {
                iter = i;
                break;
            }
            z = evaluator.evaluate(formula, z, c);
        }

        boolean escaped = iter != floatIter;
        if (settings.smooth() && escaped) {
            double logZn = Math.log(z.squaredMagnitude()) / 2.0;
            double nu = Math.log(logZn / LN2) / LN2;
            iter = iter + 1.0 - nu;
        }
        return new EscapeResult(iter, z, escaped);
    }

    /** The value handed to a non-domain coloring routine, before its bias curve. */
    public double colorInput(EscapeResult result) {
        return result.iteration() / settings.iterations();
    }

    public ColoringMode mode() {
        return mode;
    }
}
