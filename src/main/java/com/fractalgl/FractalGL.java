package com.fractalgl;

import com.fractalgl.ast.ParseNode;
import com.fractalgl.glsl.CompiledKernel;
import com.fractalgl.glsl.FractalCompiler;
import com.fractalgl.output.KernelFormatter;
import com.fractalgl.parse.FormulaParser;
import com.fractalgl.reference.Complex;
import com.fractalgl.reference.PreviewRenderer;
import com.fractalgl.settings.RenderRequest;
import com.fractalgl.settings.RenderSettings;
import com.fractalgl.settings.SettingsReader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "fractalgl", mixinStandardHelpOptions = true, version = "1.0",
         description = "Compile a complex iteration formula into GLSL escape-time fractal shaders")
public class FractalGL implements Callable<Integer> {
    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", arity = "0..1", description = "Iteration formula, e.g. z^{2}+c (default: z^{2}+c)")
    private String formula;

    @Option(names = "--settings", description = "JSON settings file; command line options override it")
    private File settingsFile;

    @Option(names = {"-n", "--iterations"}, description = "Iteration count")
    private Integer iterations;

    @Option(names = {"-b", "--breakout"}, description = "Squared escape radius")
    private Double breakout;

    @Option(names = {"-m", "--coloring"}, description = "Coloring mode: hue, grayscale, grayscaleInv, bw, bwInv, domain")
    private String coloring;

    @Option(names = "--bias", description = "Coloring curve exponent")
    private Double bias;

    @Option(names = "--hue-shift", description = "Hue shift in degrees")
    private Double hueShift;

    @Option(names = {"-j", "--julia"}, negatable = true, description = "Seed z with c (Julia mode)")
    private Boolean julia;

    @Option(names = {"-s", "--smooth"}, negatable = true, description = "Smooth the escape count")
    private Boolean smooth;

    @Option(names = "--vertex", description = "Print the vertex program instead of the fragment program")
    private boolean vertexOnly = false;

    @Option(names = "--json", description = "Print both programs and the settings as JSON")
    private boolean json = false;

    @Option(names = {"-c", "--compact-output"}, description = "Compact JSON output without whitespace")
    private boolean compactOutput = false;

    @Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
    private File outputFile;

    @Option(names = "--preview", description = "Also render a PNG preview on the CPU")
    private File previewFile;

    @Option(names = "--width", defaultValue = "640", description = "Preview width (default: ${DEFAULT-VALUE})")
    private int width;

    @Option(names = "--height", defaultValue = "480", description = "Preview height (default: ${DEFAULT-VALUE})")
    private int height;

    @Option(names = "--center-x", defaultValue = "0", description = "Preview center, real part")
    private double centerX;

    @Option(names = "--center-y", defaultValue = "0", description = "Preview center, imaginary part")
    private double centerY;

    @Option(names = "--zoom", defaultValue = "0", description = "Preview zoom level (scale is 2^zoom)")
    private double zoom;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FractalGL()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            RenderRequest request = resolveRequest();

            // Parse and compile the formula
            ParseNode tree = new FormulaParser().parse(request.equation());
            CompiledKernel kernel = new FractalCompiler().compile(tree, request.settings());

            String text;
            if (json) {
                text = new KernelFormatter(!compactOutput).format(request.equation(), request.settings(), kernel);
            } else if (vertexOnly) {
                text = kernel.vertexSource();
            } else {
                text = kernel.fragmentSource();
            }

            if (outputFile != null) {
                Files.writeString(outputFile.toPath(), text, StandardCharsets.UTF_8);
            } else {
                out.println(text);
                out.flush();
            }

            if (previewFile != null) {
                PreviewRenderer renderer = new PreviewRenderer(tree, request.settings());
                renderer.write(renderer.render(width, height, new Complex(centerX, centerY), zoom), previewFile.toPath());
            }
            return 0;
        } catch (Exception e) {
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private RenderRequest resolveRequest() throws IOException {
        RenderRequest base = settingsFile != null
                ? new SettingsReader().read(settingsFile.toPath())
                : RenderRequest.defaults();

        RenderSettings settings = base.settings();
        if (iterations != null) {
            settings = settings.withIterations(iterations);
        }
        if (breakout != null) {
            settings = settings.withBreakout(breakout);
        }
        if (coloring != null) {
            settings = settings.withColoring(coloring);
        }
        if (bias != null) {
            settings = settings.withBias(bias);
        }
        if (hueShift != null) {
            settings = settings.withHueShift(hueShift);
        }
        if (julia != null) {
            settings = settings.withJulia(julia);
        }
        if (smooth != null) {
            settings = settings.withSmooth(smooth);
        }
        return new RenderRequest(formula != null ? formula : base.equation(), settings);
    }
}
