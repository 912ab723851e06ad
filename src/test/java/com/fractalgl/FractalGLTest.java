package com.fractalgl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

public class FractalGLTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new FractalGL());
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    private Path fixture() throws URISyntaxException {
        return Paths.get(getClass().getResource("/settings/julia-domain.json").toURI());
    }

    @Test
    public void testDefaultFormula() {
        assertEquals(0, run());
        assertTrue(out.toString().contains("return cpow(z,vec2(2.0,0.0))+c;"));
        assertTrue(out.toString().contains("const int iterations = 500;"));
    }

    @Test
    public void testOptionsReachTheProgram() {
        assertEquals(0, run("z^{3}+c", "-n", "120", "-b", "4", "-m", "grayscale", "--bias", "2",
                "--hue-shift", "15", "--julia", "--smooth"));
        String program = out.toString();

        assertTrue(program.contains("return cpow(z,vec2(3.0,0.0))+c;"));
        assertTrue(program.contains("const int iterations = 120;"));
        assertTrue(program.contains("if (z.x*z.x + z.y*z.y > 4.00) {"));
        assertTrue(program.contains("float shift = 15.00;"));
        assertTrue(program.contains("x = pow(x,pow(1.1,2.00));"));
        assertTrue(program.contains("vec2 z = c;"));
        assertTrue(program.contains("if (iter != floatIter) {"));
    }

    @Test
    public void testVertexProgram() {
        assertEquals(0, run("--vertex"));
        assertTrue(out.toString().contains("attribute vec4 a_position;"));
        assertFalse(out.toString().contains("gl_FragColor"));
    }

    @Test
    public void testSettingsFileWithOverride() throws URISyntaxException {
        assertEquals(0, run("--settings", fixture().toString(), "-n", "50"));
        String program = out.toString();

        assertTrue(program.contains("return cpow(z,vec2(3.0,0.0))+c;"));
        assertTrue(program.contains("const int iterations = 50;"));
        assertTrue(program.contains("vec3 color(vec2 x) {"));
        assertTrue(program.contains("float shift = 90.00;"));
        assertTrue(program.contains("vec2 z = c;"));
    }

    @Test
    public void testFormulaArgumentBeatsSettingsFile() throws URISyntaxException {
        assertEquals(0, run("--settings", fixture().toString(), "\\sin(z)+c"));
        assertTrue(out.toString().contains("return csin(z)+c;"));
    }

    @Test
    public void testJsonOutput() {
        assertEquals(0, run("--json", "-c"));
        String json = out.toString().trim();

        assertTrue(json.startsWith("{\"equation\":\"z^{2}+c\",\"settings\":{\"iterations\":500,"));
        assertTrue(json.contains("\"vertex\":\"attribute vec4 a_position;\\n"));
        assertTrue(json.endsWith("}"));
    }

    @Test
    public void testOutputFile(@TempDir Path tempDir) throws Exception {
        Path output = tempDir.resolve("fractal.frag");
        assertEquals(0, run("z^{2}+c", "-o", output.toString()));

        assertEquals("", out.toString());
        String written = Files.readString(output, StandardCharsets.UTF_8);
        assertTrue(written.startsWith("precision highp float;"));
    }

    @Test
    public void testPreview(@TempDir Path tempDir) throws Exception {
        Path png = tempDir.resolve("preview.png");
        assertEquals(0, run("-n", "20", "--preview", png.toString(), "--width", "16", "--height", "12"));
        assertTrue(Files.size(png) > 0);
    }

    @Test
    public void testUnknownColoringMode() {
        assertEquals(1, run("-m", "not-a-real-mode"));
        assertTrue(err.toString().contains("Error: Unknown coloring mode: not-a-real-mode"));
        assertEquals("", out.toString());
    }

    @Test
    public void testInvalidFormula() {
        assertEquals(1, run("z+"));
        assertTrue(err.toString().startsWith("Error: "));
    }

    @Test
    public void testDeeplyNestedFormulaReportsError() {
        assertEquals(1, run("(".repeat(50_000) + "z" + ")".repeat(50_000)));
        assertTrue(err.toString().startsWith("Error: Formula is nested too deeply"), err.toString());
        assertEquals("", out.toString());
    }

    @Test
    public void testNonAsciiDigitReportsParseError() {
        assertEquals(1, run("z^{\u0662}+c"));
        assertTrue(err.toString().startsWith("Error: Unexpected character"), err.toString());
    }

    @Test
    public void testInvalidIterationCount() {
        assertEquals(1, run("-n", "0"));
        assertTrue(err.toString().contains("iterations must be positive"));
    }
}
