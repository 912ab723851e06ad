package com.fractalgl.reference;

import com.fractalgl.ast.ParseNode;
import com.fractalgl.settings.RenderSettings;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.stream.IntStream;

/**
 * Renders a formula on the CPU with the same pixel-to-plane mapping as the vertex program:
 * {@code c = (clip.x * aspect, clip.y) / 2^zoom + center}.
 */
public class PreviewRenderer {
    private final EscapeTimeIterator iterator;
    private final ColorMapper colorMapper;
    private final int iterations;

    public PreviewRenderer(ParseNode formula, RenderSettings settings) {
        this.iterator = new EscapeTimeIterator(formula, settings);
        this.colorMapper = new ColorMapper(settings);
        this.iterations = settings.iterations();
    }

    public BufferedImage render(int width, int height, Complex center, double zoomLevel) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image size must be positive: " + width + "x" + height);
        }
        double aspect = (double) width / height;
        double scale = Math.pow(2.0, zoomLevel);
        int[] pixels = new int[width * height];

        IntStream.range(0, height).parallel().forEach(row -> {
            double clipY = 1.0 - 2.0 * (row + 0.5) / height;
            for (int column = 0; column < width; column++) {
                double clipX = 2.0 * (column + 0.5) / width - 1.0;
                Complex c = new Complex(clipX * aspect / scale + center.re(), clipY / scale + center.im());
                pixels[row * width + column] = colorMapper.color(iterator.iterate(c), iterations);
            }
        });

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        image.setRGB(0, 0, width, height, pixels, 0, width);
        return image;
    }

    public void write(BufferedImage image, Path output) throws IOException {
        if (!ImageIO.write(image, "png", output.toFile())) {
            throw new IOException("No PNG writer available");
        }
    }
}
