package com.banana.core.request;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Prepares a reference image for upload: RGB, longest side at most {@link #MAX_DIMENSION}, PNG.
 * Blocking; called from worker threads.
 */
public final class ReferenceImageLoader {

    public static final int MAX_DIMENSION = 1024;

    private final int maxDimension;

    public ReferenceImageLoader() {
        this(MAX_DIMENSION);
    }

    public ReferenceImageLoader(int maxDimension) {
        if (maxDimension < 1) {
            throw new IllegalArgumentException("maxDimension must be positive");
        }
        this.maxDimension = maxDimension;
    }

    public ReferenceImage load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("Image not found: " + path);
        }
        BufferedImage source = ImageIO.read(path.toFile());
        if (source == null) {
            throw new IOException("Unsupported image format: " + path.getFileName());
        }
        BufferedImage prepared = toRgb(source, maxDimension);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(prepared, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return new ReferenceImage(out.toByteArray(), "image/png", prepared.getWidth(), prepared.getHeight());
    }

    static BufferedImage toRgb(BufferedImage source, int maxDimension) {
        int width = source.getWidth();
        int height = source.getHeight();
        int longest = Math.max(width, height);
        if (longest > maxDimension) {
            double scale = (double) maxDimension / longest;
            width = Math.max(1, (int) Math.round(width * scale));
            height = Math.max(1, (int) Math.round(height * scale));
        }
        if (width == source.getWidth() && height == source.getHeight()
            && source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }

        BufferedImage target = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
