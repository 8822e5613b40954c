package com.medform.backend.services.extraction;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import javax.imageio.ImageIO;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Reduces any supported document to a single representative page image.
 */
@Component
@Slf4j
public class DocumentRasterizer {

    public BufferedImage rasterizeFirstPage(SourceDocument document, int dpi) throws IOException {
        if (document.isPdf()) {
            try (PDDocument pdf = PDDocument.load(new ByteArrayInputStream(document.bytes()))) {
                if (pdf.getNumberOfPages() == 0) {
                    throw new IOException("PDF has no pages");
                }
                PDFRenderer renderer = new PDFRenderer(pdf);
                BufferedImage image = renderer.renderImageWithDPI(0, Math.max(72, dpi), ImageType.RGB);
                log.info("[Raster] PDF page 1/{} rendered at {} dpi ({}x{})",
                        pdf.getNumberOfPages(), dpi, image.getWidth(), image.getHeight());
                return image;
            }
        }

        BufferedImage image = ImageIO.read(new ByteArrayInputStream(document.bytes()));
        if (image == null) {
            throw new IOException("Unsupported image format" + (document.mimeType() != null ? " (" + document.mimeType() + ")" : ""));
        }
        return image;
    }

    /**
     * Downscales by {@code sqrt(maxBytes / encodedBytes)} when the PNG encoding exceeds the limit.
     */
    public BufferedImage downscaleIfNeeded(BufferedImage image, long maxBytes) throws IOException {
        long encoded = toPng(image).length;
        if (maxBytes <= 0 || encoded <= maxBytes) return image;

        double ratio = Math.sqrt((double) maxBytes / (double) encoded);
        int width = Math.max(1, (int) Math.floor(image.getWidth() * ratio));
        int height = Math.max(1, (int) Math.floor(image.getHeight() * ratio));
        log.info("[Raster] Downscaling {}x{} -> {}x{} (encodedBytes={} max={})",
                image.getWidth(), image.getHeight(), width, height, encoded, maxBytes);
        return resize(image, width, height, BufferedImage.TYPE_INT_RGB);
    }

    public BufferedImage toGrayscale(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) return image;
        return resize(image, image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
    }

    public byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (!ImageIO.write(image, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }

    private static BufferedImage resize(BufferedImage source, int width, int height, int type) {
        BufferedImage target = new BufferedImage(width, height, type);
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
