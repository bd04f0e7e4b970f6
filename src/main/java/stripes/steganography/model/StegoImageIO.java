package stripes.steganography.model;

import org.w3c.dom.NodeList;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads carriers as grayscale grids and writes PNG files whose text entries
 * ({@code tEXt} chunks) carry the encoding parameters.
 */
public class StegoImageIO {

    private static final String PNG = "png";
    private static final String PNG_METADATA_FORMAT = "javax_imageio_png_1.0";

    /**
     * Loads any ImageIO-readable raster. Gray rasters (with or without alpha, any bit
     * depth) are read from band 0 and scaled to 8 bits; color images are converted
     * with 0.299 R + 0.587 G + 0.114 B.
     * @throws IOException if the file cannot be read or holds no decodable image.
     */
    public GrayImage readGrayscale(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Could not load image at " + file + ": unsupported or corrupt format.");
        }
        int height = image.getHeight();
        int width = image.getWidth();
        double[] samples = new double[height * width];

        ColorModel colorModel = image.getColorModel();
        if (colorModel.getColorSpace().getType() == ColorSpace.TYPE_GRAY) {
            // getRGB would pass gray samples through a linear to sRGB conversion
            int bits = colorModel.getComponentSize(0);
            int[] raw = image.getRaster().getSamples(0, 0, width, height, 0, (int[]) null);
            for (int i = 0; i < raw.length; i++) {
                samples[i] = toEightBit(raw[i], bits);
            }
        } else {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int rgb = image.getRGB(x, y);
                    int r = (rgb >> 16) & 0xFF;
                    int g = (rgb >> 8) & 0xFF;
                    int b = rgb & 0xFF;
                    samples[y * width + x] = Math.rint(0.299 * r + 0.587 * g + 0.114 * b);
                }
            }
        }
        return GrayImage.of(height, width, samples);
    }

    static double toEightBit(int sample, int bits) {
        if (bits == 8) return sample;
        if (bits > 8) return sample >> (bits - 8);
        return Math.rint(sample * 255.0 / ((1 << bits) - 1));
    }

    /**
     * Writes an 8-bit grayscale PNG. Samples are clipped to [0,255] and truncated.
     */
    public void writePng(GrayImage image, Map<String, String> textEntries, Path file) throws IOException {
        BufferedImage buffered = new BufferedImage(image.width(), image.height(), BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = buffered.getRaster();
        raster.setDataElements(0, 0, image.width(), image.height(), image.toByteSamples());

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(PNG);
        if (!writers.hasNext()) {
            throw new IOException("No PNG writer available.");
        }
        ImageWriter writer = writers.next();
        try {
            ImageWriteParam param = writer.getDefaultWriteParam();
            IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(buffered), param);

            if (textEntries != null && !textEntries.isEmpty()) {
                IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(PNG_METADATA_FORMAT);
                IIOMetadataNode text = new IIOMetadataNode("tEXt");
                for (Map.Entry<String, String> e : textEntries.entrySet()) {
                    IIOMetadataNode entry = new IIOMetadataNode("tEXtEntry");
                    entry.setAttribute("keyword", e.getKey());
                    entry.setAttribute("value", e.getValue());
                    text.appendChild(entry);
                }
                root.appendChild(text);
                metadata.setFromTree(PNG_METADATA_FORMAT, root);
            }

            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.deleteIfExists(file);
            try (ImageOutputStream ios = ImageIO.createImageOutputStream(file.toFile())) {
                if (ios == null) {
                    throw new IOException("Cannot open " + file + " for writing.");
                }
                writer.setOutput(ios);
                writer.write(null, new IIOImage(buffered, null, metadata), param);
            }
        } finally {
            writer.dispose();
        }
    }

    /**
     * Returns the PNG text entries of a file, empty when it has none or is not a PNG.
     */
    public Map<String, String> readTextMetadata(Path file) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (ImageInputStream iis = ImageIO.createImageInputStream(file.toFile())) {
            if (iis == null) {
                throw new IOException("Cannot open " + file + " for reading.");
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) {
                throw new IOException("Could not load image at " + file + ": unsupported or corrupt format.");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true);
                IIOMetadata metadata = reader.getImageMetadata(0);
                if (metadata == null || !PNG_METADATA_FORMAT.equals(metadata.getNativeMetadataFormatName())) {
                    return entries;
                }
                IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(PNG_METADATA_FORMAT);
                NodeList list = root.getElementsByTagName("tEXtEntry");
                for (int i = 0; i < list.getLength(); i++) {
                    IIOMetadataNode node = (IIOMetadataNode) list.item(i);
                    entries.put(node.getAttribute("keyword"), node.getAttribute("value"));
                }
            } finally {
                reader.dispose();
            }
        }
        return entries;
    }
}
