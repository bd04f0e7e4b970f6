package stripes.steganography.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import stripes.steganography.model.text.GlyphRasterizer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Map;

public class SteganographyServiceImpl implements SteganographyService {

    private static final Logger log = LoggerFactory.getLogger(SteganographyServiceImpl.class);

    private final StegoImageIO imageIO;
    private final Decoder decoder;

    public SteganographyServiceImpl() {
        this(new StegoImageIO(), new Decoder());
    }

    public SteganographyServiceImpl(StegoImageIO imageIO, Decoder decoder) {
        this.imageIO = imageIO;
        this.decoder = decoder;
    }

    @Override
    public EncodingParameters hideMessage(Path coverFile, String message, Path outputFile,
                                          EncodeSettings settings, GlyphRasterizer rasterizer) throws IOException {
        GrayImage carrier = imageIO.readGrayscale(coverFile);
        log.info("Loaded carrier {} ({}x{})", coverFile, carrier.width(), carrier.height());

        EncodingResult result = new Encoder(rasterizer).encode(carrier, message, settings);
        imageIO.writePng(result.stego(), result.parameters().toMetadata(), outputFile);
        log.info("Wrote stego image {} with {}", outputFile, result.parameters());
        return result.parameters();
    }

    @Override
    public void revealMessage(Path stegoFile, Path outputFile) throws IOException {
        Map<String, String> metadata = imageIO.readTextMetadata(stegoFile);
        EncodingParameters parameters = EncodingParameters.fromMetadata(metadata);
        GrayImage stego = imageIO.readGrayscale(stegoFile);
        log.info("Decoding {} ({}x{}) with {}", stegoFile, stego.width(), stego.height(), parameters);

        GrayImage revealed = decoder.decode(stego, parameters);
        imageIO.writePng(revealed, Collections.emptyMap(), outputFile);
    }
}
