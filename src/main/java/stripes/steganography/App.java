package stripes.steganography;

import stripes.steganography.controller.DecodeController;
import stripes.steganography.controller.EncodeController;
import stripes.steganography.model.SteganographyService;
import stripes.steganography.model.SteganographyServiceImpl;
import stripes.steganography.view.SteganographyView;
import stripes.steganography.view.SteganographyViewImpl;
import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "stripe-stego",
        mixinStandardHelpOptions = true,
        version = "Stripe Stego 1.0",
        description = "Hide text in a grayscale image as a phase-shifted stripe pattern, or reveal it."
)
public class App {
    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        CommandLine cmd = createCommandLine(new SteganographyServiceImpl(), new SteganographyViewImpl());
        int exitCode = cmd.execute(args);
        System.exit(exitCode);
    }

    public static CommandLine createCommandLine(SteganographyService service, SteganographyView view) {
        CommandLine cmd = new CommandLine(new App());
        cmd.addSubcommand("encode", new EncodeController(service, view));
        cmd.addSubcommand("decode", new DecodeController(service, view));
        return cmd;
    }
}
