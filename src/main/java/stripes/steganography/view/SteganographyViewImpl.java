package stripes.steganography.view;

import java.io.PrintStream;

public class SteganographyViewImpl implements SteganographyView {

    private final PrintStream out;
    private final PrintStream err;

    public SteganographyViewImpl() {
        this(System.out, System.err);
    }

    public SteganographyViewImpl(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    @Override
    public void showMessage(String message) {
        out.println(message);
    }

    @Override
    public void showError(String message) {
        err.println("ERROR: " + message);
    }

    @Override
    public void showSuccess(String message) {
        out.println("SUCCESS: " + message);
    }
}
