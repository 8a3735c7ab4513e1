package wake.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wake.compiler.CompileResult;
import wake.compiler.WakeCompiler;
import wake.diag.Diagnostic;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.ArrayList;
import java.util.List;

public final class Main {
    private static final Logger LOG = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: wakec <input.wake> [output.masm]");
            return EXIT_USAGE;
        }

        Path input = Path.of(args[0]).normalize();
        Path output = (args.length == 2)
                ? Path.of(args[1]).normalize()
                : Path.of(input.toString().replaceFirst("(?i)\\.wake$", "") + ".masm");

        if (!Files.isRegularFile(input)) {
            System.err.println("Input file '" + input + "' not found");
            return EXIT_FAILURE;
        }

        System.out.println("Compiling " + input + " to " + output);
        CompileResult result = new WakeCompiler(defaultSearchPaths()).compile(input);

        for (Diagnostic w : result.warnings()) {
            System.err.println(w);
        }
        if (!result.isSuccess()) {
            System.err.println("Error: " + result.error());
            return EXIT_FAILURE;
        }

        try {
            Files.writeString(output, result.output(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Error: could not write '" + output + "': " + e.getMessage());
            return EXIT_FAILURE;
        }

        System.out.println("Wake file '" + input + "' successfully compiled to Masm file '" + output + "'");
        return EXIT_OK;
    }

    // compiler install dir, its include/ subdirectory, then the working directory
    static List<Path> defaultSearchPaths() {
        List<Path> paths = new ArrayList<>();
        Path installDir = installDir();
        if (installDir != null) {
            paths.add(installDir);
            paths.add(installDir.resolve("include"));
        }
        paths.add(Path.of("").toAbsolutePath());
        return paths;
    }

    private static Path installDir() {
        CodeSource source = Main.class.getProtectionDomain().getCodeSource();
        if (source == null) return null;
        try {
            Path location = Path.of(source.getLocation().toURI());
            return Files.isDirectory(location) ? location : location.getParent();
        } catch (URISyntaxException | IllegalArgumentException e) {
            LOG.debug("Cannot determine install directory", e);
            return null;
        }
    }
}
