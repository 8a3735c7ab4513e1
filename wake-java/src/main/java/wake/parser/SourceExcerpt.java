package wake.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

// "Line N: text" plus a caret under the first non-blank column
final class SourceExcerpt {
    private static final Logger LOG = LoggerFactory.getLogger(SourceExcerpt.class);

    private SourceExcerpt() {}

    static String of(String sourceFile, int line) {
        if (sourceFile == null || sourceFile.isEmpty()) return "";
        try {
            Path path = Path.of(sourceFile);
            if (!Files.isRegularFile(path)) return "";
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (line < 1 || line > lines.size()) return "";
            return render(line, lines.get(line - 1));
        } catch (IOException | InvalidPathException e) {
            LOG.debug("No source excerpt for {}:{}", sourceFile, line, e);
            return "";
        }
    }

    static String render(int line, String text) {
        String stripped = text.stripTrailing();
        int indent = stripped.length() - stripped.stripLeading().length();
        return "Line " + line + ": " + stripped + "\n" + " ".repeat(indent) + "^";
    }
}
