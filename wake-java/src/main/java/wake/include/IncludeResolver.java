package wake.include;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wake.diag.Diagnostic;
import wake.lexer.Lexer;
import wake.lexer.Token;
import wake.lexer.TokenType;
import wake.parser.ParseException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.*;

public final class IncludeResolver {
    private static final Logger LOG = LoggerFactory.getLogger(IncludeResolver.class);

    public static final String EXTENSION = ".wake";

    private final List<Path> searchPaths = new ArrayList<>();

    public record Result(List<Token> tokens, List<Diagnostic> warnings) {}

    public IncludeResolver(Path rootDir) {
        addSearchPath(rootDir);
    }

    // existing, not yet listed directories only
    public boolean addSearchPath(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) return false;
        Path normalized = dir.toAbsolutePath().normalize();
        if (searchPaths.contains(normalized)) return false;
        searchPaths.add(normalized);
        return true;
    }

    public List<Path> searchPaths() {
        return List.copyOf(searchPaths);
    }

    // next to currentFile, then each search path, then both again with EXTENSION appended
    public Path resolveIncludePath(String name, Path currentFile) {
        return findIncludePath(name, currentFile)
                .orElseThrow(() -> new IncludeException(name, currentFile == null ? "" : currentFile.toString()));
    }

    public Optional<Path> findIncludePath(String name, Path currentFile) {
        Optional<Path> found = lookup(name, currentFile);
        if (found.isEmpty() && !name.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            found = lookup(name + EXTENSION, currentFile);
        }
        return found;
    }

    private Optional<Path> lookup(String name, Path currentFile) {
        Path relative;
        try {
            relative = Path.of(name);
        } catch (InvalidPathException e) {
            LOG.debug("Not a valid include path: '{}'", name, e);
            return Optional.empty();
        }

        if (currentFile != null) {
            Path dir = currentFile.toAbsolutePath().getParent();
            if (dir != null) {
                Path candidate = dir.resolve(relative).normalize();
                if (Files.isRegularFile(candidate)) return Optional.of(candidate);
            }
        }
        for (Path dir : searchPaths) {
            Path candidate = dir.resolve(relative).normalize();
            if (Files.isRegularFile(candidate)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    // ---------- merge ----------
    // one fresh visited set per call; a file seen before contributes nothing
    public Result process(Path entryFile) throws IOException {
        Path main = entryFile.toAbsolutePath().normalize();
        Set<Path> visited = new HashSet<>();
        List<Token> merged = new ArrayList<>();
        List<Diagnostic> warnings = new ArrayList<>();

        Token eof = expand(main, true, visited, merged, warnings);
        merged.add(eof != null ? eof : new Token(TokenType.EOF, "", 1, main.toString()));

        LOG.debug("Resolved {} into {} tokens from {} file(s)", main, merged.size(), visited.size());
        return new Result(List.copyOf(merged), List.copyOf(warnings));
    }

    // appends the file's tokens minus its EOF to out, returns that EOF (null if skipped)
    private Token expand(Path file, boolean entry, Set<Path> visited,
                         List<Token> out, List<Diagnostic> warnings) throws IOException {
        if (!visited.add(file.toRealPath()) && !entry) {
            LOG.debug("Already included, skipping {}", file);
            return null;
        }

        String source = Files.readString(file, StandardCharsets.UTF_8);
        List<Token> tokens = new Lexer(source, file.toString()).tokenize();

        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            switch (t.type()) {
                case EOF -> {
                    return t;
                }
                case MACRO_INCLUDE, INCLUDE -> {
                    // the lexer always ends with EOF, so i + 1 exists
                    Token path = tokens.get(++i);
                    if (path.type() != TokenType.STRING_LITERAL) {
                        throw ParseException.of(path, "Expected string after '" + t.lexeme() + "' directive");
                    }
                    if (t.type() == TokenType.MACRO_INCLUDE) {
                        out.add(t);
                        out.add(path);
                    } else {
                        include(t, path, file, visited, out, warnings);
                    }
                }
                default -> out.add(t);
            }
        }
        return null;
    }

    private void include(Token directive, Token path, Path from, Set<Path> visited,
                         List<Token> out, List<Diagnostic> warnings) throws IOException {
        String name = stripQuotes(path.lexeme());
        Optional<Path> target = findIncludePath(name, from);
        if (target.isPresent()) {
            LOG.debug("Including {} from {}:{}", target.get(), from, directive.line());
            expand(target.get(), false, visited, out, warnings);
            return;
        }

        Diagnostic warning = new Diagnostic(from.toString(), directive.line(),
                "Could not find include file '" + name + "', keeping the directive");
        LOG.debug("{}", warning);
        warnings.add(warning);
        out.add(directive);
        out.add(path);
    }

    private static String stripQuotes(String lexeme) {
        int start = 0;
        int end = lexeme.length();
        while (start < end && lexeme.charAt(start) == '"') start++;
        while (end > start && lexeme.charAt(end - 1) == '"') end--;
        return lexeme.substring(start, end);
    }
}
