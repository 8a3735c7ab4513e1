package wake.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import wake.ast.Program;
import wake.ast.decl.FunctionDecl;
import wake.ast.decl.TopLevelDecl;
import wake.ast.decl.VerbatimIncludeDecl;
import wake.ast.insn.*;
import wake.diag.Diagnostic;
import wake.lexer.Token;
import wake.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class Parser {
    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final List<Diagnostic> warnings = new ArrayList<>();
    private int pos = 0;

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("token stream must end with EOF");
        }
        this.tokens = tokens;
    }

    public List<Diagnostic> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    // ---------- entry ----------
    public Program parseProgram() {
        List<TopLevelDecl> decls = new ArrayList<>();

        while (!check(TokenType.EOF)) {
            if (match(TokenType.MACRO_INCLUDE)) decls.add(parseVerbatimInclude());
            else if (match(TokenType.INCLUDE)) skipUnresolvedInclude();
            else if (match(TokenType.VOID)) decls.add(parseFunctionDecl());
            else {
                Token t = advance();
                warn(t, "Skipping unexpected token '" + t.lexeme() + "' (" + t.type() + ")");
            }
        }
        return new Program(decls);
    }

    // ---------- directives ----------
    private VerbatimIncludeDecl parseVerbatimInclude() {
        Token directive = previous();
        Token path = consume(TokenType.STRING_LITERAL, "Expected string path after '" + directive.lexeme() + "'");
        return new VerbatimIncludeDecl(directive.lexeme(), path.lexeme());
    }

    // #include left in the stream was already reported by the include resolver
    private void skipUnresolvedInclude() {
        Token directive = previous();
        Token path = consume(TokenType.STRING_LITERAL, "Expected string path after '" + directive.lexeme() + "'");
        LOG.debug("Dropping unresolved include {} at {}:{}", path.lexeme(), directive.sourceFile(), directive.line());
    }

    // ---------- function ----------
    private FunctionDecl parseFunctionDecl() {
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");

        // parameter lists are always empty
        consume(TokenType.LPAREN, "Expected '(' after function name");
        consume(TokenType.RPAREN, "Expected ')' after parameters");
        consume(TokenType.LBRACE, "Expected '{' before function body");

        List<Instruction> body = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !check(TokenType.EOF)) {
            skipSemicolons();
            if (check(TokenType.RBRACE) || check(TokenType.EOF)) break;

            if (match(TokenType.IDENTIFIER)) {
                body.add(parseInstruction(previous()));
            } else {
                Token t = advance();
                warn(t, "Skipping unexpected token '" + t.lexeme() + "' in body of '" + name.lexeme() + "'");
            }
            skipSemicolons();
        }

        consume(TokenType.RBRACE, "Expected '}' after function body");
        return new FunctionDecl(name.lexeme(), body);
    }

    private Instruction parseInstruction(Token name) {
        Opcode op = Opcode.fromKeyword(name.lexeme())
                .orElseThrow(() -> ParseException.of(name, "Unknown instruction '" + name.lexeme() + "'"));

        consume(TokenType.LPAREN, "Expected '(' after '" + name.lexeme() + "'");
        Instruction insn = switch (op) {
            case MOV -> {
                String dest = value("destination");
                comma();
                yield new Move(dest, value("source"));
            }
            case DB -> parseDefineBytes();
            case CALL -> new Call(consume(TokenType.STRING_LITERAL, "Expected function name string").lexeme());
            case HLT -> new Halt();
            case RET -> new Return();

            case ADD -> binary(Add::new);
            case SUB -> binary(Subtract::new);
            case MUL -> binary(Multiply::new);
            case DIV -> binary(Divide::new);
            case CMP -> binary(Compare::new);
            case AND -> binary(And::new);
            case OR -> binary(Or::new);
            case XOR -> binary(Xor::new);
            case SHL -> binary(ShiftLeft::new);
            case SHR -> binary(ShiftRight::new);

            case INC -> new Increment(value("operand"));
            case PUSH -> new Push(value("operand"));
            case POP -> new Pop(value("operand"));
            case NOT -> new Not(value("operand"));
            case EXIT -> new Exit(value("operand"));

            case JMP -> new Jump(label("jump target"));
            case JE -> conditional(JumpIfEqual::new);
            case JNE -> conditional(JumpIfNotEqual::new);
            case JL -> conditional(JumpIfLess::new);
            case JG -> conditional(JumpIfGreater::new);

            case OUT -> output(Output::new);
            case COUT -> output(OutputChar::new);
        };
        consume(TokenType.RPAREN, "Expected ')' after arguments of '" + name.lexeme() + "'");
        match(TokenType.SEMICOLON);
        return insn;
    }

    private DefineBytes parseDefineBytes() {
        Token addr = consume(TokenType.IDENTIFIER, "Expected address");
        if (!addr.lexeme().startsWith("$")) {
            throw ParseException.of(addr, "Address in db statement must start with $");
        }
        comma();
        Token text = consume(TokenType.STRING_LITERAL, "Expected string");
        return new DefineBytes(addr.lexeme().substring(1), text.lexeme());
    }

    // ---------- operand shapes ----------
    private interface BinaryFactory { Instruction create(String dest, List<String> sources); }
    private interface PairFactory { Instruction create(String first, String second); }

    // dest, src [, src]
    private Instruction binary(BinaryFactory factory) {
        String dest = value("first argument");
        comma();
        List<String> sources = new ArrayList<>();
        sources.add(value("second argument"));
        if (match(TokenType.COMMA)) sources.add(value("third argument"));
        return factory.create(dest, sources);
    }

    private Instruction conditional(PairFactory factory) {
        String whenTrue = label("true label");
        consume(TokenType.COMMA, "Expected ',' between jump targets");
        return factory.create(whenTrue, label("false label"));
    }

    private Instruction output(PairFactory factory) {
        String port = value("port number/identifier");
        consume(TokenType.COMMA, "Expected ',' between output arguments");
        if (match(TokenType.IDENTIFIER, TokenType.STRING_LITERAL)) {
            return factory.create(port, unquote(previous().lexeme()));
        }
        throw ParseException.of(peek(), "Expected second argument (register/identifier/address)");
    }

    private String value(String what) {
        if (match(TokenType.IDENTIFIER, TokenType.NUMBER_LITERAL)) return previous().lexeme();
        throw ParseException.of(peek(), "Expected " + what);
    }

    private String label(String what) {
        if (match(TokenType.STRING_LITERAL, TokenType.IDENTIFIER)) return unquote(previous().lexeme());
        throw ParseException.of(peek(), "Expected " + what);
    }

    private void comma() {
        consume(TokenType.COMMA, "Expected ',' between arguments");
    }

    static String unquote(String s) {
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) return s.substring(1, s.length() - 1);
        return s;
    }

    // ---------- helpers ----------
    private void skipSemicolons() {
        while (match(TokenType.SEMICOLON)) {
            // separators
        }
    }

    private void warn(Token at, String message) {
        Diagnostic d = new Diagnostic(at.sourceFile(), at.line(), message);
        LOG.debug("{}", d);
        warnings.add(d);
    }

    private boolean match(TokenType... types) {
        for (TokenType t : types) {
            if (check(t)) { advance(); return true; }
        }
        return false;
    }

    private Token consume(TokenType t, String msg) {
        if (check(t)) return advance();
        throw ParseException.of(peek(), msg);
    }

    private boolean check(TokenType t) {
        return peek().type() == t;
    }

    private Token advance() {
        if (!check(TokenType.EOF)) pos++;
        return previous();
    }

    private Token peek() { return tokens.get(pos); }
    private Token previous() { return tokens.get(pos - 1); }
}
