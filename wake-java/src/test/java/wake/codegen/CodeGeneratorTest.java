package wake.codegen;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import wake.ast.Program;
import wake.ast.decl.FunctionDecl;
import wake.ast.decl.VerbatimIncludeDecl;
import wake.ast.insn.*;
import wake.lexer.Lexer;
import wake.parser.Parser;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class CodeGeneratorTest {

    private static Program parse(String src) {
        return new Parser(new Lexer(src, "").tokenize()).parseProgram();
    }

    private static String compile(String src) {
        return new CodeGenerator().generate(parse(src));
    }

    // one case per instruction kind: statement -> emitted line
    static Stream<Arguments> instructionTable() {
        return Stream.of(
                Arguments.of("mov(r1, 5)", "    MOV r1 5"),
                Arguments.of("db($10, \"hello\")", "    DB $10 \"hello\""),
                Arguments.of("call(\"print\")", "    CALL #\"print\""),
                Arguments.of("hlt()", "HLT"),
                Arguments.of("ret()", "RET"),
                Arguments.of("add(r1, r2)", "    ADD r1 r2"),
                Arguments.of("sub(r1, 3)", "    SUB r1 3"),
                Arguments.of("mul(r1, r2)", "    MUL r1 r2"),
                Arguments.of("div(r1, r2)", "    DIV r1 r2"),
                Arguments.of("inc(r1)", "    INC r1"),
                Arguments.of("jmp(\"loop\")", "    JMP #loop"),
                Arguments.of("cmp(r1, 10)", "    CMP r1 10"),
                Arguments.of("je(\"done\", \"loop\")", "    JE #done #loop"),
                Arguments.of("jne(done, loop)", "    JNE #done #loop"),
                Arguments.of("jl(\"a\", \"b\")", "    JL #a #b"),
                Arguments.of("jg(\"a\", \"b\")", "    JG #a #b"),
                Arguments.of("push(r1)", "    PUSH r1"),
                Arguments.of("pop(r1)", "    POP r1"),
                Arguments.of("out(1, r1)", "    OUT 1 r1"),
                Arguments.of("cout(1, \"r1\")", "    COUT 1 r1"),
                Arguments.of("exit(0)", "    EXIT 0"),
                Arguments.of("and(r1, r2)", "    AND r1 r2"),
                Arguments.of("or(r1, r2)", "    OR r1 r2"),
                Arguments.of("xor(r1, r2)", "    XOR r1 r2"),
                Arguments.of("not(r1)", "    NOT r1"),
                Arguments.of("shl(r1, 2)", "    SHL r1 2"),
                Arguments.of("shr(r1, 2)", "    SHR r1 2")
        );
    }

    @ParameterizedTest
    @MethodSource("instructionTable")
    void generate_instruction_line(String statement, String expected) {
        assertEquals("LBL f\n" + expected + "\n", compile("void f() { " + statement + "; }"));
    }

    @Test
    void instruction_table_covers_every_opcode() {
        Set<Opcode> covered = instructionTable()
                .map(a -> (String) a.get()[0])
                .map(s -> s.substring(0, s.indexOf('(')))
                .map(k -> Opcode.fromKeyword(k).orElseThrow())
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(Opcode.class)));
        assertEquals(EnumSet.allOf(Opcode.class), covered);
    }

    @Test
    void generate_main_scenario() {
        String out = compile("void main() { mov(r1, 5); add(r1, r1, 2); hlt(); }");
        assertEquals("LBL main\n    MOV r1 5\n    ADD r1 r1 2\nHLT\n", out);
    }

    @Test
    void generate_macro_include_as_plain_include() {
        String out = compile("#M_include \"x.inc\"\nvoid main() { hlt(); }");
        assertEquals("#include \"x.inc\"\nLBL main\nHLT\n", out);
    }

    @Test
    void generate_functions_separated_by_blank_line() {
        String out = compile("void a() { ret(); } void b() { } void c() { inc(x); }");
        assertEquals("LBL a\nRET\n\nLBL b\n\nLBL c\n    INC x\n", out);
    }

    @Test
    void generate_empty_program() {
        assertEquals("", new CodeGenerator().generate(new Program(List.of())));
    }

    @Test
    void generate_is_idempotent() {
        Program p = parse("#M_include \"io.inc\" void main() { mov(a, 1); call(\"f\"); hlt(); } void f() { ret(); }");
        var gen = new CodeGenerator();
        assertEquals(gen.generate(p), gen.generate(p));
        assertEquals(gen.generate(p), new CodeGenerator().generate(p));
    }

    @Test
    void generate_from_hand_built_ast() {
        Program p = new Program(List.of(
                new VerbatimIncludeDecl("#M_include", "\"std.inc\""),
                new FunctionDecl("start", List.of(
                        new DefineBytes("", "\"x\""),
                        new Xor("r1", List.of("r2", "r3")),
                        new JumpIfLess("lo", "hi"),
                        new Return()))));
        assertEquals(String.join("\n",
                "#include \"std.inc\"",
                "LBL start",
                "    DB $ \"x\"",
                "    XOR r1 r2 r3",
                "    JL #lo #hi",
                "RET",
                ""), new CodeGenerator().generate(p));
    }

    @Test
    void binary_instruction_requires_a_source() {
        assertThrows(IllegalArgumentException.class, () -> new Add("r1", List.of()));
    }

    @Test
    void line_for_single_instruction() {
        var gen = new CodeGenerator();
        assertEquals(CodeGenerator.INDENT + "PUSH r9", gen.line(new Push("r9")));
        assertEquals("HLT", gen.line(new Halt()));
        assertTrue(Arrays.stream(Opcode.values()).allMatch(o -> o.mnemonic().equals(o.keyword().toUpperCase())));
    }
}
