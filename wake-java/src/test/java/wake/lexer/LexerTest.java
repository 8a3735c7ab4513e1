package wake.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<Token> lex(String src) {
        return new Lexer(src, "/tmp/test.wake").tokenize();
    }

    private static List<TokenType> typesNoEof(String src) {
        return lex(src).stream().filter(t -> t.type() != TokenType.EOF).map(Token::type).toList();
    }

    private static Token last(List<Token> tokens) {
        return tokens.get(tokens.size() - 1);
    }

    @Test
    void lex_all_single_char_tokens() {
        assertEquals(List.of(
                TokenType.LPAREN, TokenType.RPAREN,
                TokenType.LBRACE, TokenType.RBRACE,
                TokenType.COMMA, TokenType.SEMICOLON
        ), typesNoEof("(){},;"));
    }

    @Test
    void lex_function_header() {
        var toks = lex("void main() {");
        assertEquals(List.of(TokenType.VOID, TokenType.IDENTIFIER, TokenType.LPAREN,
                TokenType.RPAREN, TokenType.LBRACE, TokenType.EOF),
                toks.stream().map(Token::type).toList());
        assertEquals("main", toks.get(1).lexeme());
    }

    @Test
    void lex_void_is_a_whole_word_keyword() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("voidx _void"));
    }

    @Test
    void lex_identifier_and_number() {
        var toks = lex("r_1 42");
        assertEquals(TokenType.IDENTIFIER, toks.get(0).type());
        assertEquals("r_1", toks.get(0).lexeme());
        assertEquals(TokenType.NUMBER_LITERAL, toks.get(1).type());
        assertEquals("42", toks.get(1).lexeme());
    }

    @Test
    void lex_digits_then_letters_split() {
        assertEquals(List.of(TokenType.NUMBER_LITERAL, TokenType.IDENTIFIER), typesNoEof("12ab"));
    }

    @Test
    void lex_include_directives() {
        var toks = lex("#M_include \"x.inc\"\n#include \"lib.wake\"");
        assertEquals(TokenType.MACRO_INCLUDE, toks.get(0).type());
        assertEquals("#M_include", toks.get(0).lexeme());
        assertEquals(TokenType.STRING_LITERAL, toks.get(1).type());
        assertEquals(TokenType.INCLUDE, toks.get(2).type());
        assertEquals("#include", toks.get(2).lexeme());
        assertEquals(2, toks.get(2).line());
    }

    @Test
    void lex_stray_hash_is_dropped() {
        assertEquals(List.of(TokenType.IDENTIFIER), typesNoEof("#define"));
        assertEquals("define", lex("#define").get(0).lexeme());
    }

    @Test
    void lex_string_literal_keeps_quotes_and_escapes() {
        var toks = lex("\"he said \\\"hi\\\"\"");
        assertEquals(TokenType.STRING_LITERAL, toks.get(0).type());
        assertEquals("\"he said \\\"hi\\\"\"", toks.get(0).lexeme());
    }

    @Test
    void lex_address_literals() {
        var toks = lex("$7 $ $123");
        assertEquals(List.of("$7", "$", "$123"),
                toks.subList(0, 3).stream().map(Token::lexeme).toList());
        assertTrue(toks.subList(0, 3).stream().allMatch(t -> t.type() == TokenType.IDENTIFIER));
    }

    @Test
    void lex_comment_skipped() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IDENTIFIER), typesNoEof("x// cmt ( \"\ny"));
        assertEquals(List.of(TokenType.IDENTIFIER), typesNoEof("x // comment at end of input"));
    }

    @Test
    void lex_lines_and_source_file() {
        var toks = lex("a\n\n  b\n");
        assertEquals("IDENTIFIER('a')@1", toks.get(0).toString());
        assertEquals("IDENTIFIER('b')@3", toks.get(1).toString());
        assertEquals("/tmp/test.wake", toks.get(1).sourceFile());
    }

    @Test
    void lex_single_eof_at_final_line() {
        var toks = lex("a\nb\n");
        assertEquals(1, toks.stream().filter(t -> t.type() == TokenType.EOF).count());
        assertEquals(TokenType.EOF, last(toks).type());
        assertEquals(3, last(toks).line());
    }

    @Test
    void lex_empty_source_is_just_eof() {
        var toks = lex("");
        assertEquals(1, toks.size());
        assertEquals(1, toks.get(0).line());
    }

    @ParameterizedTest
    @ValueSource(strings = {"@", "+", "/", "[", "-"})
    void lex_error_unexpected_char(String input) {
        var e = assertThrows(LexerException.class, () -> lex("mov\n" + input));
        assertTrue(e.getMessage().contains("'" + input + "'"), e.getMessage());
        assertEquals(2, e.line());
        assertEquals("/tmp/test.wake", e.sourceFile());
    }

    @Test
    void lex_error_unterminated_string() {
        var e = assertThrows(LexerException.class, () -> lex("x\n\"abc"));
        assertTrue(e.getMessage().startsWith("Unterminated string at line 2"), e.getMessage());
    }

    @Test
    void lex_escaped_quote_at_end_is_unterminated() {
        assertThrows(LexerException.class, () -> lex("\"abc\\\""));
    }
}
