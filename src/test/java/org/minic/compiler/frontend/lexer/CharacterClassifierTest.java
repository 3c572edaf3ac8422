package org.minic.compiler.frontend.lexer;

import org.minic.compiler.api.CompilerErrorCode;
import org.minic.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CharacterClassifierTest {

    private static final SourceInfo POSITION = new SourceInfo("test.c", 3, 7, "  x = {");

    @ParameterizedTest
    @CsvSource({
            "'{', OPEN_BRACE",
            "'}', CLOSE_BRACE",
            "'(', OPEN_PARENTHESIS",
            "')', CLOSE_PARENTHESIS",
            "';', SEMICOLON"
    })
    void primitiveToToken_mapsEachPunctuationCharacter(char c, TokenType expected) throws LexerException {
        Token token = CharacterClassifier.primitiveToToken(c, POSITION);

        assertThat(token.type()).isEqualTo(expected);
        assertThat(token.text()).isEqualTo(String.valueOf(c));
        assertThat(token.value()).isNull();
        assertThat(token.line()).isEqualTo(3);
        assertThat(token.column()).isEqualTo(7);
    }

    @Test
    void primitiveToToken_rejectsOtherCharacters() {
        assertThatThrownBy(() -> CharacterClassifier.primitiveToToken('[', POSITION))
                .isInstanceOf(LexerException.class)
                .hasMessageContaining("Unexpected character: [")
                .extracting(e -> ((LexerException) e).getErrorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_CHARACTER);
    }

    @Test
    void stringToToken_recognizesKeywordsCaseSensitively() {
        assertThat(CharacterClassifier.stringToToken("Int", POSITION).type()).isEqualTo(TokenType.INT_KEYWORD);
        assertThat(CharacterClassifier.stringToToken("Return", POSITION).type()).isEqualTo(TokenType.RETURN_KEYWORD);
        assertThat(CharacterClassifier.stringToToken("int", POSITION).type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(CharacterClassifier.stringToToken("RETURN", POSITION).type()).isEqualTo(TokenType.IDENTIFIER);
    }

    @Test
    void stringToToken_keepsIdentifierNameUntrimmed() {
        Token token = CharacterClassifier.stringToToken("Int_2", POSITION);

        assertThat(token.type()).isEqualTo(TokenType.IDENTIFIER);
        assertThat(token.value()).isEqualTo("Int_2");
        assertThat(token.text()).isEqualTo("Int_2");
    }

    @ParameterizedTest
    @ValueSource(ints = {' ', '\t', '\u000B', '\f', '\u00A0', '\u2007', '\u0085', '\u3000', '\n', '\r', '\u2028', '\u202F'})
    void isWhitespace_coversUnicodeWhiteSpace(int codePoint) {
        assertThat(CharacterClassifier.isWhitespace(codePoint)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {'\u001C', '\u001D', '\u001E', '\u001F', '\u200B', 'a', '_'})
    void isWhitespace_rejectsInformationSeparatorsAndNonSpaces(int codePoint) {
        assertThat(CharacterClassifier.isWhitespace(codePoint)).isFalse();
    }

    @Test
    void identifierPredicates() {
        assertThat(CharacterClassifier.isIdentifierStart('_')).isTrue();
        assertThat(CharacterClassifier.isIdentifierStart('\u00E9')).isTrue();
        assertThat(CharacterClassifier.isIdentifierStart('7')).isFalse();
        assertThat(CharacterClassifier.isIdentifierPart('7')).isTrue();
        assertThat(CharacterClassifier.isIdentifierPart('\u00B2')).isTrue();
        assertThat(CharacterClassifier.isIdentifierPart('-')).isFalse();
    }

    @Test
    void isIntegerLiteralChar_acceptsDigitsHexLettersAndPrefixes() {
        for (char c : "0123456789abcdefABCDEFox".toCharArray()) {
            assertThat(CharacterClassifier.isIntegerLiteralChar(c)).as("%s", c).isTrue();
        }
        for (char c : "gzGOX_".toCharArray()) {
            assertThat(CharacterClassifier.isIntegerLiteralChar(c)).as("%s", c).isFalse();
        }
    }
}
