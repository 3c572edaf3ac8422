package org.minic.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.minic.compiler.frontend.lexer.Token;
import org.minic.compiler.frontend.lexer.TokenType;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Output formats for a token sequence printed by the command line.
 */
public enum TokenFormat {

    /**
     * A single-line dump, e.g. {@code [IntKeyword, Identifier("main"), Integer(0), Semicolon]}.
     */
    DEBUG {
        @Override
        public String render(List<Token> tokens) {
            return tokens.stream()
                    .map(Token::toDebugString)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    },

    /**
     * A pretty-printed JSON array with one object per token, including its position.
     */
    JSON {
        @Override
        public String render(List<Token> tokens) {
            JsonArray array = new JsonArray();
            for (Token token : tokens) {
                JsonObject json = new JsonObject();
                json.addProperty("type", token.type().name());
                json.addProperty("text", token.text());
                if (token.type() == TokenType.INTEGER) {
                    json.addProperty("value", new BigInteger(Long.toUnsignedString(token.integerValue())));
                } else if (token.type() == TokenType.IDENTIFIER) {
                    json.addProperty("value", (String) token.value());
                }
                json.addProperty("line", token.line());
                json.addProperty("column", token.column());
                array.add(json);
            }
            return GSON.toJson(array);
        }
    };

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Renders the tokens in this format.
     * @param tokens The tokens in source order.
     * @return The rendered text, without a trailing line break.
     */
    public abstract String render(List<Token> tokens);
}
