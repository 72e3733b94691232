package org.boc.parsing;

import java.util.Locale;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class TestLexer {

    @Test
    public void recognizesKeywordsCaseInsensitively()
    {
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.BELIEF, TokenType.UPDATE_BELIEF, TokenType.CONFIDENCE_DECAY, TokenType.ENTITY},
                tokenize("belief UPDATE_BELIEF Confidence_Decay entity"));
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.REASONING_CONTEXT, TokenType.INTENT, TokenType.SHARED_STATE,
                        TokenType.SELF_CAPABILITY, TokenType.CALCULATE_WITH_UNCERTAINTY,
                        TokenType.STRUCTURED_KNOWLEDGE, TokenType.AGENT_COORDINATION, TokenType.PROVENANCE},
                tokenize("reasoning_context intent shared_state self_capability calculate_with_uncertainty " +
                        "structured_knowledge agent_coordination provenance"));
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.BOOLEAN, TokenType.BOOLEAN, TokenType.IDENTIFIER},
                tokenize("true FALSE truthy"));
    }

    @Test
    public void identifiersKeepDashesAndAt()
    {
        Lexer lexer = new Lexer("sensor-123 user@host _private");
        assertToken(lexer.nextToken(), TokenType.IDENTIFIER, "sensor-123");
        assertToken(lexer.nextToken(), TokenType.IDENTIFIER, "user@host");
        assertToken(lexer.nextToken(), TokenType.IDENTIFIER, "_private");
        assertToken(lexer.nextToken(), TokenType.EOF, "");
    }

    @Test
    public void leadingAtIsAttributePrefix()
    {
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.AT, TokenType.IDENTIFIER, TokenType.LPAREN, TokenType.STRING, TokenType.RPAREN},
                tokenize("@priority(\"high\")"));
    }

    @Test
    public void readsNumbersWithoutSignOrExponent()
    {
        Lexer lexer = new Lexer("0.85 1013.25 -3");
        assertToken(lexer.nextToken(), TokenType.NUMBER, "0.85");
        assertToken(lexer.nextToken(), TokenType.NUMBER, "1013.25");
        try {
            lexer.nextToken();
            fail("lexed a sign");
        } catch (LexException e) {
            assertEquals(1, e.getLine());
            assertEquals(14, e.getColumn());
        }
    }

    @Test
    public void readsStringsWithEscapes()
    {
        Lexer lexer = new Lexer("\"say \\\"hi\\\"\" 'single'");
        assertToken(lexer.nextToken(), TokenType.STRING, "say \"hi\"");
        assertToken(lexer.nextToken(), TokenType.STRING, "single");
    }

    @Test(expected = LexException.class)
    public void unterminatedString()
    {
        tokenize("fact: \"never closed");
    }

    @Test
    public void uncertaintyIsOneToken()
    {
        Lexer lexer = new Lexer("22.5 ±0.1 ± 0.25");
        assertToken(lexer.nextToken(), TokenType.NUMBER, "22.5");
        assertToken(lexer.nextToken(), TokenType.UNCERTAINTY, "±0.1");
        assertToken(lexer.nextToken(), TokenType.UNCERTAINTY, "±0.25");
    }

    @Test(expected = LexException.class)
    public void uncertaintyNeedsDigits()
    {
        tokenize("22.5 ± x");
    }

    @Test
    public void twoCharacterOperatorsWin()
    {
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.IDENTIFIER, TokenType.RANGE, TokenType.IDENTIFIER,
                        TokenType.LAMBDA, TokenType.ASSIGN, TokenType.ACCESS},
                tokenize("a..b => = ."));
        Assert.assertArrayEquals(
                new TokenType[]{TokenType.LBRACE, TokenType.RBRACE, TokenType.LBRACKET, TokenType.RBRACKET,
                        TokenType.COMMA, TokenType.COLON, TokenType.SEMICOLON},
                tokenize("{ } [ ] , : ;"));
    }

    @Test
    public void skipsCommentsAndTracksPositions()
    {
        Lexer lexer = new Lexer("// initial belief\n  belief {\n\tfact: 1 }");
        assertPosition(lexer.nextToken(), TokenType.BELIEF, 2, 3);
        assertPosition(lexer.nextToken(), TokenType.LBRACE, 2, 10);
        assertPosition(lexer.nextToken(), TokenType.IDENTIFIER, 3, 2);
        assertPosition(lexer.nextToken(), TokenType.COLON, 3, 6);
        assertPosition(lexer.nextToken(), TokenType.NUMBER, 3, 8);
        assertPosition(lexer.nextToken(), TokenType.RBRACE, 3, 10);
        assertPosition(lexer.nextToken(), TokenType.EOF, 3, 11);
        assertPosition(lexer.nextToken(), TokenType.EOF, 3, 11);
    }

    @Test
    public void reportsIllegalCharacter()
    {
        try {
            tokenize("belief {\n  fact: #1 }");
            fail("lexed '#'");
        } catch (LexException e) {
            assertEquals(2, e.getLine());
            assertEquals(9, e.getColumn());
        }
    }

    @Test
    public void emptyInput()
    {
        assertEquals(0, Lexer.tokenize("").size());
        assertEquals(0, Lexer.tokenize("  // nothing here").size());
        assertEquals(0, Lexer.tokenize(null).size());
    }

    @Test
    public void keywordsIgnoreTheDefaultLocale()
    {
        Locale saved = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            Assert.assertArrayEquals(new TokenType[]{TokenType.INTENT, TokenType.SHARED_STATE, TokenType.BOOLEAN},
                    tokenize("INTENT SHARED_STATE TRUE"));
        } finally {
            Locale.setDefault(saved);
        }
    }

    private static void assertToken(Token token, TokenType type, String text)
    {
        assertEquals(type, token.getType());
        assertEquals(text, token.getText());
    }

    private static void assertPosition(Token token, TokenType type, int line, int column)
    {
        assertEquals(type, token.getType());
        assertEquals(line, token.getLine());
        assertEquals(column, token.getColumn());
    }

    private static TokenType[] tokenize(String input)
    {
        List<TokenType> types = Lexer.tokenize(input);
        return types.toArray(new TokenType[types.size()]);
    }
}
