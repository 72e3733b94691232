package org.boc.parsing;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Character-level scanner for BOC source. Whitespace and {@code //} line comments are skipped,
 * everything else is handed out one token at a time through {@link #nextToken()}.
 * Once the input is exhausted every further call returns an {@link TokenType#EOF} token.
 */
public class Lexer {

    public static final char UNCERTAINTY_SIGN = '±';

    private final String input;
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private static final Map<String, TokenType> keywords = generateKeywords();
    private static Map<String, TokenType> generateKeywords(){
        Map<String, TokenType> hm = new HashMap<String, TokenType>();

        hm.put("belief", TokenType.BELIEF);
        hm.put("reasoning_context", TokenType.REASONING_CONTEXT);
        hm.put("intent", TokenType.INTENT);
        hm.put("shared_state", TokenType.SHARED_STATE);
        hm.put("self_capability", TokenType.SELF_CAPABILITY);
        hm.put("calculate_with_uncertainty", TokenType.CALCULATE_WITH_UNCERTAINTY);
        hm.put("structured_knowledge", TokenType.STRUCTURED_KNOWLEDGE);
        hm.put("entity", TokenType.ENTITY);
        hm.put("update_belief", TokenType.UPDATE_BELIEF);
        hm.put("confidence_decay", TokenType.CONFIDENCE_DECAY);
        hm.put("agent_coordination", TokenType.AGENT_COORDINATION);
        hm.put("provenance", TokenType.PROVENANCE);

        hm.put("true", TokenType.BOOLEAN);
        hm.put("false", TokenType.BOOLEAN);
        return hm;
    }

    private static final Map<Character, TokenType> singleCharTokens = generateSingleCharTokens();
    private static Map<Character, TokenType> generateSingleCharTokens(){
        Map<Character, TokenType> hm = new HashMap<Character, TokenType>();

        hm.put('=', TokenType.ASSIGN);
        hm.put('{', TokenType.LBRACE);
        hm.put('}', TokenType.RBRACE);
        hm.put('[', TokenType.LBRACKET);
        hm.put(']', TokenType.RBRACKET);
        hm.put('(', TokenType.LPAREN);
        hm.put(')', TokenType.RPAREN);
        hm.put(',', TokenType.COMMA);
        hm.put(':', TokenType.COLON);
        hm.put('.', TokenType.ACCESS);
        hm.put(';', TokenType.SEMICOLON);
        hm.put('@', TokenType.AT);
        return hm;
    }

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    public Token nextToken() {
        while (!atEnd()) {
            char c = current();

            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            if (c == '/' && peek() == '/') {
                skipComment();
                continue;
            }

            final int startLine = line;
            final int startColumn = column;

            if (Character.isDigit(c)) {
                return new Token(TokenType.NUMBER, readNumber(), startLine, startColumn);
            }

            if (Character.isLetter(c) || c == '_') {
                String word = readIdentifier();
                TokenType type = keywords.get(word.toLowerCase(Locale.ROOT));
                return new Token(type == null ? TokenType.IDENTIFIER : type, word, startLine, startColumn);
            }

            if (c == '"' || c == '\'') {
                return new Token(TokenType.STRING, readString(), startLine, startColumn);
            }

            // two character operators win over their single character prefixes
            if (c == '.' && peek() == '.') {
                advance();
                advance();
                return new Token(TokenType.RANGE, "..", startLine, startColumn);
            }
            if (c == '=' && peek() == '>') {
                advance();
                advance();
                return new Token(TokenType.LAMBDA, "=>", startLine, startColumn);
            }

            if (c == UNCERTAINTY_SIGN) {
                advance();
                while (!atEnd() && (current() == ' ' || current() == '\t')) {
                    advance();
                }
                String amount = readNumber();
                if (amount.isEmpty()) {
                    throw new LexException("Expected digits after '" + UNCERTAINTY_SIGN + "'", startLine, startColumn);
                }
                return new Token(TokenType.UNCERTAINTY, UNCERTAINTY_SIGN + amount, startLine, startColumn);
            }

            TokenType type = singleCharTokens.get(c);
            if (type != null) {
                advance();
                return new Token(type, String.valueOf(c), startLine, startColumn);
            }

            throw new LexException("Illegal character '" + c + "'", startLine, startColumn);
        }
        return new Token(TokenType.EOF, "", line, column);
    }

    /**
     * Classifies the whole input, stopping before EOF.
     */
    public static List<TokenType> tokenize(String inputString){
        // create a new lexer so as not to reset this one
        Lexer temp = new Lexer(inputString);
        List<TokenType> types = new ArrayList<TokenType>();
        Token token;
        while ( (token = temp.nextToken()).getType() != TokenType.EOF){
            types.add(token.getType());
        }
        return types;
    }

    private boolean atEnd() {
        return pos >= input.length();
    }

    private char current() {
        return input.charAt(pos);
    }

    private char peek() {
        int next = pos + 1;
        return next < input.length() ? input.charAt(next) : '\0';
    }

    private void advance() {
        if (current() == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void skipComment() {
        while (!atEnd() && current() != '\n') {
            advance();
        }
    }

    // digit-and-dot runs only, no sign and no exponent
    private String readNumber() {
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && (Character.isDigit(current()) || current() == '.')) {
            sb.append(current());
            advance();
        }
        return sb.toString();
    }

    private String readIdentifier() {
        StringBuilder sb = new StringBuilder();
        while (!atEnd() && isIdentifierPart(current())) {
            sb.append(current());
            advance();
        }
        return sb.toString();
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '@';
    }

    private String readString() {
        final int startLine = line;
        final int startColumn = column;
        final char quote = current();
        advance();

        StringBuilder sb = new StringBuilder();
        while (!atEnd() && current() != quote) {
            if (current() == '\\') {
                // escapes are passed through as the escaped character
                advance();
                if (atEnd()) {
                    break;
                }
            }
            sb.append(current());
            advance();
        }
        if (atEnd()) {
            throw new LexException("Unterminated string", startLine, startColumn);
        }
        advance();
        return sb.toString();
    }
}
