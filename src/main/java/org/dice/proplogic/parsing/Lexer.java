package org.dice.proplogic.parsing;

import org.apache.commons.lang.CharUtils;
import org.apache.commons.lang.StringUtils;
import org.dice.proplogic.exception.LexException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits an expression into tokens. Single character symbols are matched first, so
 * a 'T' or 'F' is always a literal, even when followed by other letters. Any other
 * letter starts a variable name made of the longest run of ASCII letters.
 */
public class Lexer {

    private static final String WHITESPACE = " \t\r\n";

    private static final char cTRUE = 'T';
    private static final char cFALSE = 'F';
    private static final char cNOT = '~';
    private static final char cLPAREN = '(';
    private static final char cRPAREN = ')';

    private static final String sOR = "||";
    private static final String sAND = "&&";
    private static final String sIMPLIES = "->";

    private static final Map<Character, TokenType> charToType = generateCharToType();
    private static Map<Character, TokenType> generateCharToType(){
        Map<Character, TokenType> hm = new HashMap<Character, TokenType>();

        hm.put(cTRUE, TokenType.TRUE);
        hm.put(cFALSE, TokenType.FALSE);
        hm.put(cNOT, TokenType.NOT);
        hm.put(cLPAREN, TokenType.LPAREN);
        hm.put(cRPAREN, TokenType.RPAREN);
        return hm;
    }

    private static final Map<String, TokenType> stringToType = generateStringToType();
    private static Map<String, TokenType> generateStringToType(){
        Map<String, TokenType> hm = new LinkedHashMap<String, TokenType>();

        hm.put(sOR, TokenType.OR);
        hm.put(sAND, TokenType.AND);
        hm.put(sIMPLIES, TokenType.IMPLIES);
        return hm;
    }

    private final String inputString;

    public Lexer(String s) {
        this.inputString = s == null ? StringUtils.EMPTY : s;
    }

    /**
     * @return the tokens of the input, always terminated by an {@link TokenType#EOF} token
     * @throws LexException on the first character that starts no token
     */
    public List<Token> lex() {
        List<Token> tokens = new ArrayList<Token>();
        final int length = inputString.length();
        int i = 0;
        while (i < length) {
            char c = inputString.charAt(i);

            if (WHITESPACE.indexOf(c) >= 0) {
                i++;
                continue;
            }

            TokenType single = charToType.get(c);
            if (single != null) {
                tokens.add(new Token(single, i));
                i++;
                continue;
            }

            TokenType pair = matchOperator(i);
            if (pair != null) {
                tokens.add(new Token(pair, i));
                i += pair.getSymbol().length();
                continue;
            }

            if (CharUtils.isAsciiAlpha(c)) {
                int end = i + 1;
                while (end < length && CharUtils.isAsciiAlpha(inputString.charAt(end))) {
                    end++;
                }
                tokens.add(new Token(TokenType.VARIABLE, i, inputString.substring(i, end)));
                i = end;
                continue;
            }

            throw new LexException(i, c);
        }
        tokens.add(new Token(TokenType.EOF, length));
        return Collections.unmodifiableList(tokens);
    }

    private TokenType matchOperator(int offset) {
        for (Map.Entry<String, TokenType> entry : stringToType.entrySet()) {
            if (inputString.startsWith(entry.getKey(), offset)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public static List<TokenType> tokenize(String inputString){
        List<TokenType> types = new ArrayList<TokenType>();
        for (Token token : new Lexer(inputString).lex()) {
            if (token.getType() != TokenType.EOF) {
                types.add(token.getType());
            }
        }
        return types;
    }

    @Override
    public String toString() {
        return this.inputString;
    }
}
