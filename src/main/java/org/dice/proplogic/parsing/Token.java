package org.dice.proplogic.parsing;

public class Token {

    private final TokenType type;
    private final int position;
    private final String value;

    public Token(TokenType type, int position, String value) {
        this.type = type;
        this.position = position;
        this.value = value;
    }

    public Token(TokenType type, int position) {
        this(type, position, type.getSymbol());
    }

    public TokenType getType() {
        return type;
    }

    /**
     * @return 0-based offset of the first character of this token
     */
    public int getPosition() {
        return position;
    }

    /**
     * @return the variable name for {@link TokenType#VARIABLE} tokens, the symbol otherwise
     */
    public String getValue() {
        return value;
    }

    @Override
    public String toString(){
        return this.value;
    }
}
