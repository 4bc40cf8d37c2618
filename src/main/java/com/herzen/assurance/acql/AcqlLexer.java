package com.herzen.assurance.acql;

import com.herzen.assurance.acql.AcqlModels.Token;
import com.herzen.assurance.acql.AcqlModels.TokenType;
import com.herzen.assurance.error.AcqlParseException;

import java.util.ArrayList;
import java.util.List;

public class AcqlLexer {

    public List<Token> tokenize(String input) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = input.length();
        while (i < n) {
            char c = input.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LPAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RPAREN, ")", i++));
            } else if (c == '=' || c == '<' || c == '>' || c == '!') {
                int start = i++;
                if (i < n && input.charAt(i) == '=') i++;
                String op = input.substring(start, i);
                if (op.equals("!")) throw new AcqlParseException(start, op, "Expected '!='");
                tokens.add(new Token(TokenType.OPERATOR, op, start));
            } else if (Character.isDigit(c) || ((c == '-' || c == '.') && i + 1 < n && Character.isDigit(input.charAt(i + 1)))) {
                int start = i++;
                while (i < n && (Character.isDigit(input.charAt(i)) || input.charAt(i) == '.')) i++;
                String text = input.substring(start, i);
                try {
                    Double.parseDouble(text);
                } catch (NumberFormatException e) {
                    throw new AcqlParseException(start, text, "Malformed number '" + text + "'");
                }
                tokens.add(new Token(TokenType.NUMBER, text, start));
            } else if (c == '\'' || c == '"') {
                int start = i++;
                while (i < n && input.charAt(i) != c) i++;
                if (i >= n) throw new AcqlParseException(start, input.substring(start), "Unterminated string");
                tokens.add(new Token(TokenType.STRING, input.substring(start + 1, i), start));
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && isWordChar(input.charAt(i))) i++;
                tokens.add(new Token(TokenType.WORD, input.substring(start, i), start));
            } else {
                throw new AcqlParseException(i, String.valueOf(c), "Unexpected character '" + c + "'");
            }
        }
        tokens.add(new Token(TokenType.EOF, "", n));
        return tokens;
    }

    private boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == ':' || c == '-';
    }
}
