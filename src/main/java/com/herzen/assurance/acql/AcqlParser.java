package com.herzen.assurance.acql;

import com.herzen.assurance.acql.AcqlModels.*;
import com.herzen.assurance.error.AcqlParseException;
import com.herzen.assurance.gsn.GsnModels.NodeKind;

import java.util.List;
import java.util.Locale;

// query      := quantified | builtin
// quantified := (ALL | EXISTS | COUNT) kind (WHERE expr)? (HAVE expr)?
// builtin    := CONSISTENCY() | COMPLETENESS() | SOUNDNESS()
//             | COVERAGE(kind) (op number)? | WEAKEST(kind) (op number)?
// expr       := and (OR and)* ; and := unary (AND unary)*
// unary      := NOT unary | '(' expr ')' | field op value
public class AcqlParser {
    private static final String ANY_NODE = "Node";

    private final AcqlLexer lexer = new AcqlLexer();

    public Query parse(String input) {
        if (input == null || input.isBlank()) {
            throw new AcqlParseException(0, "", "Empty query");
        }
        return new Cursor(lexer.tokenize(input)).query();
    }

    private static final class Cursor {
        private final List<Token> tokens;
        private int pos;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        Query query() {
            Token head = peek();
            Query query;
            Quantifier quantifier = head.type() == TokenType.WORD ? quantifier(head.text()) : null;
            Builtin builtin = head.type() == TokenType.WORD ? builtin(head.text()) : null;
            if (quantifier != null) {
                next();
                query = quantified(quantifier);
            } else if (builtin != null) {
                next();
                query = builtinCall(builtin);
            } else {
                throw error(head, "Expected ALL, EXISTS, COUNT or a built-in check");
            }
            if (peek().type() != TokenType.EOF) {
                throw error(peek(), "Unexpected token '" + peek().text() + "'");
            }
            return query;
        }

        private Query quantified(Quantifier quantifier) {
            NodeKind kind = kind();
            Expr where = null;
            Expr have = null;
            if (peek().isWord("WHERE")) {
                next();
                where = expr();
            }
            if (peek().isWord("HAVE")) {
                next();
                have = expr();
            }
            return new QuantifiedQuery(quantifier, kind, where, have);
        }

        private Query builtinCall(Builtin builtin) {
            expect(TokenType.LPAREN, "Expected '(' after " + builtin);
            NodeKind kind = null;
            boolean takesKind = builtin == Builtin.COVERAGE || builtin == Builtin.WEAKEST;
            if (takesKind) kind = kind();
            expect(TokenType.RPAREN, "Expected ')'");

            CompareOp op = null;
            Double threshold = null;
            if (takesKind && peek().type() == TokenType.OPERATOR) {
                op = operator();
                Token number = next();
                if (number.type() != TokenType.NUMBER) throw error(number, "Expected a number");
                threshold = Double.parseDouble(number.text());
            }
            return new BuiltinQuery(builtin, kind, op, threshold);
        }

        private NodeKind kind() {
            Token token = next();
            if (token.type() != TokenType.WORD) throw error(token, "Expected a node kind");
            if (token.text().equalsIgnoreCase(ANY_NODE)) return null;
            NodeKind kind = NodeKind.parse(token.text());
            if (kind == null) throw error(token, "Unknown node kind '" + token.text() + "'");
            return kind;
        }

        private Expr expr() {
            Expr left = and();
            while (peek().isWord("OR")) {
                next();
                left = new OrExpr(left, and());
            }
            return left;
        }

        private Expr and() {
            Expr left = unary();
            while (peek().isWord("AND")) {
                next();
                left = new AndExpr(left, unary());
            }
            return left;
        }

        private Expr unary() {
            if (peek().isWord("NOT")) {
                next();
                return new NotExpr(unary());
            }
            if (peek().type() == TokenType.LPAREN) {
                next();
                Expr inner = expr();
                expect(TokenType.RPAREN, "Expected ')'");
                return inner;
            }
            return comparison();
        }

        private Expr comparison() {
            Token field = next();
            if (field.type() != TokenType.WORD || isReserved(field.text())) {
                throw error(field, "Expected a field name");
            }
            CompareOp op = operator();
            Token value = next();
            return switch (value.type()) {
                case NUMBER -> new Comparison(field.text(), op, Double.parseDouble(value.text()), field.position());
                case STRING, WORD -> new Comparison(field.text(), op, value.text(), field.position());
                default -> throw error(value, "Expected a value");
            };
        }

        private CompareOp operator() {
            Token token = next();
            CompareOp op = token.type() == TokenType.OPERATOR ? CompareOp.parse(token.text()) : null;
            if (op == null) throw error(token, "Expected a comparison operator");
            return op;
        }

        private void expect(TokenType type, String message) {
            Token token = next();
            if (token.type() != type) throw error(token, message);
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token next() {
            Token token = tokens.get(pos);
            if (token.type() != TokenType.EOF) pos++;
            return token;
        }

        private AcqlParseException error(Token token, String message) {
            return new AcqlParseException(token.position(), token.text(), message);
        }

        private static boolean isReserved(String word) {
            return switch (word.toUpperCase(Locale.ROOT)) {
                case "ALL", "EXISTS", "COUNT", "WHERE", "HAVE", "AND", "OR", "NOT" -> true;
                default -> false;
            };
        }

        private static Quantifier quantifier(String word) {
            for (Quantifier q : Quantifier.values()) {
                if (q.name().equalsIgnoreCase(word)) return q;
            }
            return null;
        }

        private static Builtin builtin(String word) {
            for (Builtin b : Builtin.values()) {
                if (b.name().equalsIgnoreCase(word)) return b;
            }
            return null;
        }
    }
}
