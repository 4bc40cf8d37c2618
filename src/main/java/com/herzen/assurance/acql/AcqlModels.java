package com.herzen.assurance.acql;

import com.herzen.assurance.gsn.GsnModels.NodeKind;

import java.util.List;

public class AcqlModels {
    public enum TokenType { WORD, NUMBER, STRING, LPAREN, RPAREN, OPERATOR, EOF }

    public record Token(TokenType type, String text, int position) {
        public boolean isWord(String keyword) {
            return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
        }
    }

    public enum Quantifier { ALL, EXISTS, COUNT }

    public enum Builtin { CONSISTENCY, COMPLETENESS, SOUNDNESS, COVERAGE, WEAKEST }

    public enum CompareOp {
        EQ("="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">=");

        private final String symbol;

        CompareOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static CompareOp parse(String text) {
            return switch (text) {
                case "=", "==" -> EQ;
                case "!=" -> NE;
                case "<" -> LT;
                case "<=" -> LE;
                case ">" -> GT;
                case ">=" -> GE;
                default -> null;
            };
        }

        public boolean test(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
            };
        }
    }

    public interface Query {}

    public record QuantifiedQuery(Quantifier quantifier, NodeKind kind, Expr where, Expr have) implements Query {}

    public record BuiltinQuery(Builtin builtin, NodeKind kind, CompareOp op, Double threshold) implements Query {}

    public interface Expr {}

    public record OrExpr(Expr left, Expr right) implements Expr {}

    public record AndExpr(Expr left, Expr right) implements Expr {}

    public record NotExpr(Expr operand) implements Expr {}

    public record Comparison(String field, CompareOp op, Object value, int position) implements Expr {}

    public record QueryResult(boolean result, List<String> failingNodes, String message, Double value) {
        public QueryResult {
            failingNodes = List.copyOf(failingNodes);
        }
    }

    public record ScriptEntry(String query, QueryResult result, String errorCode, String error) {
        public boolean ok() {
            return errorCode == null;
        }
    }
}
