package org.javai.formula.parse;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Syntax tree of formula text, before it is lowered to terms.
 *
 * <p>Operators are represented as calls named by their symbol, so {@code a + b} is
 * {@code Call("+", [a, b], true)}. Printing an expression gives back formula text,
 * with parentheses only where precedence requires them.
 */
public sealed interface Expr permits Expr.Name, Expr.Literal, Expr.Call {

    record Name(String name) implements Expr {

        public Name {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public String toString() {
            return isPlainName(name) ? name : "`" + name + "`";
        }

        private static boolean isPlainName(String name) {
            if (!(Character.isLetter(name.charAt(0)) || name.charAt(0) == '_')) {
                return false;
            }
            for (int i = 1; i < name.length(); i++) {
                char c = name.charAt(i);
                if (!(Character.isLetterOrDigit(c) || c == '_' || c == '.')) {
                    return false;
                }
            }
            return true;
        }
    }

    record Literal(double value) implements Expr {

        public static Literal of(double value) {
            return new Literal(value);
        }

        @Override
        public String toString() {
            return value == Math.rint(value) && !Double.isInfinite(value)
                    ? Long.toString((long) value)
                    : Double.toString(value);
        }
    }

    /**
     * A function call or an operator application.
     *
     * @param name the function name or operator symbol
     * @param args the arguments
     * @param operator whether this is an operator written infix or prefix
     */
    record Call(String name, List<Expr> args, boolean operator) implements Expr {

        public Call {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        public static Call operator(String symbol, List<Expr> args) {
            return new Call(symbol, args, true);
        }

        public static Call function(String name, List<Expr> args) {
            return new Call(name, args, false);
        }

        public boolean is(String op) {
            return operator && name.equals(op);
        }

        public Call withArgs(List<Expr> newArgs) {
            return new Call(name, newArgs, operator);
        }

        @Override
        public String toString() {
            if (!operator) {
                return name + "(" + args.stream().map(Expr::toString).collect(Collectors.joining(", ")) + ")";
            }
            if (args.size() == 1) {
                return name + wrap(args.get(0), precedence(this), false);
            }
            int precedence = precedence(this);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < args.size(); i++) {
                if (i > 0) {
                    sb.append(' ').append(name).append(' ');
                }
                Expr arg = args.get(i);
                boolean tight = name.equals("^") ? i == 0 : i > 0 && !(arg instanceof Call c && c.is(name) && isAssociative(name));
                sb.append(wrap(arg, precedence, tight));
            }
            return sb.toString();
        }

        private static String wrap(Expr arg, int parent, boolean tight) {
            int own = precedence(arg);
            boolean parens = own < parent || own == parent && tight;
            return parens ? "(" + arg + ")" : arg.toString();
        }

        private static boolean isAssociative(String op) {
            return op.equals("+") || op.equals("*") || op.equals("&");
        }
    }

    /**
     * Binding strength of an expression's outermost operator; higher binds tighter.
     */
    static int precedence(Expr expr) {
        if (expr instanceof Literal literal) {
            return literal.value() < 0 ? 3 : 5;
        }
        if (!(expr instanceof Call call) || !call.operator()) {
            return 5;
        }
        if (call.args().size() == 1) {
            return 3;
        }
        switch (call.name()) {
            case "~":
                return 0;
            case "+":
            case "-":
                return 1;
            case "*":
            case "&":
            case "/":
                return 2;
            default:
                return 4;
        }
    }
}
