package org.javai.formula.parse;

import org.javai.formula.ConstantTerm;
import org.javai.formula.FormulaSyntaxException;
import org.javai.formula.FormulaTerm;
import org.javai.formula.FunctionTerm;
import org.javai.formula.Term;
import org.javai.formula.Terms;
import org.javai.formula.VariableTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses formula text into a normalized {@link FormulaTerm}.
 *
 * <p>Syntax, loosest binding first:
 * <pre>
 *   formula := sum '~' sum
 *   sum     := product (('+' | '-') product)*
 *   product := unary (('*' | '&amp;' | '/') unary)*
 *   unary   := ('-' | '+') unary | power
 *   power   := primary ('^' unary)?
 *   primary := number | name | name '(' [sum (',' sum)*] ')' | '(' sum ')'
 * </pre>
 *
 * <p>{@code +}, {@code &} and {@code *} are the formula operators and are rewritten to
 * normal form by the {@link FormulaRewriter}; {@code x - 1} removes the intercept.
 * Everything else ({@code log(x)}, {@code x / y}, {@code x ^ 2}, {@code -x}) is
 * captured as a {@link FunctionTerm} whose arguments are themselves parsed as
 * formula terms.
 */
public final class FormulaParser {

    private static final Logger logger = LoggerFactory.getLogger(FormulaParser.class);

    private static final FormulaParser STANDARD = new FormulaParser(ElementwiseFunctions.standard());

    private final ElementwiseFunctions functions;
    private final FormulaRewriter rewriter;

    public FormulaParser(ElementwiseFunctions functions) {
        this(functions, FormulaRewriter.standard());
    }

    public FormulaParser(ElementwiseFunctions functions, FormulaRewriter rewriter) {
        this.functions = Objects.requireNonNull(functions, "functions must not be null");
        this.rewriter = Objects.requireNonNull(rewriter, "rewriter must not be null");
    }

    /**
     * Parses a formula with the standard functions.
     *
     * @throws FormulaSyntaxException if the text is not a well-formed formula
     */
    public static FormulaTerm parse(String text) {
        return STANDARD.formula(text);
    }

    /**
     * Parses one side of a formula (no {@code ~}) with the standard functions.
     */
    public static Term parseTerms(String text) {
        return STANDARD.terms(text);
    }

    public FormulaTerm formula(String text) {
        Expr syntax = syntax(text);
        if (!(syntax instanceof Expr.Call call) || !call.is("~")) {
            throw new FormulaSyntaxException("expected formula separator ~", text, text.length());
        }
        Expr.Call normalized = (Expr.Call) rewriter.normalize(call);
        FormulaTerm formula = new FormulaTerm(
                lowerSide(normalized.args().get(0), text),
                lowerSide(normalized.args().get(1), text));
        logger.debug("Parsed formula \"{}\" as {}", text, formula);
        return formula;
    }

    public Term terms(String text) {
        Expr syntax = syntax(text);
        if (syntax instanceof Expr.Call call && call.is("~")) {
            throw new FormulaSyntaxException("unexpected formula separator ~ in terms", text, text.indexOf('~'));
        }
        return lowerSide(rewriter.normalize(syntax), text);
    }

    /**
     * The syntax tree of formula text, before any rewriting.
     */
    public Expr syntax(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return new Reader(text).read();
    }

    private Term lowerSide(Expr expr, String source) {
        List<Expr> parts = expr instanceof Expr.Call call && call.is("+") ? call.args() : List.of(expr);
        List<Term> terms = new ArrayList<>(parts.size());
        for (Expr part : parts) {
            if (part instanceof Expr.Literal literal && !new ConstantTerm(literal.value()).isInterceptMarker()) {
                throw new FormulaSyntaxException("invalid intercept " + literal
                        + ": only 0, 1 and -1 may appear as terms, in \"" + source + "\"");
            }
            terms.add(lower(part));
        }
        return Terms.combine(terms);
    }

    private Term lower(Expr expr) {
        if (expr instanceof Expr.Name name) {
            return new VariableTerm(name.name());
        }
        if (expr instanceof Expr.Literal literal) {
            return new ConstantTerm(literal.value());
        }
        Expr.Call call = (Expr.Call) expr;
        if (call.is("+")) {
            return Terms.combine(call.args().stream().map(this::lower).toList());
        }
        if (call.is("&")) {
            return Terms.interact(call.args().stream().map(this::lower).toList());
        }
        return capture(call);
    }

    private FunctionTerm capture(Expr.Call call) {
        List<Term> args = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            args.add(lower(rewriter.normalize(arg)));
        }
        Set<String> names = new LinkedHashSet<>();
        collectNames(call, names);
        List<String> argNames = List.copyOf(names);
        return new FunctionTerm(call.name(), args, call.toString(), argNames, functions.compile(call, argNames));
    }

    private static void collectNames(Expr expr, Set<String> names) {
        if (expr instanceof Expr.Name name) {
            names.add(name.name());
        } else if (expr instanceof Expr.Call call) {
            call.args().forEach(arg -> collectNames(arg, names));
        }
    }

    /**
     * Recursive descent over the tokens of one formula.
     */
    private static final class Reader {

        private final String source;
        private final Lexer lexer;
        private Token current;

        Reader(String source) {
            this.source = source;
            this.lexer = new Lexer(source);
            this.current = lexer.next();
        }

        Expr read() {
            if (current.is(Token.Type.EOF)) {
                throw new FormulaSyntaxException("empty formula", source, 0);
            }
            if (current.isOperator("~")) {
                throw new FormulaSyntaxException("missing response before ~", source, current.position());
            }
            Expr lhs = sum();
            if (!current.isOperator("~")) {
                if (current.is(Token.Type.EOF)) {
                    return lhs;
                }
                throw unexpected();
            }
            advance();
            if (current.is(Token.Type.EOF)) {
                throw new FormulaSyntaxException("missing predictors after ~", source, current.position());
            }
            Expr rhs = sum();
            if (current.isOperator("~")) {
                throw new FormulaSyntaxException("formula separator ~ may appear only once", source, current.position());
            }
            if (!current.is(Token.Type.EOF)) {
                throw unexpected();
            }
            return Expr.Call.operator("~", List.of(lhs, rhs));
        }

        private Expr sum() {
            Expr left = product();
            while (current.isOperator("+") || current.isOperator("-")) {
                String op = current.text();
                advance();
                left = Expr.Call.operator(op, List.of(left, product()));
            }
            return left;
        }

        private Expr product() {
            Expr left = unary();
            while (current.isOperator("*") || current.isOperator("&") || current.isOperator("/")) {
                String op = current.text();
                advance();
                left = Expr.Call.operator(op, List.of(left, unary()));
            }
            return left;
        }

        private Expr unary() {
            if (current.isOperator("-")) {
                advance();
                Expr operand = unary();
                if (operand instanceof Expr.Literal literal) {
                    return Expr.Literal.of(-literal.value());
                }
                return Expr.Call.operator("-", List.of(operand));
            }
            if (current.isOperator("+")) {
                advance();
                return unary();
            }
            return power();
        }

        private Expr power() {
            Expr base = primary();
            if (current.isOperator("^")) {
                advance();
                return Expr.Call.operator("^", List.of(base, unary()));
            }
            return base;
        }

        private Expr primary() {
            Token token = current;
            switch (token.type()) {
                case NUMBER:
                    advance();
                    return Expr.Literal.of(Double.parseDouble(token.text()));
                case NAME:
                    advance();
                    if (current.is(Token.Type.LPAREN)) {
                        return call(token.text());
                    }
                    return new Expr.Name(token.text());
                case LPAREN:
                    advance();
                    Expr inner = sum();
                    expect(Token.Type.RPAREN, "')'");
                    return inner;
                default:
                    throw unexpected();
            }
        }

        private Expr call(String name) {
            advance();
            List<Expr> args = new ArrayList<>();
            if (!current.is(Token.Type.RPAREN)) {
                args.add(sum());
                while (current.is(Token.Type.COMMA)) {
                    advance();
                    args.add(sum());
                }
            }
            expect(Token.Type.RPAREN, "',' or ')'");
            return Expr.Call.function(name, args);
        }

        private void expect(Token.Type type, String description) {
            if (!current.is(type)) {
                if (current.isOperator("~")) {
                    throw new FormulaSyntaxException("formula separator ~ may only appear at the top level",
                            source, current.position());
                }
                throw new FormulaSyntaxException("expected " + description + " but found " + current.describe(),
                        source, current.position());
            }
            advance();
        }

        private FormulaSyntaxException unexpected() {
            if (current.isOperator("~")) {
                return new FormulaSyntaxException("formula separator ~ may only appear at the top level",
                        source, current.position());
            }
            return new FormulaSyntaxException("unexpected " + current.describe(), source, current.position());
        }

        private void advance() {
            current = lexer.next();
        }
    }
}
