package com.team.avagen.dsl;

import com.team.avagen.dsl.FluentExpr.ActionCall;
import com.team.avagen.dsl.FluentExpr.Literal;
import com.team.avagen.dsl.FluentExpr.MatcherCall;
import com.team.avagen.dsl.FluentExpr.NestedHelperCall;
import com.team.avagen.dsl.FluentExpr.RawExpr;
import com.team.avagen.dsl.FluentExpr.Reference;
import com.team.avagen.exception.ConversionFormatException;
import com.team.avagen.util.StatementText;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for normalized Espresso statements.
 *
 * <pre>
 * statement := call ('.' IDENT args)* ';'? EOF
 * call      := IDENT ('.' IDENT)* args
 * args      := '(' (arg (',' arg)*)? ')'
 * arg       := STRING | CHAR | NUMBER | IDENT ('.' IDENT)* args? | raw
 * raw       := any balanced token run up to the next top-level ',' or ')'
 * </pre>
 *
 * The first chained {@code perform} separates the lookup from the actions. Calls before it
 * are matcher calls (string helpers inside them become {@link NestedHelperCall}), calls inside
 * and after it are action calls. A statement without {@code perform}, or with an empty one,
 * is rejected with {@link ConversionFormatException}.
 */
@Component
@RequiredArgsConstructor
public class FluentCallParser {

    static final String PERFORM = "perform";

    private final EspressoVocabulary vocabulary;

    private enum Context {
        LOOKUP,
        ACTION
    }

    public FluentStatement parse(String statement) {
        List<Token> tokens = new FluentCallLexer(statement).tokenize();
        return new Run(statement, tokens).statement();
    }

    /** Cursor state for one parse. */
    private final class Run {

        private final String source;
        private final List<Token> tokens;
        private int pos;

        private Run(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        FluentStatement statement() {
            List<String> path = path();
            if (!peek().is(TokenType.LPAREN)) {
                throw error("statement must start with a call");
            }
            String name = path.get(path.size() - 1);
            MatcherCall entry = new MatcherCall(qualifierOf(path), name, args(Context.LOOKUP));

            List<MatcherCall> modifiers = new ArrayList<>();
            List<FluentExpr> actions = null;
            List<ActionCall> trailing = new ArrayList<>();

            while (peek().is(TokenType.DOT)) {
                advance();
                String chained = expect(TokenType.IDENT).text();
                if (actions == null && PERFORM.equals(chained)) {
                    actions = args(Context.ACTION);
                    if (actions.isEmpty()) {
                        throw error("perform() has no actions");
                    }
                } else if (actions == null) {
                    modifiers.add(new MatcherCall(null, chained, args(Context.LOOKUP)));
                } else {
                    trailing.add(new ActionCall(null, chained, args(Context.ACTION)));
                }
            }

            if (peek().is(TokenType.SEMICOLON)) {
                advance();
            }
            if (!peek().is(TokenType.EOF)) {
                throw error("unexpected " + peek().text() + " at " + peek().start());
            }
            if (actions == null) {
                throw error("expected entry(...).perform(...)");
            }
            return new FluentStatement(entry, modifiers, actions, trailing);
        }

        private List<FluentExpr> args(Context context) {
            expect(TokenType.LPAREN);
            List<FluentExpr> args = new ArrayList<>();
            if (peek().is(TokenType.RPAREN)) {
                advance();
                return args;
            }
            while (true) {
                args.add(arg(context));
                if (peek().is(TokenType.COMMA)) {
                    advance();
                    continue;
                }
                expect(TokenType.RPAREN);
                return args;
            }
        }

        private FluentExpr arg(Context context) {
            int mark = pos;
            FluentExpr primary = primary(context);
            if (primary != null && (peek().is(TokenType.COMMA) || peek().is(TokenType.RPAREN))) {
                return primary;
            }
            pos = mark;
            return raw();
        }

        /** Returns {@code null} when the argument does not start like a modelled expression. */
        private FluentExpr primary(Context context) {
            Token t = peek();
            switch (t.type()) {
                case STRING, CHAR, NUMBER -> {
                    advance();
                    return new Literal(t.text());
                }
                case IDENT -> {
                    List<String> path = path();
                    if (!peek().is(TokenType.LPAREN)) {
                        return new Reference(path);
                    }
                    String qualifier = qualifierOf(path);
                    String name = path.get(path.size() - 1);
                    List<FluentExpr> args = args(context);
                    if (context == Context.ACTION) {
                        return new ActionCall(qualifier, name, args);
                    }
                    if (vocabulary.isStringHelper(name)) {
                        return new NestedHelperCall(qualifier, name, args);
                    }
                    return new MatcherCall(qualifier, name, args);
                }
                default -> {
                    return null;
                }
            }
        }

        private RawExpr raw() {
            int startToken = pos;
            int depth = 0;
            List<String> calls = new ArrayList<>();

            while (true) {
                Token t = peek();
                if (t.is(TokenType.EOF)) {
                    throw error("unbalanced argument list");
                }
                if (depth == 0 && (t.is(TokenType.COMMA) || t.is(TokenType.RPAREN))) {
                    break;
                }
                if (t.is(TokenType.LPAREN)) {
                    depth++;
                } else if (t.is(TokenType.RPAREN)) {
                    depth--;
                } else if (t.is(TokenType.IDENT) && tokens.get(pos + 1).is(TokenType.LPAREN)) {
                    calls.add(t.text());
                }
                advance();
            }
            if (pos == startToken) {
                throw error("empty argument at " + peek().start());
            }
            String text = source.substring(tokens.get(startToken).start(), tokens.get(pos - 1).end());
            return new RawExpr(StatementText.tighten(text), calls);
        }

        private List<String> path() {
            List<String> path = new ArrayList<>();
            path.add(expect(TokenType.IDENT).text());
            while (peek().is(TokenType.DOT) && tokens.get(pos + 1).is(TokenType.IDENT)) {
                advance();
                path.add(advance().text());
            }
            return path;
        }

        private String qualifierOf(List<String> path) {
            return path.size() == 1 ? null : String.join(".", path.subList(0, path.size() - 1));
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private Token advance() {
            Token t = tokens.get(pos);
            if (!t.is(TokenType.EOF)) {
                pos++;
            }
            return t;
        }

        private Token expect(TokenType type) {
            Token t = peek();
            if (!t.is(type)) {
                throw error("expected " + type + " but found '" + t.text() + "' at " + t.start());
            }
            return advance();
        }

        private ConversionFormatException error(String details) {
            return new ConversionFormatException(source, details);
        }
    }
}
