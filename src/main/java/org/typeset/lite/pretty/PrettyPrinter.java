package org.typeset.lite.pretty;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.typeset.lite.syntax.*;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prints syntax trees back to canonical source text.
 *
 * The output re-parses to an equal tree, and among the equivalent surface
 * forms the most compact one is chosen:
 * - a content block holding a single call drops its braces: {[f]} => [f]
 * - a bracketed call whose last argument is content gets a body: [v {Hi}] => [v][Hi]
 * - a body holding a single call becomes a chain: [v][[f]] => [v | f]
 *
 * Printing the output again after parsing yields the same text. An instance
 * keeps its output buffer in a field and is not thread-safe; the static
 * {@code print} methods use a fresh instance per call.
 */
public final class PrettyPrinter implements ExprVisitor<Void>, NodeVisitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(PrettyPrinter.class);

    private final PrettyConfig config;
    private Printer p = new Printer();
    private int depth;

    public PrettyPrinter(PrettyConfig config) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
    }

    /**
     * Prints an expression with the loaded configuration.
     */
    public static String print(Expr expr) {
        return new PrettyPrinter(PrettyConfig.load()).pretty(expr);
    }

    /**
     * Prints a markup tree with the loaded configuration.
     */
    public static String print(List<Spanned<Node>> tree) {
        return new PrettyPrinter(PrettyConfig.load()).pretty(tree);
    }

    /**
     * Prints an expression as it appears in expression position, e.g. as an
     * argument or inside braces.
     *
     * @param expr The expression to print
     * @return The canonical source text
     * @throws PrettyPrintException if a depth limit is configured and the tree
     *                              nests deeper
     */
    public String pretty(Expr expr) {
        reset();
        expr(expr);
        return p.finish();
    }

    /**
     * Prints a markup tree, e.g. a whole document.
     */
    public String pretty(List<Spanned<Node>> tree) {
        reset();
        tree(tree);
        return p.finish();
    }

    /**
     * Prints a call in bracket form. With {@code chained} set the call is
     * printed as the continuation of an enclosing chain: {@code " | f x"}
     * instead of {@code "[f x"}. The closing bracket is printed either way.
     */
    public String prettyBracketCall(CallExpr call, boolean chained) {
        reset();
        bracketCall(call, chained);
        return p.finish();
    }

    private void reset() {
        p = new Printer();
        depth = 0;
    }

    // ==================== Expressions ====================

    private void expr(Expr expr) {
        enter();
        try {
            expr.accept(this);
        } finally {
            depth--;
        }
    }

    @Override
    public Void visitNone(NoneExpr none) {
        p.push("none");
        return null;
    }

    @Override
    public Void visitIdent(IdentExpr ident) {
        p.push(ident.ident().name());
        return null;
    }

    @Override
    public Void visitBool(BoolExpr bool) {
        p.push(bool.value() ? "true" : "false");
        return null;
    }

    @Override
    public Void visitInt(IntExpr integer) {
        p.pushInt(integer.value());
        return null;
    }

    @Override
    public Void visitFloat(FloatExpr number) {
        p.pushFloat(number.value());
        return null;
    }

    @Override
    public Void visitLength(LengthExpr length) {
        p.pushFloat(length.value()).push(length.unit().symbol());
        return null;
    }

    @Override
    public Void visitPercent(PercentExpr percent) {
        p.pushFloat(percent.value()).push('%');
        return null;
    }

    @Override
    public Void visitColor(ColorExpr color) {
        p.push(color.color().toHex());
        return null;
    }

    @Override
    public Void visitStr(StrExpr str) {
        p.push(quote(str.value()));
        return null;
    }

    @Override
    public Void visitCall(CallExpr call) {
        p.push(call.functionName()).push('(');
        arguments(call.arguments());
        p.push(')');
        return null;
    }

    @Override
    public Void visitUnary(UnaryExpr unary) {
        p.push(unary.op().value().symbol());
        expr(unary.expr().value());
        return null;
    }

    @Override
    public Void visitBinary(BinaryExpr binary) {
        expr(binary.lhs().value());
        p.push(' ').push(binary.op().value().symbol()).push(' ');
        expr(binary.rhs().value());
        return null;
    }

    @Override
    public Void visitArray(ArrayExpr array) {
        p.push('(');
        p.join(array.items(), ", ", item -> expr(item.value()));
        // (x,) is an array, (x) is just x
        if (array.items().size() == 1) {
            p.push(',');
        }
        p.push(')');
        return null;
    }

    @Override
    public Void visitDict(DictExpr dict) {
        p.push('(');
        if (dict.entries().isEmpty()) {
            // () is the empty array
            p.push(':');
        } else {
            p.join(dict.entries(), ", ", this::named);
        }
        p.push(')');
        return null;
    }

    @Override
    public Void visitContent(ContentExpr content) {
        Optional<CallExpr> call = content.singleCall();
        if (call.isPresent()) {
            // {[f]} => [f]
            bracketCall(call.get(), false);
        } else {
            p.push('{');
            tree(content.tree());
            p.push('}');
        }
        return null;
    }

    private void arguments(List<Argument> args) {
        p.join(args, ", ", this::argument);
    }

    private void argument(Argument arg) {
        if (arg instanceof Named named) {
            named(named);
        } else {
            expr(arg.expr().value());
        }
    }

    private void named(Named named) {
        p.push(named.name().value().name()).push(": ");
        expr(named.expr().value());
    }

    // ==================== Bracket calls ====================

    private void bracketCall(CallExpr call, boolean chained) {
        enter();
        try {
            p.push(chained ? " | " : "[");
            p.push(call.functionName());

            List<Argument> args = call.arguments();
            Optional<ContentExpr> body = trailingContent(args);
            if (body.isPresent()) {
                List<Argument> head = args.subList(0, args.size() - 1);
                if (!head.isEmpty()) {
                    p.push(' ');
                    arguments(head);
                }

                Optional<CallExpr> inner = body.get().singleCall();
                if (inner.isPresent()) {
                    // [v][[f]] => [v | f], the innermost call closes the bracket
                    LOG.trace("Chaining call '{}' into '{}'", inner.get().functionName(), call.functionName());
                    bracketCall(inner.get(), true);
                    return;
                }

                p.push("][");
                tree(body.get().tree());
            } else if (!args.isEmpty()) {
                p.push(' ');
                arguments(args);
            }

            p.push(']');
        } finally {
            depth--;
        }
    }

    private static Optional<ContentExpr> trailingContent(List<Argument> args) {
        if (!args.isEmpty()
                && args.get(args.size() - 1) instanceof Argument.Positional last
                && last.expr().value() instanceof ContentExpr content) {
            return Optional.of(content);
        }
        return Optional.empty();
    }

    // ==================== Markup ====================

    private void tree(List<Spanned<Node>> tree) {
        for (Spanned<Node> node : tree) {
            enter();
            try {
                node.value().accept(this);
            } finally {
                depth--;
            }
        }
    }

    @Override
    public Void visitText(TextNode text) {
        p.push(escapeText(text.text()));
        return null;
    }

    @Override
    public Void visitSpace(SpaceNode space) {
        p.push(' ');
        return null;
    }

    @Override
    public Void visitLinebreak(LinebreakNode linebreak) {
        p.push('\\');
        return null;
    }

    @Override
    public Void visitParbreak(ParbreakNode parbreak) {
        p.push("\n\n");
        return null;
    }

    @Override
    public Void visitStrong(StrongNode strong) {
        p.push('*');
        return null;
    }

    @Override
    public Void visitEmph(EmphNode emph) {
        p.push('_');
        return null;
    }

    @Override
    public Void visitHeading(HeadingNode heading) {
        p.push("#".repeat(heading.level()));
        tree(heading.contents());
        return null;
    }

    @Override
    public Void visitExpr(ExprNode node) {
        if (node.expr() instanceof CallExpr call) {
            bracketCall(call, false);
        } else {
            p.push('{');
            expr(node.expr());
            p.push('}');
        }
        return null;
    }

    // ==================== Helpers ====================

    private void enter() {
        if (++depth > config.maxDepth() && config.isLimited()) {
            LOG.error("Syntax tree exceeds maximum print depth of {}", config.maxDepth());
            throw new PrettyPrintException("Syntax tree nested too deeply to print", depth);
        }
    }

    /**
     * Quotes a string literal, escaping backslashes, quotes and control
     * characters.
     */
    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        value.codePoints().forEach(c -> {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (Character.isISOControl(c)) {
                        sb.append("\\u{").append(Integer.toHexString(c)).append('}');
                    } else {
                        sb.appendCodePoint(c);
                    }
                }
            }
        });
        return sb.append('"').toString();
    }

    /**
     * Escapes characters that would otherwise start markup or an expression.
     */
    static String escapeText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\', '*', '_', '#', '[', ']', '{', '}', '`' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
