package org.typeset.lite.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Function call expression: {@code foo(...)}, {@code [foo ...]}.
 * 
 * For a bracketed call with a body the body is the last positional argument,
 * a {@link ContentExpr}. The span of {@code args} does not include the body.
 *
 * @param name The name of the function
 * @param args The arguments, in call order
 */
public record CallExpr(Spanned<Ident> name, Spanned<List<Argument>> args) implements Expr {

    public CallExpr {
        Objects.requireNonNull(name, "Function name cannot be null");
        Objects.requireNonNull(args, "Arguments cannot be null");
        args = new Spanned<>(List.copyOf(args.value()), args.span());
    }

    public static CallExpr of(String name, Argument... args) {
        return of(name, List.of(args));
    }

    public static CallExpr of(String name, List<Argument> args) {
        return new CallExpr(Spanned.detached(new Ident(name)), Spanned.detached(args));
    }

    public String functionName() {
        return name.value().name();
    }

    public List<Argument> arguments() {
        return args.value();
    }

    @Override
    public <T> T accept(ExprVisitor<T> visitor) {
        return visitor.visitCall(this);
    }
}
