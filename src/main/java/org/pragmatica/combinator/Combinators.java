package org.pragmatica.combinator;

import org.pragmatica.combinator.parser.Parser;
import org.pragmatica.combinator.parser.combinator.Choice;
import org.pragmatica.combinator.parser.combinator.Not;
import org.pragmatica.combinator.parser.combinator.OfType;
import org.pragmatica.combinator.parser.combinator.Predicate;
import org.pragmatica.combinator.parser.combinator.Reference;
import org.pragmatica.combinator.parser.combinator.Repeatable;
import org.pragmatica.combinator.parser.combinator.Sequence;

import java.util.List;
import java.util.function.Supplier;

/**
 * Static factories for building grammars.
 *
 * <p>Example usage:
 * <pre>{@code
 * Parser<Kind> item = sequence("item",
 *                              predicate("id", kind -> kind instanceof Kind.Id),
 *                              ofType("=", Kind.EQUALS),
 *                              predicate("value", kind -> kind instanceof Kind.Str));
 * Parser<Kind> document = sequence("document", optionalRepeatable("items", item), ofType("eoi", Kind.EOI));
 * }</pre>
 */
public final class Combinators {
    private Combinators() {}

    public static <T> Parser<T> ofType(String label, T type) {
        return new OfType<>(label, false, type);
    }

    public static <T> Parser<T> optionalOfType(String label, T type) {
        return new OfType<>(label, true, type);
    }

    public static <T> Parser<T> predicate(String label, java.util.function.Predicate<? super T> test) {
        return new Predicate<>(label, false, test);
    }

    public static <T> Parser<T> optionalPredicate(String label, java.util.function.Predicate<? super T> test) {
        return new Predicate<>(label, true, test);
    }

    @SafeVarargs
    public static <T> Parser<T> sequence(String label, Parser<T>... children) {
        return new Sequence<>(label, false, List.of(children));
    }

    @SafeVarargs
    public static <T> Parser<T> optionalSequence(String label, Parser<T>... children) {
        return new Sequence<>(label, true, List.of(children));
    }

    /**
     * One or more repetitions.
     */
    public static <T> Parser<T> repeatable(String label, Parser<T> child) {
        return new Repeatable<>(label, false, child);
    }

    /**
     * Zero or more repetitions.
     */
    public static <T> Parser<T> optionalRepeatable(String label, Parser<T> child) {
        return new Repeatable<>(label, true, child);
    }

    public static <T> Parser<T> not(String label, Parser<T> child) {
        return new Not<>(label, false, child);
    }

    public static <T> Parser<T> optionalNot(String label, Parser<T> child) {
        return new Not<>(label, true, child);
    }

    @SafeVarargs
    public static <T> Parser<T> choice(String label, Parser<T>... alternatives) {
        return new Choice<>(label, false, List.of(alternatives));
    }

    @SafeVarargs
    public static <T> Parser<T> optionalChoice(String label, Parser<T>... alternatives) {
        return new Choice<>(label, true, List.of(alternatives));
    }

    /**
     * Forward reference to a rule that is defined later, e.g. for recursive grammars.
     */
    public static <T> Parser<T> reference(String label, Supplier<? extends Parser<T>> target) {
        return new Reference<>(label, target);
    }
}
