package com.contextsmith.multimatch.utils;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Simple command line parser.
 *
 * <pre>
 *   Args.match()
 *       .on(options("--patterns", "-p"), value -> patternPath = value)
 *       .on("--stream", () -> streaming = true)
 *       .rest(files -> inputFiles = files)
 *       .parse(args);
 * </pre>
 *
 * Options are matched case-insensitively. A value is either the next
 * argument or given inline as {@code --option=value}. Everything that is not
 * consumed by an option ends up in {@link #rest(Consumer)}.
 */
public class Args {
    List<Matcher> matchers;
    List<Consumer<List<String>>> restHandlers;

    public Args() {
        matchers = new ArrayList<>();
        restHandlers = new ArrayList<>();
    }

    public Args on(String option, Runnable handler) {
        return on(options(option), handler);
    }

    public Args on(String option, Consumer<String> handler) {
        return on(options(option), handler);
    }

    public Args on(Predicate<String> test, Runnable handler) {
        matchers.add(args -> {
            boolean p = test.test(args.option());
            if (p) {
                handler.run();
            }
            return p;
        });
        return this;
    }

    public Args on(Predicate<String> test, Consumer<String> handler) {
        matchers.add(args -> {
            boolean p = test.test(args.option());
            if (p) {
                handler.accept(args.value());
            }
            return p;
        });
        return this;
    }

    public Args rest(Consumer<List<String>> restHandler) {
        restHandlers.add(restHandler);
        return this;
    }

    public void parse(String... someArgs) {
        ArgsIterator args = new ArgsIterator(someArgs);
        while (args.hasNext()) {
            args.matchNext(matchers);
        }
        List<String> rest = args.rest();
        restHandlers.forEach(handler -> handler.accept(rest));
    }

    public static Predicate<String> options(String... alternatives) {
        if (alternatives.length == 1) {
            return s -> alternatives[0].equalsIgnoreCase(s);
        }
        return s -> Arrays.stream(alternatives).anyMatch(alt -> alt.equalsIgnoreCase(s));
    }

    interface Matcher {
        /** @return true if option was consumed **/
        boolean match(ArgsIterator args);
    }

    public static Args match() {
        return new Args();
    }

    static class ArgsIterator {
        String[] allArgs;
        BitSet consumed;
        int current;

        ArgsIterator(String[] args) {
            this.allArgs = args;
            this.consumed = new BitSet(args.length);
        }

        /** The current argument without any inline value. */
        String option() {
            String arg = allArgs[current];
            int eq = arg.indexOf('=');
            return (arg.startsWith("-") && eq > 0) ? arg.substring(0, eq) : arg;
        }

        /** @throws IllegalArgumentException if the option has no value **/
        String value() {
            String arg = allArgs[current];
            int eq = arg.indexOf('=');
            if (arg.startsWith("-") && eq > 0) {
                return arg.substring(eq + 1);
            }
            if (current + 1 >= allArgs.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            consumed.set(current + 1);
            return allArgs[current + 1];
        }

        List<String> rest() {
            // all unconsumed arguments
            return IntStream.range(0, allArgs.length).filter(i -> !consumed.get(i)).mapToObj(i -> allArgs[i]).collect(Collectors.toList());
        }

        void matchNext(List<Matcher> matchers) {
            int currentOption = current;
            for (Matcher m : matchers) {
                if (m.match(this)) {
                    consumed.set(currentOption);
                    break;
                }
            }
            advance();
        }

        void advance() {
            current++;
            // find next unconsumed
            while (hasNext() && consumed.get(current)) current++;
        }

        boolean hasNext() {
            return current < allArgs.length;
        }
    }
}
