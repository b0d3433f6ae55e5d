package com.thriftgen.testdata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Lazy description of how to draw a value.
 *
 * Building a generator has no side effects; every {@link #sample(GenContext)}
 * call is an independent run with its own {@link Sampler}.
 */
@FunctionalInterface
public interface Gen<T> {

    T generate(Sampler sampler);

    default T sample(GenContext context) {
        return generate(context.newSampler());
    }

    /**
     * Draws {@code count} values from one sampling run.
     */
    default List<T> sample(GenContext context, int count) {
        Sampler sampler = context.newSampler();
        List<T> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            values.add(generate(sampler));
        }
        return values;
    }

    default <R> Gen<R> map(Function<? super T, ? extends R> mapper) {
        return sampler -> mapper.apply(generate(sampler));
    }

    static <T> Gen<T> constant(T value) {
        return sampler -> value;
    }

    /**
     * Uniform choice between the given generators.
     */
    @SafeVarargs
    static <T> Gen<T> oneOf(Gen<? extends T>... choices) {
        List<Gen<? extends T>> options = List.of(choices);
        if (options.isEmpty()) {
            throw new IllegalArgumentException("oneOf needs at least one generator");
        }
        return sampler -> options.get(sampler.nextInt(options.size())).generate(sampler);
    }

    /**
     * 50/50 choice between {@code generator} and {@code null}. Always
     * {@code null} once the depth limit is reached.
     */
    static <T> Gen<T> nullable(Gen<? extends T> generator) {
        Gen<T> choice = oneOf(generator, constant(null));
        return sampler -> sampler.atDepthLimit() ? null : choice.generate(sampler);
    }

    /**
     * Defers building the generator until a value is drawn. Used for
     * self-referential types.
     */
    static <T> Gen<T> lazy(Supplier<Gen<? extends T>> supplier) {
        return sampler -> supplier.get().generate(sampler);
    }

    /**
     * Draws every binding independently in declaration order, then constructs
     * a single value from all of them. Counts as one level of nesting.
     */
    static <T> Gen<T> letAll(List<Binding<?>> bindings, Function<Bindings, ? extends T> construct) {
        List<Binding<?>> ordered = List.copyOf(bindings);
        return sampler -> sampler.descend(() -> {
            Map<String, Object> drawn = new LinkedHashMap<>();
            for (Binding<?> binding : ordered) {
                drawn.put(binding.getName(), binding.getGenerator().generate(sampler));
            }
            return construct.apply(new Bindings(drawn));
        });
    }
}
