package io.palaver.core.prompt;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * How raw input becomes a screen value: convert, then validate the converted value, then
 * transform it. A converter signals unusable input by throwing {@link IllegalArgumentException}.
 */
public final class InputSpec<T> {
    private final Function<String, T> converter;
    private final Function<? super T, String> validator;
    private final UnaryOperator<T> transformer;

    private InputSpec(Function<String, T> converter, Function<? super T, String> validator, UnaryOperator<T> transformer) {
        this.converter = converter;
        this.validator = validator;
        this.transformer = transformer;
    }

    public static InputSpec<String> text() {
        return new InputSpec<>(Function.identity(), null, null);
    }

    public static InputSpec<Integer> integer() {
        return converting(raw -> Integer.parseInt(raw.trim()));
    }

    public static <T> InputSpec<T> converting(Function<String, T> converter) {
        return new InputSpec<>(Objects.requireNonNull(converter, "converter must not be null"), null, null);
    }

    /**
     * @param validator returns an error message, or {@code null} when the value is acceptable
     */
    public InputSpec<T> validate(Function<? super T, String> validator) {
        return new InputSpec<>(converter, validator, transformer);
    }

    public InputSpec<T> transform(UnaryOperator<T> transformer) {
        return new InputSpec<>(converter, validator, transformer);
    }

    T convert(String raw) {
        return converter.apply(raw);
    }

    String validationError(T value) {
        if (validator == null) {
            return null;
        }
        String error = validator.apply(value);
        return error == null || error.isBlank() ? null : error;
    }

    T finish(T value) {
        return transformer == null ? value : transformer.apply(value);
    }
}
