package org.netpreserve.fedicrawl.config;

import java.util.function.Predicate;

final class Checks {
    private Checks() {
    }

    static <T> T validate(String name, T value, Predicate<T> validator) {
        if (value == null || !validator.test(value)) {
            throw new ConfigurationException("Invalid " + name + ": " + value);
        }
        return value;
    }

    static <T> T validateIfNotNull(String name, T value, Predicate<T> validator) {
        if (value != null && !validator.test(value)) {
            throw new ConfigurationException("Invalid " + name + ": " + value);
        }
        return value;
    }
}
