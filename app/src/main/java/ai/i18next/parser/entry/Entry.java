package ai.i18next.parser.entry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A translation key found in application source code.
 *
 * @param key       key as written in code, possibly nested with the key separator
 * @param namespace namespace given at the call site, if any
 * @param value     default value given at the call site, if any
 * @param hasCount  whether the call passed a {@code count} option and needs plural forms
 * @param options   remaining i18next options of the call
 */
public record Entry(String key, Optional<String> namespace, Optional<String> value, boolean hasCount,
                    Map<String, String> options) {

    public Entry {
        Objects.requireNonNull(key, "key");
        namespace = namespace == null ? Optional.empty() : namespace.filter(ns -> !ns.isBlank());
        value = value == null ? Optional.empty() : value;
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static Entry of(String key) {
        return new Entry(key, Optional.empty(), Optional.empty(), false, Map.of());
    }

    public static Entry of(String namespace, String key, String value) {
        return new Entry(key, Optional.ofNullable(namespace), Optional.ofNullable(value), false, Map.of());
    }

    public Entry withCount() {
        return new Entry(key, namespace, value, true, options);
    }
}
