package net.osslabz.wamp.error;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;


final class Renderings {

    private Renderings() {

    }


    /**
     * Debug form of a payload value: strings are quoted at any depth, everything else uses {@code toString()}.
     */
    static String repr(Object value) {

        if (value instanceof CharSequence s) {
            return "\"" + s + "\"";
        }
        if (value instanceof List<?> list) {
            return "[" + joinRepr(list) + "]";
        }
        if (value instanceof Map<?, ?> map) {
            return map.entrySet().stream()
                .map(e -> e.getKey() + "=" + repr(e.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
        }
        return String.valueOf(value);
    }


    static String joinRepr(List<?> values) {

        return values.stream().map(Renderings::repr).collect(Collectors.joining(", "));
    }


    static String joinPlain(List<?> values) {

        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }


    static String joinKeywords(Map<String, ?> values) {

        return values.entrySet().stream()
            .map(e -> e.getKey() + "=" + repr(e.getValue()))
            .collect(Collectors.joining(", "));
    }
}
