package ai.callgraph.model;

import java.util.Collection;
import java.util.Objects;

public final class Names {

    private static final int MAX_MESSAGE = 200;

    private Names() {
    }

    /**
     * Name part of a parameter as written: {@code "gdata::Data"} gives {@code "gdata"},
     * {@code "crf::Float64=0.11"} gives {@code "crf"}, {@code "args..."} gives {@code "args"}.
     */
    public static String bareParameterName(String parameter) {
        if (parameter == null) {
            return "";
        }
        String raw = parameter.trim();
        // keyword arguments may carry the ';' separator in front
        while (raw.startsWith(";")) {
            raw = raw.substring(1).trim();
        }
        if (raw.isEmpty()) {
            return raw;
        }

        final StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            final char c = raw.charAt(i);
            if (c == ':' || c == '=' || c == ';' || Character.isWhitespace(c)) {
                break;
            }
            sb.append(c);
        }

        String normalized = sb.toString();
        if (normalized.endsWith("...")) {
            normalized = normalized.substring(0, normalized.length() - 3);
        }
        return normalized;
    }

    public static String joinOrNone(Collection<String> values) {
        Objects.requireNonNull(values, "values");
        return values.isEmpty() ? "None" : String.join(", ", values);
    }

    public static String clip(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > MAX_MESSAGE ? msg.substring(0, MAX_MESSAGE) + "..." : msg;
    }
}
