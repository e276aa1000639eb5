package ai.agentcap.router.orch.trace;

import org.apache.commons.codec.digest.DigestUtils;

import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Canonical rendering and hashing of invocation payloads.
 *
 * <p>Map entries are rendered sorted by key so that two input maps with the same content
 * produce the same key regardless of insertion order. Collections and arrays keep their order.
 * Strings and map keys are quoted with {@code "} and {@code \} escaped, so a value can never
 * spell out another entry.</p>
 */
public final class CapDigest {

    private static final int MAX_DEPTH = 24;

    private CapDigest() {
    }

    /** Coalescing / response-cache key of an invocation. */
    public static String key(String capabilityId, Map<String, ?> inputs) {
        StringBuilder sb = new StringBuilder(128);
        sb.append(capabilityId).append(':');
        appendCanonical(sb, inputs == null ? Map.of() : inputs, 0, new IdentityHashMap<>());
        return sb.toString();
    }

    public static String canonical(Object v) {
        StringBuilder sb = new StringBuilder(256);
        appendCanonical(sb, v, 0, new IdentityHashMap<>());
        return sb.toString();
    }

    public static String sha256Canonical(Object v) {
        return sha256Hex(canonical(v));
    }

    public static String sha256Hex(String s) {
        return DigestUtils.sha256Hex(s.getBytes(StandardCharsets.UTF_8));
    }

    /** First 16 hex chars of the SHA-256 over {capabilityId, inputs}. */
    public static String contentHash(String capabilityId, Map<String, ?> inputs) {
        return sha256Hex(key(capabilityId, inputs)).substring(0, 16);
    }

    private static void appendCanonical(StringBuilder sb, Object v, int depth, IdentityHashMap<Object, Boolean> seen) {
        if (v == null) {
            sb.append("null");
            return;
        }
        if (v instanceof CharSequence s) {
            appendQuoted(sb, s);
            return;
        }
        if (v instanceof Number || v instanceof Boolean || v instanceof Enum<?>) {
            sb.append(v);
            return;
        }
        if (seen.put(v, Boolean.TRUE) != null) {
            sb.append("<cycle>");
            return;
        }
        try {
            if (depth > MAX_DEPTH) {
                sb.append("<max-depth>");
                return;
            }
            if (v instanceof Map<?, ?> m) {
                sb.append('{');
                ArrayList<Map.Entry<?, ?>> entries = new ArrayList<>(m.entrySet());
                entries.sort(Comparator.comparing(e -> String.valueOf(e.getKey())));
                boolean first = true;
                for (Map.Entry<?, ?> e : entries) {
                    if (!first) {
                        sb.append(',');
                    }
                    first = false;
                    appendQuoted(sb, String.valueOf(e.getKey()));
                    sb.append(':');
                    appendCanonical(sb, e.getValue(), depth + 1, seen);
                }
                sb.append('}');
                return;
            }
            if (v instanceof Collection<?> c) {
                sb.append('[');
                boolean first = true;
                for (Object o : c) {
                    if (!first) {
                        sb.append(',');
                    }
                    first = false;
                    appendCanonical(sb, o, depth + 1, seen);
                }
                sb.append(']');
                return;
            }
            if (v.getClass().isArray()) {
                sb.append('[');
                int n = Array.getLength(v);
                for (int i = 0; i < n; i++) {
                    if (i > 0) {
                        sb.append(',');
                    }
                    appendCanonical(sb, Array.get(v, i), depth + 1, seen);
                }
                sb.append(']');
                return;
            }
            sb.append(v);
        } finally {
            seen.remove(v);
        }
    }

    private static void appendQuoted(StringBuilder sb, CharSequence s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        sb.append('"');
    }
}
