package fr.lapetina.liveconfig.infrastructure.reader;

import fr.lapetina.liveconfig.domain.reader.Resolver;
import fr.lapetina.liveconfig.exception.ConfigException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default resolver expanding {@code ${path}} and {@code ${path:default}} placeholders in string leaves.
 *
 * The referenced value is rendered as a string. A missing reference without a default expands to the
 * empty string. Placeholders inside a referenced value or a default are expanded first, so
 * {@code ${primary:${fallback}}} is supported; a reference cycle fails the whole pass. An unterminated
 * placeholder is kept as literal text.
 */
public final class PlaceholderResolver implements Resolver {

    private static final String OPEN = "${";

    @Override
    public void resolve(Map<String, Object> tree) {
        Map<String, Object> source = Trees.deepCopy(tree);
        resolveMap(tree, source);
    }

    @SuppressWarnings("unchecked")
    private void resolveMap(Map<String, Object> node, Map<String, Object> source) {
        for (Map.Entry<String, Object> entry : node.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String text) {
                entry.setValue(expand(text, source, new ArrayDeque<>()));
            } else if (value instanceof Map<?, ?> nested) {
                resolveMap((Map<String, Object>) nested, source);
            } else if (value instanceof List<?> list) {
                resolveList((List<Object>) list, source);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void resolveList(List<Object> list, Map<String, Object> source) {
        for (int i = 0; i < list.size(); i++) {
            Object element = list.get(i);
            if (element instanceof String text) {
                list.set(i, expand(text, source, new ArrayDeque<>()));
            } else if (element instanceof Map<?, ?> nested) {
                resolveMap((Map<String, Object>) nested, source);
            } else if (element instanceof List<?> nested) {
                resolveList((List<Object>) nested, source);
            }
        }
    }

    private String expand(String text, Map<String, Object> source, Deque<String> visiting) {
        int start = text.indexOf(OPEN);
        if (start < 0) {
            return text;
        }
        StringBuilder result = new StringBuilder();
        int position = 0;
        while (start >= 0) {
            int end = closingBrace(text, start + OPEN.length());
            if (end < 0) {
                break;
            }
            result.append(text, position, start);
            String expression = text.substring(start + OPEN.length(), end);
            int separator = expression.indexOf(':');
            String path = (separator < 0 ? expression : expression.substring(0, separator)).trim();
            String fallback = separator < 0 ? "" : expression.substring(separator + 1);
            result.append(lookup(path, fallback, source, visiting));
            position = end + 1;
            start = text.indexOf(OPEN, position);
        }
        result.append(text, position, text.length());
        return result.toString();
    }

    /**
     * Returns the index of the brace closing a placeholder whose body starts at {@code from}, or -1.
     */
    private static int closingBrace(String text, int from) {
        int depth = 1;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '$' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                depth++;
                i++;
            } else if (c == '}' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    private String lookup(String path, String fallback, Map<String, Object> source, Deque<String> visiting) {
        if (visiting.contains(path)) {
            throw new ConfigException("Circular reference: " + String.join(" -> ", visiting) + " -> " + path);
        }
        Optional<Object> referenced = Trees.lookup(source, path);
        if (referenced.isEmpty()) {
            return expand(fallback, source, visiting);
        }
        Object value = referenced.get();
        if (value instanceof String text) {
            visiting.addLast(path);
            try {
                return expand(text, source, visiting);
            } finally {
                visiting.removeLast();
            }
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            return expand(fallback, source, visiting);
        }
        return String.valueOf(value);
    }
}
