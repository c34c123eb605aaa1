package io.github.cyfko.stackage.core;

import io.github.cyfko.stackage.core.api.Kind;
import io.github.cyfko.stackage.core.utils.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * String assembly for stacks.
 * <p>
 * Elements are rendered one by one (nested stacks recursively, conditions through their own
 * rendering, everything else as encapsulated text), empty renderings are dropped, and the survivors
 * are joined according to the stack's kind and flags.
 * </p>
 */
final class StackRenderer {

    private StackRenderer() {
    }

    static String render(NodeConfig cfg, List<Object> elements) {
        if (cfg.presentationPolicy != null) {
            return cfg.presentationPolicy.present(Collections.unmodifiableList(elements));
        }

        List<String> parts = new ArrayList<>(elements.size());
        for (Object element : elements) {
            String rendered = renderElement(cfg, element);
            if (!rendered.isEmpty()) parts.add(rendered);
        }

        String body = assemble(cfg, parts);
        if (cfg.positive(ConfigFlag.PAREN)) body = "(" + body + ")";
        return StringUtils.condense(body);
    }

    private static String assemble(NodeConfig cfg, List<String> parts) {
        Kind kind = cfg.kind;
        String pad = cfg.pad();
        String symbol = cfg.symbol;
        String word = kind.word(cfg.positive(ConfigFlag.FOLD));

        if (cfg.positive(ConfigFlag.LEAD_ONCE)) {
            List<String> fields = new ArrayList<>(parts.size() + 1);
            if (kind != Kind.LIST) fields.add(symbol.isEmpty() ? " " + word + " " : symbol);
            fields.addAll(parts);
            return String.join(pad, fields);
        }

        if (kind == Kind.LIST) {
            String delimiter = cfg.delimiter;
            return String.join(delimiter.isEmpty() ? pad : delimiter, parts);
        }

        String operator = symbol.isEmpty() ? " " + word + " " : pad + symbol + pad;
        return String.join(operator, parts);
    }

    static String renderElement(NodeConfig cfg, Object element) {
        Optional<Stack> nested = Node.toStack(element);
        if (nested.isPresent()) {
            Stack stack = nested.get();
            String inner = stack.toString();
            if (!inner.isEmpty() && stack.getKind() == Kind.NOT && stack.symbol().isEmpty()) {
                return stack.kind() + " " + inner;
            }
            return inner;
        }

        Optional<Condition> condition = Node.toCondition(element);
        if (condition.isPresent()) return condition.get().toString();

        String text = plainText(element);
        return text.isEmpty() ? "" : cfg.encapsulate(text);
    }

    /**
     * Unencapsulated text of a value; used for rendering and as the default sort key.
     */
    static String plainText(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        return String.valueOf(value);
    }
}
