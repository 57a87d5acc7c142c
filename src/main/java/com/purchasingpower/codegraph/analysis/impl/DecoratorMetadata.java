package com.purchasingpower.codegraph.analysis.impl;

import lombok.extern.slf4j.Slf4j;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.purchasingpower.codegraph.analysis.impl.SourceText.field;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.firstNamedChild;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.is;
import static com.purchasingpower.codegraph.analysis.impl.SourceText.namedChildren;

/**
 * Object-literal argument of a decorator, e.g. the {@code { selector: 'app-root', ... }} of
 * {@code @Component}.
 *
 * <p>Literal values convert to strings, booleans and string lists. Anything else is kept as the
 * marker {@code [Complex Value: <syntax-kind>]}.
 */
@Slf4j
final class DecoratorMetadata {

    private final SourceText source;
    private final Map<String, TSNode> entries;

    private DecoratorMetadata(SourceText source, Map<String, TSNode> entries) {
        this.source = source;
        this.entries = entries;
    }

    static DecoratorMetadata empty(SourceText source) {
        return new DecoratorMetadata(source, Collections.emptyMap());
    }

    /**
     * @param arguments the {@code arguments} node of the decorator call, may be {@code null}
     */
    static DecoratorMetadata fromArguments(TSNode arguments, SourceText source) {
        TSNode first = firstNamedChild(arguments);
        if (!is(first, "object")) {
            return empty(source);
        }
        Map<String, TSNode> entries = new LinkedHashMap<>();
        for (TSNode pair : namedChildren(first, "pair")) {
            TSNode key = field(pair, "key");
            TSNode value = field(pair, "value");
            if (key == null || value == null) {
                continue;
            }
            String name = is(key, "string") ? source.unquote(key) : source.text(key);
            entries.put(name, value);
        }
        return new DecoratorMetadata(source, entries);
    }

    boolean has(String key) {
        return entries.containsKey(key);
    }

    /** Converted value, or {@code null} when the key is absent. */
    Object value(String key) {
        TSNode node = entries.get(key);
        return node == null ? null : convert(node);
    }

    /**
     * Names referenced by the elements of an array value. Nested arrays are flattened.
     */
    List<String> referencedNames(String key) {
        List<String> names = new ArrayList<>();
        TSNode node = entries.get(key);
        if (node == null) {
            return names;
        }
        if (is(node, "array")) {
            collectNames(node, names);
        } else {
            log.debug("'{}' is not an array literal ({}); no references taken", key, node.getType());
        }
        return names;
    }

    private void collectNames(TSNode array, List<String> names) {
        for (TSNode element : namedChildren(array)) {
            if (is(element, "array")) {
                collectNames(element, names);
                continue;
            }
            String name = referencedName(element);
            if (name != null) {
                names.add(name);
            } else {
                log.debug("Skipping list element '{}' ({})", source.text(element), element.getType());
            }
        }
    }

    private String referencedName(TSNode element) {
        switch (element.getType()) {
            case "identifier":
            case "member_expression":
                return source.text(element);
            case "call_expression": {
                // Foo.forRoot(...) refers to Foo
                TSNode function = field(element, "function");
                if (is(function, "member_expression")) {
                    TSNode object = field(function, "object");
                    return object != null ? referencedName(object) : null;
                }
                return null;
            }
            case "object": {
                String provided = null;
                for (TSNode pair : namedChildren(element, "pair")) {
                    String pairKey = source.text(field(pair, "key"));
                    TSNode value = field(pair, "value");
                    if (value == null) {
                        continue;
                    }
                    if ("useClass".equals(pairKey)) {
                        return referencedName(value);
                    }
                    if ("provide".equals(pairKey)) {
                        provided = referencedName(value);
                    }
                }
                return provided;
            }
            default:
                return null;
        }
    }

    private Object convert(TSNode node) {
        switch (node.getType()) {
            case "string":
                return source.unquote(node);
            case "template_string":
                if (namedChildren(node, "template_substitution").isEmpty()) {
                    return source.unquote(node);
                }
                return complex(node);
            case "number":
            case "identifier":
            case "member_expression":
                return source.text(node);
            case "true":
                return Boolean.TRUE;
            case "false":
                return Boolean.FALSE;
            case "array": {
                List<String> elements = new ArrayList<>();
                for (TSNode element : namedChildren(node)) {
                    elements.add(is(element, "string") ? source.unquote(element) : source.text(element));
                }
                return elements;
            }
            default:
                return complex(node);
        }
    }

    private static String complex(TSNode node) {
        return "[Complex Value: " + node.getType() + "]";
    }
}
