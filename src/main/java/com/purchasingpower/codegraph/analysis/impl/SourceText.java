package com.purchasingpower.codegraph.analysis.impl;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * UTF-8 source of one file plus the node helpers the extractor needs. Tree-sitter offsets are byte
 * offsets, so text is always sliced from the encoded bytes.
 */
final class SourceText {

    private final byte[] bytes;

    SourceText(String source) {
        this.bytes = source.getBytes(StandardCharsets.UTF_8);
    }

    String text(TSNode node) {
        if (!present(node)) {
            return "";
        }
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(bytes.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(bytes, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Text of a {@code string} or substitution-free {@code template_string} node without its quotes.
     */
    String unquote(TSNode node) {
        String raw = text(node);
        if (raw.length() >= 2) {
            char first = raw.charAt(0);
            if ((first == '\'' || first == '"' || first == '`') && raw.charAt(raw.length() - 1) == first) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }

    static boolean present(TSNode node) {
        return node != null && !node.isNull();
    }

    static boolean is(TSNode node, String type) {
        return present(node) && type.equals(node.getType());
    }

    static TSNode field(TSNode node, String fieldName) {
        if (!present(node)) {
            return null;
        }
        TSNode child = node.getChildByFieldName(fieldName);
        return present(child) ? child : null;
    }

    /** Named children without comments. */
    static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>();
        if (!present(node)) {
            return children;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (present(child) && !"comment".equals(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    static List<TSNode> namedChildren(TSNode node, String type) {
        List<TSNode> matching = new ArrayList<>();
        for (TSNode child : namedChildren(node)) {
            if (type.equals(child.getType())) {
                matching.add(child);
            }
        }
        return matching;
    }

    static TSNode firstNamedChild(TSNode node) {
        List<TSNode> children = namedChildren(node);
        return children.isEmpty() ? null : children.get(0);
    }

    static int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }
}
