package com.climaterisklens.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keeps user-facing text ASCII-only: dashes and smart quotes become plain
 * punctuation, other non-ASCII characters are dropped.
 */
public final class AsciiSanitizer {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private AsciiSanitizer() {
    }

    /**
     * Sanitizes one string. Null stays null.
     */
    public static String sanitizeText(String text) {
        if (text == null)
            return null;
        String s = text.replace("\u2014", " - ")
                .replace("\u2013", " - ")
                .replace('\u201c', '"')
                .replace('\u201d', '"')
                .replace('\u2018', '\'')
                .replace('\u2019', '\'');

        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (ch >= 32 && ch <= 126) {
                sb.append(ch);
            } else if (Character.isWhitespace(ch) || Character.isSpaceChar(ch)) {
                sb.append(' ');
            }
        }
        return WHITESPACE_RUN.matcher(sb).replaceAll(" ").trim();
    }

    /**
     * Sanitizes every textual value and every field name of a JSON tree.
     * Containers are edited in place; a bare text root is replaced, so callers
     * use the returned node. Field names that collide after sanitizing keep
     * the last value.
     */
    public static JsonNode sanitizeTree(JsonNode node) {
        if (node == null)
            return null;
        if (node.isTextual())
            return TextNode.valueOf(sanitizeText(node.textValue()));
        if (node instanceof ObjectNode obj) {
            Iterator<Map.Entry<String, JsonNode>> it = obj.fields();
            List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
            it.forEachRemaining(entries::add);
            obj.removeAll();
            for (Map.Entry<String, JsonNode> e : entries) {
                obj.set(sanitizeText(e.getKey()), sanitizeTree(e.getValue()));
            }
        } else if (node instanceof ArrayNode arr) {
            for (int i = 0; i < arr.size(); i++) {
                arr.set(i, sanitizeTree(arr.get(i)));
            }
        }
        return node;
    }

    public static boolean isAsciiOnly(String text) {
        if (text == null)
            return true;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) >= 128)
                return false;
        }
        return true;
    }

    /**
     * Lists the non-ASCII characters of a string in order of appearance.
     */
    public static List<String> findNonAscii(String text) {
        List<String> out = new ArrayList<>();
        if (text == null)
            return out;
        text.codePoints()
                .filter(cp -> cp >= 128)
                .forEach(cp -> out.add(new String(Character.toChars(cp))));
        return out;
    }
}
