package com.wailer.render;

import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Copies the rules of a document's {@code <style>} blocks onto the
 * {@code style} attribute of every element they match, since most mail
 * clients ignore style sheets.
 *
 * <p>Rules apply in order of specificity, then source order. Declarations
 * already present in a {@code style} attribute win. Rules whose selector cannot
 * be evaluated statically ({@code a:hover}) stay in their {@code <style>}
 * block; a block that ends up empty is removed. Blocks holding at-rules
 * ({@code @media}, {@code @font-face}) are left as they are.
 */
class CssInliner {

    private static final Logger LOG = LoggerFactory.getLogger(CssInliner.class);

    private static final Pattern COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);

    void inline(final Document doc) {
        final List<Rule> rules = new ArrayList<>();
        int order = 0;

        for (final Element style : doc.select("style")) {
            final String css = COMMENT.matcher(style.data()).replaceAll("");
            if (css.contains("@")) continue;

            final StringBuilder kept = new StringBuilder();
            for (final String[] block : blocks(css)) {
                for (final String selector : block[0].split(",")) {
                    final String sel = selector.trim();
                    if (sel.isEmpty()) continue;
                    if (isEvaluable(doc, sel)) {
                        rules.add(new Rule(sel, declarations(block[1]), order++));
                    } else {
                        kept.append(sel).append(" {").append(block[1]).append("}\n");
                    }
                }
            }

            if (kept.length() == 0) {
                style.remove();
            } else {
                style.empty().appendChild(new DataNode(kept.toString()));
            }
        }

        if (rules.isEmpty()) return;
        rules.sort(Comparator.comparingInt(Rule::specificity).thenComparingInt(Rule::order));

        final Map<Element, Map<String, String>> computed = new IdentityHashMap<>();
        for (final Rule rule : rules) {
            for (final Element el : doc.select(rule.selector())) {
                computed.computeIfAbsent(el, e -> new LinkedHashMap<>()).putAll(rule.declarations());
            }
        }

        computed.forEach((el, decls) -> {
            decls.putAll(declarations(el.attr("style")));
            el.attr("style", serialize(decls));
        });
        LOG.debug("Inlined {} CSS rule(s) into {} element(s)", rules.size(), computed.size());
    }

    // ── Parsing ───────────────────────────────────────────────────────────────

    /** Splits a style sheet into {selector list, declaration block} pairs. */
    private static List<String[]> blocks(final String css) {
        final List<String[]> out = new ArrayList<>();
        int pos = 0;
        while (true) {
            final int open = css.indexOf('{', pos);
            if (open < 0) break;
            final int close = css.indexOf('}', open);
            if (close < 0) break;
            out.add(new String[] { css.substring(pos, open), css.substring(open + 1, close) });
            pos = close + 1;
        }
        return out;
    }

    static Map<String, String> declarations(final String block) {
        final Map<String, String> out = new LinkedHashMap<>();
        for (final String decl : block.split(";")) {
            final int colon = decl.indexOf(':');
            if (colon <= 0) continue;
            final String name  = decl.substring(0, colon).trim().toLowerCase();
            final String value = decl.substring(colon + 1).trim();
            if (!name.isEmpty() && !value.isEmpty()) {
                // re-inserting moves the property to the end, like a later declaration
                out.remove(name);
                out.put(name, value);
            }
        }
        return out;
    }

    private static String serialize(final Map<String, String> decls) {
        final StringBuilder sb = new StringBuilder();
        decls.forEach((name, value) -> {
            if (sb.length() > 0) sb.append(';');
            sb.append(name).append(':').append(value);
        });
        return sb.toString();
    }

    private static boolean isEvaluable(final Document doc, final String selector) {
        if (selector.contains(":")) return false;
        try {
            doc.select(selector);
            return true;
        } catch (Selector.SelectorParseException e) {
            LOG.debug("Keeping CSS rule with unsupported selector: {}", selector);
            return false;
        }
    }

    /** Ids count 100, classes and attributes 10, element names 1. */
    static int specificity(final String selector) {
        int score = 0;
        for (final String part : selector.split("[\\s>+~]+")) {
            if (part.isEmpty()) continue;
            if (Character.isLetter(part.charAt(0))) score += 1;
            for (final char c : part.toCharArray()) {
                if (c == '#') score += 100;
                else if (c == '.' || c == '[') score += 10;
            }
        }
        return score;
    }

    private static final class Rule {
        private final String              selector;
        private final Map<String, String> declarations;
        private final int                 order;
        private final int                 specificity;

        Rule(final String selector, final Map<String, String> declarations, final int order) {
            this.selector     = selector;
            this.declarations = declarations;
            this.order        = order;
            this.specificity  = CssInliner.specificity(selector);
        }

        String selector()                  { return selector; }
        Map<String, String> declarations() { return declarations; }
        int order()                        { return order; }
        int specificity()                  { return specificity; }
    }
}
