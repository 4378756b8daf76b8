package com.williamcallahan.gvtakeout.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

/**
 * Text and link helpers shared by the markup extractors.
 */
final class MarkupText {

    static final String TEL_SCHEME = "tel:";

    private MarkupText() {}

    /**
     * Concatenates the raw text of every descendant text node and trims the result.
     *
     * <p>Unlike {@link Element#text()} this keeps interior whitespace exactly as the export wrote it.</p>
     */
    static String fullText(Node node) {
        StringBuilder text = new StringBuilder();
        NodeTraversor.traverse((child, depth) -> {
            if (child instanceof TextNode textNode) {
                text.append(textNode.getWholeText());
            }
        }, node);
        return text.toString().trim();
    }

    /**
     * Returns the number from a {@code tel:} href on this element, or null when it has none.
     */
    static String telNumber(Element element) {
        String href = element.attr("href");
        if (href.startsWith(TEL_SCHEME)) {
            return href.substring(TEL_SCHEME.length());
        }
        return null;
    }

    /**
     * Finds the number on the nearest ancestor of {@code element} carrying a {@code tel:} link.
     *
     * @param element element whose ancestors are searched
     * @param boundary last ancestor to inspect
     * @return phone number, or empty string when no ancestor up to the boundary has one
     */
    static String nearestAncestorTelNumber(Element element, Element boundary) {
        Element current = element.parent();
        while (current != null) {
            String number = telNumber(current);
            if (number != null) {
                return number;
            }
            if (current == boundary) {
                break;
            }
            current = current.parent();
        }
        return "";
    }
}
