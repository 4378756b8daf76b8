package com.williamcallahan.gvtakeout.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;

/**
 * Declarative (tag, class) routing applied during a single depth-first walk of a jsoup tree.
 *
 * <p>Every route whose selector matches an element runs, in registration order, and the walk
 * always continues into the element's children. Handlers do not mutate shared state: they emit
 * fragments, and {@link #collect(Node)} returns those fragments in document order for the caller
 * to fold.</p>
 *
 * @param <F> fragment type emitted by the handlers
 */
public final class MarkupDispatchTable<F> {

    /**
     * Handles one matched element.
     */
    @FunctionalInterface
    public interface ElementHandler<F> {
        void handle(Element element, Consumer<F> emit);
    }

    /**
     * Handles one text node.
     */
    @FunctionalInterface
    public interface TextHandler<F> {
        void handle(TextNode text, Consumer<F> emit);
    }

    /**
     * Selector plus handler. A null tag matches any element; every class token must be present.
     *
     * @param tagName lower-case tag name, or null for any tag
     * @param classTokens class tokens that must all be present
     * @param handler handler invoked for matching elements
     */
    record Route<F>(String tagName, Set<String> classTokens, ElementHandler<F> handler) {

        Route {
            Objects.requireNonNull(classTokens, "classTokens");
            Objects.requireNonNull(handler, "handler");
        }

        boolean matches(Element element) {
            if (tagName != null && !tagName.equals(element.normalName())) {
                return false;
            }
            for (String token : classTokens) {
                if (!element.hasClass(token)) {
                    return false;
                }
            }
            return true;
        }
    }

    private final List<Route<F>> routes;
    private final TextHandler<F> textHandler;

    private MarkupDispatchTable(List<Route<F>> routes, TextHandler<F> textHandler) {
        this.routes = List.copyOf(routes);
        this.textHandler = textHandler;
    }

    public static <F> Builder<F> builder() {
        return new Builder<>();
    }

    /**
     * Walks {@code root} and its descendants, returning every emitted fragment in document order.
     *
     * @param root subtree to walk; the root itself is also routed
     * @return emitted fragments
     */
    public List<F> collect(Node root) {
        List<F> fragments = new ArrayList<>();
        Consumer<F> emit = fragment -> fragments.add(Objects.requireNonNull(fragment, "fragment"));
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof Element element) {
                for (Route<F> route : routes) {
                    if (route.matches(element)) {
                        route.handler().handle(element, emit);
                    }
                }
            } else if (textHandler != null && node instanceof TextNode text) {
                textHandler.handle(text, emit);
            }
        }, root);
        return fragments;
    }

    int routeCount() {
        return routes.size();
    }

    /**
     * Collects routes in the order they should fire for a single element.
     */
    public static final class Builder<F> {
        private final List<Route<F>> routes = new ArrayList<>();
        private TextHandler<F> textHandler;

        private Builder() {}

        /**
         * Routes elements by tag name and class tokens.
         *
         * @param tagName tag name, or null for any tag
         * @param classAttribute space-separated class tokens, empty for no class constraint
         * @param handler element handler
         * @return this builder
         */
        public Builder<F> on(String tagName, String classAttribute, ElementHandler<F> handler) {
            String normalizedTag = tagName == null ? null : tagName.toLowerCase(Locale.ROOT);
            routes.add(new Route<>(normalizedTag, classTokens(classAttribute), handler));
            return this;
        }

        /**
         * Routes elements by tag name alone.
         */
        public Builder<F> onTag(String tagName, ElementHandler<F> handler) {
            return on(Objects.requireNonNull(tagName, "tagName"), "", handler);
        }

        /**
         * Routes elements of any tag carrying the given class tokens.
         */
        public Builder<F> onClass(String classAttribute, ElementHandler<F> handler) {
            return on(null, classAttribute, handler);
        }

        public Builder<F> onText(TextHandler<F> handler) {
            this.textHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        public MarkupDispatchTable<F> build() {
            return new MarkupDispatchTable<>(routes, textHandler);
        }

        private static Set<String> classTokens(String classAttribute) {
            if (classAttribute == null || classAttribute.isBlank()) {
                return Set.of();
            }
            return Set.of(classAttribute.trim().split("\\s+"));
        }
    }
}
