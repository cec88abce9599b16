package com.repo.scopemetrics.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A template literal. The static parts ({@code TemplateElement}s) are kept as
 * their cooked strings; only the embedded expressions are child nodes.
 */
public final class TemplateLiteral extends Node {

    private final List<String> quasis;
    private final List<Node> expressions;

    public TemplateLiteral(List<String> quasis, List<? extends Node> expressions) {
        super(NodeKind.TEMPLATE_LITERAL);
        // cooked is null for invalid escapes in tagged templates
        this.quasis = Collections.unmodifiableList(new ArrayList<>(quasis));
        this.expressions = adoptAll(List.copyOf(expressions));
    }

    public static TemplateLiteral of(String text) {
        return new TemplateLiteral(List.of(text), List.of());
    }

    public List<String> quasis() {
        return quasis;
    }

    public List<Node> expressions() {
        return expressions;
    }

    /**
     * The string this template always evaluates to, or {@code null} when it embeds expressions.
     */
    public String staticValue() {
        return expressions.isEmpty() && quasis.size() == 1 ? quasis.get(0) : null;
    }

    @Override
    public List<Node> children() {
        return expressions;
    }
}
