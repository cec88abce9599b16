package com.repo.scopemetrics.rules;

import com.repo.scopemetrics.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable function descriptions for messages, e.g.
 * {@code function 'foo'}, {@code static async method 'load'}, {@code arrow function},
 * {@code private method #reset}, {@code getter 'size'}, {@code constructor}.
 */
public final class FunctionNames {

    private FunctionNames() {
    }

    public static String nameWithKind(FunctionNode node) {
        Node parent = node.parent();
        NodeKind parentKind = parent == null ? NodeKind.OTHER : parent.kind();
        boolean classMember = parentKind == NodeKind.METHOD_DEFINITION || parentKind == NodeKind.PROPERTY_DEFINITION;
        boolean member = classMember || parentKind == NodeKind.PROPERTY;
        List<String> tokens = new ArrayList<>();

        if (classMember) {
            if (isStatic(parent)) {
                tokens.add("static");
            }
            if (isPrivateKey(parent)) {
                tokens.add("private");
            }
        }
        if (node.isAsync()) {
            tokens.add("async");
        }
        if (node.isGenerator()) {
            tokens.add("generator");
        }

        if (parentKind == NodeKind.METHOD_DEFINITION || parentKind == NodeKind.PROPERTY) {
            String kind = parentKind == NodeKind.METHOD_DEFINITION
                    ? ((MethodDefinition) parent).methodKind()
                    : ((Property) parent).propertyKind();
            switch (kind) {
                case "constructor" -> {
                    return "constructor";
                }
                case "get" -> tokens.add("getter");
                case "set" -> tokens.add("setter");
                default -> tokens.add("method");
            }
        } else if (parentKind == NodeKind.PROPERTY_DEFINITION) {
            tokens.add("method");
        } else {
            if (node.isArrow()) {
                tokens.add("arrow");
            }
            tokens.add("function");
        }

        if (member) {
            if (isPrivateKey(parent)) {
                tokens.add("#" + ((PrivateIdentifier) keyOf(parent)).name());
            } else {
                String name = staticPropertyName(keyOf(parent), isComputed(parent));
                if (name != null) {
                    tokens.add("'" + name + "'");
                } else if (node.id() != null) {
                    tokens.add("'" + node.id().name() + "'");
                }
            }
        } else if (node.id() != null) {
            tokens.add("'" + node.id().name() + "'");
        }
        return String.join(" ", tokens);
    }

    /**
     * Upper-case the first character.
     */
    public static String upperCaseFirst(String s) {
        if (s == null || s.isEmpty()) {
            return s;
        }
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    /**
     * The name a property key denotes without evaluation: {@code a}, {@code 'a'}, {@code ['a']}, {@code [`a`]}, {@code 1}.
     */
    static String staticPropertyName(Node key, boolean computed) {
        if (key == null) {
            return null;
        }
        if (!computed && key.kind() == NodeKind.IDENTIFIER) {
            return ((Identifier) key).name();
        }
        if (key.kind() == NodeKind.LITERAL) {
            Object value = ((Literal) key).value();
            if (value == null) {
                return ((Literal) key).raw();
            }
            if (value instanceof Double && ((Double) value) % 1 == 0 && !((Double) value).isInfinite()) {
                return String.valueOf(((Double) value).longValue());
            }
            return String.valueOf(value);
        }
        if (key.kind() == NodeKind.TEMPLATE_LITERAL) {
            return ((TemplateLiteral) key).staticValue();
        }
        return null;
    }

    private static Node keyOf(Node member) {
        return switch (member.kind()) {
            case METHOD_DEFINITION -> ((MethodDefinition) member).key();
            case PROPERTY_DEFINITION -> ((PropertyDefinition) member).key();
            case PROPERTY -> ((Property) member).key();
            default -> null;
        };
    }

    private static boolean isComputed(Node member) {
        return switch (member.kind()) {
            case METHOD_DEFINITION -> ((MethodDefinition) member).isComputed();
            case PROPERTY_DEFINITION -> ((PropertyDefinition) member).isComputed();
            case PROPERTY -> ((Property) member).isComputed();
            default -> false;
        };
    }

    private static boolean isStatic(Node member) {
        return switch (member.kind()) {
            case METHOD_DEFINITION -> ((MethodDefinition) member).isStatic();
            case PROPERTY_DEFINITION -> ((PropertyDefinition) member).isStatic();
            default -> false;
        };
    }

    private static boolean isPrivateKey(Node member) {
        Node key = keyOf(member);
        return !isComputed(member) && key != null && key.kind() == NodeKind.PRIVATE_IDENTIFIER;
    }
}
