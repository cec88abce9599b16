package com.repo.scopemetrics.ast;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads ESTree documents (the JSON that espree, acorn or
 * {@code @babel/parser} with the estree plugin emit) into typed nodes.
 */
public class EstreeReader {

    // Objects and arrays both count; deeper documents are rejected before conversion.
    static final int MAX_NESTING_DEPTH = 2_000;

    private static final Set<String> NON_CHILD_KEYS = Set.of(
            "type", "loc", "range", "start", "end", "parent", "comments", "tokens");

    private static final ObjectMapper MAPPER = createMapper();

    private static ObjectMapper createMapper() {
        JsonFactory factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(MAX_NESTING_DEPTH)
                        .maxStringLength(Integer.MAX_VALUE)
                        .build())
                .build();
        return JsonMapper.builder(factory).build();
    }

    /**
     * Read an ESTree program from a file.
     */
    public Program read(Path file) {
        JsonNode document;
        try (Reader reader = Files.newBufferedReader(file)) {
            document = MAPPER.readTree(reader);
        } catch (JsonProcessingException e) {
            throw new EstreeFormatException("Malformed document " + file + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EstreeFormatException("Could not read " + file + ": " + e.getMessage(), e);
        }
        return toProgram(document, file.toString());
    }

    /**
     * Parse an ESTree program from a JSON string.
     */
    public Program parse(String json) {
        JsonNode document;
        try {
            document = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EstreeFormatException("Malformed document <string>: " + e.getOriginalMessage(), e);
        }
        return toProgram(document, "<string>");
    }

    private Program toProgram(JsonNode document, String source) {
        if (document == null || !document.isObject()) {
            throw new EstreeFormatException("Expected an ESTree object in " + source);
        }
        Node root = toNode(document);
        if (root.kind() != NodeKind.PROGRAM) {
            throw new EstreeFormatException("Expected a Program root in " + source + " but found " + root.type());
        }
        return (Program) root;
    }

    private Node toNode(JsonNode object) {
        JsonNode rawType = object.get("type");
        if (rawType == null || !rawType.isTextual()) {
            throw new EstreeFormatException("Node without a type: " + fieldNames(object));
        }
        String type = rawType.textValue();
        NodeKind kind = NodeKind.fromEstreeType(type);

        Node node = switch (kind) {
            case PROGRAM -> new Program(nodes(object, "body"));
            case FUNCTION_DECLARATION, FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> new FunctionNode(
                    kind,
                    child(object, "id", Identifier.class),
                    nodes(object, "params"),
                    child(object, "body", Node.class),
                    flag(object, "async"),
                    flag(object, "generator"));
            case CLASS_DECLARATION, CLASS_EXPRESSION -> new ClassNode(
                    kind,
                    child(object, "id", Identifier.class),
                    child(object, "superClass", Node.class),
                    child(object, "body", ClassBody.class));
            case CLASS_BODY -> new ClassBody(nodes(object, "body"));
            case METHOD_DEFINITION -> new MethodDefinition(
                    child(object, "key", Node.class),
                    child(object, "value", FunctionNode.class),
                    text(object, "kind"),
                    flag(object, "computed"),
                    flag(object, "static"));
            case PROPERTY_DEFINITION -> new PropertyDefinition(
                    child(object, "key", Node.class),
                    child(object, "value", Node.class),
                    flag(object, "computed"),
                    flag(object, "static"));
            case STATIC_BLOCK -> new StaticBlock(nodes(object, "body"));
            case BLOCK_STATEMENT -> new BlockStatement(nodes(object, "body"));
            case IF_STATEMENT -> new IfStatement(
                    child(object, "test", Node.class),
                    child(object, "consequent", Node.class),
                    child(object, "alternate", Node.class));
            case FOR_STATEMENT -> LoopStatement.forStatement(
                    child(object, "init", Node.class),
                    child(object, "test", Node.class),
                    child(object, "update", Node.class),
                    child(object, "body", Node.class));
            case FOR_IN_STATEMENT -> LoopStatement.forIn(
                    child(object, "left", Node.class),
                    child(object, "right", Node.class),
                    child(object, "body", Node.class));
            case FOR_OF_STATEMENT -> LoopStatement.forOf(
                    child(object, "left", Node.class),
                    child(object, "right", Node.class),
                    child(object, "body", Node.class));
            case WHILE_STATEMENT -> LoopStatement.whileStatement(
                    child(object, "test", Node.class),
                    child(object, "body", Node.class));
            case DO_WHILE_STATEMENT -> LoopStatement.doWhile(
                    child(object, "body", Node.class),
                    child(object, "test", Node.class));
            case SWITCH_STATEMENT -> new SwitchStatement(
                    child(object, "discriminant", Node.class),
                    typedNodes(object, "cases", SwitchCase.class));
            case SWITCH_CASE -> new SwitchCase(
                    child(object, "test", Node.class),
                    nodes(object, "consequent"));
            case CATCH_CLAUSE -> new CatchClause(
                    child(object, "param", Node.class),
                    child(object, "body", BlockStatement.class));
            case CONDITIONAL_EXPRESSION -> new ConditionalExpression(
                    child(object, "test", Node.class),
                    child(object, "consequent", Node.class),
                    child(object, "alternate", Node.class));
            case LOGICAL_EXPRESSION -> new LogicalExpression(
                    logicalOperator(object),
                    child(object, "left", Node.class),
                    child(object, "right", Node.class));
            case ASSIGNMENT_EXPRESSION -> new AssignmentExpression(
                    text(object, "operator"),
                    child(object, "left", Node.class),
                    child(object, "right", Node.class));
            case CALL_EXPRESSION -> new CallExpression(
                    child(object, "callee", Node.class),
                    nodes(object, "arguments"),
                    flag(object, "optional"));
            case MEMBER_EXPRESSION -> new MemberExpression(
                    child(object, "object", Node.class),
                    child(object, "property", Node.class),
                    flag(object, "computed"),
                    flag(object, "optional"));
            case IDENTIFIER -> new Identifier(text(object, "name"));
            case PRIVATE_IDENTIFIER -> new PrivateIdentifier(text(object, "name"));
            case LITERAL -> new Literal(literalValue(object.get("value")), text(object, "raw"));
            case TEMPLATE_LITERAL -> new TemplateLiteral(
                    templateQuasis(object),
                    nodes(object, "expressions"));
            case VARIABLE_DECLARATOR -> new VariableDeclarator(
                    child(object, "id", Node.class),
                    child(object, "init", Node.class));
            case PROPERTY -> new Property(
                    child(object, "key", Node.class),
                    child(object, "value", Node.class),
                    text(object, "kind"),
                    flag(object, "method"),
                    flag(object, "shorthand"),
                    flag(object, "computed"));
            case OTHER -> new GenericNode(type, genericChildren(object));
        };
        node.setPosition(position(object));
        return node;
    }

    private <T extends Node> T child(JsonNode object, String key, Class<T> expected) {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isObject()) {
            throw new EstreeFormatException("Property '" + key + "' of " + typeOf(object) + " is not a node");
        }
        return expect(toNode(value), expected, key);
    }

    private List<Node> nodes(JsonNode object, String key) {
        return typedNodes(object, key, Node.class);
    }

    private <T extends Node> List<T> typedNodes(JsonNode object, String key, Class<T> expected) {
        JsonNode value = object.get(key);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new EstreeFormatException("Property '" + key + "' of " + typeOf(object) + " is not a list");
        }
        List<T> result = new ArrayList<>();
        for (JsonNode element : value) {
            // array holes such as [, a] are serialized as null
            if (element.isObject()) {
                result.add(expect(toNode(element), expected, key));
            }
        }
        return result;
    }

    private List<Node> genericChildren(JsonNode object) {
        List<Node> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (NON_CHILD_KEYS.contains(entry.getKey())) {
                continue;
            }
            JsonNode value = entry.getValue();
            if (isNodeObject(value)) {
                children.add(toNode(value));
            } else if (value.isArray()) {
                for (JsonNode element : value) {
                    if (isNodeObject(element)) {
                        children.add(toNode(element));
                    }
                }
            }
        }
        return children;
    }

    private static boolean isNodeObject(JsonNode value) {
        return value.isObject() && value.path("type").isTextual();
    }

    private static <T extends Node> T expect(Node node, Class<T> expected, String key) {
        if (!expected.isInstance(node)) {
            throw new EstreeFormatException("Property '" + key + "' holds a " + node.type()
                    + " where " + expected.getSimpleName() + " was expected");
        }
        return expected.cast(node);
    }

    private static LogicalOperator logicalOperator(JsonNode object) {
        try {
            return LogicalOperator.fromToken(text(object, "operator"));
        } catch (IllegalArgumentException e) {
            throw new EstreeFormatException(e.getMessage(), e);
        }
    }

    private static Object literalValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isIntegralNumber()) {
            return value.numberValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        // regex and bigint literals serialize their value as an empty object
        return null;
    }

    private static List<String> templateQuasis(JsonNode object) {
        List<String> quasis = new ArrayList<>();
        for (JsonNode element : object.path("quasis")) {
            JsonNode cooked = element.path("value").path("cooked");
            quasis.add(cooked.isTextual() ? cooked.textValue() : null);
        }
        return quasis;
    }

    private static SourcePosition position(JsonNode object) {
        JsonNode start = object.path("loc").path("start");
        JsonNode line = start.path("line");
        JsonNode column = start.path("column");
        if (line.isNumber() && column.isNumber()) {
            return new SourcePosition(line.intValue(), column.intValue());
        }
        return SourcePosition.UNKNOWN;
    }

    private static String text(JsonNode object, String key) {
        JsonNode value = object.get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static boolean flag(JsonNode object, String key) {
        return object.path(key).booleanValue();
    }

    private static String typeOf(JsonNode object) {
        return object.path("type").asText("?");
    }

    private static List<String> fieldNames(JsonNode object) {
        List<String> names = new ArrayList<>();
        object.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
