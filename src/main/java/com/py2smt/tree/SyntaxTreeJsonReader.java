package com.py2smt.tree;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.py2smt.source.ParseException;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads a syntax tree serialized as JSON by an external frontend.
 * <p>
 * Every node is an object whose {@code kind} names the node type, with the node's fields
 * under their own names, for example
 * <pre>
 * {"kind": "BinOp", "left": {"kind": "Name", "identifier": "x"}, "op": "Add",
 *  "right": {"kind": "Constant", "value": 1}}
 * </pre>
 * Operators use their Python ast names. A kind this reader does not know becomes an
 * {@link SyntaxNode.Unsupported} node.
 */
public class SyntaxTreeJsonReader {
    private final JsonFactory factory = new JsonFactory();

    public SyntaxNode read(InputStream input) throws IOException {
        try (JsonParser parser = factory.createParser(input)) {
            return readTree(parser);
        }
    }

    public SyntaxNode read(String json) throws IOException {
        try (JsonParser parser = factory.createParser(json)) {
            return readTree(parser);
        }
    }

    private SyntaxNode readTree(JsonParser parser) throws IOException {
        Object value;
        try {
            value = parseValue(parser, parser.nextToken());
            if (parser.nextToken() != null) {
                throw malformed(parser, "trailing content after the syntax tree");
            }
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            throw new ParseException(e.getOriginalMessage(),
                    location != null ? location.getLineNr() : 0,
                    location != null ? location.getColumnNr() : 0,
                    null);
        }
        return toNode(value, "root");
    }

    // JSON is first read into plain maps and lists, then shaped into nodes.
    private Object parseValue(JsonParser parser, JsonToken token) throws IOException {
        if (token == null) {
            throw malformed(parser, "empty input");
        }
        return switch (token) {
            case START_OBJECT -> parseObject(parser);
            case START_ARRAY -> parseArray(parser);
            case VALUE_STRING -> parser.getText();
            case VALUE_NUMBER_INT -> parser.getBigIntegerValue();
            case VALUE_NUMBER_FLOAT -> {
                double number = parser.getDoubleValue();
                if (!Double.isFinite(number)) {
                    throw malformed(parser, "number " + parser.getText() + " is out of range for a float");
                }
                yield number;
            }
            case VALUE_TRUE -> Boolean.TRUE;
            case VALUE_FALSE -> Boolean.FALSE;
            case VALUE_NULL -> JsonNull.INSTANCE;
            default -> throw malformed(parser, "unexpected JSON token " + token);
        };
    }

    private MutableMap<String, Object> parseObject(JsonParser parser) throws IOException {
        var fields = Maps.mutable.<String, Object>empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.getCurrentName();
            fields.put(fieldName, parseValue(parser, parser.nextToken()));
        }

        return fields;
    }

    private MutableList<Object> parseArray(JsonParser parser) throws IOException {
        var elements = Lists.mutable.empty();

        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(parseValue(parser, token));
        }

        return elements;
    }

    private ParseException malformed(JsonParser parser, String message) {
        JsonLocation location = parser.getCurrentLocation();
        return new ParseException(message, location.getLineNr(), location.getColumnNr(), null);
    }

    // ---------------------------------------------------------------- shaping

    @SuppressWarnings("unchecked")
    private SyntaxNode toNode(Object value, String where) {
        if (!(value instanceof MutableMap)) {
            throw new ParseException("Expected a node object at " + where + " but found " + describe(value));
        }
        MutableMap<String, Object> fields = (MutableMap<String, Object>) value;
        String kind = string(fields, "kind", where);
        String path = where + "." + kind;

        return switch (kind) {
            case "Module" -> new SyntaxNode.Module(nodes(fields, "statements", path));
            case "FunctionDef" -> new SyntaxNode.FunctionDef(
                    string(fields, "name", path),
                    list(fields, "params", path).collect(param -> {
                        if (!(param instanceof String name)) {
                            throw new ParseException("Parameter names at " + path + " must be strings");
                        }
                        return name;
                    }).toImmutable(),
                    nodes(fields, "body", path));
            case "Assign" -> new SyntaxNode.Assign(targets(fields, path), node(fields, "value", path));
            case "BinOp" -> new SyntaxNode.BinOp(
                    node(fields, "left", path),
                    operator(fields, "op", path, BinaryOperator::fromAstName),
                    node(fields, "right", path));
            case "Compare" -> compare(fields, path);
            case "BoolOp" -> new SyntaxNode.BoolOp(
                    operator(fields, "op", path, BooleanOperator::fromAstName),
                    nodes(fields, "values", path));
            case "UnaryOp" -> new SyntaxNode.UnaryOp(
                    operator(fields, "op", path, UnaryOperator::fromAstName),
                    node(fields, "operand", path));
            case "If" -> new SyntaxNode.If(
                    node(fields, "test", path),
                    nodes(fields, "body", path),
                    fields.containsKey("orelse") ? nodes(fields, "orelse", path) : Lists.immutable.<SyntaxNode>empty());
            case "Return" -> {
                Object returned = fields.get("value");
                yield new SyntaxNode.Return(returned == null || returned == JsonNull.INSTANCE
                        ? null
                        : toNode(returned, path + ".value"));
            }
            case "Name" -> new SyntaxNode.Name(string(fields, "identifier", path));
            case "Constant" -> constant(fields, path);
            case "Expr" -> new SyntaxNode.Expr(node(fields, "value", path));
            default -> new SyntaxNode.Unsupported(kind);
        };
    }

    private SyntaxNode compare(MutableMap<String, Object> fields, String path) {
        ImmutableList<CompareOperator> ops = list(fields, "ops", path)
                .collect(op -> lookup(op, path + ".ops", CompareOperator::fromAstName))
                .toImmutable();
        ImmutableList<SyntaxNode> comparators = nodes(fields, "comparators", path);
        if (ops.size() != comparators.size() || ops.isEmpty()) {
            throw new ParseException("Compare at " + path + " needs one comparator per operator");
        }
        return new SyntaxNode.Compare(node(fields, "left", path), ops, comparators);
    }

    private ImmutableList<SyntaxNode> targets(MutableMap<String, Object> fields, String path) {
        ImmutableList<SyntaxNode> targets = nodes(fields, "targets", path);
        targets.forEachWithIndex((target, index) -> {
            if (!(target instanceof SyntaxNode.Name)) {
                throw new ParseException("Assign target at " + path + ".targets[" + index + "] must be a Name, found "
                        + target.getClass().getSimpleName());
            }
        });
        return targets;
    }

    private SyntaxNode constant(MutableMap<String, Object> fields, String path) {
        Object value = fields.get("value");
        if (value instanceof BigInteger integer) {
            return SyntaxNode.Constant.of(integer);
        }
        if (value instanceof Double number) {
            return SyntaxNode.Constant.of(number);
        }
        if (value instanceof String text) {
            return SyntaxNode.Constant.of(text);
        }
        throw new ParseException("Constant at " + path + " must hold a number or a string, found " + describe(value));
    }

    private SyntaxNode node(MutableMap<String, Object> fields, String field, String path) {
        if (!fields.containsKey(field)) {
            throw new ParseException("Missing field '" + field + "' at " + path);
        }
        return toNode(fields.get(field), path + "." + field);
    }

    private ImmutableList<SyntaxNode> nodes(MutableMap<String, Object> fields, String field, String path) {
        MutableList<Object> elements = list(fields, field, path);
        MutableList<SyntaxNode> result = Lists.mutable.withInitialCapacity(elements.size());
        elements.forEachWithIndex((element, index) -> result.add(toNode(element, path + "." + field + "[" + index + "]")));
        return result.toImmutable();
    }

    @SuppressWarnings("unchecked")
    private MutableList<Object> list(MutableMap<String, Object> fields, String field, String path) {
        Object value = fields.get(field);
        if (!(value instanceof MutableList)) {
            throw new ParseException("Field '" + field + "' at " + path + " must be an array, found " + describe(value));
        }
        return (MutableList<Object>) value;
    }

    private String string(MutableMap<String, Object> fields, String field, String path) {
        Object value = fields.get(field);
        if (!(value instanceof String text)) {
            throw new ParseException("Field '" + field + "' at " + path + " must be a string, found " + describe(value));
        }
        return text;
    }

    private <T> T operator(MutableMap<String, Object> fields, String field, String path,
                           Function<String, Optional<T>> lookup) {
        return lookup(fields.get(field), path + "." + field, lookup);
    }

    private <T> T lookup(Object name, String path, Function<String, Optional<T>> lookup) {
        if (!(name instanceof String text)) {
            throw new ParseException("Operator at " + path + " must be a string, found " + describe(name));
        }
        return lookup.apply(text)
                .orElseThrow(() -> new ParseException("Unknown operator '" + text + "' at " + path));
    }

    private static String describe(Object value) {
        if (value == null) {
            return "nothing";
        }
        if (value == JsonNull.INSTANCE) {
            return "null";
        }
        return value.getClass().getSimpleName();
    }

    private enum JsonNull {
        INSTANCE
    }
}
