package com.zzf.coder.core.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Typed argument schema of a tool. Validation reports every violation at once
 * so the model can fix all of them in a single retry.
 */
public final class ToolSchema {

    public enum Type {
        STRING, INTEGER, NUMBER, BOOLEAN, ARRAY, OBJECT, ANY;

        String jsonName() {
            return name().toLowerCase(Locale.ROOT);
        }

        static Type fromJson(JsonNode typeNode) {
            if (typeNode == null || typeNode.isMissingNode() || typeNode.isNull()) {
                return ANY;
            }
            if (typeNode.isArray()) {
                for (JsonNode candidate : typeNode) {
                    if (!"null".equals(candidate.asText())) {
                        return fromJson(candidate);
                    }
                }
                return ANY;
            }
            try {
                return Type.valueOf(typeNode.asText("").toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return ANY;
            }
        }

        boolean matches(JsonNode value) {
            switch (this) {
                case STRING:
                    return value.isTextual();
                case INTEGER:
                    return value.isIntegralNumber()
                            || (value.isNumber() && value.asDouble() == Math.rint(value.asDouble()));
                case NUMBER:
                    return value.isNumber();
                case BOOLEAN:
                    return value.isBoolean();
                case ARRAY:
                    return value.isArray();
                case OBJECT:
                    return value.isObject();
                default:
                    return true;
            }
        }
    }

    @Getter
    public static final class Property {
        private final String name;
        private final Type type;
        private final String description;
        private final boolean required;
        private final List<String> enumValues;
        private final Type itemType;
        private final ToolSchema itemSchema;

        private Property(String name, Type type, String description, boolean required,
                         List<String> enumValues, Type itemType, ToolSchema itemSchema) {
            this.name = name;
            this.type = type;
            this.description = description;
            this.required = required;
            this.enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
            this.itemType = itemType;
            this.itemSchema = itemSchema;
        }
    }

    private final Map<String, Property> properties;
    private final boolean additionalProperties;
    private final JsonNode raw;

    private ToolSchema(Map<String, Property> properties, boolean additionalProperties, JsonNode raw) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        this.additionalProperties = additionalProperties;
        this.raw = raw;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Property> getProperties() {
        return properties;
    }

    public boolean isAdditionalProperties() {
        return additionalProperties;
    }

    /**
     * Returns every violation found in {@code args}; an empty list means valid.
     * Explicit JSON nulls count as absent.
     */
    public List<String> validate(JsonNode args) {
        List<String> violations = new ArrayList<>();
        if (args == null || args.isNull() || args.isMissingNode()) {
            args = JsonNodeFactory.instance.objectNode();
        }
        if (!args.isObject()) {
            violations.add("arguments must be a JSON object");
            return violations;
        }
        validateObject(args, "", violations);
        return violations;
    }

    private void validateObject(JsonNode args, String prefix, List<String> violations) {
        for (Property property : properties.values()) {
            JsonNode value = args.get(property.name);
            if (value == null || value.isNull()) {
                if (property.required) {
                    violations.add("missing required argument '" + prefix + property.name + "'");
                }
                continue;
            }
            validateValue(property, value, prefix + property.name, violations);
        }
        if (!additionalProperties) {
            Iterator<String> names = args.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!properties.containsKey(name)) {
                    violations.add("unexpected argument '" + prefix + name + "'");
                }
            }
        }
    }

    private void validateValue(Property property, JsonNode value, String path, List<String> violations) {
        if (!property.type.matches(value)) {
            violations.add("argument '" + path + "' must be of type " + property.type.jsonName()
                    + " but was " + describe(value));
            return;
        }
        if (!property.enumValues.isEmpty() && !property.enumValues.contains(value.asText())) {
            violations.add("argument '" + path + "' must be one of " + property.enumValues
                    + " but was '" + value.asText() + "'");
        }
        if (property.type == Type.ARRAY) {
            for (int i = 0; i < value.size(); i++) {
                JsonNode item = value.get(i);
                String itemPath = path + "[" + i + "]";
                if (property.itemSchema != null) {
                    if (!item.isObject()) {
                        violations.add("argument '" + itemPath + "' must be of type object but was " + describe(item));
                    } else {
                        property.itemSchema.validateObject(item, itemPath + ".", violations);
                    }
                } else if (property.itemType != null && !property.itemType.matches(item)) {
                    violations.add("argument '" + itemPath + "' must be of type " + property.itemType.jsonName()
                            + " but was " + describe(item));
                }
            }
        }
    }

    private static String describe(JsonNode value) {
        if (value.isTextual()) {
            return "string";
        }
        if (value.isIntegralNumber()) {
            return "integer";
        }
        if (value.isNumber()) {
            return "number";
        }
        if (value.isBoolean()) {
            return "boolean";
        }
        if (value.isArray()) {
            return "array";
        }
        if (value.isObject()) {
            return "object";
        }
        return value.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    /** JSON Schema rendering for the tool catalog; schemas imported from JSON are returned as given. */
    public ObjectNode toJsonSchema() {
        if (raw != null && raw.isObject()) {
            return ((ObjectNode) raw).deepCopy();
        }
        JsonNodeFactory f = JsonNodeFactory.instance;
        ObjectNode schema = f.objectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        ArrayNode required = f.arrayNode();
        for (Property property : properties.values()) {
            ObjectNode p = props.putObject(property.name);
            if (property.type != Type.ANY) {
                p.put("type", property.type.jsonName());
            }
            if (property.description != null && !property.description.isEmpty()) {
                p.put("description", property.description);
            }
            if (!property.enumValues.isEmpty()) {
                ArrayNode values = p.putArray("enum");
                property.enumValues.forEach(values::add);
            }
            if (property.itemSchema != null) {
                p.set("items", property.itemSchema.toJsonSchema());
            } else if (property.itemType != null) {
                p.putObject("items").put("type", property.itemType.jsonName());
            }
            if (property.required) {
                required.add(property.name);
            }
        }
        if (required.size() > 0) {
            schema.set("required", required);
        }
        schema.put("additionalProperties", additionalProperties);
        return schema;
    }

    /**
     * Reads a JSON Schema object (as published by MCP servers). Unknown keywords are ignored;
     * {@code additionalProperties} defaults to true as in JSON Schema.
     */
    public static ToolSchema fromJsonSchema(JsonNode schema) {
        Builder builder = builder();
        if (schema == null || !schema.isObject()) {
            return builder.additionalProperties(true).build();
        }
        Set<String> required = new HashSet<>();
        for (JsonNode name : schema.path("required")) {
            required.add(name.asText());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = schema.path("properties").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode def = field.getValue();
            List<String> enumValues = new ArrayList<>();
            for (JsonNode v : def.path("enum")) {
                enumValues.add(v.asText());
            }
            Type type = Type.fromJson(def.get("type"));
            Type itemType = null;
            ToolSchema itemSchema = null;
            if (type == Type.ARRAY && def.has("items")) {
                JsonNode items = def.get("items");
                itemType = Type.fromJson(items.get("type"));
                if (itemType == Type.OBJECT && items.has("properties")) {
                    itemSchema = fromJsonSchema(items);
                }
            }
            builder.property(new Property(field.getKey(), type, def.path("description").asText(""),
                    required.contains(field.getKey()), enumValues, itemType, itemSchema));
        }
        JsonNode additional = schema.get("additionalProperties");
        builder.additionalProperties(additional == null || !additional.isBoolean() || additional.asBoolean());
        builder.raw = schema.deepCopy();
        return builder.build();
    }

    public static final class Builder {
        private final Map<String, Property> properties = new LinkedHashMap<>();
        private boolean additionalProperties = false;
        private JsonNode raw;

        private Builder property(Property property) {
            properties.put(property.name, property);
            return this;
        }

        public Builder required(String name, Type type, String description) {
            return property(new Property(name, type, description, true, null, null, null));
        }

        public Builder optional(String name, Type type, String description) {
            return property(new Property(name, type, description, false, null, null, null));
        }

        public Builder requiredEnum(String name, String description, List<String> values) {
            return property(new Property(name, Type.STRING, description, true, values, null, null));
        }

        public Builder optionalEnum(String name, String description, List<String> values) {
            return property(new Property(name, Type.STRING, description, false, values, null, null));
        }

        public Builder optionalArray(String name, Type itemType, String description) {
            return property(new Property(name, Type.ARRAY, description, false, null, itemType, null));
        }

        public Builder requiredArray(String name, ToolSchema itemSchema, String description) {
            return property(new Property(name, Type.ARRAY, description, true, null, Type.OBJECT, itemSchema));
        }

        public Builder additionalProperties(boolean allowed) {
            this.additionalProperties = allowed;
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(properties, additionalProperties, raw);
        }
    }
}
