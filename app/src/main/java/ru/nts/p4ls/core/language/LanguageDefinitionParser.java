/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.p4ls.core.language;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import ru.nts.p4ls.core.LsErrorCode;
import ru.nts.p4ls.core.LsException;
import ru.nts.p4ls.core.ast.NodeKind;

import java.util.*;

/**
 * Разбор JSON документа с набором правил.
 *
 * Варианты (Multiplicity, NodeQuery, DirectOrRule, SymbolRole) записываются
 * как объект с единственным ключом-тегом: {"One": {...}}, {"Kind": "type"},
 * {"Rule": "Type"}, {"Init": "constant"}. Варианты без данных - строкой: "Usage".
 *
 * Любая ошибка формы документа - {@link LsErrorCode#CONFIG_INVALID} с путём до места ошибки.
 */
final class LanguageDefinitionParser {

    // Хвост после документа правил - тоже битый документ
    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private LanguageDefinitionParser() {}

    static LanguageDefinition parse(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new LsException(LsErrorCode.CONFIG_INVALID,
                    Map.of("path", "$", "reason", String.valueOf(e.getOriginalMessage())), e);
        }
        if (root == null || !root.isObject()) {
            throw invalid("$", "document must be a JSON object");
        }

        List<Rule> rules = parseRules(root.path("ast_rules"));
        Map<String, CompletionKind> symbolTypes = parseSymbolTypes(root.path("symbol_types"));

        if (rules.stream().noneMatch(r -> NodeKind.ROOT.name().equals(r.name()))) {
            throw invalid("ast_rules", "rule named 'Root' is required");
        }
        return new LanguageDefinition(rules, symbolTypes);
    }

    private static List<Rule> parseRules(JsonNode node) {
        if (node.isMissingNode()) {
            throw invalid("ast_rules", "required array is missing");
        }
        if (!node.isArray()) {
            throw invalid("ast_rules", "must be an array");
        }
        List<Rule> rules = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            String path = "ast_rules[" + i + "]";
            Rule rule = parseRule(node.get(i), path);
            if (!names.add(rule.name())) {
                throw invalid(path, "duplicate rule name '" + rule.name() + "'");
            }
            rules.add(rule);
        }
        return rules;
    }

    private static Rule parseRule(JsonNode node, String path) {
        if (!node.isObject()) {
            throw invalid(path, "rule must be an object");
        }
        String name = requireText(node.path("name"), path + ".name");

        JsonNode scopeNode = node.path("is_scope");
        boolean isScope = false;
        if (!scopeNode.isMissingNode()) {
            if (!scopeNode.isBoolean()) {
                throw invalid(path + ".is_scope", "must be a boolean");
            }
            isScope = scopeNode.booleanValue();
        }

        SymbolRole symbol = parseSymbolRole(node.path("symbol"), path + ".symbol");

        List<Multiplicity> children = new ArrayList<>();
        JsonNode childrenNode = node.path("children");
        if (!childrenNode.isMissingNode()) {
            if (!childrenNode.isArray()) {
                throw invalid(path + ".children", "must be an array");
            }
            for (int i = 0; i < childrenNode.size(); i++) {
                children.add(parseMultiplicity(childrenNode.get(i), path + ".children[" + i + "]"));
            }
        }
        return new Rule(name, isScope, symbol, children);
    }

    private static SymbolRole parseSymbolRole(JsonNode node, String path) {
        if (node.isMissingNode() || node.isNull()) {
            return SymbolRole.NONE;
        }
        if (node.isTextual()) {
            return switch (node.asText()) {
                case "None" -> SymbolRole.NONE;
                case "Usage" -> SymbolRole.USAGE;
                default -> throw invalid(path, "unknown symbol role '" + node.asText() + "'");
            };
        }
        Map.Entry<String, JsonNode> tagged = singleTag(node, path);
        if (!"Init".equals(tagged.getKey())) {
            throw invalid(path, "unknown symbol role '" + tagged.getKey() + "'");
        }
        return new SymbolRole.Init(requireText(tagged.getValue(), path + ".Init"));
    }

    private static Multiplicity parseMultiplicity(JsonNode node, String path) {
        Map.Entry<String, JsonNode> tagged = singleTag(node, path);
        String childPath = path + "." + tagged.getKey();
        return switch (tagged.getKey()) {
            case "One" -> new Multiplicity.One(parseChild(tagged.getValue(), childPath));
            case "Maybe" -> new Multiplicity.Maybe(parseChild(tagged.getValue(), childPath));
            case "Many" -> new Multiplicity.Many(parseChild(tagged.getValue(), childPath));
            default -> throw invalid(path, "unknown multiplicity '" + tagged.getKey() + "'");
        };
    }

    private static Child parseChild(JsonNode node, String path) {
        if (!node.isObject()) {
            throw invalid(path, "child must be an object");
        }
        NodeQuery query = parseQuery(node.path("query"), path + ".query");
        DirectOrRule target = parseTarget(node.path("rule"), path + ".rule");

        JsonNode usageNode = node.path("symbol_usage");
        boolean symbolUsage = false;
        if (!usageNode.isMissingNode()) {
            if (!usageNode.isBoolean()) {
                throw invalid(path + ".symbol_usage", "must be a boolean");
            }
            symbolUsage = usageNode.booleanValue();
        }
        return new Child(query, target, symbolUsage);
    }

    private static NodeQuery parseQuery(JsonNode node, String path) {
        if (node.isMissingNode()) {
            throw invalid(path, "query is required");
        }
        Map.Entry<String, JsonNode> tagged = singleTag(node, path);
        String valuePath = path + "." + tagged.getKey();
        return switch (tagged.getKey()) {
            case "Kind" -> new NodeQuery.Kind(requireText(tagged.getValue(), valuePath));
            case "Field" -> new NodeQuery.Field(requireText(tagged.getValue(), valuePath));
            case "Path" -> {
                JsonNode steps = tagged.getValue();
                if (!steps.isArray()) {
                    throw invalid(valuePath, "path must be an array of queries");
                }
                List<NodeQuery> parsed = new ArrayList<>();
                for (int i = 0; i < steps.size(); i++) {
                    parsed.add(parseQuery(steps.get(i), valuePath + "[" + i + "]"));
                }
                yield new NodeQuery.Path(parsed);
            }
            default -> throw invalid(path, "unknown query '" + tagged.getKey() + "'");
        };
    }

    private static DirectOrRule parseTarget(JsonNode node, String path) {
        if (node.isMissingNode()) {
            throw invalid(path, "rule target is required");
        }
        Map.Entry<String, JsonNode> tagged = singleTag(node, path);
        String valuePath = path + "." + tagged.getKey();
        return switch (tagged.getKey()) {
            case "Direct" -> new DirectOrRule.Direct(NodeKind.terminal(requireText(tagged.getValue(), valuePath)));
            case "Rule" -> new DirectOrRule.Rule(requireText(tagged.getValue(), valuePath));
            default -> throw invalid(path, "unknown rule target '" + tagged.getKey() + "'");
        };
    }

    private static Map<String, CompletionKind> parseSymbolTypes(JsonNode node) {
        Map<String, CompletionKind> result = new LinkedHashMap<>();
        if (node.isMissingNode()) {
            return result;
        }
        if (!node.isArray()) {
            throw invalid("symbol_types", "must be an array of [rule, kind] pairs");
        }
        for (int i = 0; i < node.size(); i++) {
            String path = "symbol_types[" + i + "]";
            JsonNode pair = node.get(i);
            if (!pair.isArray() || pair.size() != 2) {
                throw invalid(path, "must be a [rule, kind] pair");
            }
            String ruleName = requireText(pair.get(0), path + "[0]");
            String kindName = requireText(pair.get(1), path + "[1]");
            CompletionKind kind = CompletionKind.fromDisplayName(kindName)
                    .orElseThrow(() -> invalid(path + "[1]", "unknown completion kind '" + kindName + "'"));
            result.put(ruleName, kind);
        }
        return result;
    }

    private static Map.Entry<String, JsonNode> singleTag(JsonNode node, String path) {
        if (!node.isObject() || node.size() != 1) {
            throw invalid(path, "expected an object with exactly one variant tag");
        }
        return node.fields().next();
    }

    private static String requireText(JsonNode node, String path) {
        if (!node.isTextual() || node.asText().isBlank()) {
            throw invalid(path, "non-empty string expected");
        }
        return node.asText();
    }

    private static LsException invalid(String path, String reason) {
        return new LsException(LsErrorCode.CONFIG_INVALID, Map.of("path", path, "reason", reason));
    }
}
