package com.arbor.config;

import com.arbor.exception.AuthoringException;
import com.arbor.operator.OperatorRegistry;
import com.arbor.tree.BranchKey;
import com.arbor.tree.DecisionTree;
import com.arbor.tree.IntRange;
import com.arbor.tree.Leaf;
import com.arbor.tree.LiteralKey;
import com.arbor.tree.Node;
import com.arbor.tree.OperatorMatch;
import com.arbor.tree.PredicateKey;
import com.arbor.tree.QuestionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Loads decision trees from YAML files.
 * <p>
 * Format:
 * <pre>
 * tree:
 *   name: loan
 *   version: "1.0"
 *   root:
 *     question: What is your credit score?
 *     variable: credit_score
 *     branches:
 *       - when: ["&lt;", 640]          # operator match
 *         then: Declined - Credit score too low
 *       - when: CAR                 # literal
 *         then: { question: ..., branches: [...] }
 *       - predicate: stable         # named predicate from a PredicateCatalog
 *         then: ...
 * </pre>
 * A reference written as {@code {range: [130, 140]}} becomes an {@link IntRange}.
 */
public class TreeLoader {

    private static final Logger log = LoggerFactory.getLogger(TreeLoader.class);

    private TreeLoader() {
    }

    /**
     * Load a tree from a path without named predicates.
     * Supports classpath: prefix for classpath resources.
     */
    public static DecisionTree load(String path) {
        return load(path, PredicateCatalog.empty());
    }

    /**
     * Load a tree from a path.
     *
     * @param path       Path to the tree file, optionally prefixed with classpath:
     * @param predicates Predicates the tree may reference by name
     * @return Loaded tree
     */
    public static DecisionTree load(String path, PredicateCatalog predicates) {
        log.info("Loading decision tree from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parse(inputStream, defaultName(path), predicates);
            }
        } catch (IOException e) {
            throw new AuthoringException("Failed to load decision tree from: " + path, e);
        }
    }

    /**
     * Parse a tree from YAML text.
     */
    public static DecisionTree parse(String yaml, PredicateCatalog predicates) {
        return parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "unnamed", predicates);
    }

    /**
     * Check that every operator symbol used by the tree is registered.
     *
     * @throws AuthoringException listing the unregistered symbols
     */
    public static void validate(DecisionTree tree, OperatorRegistry registry) {
        Set<String> missing = new TreeSet<>();
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(tree.root());
        while (!pending.isEmpty()) {
            if (pending.pop() instanceof QuestionNode question) {
                question.branches().forEach(branch -> {
                    if (branch.key() instanceof OperatorMatch match && !registry.contains(match.symbol())) {
                        missing.add(match.symbol());
                    }
                    pending.push(branch.target());
                });
            }
        }
        if (!missing.isEmpty()) {
            throw new AuthoringException("Tree '" + tree.name() + "' uses unregistered operators " + missing);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    private static String defaultName(String path) {
        String fileName = path.substring(Math.max(path.lastIndexOf('/'), path.lastIndexOf(':')) + 1);
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    @SuppressWarnings("unchecked")
    private static DecisionTree parse(InputStream inputStream, String defaultName, PredicateCatalog predicates) {
        Object loaded;
        try {
            loaded = new Yaml().load(inputStream);
        } catch (YAMLException e) {
            throw new AuthoringException("Decision tree is not valid YAML: " + e.getMessage(), e);
        }
        if (!(loaded instanceof Map)) {
            throw new AuthoringException("Decision tree file is empty or not a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // The tree section may sit at the root or under a 'tree' key
        Map<String, Object> treeMap = root.get("tree") instanceof Map
                ? (Map<String, Object>) root.get("tree")
                : root;

        String name = getString(treeMap, "name", defaultName);
        String version = getString(treeMap, "version", "1.0");
        Object rootNode = treeMap.get("root");
        if (rootNode == null) {
            throw new AuthoringException("Decision tree '" + name + "' has no root");
        }

        DecisionTree tree = new DecisionTree(name, version, parseNode(rootNode, predicates));
        log.info("Loaded decision tree: {} v{}", name, version);
        return tree;
    }

    @SuppressWarnings("unchecked")
    private static Node parseNode(Object raw, PredicateCatalog predicates) {
        if (!(raw instanceof Map<?, ?> map) || !(map.containsKey("question") || map.containsKey("branches"))) {
            return Leaf.parse(String.valueOf(raw));
        }

        Map<String, Object> nodeMap = (Map<String, Object>) map;
        String question = getString(nodeMap, "question", null);
        if (question == null || question.isBlank()) {
            throw new AuthoringException("Malformed node: question text is required, got " + nodeMap.keySet());
        }
        if (!(nodeMap.get("branches") instanceof List<?> branchList) || branchList.isEmpty()) {
            throw new AuthoringException("Malformed node '" + question + "': branches must be a non-empty list");
        }

        QuestionNode.Builder builder = QuestionNode.builder(question)
                .variable(getString(nodeMap, "variable", null));
        for (Object item : branchList) {
            if (!(item instanceof Map)) {
                throw new AuthoringException("Malformed branch under '" + question + "': " + item);
            }
            Map<String, Object> branchMap = (Map<String, Object>) item;
            if (!branchMap.containsKey("then")) {
                throw new AuthoringException("Branch under '" + question + "' has no 'then'");
            }
            if (branchMap.get("then") == null) {
                throw new AuthoringException("Branch under '" + question + "' has an empty 'then'");
            }
            builder.branch(parseKey(branchMap, question, predicates), parseNode(branchMap.get("then"), predicates));
        }
        return builder.build();
    }

    private static BranchKey parseKey(Map<String, Object> branchMap, String question, PredicateCatalog predicates) {
        boolean hasWhen = branchMap.containsKey("when");
        boolean hasPredicate = branchMap.containsKey("predicate");
        if (hasWhen == hasPredicate) {
            throw new AuthoringException("Branch under '" + question
                    + "' must have exactly one of 'when' or 'predicate'");
        }

        if (hasPredicate) {
            String name = getString(branchMap, "predicate", "");
            Predicate<Object> predicate = predicates.get(name)
                    .orElseThrow(() -> new AuthoringException("Branch under '" + question
                            + "' references unknown predicate '" + name + "'"));
            return PredicateKey.of(name, predicate);
        }

        Object when = branchMap.get("when");
        if (when instanceof List<?> list && list.size() == 2 && list.get(0) instanceof String symbol) {
            return new OperatorMatch(symbol, parseValue(list.get(1)));
        }
        return new LiteralKey(parseValue(when));
    }

    private static Object parseValue(Object raw) {
        if (raw instanceof Map<?, ?> map && map.size() == 1 && map.get("range") instanceof List<?> bounds) {
            if (bounds.size() != 2 || !(bounds.get(0) instanceof Number from) || !(bounds.get(1) instanceof Number to)) {
                throw new AuthoringException("Range requires two numeric bounds, got " + bounds);
            }
            return IntRange.of(from.longValue(), to.longValue());
        }
        if (raw instanceof List<?> list) {
            List<Object> values = new ArrayList<>(list.size());
            for (Object item : list) {
                values.add(parseValue(item));
            }
            return Collections.unmodifiableList(values);
        }
        return raw;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }
}
