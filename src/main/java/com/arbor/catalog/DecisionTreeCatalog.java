package com.arbor.catalog;

import com.arbor.config.PredicateCatalog;
import com.arbor.config.TreeLoader;
import com.arbor.exception.AuthoringException;
import com.arbor.operator.OperatorRegistry;
import com.arbor.tree.DecisionTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Named decision trees, loaded once and read-only afterwards.
 */
public class DecisionTreeCatalog {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeCatalog.class);

    private final Map<String, DecisionTree> trees;

    private DecisionTreeCatalog(Map<String, DecisionTree> trees) {
        this.trees = Collections.unmodifiableMap(trees);
    }

    /**
     * Load every tree location and index the trees by name.
     *
     * @param locations  Tree file paths (classpath: prefix supported)
     * @param predicates Named predicates available to the trees
     * @param registry   Registry to validate operator symbols against, or null to skip validation
     * @return Catalog of the loaded trees
     * @throws AuthoringException if a tree cannot be loaded, a name repeats, or validation fails
     */
    public static DecisionTreeCatalog load(List<String> locations, PredicateCatalog predicates,
                                           OperatorRegistry registry) {
        Map<String, DecisionTree> trees = new LinkedHashMap<>();
        for (String location : locations) {
            DecisionTree tree = TreeLoader.load(location, predicates);
            if (registry != null) {
                TreeLoader.validate(tree, registry);
            }
            if (trees.putIfAbsent(tree.name(), tree) != null) {
                throw new AuthoringException("Duplicate decision tree name '" + tree.name() + "' in " + location);
            }
        }
        log.info("Decision tree catalog ready with {} trees: {}", trees.size(), trees.keySet());
        return new DecisionTreeCatalog(trees);
    }

    /**
     * Create a catalog from trees built in code.
     */
    public static DecisionTreeCatalog of(Collection<DecisionTree> trees) {
        Map<String, DecisionTree> indexed = new LinkedHashMap<>();
        for (DecisionTree tree : trees) {
            if (indexed.putIfAbsent(tree.name(), tree) != null) {
                throw new AuthoringException("Duplicate decision tree name '" + tree.name() + "'");
            }
        }
        return new DecisionTreeCatalog(indexed);
    }

    /**
     * Get a tree by name.
     *
     * @throws AuthoringException if no tree has the name
     */
    public DecisionTree get(String name) {
        return find(name).orElseThrow(() -> new AuthoringException(
                "Unknown decision tree '" + name + "'. Known trees: " + trees.keySet()));
    }

    public Optional<DecisionTree> find(String name) {
        return Optional.ofNullable(trees.get(name));
    }

    public Set<String> names() {
        return trees.keySet();
    }

    public int size() {
        return trees.size();
    }
}
