package com.arbor.input;

import com.arbor.core.EvaluationContext;
import com.arbor.tree.QuestionNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Default implementation of InputResolver.
 * <p>
 * A declared variable is authoritative: when it is missing from the context the question is
 * unanswered, with no fallback. The substring fallback applies only to nodes without a
 * declared variable, and only in {@link BindingMode#DECLARED_WITH_SUBSTRING_FALLBACK}.
 */
public class DefaultInputResolver implements InputResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultInputResolver.class);

    private final BindingMode bindingMode;

    public DefaultInputResolver() {
        this(BindingMode.DECLARED);
    }

    public DefaultInputResolver(BindingMode bindingMode) {
        this.bindingMode = bindingMode == null ? BindingMode.DECLARED : bindingMode;
    }

    public BindingMode getBindingMode() {
        return bindingMode;
    }

    @Override
    public Optional<ResolvedInput> resolve(QuestionNode node, EvaluationContext context) {
        Optional<String> declared = node.declaredVariable();
        if (declared.isPresent()) {
            String name = declared.get();
            return context.get(name)
                    .map(value -> new ResolvedInput(name, InputResolver.subjectOf(name), value));
        }

        if (bindingMode != BindingMode.DECLARED_WITH_SUBSTRING_FALLBACK) {
            log.debug("Question '{}' declares no variable and substring fallback is disabled", node.question());
            return Optional.empty();
        }
        return resolveBySubstring(node, context);
    }

    private Optional<ResolvedInput> resolveBySubstring(QuestionNode node, EvaluationContext context) {
        String question = node.question();
        List<String> candidates = new ArrayList<>();
        for (String name : context.names()) {
            if (question.contains(InputResolver.subjectOf(name))) {
                candidates.add(name);
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        if (candidates.size() > 1) {
            log.warn("Question '{}' matches several inputs {}, binding the first: {}",
                    question, candidates, candidates.get(0));
        }

        String name = candidates.get(0);
        return context.get(name)
                .map(value -> new ResolvedInput(name, InputResolver.subjectOf(name), value));
    }
}
