package com.arbor.lookup;

import com.arbor.catalog.DecisionTreeCatalog;
import com.arbor.core.EvaluationContext;
import com.arbor.core.EvaluationContextFactory;
import com.arbor.engine.DecisionEngine;
import com.arbor.engine.EvaluationResult;
import com.arbor.tree.DecisionTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Typed entry points for the bundled trees, as exposed to tool-call callers.
 */
public class TreeLookupService {

    private static final Logger log = LoggerFactory.getLogger(TreeLookupService.class);

    public static final String LOAN_TREE = "loan";
    public static final String LOAN_PURPOSE_TREE = "loan-purpose";
    public static final String BLOOD_PRESSURE_TREE = "blood-pressure";
    public static final String ATRIAL_FIBRILLATION_TREE = "atrial-fibrillation";
    public static final String BRADYCARDIA_EVALUATION_TREE = "bradycardia-evaluation";
    public static final String BRADYCARDIA_MONITORING_TREE = "bradycardia-monitoring";

    private static final String PURPOSE = "purpose";

    private final DecisionEngine engine;
    private final DecisionTreeCatalog catalog;

    public TreeLookupService(DecisionEngine engine, DecisionTreeCatalog catalog) {
        this.engine = engine;
        this.catalog = catalog;
    }

    public EvaluationResult loan(int creditScore, int income, int requestedAmount) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("credit_score", creditScore);
        inputs.put("income", income);
        inputs.put("requested_amount", requestedAmount);
        return lookup(LOAN_TREE, inputs);
    }

    public EvaluationResult loanByPurpose(LoanPurpose purpose, int creditScore, String country) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put(PURPOSE, purpose);
        inputs.put("credit_score", creditScore);
        inputs.put("country", country);
        return lookup(LOAN_PURPOSE_TREE, inputs);
    }

    public EvaluationResult bloodPressure(int systolic, int diastolic) {
        log.debug("Received systolic: {}, diastolic: {}", systolic, diastolic);
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("systolic_blood_pressure", systolic);
        inputs.put("diastolic_blood_pressure", diastolic);
        return lookup(BLOOD_PRESSURE_TREE, inputs);
    }

    public EvaluationResult atrialFibrillation(int systolic, int diastolic, int heartRate,
                                               boolean decompensatedHeartFailure,
                                               boolean rateControlContraindicated,
                                               boolean digoxinContraindicated,
                                               boolean amiodaroneContraindicated) {
        boolean stable = Hemodynamics.isStable(systolic, diastolic, heartRate);
        log.debug("Hemodynamic stability for SBP {}, DBP {}, HR {}: {}", systolic, diastolic, heartRate, stable);

        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("hemodynamically_stable", stable);
        inputs.put("decompensated_heart_failure", decompensatedHeartFailure);
        inputs.put("rate_control_contraindicated", rateControlContraindicated);
        inputs.put("digoxin_contraindicated", digoxinContraindicated);
        inputs.put("amiodarone_contraindicated", amiodaroneContraindicated);
        return lookup(ATRIAL_FIBRILLATION_TREE, inputs);
    }

    /**
     * Evaluate any catalog tree.
     *
     * @throws com.arbor.exception.AuthoringException if the tree is unknown
     */
    public EvaluationResult lookup(String treeName, Map<String, ?> inputs) {
        return evaluate(treeName, EvaluationContext.of(inputs));
    }

    /**
     * Evaluate any catalog tree with inputs given as a JSON object.
     */
    public EvaluationResult lookupJson(String treeName, String jsonInputs) {
        return evaluate(treeName, EvaluationContextFactory.fromJson(jsonInputs));
    }

    private EvaluationResult evaluate(String treeName, EvaluationContext inputs) {
        DecisionTree tree = catalog.get(treeName);
        if (LOAN_PURPOSE_TREE.equals(treeName)) {
            inputs = withTypedPurpose(inputs);
        }
        return engine.evaluate(tree, inputs);
    }

    /**
     * Replace purpose text such as {@code "car"} with its {@link LoanPurpose}.
     * Unknown text is left as is and reported by the tree as an invalid value.
     */
    private static EvaluationContext withTypedPurpose(EvaluationContext inputs) {
        Optional<LoanPurpose> purpose = inputs.get(PURPOSE)
                .filter(String.class::isInstance)
                .flatMap(text -> LoanPurpose.fromValue((String) text));
        if (purpose.isEmpty()) {
            return inputs;
        }
        log.debug("Purpose '{}' resolved to {}", inputs.get(PURPOSE).get(), purpose.get());
        Map<String, Object> typed = new LinkedHashMap<>(inputs.asMap());
        typed.put(PURPOSE, purpose.get());
        return EvaluationContext.of(typed);
    }
}
