package com.arbor.adapter.spring;

import com.arbor.input.BindingMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Spring Boot configuration properties for Arbor.
 */
@ConfigurationProperties(prefix = "arbor")
public class ArborProperties {

    /**
     * Whether Arbor is enabled.
     */
    private boolean enabled = true;

    /**
     * Decision tree files loaded at start-up.
     * Supports classpath: prefix for classpath resources.
     */
    private List<String> treeLocations = new ArrayList<>(List.of(
            "classpath:trees/loan.yaml",
            "classpath:trees/loan-purpose.yaml",
            "classpath:trees/blood-pressure.yaml",
            "classpath:trees/atrial-fibrillation.yaml",
            "classpath:trees/bradycardia-evaluation.yaml",
            "classpath:trees/bradycardia-monitoring.yaml"));

    /**
     * How question nodes are bound to inputs.
     */
    private BindingMode bindingMode = BindingMode.DECLARED;

    /**
     * Whether loaded trees are checked for unregistered operator symbols.
     */
    private boolean validateOnLoad = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getTreeLocations() {
        return treeLocations;
    }

    public void setTreeLocations(List<String> treeLocations) {
        this.treeLocations = treeLocations;
    }

    public BindingMode getBindingMode() {
        return bindingMode;
    }

    public void setBindingMode(BindingMode bindingMode) {
        this.bindingMode = bindingMode;
    }

    public boolean isValidateOnLoad() {
        return validateOnLoad;
    }

    public void setValidateOnLoad(boolean validateOnLoad) {
        this.validateOnLoad = validateOnLoad;
    }
}
