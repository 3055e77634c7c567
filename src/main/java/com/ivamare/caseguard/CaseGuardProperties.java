package com.ivamare.caseguard;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Case Guard.
 *
 * <p>Example configuration:
 * <pre>
 * caseguard:
 *   enabled: true
 *   uniqueness:
 *     enabled: true
 *     active-case-constraint: uq_case_active_customer
 *   pipeline:
 *     transaction-timeout-seconds: 10
 * </pre>
 */
@ConfigurationProperties(prefix = "caseguard")
public class CaseGuardProperties {

    /**
     * Enable/disable Case Guard auto-configuration.
     */
    private boolean enabled = true;

    /**
     * One-active-case-per-customer rule.
     */
    private UniquenessProperties uniqueness = new UniquenessProperties();

    /**
     * Create pipeline configuration.
     */
    private PipelineProperties pipeline = new PipelineProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public UniquenessProperties getUniqueness() {
        return uniqueness;
    }

    public void setUniqueness(UniquenessProperties uniqueness) {
        this.uniqueness = uniqueness;
    }

    public PipelineProperties getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineProperties pipeline) {
        this.pipeline = pipeline;
    }

    /**
     * Uniqueness guard configuration.
     */
    public static class UniquenessProperties {

        /**
         * Register the uniqueness guard as a pre-create interceptor.
         * The store-level index still applies when disabled.
         */
        private boolean enabled = true;

        /**
         * Name of the partial unique index over active cases per customer.
         */
        private String activeCaseConstraint = "uq_case_active_customer";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getActiveCaseConstraint() {
            return activeCaseConstraint;
        }

        public void setActiveCaseConstraint(String activeCaseConstraint) {
            this.activeCaseConstraint = activeCaseConstraint;
        }
    }

    /**
     * Create pipeline configuration.
     */
    public static class PipelineProperties {

        /**
         * Timeout in seconds for the create transaction (interceptors and commit).
         * 0 uses the transaction manager's default.
         */
        private int transactionTimeoutSeconds = 0;

        public int getTransactionTimeoutSeconds() {
            return transactionTimeoutSeconds;
        }

        public void setTransactionTimeoutSeconds(int transactionTimeoutSeconds) {
            this.transactionTimeoutSeconds = transactionTimeoutSeconds;
        }
    }
}
