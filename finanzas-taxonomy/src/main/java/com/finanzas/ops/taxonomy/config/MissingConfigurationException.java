package com.finanzas.ops.taxonomy.config;

import com.finanzas.ops.taxonomy.TaxonomyOpsException;
import lombok.Getter;

/**
 * Raised when a mutating operation is started without the configuration it requires.
 */
@Getter
public class MissingConfigurationException extends TaxonomyOpsException {

    private final String variable;

    public MissingConfigurationException(String variable, String purpose) {
        super(String.format("%s is required for %s (set %s env var or pass the matching option)",
                variable, purpose, variable));
        this.variable = variable;
    }
}
