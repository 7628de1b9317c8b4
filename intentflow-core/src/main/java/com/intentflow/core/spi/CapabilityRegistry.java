package com.intentflow.core.spi;

import com.intentflow.core.model.ActionDescriptor;

/**
 * Which actions have a registered executor. Checked when a plan is validated.
 */
@FunctionalInterface
public interface CapabilityRegistry {

    boolean supports(ActionDescriptor action);
}
