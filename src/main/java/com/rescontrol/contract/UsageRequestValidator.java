package com.rescontrol.contract;

import org.springframework.stereotype.Component;

@Component
public class UsageRequestValidator {

    /**
     * @param requireUsageId authorize, allocate and release need a usage ID; resource lookups do not
     */
    public void validate(UsageRequest request, boolean requireUsageId) {
        if (request == null) {
            throw new ContractViolationException("request cannot be null");
        }
        requireString(request.tenant(), "tenant is required");
        if (requireUsageId) {
            requireString(request.usageId(), "usage_id is required");
        }
        if (request.units() != null) {
            double units = request.units();
            if (Double.isNaN(units) || Double.isInfinite(units) || units <= 0) {
                throw new ContractViolationException("units must be a positive number");
            }
        }
        if (request.usageTtl() != null && request.usageTtl().isNegative()) {
            throw new ContractViolationException("usage_ttl must not be negative");
        }
    }

    private void requireString(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ContractViolationException(message);
        }
    }
}
