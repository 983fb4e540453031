package com.github.salilvnair.toolhub.engine.validation;

import com.github.salilvnair.toolhub.engine.ToolHubConstants;
import com.github.salilvnair.toolhub.engine.model.InputContract;
import com.github.salilvnair.toolhub.engine.model.ParameterSpec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class InputContractValidator {

    private static final Set<String> KNOWN_TYPES = Set.of(
            ToolHubConstants.PARAM_TYPE_STRING,
            ToolHubConstants.PARAM_TYPE_INTEGER,
            ToolHubConstants.PARAM_TYPE_NUMBER,
            ToolHubConstants.PARAM_TYPE_BOOLEAN,
            ToolHubConstants.PARAM_TYPE_ARRAY,
            ToolHubConstants.PARAM_TYPE_OBJECT
    );

    /**
     * Checks params against the contract. Returns an empty list when the params are acceptable.
     */
    public List<ContractViolation> validate(InputContract contract, Map<String, Object> params) {
        if (contract == null) {
            return List.of();
        }
        Map<String, Object> safeParams = params == null ? Map.of() : params;
        List<ContractViolation> violations = new ArrayList<>();

        for (String name : contract.required()) {
            if (!safeParams.containsKey(name) || safeParams.get(name) == null) {
                violations.add(new ContractViolation(name, "is required"));
            }
        }

        for (Map.Entry<String, Object> entry : safeParams.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            ParameterSpec spec = contract.properties().get(name);
            if (spec == null) {
                if (!contract.additionalProperties()) {
                    violations.add(new ContractViolation(name, "is not an accepted parameter"));
                }
                continue;
            }
            // null for an optional param means "not supplied"
            if (value == null || spec.type() == null) {
                continue;
            }
            if (!matchesType(spec.type(), value)) {
                violations.add(new ContractViolation(name, "must be of type " + spec.type()));
            } else if (ToolHubConstants.PARAM_TYPE_INTEGER.equals(spec.type()) && !fitsInLong(value)) {
                violations.add(new ContractViolation(name, "is out of range for type integer"));
            }
        }
        return violations;
    }

    /**
     * Checks that a contract is well formed. Used at registration time, so a broken contract
     * is reported to the registering caller instead of surfacing on every execution.
     */
    public List<String> validateDefinition(InputContract contract) {
        if (contract == null) {
            return List.of();
        }
        List<String> problems = new ArrayList<>();
        if (!ToolHubConstants.CONTRACT_TYPE_OBJECT.equals(contract.type())) {
            problems.add("contract type must be '" + ToolHubConstants.CONTRACT_TYPE_OBJECT + "' but was '" + contract.type() + "'");
        }
        contract.properties().forEach((name, spec) -> {
            if (name == null || name.isBlank()) {
                problems.add("parameter name must be non-blank");
            } else if (spec == null || spec.type() == null || !KNOWN_TYPES.contains(spec.type())) {
                problems.add("parameter '" + name + "' has unsupported type " + (spec == null ? null : spec.type()));
            }
        });
        for (String name : contract.required()) {
            if (!contract.properties().containsKey(name)) {
                problems.add("required parameter '" + name + "' is not declared in properties");
            }
        }
        return problems;
    }

    private boolean matchesType(String type, Object value) {
        return switch (type) {
            case ToolHubConstants.PARAM_TYPE_STRING -> value instanceof CharSequence;
            case ToolHubConstants.PARAM_TYPE_INTEGER -> isIntegral(value);
            case ToolHubConstants.PARAM_TYPE_NUMBER -> value instanceof Number;
            case ToolHubConstants.PARAM_TYPE_BOOLEAN -> value instanceof Boolean;
            case ToolHubConstants.PARAM_TYPE_ARRAY -> value instanceof Collection<?> || value.getClass().isArray();
            case ToolHubConstants.PARAM_TYPE_OBJECT -> value instanceof Map<?, ?>;
            default -> true;
        };
    }

    private boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.stripTrailingZeros().scale() <= 0;
        }
        return false;
    }

    private boolean fitsInLong(Object value) {
        if (value instanceof BigInteger big) {
            return big.bitLength() < Long.SIZE;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toBigInteger().bitLength() < Long.SIZE;
        }
        return true;
    }
}
