package com.github.salilvnair.toolhub.engine.validation;

public record ContractViolation(String parameter, String reason) {
}
