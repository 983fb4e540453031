package com.github.salilvnair.toolhub.service.linear;

public record LinearTeam(String id, String name, String key, String description) {
}
