package com.github.salilvnair.toolhub.service.linear;

public record LinearMember(String id, String name, String email, boolean active) {
}
