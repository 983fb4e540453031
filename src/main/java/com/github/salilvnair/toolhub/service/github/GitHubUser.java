package com.github.salilvnair.toolhub.service.github;

public record GitHubUser(long id, String username, String email, String role) {
}
