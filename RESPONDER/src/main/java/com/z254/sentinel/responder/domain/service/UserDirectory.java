package com.z254.sentinel.responder.domain.service;

import com.z254.sentinel.responder.config.ResponderProperties;
import com.z254.sentinel.responder.domain.model.User;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Users and their approval roles, loaded from {@code responder.users}.
 */
@Service
public class UserDirectory {

    private final Map<String, User> users = new LinkedHashMap<>();

    public UserDirectory(ResponderProperties properties) {
        properties.getUsers().forEach(entry ->
                users.put(entry.getName(), new User(entry.getName(), entry.getRole(), entry.isFinalAuthority())));
    }

    public Optional<User> find(String name) {
        return Optional.ofNullable(name).map(users::get);
    }

    public List<User> all() {
        return List.copyOf(users.values());
    }

    public List<User> finalAuthorities() {
        return users.values().stream().filter(User::isFinalAuthority).toList();
    }
}
