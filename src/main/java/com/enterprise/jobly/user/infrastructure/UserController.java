package com.enterprise.jobly.user.infrastructure;

import com.enterprise.jobly.user.application.UserService;
import com.enterprise.jobly.user.domain.User;
import com.enterprise.jobly.user.domain.UserDetail;

import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/users")
public class UserController {

    private final UserService users;

    public UserController(UserService users) {
        this.users = users;
    }

    @GetMapping
    public Map<String, List<User>> findAll() {
        return Map.of("users", users.findAll());
    }

    @GetMapping("/{username}")
    public Map<String, UserDetail> get(@PathVariable String username) {
        return Map.of("user", users.get(username));
    }

    @PatchMapping("/{username}")
    public Map<String, User> update(@PathVariable String username, @RequestBody Map<String, Object> data) {
        return Map.of("user", users.update(username, data));
    }

    @DeleteMapping("/{username}")
    public Map<String, String> remove(@PathVariable String username) {
        users.remove(username);
        return Map.of("deleted", username);
    }

    @PostMapping("/{username}/jobs/{id}")
    public Map<String, Integer> apply(@PathVariable String username, @PathVariable int id) {
        users.applyToJob(username, id);
        return Map.of("applied", id);
    }
}
