package com.lumi.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.global.error.ValidationProblemException;

import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    private static final int MAX_LENGTH = 128;

    private final AuthProperties.Password config;

    public PasswordPolicy(AuthProperties authProperties) {
        this.config = authProperties.getPassword();
    }

    public List<String> findIssues(String password) {
        List<String> issues = new ArrayList<>();
        if (password == null || password.length() < config.getMinLength()) {
            issues.add("Password must be at least " + config.getMinLength() + " characters long");
            if (password == null) {
                return issues;
            }
        }
        if (password.length() > MAX_LENGTH) {
            issues.add("Password must be at most " + MAX_LENGTH + " characters long");
        }
        if (config.isRequireUppercase() && password.chars().noneMatch(Character::isUpperCase)) {
            issues.add("Password must contain an uppercase letter");
        }
        if (config.isRequireLowercase() && password.chars().noneMatch(Character::isLowerCase)) {
            issues.add("Password must contain a lowercase letter");
        }
        if (config.isRequireDigit() && password.chars().noneMatch(Character::isDigit)) {
            issues.add("Password must contain a digit");
        }
        if (config.isRequireSpecial() && password.chars().allMatch(Character::isLetterOrDigit)) {
            issues.add("Password must contain a special character");
        }
        return issues;
    }

    public void assertAcceptable(String password) {
        List<String> issues = findIssues(password);
        if (!issues.isEmpty()) {
            throw new ValidationProblemException("weak_password", "Password does not meet the password policy",
                    Map.of("issues", issues));
        }
    }
}
