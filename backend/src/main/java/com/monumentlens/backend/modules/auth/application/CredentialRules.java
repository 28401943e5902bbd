package com.monumentlens.backend.modules.auth.application;

import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Input rules for usernames, emails, names and passwords. Each field has a list of named predicates and
 * one error code; adding a rule means adding a list entry.
 */
@Component
public class CredentialRules {

    private static final Pattern USERNAME_PATTERN = Pattern.compile("^[A-Za-z0-9_]{3,20}$");
    private static final Pattern EMAIL_PATTERN =
            Pattern.compile("^[A-Z0-9._%+-]+@[A-Z0-9.-]+\\.[A-Z]{2,}$", Pattern.CASE_INSENSITIVE);

    public static final int PASSWORD_MIN_LENGTH = 8;
    public static final int PASSWORD_MAX_LENGTH = 128;
    public static final int FULL_NAME_MAX_LENGTH = 100;
    public static final int EMAIL_MAX_LENGTH = 320;

    public record Rule(String name, Predicate<String> predicate) {
    }

    public record RuleSet(AuthErrorCode errorCode, List<Rule> rules) {

        public List<String> failures(String value) {
            if (value == null) {
                return List.of("REQUIRED");
            }
            return rules.stream()
                    .filter(rule -> !rule.predicate().test(value))
                    .map(Rule::name)
                    .toList();
        }

        public void enforce(String value) {
            List<String> failed = failures(value);
            if (!failed.isEmpty()) {
                throw new AuthException(errorCode, errorCode.getDefaultDetail() + ": " + String.join(", ", failed));
            }
        }
    }

    public static final RuleSet USERNAME = new RuleSet(AuthErrorCode.INVALID_USERNAME, List.of(
            new Rule("USERNAME_FORMAT", value -> USERNAME_PATTERN.matcher(value).matches())
    ));

    public static final RuleSet EMAIL = new RuleSet(AuthErrorCode.INVALID_EMAIL, List.of(
            new Rule("EMAIL_LENGTH", value -> value.length() <= EMAIL_MAX_LENGTH),
            new Rule("EMAIL_FORMAT", value -> EMAIL_PATTERN.matcher(value).matches())
    ));

    public static final RuleSet FULL_NAME = new RuleSet(AuthErrorCode.INVALID_FULL_NAME, List.of(
            new Rule("FULL_NAME_LENGTH", value -> value.strip().length() <= FULL_NAME_MAX_LENGTH)
    ));

    public static final RuleSet PASSWORD = new RuleSet(AuthErrorCode.WEAK_PASSWORD, List.of(
            new Rule("MIN_LENGTH", value -> value.length() >= PASSWORD_MIN_LENGTH),
            new Rule("MAX_LENGTH", value -> value.length() <= PASSWORD_MAX_LENGTH),
            new Rule("UPPERCASE", value -> value.chars().anyMatch(Character::isUpperCase)),
            new Rule("LOWERCASE", value -> value.chars().anyMatch(Character::isLowerCase)),
            new Rule("DIGIT", value -> value.chars().anyMatch(Character::isDigit)),
            new Rule("SYMBOL", value -> value.chars().anyMatch(CredentialRules::isSymbol))
    ));

    public void checkRegistration(String username, String email, String fullName, String password) {
        USERNAME.enforce(username);
        EMAIL.enforce(email);
        if (fullName != null) {
            FULL_NAME.enforce(fullName);
        }
        PASSWORD.enforce(password);
    }

    public void checkEmail(String email) {
        EMAIL.enforce(email);
    }

    public void checkFullName(String fullName) {
        FULL_NAME.enforce(fullName);
    }

    public void checkPassword(String password) {
        PASSWORD.enforce(password);
    }

    private static boolean isSymbol(int ch) {
        return !Character.isLetterOrDigit(ch) && !Character.isWhitespace(ch) && !Character.isISOControl(ch);
    }
}
