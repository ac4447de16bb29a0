package io.possync.remote;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.possync.model.Identity;
import io.possync.model.Role;
import io.possync.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

public record RegistrationRequest(
        String firstName,
        String lastName,
        String email,
        String password,
        String confirmPassword,
        String phone,
        Role role,
        String companyId,
        String storeId
) {
    public static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final int MIN_PASSWORD_LENGTH = 6;
    private static final int MIN_NAME_LENGTH = 2;

    public Map<String, String> validate() {
        Map<String, String> errors = new LinkedHashMap<>();
        if (firstName == null || firstName.trim().length() < MIN_NAME_LENGTH) {
            errors.put("firstName", "First name must be at least 2 characters");
        }
        if (lastName == null || lastName.trim().length() < MIN_NAME_LENGTH) {
            errors.put("lastName", "Last name must be at least 2 characters");
        }
        if (email == null || email.isBlank()) {
            errors.put("email", "Email is required");
        } else if (!EMAIL.matcher(email.trim()).matches()) {
            errors.put("email", "Please enter a valid email address");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            errors.put("password", "Password must be at least 6 characters");
        }
        if (confirmPassword == null || confirmPassword.isEmpty()) {
            errors.put("confirmPassword", "Please confirm your password");
        } else if (!confirmPassword.equals(password)) {
            errors.put("confirmPassword", "Passwords do not match");
        }
        return errors;
    }

    public void requireValid() {
        Map<String, String> errors = validate();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors.values()));
        }
    }

    public String fullName() {
        return (firstName == null ? "" : firstName.trim()) + " " + (lastName == null ? "" : lastName.trim());
    }

    ObjectNode toWire() {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("name", fullName().trim());
        body.put("first_name", firstName == null ? "" : firstName.trim());
        body.put("last_name", lastName == null ? "" : lastName.trim());
        body.put("email", Identity.normalizeEmail(email));
        body.put("password", password);
        body.put("role", (role == null ? Role.CASHIER : role).wireName());
        if (phone != null && !phone.isBlank()) {
            body.put("phone", phone.trim());
        }
        if (companyId != null && !companyId.isBlank()) {
            body.put("company_id", companyId);
        }
        if (storeId != null && !storeId.isBlank()) {
            body.put("store_id", storeId);
        }
        return body;
    }
}
