package com.finpal.assistant.user;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Entry of the user directory. Besides name and password, any profile field submitted at
 * registration (email, age, occupation, ...) is kept and written back as-is.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UserAccount {

    private String phone;
    private String name;
    private String password;
    private final Map<String, Object> profile = new LinkedHashMap<>();

    public UserAccount() {
    }

    public UserAccount(String phone, String name, String password) {
        this.phone = phone;
        this.name = name;
        this.password = password;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    @JsonAnyGetter
    public Map<String, Object> getProfile() {
        return profile;
    }

    @JsonAnySetter
    public void putProfileField(String key, Object value) {
        profile.put(key, value);
    }

    public boolean passwordMatches(String candidate) {
        return password != null && password.equals(candidate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserAccount that)) return false;
        return Objects.equals(phone, that.phone)
                && Objects.equals(name, that.name)
                && Objects.equals(password, that.password)
                && profile.equals(that.profile);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phone, name, password, profile);
    }
}
