package com.finpal.assistant.auth;

public class PhoneAlreadyRegisteredException extends RuntimeException {

    public PhoneAlreadyRegisteredException() {
        super("Phone already registered");
    }
}
