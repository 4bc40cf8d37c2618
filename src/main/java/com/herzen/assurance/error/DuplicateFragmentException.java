package com.herzen.assurance.error;

public class DuplicateFragmentException extends AssuranceException {
    public DuplicateFragmentException(String name) {
        super("Fragment already registered: " + name);
    }

    @Override
    public String code() {
        return "DUPLICATE_ID";
    }
}
