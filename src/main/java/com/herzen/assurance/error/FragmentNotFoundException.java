package com.herzen.assurance.error;

public class FragmentNotFoundException extends AssuranceException {
    public FragmentNotFoundException(String name) {
        super("Fragment not found: " + name);
    }

    @Override
    public String code() {
        return "NOT_FOUND";
    }
}
