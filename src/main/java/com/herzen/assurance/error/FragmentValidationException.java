package com.herzen.assurance.error;

public class FragmentValidationException extends AssuranceException {
    private final String fragmentName;

    public FragmentValidationException(String fragmentName, String message) {
        super(message);
        this.fragmentName = fragmentName;
    }

    public String fragmentName() {
        return fragmentName;
    }

    @Override
    public String code() {
        return "VALIDATION_FAILED";
    }
}
