package com.herzen.assurance.error;

public class AcqlParseException extends AssuranceException {
    private final int position;
    private final String token;

    public AcqlParseException(int position, String token, String message) {
        super(message + " at position " + position);
        this.position = position;
        this.token = token;
    }

    public int position() {
        return position;
    }

    public String token() {
        return token;
    }

    @Override
    public String code() {
        return "PARSE_ERROR";
    }
}
