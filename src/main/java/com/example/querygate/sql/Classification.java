package com.example.querygate.sql;

public record Classification(Verdict verdict, String message) {

    public enum Verdict {
        ACCEPTED,
        EMPTY_QUERY,
        NOT_READ_ONLY
    }

    public static Classification accepted() {
        return new Classification(Verdict.ACCEPTED, null);
    }

    public static Classification rejected(Verdict verdict, String message) {
        return new Classification(verdict, message);
    }

    public boolean isAccepted() {
        return verdict == Verdict.ACCEPTED;
    }
}
