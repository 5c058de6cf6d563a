package com.aschik.accountservice.exception;

public final class ProblemTypes {

    public static final String BASE = "https://aschik.dev/problems/";

    private ProblemTypes() {}

    public static String uri(String slug) {
        return BASE + slug;
    }
}
