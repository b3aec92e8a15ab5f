package com.heroes.heroes_api.config;

/**
 * Helpers for printing JDBC URLs without leaking credentials.
 */
public final class DatabaseUrls {

    private DatabaseUrls() {}

    public static String mask(String url) {
        if (url == null) {
            return "not-set";
        }
        return url
                .replaceAll("(?i)(password=)[^;&]*", "$1****")
                .replaceAll("//([^:/@]+):[^@/]+@", "//$1:****@");
    }
}
