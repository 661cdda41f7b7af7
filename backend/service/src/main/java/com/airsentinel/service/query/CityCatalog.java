package com.airsentinel.service.query;

import com.airsentinel.service.error.UnknownCityException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The configured cities. Lookups ignore case and surrounding whitespace and return the
 * configured spelling.
 */
public final class CityCatalog {
    private final List<String> names;
    private final Map<String, String> byKey;

    public CityCatalog(List<String> names) {
        this.names = List.copyOf(names);
        Map<String, String> keys = new LinkedHashMap<>();
        for (String name : this.names) {
            keys.put(key(name), name);
        }
        this.byKey = Map.copyOf(keys);
    }

    public List<String> names() {
        return names;
    }

    public String resolve(String city) {
        String canonical = city == null ? null : byKey.get(key(city));
        if (canonical == null) {
            throw new UnknownCityException(city);
        }
        return canonical;
    }

    private static String key(String city) {
        return city.trim().toLowerCase(Locale.ROOT);
    }
}
