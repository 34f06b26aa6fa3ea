package com.flowuml.action;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class TemplateResolverTest {

    private static final Map<String, String> VARS = Map.of("userId", "42", "user.name", "Ann", "price", "$5");

    @Test
    void markersAreReplacedFromVariables() {
        assertEquals("42", TemplateResolver.resolve("{{userId}}", VARS::get));
        assertEquals("id=42 name=Ann", TemplateResolver.resolve("id={{ userId }} name={{user.name}}", VARS::get));
        assertEquals("cost $5", TemplateResolver.resolve("cost {{price}}", VARS::get));
    }

    @Test
    void missingVariablesBecomeEmpty() {
        assertEquals("hi !", TemplateResolver.resolve("hi {{nobody}}!", VARS::get));
        assertEquals("x", TemplateResolver.resolve("x{{a}}", null));
    }

    @Test
    void textWithoutValidMarkersIsUnchanged() {
        assertEquals("{{not valid!}} {single}", TemplateResolver.resolve("{{not valid!}} {single}", VARS::get));
        assertEquals("", TemplateResolver.resolve("", VARS::get));
        assertNull(TemplateResolver.resolve(null, VARS::get));
    }

    @Test
    void resolveAllKeepsKeyOrder() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("b", "{{userId}}");
        params.put("a", "plain");
        Map<String, String> resolved = TemplateResolver.resolveAll(params, VARS::get);
        assertEquals(List.of("b", "a"), List.copyOf(resolved.keySet()));
        assertEquals("42", resolved.get("b"));
    }
}
