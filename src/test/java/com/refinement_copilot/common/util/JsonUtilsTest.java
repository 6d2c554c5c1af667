package com.refinement_copilot.common.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

public class JsonUtilsTest {

    @Test
    public void shouldPreferJsonCodeBlock() {
        Optional<String> json = JsonUtils.extractJsonObject("Result:\n```json\n{\"a\": 1}\n```\nand {\"b\": 2}");

        Assertions.assertEquals("{\"a\": 1}", json.orElseThrow());
    }

    @Test
    public void shouldReadGenericCodeBlock() {
        Optional<String> json = JsonUtils.extractJsonObject("```\n{\"a\": {\"b\": 2}}\n```");

        Assertions.assertEquals("{\"a\": {\"b\": 2}}", json.orElseThrow());
    }

    @Test
    public void shouldFindBalancedObjectInProse() {
        Optional<String> json = JsonUtils.extractJsonObject("Sure! {\"text\": \"curly } inside\", \"n\": {\"m\": 1}} Hope that helps.");

        Assertions.assertEquals("{\"text\": \"curly } inside\", \"n\": {\"m\": 1}}", json.orElseThrow());
    }

    @Test
    public void shouldReturnEmptyWithoutValidObject() {
        Assertions.assertTrue(JsonUtils.extractJsonObject(null).isEmpty());
        Assertions.assertTrue(JsonUtils.extractJsonObject("   ").isEmpty());
        Assertions.assertTrue(JsonUtils.extractJsonObject("no json here").isEmpty());
        Assertions.assertTrue(JsonUtils.extractJsonObject("{\"unterminated\": ").isEmpty());
        Assertions.assertTrue(JsonUtils.extractJsonObject("[1, 2, 3]").isEmpty());
    }
}
