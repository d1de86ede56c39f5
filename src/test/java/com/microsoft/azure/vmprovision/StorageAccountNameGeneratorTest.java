package com.microsoft.azure.vmprovision;

import com.microsoft.azure.vmprovision.util.AzureUtil;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageAccountNameGeneratorTest {

    private final StorageAccountNameGenerator generator = new StorageAccountNameGenerator(
            Clock.fixed(Instant.parse("2024-03-07T09:05:42Z"), ZoneOffset.UTC));

    @Test
    void generateTruncatesStripsAndLowerCases() {
        // When
        String actual = generator.generate("Visual Studio Enterprise", "my-resource-group", "web-server-01", 0);

        // Then
        assertThat(actual, equalTo("visuamyresweb030709050"));
    }

    @Test
    void generateAppendsIteration() {
        String actual = generator.generate("sub", "rg", "vm", 9);

        assertThat(actual, equalTo("subrgvm030709059"));
    }

    @Test
    void generateGivenLongNamesThenStaysWithinStorageAccountLimits() {
        // Given
        String longName = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";

        for (int i = 0; i < 10; i++) {
            // When
            String actual = generator.generate(longName, longName, longName, i);

            // Then
            assertThat(actual.length(), lessThanOrEqualTo(5 + 6 + 4 + 8 + 2));
            assertTrue(actual.matches("^[a-z0-9]+$"), actual);
            assertTrue(AzureUtil.validateStorageAccountName(actual), actual);
        }
    }

    @Test
    void generateGivenMissingSubscriptionNameThenSkipsIt() {
        String actual = generator.generate(null, "rg", "vm", 1);

        assertThat(actual, equalTo("rgvm030709051"));
    }
}
