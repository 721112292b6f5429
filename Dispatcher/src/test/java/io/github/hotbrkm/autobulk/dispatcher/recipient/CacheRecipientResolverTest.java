package io.github.hotbrkm.autobulk.dispatcher.recipient;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.RecipientSpec;
import io.github.hotbrkm.autobulk.dispatcher.job.TestJobs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheRecipientResolver test")
class CacheRecipientResolverTest {

    private static final Instant RUN_AT = Instant.parse("2024-01-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private CacheRecipientResolver resolver(Path cacheFile) {
        return new CacheRecipientResolver(new RecipientCache(cacheFile, new ObjectMapper()));
    }

    private static Job jobFor(RecipientSpec spec) {
        return TestJobs.delayedJob(RUN_AT).recipientSpec(spec).build();
    }

    private Path writeCache(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    @DisplayName("Static list becomes recipients with trimmed addresses and no attributes")
    void staticList_resolvesAddresses() {
        Job job = jobFor(new RecipientSpec.StaticList(List.of(" alice@example.com ", "bob@example.org")));

        List<Recipient> recipients = resolver(tempDir.resolve("unused.csv")).resolve(job);

        assertThat(recipients).extracting(Recipient::email).containsExactly("alice@example.com", "bob@example.org");
        assertThat(recipients).allSatisfy(recipient -> assertThat(recipient.attributes()).isEmpty());
    }

    @Test
    @DisplayName("Empty static list is a resolution failure")
    void emptyStaticList_fails() {
        Job job = jobFor(new RecipientSpec.StaticList(List.of()));

        assertThatThrownBy(() -> resolver(tempDir.resolve("unused.csv")).resolve(job))
                .isInstanceOf(ResolutionException.class);
    }

    @Test
    @DisplayName("CSV cache is filtered on every criterion and rows without email are skipped")
    void csvCache_filtersOnAllCriteria() throws IOException {
        Path cache = writeCache("recipients.csv", """
                email,department,region
                kim@example.com,sales,apac
                lee@example.com,sales,emea
                ,sales,apac
                park@example.com,marketing,apac
                """);
        Job job = jobFor(new RecipientSpec.CacheFilter(Map.of("department", "sales", "region", "apac")));

        List<Recipient> recipients = resolver(cache).resolve(job);

        assertThat(recipients).singleElement().satisfies(recipient -> {
            assertThat(recipient.email()).isEqualTo("kim@example.com");
            assertThat(recipient.attributes()).containsEntry("department", "sales").containsEntry("region", "apac");
        });
    }

    @Test
    @DisplayName("JSON cache values are compared as strings")
    void jsonCache_comparesStringValues() throws IOException {
        Path cache = writeCache("recipients.json", """
                [
                  {"email": "a@example.com", "tier": 1, "active": true},
                  {"email": "b@example.com", "tier": 2, "active": true},
                  {"tier": 1}
                ]
                """);
        Job job = jobFor(new RecipientSpec.CacheFilter(Map.of("tier", "1", "active", "true")));

        assertThat(resolver(cache).resolve(job)).extracting(Recipient::email).containsExactly("a@example.com");
    }

    @Test
    @DisplayName("No matching record is a resolution failure")
    void noMatch_fails() throws IOException {
        Path cache = writeCache("recipients.csv", "email,department\nkim@example.com,sales\n");
        Job job = jobFor(RecipientSpec.CacheFilter.of("department", "legal"));

        assertThatThrownBy(() -> resolver(cache).resolve(job))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("department=legal");
    }

    @Test
    @DisplayName("Cache file is re-read on every resolution")
    void cache_isReadOnEveryCall() throws IOException {
        Path cache = writeCache("recipients.csv", "email,department\nkim@example.com,sales\n");
        CacheRecipientResolver resolver = resolver(cache);
        Job job = jobFor(RecipientSpec.CacheFilter.of("department", "sales"));

        assertThat(resolver.resolve(job)).hasSize(1);

        Files.writeString(cache, "email,department\nkim@example.com,sales\nlee@example.com,sales\n", StandardCharsets.UTF_8);

        assertThat(resolver.resolve(job)).extracting(Recipient::email).containsExactly("kim@example.com", "lee@example.com");
    }

    @Test
    @DisplayName("Missing cache file falls back to the sample recipients")
    void missingCache_usesSamples() {
        Job job = jobFor(RecipientSpec.CacheFilter.of("department", "sales"));

        List<Recipient> recipients = resolver(tempDir.resolve("absent.csv")).resolve(job);

        assertThat(recipients).extracting(Recipient::email).containsExactly("demo+sales@example.com");
    }

    @Test
    @DisplayName("Unsupported or malformed cache files are resolution failures")
    void unreadableCache_fails() throws IOException {
        Job job = jobFor(RecipientSpec.CacheFilter.of("department", "sales"));
        Path xml = writeCache("recipients.xml", "<recipients/>");
        Path json = writeCache("broken.json", "{\"email\": \"not-a-list@example.com\"}");

        assertThatThrownBy(() -> resolver(xml).resolve(job))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("Unsupported");
        assertThatThrownBy(() -> resolver(json).resolve(job)).isInstanceOf(ResolutionException.class);
    }
}
