package io.github.hotbrkm.autobulk.dispatcher.recipient;

import io.github.hotbrkm.autobulk.dispatcher.job.Job;
import io.github.hotbrkm.autobulk.dispatcher.job.RecipientSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves static lists from the job itself and filters from the {@link RecipientCache}.
 */
@Slf4j
public class CacheRecipientResolver implements RecipientResolver {

    static final String EMAIL_FIELD = "email";

    private final RecipientCache recipientCache;

    public CacheRecipientResolver(RecipientCache recipientCache) {
        this.recipientCache = Objects.requireNonNull(recipientCache, "recipientCache must not be null");
    }

    @Override
    public List<Recipient> resolve(Job job) {
        RecipientSpec spec = job.getRecipientSpec();
        if (spec instanceof RecipientSpec.StaticList staticList) {
            return resolveStatic(job, staticList);
        }
        if (spec instanceof RecipientSpec.CacheFilter filter) {
            return resolveFilter(job, filter);
        }
        throw new ResolutionException("Job " + job.getId() + " has no recipient specification");
    }

    private List<Recipient> resolveStatic(Job job, RecipientSpec.StaticList staticList) {
        List<Recipient> recipients = staticList.addresses().stream()
                .filter(address -> !address.isBlank())
                .map(Recipient::of)
                .toList();
        if (recipients.isEmpty()) {
            throw new ResolutionException("Static list job " + job.getId() + " does not define any recipients");
        }
        return recipients;
    }

    private List<Recipient> resolveFilter(Job job, RecipientSpec.CacheFilter filter) {
        List<Map<String, String>> records = recipientCache.load();
        Map<String, String> criteria = filter.criteria();
        if (criteria.isEmpty()) {
            log.warn("Recipient filter of job {} is empty; selecting every cached recipient", job.getId());
        }

        List<Recipient> matched = new ArrayList<>();
        for (Map<String, String> record : records) {
            String email = record.get(EMAIL_FIELD);
            if (email == null || email.isBlank()) {
                continue;
            }
            if (matches(record, criteria)) {
                matched.add(new Recipient(email, record));
            }
        }
        if (matched.isEmpty()) {
            throw new ResolutionException("No cached recipients matched the filter " + criteria + " of job " + job.getId());
        }
        log.debug("Job {} resolved {} of {} cached recipients", job.getId(), matched.size(), records.size());
        return matched;
    }

    private static boolean matches(Map<String, String> record, Map<String, String> criteria) {
        for (Map.Entry<String, String> criterion : criteria.entrySet()) {
            if (!Objects.equals(record.get(criterion.getKey()), criterion.getValue())) {
                return false;
            }
        }
        return true;
    }
}
