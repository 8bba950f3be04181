package org.carma.influence.simulation;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps feature tags onto a canonical vocabulary so that "same concept, different
 * spelling" counts as agreement.
 *
 * Tags are lower-cased and separators (spaces, hyphens, dots) collapse to underscores
 * before the synonym lookup. Tags outside the vocabulary after the lookup are dropped.
 */
public class TagCanonicalizer {

    /** Network-flow concepts recognised beyond the feature whitelist. */
    private static final Set<String> EXTRA_CONCEPTS = Set.of(
        "duration", "flags", "dns", "http", "tls", "ja3", "user_agent", "flow_count", "window");

    private final Set<String> vocabulary;
    private final Map<String, String> synonyms;

    public TagCanonicalizer(Collection<String> vocabulary, Map<String, String> synonyms) {
        this.vocabulary = Set.copyOf(vocabulary);
        Map<String, String> normalized = new HashMap<>();
        synonyms.forEach((from, to) -> normalized.put(normalize(from), normalize(to)));
        this.synonyms = Map.copyOf(normalized);
    }

    /**
     * Whitelist plus the common flow concepts, with the usual spellings of each.
     */
    public static TagCanonicalizer forWhitelist(Collection<String> whitelist) {
        Set<String> vocabulary = new LinkedHashSet<>();
        whitelist.forEach(tag -> vocabulary.add(normalize(tag)));
        vocabulary.addAll(EXTRA_CONCEPTS);

        Map<String, String> synonyms = new HashMap<>();
        synonyms.put("bytes", "flow_bytes");
        synonyms.put("byte_count", "flow_bytes");
        synonyms.put("total_bytes", "flow_bytes");
        synonyms.put("flow_size", "flow_bytes");
        synonyms.put("packet_count", "packets");
        synonyms.put("pkts", "packets");
        synonyms.put("num_packets", "packets");
        synonyms.put("packet_rate", "rate");
        synonyms.put("byte_rate", "rate");
        synonyms.put("flow_rate", "rate");
        synonyms.put("inter_arrival_time", "iat");
        synonyms.put("interarrival_time", "iat");
        synonyms.put("source_ip", "src_ip");
        synonyms.put("destination_ip", "dst_ip");
        synonyms.put("source_port", "src_port");
        synonyms.put("destination_port", "dst_port");
        synonyms.put("dest_ip", "dst_ip");
        synonyms.put("dest_port", "dst_port");
        synonyms.put("proto", "protocol");
        synonyms.put("payload_entropy", "entropy");
        synonyms.put("shannon_entropy", "entropy");
        synonyms.put("payload_length", "payload_len");
        synonyms.put("payload_size", "payload_len");
        synonyms.put("flow_duration", "duration");
        synonyms.put("tcp_flags", "flags");
        return new TagCanonicalizer(vocabulary, synonyms);
    }

    public Optional<String> canonicalize(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = normalize(tag);
        String mapped = synonyms.getOrDefault(normalized, normalized);
        return vocabulary.contains(mapped) ? Optional.of(mapped) : Optional.empty();
    }

    public Set<String> canonicalize(Collection<String> tags) {
        Set<String> result = new TreeSet<>();
        for (String tag : tags) {
            canonicalize(tag).ifPresent(result::add);
        }
        return result;
    }

    public Set<String> getVocabulary() {
        return vocabulary;
    }

    static String normalize(String tag) {
        return tag.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-.]+", "_");
    }
}
