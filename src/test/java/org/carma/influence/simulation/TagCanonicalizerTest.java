package org.carma.influence.simulation;

import org.carma.influence.config.HarnessConfig;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TagCanonicalizerTest {

    private final TagCanonicalizer canonicalizer = TagCanonicalizer.forWhitelist(HarnessConfig.DEFAULT_WHITELIST);

    @Test
    void whitelistTagsMapToThemselves() {
        assertThat(canonicalizer.canonicalize("entropy")).contains("entropy");
        assertThat(canonicalizer.canonicalize("SRC_IP")).contains("src_ip");
    }

    @Test
    void separatorsCollapseToUnderscores() {
        assertThat(canonicalizer.canonicalize("payload-len")).contains("payload_len");
        assertThat(canonicalizer.canonicalize("dst.port")).contains("dst_port");
        assertThat(canonicalizer.canonicalize(" flow  bytes ")).contains("flow_bytes");
    }

    @Test
    void synonymsMapOntoTheVocabulary() {
        assertThat(canonicalizer.canonicalize("Inter-Arrival Time")).contains("iat");
        assertThat(canonicalizer.canonicalize("pkts")).contains("packets");
        assertThat(canonicalizer.canonicalize("tcp flags")).contains("flags");
    }

    @Test
    void unknownTagsAreDropped() {
        assertThat(canonicalizer.canonicalize("favourite colour")).isEmpty();
        assertThat(canonicalizer.canonicalize((String) null)).isEmpty();
    }

    @Test
    void setsCollapseSynonyms() {
        assertThat(canonicalizer.canonicalize(List.of("bytes", "flow_bytes", "total bytes", "mystery")))
            .containsExactly("flow_bytes");
    }

    @Test
    void customVocabulary() {
        TagCanonicalizer custom = new TagCanonicalizer(List.of("alpha"), Map.of("A-Lpha", "alpha"));

        assertThat(custom.canonicalize("a lpha")).contains("alpha");
        assertThat(custom.getVocabulary()).containsExactly("alpha");
    }
}
